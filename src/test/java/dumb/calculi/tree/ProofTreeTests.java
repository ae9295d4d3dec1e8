package dumb.calculi.tree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dumb.calculi.tree.ProofTree.NONE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProofTreeTests {

    //      a
    //    b   c
    //   d e    f
    private ProofTree<String> t;
    private int a, b, c, d, e, f;

    @BeforeEach
    void build() {
        t = new ProofTree<>();
        a = t.add(NONE, "a", null);
        b = t.add(a, "b", "R1");
        c = t.add(a, "c", "R1");
        d = t.add(b, "d", "R2");
        e = t.add(b, "e", "R2");
        f = t.add(c, "f", "R3");
    }

    @Test
    void traversals() {
        assertEquals(List.of(a, b, d, e, c, f), t.preOrder(a));
        assertEquals(List.of(d, e, b, f, c, a), t.postOrder(a));
        assertEquals(List.of(a, b, c, d, e, f), t.levelOrder(a));
        assertEquals(List.of(d, e, f), t.leaves(a));
        assertEquals(List.of(d, e), t.leaves(b));
        assertEquals(List.of(f), t.leaves(f));
    }

    @Test
    void locatorsAndPaths() {
        assertEquals(List.of(0), t.locator(a));
        assertEquals(List.of(0, 1, 0), t.locator(f));
        assertEquals(List.of(0, 0, 1), t.locator(e));
        assertEquals(List.of(a, b, e), t.path(e));
        assertEquals(List.of(b, e), t.pathFrom(b, e));
        assertEquals(2, t.depth(d));
        assertTrue(t.isAncestorOrSelf(b, d));
        assertFalse(t.isAncestorOrSelf(c, d));
    }

    @Test
    void secondRootRejected() {
        assertThrows(IllegalStateException.class, () -> t.add(NONE, "x", null));
        assertThrows(IllegalStateException.class, () -> new ProofTree<String>().root());
    }

    @Test
    void truncateForgetsLaterNodes() {
        var mark = t.size();
        var g = t.add(d, "g", "R4");
        t.add(g, "h", "R5");
        t.truncate(mark);
        assertEquals(6, t.size());
        assertTrue(t.isLeaf(d));
        assertEquals(List.of(d, e, f), t.leaves(a));
        assertThrows(IllegalArgumentException.class, () -> t.truncate(10));
    }

    @Test
    void graftCopiesSubtrees() {
        var other = new ProofTree<String>("x", null);
        var copy = other.graft(other.root(), t, b, String::toUpperCase);
        assertEquals("B", other.payload(copy));
        assertEquals("R1", other.justification(copy));
        assertEquals(4, other.size());
        assertEquals(List.of(0, 0, 1), other.locator(other.children(copy).get(1)));
        assertEquals(6, t.size());
    }

    @Test
    void subtreeKeepsShape() {
        var sub = t.subtree(b, s -> s);
        assertEquals(3, sub.size());
        assertEquals(t.key(b), sub.key(sub.root()));
        assertFalse(t.key(b).equals(t.key(c)));
        assertEquals("R1", sub.justification(sub.root()));
    }

    @Test
    void json() {
        var j = t.toJson(a, s -> s);
        assertEquals("a", j.get("content").asText());
        assertFalse(j.has("justification"));
        assertEquals("R1", j.get("children").get(0).get("justification").asText());
        assertFalse(j.get("children").get(0).get("children").get(0).has("children"));
    }

    @Test
    void render() {
        assertEquals("a\n  b [R1]\n    d [R2]\n    e [R2]\n  c [R1]\n    f [R3]\n", t.render(a, s -> s));
    }
}
