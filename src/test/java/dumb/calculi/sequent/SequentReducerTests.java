package dumb.calculi.sequent;

import dumb.calculi.AbstractTest;
import dumb.calculi.Configuration;
import dumb.calculi.Sequent;
import dumb.calculi.SolverException;
import dumb.calculi.tree.ProofTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequentReducerTests extends AbstractTest {

    private final SequentCalculus lkMinEA = Sequents.lkMinEA();

    private static void assertLeavesAre(SequentCalculus calculus, ProofTree<Sequent> tree, List<Sequent> premises) {
        for (var leaf : tree.leaves(tree.root())) {
            var s = tree.payload(leaf);
            assertTrue(premises.contains(s) || calculus.isAxiom(s), () -> "open leaf " + s.toKif());
        }
    }

    @Test
    void excludedMiddle() throws SolverException {
        var target = seq("(sequent (@Gamma) (@Delta (or ?A (not ?A))))");
        var tree = lkMinEA.reduce(target);
        assertEquals(target, tree.payload(tree.root()));
        assertEquals("∨R1", tree.justification(tree.root()));
        assertLeavesAre(lkMinEA, tree, List.of());
        assertTrue(lkMinEA.treeIsClosed(tree, tree.root()));
        assertTrue(lkMinEA.isCorrectTree(tree), () -> lkMinEA.errors(tree, List.of(), false) + "\n" + SequentCalculus.render(tree));
    }

    @Test
    void contradictionHasNoReduction() {
        var e = assertThrows(SolverException.class,
                () -> lkMinEA.reduce(seq("(sequent (@Gamma) (@Delta (and ?A (not ?A))))")));
        assertEquals("Could not find reduction for (sequent (@Gamma) (@Delta (and ?A (not ?A))))", e.getMessage());
    }

    @Test
    void premisesCloseBranches() throws SolverException {
        var premise = seq("(sequent (?A) (?B))");
        var target = seq("(sequent (?A (not ?B)) ())");
        var tree = lkMinEA.reduce(target, List.of(premise));
        assertEquals("~L", tree.justification(tree.root()));
        var leaf = tree.children(tree.root()).get(0);
        assertEquals(premise, tree.payload(leaf));
        assertEquals(SequentCalculus.PREMISE, tree.justification(leaf));
        assertTrue(lkMinEA.isCorrectTree(tree, List.of(premise)));
        assertFalse(lkMinEA.isCorrectTree(tree), "without the premise the leaf is no axiom");
    }

    @Test
    void smartWeakeningFromPremise() throws SolverException {
        var premise = seq("(sequent (p) (q))");
        var tree = lkMinEA.reduce(seq("(sequent (p r) (q))"), List.of(premise));
        assertEquals(2, tree.size());
        assertEquals("WL", tree.justification(tree.root()));
        assertEquals(premise, tree.payload(tree.leaves(tree.root()).get(0)));
        assertTrue(lkMinEA.isCorrectTree(tree, List.of(premise)));
    }

    @Test
    void smartWeakeningFromIdentity() throws SolverException {
        var target = seq("(sequent (r p s) (q p))");
        var tree = lkMinEA.reduce(target);
        assertEquals(target, tree.payload(tree.root()));
        var leaves = tree.leaves(tree.root());
        assertEquals(List.of(seq("(sequent (p) (p))")), leaves.stream().map(tree::payload).toList());
        assertEquals(SequentCalculus.IDENTITY, tree.justification(leaves.get(0)));
        assertEquals(4, tree.size());
        assertTrue(lkMinEA.isCorrectTree(tree));
    }

    @Test
    void validity() {
        assertTrue(lkMinEA.isValid(inf("(inference ((or p q) (not p)) (q))")));
        assertTrue(lkMinEA.isValid(inf("(inference ((and p q)) ((or q r)))")));
        assertFalse(lkMinEA.isValid(inf("(inference ((or p q)) (p))")));
    }

    @Test
    void lkMinWithoutSmartWeakening() throws SolverException {
        var lkMin = Sequents.lkMin();
        var target = seq("(sequent ((not (not p))) (p))");
        var tree = lkMin.reduce(target);
        assertEquals(List.of("~L", "~R", SequentCalculus.IDENTITY),
                tree.preOrder(tree.root()).stream().map(tree::justification).toList());
        assertTrue(lkMin.isCorrectTree(tree));
    }

    @Test
    void depthBound() throws SolverException {
        var identity = seq("(sequent (p) (p))");
        var none = Sequents.lkMinEA(Configuration.defaults().withSequentMaxDepth(0));
        assertThrows(SolverException.class, () -> none.reduce(identity));

        var one = Sequents.lkMinEA(Configuration.defaults().withSequentMaxDepth(1));
        var tree = one.reduce(identity);
        assertEquals(1, tree.size());
        assertEquals(SequentCalculus.IDENTITY, tree.justification(tree.root()));
        assertThrows(SolverException.class, () -> one.reduce(seq("(sequent ((not (not p))) (p))")));
    }

    @Test
    void weakeningStepsCountAgainstTheDepthBound() throws SolverException {
        var premise = seq("(sequent (p) (q))");
        var target = seq("(sequent (p r) (q))");
        var config = Configuration.defaults().withSmartWeakening(true);

        var shallow = Sequents.lkMinEA(config.withSequentMaxDepth(1));
        assertThrows(SolverException.class, () -> shallow.reduce(target, List.of(premise)));

        var enough = Sequents.lkMinEA(config.withSequentMaxDepth(2));
        var tree = enough.reduce(target, List.of(premise));
        assertEquals(2, tree.size());
        for (var leaf : tree.leaves(tree.root())) assertTrue(tree.depth(leaf) < 2);
    }

    @Test
    void searchesAreIndependent() throws SolverException {
        var target = seq("(sequent ((and p q)) (q))");
        assertThrows(SolverException.class, () -> lkMinEA.reduce(seq("(sequent ((and p q)) (r))")));
        assertEquals(lkMinEA.reduce(target).key(0), lkMinEA.reduce(target).key(0));
    }
}
