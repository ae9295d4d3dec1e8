package dumb.calculi;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormulaTests extends AbstractTest {

    @Test
    void structuralEquality() {
        assertEquals(f("(and p (not q))"), Formula.of("and", Formula.atom("p"), Formula.of("not", Formula.atom("q"))));
        assertEquals(f("(and p (not q))").hashCode(), f("(and p (not q))").hashCode());
        assertNotEquals(f("(and p q)"), f("(and q p)"));
        assertNotEquals(f("?A"), f("A"));
    }

    @Test
    void schematic() {
        assertTrue(f("(or p (not ?B))").isSchematic());
        assertFalse(f("(or p (not q))").isSchematic());
        assertEquals(0, f("(=> p q)").level());
    }

    @Test
    void json() {
        var j = f("(not ?A)").toJson();
        assertEquals("compound", j.getString("type"));
        assertEquals("not", j.getString("connective"));
        var arg = j.getJSONArray("args").getJSONObject(0);
        assertEquals("var", arg.getString("type"));
        assertEquals("?A", arg.getString("name"));
        assertEquals("p", f("p").toJson().getString("symbol"));
    }

    @Test
    void invalidNames() {
        assertThrows(IllegalArgumentException.class, () -> Formula.atom("?A"));
        assertThrows(IllegalArgumentException.class, () -> Formula.var("A"));
        assertThrows(IllegalArgumentException.class, () -> Formula.var("?"));
        assertThrows(IllegalArgumentException.class, () -> new Formula.Compound("and", List.of()));
    }
}
