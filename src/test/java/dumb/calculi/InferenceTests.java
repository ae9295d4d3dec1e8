package dumb.calculi;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InferenceTests extends AbstractTest {

    @Test
    void levelFollowsMembers() {
        assertEquals(0, f("p").level());
        assertEquals(1, inf("(inference (p) (q))").level());
        assertEquals(2, inf("(inference ((inference (p) (q))) ((inference () (q))))").level());
        assertEquals(2, inf("(inference () ((inference (p) (p))))").level());
    }

    @Test
    void emptyInferenceTakesDeclaredLevel() {
        assertEquals(1, inf("(inference () ())").level());
        var empty2 = inf("(inference () () 2)");
        assertEquals(2, empty2.level());
        assertNotEquals(inf("(inference () ())"), empty2);
        assertEquals("(inference () () 2)", empty2.toKif());
    }

    @Test
    void declaredLevelMustAgree() {
        assertThrows(Inference.IncorrectLevelsException.class,
                () -> new Inference(List.of(f("p")), List.of(f("q")), 2));
        assertEquals(1, new Inference(List.of(f("p")), List.of(f("q")), 1).level());
    }

    @Test
    void schematicWhenAnyMemberIs() {
        assertTrue(inf("(inference (p (not ?A)) (q))").isSchematic());
        assertTrue(inf("(inference ((inference (?A) ())) ())").isSchematic());
        assertFalse(inf("(inference (p) (q))").isSchematic());
    }

    @Test
    void kifRoundTrip() {
        var text = "(inference ((or p q) (not p)) (q))";
        assertEquals(text, inf(text).toKif());
        assertEquals(inf(text), inf(inf(text).toKif()));
    }
}
