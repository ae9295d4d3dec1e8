package dumb.calculi.tableau;

import dumb.calculi.AbstractTest;
import dumb.calculi.Substitution;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StandardTests extends AbstractTest {

    private static final Standard TS = Standard.pair(Standard.of("1", "i"), Standard.of("1"));

    private static boolean matches(Standard candidate, Standard pattern) {
        return Standard.match(candidate, pattern, Substitution.EMPTY) != null;
    }

    @Test
    void variablesBindWholeStandards() {
        assertTrue(matches(TS, std("(var X)")));
        var s = Standard.match(TS, std("(pair (var X) (var Y))"), Substitution.EMPTY);
        assertNotNull(s);
        assertEquals(Standard.of("1", "i"), s.standard("X"));
        assertEquals(Standard.of("1"), s.standard("Y"));
    }

    @Test
    void repeatedVariablesMustAgree() {
        assertNull(Standard.match(TS, std("(pair (var X) (var X))"), Substitution.EMPTY));
        assertTrue(matches(Standard.pair(TS, TS), std("(pair (var X) (var X))")));
    }

    @Test
    void barsMustAgree() {
        var x = std("(var X)");
        assertNull(Standard.match(x.barred(), x, Substitution.EMPTY));
        assertNull(Standard.match(x, x.barred(), Substitution.EMPTY));
        assertTrue(matches(TS.barred(), std("(bar (var X))")));
    }

    @Test
    void barredVariableBindsUnbarredValue() {
        var s = Standard.match(Standard.of("0").barred(), std("(bar (var X))"), Substitution.EMPTY);
        assertNotNull(s);
        assertEquals(Standard.of("0"), s.standard("X"));
        assertEquals(Standard.of("0").barred(), std("(bar (var X))").instantiate(s));
    }

    @Test
    void valuesCompareAsSets() {
        assertTrue(matches(std("(values i 1)"), std("(values 1 i)")));
        assertNull(Standard.match(std("(values 1)"), std("(values 1 i)"), Substitution.EMPTY));
    }

    @Test
    void levels() {
        assertEquals(0, Standard.of("1").level());
        assertEquals(1, TS.level());
        assertEquals(2, Standard.pair(TS, TS).level());
        assertEquals(-1, Standard.var("X").level());
    }

    @Test
    void valueSetOperations() {
        var t = (Standard.Values) std("(values 1 i)");
        var n = (Standard.Values) std("(values i 0)");
        assertEquals(Standard.of("i"), t.intersection(n));
        assertEquals(Standard.of("0"), t.complement(Metainferential.VALUES));
        assertTrue(Standard.of("1").subsetOf(t));
        assertTrue(Standard.of("1").isSingleton());
        assertTrue(Standard.of().isEmpty());
    }

    @Test
    void unboundVariableCannotBeInstantiated() {
        assertThrows(IllegalArgumentException.class, () -> Standard.var("X").instantiate(Substitution.EMPTY));
    }
}
