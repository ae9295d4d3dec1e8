package dumb.calculi.kif;

import dumb.calculi.AbstractTest;
import dumb.calculi.Formula;
import dumb.calculi.Inference;
import dumb.calculi.Sequent;
import dumb.calculi.kif.KifParser.ParseException;
import dumb.calculi.tableau.Standard;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotationTests extends AbstractTest {

    @Test
    void formulas() {
        assertEquals(Formula.atom("p"), f("p"));
        assertEquals(Formula.var("?A"), f("?A"));
        assertEquals(Formula.of("=>", Formula.atom("p"), Formula.of("not", Formula.var("?B"))), f("(=> p (not ?B))"));
    }

    @Test
    void claimsDispatchOnInference() {
        assertInstanceOf(Inference.class, claim("(inference (p) (q))"));
        assertInstanceOf(Formula.class, claim("(and p q)"));
    }

    @Test
    void sequentsMixContextsAndFormulas() {
        var s = seq("(sequent (@Gamma ?A) ((not ?A) @Delta) ())");
        assertEquals(3, s.size());
        assertEquals(new Sequent.Context("@Gamma"), s.side(0).get(0));
        assertEquals(f("(not ?A)"), s.side(1).get(0));
        assertEquals(List.of(), s.side(2));
        assertEquals("(sequent (@Gamma ?A) ((not ?A) @Delta) ())", s.toKif());
    }

    @Test
    void standards() {
        assertEquals(Standard.of("i", "1"), std("(values 1 i)"));
        assertEquals(Standard.pair(Standard.of("1"), Standard.var("X")), std("(pair (values 1) (var X))"));
        var barred = std("(bar (values 0))");
        assertTrue(barred.bar());
        assertEquals("(bar (values 0))", barred.toKif());
        assertEquals(Standard.of(), std("(values)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "@Gamma",
            "()",
            "(inference (p))",
            "(inference (p) (q) x)",
            "(not)",
            "((not p) q)",
            "(and (sequent (p) (q)) r)",
    })
    void rejectedFormulasAndInferences(String kif) {
        assertThrows(ParseException.class, () -> Notation.claim(kif));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "(bar (bar (values 1)))",
            "(pair (values 1))",
            "(values (1))",
            "(var)",
            "(designated 1)",
            "x",
    })
    void rejectedStandards(String kif) {
        assertThrows(ParseException.class, () -> Notation.standard(kif));
    }

    @Test
    void contradictoryLevelBecomesParseError() {
        var e = assertThrows(ParseException.class, () -> Notation.inference("(inference (p) (q) 3)"));
        assertTrue(e.getMessage().contains("level"), e.getMessage());
        assertThrows(ParseException.class, () -> Notation.sequent("(sequent (p))"));
    }
}
