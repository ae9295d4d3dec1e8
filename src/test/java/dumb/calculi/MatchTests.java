package dumb.calculi;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchTests extends AbstractTest {

    @Test
    void formulaBindsMetavariables() {
        var s = Match.formula(f("(and p (not q))"), f("(and ?A ?B)"), Substitution.EMPTY);
        assertNotNull(s);
        assertEquals(f("p"), s.get(Formula.var("?A")));
        assertEquals(f("(not q)"), s.get(Formula.var("?B")));
    }

    @Test
    void repeatedMetavariableMustAgree() {
        assertTrue(Match.isInstance(f("(or p p)"), f("(or ?A ?A)")));
        assertFalse(Match.isInstance(f("(or p q)"), f("(or ?A ?A)")));
        assertFalse(Match.isInstance(f("(or p q)"), f("(and ?A ?B)")));
        assertFalse(Match.isInstance(f("p"), f("(not ?A)")));
        assertTrue(Match.isInstance(f("(not (not p))"), f("?A")));
    }

    @Test
    void earlierBindingsConstrainTheMatch() {
        var s = Substitution.EMPTY.bind(Formula.var("?A"), f("q"));
        assertNull(Match.formula(f("(not p)"), f("(not ?A)"), s));
        assertNotNull(Match.formula(f("(not q)"), f("(not ?A)"), s));
    }

    @Test
    void inferencePremisesMatchInAnyOrder() {
        var candidate = inf("(inference (p (=> p q)) (q))");
        var pattern = inf("(inference ((=> ?A ?B) ?A) (?B))");
        var s = Match.inference(candidate, pattern, Substitution.EMPTY);
        assertNotNull(s);
        assertEquals(f("p"), s.get(Formula.var("?A")));
        assertEquals(f("q"), s.get(Formula.var("?B")));

        assertNull(Match.inference(candidate, pattern, Substitution.EMPTY, true));
        assertNotNull(Match.inference(candidate, inf("(inference (?A (=> ?A ?B)) (?B))"), Substitution.EMPTY, true));
    }

    @Test
    void inferenceCountsAndLevelsMustAgree() {
        var simple = inf("(inference (p) (q))");
        assertNull(Match.inference(simple, inf("(inference (?A ?B) (?C))"), Substitution.EMPTY));
        assertNull(Match.inference(simple, inf("(inference (?A) ())"), Substitution.EMPTY));

        var meta = inf("(inference ((inference (p) (q))) ((inference (p) (p))))");
        assertEquals(2, meta.level());
        assertNull(Match.claim(meta, simple, Substitution.EMPTY, false));
        assertNotNull(Match.claim(meta, inf("(inference ((inference (?A) (?B))) ((inference (?A) (?A))))"),
                Substitution.EMPTY, false));
        assertNull(Match.claim(f("p"), simple, Substitution.EMPTY, false));
    }

    @Test
    void instantiateUndoesMatch() {
        var candidate = inf("(inference ((or p q) (not p)) (q))");
        var pattern = inf("(inference ((or ?A ?B) (not ?A)) (?B))");
        var s = Match.inference(candidate, pattern, Substitution.EMPTY);
        assertNotNull(s);
        assertEquals(candidate, Match.instantiate(pattern, s));

        var sequent = seq("(sequent (p q) (r))");
        var rule = seq("(sequent (@Gamma ?A) (@Delta))");
        for (var each : Match.sequent(sequent, rule))
            assertEquals(sequent, Match.instantiate(rule, each));
    }

    @Test
    void instantiateNeedsEveryHoleBound() {
        assertThrows(IllegalArgumentException.class, () -> Match.instantiate(f("(and ?A ?B)"),
                Substitution.EMPTY.bind(Formula.var("?A"), f("p"))));
        assertThrows(IllegalArgumentException.class, () -> Match.instantiate(seq("(sequent (@Gamma) ())"), Substitution.EMPTY));
    }

    @Test
    void sequentSplitsBetweenTwoContexts() {
        var candidate = seq("(sequent (p q r) ())");
        var pattern = seq("(sequent (@Gamma @Delta) ())");
        var all = Match.sequent(candidate, pattern);
        assertEquals(4, all.size());

        var gamma = new Sequent.Context("@Gamma");
        var delta = new Sequent.Context("@Delta");
        for (var s : all) {
            var joined = new ArrayList<Sequent.Item>(s.get(gamma));
            joined.addAll(s.get(delta));
            assertEquals(candidate.side(0), joined);
        }
        assertEquals(List.of(), all.get(0).get(delta));
        assertEquals(List.of(), all.get(all.size() - 1).get(gamma));
    }

    @Test
    void sequentSidesMustMatchInNumber() {
        assertTrue(Match.sequent(seq("(sequent (p) (p))"), seq("(sequent (?A) (?A) (?A))")).isEmpty());
        assertTrue(Match.isInstance(seq("(sequent (p) (p) (p))"), seq("(sequent (?A) (?A) (?A))")));
    }

    @Test
    void bindingsCarryAcrossSides() {
        assertTrue(Match.isInstance(seq("(sequent (p q) (r p q))"), seq("(sequent (@Gamma) (r @Gamma))")));
        assertFalse(Match.isInstance(seq("(sequent (p q) (r q p))"), seq("(sequent (@Gamma) (r @Gamma))")));
    }
}
