package dumb.calculi;

import dumb.calculi.Sequent.Context;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextMatcherTests extends AbstractTest {

    private static final Context GAMMA = new Context("@Gamma");
    private static final Context DELTA = new Context("@Delta");
    private static final Context PI = new Context("@Pi");
    private static final Context SIGMA = new Context("@Sigma");

    private static List<Substitution> match(List<Sequent.Item> candidate, List<Sequent.Item> rule) {
        return ContextMatcher.side(candidate, rule, List.of(Substitution.EMPTY));
    }

    @Test
    void emptyRuleSideMatchesOnlyEmptySide() {
        assertEquals(1, match(List.of(), List.of()).size());
        assertTrue(match(side("p"), List.of()).isEmpty());
    }

    @Test
    void lonePlaceholderTakesEverything() {
        var all = match(side("p", "q"), side("@Gamma"));
        assertEquals(1, all.size());
        assertEquals(side("p", "q"), all.get(0).get(GAMMA));

        var none = match(List.of(), side("@Gamma"));
        assertEquals(1, none.size());
        assertEquals(List.of(), none.get(0).get(GAMMA));
    }

    @Test
    void everyPositionOfThePrincipalFormulaIsTried() {
        var all = match(side("p", "(not q)", "(not r)"), side("@Gamma", "(not ?A)", "@Delta"));
        assertEquals(2, all.size());
        assertEquals(f("q"), all.get(0).get(Formula.var("?A")));
        assertEquals(side("p"), all.get(0).get(GAMMA));
        assertEquals(side("(not r)"), all.get(0).get(DELTA));
        assertEquals(f("r"), all.get(1).get(Formula.var("?A")));
        assertEquals(side("p", "(not q)"), all.get(1).get(GAMMA));
    }

    @Test
    void formulaAtTheEdgeMustBeAtTheEdge() {
        assertTrue(match(side("p", "(not q)"), side("(not ?A)", "@Gamma")).isEmpty());
        assertEquals(1, match(side("(not q)", "p"), side("(not ?A)", "@Gamma")).size());
        assertTrue(match(side("(not q)", "p"), side("@Gamma", "(not ?A)")).isEmpty());
    }

    @Test
    void adjacentFormulasStayAdjacent() {
        assertTrue(match(side("p", "r", "q"), side("@Gamma", "p", "q", "@Delta")).isEmpty());
        assertEquals(1, match(side("r", "p", "q"), side("@Gamma", "p", "q", "@Delta")).size());
        assertEquals(1, match(side("p", "r", "q"), side("@Gamma", "p", "@Sigma", "q", "@Delta")).size());
    }

    @Test
    void repeatedPlaceholderRepeatsItsContent() {
        var all = match(side("p", "p", "q"), side("@Pi", "@Pi", "@Gamma"));
        assertEquals(2, all.size());
        assertEquals(List.of(), all.get(0).get(PI));
        assertEquals(side("p", "p", "q"), all.get(0).get(GAMMA));
        assertEquals(side("p"), all.get(1).get(PI));
        assertEquals(side("q"), all.get(1).get(GAMMA));
    }

    @Test
    void placeholdersInTheCandidateAreItems() {
        var all = match(side("@Gamma", "?A"), side("@Sigma", "?B"));
        assertEquals(1, all.size());
        assertEquals(List.of(GAMMA), all.get(0).get(SIGMA));
        assertEquals(f("?A"), all.get(0).get(Formula.var("?B")));
    }

    @Test
    void priorBindingsFilterSplits() {
        var prior = Substitution.EMPTY.bind(GAMMA, side("p"));
        var all = ContextMatcher.side(side("p", "q"), side("@Gamma", "@Delta"), List.of(prior));
        assertEquals(1, all.size());
        assertEquals(side("q"), all.get(0).get(DELTA));
    }

    @Test
    void assignmentsAreNonDecreasingInOrder() {
        var seen = new ArrayList<String>();
        ContextMatcher.assignments(2, 2, a -> seen.add(a[0] + "" + a[1]));
        assertEquals(List.of("00", "01", "11"), seen);
    }
}
