package dumb.calculi.tableau;

import dumb.calculi.Claim;
import dumb.calculi.Formula;
import dumb.calculi.Inference;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * How a tableau for an inference begins, and which unjustified nodes count as legitimate
 * starting points when a tableau is checked against an inference.
 */
public interface StartPolicy {

    /** Entries of the initial branch, top first. */
    List<TableauEntry> begin(Inference goal);

    /**
     * @return the premise and conclusion positions the entry stands for, or null when it stands
     * for none of them
     */
    @Nullable Witness witness(TableauEntry entry, Inference goal);

    record Witness(Set<Integer> premises, Set<Integer> conclusions) {
        public Witness {
            premises = Set.copyOf(premises);
            conclusions = Set.copyOf(conclusions);
        }
    }

    /** Premises as given, then negated conclusions, all without index. */
    static StartPolicy negatedConclusions(String negation) {
        return new StartPolicy() {
            @Override
            public List<TableauEntry> begin(Inference goal) {
                var out = new ArrayList<TableauEntry>();
                for (var p : goal.premises) out.add(TableauEntry.of(p));
                for (var c : goal.conclusions) out.add(TableauEntry.of(Formula.of(negation, formula(c))));
                return out;
            }

            @Override
            public @Nullable Witness witness(TableauEntry entry, Inference goal) {
                var premises = new HashSet<Integer>();
                var conclusions = new HashSet<Integer>();
                for (var i = 0; i < goal.premises.size(); i++)
                    if (goal.premises.get(i).equals(entry.content())) premises.add(i);
                if (entry.content() instanceof Formula.Compound c && c.connective.equals(negation) && c.arity() == 1)
                    for (var i = 0; i < goal.conclusions.size(); i++)
                        if (goal.conclusions.get(i).equals(c.get(0))) conclusions.add(i);
                return premises.isEmpty() && conclusions.isEmpty() ? null : new Witness(premises, conclusions);
            }
        };
    }

    /** Premises at one index, conclusions unnegated at another. */
    static StartPolicy signed(int premiseIndex, int conclusionIndex) {
        var p = Index.of(premiseIndex);
        var c = Index.of(conclusionIndex);
        return new StartPolicy() {
            @Override
            public List<TableauEntry> begin(Inference goal) {
                var out = new ArrayList<TableauEntry>();
                for (var x : goal.premises) out.add(new TableauEntry(x, p));
                for (var x : goal.conclusions) out.add(new TableauEntry(x, c));
                return out;
            }

            @Override
            public @Nullable Witness witness(TableauEntry entry, Inference goal) {
                var premises = new HashSet<Integer>();
                var conclusions = new HashSet<Integer>();
                if (p.equals(entry.index()))
                    for (var i = 0; i < goal.premises.size(); i++)
                        if (goal.premises.get(i).equals(entry.content())) premises.add(i);
                if (c.equals(entry.index()))
                    for (var i = 0; i < goal.conclusions.size(); i++)
                        if (goal.conclusions.get(i).equals(entry.content())) conclusions.add(i);
                return premises.isEmpty() && conclusions.isEmpty() ? null : new Witness(premises, conclusions);
            }
        };
    }

    private static Formula formula(Claim c) {
        if (c instanceof Formula f) return f;
        throw new IllegalArgumentException("Expected a formula, got the inference " + c.toKif());
    }
}
