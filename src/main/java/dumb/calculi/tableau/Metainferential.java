package dumb.calculi.tableau;

import dumb.calculi.Configuration;
import dumb.calculi.Formula;
import dumb.calculi.Inference;
import dumb.calculi.Languages;
import dumb.calculi.Substitution;
import dumb.calculi.tree.ProofTree;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.calculi.tableau.TableauSystem.rule;
import static dumb.calculi.tableau.Tableaux.A;
import static dumb.calculi.tableau.Tableaux.B;
import static dumb.calculi.tableau.Tableaux.and;
import static dumb.calculi.tableau.Tableaux.implies;
import static dumb.calculi.tableau.Tableaux.not;
import static dumb.calculi.tableau.Tableaux.or;

/**
 * Metainferential tableaux over the three values 1, i and 0. Nodes carry a standard: a set of
 * values a formula takes, or a pair of standards an inference satisfies (premises in the first,
 * some conclusion in the second). A barred standard says the opposite. Structural rules unfold
 * inferences and reshape value sets; connective rules follow Strong or Weak Kleene.
 */
public enum Metainferential {
    ;

    public static final Set<String> VALUES = Set.of("1", "i", "0");

    static final Standard S = Standard.of("1");
    static final Standard I = Standard.of("i");
    static final Standard F = Standard.of("0");
    static final Standard T = Standard.of("1", "i");
    static final Standard N = Standard.of("i", "0");
    static final Standard D = Standard.of("1", "0");

    private static TableauEntry e(Formula f, Standard s) {
        return new TableauEntry(f, s);
    }

    private static List<TableauEntry> branch(TableauEntry... entries) {
        return List.of(entries);
    }

    /** Strong Kleene metainferential tableaux for inferences checked against {@code standard}. */
    public static TableauSystem sk(Standard standard, Configuration config) {
        return system(strongKleene(), standard, config);
    }

    /** Weak Kleene: an i anywhere in a compound makes the whole compound i. */
    public static TableauSystem wk(Standard standard, Configuration config) {
        var rules = strongKleene();
        rules.put("R∧i", rule("R∧i", e(and(A, B), I)).branches(List.of(branch(e(A, I)), branch(e(B, I)))).build());
        rules.put("R∧0", rule("R∧0", e(and(A, B), F)).branches(List.of(
                branch(e(A, F), e(B, D)), branch(e(B, F), e(A, D)))).build());
        rules.put("R∨i", rule("R∨i", e(or(A, B), I)).branches(List.of(branch(e(A, I)), branch(e(B, I)))).build());
        rules.put("R∨1", rule("R∨1", e(or(A, B), S)).branches(List.of(
                branch(e(A, S), e(B, D)), branch(e(B, S), e(A, D)))).build());
        rules.put("R→i", rule("R→i", e(implies(A, B), I)).branches(List.of(branch(e(A, I)), branch(e(B, I)))).build());
        rules.put("R→1", rule("R→1", e(implies(A, B), S)).branches(List.of(
                branch(e(A, F), e(B, D)), branch(e(B, S), e(A, D)))).build());
        return system(rules, standard, config);
    }

    private static TableauSystem system(Map<String, SchematicRule> connectives, Standard standard, Configuration config) {
        var rules = new ArrayList<TableauRule>(List.of(
                new Inf0(), new Inf1(), new Complement(), new Intersection(), new Singleton()));
        rules.addAll(connectives.values());
        return new TableauSystem(Languages.CLASSICAL, rules, List.of(), closure(), start(standard), config);
    }

    private static Map<String, SchematicRule> strongKleene() {
        var r = new LinkedHashMap<String, SchematicRule>();
        r.put("R~1", rule("R~1", e(not(A), S)).then(e(A, F)).build());
        r.put("R~i", rule("R~i", e(not(A), I)).then(e(A, I)).build());
        r.put("R~0", rule("R~0", e(not(A), F)).then(e(A, S)).build());

        r.put("R∧1", rule("R∧1", e(and(A, B), S)).then(e(A, S), e(B, S)).build());
        r.put("R∧i", rule("R∧i", e(and(A, B), I)).branches(List.of(
                branch(e(A, T), e(B, I)), branch(e(A, I), e(B, T)))).build());
        r.put("R∧0", rule("R∧0", e(and(A, B), F)).branches(List.of(branch(e(A, F)), branch(e(B, F)))).build());

        r.put("R∨1", rule("R∨1", e(or(A, B), S)).branches(List.of(branch(e(A, S)), branch(e(B, S)))).build());
        r.put("R∨i", rule("R∨i", e(or(A, B), I)).branches(List.of(
                branch(e(A, N), e(B, I)), branch(e(A, I), e(B, N)))).build());
        r.put("R∨0", rule("R∨0", e(or(A, B), F)).then(e(A, F), e(B, F)).build());

        r.put("R→1", rule("R→1", e(implies(A, B), S)).branches(List.of(branch(e(A, F)), branch(e(B, S)))).build());
        r.put("R→i", rule("R→i", e(implies(A, B), I)).branches(List.of(
                branch(e(A, I), e(B, N)), branch(e(A, T), e(B, I)))).build());
        r.put("R→0", rule("R→0", e(implies(A, B), F)).then(e(A, S), e(B, F)).build());
        return r;
    }

    /**
     * A branch closes when a formula takes no value at all (an empty, unbarred value set), or when
     * the empty inference is said to satisfy a standard.
     */
    public static ClosurePolicy closure() {
        return (system, tree, top, node) -> {
            for (var n : tree.pathFrom(top, node)) {
                var e = tree.payload(n);
                var standard = e.standard();
                if (standard == null || standard.bar()) continue;
                if (standard instanceof Standard.Values v && v.isEmpty() && e.isFormula()) return true;
                if (e.content() instanceof Inference i && i.isEmpty()) return true;
            }
            return false;
        };
    }

    /** The tableau starts from the inference failing the standard. */
    public static StartPolicy start(Standard standard) {
        var root = standard.barred();
        return new StartPolicy() {
            @Override
            public List<TableauEntry> begin(Inference goal) {
                if (goal.level() != standard.level())
                    throw new Inference.IncorrectLevelsException("Standard " + standard.toKif() + " has level "
                            + standard.level() + " but " + goal.toKif() + " has level " + goal.level());
                return List.of(new TableauEntry(goal, root));
            }

            @Override
            public @Nullable Witness witness(TableauEntry entry, Inference goal) {
                if (!goal.equals(entry.content()) || !root.equals(entry.index())) return null;
                var premises = new ArrayList<Integer>();
                var conclusions = new ArrayList<Integer>();
                for (var i = 0; i < goal.premises.size(); i++) premises.add(i);
                for (var i = 0; i < goal.conclusions.size(); i++) conclusions.add(i);
                return new Witness(Set.copyOf(premises), Set.copyOf(conclusions));
            }
        };
    }

    /**
     * Reads a valuation off the first open branch: each atom standing alone with a single,
     * unbarred value.
     *
     * @return atom symbol to value, or null when every branch is closed
     */
    public static @Nullable Map<String, String> counterexample(TableauSystem system, ProofTree<TableauEntry> tree) {
        for (var leaf : tree.leaves(tree.root())) {
            if (system.nodeIsClosed(tree, leaf)) continue;
            var valuation = new LinkedHashMap<String, String>();
            for (var n : tree.path(leaf)) {
                var e = tree.payload(n);
                if (e.content() instanceof Formula.Atom a && e.standard() instanceof Standard.Values v
                        && !v.bar() && v.isSingleton())
                    valuation.put(a.symbol(), v.values().iterator().next());
            }
            return valuation;
        }
        return null;
    }

    /**
     * Rule computed from the node itself rather than matched against a pattern. Every derived node
     * is justified by the rule name; one list of entries per branch.
     */
    abstract static class Structural implements TableauRule {

        private final String name;

        Structural(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        abstract @Nullable List<List<TableauEntry>> branches(ProofTree<TableauEntry> tree, int node);

        @Override
        public @Nullable Substitution applicable(TableauSystem system, ProofTree<TableauEntry> tree, int node) {
            var b = branches(tree, node);
            return b == null || b.isEmpty() ? null : Substitution.EMPTY;
        }

        @Override
        public Consequence consequence(TableauSystem system, ProofTree<TableauEntry> tree, int node, Substitution s) {
            var pattern = new ProofTree<>(tree.payload(node), null);
            var b = branches(tree, node);
            if (b == null) throw new IllegalStateException("Rule " + name + " does not apply to " + tree.payload(node));
            for (var chain : b) pattern.chain(pattern.root(), chain, name);
            return new Consequence(pattern, pattern.root());
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** An inference and a pair standard of its own level. */
    private static @Nullable Standard.Pair pair(TableauEntry e, boolean bar) {
        if (e.content() instanceof Inference i && !i.isEmpty()
                && e.standard() instanceof Standard.Pair p && p.bar() == bar && p.level() == i.level())
            return p;
        return null;
    }

    private static @Nullable Standard.Values values(TableauEntry e, boolean bar) {
        return e.isFormula() && e.standard() instanceof Standard.Values v && v.bar() == bar ? v : null;
    }

    /** Failing X/Y: every premise in X and every conclusion outside Y. */
    static final class Inf0 extends Structural {
        Inf0() {
            super("inf0");
        }

        @Override
        @Nullable List<List<TableauEntry>> branches(ProofTree<TableauEntry> tree, int node) {
            var e = tree.payload(node);
            var p = pair(e, true);
            if (p == null) return null;
            var i = (Inference) e.content();
            var chain = new ArrayList<TableauEntry>();
            for (var c : i.premises) chain.add(new TableauEntry(c, p.premises()));
            for (var c : i.conclusions) chain.add(new TableauEntry(c, p.conclusions().barred()));
            return List.of(chain);
        }
    }

    /** Satisfying X/Y: some premise outside X or some conclusion in Y. */
    static final class Inf1 extends Structural {
        Inf1() {
            super("inf1");
        }

        @Override
        @Nullable List<List<TableauEntry>> branches(ProofTree<TableauEntry> tree, int node) {
            var e = tree.payload(node);
            var p = pair(e, false);
            if (p == null) return null;
            var i = (Inference) e.content();
            var out = new ArrayList<List<TableauEntry>>();
            for (var c : i.premises) out.add(List.of(new TableauEntry(c, p.premises().barred())));
            for (var c : i.conclusions) out.add(List.of(new TableauEntry(c, p.conclusions())));
            return out;
        }
    }

    /** A formula outside X takes one of the remaining values. */
    static final class Complement extends Structural {
        Complement() {
            super("complement");
        }

        @Override
        @Nullable List<List<TableauEntry>> branches(ProofTree<TableauEntry> tree, int node) {
            var e = tree.payload(node);
            var v = values(e, true);
            return v == null ? null : List.of(List.of(new TableauEntry(e.content(), v.complement(VALUES))));
        }
    }

    /**
     * A formula in X further up the branch and in Y here is in both. Not applied when either set
     * is empty or contains the other.
     */
    static final class Intersection extends Structural {
        Intersection() {
            super("intersection");
        }

        @Override
        @Nullable List<List<TableauEntry>> branches(ProofTree<TableauEntry> tree, int node) {
            var e = tree.payload(node);
            var y = values(e, false);
            if (y == null || y.isEmpty()) return null;
            for (var n = tree.parent(node); n != ProofTree.NONE; n = tree.parent(n)) {
                var other = tree.payload(n);
                var x = values(other, false);
                if (x == null || x.isEmpty() || !other.content().equals(e.content())) continue;
                if (x.subsetOf(y) || y.subsetOf(x)) continue;
                return List.of(List.of(new TableauEntry(e.content(), x.intersection(y))));
            }
            return null;
        }
    }

    /** A formula in a set of several values takes one of them. */
    static final class Singleton extends Structural {
        Singleton() {
            super("singleton");
        }

        @Override
        @Nullable List<List<TableauEntry>> branches(ProofTree<TableauEntry> tree, int node) {
            var e = tree.payload(node);
            var v = values(e, false);
            if (v == null || v.values().size() < 2) return null;
            var out = new ArrayList<List<TableauEntry>>();
            for (var value : v.values()) out.add(List.of(new TableauEntry(e.content(), Standard.of(value))));
            return out;
        }
    }
}
