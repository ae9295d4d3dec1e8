package dumb.calculi.tableau;

import dumb.calculi.Formula;
import dumb.calculi.Substitution;
import dumb.calculi.tree.ProofTree;

import java.util.HashSet;

/**
 * Decides whether the branch ending at a node is closed.
 */
@FunctionalInterface
public interface ClosurePolicy {

    /**
     * @param top the node the branch is read from, as if it were the root; {@link ProofTree#NONE}
     *            for the actual root
     */
    boolean isClosed(TableauSystem system, ProofTree<TableauEntry> tree, int top, int node);

    /** A formula and its negation with the same index. */
    static ClosurePolicy negation(String negation) {
        return (system, tree, top, node) -> {
            var seen = new HashSet<TableauEntry>();
            for (var n : tree.pathFrom(top, node)) {
                var e = tree.payload(n);
                if (e.content() instanceof Formula f) {
                    if (seen.contains(new TableauEntry(Formula.of(negation, f), e.index()))) return true;
                    if (f instanceof Formula.Compound c && c.connective.equals(negation) && c.arity() == 1
                            && seen.contains(new TableauEntry(c.get(0), e.index())))
                        return true;
                }
                seen.add(e);
            }
            return false;
        };
    }

    /** The same formula with indices 1 and 0. */
    static ClosurePolicy oppositeTruths() {
        return (system, tree, top, node) -> {
            var seen = new HashSet<TableauEntry>();
            for (var n : tree.pathFrom(top, node)) {
                var e = tree.payload(n);
                if (e.index() instanceof Index.Truth t && seen.contains(new TableauEntry(e.content(), t.opposite())))
                    return true;
                seen.add(e);
            }
            return false;
        };
    }

    /** Every pair of nodes on the branch against every closure rule, in both orientations. */
    static ClosurePolicy closureRules() {
        return (system, tree, top, node) -> {
            var path = tree.pathFrom(top, node);
            for (var i = 0; i < path.size(); i++) {
                for (var j = i + 1; j < path.size(); j++) {
                    var a = tree.payload(path.get(i));
                    var b = tree.payload(path.get(j));
                    for (var rule : system.closureRules()) {
                        var s = a.match(rule.first(), Substitution.EMPTY);
                        if (s != null && b.match(rule.second(), s) != null) return true;
                        s = b.match(rule.first(), Substitution.EMPTY);
                        if (s != null && a.match(rule.second(), s) != null) return true;
                    }
                }
            }
            return false;
        };
    }

    /** Closed when the node itself holds an atomic well formed formula; the branch is not read. */
    static ClosurePolicy atomic() {
        return (system, tree, top, node) -> tree.payload(node).content() instanceof Formula f
                && system.language().isAtomicFormula(f);
    }
}
