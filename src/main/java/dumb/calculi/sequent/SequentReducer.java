package dumb.calculi.sequent;

import dumb.calculi.Formula;
import dumb.calculi.Match;
import dumb.calculi.Sequent;
import dumb.calculi.Sequent.Item;
import dumb.calculi.SolverException;
import dumb.calculi.tree.ProofTree;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.calculi.util.Log.debug;
import static dumb.calculi.util.Log.debugging;

/**
 * Backward proof search. At each sequent: a premise or an axiom ends the branch; otherwise,
 * optionally, a chain of weakenings from a premise or an identity; otherwise every rule in the
 * calculus' solver order, with every distinct instantiation of its premises, depth first.
 * Sequents that failed once are not tried again during the same search, and a sequent is never
 * reduced to one already on its own branch. The depth bound counts every node on a branch,
 * weakening steps included.
 */
public final class SequentReducer {

    private final SequentCalculus calculus;
    private final Map<Integer, String> weakeningRules;

    SequentReducer(SequentCalculus calculus, Map<Integer, String> weakeningRules) {
        this.calculus = calculus;
        this.weakeningRules = Collections.unmodifiableMap(new LinkedHashMap<>(weakeningRules));
    }

    /**
     * @return the first derivation found, rooted at the sequent
     * @throws SolverException when there is none within the configured depth
     */
    public ProofTree<Sequent> reduce(Sequent sequent, List<Sequent> premises) throws SolverException {
        var search = new Search(List.copyOf(premises));
        if (search.reduce(sequent, ProofTree.NONE, calculus.config().sequentMaxDepth(), List.of()) == ProofTree.NONE)
            throw new SolverException("Could not find reduction for " + sequent.toKif());
        return search.tree;
    }

    /** State of one call to {@link #reduce}. */
    private final class Search {
        final ProofTree<Sequent> tree = new ProofTree<>();
        final Set<Sequent> failed = new HashSet<>();
        final List<Sequent> premises;

        Search(List<Sequent> premises) {
            this.premises = premises;
        }

        /** @return the node added under {@code parent} for the sequent, or {@link ProofTree#NONE} */
        int reduce(Sequent sequent, int parent, int depth, List<Sequent> path) {
            if (depth == 0) return ProofTree.NONE;

            if (premises.contains(sequent)) return tree.add(parent, sequent, SequentCalculus.PREMISE);
            for (var axiom : calculus.axioms().keySet())
                if (calculus.isAxiom(sequent, axiom)) return tree.add(parent, sequent, axiom);

            if (calculus.config().smartWeakening()) {
                var chain = weakening(sequent);
                if (chain != null && chain.size() <= depth) {
                    var top = tree.add(parent, chain.get(0).sequent, chain.get(0).justification);
                    var node = top;
                    for (var step : chain.subList(1, chain.size())) node = tree.add(node, step.sequent, step.justification);
                    return top;
                }
            }

            var branch = new ArrayList<>(path);
            branch.add(sequent);
            for (var name : calculus.solverRuleOrder()) {
                var rule = calculus.rules().get(name);
                for (var premisesOfRule : instantiations(sequent, rule, branch)) {
                    var mark = tree.size();
                    var node = tree.add(parent, sequent, name);
                    var reduced = true;
                    for (var p : premisesOfRule) {
                        if (failed.contains(p) || reduce(p, node, depth - 1, branch) == ProofTree.NONE) {
                            failed.add(p);
                            reduced = false;
                            break;
                        }
                    }
                    if (reduced) {
                        if (debugging()) debug("Reduced " + sequent.toKif() + " by " + name);
                        return node;
                    }
                    tree.truncate(mark);
                }
            }
            return ProofTree.NONE;
        }

        /**
         * Distinct premise lists the rule reduces the sequent to. Lists that would revisit a
         * sequent on the branch, or a sequent that already failed, or repeat a formula on a side
         * more often than allowed, are left out.
         */
        List<List<Sequent>> instantiations(Sequent sequent, SequentRule rule, List<Sequent> branch) {
            var out = new ArrayList<List<Sequent>>();
            for (var s : Match.sequent(sequent, rule.conclusion())) {
                var list = new ArrayList<Sequent>(rule.premises().size());
                for (var p : rule.premises()) {
                    var instance = Match.instantiate(p, s);
                    if (branch.contains(instance) || failed.contains(instance) || !withinApparitions(instance)) {
                        list = null;
                        break;
                    }
                    list.add(instance);
                }
                if (list != null && !out.contains(list)) out.add(list);
            }
            return out;
        }

        boolean withinApparitions(Sequent sequent) {
            var max = calculus.config().maxApparitionsPerSide();
            if (max == null) return true;
            for (var side : sequent.sides())
                for (var item : side)
                    if (Collections.frequency(side, item) > max) return false;
            return true;
        }

        /**
         * Reaches the sequent by weakening alone, from a premise whose sides are subsequences of
         * the sequent's sides, or else from the identity of a formula found on every side.
         *
         * @return the chain from the sequent (first) down to its starting point (last), or null
         */
        @Nullable List<Step> weakening(Sequent target) {
            for (var side = 0; side < target.size(); side++)
                if (!weakeningRules.containsKey(side)) return null;

            for (var premise : premises) {
                if (premise.size() != target.size()) continue;
                var embeds = true;
                for (var side = 0; side < target.size() && embeds; side++)
                    embeds = subsequence(premise.side(side), target.side(side));
                if (embeds) return fromPremise(premise, target);
            }

            for (var item : target.side(0)) {
                if (!(item instanceof Formula f)) continue;
                var everywhere = true;
                for (var side = 1; side < target.size() && everywhere; side++)
                    everywhere = target.side(side).contains(f);
                if (everywhere) return fromIdentity(f, target);
            }
            return null;
        }

        /** Weakens each side from left to right, inserting what the premise lacks. */
        List<Step> fromPremise(Sequent premise, Sequent target) {
            var steps = new ArrayList<Step>();
            steps.add(new Step(premise, SequentCalculus.PREMISE));
            var current = premise;
            for (var side = 0; side < target.size(); side++) {
                var have = premise.side(side);
                var next = 0;
                var targetSide = target.side(side);
                for (var position = 0; position < targetSide.size(); position++) {
                    if (next < have.size() && targetSide.get(position).equals(have.get(next))) {
                        next++;
                        continue;
                    }
                    current = current.insert(side, position, targetSide.get(position));
                    steps.add(new Step(current, weakeningRules.get(side)));
                }
            }
            return checked(steps, target);
        }

        /**
         * Starts from the identity of {@code f} and, side by side, adds what lies left of the
         * first occurrence of {@code f} (innermost first), then what lies right of it.
         */
        List<Step> fromIdentity(Formula f, Sequent target) {
            var steps = new ArrayList<Step>();
            var current = Sequent.identity(f, target.size());
            steps.add(new Step(current, SequentCalculus.IDENTITY));
            for (var side = 0; side < target.size(); side++) {
                var targetSide = target.side(side);
                var at = targetSide.indexOf(f);
                for (var i = at - 1; i >= 0; i--) {
                    current = current.insert(side, 0, targetSide.get(i));
                    steps.add(new Step(current, weakeningRules.get(side)));
                }
                for (var i = at + 1; i < targetSide.size(); i++) {
                    current = current.insert(side, current.side(side).size(), targetSide.get(i));
                    steps.add(new Step(current, weakeningRules.get(side)));
                }
            }
            return checked(steps, target);
        }

        List<Step> checked(List<Step> bottomUp, Sequent target) {
            var last = bottomUp.get(bottomUp.size() - 1).sequent;
            if (!last.equals(target))
                throw new IllegalStateException("Weakening reached " + last.toKif() + " instead of " + target.toKif());
            var out = new ArrayList<>(bottomUp);
            Collections.reverse(out);
            return out;
        }
    }

    private static boolean subsequence(List<Item> small, List<Item> large) {
        var i = 0;
        for (var item : large)
            if (i < small.size() && small.get(i).equals(item)) i++;
        return i == small.size();
    }

    private record Step(Sequent sequent, String justification) {
    }
}
