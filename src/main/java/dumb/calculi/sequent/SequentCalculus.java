package dumb.calculi.sequent;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.calculi.Claim;
import dumb.calculi.Configuration;
import dumb.calculi.CorrectionError;
import dumb.calculi.ErrorCode;
import dumb.calculi.Formula;
import dumb.calculi.Inference;
import dumb.calculi.Language;
import dumb.calculi.Match;
import dumb.calculi.Sequent;
import dumb.calculi.SolverException;
import dumb.calculi.Substitution;
import dumb.calculi.tree.ProofTree;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dumb.calculi.util.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * A sequent calculus: axioms, named rules and the order in which the reducer tries them.
 * Derivations are {@link ProofTree}s whose root is the derived sequent and whose children are the
 * premises it was derived from.
 */
public class SequentCalculus {

    public static final String PREMISE = "premise";
    public static final String IDENTITY = "identity";

    private final Language language;
    private final Map<String, Sequent> axioms;
    private final Map<String, SequentRule> rules;
    private final List<String> solverRuleOrder;
    private final Configuration config;
    private final SequentReducer reducer;

    /**
     * @param weakeningRules name of the weakening rule for each side, used by smart weakening
     */
    public SequentCalculus(Language language, Map<String, Sequent> axioms, List<SequentRule> rules,
                           List<String> solverRuleOrder, Map<Integer, String> weakeningRules, Configuration config) {
        this.language = requireNonNull(language);
        this.config = requireNonNull(config);
        this.axioms = Collections.unmodifiableMap(new LinkedHashMap<>(axioms));
        for (var a : this.axioms.values()) language.checkWellFormed(a);

        var byName = new LinkedHashMap<String, SequentRule>();
        for (var r : rules) {
            if (byName.put(r.name(), r) != null)
                throw new IllegalArgumentException("Duplicate rule name " + r.name());
            language.checkWellFormed(r.conclusion());
            for (var p : r.premises()) language.checkWellFormed(p);
        }
        this.rules = Collections.unmodifiableMap(byName);

        for (var name : solverRuleOrder)
            if (!byName.containsKey(name))
                throw new IllegalArgumentException("Solver rule order names unknown rule " + name);
        this.solverRuleOrder = List.copyOf(solverRuleOrder);

        for (var name : weakeningRules.values())
            if (!byName.containsKey(name))
                throw new IllegalArgumentException("Weakening rule " + name + " is not a rule of the calculus");
        this.reducer = new SequentReducer(this, weakeningRules);
    }

    public Language language() {
        return language;
    }

    public Map<String, Sequent> axioms() {
        return axioms;
    }

    public Map<String, SequentRule> rules() {
        return rules;
    }

    public @Nullable SequentRule rule(String name) {
        return rules.get(name);
    }

    public List<String> solverRuleOrder() {
        return solverRuleOrder;
    }

    public Configuration config() {
        return config;
    }

    public boolean isAxiom(Sequent sequent) {
        return isAxiom(sequent, null);
    }

    /**
     * With the fast check only the identity without context counts (the same single formula on
     * every side) and the axiom name is ignored. Otherwise the sequent must be an instance of the
     * named axiom, or of any axiom when no name is given.
     */
    public boolean isAxiom(Sequent sequent, @Nullable String axiomName) {
        if (config.fastAxiomCheck()) return isIdentity(sequent);
        if (axiomName != null) {
            var axiom = axioms.get(axiomName);
            return axiom != null && Match.isInstance(sequent, axiom);
        }
        for (var axiom : axioms.values())
            if (Match.isInstance(sequent, axiom)) return true;
        return false;
    }

    static boolean isIdentity(Sequent sequent) {
        var first = sequent.side(0);
        if (first.size() != 1 || !(first.get(0) instanceof Formula f)) return false;
        for (var i = 1; i < sequent.size(); i++)
            if (!sequent.side(i).equals(List.of(f))) return false;
        return true;
    }

    /** Every leaf below the node is an axiom. */
    public boolean treeIsClosed(ProofTree<Sequent> tree, int node) {
        for (var leaf : tree.leaves(node))
            if (!isAxiom(tree.payload(leaf))) return false;
        return true;
    }

    /** Outcome of checking one rule application: the surviving substitutions, or what went wrong. */
    public record Application(List<Substitution> substitutions, @Nullable String error) {
        public Application {
            substitutions = List.copyOf(substitutions);
        }

        public boolean correct() {
            return error == null;
        }

        static Application failure(String error) {
            return new Application(List.of(), error);
        }
    }

    /**
     * Whether the node and its children are an instance of the named rule. The conclusion is
     * matched first, then each premise in order, carrying every substitution still consistent.
     */
    public Application isCorrectlyApplied(ProofTree<Sequent> tree, int node, String ruleName) {
        var content = tree.payload(node).toKif();
        if (!ruleName.equals(tree.justification(node)))
            return Application.failure("Node justification for node " + content + " is not " + ruleName);
        var rule = rules.get(ruleName);
        if (rule == null)
            return Application.failure("Node " + content + " is justified by " + ruleName + ", which is not a rule");

        var children = tree.children(node);
        if (children.size() != rule.premises().size())
            return Application.failure("Incorrect number of premises for node " + content);

        var possible = Match.sequent(tree.payload(node), rule.conclusion());
        if (possible.isEmpty())
            return Application.failure("Node " + content + " is incorrectly derived, it is not an instance of "
                    + ruleName + "'s conclusion");

        for (var i = 0; i < children.size(); i++) {
            possible = Match.sequent(tree.payload(children.get(i)), rule.premises().get(i), possible);
            if (possible.isEmpty())
                return Application.failure("Node " + content + " is incorrectly derived, premise "
                        + tree.payload(children.get(i)).toKif() + " is not an instance of rule premise "
                        + rule.premises().get(i).toKif());
        }
        return new Application(possible, null);
    }

    public boolean isCorrectTree(ProofTree<Sequent> tree) {
        return isCorrectTree(tree, List.of());
    }

    public boolean isCorrectTree(ProofTree<Sequent> tree, List<Sequent> premises) {
        return errors(tree, premises, true).isEmpty();
    }

    /**
     * Checks a derivation bottom-up (post-order). A leaf is either one of the premises, justified
     * by nothing or {@value #PREMISE}, or an instance of the axiom it names; every other node
     * must be a correct application of the rule it names.
     *
     * @return errors in the order found, empty when the derivation is correct
     */
    public List<CorrectionError> errors(ProofTree<Sequent> tree, List<Sequent> premises, boolean exitOnFirstError) {
        var errors = new ArrayList<CorrectionError>();
        for (var node : tree.postOrder(tree.root())) {
            var sequent = tree.payload(node);
            var at = tree.locator(node);
            var justification = tree.justification(node);

            var malformed = language.wellFormednessError(sequent);
            if (malformed != null) {
                errors.add(new CorrectionError(ErrorCode.GEN_MALFORMED_FORMULA, at, malformed));
                if (exitOnFirstError) return errors;
                continue;
            }

            if (tree.isLeaf(node)) {
                if (premises.contains(sequent)) {
                    if (justification != null && !justification.equals(PREMISE)) {
                        errors.add(new CorrectionError(ErrorCode.SEQ_INCORRECT_PREMISE, at, "Node " + sequent.toKif()
                                + ": Premise nodes must have either no justification or '" + PREMISE + "'"));
                        if (exitOnFirstError) return errors;
                    }
                    continue;
                }
                if (config.fastAxiomCheck() && !IDENTITY.equals(justification)) {
                    errors.add(new CorrectionError(ErrorCode.SEQ_INCORRECT_AXIOM, at,
                            "Node " + sequent.toKif() + ": Axiom " + justification + " is not a valid axiom name"));
                    if (exitOnFirstError) return errors;
                }
                if (!isAxiom(sequent, justification)) {
                    errors.add(new CorrectionError(ErrorCode.SEQ_INCORRECT_AXIOM, at,
                            "Node " + sequent.toKif() + " is not a valid axiom"));
                    if (exitOnFirstError) return errors;
                }
            } else {
                var applied = justification == null
                        ? Application.failure("Node " + sequent.toKif() + " has premises but no justification")
                        : isCorrectlyApplied(tree, node, justification);
                if (!applied.correct()) {
                    errors.add(new CorrectionError(ErrorCode.SEQ_RULE_INCORRECTLY_APPLIED, at, requireNonNull(applied.error())));
                    if (exitOnFirstError) return errors;
                }
            }
        }
        return errors;
    }

    /**
     * Searches for a derivation of the sequent from the axioms.
     *
     * @throws SolverException when none is found within the configured depth
     */
    public ProofTree<Sequent> reduce(Sequent sequent) throws SolverException {
        return reduce(sequent, List.of());
    }

    /** Searches for a derivation of the sequent from the axioms and the given premises. */
    public ProofTree<Sequent> reduce(Sequent sequent, List<Sequent> premises) throws SolverException {
        return reducer.reduce(sequent, premises);
    }

    /**
     * The sequent with the premises on each side before {@code separateAt} and the conclusions on
     * every side from it on.
     */
    public static Sequent transformInferenceIntoSequent(Inference inference, int sides, int separateAt) {
        if (sides < 2) throw new IllegalArgumentException("A sequent needs at least two sides");
        if (separateAt < 0 || separateAt > sides)
            throw new IllegalArgumentException("Cannot separate " + sides + " sides at " + separateAt);
        var out = new ArrayList<List<Sequent.Item>>(sides);
        for (var i = 0; i < sides; i++)
            out.add(formulas(i < separateAt ? inference.premises : inference.conclusions, inference));
        return new Sequent(out);
    }

    public static Sequent transformInferenceIntoSequent(Inference inference) {
        return transformInferenceIntoSequent(inference, 2, 1);
    }

    private static List<Sequent.Item> formulas(List<? extends Claim> claims, Inference inference) {
        var out = new ArrayList<Sequent.Item>(claims.size());
        for (var c : claims) {
            if (!(c instanceof Formula f))
                throw new IllegalArgumentException("Only inferences between formulas become sequents: " + inference.toKif());
            out.add(f);
        }
        return out;
    }

    public boolean isValid(Inference inference) {
        return isValid(inference, 2, 1);
    }

    /** Whether the reducer derives the sequent the inference becomes. */
    public boolean isValid(Inference inference, int sides, int separateAt) {
        try {
            reduce(transformInferenceIntoSequent(inference, sides, separateAt));
            return true;
        } catch (SolverException e) {
            debug(e.getMessage());
            return false;
        }
    }

    public static JsonNode toJson(ProofTree<Sequent> tree) {
        return tree.toJson(tree.root(), Sequent::toKif);
    }

    public static String render(ProofTree<Sequent> tree) {
        return tree.render(tree.root(), Sequent::toKif);
    }
}
