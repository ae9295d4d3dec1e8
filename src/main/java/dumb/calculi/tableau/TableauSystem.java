package dumb.calculi.tableau;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.calculi.Claim;
import dumb.calculi.Configuration;
import dumb.calculi.CorrectionError;
import dumb.calculi.ErrorCode;
import dumb.calculi.Inference;
import dumb.calculi.Language;
import dumb.calculi.SolverException;
import dumb.calculi.Substitution;
import dumb.calculi.tree.ProofTree;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A tableau calculus: a language, an ordered list of rules, closure rules, and the policies that
 * decide when a branch closes and how a tableau for an inference begins.
 */
public class TableauSystem {

    private final Language language;
    private final Map<String, TableauRule> rules;
    private final List<ClosureRule> closureRules;
    private final ClosurePolicy closure;
    private final StartPolicy start;
    private final TableauxSolver solver;

    public TableauSystem(Language language, List<? extends TableauRule> rules, List<ClosureRule> closureRules,
                         ClosurePolicy closure, StartPolicy start, Configuration config) {
        this.language = requireNonNull(language);
        this.closureRules = List.copyOf(closureRules);
        this.closure = requireNonNull(closure);
        this.start = requireNonNull(start);
        this.solver = new TableauxSolver(config.tableauMaxDepth());

        var byName = new LinkedHashMap<String, TableauRule>();
        for (var r : rules) {
            if (byName.put(r.name(), r) != null)
                throw new IllegalArgumentException("Duplicate rule name " + r.name());
            if (r instanceof SchematicRule s)
                for (var n : s.tree().preOrder(s.tree().root()))
                    language.checkWellFormed(s.tree().payload(n).content());
        }
        this.rules = byName;
        for (var c : this.closureRules) {
            language.checkWellFormed(c.first().content());
            language.checkWellFormed(c.second().content());
        }
    }

    public Language language() {
        return language;
    }

    /** Rules in declaration order. */
    public List<TableauRule> rules() {
        return List.copyOf(rules.values());
    }

    public @Nullable TableauRule rule(String name) {
        return rules.get(name);
    }

    public List<ClosureRule> closureRules() {
        return closureRules;
    }

    public StartPolicy start() {
        return start;
    }

    /**
     * Matches a candidate node against a pattern node: the pattern's index, when present, must
     * match; the pattern's justification, when present, must be equal; then the contents must match.
     */
    public static @Nullable Substitution matchNode(ProofTree<TableauEntry> tree, int node,
                                                   ProofTree<TableauEntry> pattern, int patternNode, Substitution s) {
        var j = pattern.justification(patternNode);
        if (j != null && !j.equals(tree.justification(node))) return null;
        return tree.payload(node).match(pattern.payload(patternNode), s);
    }

    /** Formulas are checked as the inference with that single premise and no conclusion. */
    public static Inference goal(Claim target) {
        return target instanceof Inference i ? i : new Inference(List.of(target), List.of());
    }

    public boolean nodeIsClosed(ProofTree<TableauEntry> tree, int node) {
        return closure.isClosed(this, tree, ProofTree.NONE, node);
    }

    /** Every leaf below {@code node} is closed, reading branches from {@code node} down. */
    public boolean treeIsClosed(ProofTree<TableauEntry> tree, int node) {
        for (var leaf : tree.leaves(node))
            if (!closure.isClosed(this, tree, node, leaf)) return false;
        return true;
    }

    public boolean treeIsClosed(ProofTree<TableauEntry> tree) {
        return treeIsClosed(tree, tree.root());
    }

    /**
     * @return the substitution under which the named rule applies at the node, or null
     */
    public @Nullable Substitution ruleIsApplicable(ProofTree<TableauEntry> tree, int node, String ruleName) {
        var rule = rules.get(ruleName);
        if (rule == null) throw new IllegalArgumentException("Unknown rule " + ruleName);
        return rule.applicable(this, tree, node);
    }

    public boolean isCorrectTree(ProofTree<TableauEntry> tree) {
        return isCorrectTree(tree, null);
    }

    public boolean isCorrectTree(ProofTree<TableauEntry> tree, @Nullable Claim target) {
        return errors(tree, target, true).isEmpty();
    }

    /**
     * Checks a tableau top-down, level by level. Unjustified nodes must come before any justified
     * node and any branching; with a target they must be its premises or negated conclusions (per
     * the start policy), and every premise and conclusion must appear. Every rule applicable at a
     * node must have its consequences in every open branch below it, and every justified node must
     * be accounted for by such an application.
     *
     * @param exitOnFirstError stop at the first error; it is the same error that heads the full list
     * @return errors in the order found, empty when the tableau is correct
     */
    public List<CorrectionError> errors(ProofTree<TableauEntry> tree, @Nullable Claim target, boolean exitOnFirstError) {
        var report = new Report(exitOnFirstError);
        var goal = target == null ? null : goal(target);
        if (goal != null) {
            var e = language.wellFormednessError(goal);
            if (e != null && report.add(new CorrectionError(ErrorCode.GEN_MALFORMED_INFERENCE, null, e)))
                return report.errors;
        }

        Set<Integer> derived = new HashSet<>();
        var premisesSeen = new HashSet<Integer>();
        var conclusionsSeen = new HashSet<Integer>();
        var traversingPremises = true;
        var order = tree.levelOrder(tree.root());

        for (var node : order) {
            var entry = tree.payload(node);
            var malformed = language.wellFormednessError(entry.content());
            if (malformed != null) {
                derived.add(node);
                if (report.add(new CorrectionError(ErrorCode.GEN_MALFORMED_FORMULA, tree.locator(node), malformed)))
                    return report.errors;
                continue;
            }

            if (tree.justification(node) != null) {
                traversingPremises = false;
            } else {
                if (!traversingPremises && report.add(new CorrectionError(ErrorCode.TBL_PREMISE_NOT_BEGINNING, tree.locator(node),
                        "Premise nodes must be at the beginning of the tableaux, before applying any rule and before opening any new branch")))
                    return report.errors;
                if (goal != null) {
                    var w = start.witness(entry, goal);
                    if (w != null) {
                        premisesSeen.addAll(w.premises());
                        conclusionsSeen.addAll(w.conclusions());
                        derived.add(node);
                    } else if (report.add(new CorrectionError(ErrorCode.TBL_INCORRECT_PREMISE, tree.locator(node),
                            "Node " + entry.toKif() + " is an incorrect premise node"))) {
                        return report.errors;
                    }
                } else {
                    derived.add(node);
                }
            }
            if (tree.children(node).size() > 1) traversingPremises = false;

            for (var rule : rules.values()) {
                var s = rule.applicable(this, tree, node);
                if (s == null) continue;
                var c = rule.consequence(this, tree, node, s);
                var applied = correctlyApplied(tree, node, c.pattern(), c.at(), derived, s);
                if (applied == null) {
                    if (report.add(new CorrectionError(ErrorCode.TBL_RULE_NOT_APPLIED, tree.locator(node),
                            "Rule " + rule.name() + " was not applied to node " + entry.toKif())))
                        return report.errors;
                } else {
                    derived.addAll(applied.derived);
                }
            }
        }

        if (goal != null) {
            for (var i = 0; i < goal.premises.size(); i++)
                if (!premisesSeen.contains(i) && report.add(new CorrectionError(ErrorCode.TBL_PREMISE_NOT_PRESENT, List.of(),
                        "Premise " + goal.premises.get(i).toKif() + " is not present in the tree")))
                    return report.errors;
            for (var i = 0; i < goal.conclusions.size(); i++)
                if (!conclusionsSeen.contains(i) && report.add(new CorrectionError(ErrorCode.TBL_CONCLUSION_NOT_PRESENT, List.of(),
                        "Conclusion " + goal.conclusions.get(i).toKif() + " is not present in the tree")))
                    return report.errors;
        }

        for (var node : order)
            if (tree.justification(node) != null && !derived.contains(node)
                    && report.add(new CorrectionError(ErrorCode.TBL_RULE_INCORRECTLY_APPLIED, tree.locator(node),
                    "Rule incorrectly applied to node " + tree.payload(node).toKif())))
                return report.errors;

        return report.errors;
    }

    private record Applied(Set<Integer> derived, Substitution s) {
    }

    /**
     * Whether the rule subtree under {@code at} is realized below {@code node} in every open branch.
     * When the node's children are fresh instances of the rule children the check descends pairwise;
     * otherwise another rule was applied there first and the whole rule subtree is looked for below
     * each child. Reaching a closed leaf satisfies the rule.
     */
    private @Nullable Applied correctlyApplied(ProofTree<TableauEntry> tree, int node, ProofTree<TableauEntry> pattern,
                                               int at, Set<Integer> derived, Substitution s) {
        if (pattern.isLeaf(at)) return new Applied(derived, s);
        if (tree.isLeaf(node)) return nodeIsClosed(tree, node) ? new Applied(derived, s) : null;

        var children = tree.children(node);
        var ruleChildren = pattern.children(at);
        @Nullable Substitution instance = children.size() == ruleChildren.size() ? s : null;
        for (var i = 0; i < children.size() && instance != null; i++)
            instance = derived.contains(children.get(i)) ? null
                    : matchNode(tree, children.get(i), pattern, ruleChildren.get(i), instance);

        var out = new HashSet<>(derived);
        if (instance == null) {
            for (var child : children) {
                var r = correctlyApplied(tree, child, pattern, at, derived, s);
                if (r == null) return null;
                out.addAll(r.derived);
            }
            return new Applied(out, s);
        }

        for (var i = 0; i < children.size(); i++) {
            var r = correctlyApplied(tree, children.get(i), pattern, ruleChildren.get(i), derived, instance);
            if (r == null) return null;
            out.addAll(r.derived);
            instance = r.s;
        }
        out.addAll(children);
        return new Applied(out, instance);
    }

    /**
     * Builds a tableau for the target: an inference, or a formula read as the inference with that
     * single premise.
     *
     * @throws SolverException when a branch reaches the configured depth bound
     */
    public ProofTree<TableauEntry> solve(Claim target) throws SolverException {
        return solver.solve(target, this);
    }

    /** Whether the tableau the solver builds for the target closes. */
    public boolean isValid(Claim target) throws SolverException {
        return treeIsClosed(solve(target));
    }

    public static JsonNode toJson(ProofTree<TableauEntry> tree) {
        return tree.toJson(tree.root(), TableauEntry::toKif);
    }

    public static String render(ProofTree<TableauEntry> tree) {
        return tree.render(tree.root(), TableauEntry::toKif);
    }

    /** Builds rule trees: the first premise is the root. */
    public static RuleBuilder rule(String name, TableauEntry premise) {
        return new RuleBuilder(name, premise);
    }

    public static final class RuleBuilder {
        private final String name;
        private final ProofTree<TableauEntry> tree;
        private int cursor;

        private RuleBuilder(String name, TableauEntry premise) {
            this.name = requireNonNull(name);
            this.tree = new ProofTree<>(premise, null);
            this.cursor = tree.root();
        }

        /** Another premise, below the previous one. */
        public RuleBuilder premise(TableauEntry premise) {
            cursor = tree.add(cursor, premise, null);
            return this;
        }

        /** A chain of consequences below the last premise (one branch). */
        public RuleBuilder then(TableauEntry... chain) {
            tree.chain(cursor, List.of(chain), name);
            return this;
        }

        /** One branch per chain below the last premise. */
        public RuleBuilder branches(List<List<TableauEntry>> branches) {
            for (var b : branches) tree.chain(cursor, b, name);
            return this;
        }

        public SchematicRule build() {
            return new SchematicRule(name, tree);
        }
    }

    /** Collects errors, telling the caller when to stop. */
    private static final class Report {
        final List<CorrectionError> errors = new ArrayList<>();
        final boolean exitOnFirst;

        Report(boolean exitOnFirst) {
            this.exitOnFirst = exitOnFirst;
        }

        boolean add(CorrectionError e) {
            errors.add(e);
            return exitOnFirst;
        }
    }
}
