package dumb.calculi.tableau;

import dumb.calculi.Substitution;
import dumb.calculi.tree.ProofTree;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Rule given as a pattern tree. Its unjustified nodes, in pre-order, are the premises; the
 * subtree below the last premise is what it derives, every node of it justified by the rule name.
 */
public final class SchematicRule implements TableauRule {

    private final String name;
    private final ProofTree<TableauEntry> tree;
    private final List<Integer> premises;

    public SchematicRule(String name, ProofTree<TableauEntry> tree) {
        this.name = requireNonNull(name);
        this.tree = requireNonNull(tree);
        var premises = new ArrayList<Integer>();
        for (var n : tree.preOrder(tree.root()))
            if (tree.justification(n) == null) premises.add(n);
        if (premises.isEmpty())
            throw new IllegalArgumentException("Rule " + name + " has no premise");
        this.premises = List.copyOf(premises);
    }

    @Override
    public String name() {
        return name;
    }

    public ProofTree<TableauEntry> tree() {
        return tree;
    }

    public int lastPremise() {
        return premises.get(premises.size() - 1);
    }

    /**
     * The node must match the last premise. Walking up from the node itself, each ancestor that
     * matches the latest unconsumed premise consumes it; the rule applies once all are consumed.
     */
    @Override
    public @Nullable Substitution applicable(TableauSystem system, ProofTree<TableauEntry> candidate, int node) {
        var last = premises.size() - 1;
        var s = TableauSystem.matchNode(candidate, node, tree, premises.get(last), Substitution.EMPTY);
        if (s == null) return null;

        var remaining = last;
        for (var n = node; n != ProofTree.NONE && remaining > 0; n = candidate.parent(n)) {
            var extended = TableauSystem.matchNode(candidate, n, tree, premises.get(remaining - 1), s);
            if (extended != null) {
                s = extended;
                remaining--;
            }
        }
        return remaining == 0 ? s : null;
    }

    @Override
    public Consequence consequence(TableauSystem system, ProofTree<TableauEntry> candidate, int node, Substitution s) {
        return new Consequence(tree, lastPremise());
    }

    @Override
    public String toString() {
        return name;
    }
}
