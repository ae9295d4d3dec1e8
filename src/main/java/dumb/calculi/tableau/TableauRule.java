package dumb.calculi.tableau;

import dumb.calculi.Substitution;
import dumb.calculi.tree.ProofTree;
import org.jetbrains.annotations.Nullable;

/**
 * A named tableau rule. Applying it at a node grafts the children of the consequence pattern
 * onto every open leaf below the node.
 */
public interface TableauRule {

    String name();

    /**
     * @return the substitution under which the rule applies with {@code node} as its last premise,
     * or null when it does not apply there
     */
    @Nullable Substitution applicable(TableauSystem system, ProofTree<TableauEntry> tree, int node);

    /**
     * The pattern the rule's output must match: the node {@code at} of the returned tree stands for
     * the triggering node and its subtree is what the rule derives below it.
     */
    Consequence consequence(TableauSystem system, ProofTree<TableauEntry> tree, int node, Substitution s);

    record Consequence(ProofTree<TableauEntry> pattern, int at) {
    }
}
