package dumb.calculi.tableau;

import dumb.calculi.Claim;
import dumb.calculi.SolverException;
import dumb.calculi.tree.ProofTree;

import java.util.ArrayDeque;

import static dumb.calculi.util.Log.debug;
import static dumb.calculi.util.Log.debugging;

/**
 * Grows a tableau breadth first. Each node is visited once; every rule applicable there, in
 * declaration order, has its consequences copied onto each open leaf below the node. Stops as soon
 * as the whole tableau is closed; an open tableau is returned as it stands.
 */
public final class TableauxSolver {

    private final int maxDepth;

    public TableauxSolver(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive");
        this.maxDepth = maxDepth;
    }

    public ProofTree<TableauEntry> solve(Claim target, TableauSystem system) throws SolverException {
        var goal = TableauSystem.goal(target);
        var begin = system.start().begin(goal);
        if (begin.isEmpty())
            throw new IllegalArgumentException("Nothing to start a tableau from for " + target.toKif());

        var tree = new ProofTree<TableauEntry>();
        tree.chain(ProofTree.NONE, begin, null);
        if (debugging()) debug("Solving " + goal.toKif());

        var queue = new ArrayDeque<Integer>();
        queue.add(tree.root());
        while (!queue.isEmpty()) {
            var node = queue.poll();
            for (var rule : system.rules()) {
                var s = rule.applicable(system, tree, node);
                if (s == null) continue;

                var c = rule.consequence(system, tree, node, s);
                var instance = c.pattern().subtree(c.at(), e -> e.instantiate(s));
                for (var leaf : tree.leaves(node)) {
                    if (system.nodeIsClosed(tree, leaf)) continue;
                    if (tree.depth(leaf) >= maxDepth)
                        throw new SolverException("Could not solve the tree for " + goal.toKif()
                                + ": maximum depth " + maxDepth + " exceeded");
                    tree.graftChildren(leaf, instance, instance.root());
                }
                if (debugging()) debug("Applied " + rule.name() + " to " + tree.payload(node).toKif());

                if (system.treeIsClosed(tree)) return tree;
            }
            queue.addAll(tree.children(node));
        }
        return tree;
    }
}
