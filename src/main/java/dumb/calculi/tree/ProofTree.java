package dumb.calculi.tree;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.calculi.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Arena of proof-tree nodes addressed by stable integer handles. A node owns a payload, an
 * optional justification and an ordered list of children; the parent index is kept only for
 * walking paths. Grafting copies entries, so no node is ever shared between branches.
 * <p>
 * Not thread safe; each verification or search owns its trees.
 */
public final class ProofTree<P> {

    public static final int NONE = -1;

    private final List<P> payloads = new ArrayList<>();
    private final List<@Nullable String> justifications = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();

    public ProofTree() {
    }

    /** A tree with a single root node. */
    public ProofTree(P root, @Nullable String justification) {
        add(NONE, root, justification);
    }

    public int root() {
        if (payloads.isEmpty()) throw new IllegalStateException("Empty tree");
        return 0;
    }

    public boolean isEmpty() {
        return payloads.isEmpty();
    }

    public int size() {
        return payloads.size();
    }

    /**
     * Adds a node under {@code parent}, or as the root when {@code parent} is {@link #NONE}.
     *
     * @return the new node's handle
     */
    public int add(int parent, P payload, @Nullable String justification) {
        if (parent == NONE && !payloads.isEmpty())
            throw new IllegalStateException("Tree already has a root");
        var id = payloads.size();
        payloads.add(Objects.requireNonNull(payload));
        justifications.add(justification);
        parents.add(parent);
        children.add(new ArrayList<>(2));
        if (parent != NONE) children.get(parent).add(id);
        return id;
    }

    /** Adds a chain of nodes below {@code parent}; returns the last one. */
    public int chain(int parent, List<P> payloads, @Nullable String justification) {
        var last = parent;
        for (var p : payloads) last = add(last, p, justification);
        return last;
    }

    public P payload(int node) {
        return payloads.get(node);
    }

    public @Nullable String justification(int node) {
        return justifications.get(node);
    }

    public int parent(int node) {
        return parents.get(node);
    }

    public List<Integer> children(int node) {
        return Collections.unmodifiableList(children.get(node));
    }

    public boolean isLeaf(int node) {
        return children.get(node).isEmpty();
    }

    public int depth(int node) {
        var d = 0;
        for (var n = parents.get(node); n != NONE; n = parents.get(n)) d++;
        return d;
    }

    /** Position among its siblings; 0 for the root. */
    public int childIndex(int node) {
        var p = parents.get(node);
        return p == NONE ? 0 : children.get(p).indexOf(node);
    }

    /** Child positions from the root down to the node, the root contributing 0. */
    public List<Integer> locator(int node) {
        var out = new ArrayList<Integer>();
        for (var n = node; n != NONE; n = parents.get(n)) out.add(childIndex(n));
        Collections.reverse(out);
        return out;
    }

    /** Nodes from the root down to {@code node}, both included. */
    public List<Integer> path(int node) {
        return pathFrom(NONE, node);
    }

    /**
     * Nodes from {@code top} down to {@code node}, both included, as if {@code top} were the
     * root. With {@link #NONE} the walk goes up to the actual root.
     */
    public List<Integer> pathFrom(int top, int node) {
        var out = new ArrayList<Integer>();
        for (var n = node; n != NONE; n = parents.get(n)) {
            out.add(n);
            if (n == top) break;
        }
        Collections.reverse(out);
        return out;
    }

    public boolean isAncestorOrSelf(int ancestor, int node) {
        for (var n = node; n != NONE; n = parents.get(n))
            if (n == ancestor) return true;
        return false;
    }

    public List<Integer> preOrder(int node) {
        var out = new ArrayList<Integer>();
        var stack = new ArrayDeque<Integer>();
        stack.push(node);
        while (!stack.isEmpty()) {
            var n = stack.pop();
            out.add(n);
            var c = children.get(n);
            for (var i = c.size() - 1; i >= 0; i--) stack.push(c.get(i));
        }
        return out;
    }

    public List<Integer> postOrder(int node) {
        var out = new ArrayList<Integer>();
        postOrder(node, out);
        return out;
    }

    private void postOrder(int node, List<Integer> out) {
        for (var c : children.get(node)) postOrder(c, out);
        out.add(node);
    }

    /** Breadth first, level by level, left to right. */
    public List<Integer> levelOrder(int node) {
        var out = new ArrayList<Integer>();
        var queue = new ArrayDeque<Integer>();
        queue.add(node);
        while (!queue.isEmpty()) {
            var n = queue.poll();
            out.add(n);
            queue.addAll(children.get(n));
        }
        return out;
    }

    /** Leaves under {@code node} (itself when it is a leaf), left to right. */
    public List<Integer> leaves(int node) {
        return preOrder(node).stream().filter(this::isLeaf).toList();
    }

    /**
     * Copies the subtree of {@code source} rooted at {@code from} under {@code parent}, as fresh
     * entries, mapping payloads through {@code f}.
     *
     * @return the handle of the copy of {@code from}
     */
    public <Q> int graft(int parent, ProofTree<Q> source, int from, Function<Q, P> f) {
        var copy = add(parent, f.apply(source.payload(from)), source.justification(from));
        for (var c : source.children(from)) graft(copy, source, c, f);
        return copy;
    }

    /** Copies every child subtree of {@code source}'s node {@code from} under {@code parent}. */
    public void graftChildren(int parent, ProofTree<P> source, int from) {
        for (var c : source.children(from)) graft(parent, source, c, Function.identity());
    }

    /**
     * Forgets every node added after the tree had {@code size} nodes, together with the
     * references earlier nodes hold to them. Used to backtrack a failed search step.
     */
    public void truncate(int size) {
        if (size > payloads.size()) throw new IllegalArgumentException("Cannot truncate to a larger size");
        for (var i = payloads.size() - 1; i >= size; i--) {
            var p = parents.get(i);
            if (p != NONE && p < size) children.get(p).remove(Integer.valueOf(i));
            payloads.remove(i);
            justifications.remove(i);
            parents.remove(i);
            children.remove(i);
        }
    }

    /** Copy of the subtree rooted at {@code node} as a new tree, payloads mapped through {@code f}. */
    public <Q> ProofTree<Q> subtree(int node, Function<P, Q> f) {
        var t = new ProofTree<Q>();
        t.graft(NONE, this, node, f);
        return t;
    }

    /** Structural key of a subtree: equal keys mean equal payloads, justifications and shape. */
    public List<Object> key(int node) {
        var k = new ArrayList<Object>();
        k.add(payloads.get(node));
        k.add(Objects.toString(justifications.get(node)));
        for (var c : children.get(node)) k.add(key(c));
        return k;
    }

    /** Subtree as JSON: payload text, justification and children. */
    public JsonNode toJson(int node, Function<P, String> text) {
        var o = Json.node();
        o.put("content", text.apply(payloads.get(node)));
        var j = justifications.get(node);
        if (j != null) o.put("justification", j);
        var c = Json.array();
        for (var child : children.get(node)) c.add(toJson(child, text));
        if (!c.isEmpty()) o.set("children", c);
        return o;
    }

    /** Indented rendering, one node per line. */
    public String render(int node, Function<P, String> text) {
        var sb = new StringBuilder();
        render(node, text, 0, sb);
        return sb.toString();
    }

    private void render(int node, Function<P, String> text, int indent, StringBuilder sb) {
        sb.append("  ".repeat(indent)).append(text.apply(payloads.get(node)));
        var j = justifications.get(node);
        if (j != null) sb.append(" [").append(j).append(']');
        sb.append('\n');
        for (var c : children.get(node)) render(c, text, indent + 1, sb);
    }
}
