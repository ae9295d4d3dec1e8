package dumb.calculi;

import dumb.calculi.Sequent.Context;
import dumb.calculi.Sequent.Item;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches one side of a sequent against one side of a rule, splitting the candidate
 * around the rule's context placeholders. Returns every consistent substitution,
 * without deduplication, in a fixed order: matched positions by increasing index
 * combination, then span distributions from "everything to the first placeholder"
 * to "everything to the last".
 */
public enum ContextMatcher {
    ;

    public static List<Substitution> side(List<Item> candidate, List<Item> rule, List<Substitution> possible) {
        if (possible.isEmpty()) return List.of();
        if (rule.isEmpty()) return candidate.isEmpty() ? possible : List.of();

        var shape = Shape.of(rule);
        var formulaPositions = new ArrayList<Integer>();
        for (var i = 0; i < candidate.size(); i++)
            if (candidate.get(i) instanceof Formula) formulaPositions.add(i);

        var result = new ArrayList<Substitution>();
        combinations(formulaPositions, shape.pattern.size(), combo -> {
            if (!shape.admits(combo, candidate.size())) return;
            var matched = matchPattern(candidate, shape.pattern, combo, possible);
            if (!matched.isEmpty())
                result.addAll(distributeContexts(candidate, shape, combo, matched));
        });
        return result;
    }

    private static List<Substitution> matchPattern(List<Item> candidate, List<Formula> pattern, int[] combo, List<Substitution> possible) {
        var out = new ArrayList<Substitution>(possible.size());
        for (var s : possible) {
            @Nullable Substitution current = s;
            for (var k = 0; k < pattern.size() && current != null; k++)
                current = Match.formula((Formula) candidate.get(combo[k]), pattern.get(k), current);
            if (current != null) out.add(current);
        }
        return out;
    }

    /**
     * Segment j holds the placeholders between pattern formulas j-1 and j; its span is the
     * part of the candidate between the corresponding matched positions.
     */
    private static List<Substitution> distributeContexts(List<Item> candidate, Shape shape, int[] combo, List<Substitution> possible) {
        var current = possible;
        var n = shape.pattern.size();
        for (var j = 0; j <= n && !current.isEmpty(); j++) {
            var segment = shape.segments.get(j);
            var from = j == 0 ? 0 : combo[j - 1] + 1;
            var to = j == n ? candidate.size() : combo[j];
            if (segment.isEmpty()) {
                if (from < to) return List.of();
                continue;
            }
            current = distribute(candidate.subList(from, to), segment, current);
        }
        return current;
    }

    private static List<Substitution> distribute(List<Item> span, List<Context> contexts, List<Substitution> possible) {
        var out = new ArrayList<Substitution>();
        assignments(span.size(), contexts.size(), assignment -> {
            var parts = new ArrayList<List<Item>>(contexts.size());
            for (var c = 0; c < contexts.size(); c++) parts.add(new ArrayList<>());
            for (var i = 0; i < span.size(); i++) parts.get(assignment[i]).add(span.get(i));
            for (var s : possible) {
                var merged = bind(s, contexts, parts);
                if (merged != null) out.add(merged);
            }
        });
        return out;
    }

    private static @Nullable Substitution bind(Substitution s, List<Context> contexts, List<List<Item>> parts) {
        var current = s;
        for (var c = 0; c < contexts.size(); c++) {
            var bound = current.get(contexts.get(c));
            if (bound == null) current = current.bind(contexts.get(c), parts.get(c));
            else if (!bound.equals(parts.get(c))) return null;
        }
        return current;
    }

    /** Strictly increasing index combinations of {@code size} elements, in lexicographic order. */
    static void combinations(List<Integer> positions, int size, IntArrayConsumer each) {
        if (size > positions.size()) return;
        combine(positions, new int[size], 0, 0, each);
    }

    private static void combine(List<Integer> positions, int[] combo, int k, int start, IntArrayConsumer each) {
        if (k == combo.length) {
            each.accept(combo.clone());
            return;
        }
        for (var i = start; i <= positions.size() - (combo.length - k); i++) {
            combo[k] = positions.get(i);
            combine(positions, combo, k + 1, i + 1, each);
        }
    }

    /**
     * Every way to hand {@code length} consecutive elements to {@code slots} ordered slots:
     * non-decreasing slot assignments, in lexicographic order.
     */
    static void assignments(int length, int slots, IntArrayConsumer each) {
        assign(new int[length], 0, 0, slots, each);
    }

    private static void assign(int[] a, int i, int min, int slots, IntArrayConsumer each) {
        if (i == a.length) {
            each.accept(a.clone());
            return;
        }
        for (var slot = min; slot < slots; slot++) {
            a[i] = slot;
            assign(a, i + 1, slot, slots, each);
        }
    }

    @FunctionalInterface
    interface IntArrayConsumer {
        void accept(int[] values);
    }

    /** A rule side reduced to its formula pattern and the placeholder runs around it. */
    private record Shape(List<Formula> pattern, List<List<Context>> segments, boolean leftContext,
                         boolean rightContext, boolean[] together) {

        static Shape of(List<Item> rule) {
            var pattern = new ArrayList<Formula>();
            var segments = new ArrayList<List<Context>>();
            var run = new ArrayList<Context>();
            for (var item : rule) {
                if (item instanceof Context c) {
                    run.add(c);
                } else {
                    pattern.add((Formula) item);
                    segments.add(List.copyOf(run));
                    run.clear();
                }
            }
            segments.add(List.copyOf(run));

            var together = new boolean[pattern.size()];
            for (var k = 1; k < pattern.size(); k++) together[k] = segments.get(k).isEmpty();

            return new Shape(pattern, segments,
                    rule.get(0) instanceof Context, rule.get(rule.size() - 1) instanceof Context, together);
        }

        /** Edge and adjacency constraints; {@code together[k]} ties pattern k to pattern k-1. */
        boolean admits(int[] combo, int candidateSize) {
            if (combo.length == 0) return true;
            if (!leftContext && combo[0] != 0) return false;
            if (!rightContext && combo[combo.length - 1] != candidateSize - 1) return false;
            for (var k = 1; k < combo.length; k++)
                if (together[k] && combo[k] != combo[k - 1] + 1) return false;
            return true;
        }
    }
}
