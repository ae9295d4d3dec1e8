package dumb.calculi;

import dumb.calculi.Sequent.Context;
import dumb.calculi.Sequent.Item;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Schematic matching: decides whether a candidate is a substitution instance of a pattern.
 * Every method returns the substitution extended with the bindings the match needed, or null
 * (empty list, for sequents) when the candidate is not an instance. Candidates are never
 * modified.
 */
public enum Match {
    ;

    /**
     * A metavariable binds on first use and must agree afterwards; any other leaf must be the
     * same symbol; compounds need the same connective and arity and match argument by argument.
     */
    public static @Nullable Substitution formula(Formula candidate, Formula pattern, Substitution s) {
        if (pattern instanceof Formula.Var v) {
            var bound = s.get(v);
            if (bound == null) return s.bind(v, candidate);
            return bound.equals(candidate) ? s : null;
        }
        if (pattern instanceof Formula.Atom) return pattern.equals(candidate) ? s : null;

        var p = (Formula.Compound) pattern;
        if (!(candidate instanceof Formula.Compound c) || !c.connective.equals(p.connective) || c.arity() != p.arity())
            return null;
        var current = s;
        for (var i = 0; i < p.arity(); i++) {
            current = formula(c.get(i), p.get(i), current);
            if (current == null) return null;
        }
        return current;
    }

    public static boolean isInstance(Formula candidate, Formula pattern) {
        return formula(candidate, pattern, Substitution.EMPTY) != null;
    }

    public static @Nullable Substitution claim(Claim candidate, Claim pattern, Substitution s, boolean ordered) {
        if (candidate instanceof Formula cf)
            return pattern instanceof Formula pf ? formula(cf, pf, s) : null;
        return pattern instanceof Inference pi ? inference((Inference) candidate, pi, s, ordered) : null;
    }

    /**
     * Counts and level must agree. Ordered mode matches positionally. Unordered mode tries
     * every permutation of the pattern premises, then (from the winning premise substitution)
     * every permutation of the pattern conclusions, and keeps the first consistent one.
     */
    public static @Nullable Substitution inference(Inference candidate, Inference pattern, Substitution s, boolean ordered) {
        if (candidate.level() != pattern.level()
                || candidate.premises.size() != pattern.premises.size()
                || candidate.conclusions.size() != pattern.conclusions.size())
            return null;
        var afterPremises = members(candidate.premises, pattern.premises, s, ordered);
        return afterPremises == null ? null : members(candidate.conclusions, pattern.conclusions, afterPremises, ordered);
    }

    public static @Nullable Substitution inference(Inference candidate, Inference pattern, Substitution s) {
        return inference(candidate, pattern, s, false);
    }

    private static @Nullable Substitution members(List<Claim> candidates, List<Claim> patterns, Substitution s, boolean ordered) {
        if (ordered) return positional(candidates, patterns, s, true);
        return firstPermutation(patterns, perm -> positional(candidates, perm, s, false));
    }

    private static @Nullable Substitution positional(List<Claim> candidates, List<Claim> patterns, Substitution s, boolean ordered) {
        var current = s;
        for (var i = 0; i < patterns.size(); i++) {
            current = claim(candidates.get(i), patterns.get(i), current, ordered);
            if (current == null) return null;
        }
        return current;
    }

    /**
     * Walks the permutations of {@code items} in lexicographic order of positions, identity
     * first, and returns the first non-null result.
     */
    static <X, R> @Nullable R firstPermutation(List<X> items, Function<List<X>, @Nullable R> attempt) {
        return permute(new ArrayList<>(items.size()), items, new boolean[items.size()], attempt);
    }

    private static <X, R> @Nullable R permute(List<X> prefix, List<X> items, boolean[] used, Function<List<X>, @Nullable R> attempt) {
        if (prefix.size() == items.size()) return attempt.apply(List.copyOf(prefix));
        for (var i = 0; i < items.size(); i++) {
            if (used[i]) continue;
            used[i] = true;
            prefix.add(items.get(i));
            var r = permute(prefix, items, used, attempt);
            prefix.remove(prefix.size() - 1);
            used[i] = false;
            if (r != null) return r;
        }
        return null;
    }

    /**
     * All substitutions, extending any of {@code possible}, under which the candidate sequent is
     * an instance of the pattern. Sides are matched in order, each carrying the full list forward.
     */
    public static List<Substitution> sequent(Sequent candidate, Sequent pattern, List<Substitution> possible) {
        if (candidate.size() != pattern.size()) return List.of();
        var current = possible;
        for (var i = 0; i < pattern.size() && !current.isEmpty(); i++)
            current = ContextMatcher.side(candidate.side(i), pattern.side(i), current);
        return current;
    }

    public static List<Substitution> sequent(Sequent candidate, Sequent pattern) {
        return sequent(candidate, pattern, List.of(Substitution.EMPTY));
    }

    public static boolean isInstance(Sequent candidate, Sequent pattern) {
        return !sequent(candidate, pattern).isEmpty();
    }

    public static Formula instantiate(Formula pattern, Substitution s) {
        if (pattern instanceof Formula.Var v) {
            var bound = s.get(v);
            if (bound == null)
                throw new IllegalArgumentException("Metavariable " + v.name() + " is not bound in " + s);
            return bound;
        }
        if (pattern instanceof Formula.Compound c && c.isSchematic())
            return new Formula.Compound(c.connective, c.args.stream().map(a -> instantiate(a, s)).toList());
        return pattern;
    }

    public static Inference instantiate(Inference pattern, Substitution s) {
        return new Inference(
                pattern.premises.stream().map(c -> instantiate(c, s)).toList(),
                pattern.conclusions.stream().map(c -> instantiate(c, s)).toList(),
                pattern.level());
    }

    public static Claim instantiate(Claim pattern, Substitution s) {
        return pattern instanceof Formula f ? instantiate(f, s) : instantiate((Inference) pattern, s);
    }

    /** Context placeholders expand in place to the sequences they are bound to. */
    public static Sequent instantiate(Sequent pattern, Substitution s) {
        var sides = new ArrayList<List<Item>>(pattern.size());
        for (var side : pattern.sides()) {
            var out = new ArrayList<Item>();
            for (var item : side) {
                if (item instanceof Context c) {
                    var bound = s.get(c);
                    if (bound == null)
                        throw new IllegalArgumentException("Context " + c.name() + " is not bound in " + s);
                    out.addAll(bound);
                } else {
                    out.add(instantiate((Formula) item, s));
                }
            }
            sides.add(out);
        }
        return new Sequent(sides);
    }
}
