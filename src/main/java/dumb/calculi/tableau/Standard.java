package dumb.calculi.tableau;

import dumb.calculi.Substitution;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * A metainferential standard: a set of designated values, a pair of lower-level standards
 * (premise standard, conclusion standard) or a variable, each optionally barred
 * (complemented).
 */
public sealed interface Standard extends Index permits Standard.Values, Standard.Pair, Standard.Variable {

    static Values of(String... values) {
        return new Values(Set.of(values), false);
    }

    static Pair pair(Standard premises, Standard conclusions) {
        return new Pair(premises, conclusions, false);
    }

    static Variable var(String name) {
        return new Variable(name, false);
    }

    boolean bar();

    Standard withBar(boolean bar);

    default Standard barred() {
        return withBar(!bar());
    }

    /** 0 for value sets, one more than the components for pairs, -1 for unbound variables. */
    int level();

    @Override
    default @Nullable Substitution match(Index pattern, Substitution s) {
        return pattern instanceof Standard p ? match(this, p, s) : null;
    }

    /**
     * Bars must agree. A variable binds on first use and must agree afterwards; pairs match
     * component-wise; value sets must be equal.
     */
    static @Nullable Substitution match(Standard candidate, Standard pattern, Substitution s) {
        if (candidate.bar() != pattern.bar()) return null;
        if (pattern instanceof Variable v) {
            var plain = candidate.withBar(false);
            var bound = s.standard(v.name());
            if (bound == null) return s.bind(v.name(), plain);
            return bound.equals(plain) ? s : null;
        }
        if (pattern instanceof Pair p && candidate instanceof Pair c) {
            var s1 = match(c.premises(), p.premises(), s);
            return s1 == null ? null : match(c.conclusions(), p.conclusions(), s1);
        }
        if (pattern instanceof Values && candidate instanceof Values)
            return candidate.equals(pattern) ? s : null;
        return null;
    }

    @Override
    Standard instantiate(Substitution s);

    record Values(Set<String> values, boolean bar) implements Standard {
        public Values {
            values = Collections.unmodifiableSortedSet(new TreeSet<>(requireNonNull(values)));
        }

        @Override
        public Values withBar(boolean bar) {
            return new Values(values, bar);
        }

        @Override
        public int level() {
            return 0;
        }

        public boolean isEmpty() {
            return values.isEmpty();
        }

        public boolean isSingleton() {
            return values.size() == 1;
        }

        public boolean subsetOf(Values other) {
            return other.values.containsAll(values);
        }

        public Values intersection(Values other) {
            var v = new TreeSet<>(values);
            v.retainAll(other.values);
            return new Values(v, false);
        }

        /** The values of {@code base} not in this set, unbarred. */
        public Values complement(Set<String> base) {
            var v = new TreeSet<>(base);
            v.removeAll(values);
            return new Values(v, false);
        }

        @Override
        public Standard instantiate(Substitution s) {
            return this;
        }

        @Override
        public String toKif() {
            var s = "(values" + (values.isEmpty() ? "" : " " + String.join(" ", values)) + ")";
            return bar ? "(bar " + s + ")" : s;
        }

        @Override
        public String toString() {
            return toKif();
        }
    }

    record Pair(Standard premises, Standard conclusions, boolean bar) implements Standard {
        public Pair {
            requireNonNull(premises);
            requireNonNull(conclusions);
        }

        @Override
        public Pair withBar(boolean bar) {
            return new Pair(premises, conclusions, bar);
        }

        @Override
        public int level() {
            return premises.level() + 1;
        }

        @Override
        public Standard instantiate(Substitution s) {
            return new Pair(premises.instantiate(s), conclusions.instantiate(s), bar);
        }

        @Override
        public String toKif() {
            var s = "(pair " + premises.toKif() + " " + conclusions.toKif() + ")";
            return bar ? "(bar " + s + ")" : s;
        }

        @Override
        public String toString() {
            return toKif();
        }
    }

    record Variable(String name, boolean bar) implements Standard {
        public Variable {
            requireNonNull(name);
        }

        @Override
        public Variable withBar(boolean bar) {
            return new Variable(name, bar);
        }

        @Override
        public int level() {
            return -1;
        }

        @Override
        public Standard instantiate(Substitution s) {
            var bound = s.standard(name);
            if (bound == null)
                throw new IllegalArgumentException("Standard variable " + name + " is not bound in " + s);
            return bound.withBar(bar);
        }

        @Override
        public String toKif() {
            var s = "(var " + name + ")";
            return bar ? "(bar " + s + ")" : s;
        }

        @Override
        public String toString() {
            return toKif();
        }
    }
}
