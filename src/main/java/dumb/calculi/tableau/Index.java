package dumb.calculi.tableau;

import dumb.calculi.Substitution;
import org.jetbrains.annotations.Nullable;

/**
 * The label a tableau node carries next to its content: a truth value for indexed and
 * many-valued systems, or a standard for metainferential ones.
 */
public sealed interface Index permits Index.Truth, Standard {

    static Truth of(int value) {
        return new Truth(value);
    }

    /**
     * Matches this (candidate) index against a pattern index.
     *
     * @return the extended substitution, or null when they do not match
     */
    @Nullable Substitution match(Index pattern, Substitution s);

    Index instantiate(Substitution s);

    String toKif();

    record Truth(int value) implements Index {
        @Override
        public @Nullable Substitution match(Index pattern, Substitution s) {
            return this.equals(pattern) ? s : null;
        }

        @Override
        public Index instantiate(Substitution s) {
            return this;
        }

        /** 1 for 0 and 0 for 1. */
        public Truth opposite() {
            return new Truth(1 - value);
        }

        @Override
        public String toKif() {
            return Integer.toString(value);
        }

        @Override
        public String toString() {
            return toKif();
        }
    }
}
