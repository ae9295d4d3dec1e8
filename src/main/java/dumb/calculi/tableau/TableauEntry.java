package dumb.calculi.tableau;

import dumb.calculi.Claim;
import dumb.calculi.Formula;
import dumb.calculi.Match;
import dumb.calculi.Substitution;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Payload of a tableau node: a formula or an inference, and an optional index.
 */
public record TableauEntry(Claim content, @Nullable Index index) {

    public TableauEntry {
        requireNonNull(content);
    }

    public static TableauEntry of(Claim content) {
        return new TableauEntry(content, null);
    }

    public static TableauEntry of(Claim content, int truth) {
        return new TableauEntry(content, Index.of(truth));
    }

    public boolean isFormula() {
        return content instanceof Formula;
    }

    public @Nullable Standard standard() {
        return index instanceof Standard s ? s : null;
    }

    /**
     * Matches this (candidate) entry against a pattern entry. A pattern without index matches any
     * index. Formulas never match inferences.
     */
    public @Nullable Substitution match(TableauEntry pattern, Substitution s) {
        var current = s;
        if (pattern.index != null) {
            if (index == null) return null;
            current = index.match(pattern.index, current);
            if (current == null) return null;
        }
        return Match.claim(content, pattern.content, current, false);
    }

    public TableauEntry instantiate(Substitution s) {
        return new TableauEntry(Match.instantiate(content, s), index == null ? null : index.instantiate(s));
    }

    public String toKif() {
        return index == null ? content.toKif() : content.toKif() + ", " + index.toKif();
    }

    @Override
    public String toString() {
        return toKif();
    }
}
