package dumb.calculi.tableau;

import static java.util.Objects.requireNonNull;

/**
 * Two node patterns that close a branch when both occur on it, in either order.
 */
public record ClosureRule(TableauEntry first, TableauEntry second) {
    public ClosureRule {
        requireNonNull(first);
        requireNonNull(second);
    }
}
