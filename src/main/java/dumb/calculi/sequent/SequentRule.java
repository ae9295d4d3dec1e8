package dumb.calculi.sequent;

import dumb.calculi.Sequent;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A schematic rule read bottom-up: the conclusion is derived from the premises, in order.
 */
public record SequentRule(String name, Sequent conclusion, List<Sequent> premises) {

    public SequentRule {
        requireNonNull(name);
        requireNonNull(conclusion);
        premises = List.copyOf(premises);
    }

    public static SequentRule of(String name, Sequent conclusion, Sequent... premises) {
        return new SequentRule(name, conclusion, List.of(premises));
    }

    @Override
    public String toString() {
        return name + ": " + conclusion.toKif() + " <- " + premises;
    }
}
