package dumb.calculi;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An ordered tuple of at least two sides. Order and repetition inside a side matter.
 */
public record Sequent(List<List<Item>> sides) {

    public Sequent {
        requireNonNull(sides);
        if (sides.size() < 2)
            throw new IllegalArgumentException("A sequent needs at least two sides, got " + sides.size());
        sides = sides.stream().map(List::<Item>copyOf).toList();
    }

    /** The identity sequent: the formula alone on each of the given number of sides. */
    public static Sequent identity(Formula f, int sides) {
        var s = new ArrayList<List<Item>>(sides);
        for (var i = 0; i < sides; i++) s.add(List.of(f));
        return new Sequent(s);
    }

    public List<Item> side(int index) {
        return sides.get(index);
    }

    public int size() {
        return sides.size();
    }

    public boolean isSchematic() {
        return sides.stream().flatMap(List::stream).anyMatch(i -> i instanceof Context || ((Formula) i).isSchematic());
    }

    /** Copy with {@code item} inserted into side {@code side} at {@code position}. */
    public Sequent insert(int side, int position, Item item) {
        var s = new ArrayList<List<Item>>(sides);
        var target = new ArrayList<>(s.get(side));
        target.add(position, item);
        s.set(side, target);
        return new Sequent(s);
    }

    public String toKif() {
        return sides.stream()
                .map(side -> side.stream().map(Item::toKif).collect(Collectors.joining(" ", "(", ")")))
                .collect(Collectors.joining(" ", "(sequent ", ")"));
    }

    @Override
    public String toString() {
        return toKif();
    }

    /** A side element: a formula, or a context placeholder. */
    public sealed interface Item permits Formula, Context {
        String toKif();
    }

    /** Context placeholder, written {@code @Gamma}; stands for zero or more formulas. */
    public record Context(String name) implements Item {
        public Context {
            requireNonNull(name);
            if (!name.startsWith("@") || name.length() < 2)
                throw new IllegalArgumentException("Context placeholder must start with '@' and have length > 1: " + name);
        }

        @Override
        public String toKif() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
