package dumb.calculi;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable formula tree. Leaves are atoms (propositional letters and sentential
 * constants) or metavariables; internal nodes carry a connective and its arguments.
 */
public sealed interface Formula extends Claim, Sequent.Item permits Formula.Atom, Formula.Var, Formula.Compound {

    static Atom atom(String symbol) {
        return new Atom(symbol);
    }

    static Var var(String name) {
        return new Var(name);
    }

    static Compound of(String connective, Formula... args) {
        return new Compound(connective, List.of(args));
    }

    @Override
    default int level() {
        return 0;
    }

    /** True when a metavariable occurs somewhere inside. */
    boolean isSchematic();

    /** Main symbol: the atom or metavariable itself, or the connective. */
    String symbol();

    JSONObject toJson();

    record Atom(String symbol) implements Formula {
        public Atom {
            requireNonNull(symbol);
            if (symbol.isEmpty() || symbol.startsWith("?") || symbol.startsWith("@"))
                throw new IllegalArgumentException("Invalid atomic symbol: '" + symbol + "'");
        }

        @Override
        public boolean isSchematic() {
            return false;
        }

        @Override
        public String toKif() {
            return symbol;
        }

        @Override
        public String toString() {
            return symbol;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "atom")
                    .put("symbol", symbol);
        }
    }

    /** Metavariable, written {@code ?A}. */
    record Var(String name) implements Formula {
        public Var {
            requireNonNull(name);
            if (!name.startsWith("?") || name.length() < 2)
                throw new IllegalArgumentException("Metavariable name must start with '?' and have length > 1: " + name);
        }

        @Override
        public String symbol() {
            return name;
        }

        @Override
        public boolean isSchematic() {
            return true;
        }

        @Override
        public String toKif() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "var")
                    .put("name", name);
        }
    }

    final class Compound implements Formula {
        public final String connective;
        public final List<Formula> args;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated;
        private volatile String kifStringCache;
        private volatile Boolean schematicCache;

        public Compound(String connective, List<Formula> args) {
            this.connective = requireNonNull(connective);
            this.args = List.copyOf(args);
            if (args.isEmpty())
                throw new IllegalArgumentException("Compound formula '" + connective + "' needs at least one argument");
        }

        @Override
        public String symbol() {
            return connective;
        }

        public Formula get(int index) {
            return args.get(index);
        }

        public int arity() {
            return args.size();
        }

        @Override
        public boolean isSchematic() {
            if (schematicCache == null) schematicCache = args.stream().anyMatch(Formula::isSchematic);
            return schematicCache;
        }

        @Override
        public String toKif() {
            if (kifStringCache == null)
                kifStringCache = args.stream().map(Formula::toKif).collect(Collectors.joining(" ", "(" + connective + " ", ")"));
            return kifStringCache;
        }

        @Override
        public JSONObject toJson() {
            var a = new JSONArray();
            args.forEach(x -> a.put(x.toJson()));
            return new JSONObject()
                    .put("type", "compound")
                    .put("connective", connective)
                    .put("args", a);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Compound c && hashCode() == c.hashCode() && connective.equals(c.connective) && args.equals(c.args));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = 31 * connective.hashCode() + args.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return toKif();
        }
    }
}
