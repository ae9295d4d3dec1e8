package dumb.calculi.kif;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** A parsed S-expression: a symbol or a parenthesized list. */
public sealed interface Sexp permits Sexp.Symbol, Sexp.Lst {

    String toKif();

    record Symbol(String name) implements Sexp {
        public Symbol {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Empty symbol");
        }

        @Override
        public String toKif() {
            return name;
        }
    }

    record Lst(List<Sexp> items) implements Sexp {
        public Lst {
            items = List.copyOf(items);
        }

        public int size() {
            return items.size();
        }

        public Sexp get(int i) {
            return items.get(i);
        }

        /** The leading symbol, or null when the list is empty or starts with a list. */
        public @Nullable String op() {
            return !items.isEmpty() && items.get(0) instanceof Symbol s ? s.name() : null;
        }

        @Override
        public String toKif() {
            return items.stream().map(Sexp::toKif).collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
