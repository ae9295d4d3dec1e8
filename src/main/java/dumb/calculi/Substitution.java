package dumb.calculi;

import dumb.calculi.Sequent.Context;
import dumb.calculi.Sequent.Item;
import dumb.calculi.tableau.Standard;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Immutable binding of pattern holes: metavariables to formulas, context placeholders to
 * item sequences, standard variables to standards. Bindings keep insertion order, so the
 * order in which alternatives are enumerated is reproducible.
 */
public final class Substitution {

    public static final Substitution EMPTY = new Substitution(Map.of(), Map.of(), Map.of());

    private final Map<Formula.Var, Formula> formulas;
    private final Map<Context, List<Item>> contexts;
    private final Map<String, Standard> standards;

    private Substitution(Map<Formula.Var, Formula> formulas, Map<Context, List<Item>> contexts, Map<String, Standard> standards) {
        this.formulas = formulas;
        this.contexts = contexts;
        this.standards = standards;
    }

    private static <K, V> Map<K, V> with(Map<K, V> m, K key, V value) {
        var n = new LinkedHashMap<>(m);
        n.put(requireNonNull(key), requireNonNull(value));
        return Collections.unmodifiableMap(n);
    }

    public @Nullable Formula get(Formula.Var v) {
        return formulas.get(v);
    }

    public @Nullable List<Item> get(Context c) {
        return contexts.get(c);
    }

    public @Nullable Standard standard(String variable) {
        return standards.get(variable);
    }

    public Substitution bind(Formula.Var v, Formula value) {
        return new Substitution(with(formulas, v, value), contexts, standards);
    }

    public Substitution bind(Context c, List<? extends Item> value) {
        return new Substitution(formulas, with(contexts, c, List.copyOf(value)), standards);
    }

    public Substitution bind(String standardVariable, Standard value) {
        return new Substitution(formulas, contexts, with(standards, standardVariable, value));
    }

    public Map<Formula.Var, Formula> formulas() {
        return formulas;
    }

    public Map<Context, List<Item>> contexts() {
        return contexts;
    }

    public Map<String, Standard> standards() {
        return standards;
    }

    public boolean isEmpty() {
        return formulas.isEmpty() && contexts.isEmpty() && standards.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Substitution s && formulas.equals(s.formulas)
                && contexts.equals(s.contexts) && standards.equals(s.standards));
    }

    @Override
    public int hashCode() {
        return Objects.hash(formulas, contexts, standards);
    }

    @Override
    public String toString() {
        return Stream.of(
                        formulas.entrySet().stream().map(e -> e.getKey().toKif() + "=" + e.getValue().toKif()),
                        contexts.entrySet().stream().map(e -> e.getKey().toKif() + "=" + e.getValue().stream().map(Item::toKif).collect(Collectors.joining(" ", "[", "]"))),
                        standards.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue().toKif()))
                .flatMap(s -> s)
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
