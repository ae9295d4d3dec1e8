package dumb.calculi;

import dumb.calculi.Sequent.Context;
import dumb.calculi.Sequent.Item;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * The alphabet of a calculus: atomic symbols, metavariables, connectives with their arities,
 * sentential constants and context placeholders. An infinite language also accepts any of its
 * atomic symbols, metavariables or placeholders followed by digits ({@code p12}, {@code ?A3}).
 */
public final class Language {

    private static final Pattern DIGITS_SUFFIX = Pattern.compile("^(.*?)(\\d+)$");

    public final Set<String> atomics;
    public final Set<String> metavariables;
    public final Map<String, Integer> connectives;
    public final Set<String> constants;
    public final Set<String> contexts;
    public final boolean infinite;

    public Language(Set<String> atomics, Set<String> metavariables, Map<String, Integer> connectives,
                    Set<String> constants, Set<String> contexts, boolean infinite) {
        this.atomics = ordered(atomics);
        this.metavariables = ordered(metavariables);
        this.connectives = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(connectives)));
        this.constants = ordered(constants);
        this.contexts = ordered(contexts);
        this.infinite = infinite;
        connectives.forEach((c, arity) -> {
            if (arity < 1) throw new IllegalArgumentException("Connective " + c + " has arity " + arity);
        });
    }

    private static Set<String> ordered(Set<String> s) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(requireNonNull(s)));
    }

    private boolean declared(String symbol, Set<String> declared) {
        if (declared.contains(symbol)) return true;
        if (!infinite) return false;
        var m = DIGITS_SUFFIX.matcher(symbol);
        return m.matches() && declared.contains(m.group(1));
    }

    public boolean isAtomic(String symbol) {
        return declared(symbol, atomics);
    }

    public boolean isMetavariable(String symbol) {
        return declared(symbol, metavariables);
    }

    public boolean isConstant(String symbol) {
        return constants.contains(symbol);
    }

    public boolean isContext(String symbol) {
        return declared(symbol, contexts);
    }

    public @Nullable Integer arity(String connective) {
        return connectives.get(connective);
    }

    /** True for well formed formulas made of atomics and constants only. */
    public boolean isAtomicFormula(Formula f) {
        return f instanceof Formula.Atom a && (isAtomic(a.symbol()) || isConstant(a.symbol()));
    }

    public boolean isWellFormed(Claim c) {
        return wellFormednessError(c) == null;
    }

    public boolean isWellFormed(Sequent s) {
        return wellFormednessError(s) == null;
    }

    /**
     * @return a description of the first offending subformula, or null when well formed
     */
    public @Nullable String wellFormednessError(Claim claim) {
        if (claim instanceof Inference i) {
            for (var c : i.premises) {
                var e = wellFormednessError(c);
                if (e != null) return e;
            }
            for (var c : i.conclusions) {
                var e = wellFormednessError(c);
                if (e != null) return e;
            }
            return null;
        }
        var f = (Formula) claim;
        if (f instanceof Formula.Atom a)
            return isAtomic(a.symbol()) || isConstant(a.symbol()) ? null : "Unknown atomic symbol " + a.symbol();
        if (f instanceof Formula.Var v)
            return isMetavariable(v.name()) ? null : "Unknown metavariable " + v.name();
        var c = (Formula.Compound) f;
        var arity = arity(c.connective);
        if (arity == null) return "Unknown connective " + c.connective + " in " + c.toKif();
        if (arity != c.arity())
            return "Connective " + c.connective + " takes " + arity + " arguments, " + c.arity() + " given in " + c.toKif();
        for (var a : c.args) {
            var e = wellFormednessError(a);
            if (e != null) return e;
        }
        return null;
    }

    public @Nullable String wellFormednessError(Sequent sequent) {
        for (var side : sequent.sides()) {
            for (Item item : side) {
                if (item instanceof Context c) {
                    if (!isContext(c.name())) return "Unknown context placeholder " + c.name();
                } else {
                    var e = wellFormednessError((Formula) item);
                    if (e != null) return e;
                }
            }
        }
        return null;
    }

    public <C extends Claim> C checkWellFormed(C claim) {
        var e = wellFormednessError(claim);
        if (e != null) throw new NotWellFormedException(e);
        return claim;
    }

    public Sequent checkWellFormed(Sequent sequent) {
        var e = wellFormednessError(sequent);
        if (e != null) throw new NotWellFormedException(e);
        return sequent;
    }

    /** Builder, in declaration order. */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Set<String> atomics = new LinkedHashSet<>();
        private final Set<String> metavariables = new LinkedHashSet<>();
        private final Map<String, Integer> connectives = new LinkedHashMap<>();
        private final Set<String> constants = new LinkedHashSet<>();
        private final Set<String> contexts = new LinkedHashSet<>();
        private boolean infinite;

        public Builder atomics(String... symbols) {
            Collections.addAll(atomics, symbols);
            return this;
        }

        public Builder metavariables(String... symbols) {
            Collections.addAll(metavariables, symbols);
            return this;
        }

        public Builder connective(String symbol, int arity) {
            connectives.put(symbol, arity);
            return this;
        }

        public Builder constants(String... symbols) {
            Collections.addAll(constants, symbols);
            return this;
        }

        public Builder contexts(String... symbols) {
            Collections.addAll(contexts, symbols);
            return this;
        }

        public Builder infinite() {
            infinite = true;
            return this;
        }

        public Language build() {
            return new Language(atomics, metavariables, connectives, constants, contexts, infinite);
        }
    }

    /** A formula, inference or sequent that does not belong to the language. */
    public static class NotWellFormedException extends IllegalArgumentException {
        public NotWellFormedException(String message) {
            super(message);
        }
    }
}
