package dumb.calculi.kif;

import dumb.calculi.Claim;
import dumb.calculi.Formula;
import dumb.calculi.Inference;
import dumb.calculi.Sequent;
import dumb.calculi.tableau.Standard;
import dumb.calculi.kif.KifParser.ParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * KIF notation for formulas, inferences, sequents and standards.
 * <pre>
 *   p  ?A  @Gamma  (not p)  (=&gt; p (and q r))
 *   (inference (p (=&gt; p q)) (q))          (inference () () 2)
 *   (sequent (@Gamma ?A) (?A @Delta))
 *   (values 1 i)  (pair (values 1) (values 1 i))  (var X)  (bar (values 1))
 * </pre>
 * The printing direction is {@code toKif()} on each value.
 */
public enum Notation {
    ;

    public static final String INFERENCE = "inference";
    public static final String SEQUENT = "sequent";

    private static final Set<String> RESERVED = Set.of(INFERENCE, SEQUENT);

    public static Formula formula(String kif) throws ParseException {
        return formula(KifParser.parseOne(kif));
    }

    public static Inference inference(String kif) throws ParseException {
        return inference(KifParser.parseOne(kif));
    }

    /** A formula, or an inference when the expression starts with {@value #INFERENCE}. */
    public static Claim claim(String kif) throws ParseException {
        return claim(KifParser.parseOne(kif));
    }

    public static Sequent sequent(String kif) throws ParseException {
        return sequent(KifParser.parseOne(kif));
    }

    public static Standard standard(String kif) throws ParseException {
        return standard(KifParser.parseOne(kif));
    }

    public static Claim claim(Sexp x) throws ParseException {
        return x instanceof Sexp.Lst l && INFERENCE.equals(l.op()) ? inference(x) : formula(x);
    }

    public static Formula formula(Sexp x) throws ParseException {
        if (x instanceof Sexp.Symbol s) {
            var name = s.name();
            if (name.startsWith("@"))
                throw new ParseException("Context placeholder " + name + " is not a formula");
            return name.startsWith("?") ? Formula.var(name) : Formula.atom(name);
        }
        var l = (Sexp.Lst) x;
        var op = l.op();
        if (op == null) throw new ParseException("Expected a connective first in " + l.toKif());
        if (RESERVED.contains(op)) throw new ParseException("Expected a formula, found " + l.toKif());
        if (l.size() < 2) throw new ParseException("Connective " + op + " without arguments in " + l.toKif());
        var args = new ArrayList<Formula>(l.size() - 1);
        for (var i = 1; i < l.size(); i++) args.add(formula(l.get(i)));
        return new Formula.Compound(op, args);
    }

    public static Inference inference(Sexp x) throws ParseException {
        if (!(x instanceof Sexp.Lst l) || !INFERENCE.equals(l.op()) || l.size() < 3 || l.size() > 4)
            throw new ParseException("Expected (inference (premises) (conclusions) [level]), found " + x.toKif());
        var premises = claims(l.get(1));
        var conclusions = claims(l.get(2));
        Integer level = null;
        if (l.size() == 4) {
            if (!(l.get(3) instanceof Sexp.Symbol s) || !s.name().matches("\\d+"))
                throw new ParseException("Inference level must be a number, found " + l.get(3).toKif());
            level = Integer.parseInt(s.name());
        }
        try {
            return new Inference(premises, conclusions, level);
        } catch (Inference.IncorrectLevelsException e) {
            throw new ParseException(e.getMessage(), x.toKif());
        }
    }

    private static List<Claim> claims(Sexp x) throws ParseException {
        if (!(x instanceof Sexp.Lst l))
            throw new ParseException("Expected a list of formulas or inferences, found " + x.toKif());
        var out = new ArrayList<Claim>(l.size());
        for (var item : l.items()) out.add(claim(item));
        return out;
    }

    public static Sequent sequent(Sexp x) throws ParseException {
        if (!(x instanceof Sexp.Lst l) || !SEQUENT.equals(l.op()) || l.size() < 3)
            throw new ParseException("Expected (sequent (side) (side) ...), found " + x.toKif());
        var sides = new ArrayList<List<Sequent.Item>>();
        for (var i = 1; i < l.size(); i++) {
            if (!(l.get(i) instanceof Sexp.Lst side))
                throw new ParseException("Sequent sides are lists, found " + l.get(i).toKif());
            var items = new ArrayList<Sequent.Item>(side.size());
            for (var item : side.items())
                items.add(item instanceof Sexp.Symbol s && s.name().startsWith("@")
                        ? new Sequent.Context(s.name())
                        : formula(item));
            sides.add(items);
        }
        return new Sequent(sides);
    }

    public static Standard standard(Sexp x) throws ParseException {
        if (!(x instanceof Sexp.Lst l) || l.op() == null)
            throw new ParseException("Expected a standard, found " + x.toKif());
        switch (l.op()) {
            case "bar" -> {
                if (l.size() != 2) throw new ParseException("bar takes one standard: " + l.toKif());
                var inner = standard(l.get(1));
                if (inner.bar()) throw new ParseException("Standard barred twice: " + l.toKif());
                return inner.barred();
            }
            case "values" -> {
                var values = new ArrayList<String>();
                for (var i = 1; i < l.size(); i++) {
                    if (!(l.get(i) instanceof Sexp.Symbol s))
                        throw new ParseException("Values are symbols, found " + l.get(i).toKif());
                    values.add(s.name());
                }
                return new Standard.Values(Set.copyOf(values), false);
            }
            case "pair" -> {
                if (l.size() != 3) throw new ParseException("pair takes two standards: " + l.toKif());
                return Standard.pair(standard(l.get(1)), standard(l.get(2)));
            }
            case "var" -> {
                if (l.size() != 2 || !(l.get(1) instanceof Sexp.Symbol s))
                    throw new ParseException("var takes a name: " + l.toKif());
                return Standard.var(s.name());
            }
            default -> throw new ParseException("Unknown standard " + l.op() + " in " + l.toKif());
        }
    }
}
