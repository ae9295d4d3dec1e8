package dumb.calculi.sequent;

import dumb.calculi.Configuration;
import dumb.calculi.Language;
import dumb.calculi.Languages;
import dumb.calculi.Sequent;
import dumb.calculi.kif.KifParser.ParseException;
import dumb.calculi.kif.Notation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ready-made sequent calculi for classical logic, two-sided.
 */
public enum Sequents {
    ;

    public static final Sequent IDENTITY = seq("(sequent (?A) (?A))");

    static final Map<Integer, String> WEAKENING = Map.of(0, "WL", 1, "WR");

    static Sequent seq(String kif) {
        try {
            return Notation.sequent(kif);
        } catch (ParseException e) {
            throw new IllegalStateException("Built-in sequent does not parse: " + kif, e);
        }
    }

    static SequentRule rule(String name, String conclusion, String... premises) {
        var p = new ArrayList<Sequent>(premises.length);
        for (var s : premises) p.add(seq(s));
        return new SequentRule(name, seq(conclusion), p);
    }

    private static List<SequentRule> lkRules(boolean cut) {
        var rules = new ArrayList<SequentRule>();
        rules.add(rule("EL", "(sequent (@Gamma @Lambda @Sigma @Delta) (@Pi))",
                "(sequent (@Gamma @Sigma @Lambda @Delta) (@Pi))"));
        rules.add(rule("ER", "(sequent (@Gamma) (@Delta @Lambda @Sigma @Pi))",
                "(sequent (@Gamma) (@Delta @Sigma @Lambda @Pi))"));
        rules.add(rule("WL", "(sequent (@Pi @Gamma) (@Delta))", "(sequent (@Gamma) (@Delta))"));
        rules.add(rule("WR", "(sequent (@Gamma) (@Delta @Pi))", "(sequent (@Gamma) (@Delta))"));
        rules.add(rule("CL", "(sequent (@Pi @Gamma) (@Delta))", "(sequent (@Pi @Pi @Gamma) (@Delta))"));
        rules.add(rule("CR", "(sequent (@Gamma) (@Delta @Pi))", "(sequent (@Gamma) (@Delta @Pi @Pi))"));
        if (cut)
            rules.add(rule("Cut", "(sequent (@Gamma @Pi) (@Delta @Sigma))",
                    "(sequent (@Gamma) (@Delta ?A))", "(sequent (?A @Pi) (@Sigma))"));
        rules.add(rule("~L", "(sequent ((not ?A) @Gamma) (@Delta))", "(sequent (@Gamma) (@Delta ?A))"));
        rules.add(rule("~R", "(sequent (@Gamma) (@Delta (not ?A)))", "(sequent (?A @Gamma) (@Delta))"));
        rules.add(rule("∧L1", "(sequent ((and ?A ?B) @Gamma) (@Delta))", "(sequent (?A @Gamma) (@Delta))"));
        rules.add(rule("∧L2", "(sequent ((and ?A ?B) @Gamma) (@Delta))", "(sequent (?B @Gamma) (@Delta))"));
        rules.add(rule("∧R", "(sequent (@Gamma) (@Delta (and ?A ?B)))",
                "(sequent (@Gamma) (@Delta ?A))", "(sequent (@Gamma) (@Delta ?B))"));
        rules.add(rule("∨L", "(sequent ((or ?A ?B) @Gamma) (@Delta))",
                "(sequent (?A @Gamma) (@Delta))", "(sequent (?B @Gamma) (@Delta))"));
        rules.add(rule("∨R1", "(sequent (@Gamma) (@Delta (or ?A ?B)))", "(sequent (@Gamma) (@Delta ?A))"));
        rules.add(rule("∨R2", "(sequent (@Gamma) (@Delta (or ?A ?B)))", "(sequent (@Gamma) (@Delta ?B))"));
        rules.add(rule("→L", "(sequent ((=> ?A ?B) @Gamma @Pi) (@Delta @Sigma))",
                "(sequent (@Gamma) (@Delta ?A))", "(sequent (?B @Pi) (@Sigma))"));
        rules.add(rule("→R", "(sequent (@Gamma) (@Delta (=> ?A ?B)))", "(sequent (?A @Gamma) (@Delta ?B))"));
        return rules;
    }

    /** Gentzen's LK with exchange, weakening, contraction and cut over placeholders. */
    public static SequentCalculus lk(Configuration config) {
        return new SequentCalculus(Languages.CLASSICAL, Map.of(SequentCalculus.IDENTITY, IDENTITY), lkRules(true),
                List.of(), WEAKENING, config);
    }

    public static SequentCalculus lk() {
        return lk(Configuration.load());
    }

    /** LK without cut, with a solver order that tries the logical rules first. */
    public static SequentCalculus lkMin(Configuration config) {
        return new SequentCalculus(Languages.CLASSICAL, Map.of(SequentCalculus.IDENTITY, IDENTITY), lkRules(false),
                List.of("~L", "~R", "∧L1", "∧L2", "∧R", "∨L", "∨R1", "∨R2", "WL", "WR", "CL", "CR", "EL", "ER"),
                WEAKENING, config);
    }

    /** LKmin, reducing with at most three occurrences of anything per side. */
    public static SequentCalculus lkMin() {
        return lkMin(Configuration.load().withMaxApparitionsPerSide(3));
    }

    /**
     * LKmin with exchange admissible: weakening, contraction and the logical rules act anywhere
     * inside a side, and the multiplicative conjunction-left and disjunction-right rules make
     * contraction unnecessary for the reducer.
     */
    public static SequentCalculus lkMinEA(Configuration config) {
        var rules = List.of(
                rule("WL", "(sequent (@Gamma @Lambda @Delta) (@Sigma))", "(sequent (@Gamma @Delta) (@Sigma))"),
                rule("WR", "(sequent (@Gamma) (@Pi @Lambda @Sigma))", "(sequent (@Gamma) (@Pi @Sigma))"),
                rule("CL1", "(sequent (@Gamma @Lambda @Delta @Pi) (@Sigma))",
                        "(sequent (@Gamma @Lambda @Delta @Lambda @Pi) (@Sigma))"),
                rule("CL2", "(sequent (@Gamma @Delta @Lambda @Pi) (@Sigma))",
                        "(sequent (@Gamma @Lambda @Delta @Lambda @Pi) (@Sigma))"),
                rule("CR1", "(sequent (@Gamma) (@Delta @Lambda @Pi @Sigma))",
                        "(sequent (@Gamma) (@Delta @Lambda @Pi @Lambda @Sigma))"),
                rule("CR2", "(sequent (@Gamma) (@Delta @Pi @Lambda @Sigma))",
                        "(sequent (@Gamma) (@Delta @Lambda @Pi @Lambda @Sigma))"),
                rule("~L", "(sequent (@Gamma (not ?A) @Delta) (@Pi @Sigma))", "(sequent (@Gamma @Delta) (@Pi ?A @Sigma))"),
                rule("~R", "(sequent (@Gamma @Delta) (@Pi (not ?A) @Sigma))", "(sequent (@Gamma ?A @Delta) (@Pi @Sigma))"),
                rule("∧L1", "(sequent (@Gamma (and ?A ?B) @Delta @Pi) (@Sigma))",
                        "(sequent (@Gamma ?A @Delta ?B @Pi) (@Sigma))"),
                rule("∧L2", "(sequent (@Gamma @Delta (and ?A ?B) @Pi) (@Sigma))",
                        "(sequent (@Gamma ?A @Delta ?B @Pi) (@Sigma))"),
                rule("∧R", "(sequent (@Gamma) (@Delta (and ?A ?B) @Pi))",
                        "(sequent (@Gamma) (@Delta ?A @Pi))", "(sequent (@Gamma) (@Delta ?B @Pi))"),
                rule("∨L", "(sequent (@Gamma (or ?A ?B) @Delta) (@Pi))",
                        "(sequent (@Gamma ?A @Delta) (@Pi))", "(sequent (@Gamma ?B @Delta) (@Pi))"),
                rule("∨R1", "(sequent (@Gamma) (@Delta (or ?A ?B) @Pi @Sigma))",
                        "(sequent (@Gamma) (@Delta ?A @Pi ?B @Sigma))"),
                rule("∨R2", "(sequent (@Gamma) (@Delta @Pi (or ?A ?B) @Sigma))",
                        "(sequent (@Gamma) (@Delta ?A @Pi ?B @Sigma))"));
        return new SequentCalculus(Languages.NEGATION_CONJUNCTION_DISJUNCTION, Map.of(SequentCalculus.IDENTITY, IDENTITY),
                rules, List.of("~L", "~R", "∧L1", "∧L2", "∧R", "∨L", "∨R1", "∨R2"), WEAKENING, config);
    }

    /** LKminEA reducing with smart weakening. */
    public static SequentCalculus lkMinEA() {
        return lkMinEA(Configuration.load().withSmartWeakening(true));
    }

    /** A calculus over any language, for rules written by the caller. */
    public static SequentCalculus of(Language language, List<SequentRule> rules, List<String> solverRuleOrder,
                                     Configuration config) {
        return new SequentCalculus(language, Map.of(SequentCalculus.IDENTITY, IDENTITY), rules, solverRuleOrder,
                Map.of(), config);
    }
}
