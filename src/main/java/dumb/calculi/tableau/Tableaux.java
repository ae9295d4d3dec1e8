package dumb.calculi.tableau;

import dumb.calculi.Configuration;
import dumb.calculi.Formula;
import dumb.calculi.Language;
import dumb.calculi.Languages;

import java.util.ArrayList;
import java.util.List;

import static dumb.calculi.Languages.AND;
import static dumb.calculi.Languages.IFF;
import static dumb.calculi.Languages.IMPLIES;
import static dumb.calculi.Languages.NOT;
import static dumb.calculi.Languages.OR;
import static dumb.calculi.tableau.TableauSystem.rule;

/**
 * Ready-made tableau systems.
 */
public enum Tableaux {
    ;

    static final Formula A = Formula.var("?A");
    static final Formula B = Formula.var("?B");

    static Formula not(Formula f) {
        return Formula.of(NOT, f);
    }

    static Formula and(Formula a, Formula b) {
        return Formula.of(AND, a, b);
    }

    static Formula or(Formula a, Formula b) {
        return Formula.of(OR, a, b);
    }

    static Formula implies(Formula a, Formula b) {
        return Formula.of(IMPLIES, a, b);
    }

    static Formula iff(Formula a, Formula b) {
        return Formula.of(IFF, a, b);
    }

    private static TableauEntry e(Formula f) {
        return TableauEntry.of(f);
    }

    private static TableauEntry e(Formula f, int index) {
        return TableauEntry.of(f, index);
    }

    /** Unindexed classical tableaux: a branch closes on a formula and its negation. */
    public static TableauSystem classical(Configuration config) {
        var rules = List.of(
                rule("R~~", e(not(not(A)))).then(e(A)).build(),
                rule("R∧", e(and(A, B))).then(e(A), e(B)).build(),
                rule("R~∧", e(not(and(A, B)))).branches(List.of(List.of(e(not(A))), List.of(e(not(B))))).build(),
                rule("R∨", e(or(A, B))).branches(List.of(List.of(e(A)), List.of(e(B)))).build(),
                rule("R~∨", e(not(or(A, B)))).then(e(not(A)), e(not(B))).build(),
                rule("R→", e(implies(A, B))).branches(List.of(List.of(e(not(A))), List.of(e(B)))).build(),
                rule("R~→", e(not(implies(A, B)))).then(e(A), e(not(B))).build(),
                rule("R↔", e(iff(A, B))).branches(List.of(List.of(e(A), e(B)), List.of(e(not(A)), e(not(B))))).build(),
                rule("R~↔", e(not(iff(A, B)))).branches(List.of(List.of(e(not(A)), e(B)), List.of(e(A), e(not(B))))).build());
        var closure = List.of(new ClosureRule(e(not(A)), e(A)));
        return new TableauSystem(Languages.CLASSICAL, rules, closure,
                config.fastClosure() ? ClosurePolicy.negation(NOT) : ClosurePolicy.closureRules(),
                StartPolicy.negatedConclusions(NOT), config);
    }

    /** Classical tableaux with nodes signed 1 (true) and 0 (false). */
    public static TableauSystem indexedClassical(Configuration config) {
        var rules = List.of(
                rule("R~1", e(not(A), 1)).then(e(A, 0)).build(),
                rule("R~0", e(not(A), 0)).then(e(A, 1)).build(),
                rule("R∧1", e(and(A, B), 1)).then(e(A, 1), e(B, 1)).build(),
                rule("R∧0", e(and(A, B), 0)).branches(List.of(List.of(e(A, 0)), List.of(e(B, 0)))).build(),
                rule("R∨1", e(or(A, B), 1)).branches(List.of(List.of(e(A, 1)), List.of(e(B, 1)))).build(),
                rule("R∨0", e(or(A, B), 0)).then(e(A, 0), e(B, 0)).build(),
                rule("R→1", e(implies(A, B), 1)).branches(List.of(List.of(e(A, 0)), List.of(e(B, 1)))).build(),
                rule("R→0", e(implies(A, B), 0)).then(e(A, 1), e(B, 0)).build(),
                rule("R↔1", e(iff(A, B), 1)).branches(List.of(List.of(e(A, 1), e(B, 1)), List.of(e(A, 0), e(B, 0)))).build(),
                rule("R↔0", e(iff(A, B), 0)).branches(List.of(List.of(e(A, 1), e(B, 0)), List.of(e(A, 0), e(B, 1)))).build());
        var closure = List.of(new ClosureRule(e(A, 1), e(A, 0)));
        return new TableauSystem(Languages.CLASSICAL, rules, closure,
                config.fastClosure() ? ClosurePolicy.oppositeTruths() : ClosurePolicy.closureRules(),
                StartPolicy.signed(1, 0), config);
    }

    /** First degree entailment: a formula may be both or neither true and false. */
    public static TableauSystem fde(Configuration config) {
        return manyValued(List.of(new ClosureRule(e(A, 0), e(A, 1))), config);
    }

    /** Strong Kleene: FDE without gluts. */
    public static TableauSystem k3(Configuration config) {
        return manyValued(List.of(
                new ClosureRule(e(A, 0), e(A, 1)),
                new ClosureRule(e(A, 1), e(not(A), 1))), config);
    }

    /** Logic of paradox: FDE without gaps. */
    public static TableauSystem lp(Configuration config) {
        return manyValued(List.of(
                new ClosureRule(e(A, 0), e(A, 1)),
                new ClosureRule(e(A, 0), e(not(A), 0))), config);
    }

    private static TableauSystem manyValued(List<ClosureRule> closure, Configuration config) {
        var rules = List.of(
                rule("R~~1", e(not(not(A)), 1)).then(e(A, 1)).build(),
                rule("R~~0", e(not(not(A)), 0)).then(e(A, 0)).build(),
                rule("R∧1", e(and(A, B), 1)).then(e(A, 1), e(B, 1)).build(),
                rule("R∧0", e(and(A, B), 0)).branches(List.of(List.of(e(A, 0)), List.of(e(B, 0)))).build(),
                rule("R~∧1", e(not(and(A, B)), 1)).then(e(or(not(A), not(B)), 1)).build(),
                rule("R~∧0", e(not(and(A, B)), 0)).then(e(or(not(A), not(B)), 0)).build(),
                rule("R∨1", e(or(A, B), 1)).branches(List.of(List.of(e(A, 1)), List.of(e(B, 1)))).build(),
                rule("R∨0", e(or(A, B), 0)).then(e(A, 0), e(B, 0)).build(),
                rule("R~∨1", e(not(or(A, B)), 1)).then(e(and(not(A), not(B)), 1)).build(),
                rule("R~∨0", e(not(or(A, B)), 0)).then(e(and(not(A), not(B)), 0)).build());
        return new TableauSystem(Languages.NEGATION_CONJUNCTION_DISJUNCTION, rules, closure,
                ClosurePolicy.closureRules(), StartPolicy.signed(1, 0), config);
    }

    /**
     * Constructive (formation) trees: one rule per connective, {@code (c ?A1 .. ?An)} branching
     * into its arguments. A branch closes on an atomic well formed formula, so the tree of a
     * formula closes exactly when the formula is well formed.
     */
    public static TableauSystem constructiveTree(Language language, Configuration config) {
        if (!language.infinite || !language.isMetavariable("?A1"))
            throw new IllegalArgumentException("Constructive trees need an infinite language with ?A metavariables");
        var rules = new ArrayList<SchematicRule>();
        language.connectives.forEach((connective, arity) -> {
            var args = new ArrayList<Formula>(arity);
            var branches = new ArrayList<List<TableauEntry>>(arity);
            for (var i = 1; i <= arity; i++) {
                var v = Formula.var("?A" + i);
                args.add(v);
                branches.add(List.of(e(v)));
            }
            rules.add(rule("R" + connective, e(new Formula.Compound(connective, args))).branches(branches).build());
        });
        return new TableauSystem(language, rules, List.of(), ClosurePolicy.atomic(),
                StartPolicy.negatedConclusions(NOT), config);
    }
}
