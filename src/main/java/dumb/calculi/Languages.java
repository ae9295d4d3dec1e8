package dumb.calculi;

/**
 * Propositional languages in KIF notation: {@code not}, {@code and}, {@code or}, {@code =>}
 * and {@code <=>}, letters {@code p} to {@code t}, metavariables {@code ?A} to {@code ?E} and
 * placeholders {@code @Gamma} and friends, all extensible with digit suffixes.
 */
public enum Languages {
    ;

    public static final String NOT = "not";
    public static final String AND = "and";
    public static final String OR = "or";
    public static final String IMPLIES = "=>";
    public static final String IFF = "<=>";

    public static final String[] CONTEXTS = {"@Gamma", "@Delta", "@Sigma", "@Lambda", "@Pi", "@Theta"};

    /** Full classical propositional language. */
    public static final Language CLASSICAL = base()
            .connective(NOT, 1)
            .connective(AND, 2)
            .connective(OR, 2)
            .connective(IMPLIES, 2)
            .connective(IFF, 2)
            .build();

    /** Negation, conjunction and disjunction only. */
    public static final Language NEGATION_CONJUNCTION_DISJUNCTION = base()
            .connective(NOT, 1)
            .connective(AND, 2)
            .connective(OR, 2)
            .build();

    private static Language.Builder base() {
        return Language.builder()
                .atomics("p", "q", "r", "s", "t")
                .metavariables("?A", "?B", "?C", "?D", "?E")
                .constants("true", "false")
                .contexts(CONTEXTS)
                .infinite();
    }
}
