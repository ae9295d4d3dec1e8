package dumb.calculi;

/**
 * Closed set of correction error codes. The hundreds digit names the engine that reports them.
 */
public enum ErrorCode {
    GEN_MALFORMED_FORMULA(101, Category.GEN, "Formula is not well formed"),
    GEN_MALFORMED_INFERENCE(102, Category.GEN, "Inference is not well formed"),

    TBL_PREMISE_NOT_BEGINNING(301, Category.TBL, "Premises must be at the beginning of the tableaux"),
    TBL_INCORRECT_PREMISE(302, Category.TBL, "Node is not a premise or the negation of a conclusion"),
    TBL_RULE_NOT_APPLIED(303, Category.TBL, "Rule was applicable but was not applied"),
    TBL_RULE_INCORRECTLY_APPLIED(304, Category.TBL, "Node was not derived by a correct rule application"),
    TBL_PREMISE_NOT_PRESENT(305, Category.TBL, "Premise not present in the tableaux"),
    TBL_CONCLUSION_NOT_PRESENT(306, Category.TBL, "Conclusion not present in the tableaux"),

    SEQ_INCORRECT_PREMISE(501, Category.SEQ, "Leaf is marked as premise but is not one"),
    SEQ_INCORRECT_AXIOM(502, Category.SEQ, "Leaf is not a premise nor an instance of an axiom"),
    SEQ_RULE_INCORRECTLY_APPLIED(503, Category.SEQ, "Rule incorrectly applied");

    public final int code;
    public final Category category;
    public final String description;

    ErrorCode(int code, Category category, String description) {
        this.code = code;
        this.category = category;
        this.description = description;
    }

    public enum Category {GEN, TBL, SEQ}
}
