package dumb.calculi;

/**
 * Something a tableau node or an inference can hold: a formula (level 0) or an
 * inference (level 1 and above).
 */
public sealed interface Claim permits Formula, Inference {

    int level();

    String toKif();
}
