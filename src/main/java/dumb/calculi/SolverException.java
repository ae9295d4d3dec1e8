package dumb.calculi;

/**
 * A solver gave up: the depth bound was reached, or every rule and substitution failed.
 */
public class SolverException extends Exception {

    public SolverException(String message) {
        super(message);
    }
}
