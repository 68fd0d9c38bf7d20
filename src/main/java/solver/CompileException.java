package solver;

/**
 * A statement could not be turned into a solver term.
 */
public class CompileException extends RuntimeException {

    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
