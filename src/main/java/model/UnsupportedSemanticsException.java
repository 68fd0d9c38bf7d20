package model;

/**
 * Facts whose meaning the axiom generator refuses to guess.
 */
public class UnsupportedSemanticsException extends RuntimeException {

    public UnsupportedSemanticsException(String message) {
        super(message);
    }
}
