package checker;

/**
 * Verdict on a statement against the knowledge base.
 */
public enum Validity {
    TRUE,
    FALSE,
    UNKNOWN
}
