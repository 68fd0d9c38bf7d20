package checker;

import com.microsoft.z3.Status;

/**
 * Verdict plus the raw engine answers it was derived from. A query that was
 * never answered (the losing side of a parallel race) has a null status.
 */
public class ValidityResult {
    private final String statement;
    private final Validity verdict;
    private final Status original;
    private final Status negated;
    private final long time;

    public ValidityResult(String statement, Validity verdict, Status original, Status negated, long time) {
        this.statement = statement;
        this.verdict = verdict;
        this.original = original;
        this.negated = negated;
        this.time = time;
    }

    public String getStatement() {
        return statement;
    }

    public Validity getVerdict() {
        return verdict;
    }

    public Status getOriginal() {
        return original;
    }

    public Status getNegated() {
        return negated;
    }

    /** Wall time in ms. */
    public long getTime() {
        return time;
    }

    @Override
    public String toString() {
        return verdict + " (orig=" + original + ", neg=" + negated + ") " + statement;
    }
}
