package checker;

import com.microsoft.z3.Status;
import kb.KnowledgeBase;
import utils.Log;

/**
 * Decides a statement by checking it and its negation one after the other.
 * <pre>
 *   negation unsat  -> TRUE
 *   statement unsat -> FALSE
 *   statement sat   -> TRUE
 *   negation sat    -> FALSE
 *   otherwise       -> UNKNOWN
 * </pre>
 */
public class ValidityChecker {

    protected final QueryRunner runner;

    public ValidityChecker(KnowledgeBase knowledgeBase) {
        this.runner = new QueryRunner(knowledgeBase);
    }

    public ValidityResult check(String statement) {
        long start = System.currentTimeMillis();
        Status original = runner.run(statement);
        Status negated = runner.run(negate(statement));
        Validity verdict = combine(original, negated);
        Log.info("Verdict " + verdict + " (orig=" + original + ", neg=" + negated + ") for " + statement);
        return new ValidityResult(statement, verdict, original, negated, System.currentTimeMillis() - start);
    }

    public static Validity combine(Status original, Status negated) {
        if (negated == Status.UNSATISFIABLE) {
            return Validity.TRUE;
        }
        if (original == Status.UNSATISFIABLE) {
            return Validity.FALSE;
        }
        if (original == Status.SATISFIABLE) {
            return Validity.TRUE;
        }
        if (negated == Status.SATISFIABLE) {
            return Validity.FALSE;
        }
        return Validity.UNKNOWN;
    }

    public static String negate(String statement) {
        return "(not " + statement.trim() + ")";
    }

    public QueryRunner getRunner() {
        return runner;
    }
}
