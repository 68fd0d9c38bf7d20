package service;

import cache.TheoryCache;
import checker.ParallelValidityChecker;
import checker.ValidityChecker;
import checker.ValidityResult;
import kb.KnowledgeBase;
import model.UnsupportedSemanticsException;
import parser.SExprParser;
import solver.CompileException;
import utils.Log;
import utils.TextUtils;

import java.util.Locale;

/**
 * Entry point for callers holding free text: pulls the statement out of a
 * response, checks it, and reports failures as outcomes instead of
 * exceptions.
 */
public class FactChecker {

    public static final String UNABLE_TO_EXTRACT = "unable to extract";

    public enum Outcome {
        TRUE,
        FALSE,
        UNKNOWN,
        UNABLE_TO_EXTRACT,
        UNABLE_TO_EVALUATE
    }

    private final ValidityChecker checker;
    private final TheoryCache theory;

    public FactChecker(KnowledgeBase knowledgeBase, boolean parallel) {
        this.checker = parallel ? new ParallelValidityChecker(knowledgeBase) : new ValidityChecker(knowledgeBase);
        this.theory = new TheoryCache(knowledgeBase);
    }

    /**
     * @param text response that carries the statement in its last
     *             &lt;result&gt;...&lt;/result&gt; span
     */
    public Evaluation evaluateResponse(String text) {
        String statement = TextUtils.extractResult(text);
        if (statement == null || statement.toLowerCase(Locale.ROOT).contains(UNABLE_TO_EXTRACT)) {
            Log.info("No statement in response");
            return new Evaluation(Outcome.UNABLE_TO_EXTRACT, null, null, "no statement found");
        }
        return evaluate(statement);
    }

    public Evaluation evaluate(String statement) {
        String normalized = statement == null ? null : TextUtils.normalizeWs(statement);
        if (!SExprParser.parse(normalized).isPresent()) {
            return new Evaluation(Outcome.UNABLE_TO_EXTRACT, normalized, null, "malformed statement");
        }
        try {
            ValidityResult result = checker.check(normalized);
            return new Evaluation(Outcome.valueOf(result.getVerdict().name()), normalized, result, null);
        } catch (CompileException | UnsupportedSemanticsException e) {
            Log.warn("Cannot evaluate " + normalized + ": " + e.getMessage());
            return new Evaluation(Outcome.UNABLE_TO_EVALUATE, normalized, null, e.getMessage());
        }
    }

    public TheoryCache getTheory() {
        return theory;
    }

    public ValidityChecker getChecker() {
        return checker;
    }

    public static class Evaluation {
        private final Outcome outcome;
        private final String statement;
        private final ValidityResult result;
        private final String message;

        public Evaluation(Outcome outcome, String statement, ValidityResult result, String message) {
            this.outcome = outcome;
            this.statement = statement;
            this.result = result;
            this.message = message;
        }

        public Outcome getOutcome() {
            return outcome;
        }

        public String getStatement() {
            return statement;
        }

        /** Null unless the statement reached the solver. */
        public ValidityResult getResult() {
            return result;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return outcome + (message == null ? "" : " (" + message + ")") + ": " + statement;
        }
    }
}
