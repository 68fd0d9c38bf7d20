package checker;

import com.microsoft.z3.Status;
import init.Config;
import kb.KnowledgeBase;
import utils.Log;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Races the statement against its negation on two threads, each with a
 * private context. The first answer decides; the other query is interrupted
 * and left to wind down on its own.
 */
public class ParallelValidityChecker extends ValidityChecker {

    private static final AtomicInteger THREAD_ID = new AtomicInteger();

    public enum Query {
        ORIGINAL,
        NEGATED
    }

    public ParallelValidityChecker(KnowledgeBase knowledgeBase) {
        super(knowledgeBase);
    }

    @Override
    public ValidityResult check(String statement) {
        long start = System.currentTimeMillis();
        ExecutorService executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "validity-worker-" + THREAD_ID.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CompletionService<Answer> completion = new ExecutorCompletionService<>(executor);
        QueryHandle originalHandle = new QueryHandle();
        QueryHandle negatedHandle = new QueryHandle();
        completion.submit(task(Query.ORIGINAL, statement, originalHandle));
        completion.submit(task(Query.NEGATED, negate(statement), negatedHandle));
        executor.shutdown();

        Answer first = null;
        try {
            Future<Answer> done = completion.poll(Config.parallelTimeoutSeconds, TimeUnit.SECONDS);
            if (done == null) {
                Log.warn("No answer within " + Config.parallelTimeoutSeconds + "s for " + statement);
            } else {
                first = done.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Log.warn("Interrupted while waiting for " + statement);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Query failed for " + statement, cause);
        } finally {
            originalHandle.cancel();
            negatedHandle.cancel();
        }

        Validity verdict = first == null ? Validity.UNKNOWN : fromFirstAnswer(first.query, first.status);
        Status original = first != null && first.query == Query.ORIGINAL ? first.status : null;
        Status negated = first != null && first.query == Query.NEGATED ? first.status : null;
        Log.info("Verdict " + verdict + " (first answer " + first + ") for " + statement);
        return new ValidityResult(statement, verdict, original, negated, System.currentTimeMillis() - start);
    }

    private Callable<Answer> task(Query query, String statement, QueryHandle handle) {
        return () -> new Answer(query, runner.run(statement, handle));
    }

    public static Validity fromFirstAnswer(Query query, Status status) {
        if (status == Status.UNSATISFIABLE) {
            return query == Query.ORIGINAL ? Validity.FALSE : Validity.TRUE;
        }
        if (status == Status.SATISFIABLE) {
            return query == Query.ORIGINAL ? Validity.TRUE : Validity.FALSE;
        }
        return Validity.UNKNOWN;
    }

    private static class Answer {
        final Query query;
        final Status status;

        Answer(Query query, Status status) {
            this.query = query;
            this.status = status;
        }

        @Override
        public String toString() {
            return query + "=" + status;
        }
    }
}
