package checker;

import solver.SolverContext;

/**
 * Lets another thread cancel a query whose context may not exist yet.
 */
public class QueryHandle {
    private SolverContext context;
    private boolean cancelled = false;

    synchronized void attach(SolverContext context) {
        this.context = context;
        if (cancelled) {
            context.interrupt();
        }
    }

    synchronized void detach() {
        this.context = null;
    }

    public synchronized void cancel() {
        cancelled = true;
        if (context != null) {
            context.interrupt();
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }
}
