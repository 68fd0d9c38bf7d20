package checker;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import kb.KnowledgeBase;
import model.Fact;
import solver.SolverContext;
import solver.TermCompiler;
import solver.TermPrinter;
import utils.Log;

import java.util.List;

/**
 * One satisfiability query: facts, axioms and a statement in a context of
 * their own. Compile and semantic errors propagate; engine failures become
 * {@link Status#UNKNOWN}.
 */
public class QueryRunner {

    private final KnowledgeBase knowledgeBase;

    public QueryRunner(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    public Status run(String statement) {
        return run(statement, new QueryHandle());
    }

    public Status run(String statement, QueryHandle handle) {
        long start = System.currentTimeMillis();
        try (SolverContext solver = new SolverContext()) {
            handle.attach(solver);
            try {
                List<Fact> facts = knowledgeBase.generateFacts(solver);
                if (Log.isDebugEnabled()) {
                    for (String sentence : solver.factsAsNaturalLanguage(facts)) {
                        Log.debug("Fact> " + sentence);
                    }
                }
                List<BoolExpr> axioms = solver.generateAllAxioms(facts);
                if (Log.isDebugEnabled()) {
                    for (BoolExpr axiom : axioms) {
                        Log.debug("Axiom> " + TermPrinter.print(solver, axiom));
                    }
                }
                BoolExpr compiled = new TermCompiler(solver).compileStatement(statement);
                Log.info("Checking " + TermPrinter.print(solver, compiled, Integer.MAX_VALUE));
                return solver.check(axioms, compiled);
            } catch (Z3Exception e) {
                if (handle.isCancelled()) {
                    Log.debug("Query cancelled: " + statement);
                } else {
                    Log.error("Engine failure on " + statement + ": " + e.getMessage());
                }
                return Status.UNKNOWN;
            } catch (RuntimeException e) {
                // an interrupted context can leave terms half-built
                if (!handle.isCancelled()) {
                    throw e;
                }
                Log.debug("Query cancelled: " + statement + " (" + e + ")");
                return Status.UNKNOWN;
            } finally {
                handle.detach();
            }
        } finally {
            Log.printTime("Query " + statement, start);
        }
    }

    public KnowledgeBase getKnowledgeBase() {
        return knowledgeBase;
    }
}
