package kb;

import model.Fact;
import solver.SolverContext;

import java.util.List;

/**
 * Source of the ground facts a statement is checked against. Implementations
 * declare their functions in the given context every time, since each query
 * runs in a fresh context.
 */
public interface KnowledgeBase {

    List<Fact> generateFacts(SolverContext solver);
}
