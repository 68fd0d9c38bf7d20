package model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Status;
import org.junit.jupiter.api.Test;
import solver.SolverContext;
import solver.TermCompiler;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ClosedWorldTest {

    private static final List<Argument> BY_TIME =
            Collections.singletonList(new Argument(TimeSeriesFunction.TIME_ARG, ValueSort.INTEGER));

    private static Status check(SolverContext solver, List<Fact> facts, String statement) {
        List<BoolExpr> axioms = solver.generateAllAxioms(facts);
        return solver.check(axioms, new TermCompiler(solver).compileStatement(statement));
    }

    @Test
    void unrecordedTimesAreUndefined() {
        try (SolverContext solver = new SolverContext()) {
            TimeSeriesFunction weight = new TimeSeriesFunction(solver, "weight", ValueSort.FP64, null, BY_TIME);
            List<Fact> facts = Arrays.asList(new Fact(weight, 150.0, 12815), new Fact(weight, 155.0, 13180));
            assertEquals(Status.UNSATISFIABLE, check(solver, facts, "(not (= (weight 12816) NaN))"));
        }
    }

    @Test
    void recordedTimesAreDefined() {
        try (SolverContext solver = new SolverContext()) {
            TimeSeriesFunction weight = new TimeSeriesFunction(solver, "weight", ValueSort.FP64, null, BY_TIME);
            List<Fact> facts = Arrays.asList(new Fact(weight, 150.0, 12815));
            assertEquals(Status.UNSATISFIABLE, check(solver, facts, "(= (weight 12815) NaN)"));
        }
    }

    @Test
    void relationWithoutFactsIsUndefinedEverywhere() {
        try (SolverContext solver = new SolverContext()) {
            new TimeSeriesFunction(solver, "weight", ValueSort.FP64, null, BY_TIME);
            assertEquals(Status.UNSATISFIABLE, check(solver, Collections.emptyList(), "(not (= (weight 1) NaN))"));
        }
    }

    @Test
    void booleanRelationIsFalseWhereUnrecorded() {
        try (SolverContext solver = new SolverContext()) {
            TimeSeriesFunction smoker = new TimeSeriesFunction(solver, "smoker", ValueSort.BOOLEAN, null, BY_TIME);
            List<Fact> facts = Arrays.asList(new Fact(smoker, true, 12815));
            assertEquals(Status.UNSATISFIABLE, check(solver, facts, "(smoker 13180)"));
            assertEquals(Status.UNSATISFIABLE, check(solver, facts, "(not (smoker 12815))"));
        }
    }

    @Test
    void conflictingFactsForOneTupleAreRejected() {
        try (SolverContext solver = new SolverContext()) {
            TimeSeriesFunction weight = new TimeSeriesFunction(solver, "weight", ValueSort.FP64, null, BY_TIME);
            List<Fact> facts = Arrays.asList(new Fact(weight, 150.0, 12815), new Fact(weight, 151.0, 12815));
            assertThrows(UnsupportedSemanticsException.class, () -> weight.generateCoreAxioms(facts));
        }
    }

    @Test
    void conflictIsFoundAcrossIntegerAndLongArguments() {
        try (SolverContext solver = new SolverContext()) {
            TimeSeriesFunction weight = new TimeSeriesFunction(solver, "weight", ValueSort.FP64, null, BY_TIME);
            List<Fact> facts = Arrays.asList(new Fact(weight, 150.0, 12815), new Fact(weight, 151.0, 12815L));
            assertThrows(UnsupportedSemanticsException.class, () -> weight.generateCoreAxioms(facts));
            assertThrows(UnsupportedSemanticsException.class, () -> solver.generateAllAxioms(facts));
        }
    }

    @Test
    void equalValuesOfDifferentJavaTypesAreDuplicates() {
        try (SolverContext solver = new SolverContext()) {
            TimeSeriesFunction weight = new TimeSeriesFunction(solver, "weight", ValueSort.FP64, null, BY_TIME);
            List<Fact> facts = Arrays.asList(new Fact(weight, 150, 12815), new Fact(weight, 150.0, 12815L));
            assertEquals(1, weight.generateCoreAxioms(facts).size());
        }
    }

    @Test
    void identicalDuplicatesAreSkipped() {
        try (SolverContext solver = new SolverContext()) {
            TimeSeriesFunction weight = new TimeSeriesFunction(solver, "weight", ValueSort.FP64, null, BY_TIME);
            List<Fact> facts = Arrays.asList(new Fact(weight, 150.0, 12815), new Fact(weight, 150.0, 12815));
            assertEquals(1, weight.generateCoreAxioms(facts).size());
        }
    }

    @Test
    void integerSeriesHasNoUndefinedValue() {
        try (SolverContext solver = new SolverContext()) {
            TimeSeriesFunction steps = new TimeSeriesFunction(solver, "steps", ValueSort.INTEGER, null, BY_TIME);
            List<Fact> facts = Arrays.asList(new Fact(steps, 9000, 12815));
            assertThrows(UnsupportedSemanticsException.class, () -> steps.generateCwaAxioms(facts));
        }
    }
}
