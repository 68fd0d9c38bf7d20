package checker;

import com.microsoft.z3.Status;
import kb.KnowledgeBase;
import kb.PatientRecord;
import model.ScalarFunction;
import model.ValueSort;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import solver.CompileException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ValidityCheckerTest {

    // age is exactly 72 years on this day
    static final int TODAY = -7305 + 72 * 365;

    static final int FIRST_DIAGNOSIS = 13180;   // 2006-02-01, true
    static final int SECOND_DIAGNOSIS = 13208;  // 2006-03-01, false
    static final int THIRD_DIAGNOSIS = 13239;   // 2006-04-01, true
    static final int DELTA = (SECOND_DIAGNOSIS - FIRST_DIAGNOSIS) / 2;

    private static ValidityChecker checker;

    @BeforeAll
    static void setUp() {
        checker = new ValidityChecker(new PatientRecord(TODAY));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "(= age 72)                                 | TRUE",
            "(= age 73)                                 | FALSE",
            "(fp< 50.0 (heart-rate 12815))              | TRUE",
            "(fp> 50.0 (heart-rate 12815))              | FALSE",
            "(fp< (weight 12815) (weight 13180))        | TRUE",
            "(= (weight 12816) NaN)                     | TRUE",
            "(= name \"Joe Bloggs\")                    | TRUE",
            "(= name \"John Doe\")                      | FALSE",
            "(< birth-date 0)                           | TRUE",
            "(= (D \"I10\" 13180) tfu_true_or_false)    | TRUE",
            "(or true false)                            | TRUE",
            "(and true false)                           | FALSE"
    })
    void decidesStatementsAboutTheRecord(String statement, Validity expected) {
        assertEquals(expected, checker.check(statement).getVerdict());
    }

    static Stream<Arguments> diagnosisHistory() {
        List<Arguments> cases = new ArrayList<>();
        int[][] timesAndTruth = {
                // time, index of the value that holds: 0 tfu_true, 1 tfu_false, 2 tfu_true_or_false
                {FIRST_DIAGNOSIS - DELTA, 2},
                {FIRST_DIAGNOSIS, 0},
                {FIRST_DIAGNOSIS + DELTA, 0},
                {SECOND_DIAGNOSIS, 1},
                {SECOND_DIAGNOSIS + DELTA, 1},
                {THIRD_DIAGNOSIS, 0},
                {THIRD_DIAGNOSIS + DELTA, 0}
        };
        String[] values = {"tfu_true", "tfu_false", "tfu_true_or_false"};
        for (int[] row : timesAndTruth) {
            for (int v = 0; v < values.length; v++) {
                cases.add(Arguments.of(row[0], values[v], v == row[1] ? Validity.TRUE : Validity.FALSE));
            }
        }
        return cases.stream();
    }

    @ParameterizedTest
    @MethodSource("diagnosisHistory")
    void diagnosisPersistsUntilSuperseded(int time, String value, Validity expected) {
        String statement = "(= (D \"E11\" " + time + ") " + value + ")";
        assertEquals(expected, checker.check(statement).getVerdict(), statement);
    }

    @Test
    void unconstrainedStatementFallsBackToTheOriginalBeingSatisfiable() {
        KnowledgeBase free = solver -> {
            new ScalarFunction(solver, "x", ValueSort.FP64, null);
            return Collections.emptyList();
        };
        ValidityResult result = new ValidityChecker(free).check("(fp> x 1.0)");
        assertEquals(Status.SATISFIABLE, result.getOriginal());
        assertEquals(Status.SATISFIABLE, result.getNegated());
        assertEquals(Validity.TRUE, result.getVerdict());
    }

    @Test
    void resultCarriesBothRawAnswers() {
        ValidityResult result = checker.check("(= age 72)");
        assertNotEquals(Status.UNSATISFIABLE, result.getOriginal());
        assertEquals(Status.UNSATISFIABLE, result.getNegated());
        assertNotNull(result.toString());
    }

    @Test
    void compileErrorsPropagate() {
        assertThrows(CompileException.class, () -> checker.check("(frobnicate 1)"));
    }

    @ParameterizedTest
    @CsvSource({
            "SATISFIABLE, UNSATISFIABLE, TRUE",
            "UNKNOWN, UNSATISFIABLE, TRUE",
            "UNSATISFIABLE, UNSATISFIABLE, TRUE",
            "UNSATISFIABLE, SATISFIABLE, FALSE",
            "UNSATISFIABLE, UNKNOWN, FALSE",
            "SATISFIABLE, SATISFIABLE, TRUE",
            "SATISFIABLE, UNKNOWN, TRUE",
            "UNKNOWN, SATISFIABLE, FALSE",
            "UNKNOWN, UNKNOWN, UNKNOWN"
    })
    void precedenceTable(Status original, Status negated, Validity expected) {
        assertEquals(expected, ValidityChecker.combine(original, negated));
    }

    @Test
    void negationWrapsTheStatement() {
        assertEquals("(not (= age 72))", ValidityChecker.negate("  (= age 72) "));
    }
}
