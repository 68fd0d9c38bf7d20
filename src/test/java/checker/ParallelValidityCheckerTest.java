package checker;

import com.microsoft.z3.Status;
import kb.PatientRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParallelValidityCheckerTest {

    private final ParallelValidityChecker checker = new ParallelValidityChecker(new PatientRecord(ValidityCheckerTest.TODAY));

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "(= age 72)                      | TRUE",
            "(= age 73)                      | FALSE",
            "(fp< 50.0 (heart-rate 12815))   | TRUE",
            "(= (D \"E11\" 13208) tfu_false) | TRUE",
            "(= (D \"E11\" 13208) tfu_true)  | FALSE"
    })
    void agreesWithTheSequentialCheckerOnDecidedStatements(String statement, Validity expected) {
        ValidityResult result = checker.check(statement);
        assertEquals(expected, result.getVerdict());
        // only the winning query is reported
        assertTrue((result.getOriginal() == null) != (result.getNegated() == null));
    }

    @ParameterizedTest
    @CsvSource({
            "ORIGINAL, UNSATISFIABLE, FALSE",
            "ORIGINAL, SATISFIABLE, TRUE",
            "ORIGINAL, UNKNOWN, UNKNOWN",
            "NEGATED, UNSATISFIABLE, TRUE",
            "NEGATED, SATISFIABLE, FALSE",
            "NEGATED, UNKNOWN, UNKNOWN"
    })
    void verdictFromFirstAnswer(ParallelValidityChecker.Query query, Status status, Validity expected) {
        assertEquals(expected, ParallelValidityChecker.fromFirstAnswer(query, status));
    }

    @Test
    void repeatedRacesLeaveNoStateBehind() {
        for (int i = 0; i < 5; i++) {
            assertEquals(Validity.TRUE, checker.check("(= age 72)").getVerdict());
        }
    }
}
