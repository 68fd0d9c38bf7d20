package kb;

import model.Fact;
import model.FunctionKind;
import org.junit.jupiter.api.Test;
import solver.SolverContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PatientRecordTest {

    @Test
    void ageFollowsTheInjectedDay() {
        try (SolverContext solver = new SolverContext()) {
            List<Fact> facts = new PatientRecord(-7305 + 365).generateFacts(solver);
            Fact age = facts.stream().filter(f -> f.getFunction().getName().equals("age")).findFirst().get();
            assertEquals(1.0, age.getResult());
        }
    }

    @Test
    void declaresEveryKindOfFunction() {
        try (SolverContext solver = new SolverContext()) {
            List<Fact> facts = new PatientRecord().generateFacts(solver);
            assertEquals(10, facts.size());
            assertEquals(6, solver.functions().size());
            assertEquals(FunctionKind.INTERPOLATABLE, solver.findFunction(PatientRecord.DIAGNOSIS).get().getKind());
            assertEquals(FunctionKind.TIME_SERIES, solver.findFunction("heart-rate").get().getKind());
            assertTrue(solver.findFunction("birth-date").isPresent());
        }
    }
}
