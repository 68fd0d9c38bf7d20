package solver;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FPNum;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Status;
import model.ScalarFunction;
import model.Tfu;
import model.UnsupportedSemanticsException;
import model.ValueSort;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SolverContextTest {

    @Test
    void untypedLiteralsFollowTheirSpelling() {
        try (SolverContext solver = new SolverContext()) {
            Expr dotted = solver.convertLiteral("72.5", null);
            assertTrue(dotted instanceof FPNum);
            assertEquals(72.5, Fp64Codec.decode((FPNum) dotted));

            Expr integral = solver.convertLiteral("72", null);
            assertTrue(integral instanceof IntNum);
            assertEquals(72, ((IntNum) integral).getInt());

            assertTrue(solver.convertLiteral("TRUE", null).isTrue());
            assertSame(solver.tfu(Tfu.UNKNOWN), solver.convertLiteral("tfu_true_or_false", null));
        }
    }

    @Test
    void declaredSortWinsOverSpelling() {
        try (SolverContext solver = new SolverContext()) {
            Expr fp = solver.convertLiteral("72", ValueSort.FP64);
            assertEquals(72.0, Fp64Codec.decode((FPNum) fp));
            Expr text = solver.convertLiteral("true", ValueSort.STRING);
            assertTrue(text.isString());
            assertEquals("true", text.getString());
        }
    }

    @Test
    void unconvertibleLiteralIsACompileError() {
        try (SolverContext solver = new SolverContext()) {
            assertThrows(CompileException.class, () -> solver.convertLiteral("seventy", null));
            assertThrows(CompileException.class, () -> solver.convertLiteral("72.5", ValueSort.INTEGER));
        }
    }

    @Test
    void integersHaveNoUndefinedValue() {
        try (SolverContext solver = new SolverContext()) {
            assertThrows(UnsupportedSemanticsException.class, () -> solver.undefinedFor(ValueSort.INTEGER));
            assertSame(solver.tfu(Tfu.UNKNOWN), solver.undefinedFor(ValueSort.TFU));
            assertEquals(SolverContext.UNDEFINED_STRING, solver.undefinedFor(ValueSort.STRING).getString());
        }
    }

    @Test
    void functionNamesAreUnique() {
        try (SolverContext solver = new SolverContext()) {
            new ScalarFunction(solver, "age", ValueSort.FP64, null);
            assertTrue(solver.findFunction("age").isPresent());
            assertThrows(IllegalArgumentException.class, () -> new ScalarFunction(solver, "age", ValueSort.FP64, null));
        }
    }

    @Test
    void arityIsChecked() {
        try (SolverContext solver = new SolverContext()) {
            Expr one = solver.mkInt(1);
            assertThrows(CompileException.class, () -> solver.mkTerm(TermKind.NOT, one, one));
            assertThrows(CompileException.class, () -> solver.mkTerm(TermKind.LT, one));
        }
    }

    @Test
    void structuralEqualityHoldsForNaN() {
        try (SolverContext solver = new SolverContext()) {
            BoolExpr same = solver.eq(solver.mkNaN(), solver.mkNaN());
            BoolExpr fpSame = solver.fpEq(solver.mkNaN(), solver.mkNaN());
            assertEquals(Status.SATISFIABLE, solver.check(Collections.emptyList(), same));
            assertEquals(Status.UNSATISFIABLE, solver.check(Collections.emptyList(), fpSame));
        }
    }

    @Test
    void closeClearsRegistriesAndIgnoresLateInterrupts() {
        SolverContext solver = new SolverContext();
        new ScalarFunction(solver, "age", ValueSort.FP64, null);
        solver.mkInt(3);
        solver.close();
        assertTrue(solver.isClosed());
        assertFalse(solver.findFunction("age").isPresent());
        assertEquals(0, solver.termCount());
        solver.interrupt();
        solver.close();
    }

    @Test
    void interruptedContextSkipsTheCheck() {
        try (SolverContext solver = new SolverContext()) {
            solver.interrupt();
            assertEquals(Status.UNKNOWN, solver.check(Collections.emptyList(), solver.mkBool(true)));
        }
    }
}
