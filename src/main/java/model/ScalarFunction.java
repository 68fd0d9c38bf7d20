package model;

import com.microsoft.z3.BoolExpr;
import solver.SolverContext;
import utils.EpochalDays;

import java.util.Collections;
import java.util.List;

/**
 * Zero-argument constant. Fully determined by its facts, so no closed-world axiom.
 */
public class ScalarFunction extends Function {

    public ScalarFunction(SolverContext solver, String name, ValueSort returnSort, Units units) {
        super(solver, name, returnSort, units, Collections.emptyList());
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.SCALAR;
    }

    @Override
    public String asNaturalLanguage(Fact fact) {
        String value;
        if (getUnits() != null && getUnits().isEpochalDay()) {
            value = EpochalDays.toDateString(((Number) fact.getResult()).longValue());
        } else {
            value = withUnits(fact.getResult());
        }
        return SUBJECT + "'s " + getDisplayName() + " is " + value;
    }

    @Override
    public List<BoolExpr> generateCwaAxioms(List<Fact> facts) {
        return Collections.emptyList();
    }
}
