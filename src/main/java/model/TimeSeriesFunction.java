package model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import solver.SolverContext;
import utils.EpochalDays;
import utils.Log;
import utils.TextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Relation with arguments whose value is undefined wherever no fact records it.
 * An argument named "time" is phrased as the date of the observation.
 */
public class TimeSeriesFunction extends Function {

    public static final String TIME_ARG = "time";

    public TimeSeriesFunction(SolverContext solver, String name, ValueSort returnSort, Units units, List<Argument> args) {
        super(solver, name, returnSort, units, args);
        if (args.isEmpty()) {
            throw new IllegalArgumentException(name + ": a time series needs at least one argument");
        }
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.TIME_SERIES;
    }

    @Override
    public String asNaturalLanguage(Fact fact) {
        List<String> described = new ArrayList<>();
        String on = "";
        for (int i = 0; i < getArity(); i++) {
            Argument arg = getArgs().get(i);
            if (TIME_ARG.equals(arg.getName())) {
                on = " on " + EpochalDays.toDateString(((Number) fact.getArg(i)).longValue());
            } else {
                described.add(arg.getName() + " " + fact.getArg(i));
            }
        }
        String at = described.isEmpty() ? "" : " at " + TextUtils.joinFancy(described);
        return SUBJECT + "'s " + getDisplayName() + at + " was " + withUnits(fact.getResult()) + on;
    }

    /**
     * forall formals . (no fact matches formals) = (F(formals) = undefined)
     */
    @Override
    public List<BoolExpr> generateCwaAxioms(List<Fact> facts) {
        List<Fact> relevant = relevantFacts(facts);
        Expr[] formals = new Expr[getArity()];
        for (int i = 0; i < formals.length; i++) {
            Argument arg = getArgs().get(i);
            formals[i] = solver.mkVar(arg.getName(), arg.getSort());
        }

        List<BoolExpr> noMatch = new ArrayList<>();
        for (Fact fact : relevant) {
            Expr[] actuals = argumentTerms(fact);
            List<BoolExpr> sameTuple = new ArrayList<>();
            for (int i = 0; i < formals.length; i++) {
                sameTuple.add(solver.eq(formals[i], actuals[i]));
            }
            noMatch.add(solver.not(solver.and(sameTuple)));
        }
        BoolExpr notDefined = solver.and(noMatch);

        Expr application = solver.apply(this, formals);
        BoolExpr body;
        if (getReturnSort() == ValueSort.BOOLEAN) {
            body = solver.implies(notDefined, solver.not(application));
        } else {
            body = solver.eq(notDefined, solver.eq(application, solver.undefinedFor(getReturnSort())));
        }
        BoolExpr axiom = solver.forall(formals, body, null);
        Log.debug("CWA axiom for " + getName() + " over " + relevant.size() + " fact(s)");
        return Collections.singletonList(axiom);
    }
}
