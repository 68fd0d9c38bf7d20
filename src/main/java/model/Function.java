package model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import solver.SolverContext;
import utils.Log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A relation of the knowledge base. Declared in, and owned by, one
 * {@link SolverContext}; subclasses decide how facts are phrased and which
 * closed-world axioms they produce.
 */
public abstract class Function {

    protected static final String SUBJECT = "The patient";

    protected final SolverContext solver;
    private final String name;
    private final List<Argument> args;
    private final ValueSort returnSort;
    private final Units units;
    private final FuncDecl decl;

    protected Function(SolverContext solver, String name, ValueSort returnSort, Units units, List<Argument> args) {
        this.solver = Objects.requireNonNull(solver);
        this.name = Objects.requireNonNull(name);
        this.returnSort = Objects.requireNonNull(returnSort);
        this.units = units;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        Sort[] domain = new Sort[this.args.size()];
        for (int i = 0; i < domain.length; i++) {
            domain[i] = solver.sortOf(this.args.get(i).getSort());
        }
        this.decl = solver.getContext().mkFuncDecl(name, domain, solver.sortOf(returnSort));
        solver.register(this);
    }

    public abstract FunctionKind getKind();

    public abstract String asNaturalLanguage(Fact fact);

    public abstract List<BoolExpr> generateCwaAxioms(List<Fact> facts);

    /**
     * F(args) = result for every fact of this function.
     */
    public List<BoolExpr> generateCoreAxioms(List<Fact> facts) {
        List<BoolExpr> axioms = new ArrayList<>();
        // keyed on engine terms: 12815 and 12815L, or 150 and 150.0, are the same value
        Map<List<Expr>, Expr> seen = new HashMap<>();
        for (Fact fact : relevantFacts(facts)) {
            Expr[] argTerms = argumentTerms(fact);
            Expr resultTerm = solver.convertLiteral(fact.getResult(), returnSort);
            Expr previous = seen.putIfAbsent(Arrays.asList(argTerms), resultTerm);
            if (previous != null) {
                if (!previous.equals(resultTerm)) {
                    throw new UnsupportedSemanticsException("Conflicting facts for " + name + fact.getArgs()
                            + ": " + previous + " and " + fact.getResult());
                }
                Log.warn("Duplicate fact ignored: " + fact);
                continue;
            }
            Expr application = solver.apply(this, argTerms);
            BoolExpr axiom;
            if (returnSort == ValueSort.BOOLEAN) {
                axiom = resultTerm.isTrue() ? (BoolExpr) application : solver.not(application);
            } else if (returnSort == ValueSort.FP64) {
                axiom = solver.fpEq(application, resultTerm);
            } else {
                axiom = solver.eq(application, resultTerm);
            }
            axioms.add(axiom);
        }
        return axioms;
    }

    public List<Fact> relevantFacts(List<Fact> facts) {
        List<Fact> relevant = new ArrayList<>();
        for (Fact fact : facts) {
            if (fact.getFunction() == this) {
                relevant.add(fact);
            }
        }
        return relevant;
    }

    protected Expr[] argumentTerms(Fact fact) {
        Expr[] terms = new Expr[args.size()];
        for (int i = 0; i < terms.length; i++) {
            terms[i] = solver.convertLiteral(fact.getArg(i), args.get(i).getSort());
        }
        return terms;
    }

    public String getName() {
        return name;
    }

    /**
     * heart-rate becomes "heart rate".
     */
    public String getDisplayName() {
        return name.replace('_', ' ').replace('-', ' ');
    }

    public List<Argument> getArgs() {
        return args;
    }

    public int getArity() {
        return args.size();
    }

    public int argIndex(String argName) {
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).getName().equals(argName)) {
                return i;
            }
        }
        return -1;
    }

    public ValueSort getReturnSort() {
        return returnSort;
    }

    public Units getUnits() {
        return units;
    }

    public FuncDecl getDecl() {
        return decl;
    }

    protected String withUnits(Object value) {
        return units == null ? String.valueOf(value) : units.format(value);
    }

    @Override
    public String toString() {
        return getKind() + " (" + name + " " + args + " -> " + returnSort + ")";
    }
}
