package solver;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Constructor;
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FPRMExpr;
import com.microsoft.z3.FPSort;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Global;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Pattern;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import init.Config;
import model.Fact;
import model.Function;
import model.Tfu;
import model.UnsupportedSemanticsException;
import model.ValueSort;
import utils.Log;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One Z3 context plus everything created in it: the TFU datatype, the Float64
 * sort, declared functions, terms and bound variables. Not thread-safe except
 * for {@link #interrupt()}. Must be closed; closing clears the registries
 * before the engine context is released.
 */
public class SolverContext implements AutoCloseable {

    public static final String UNDEFINED_STRING = "%%undefined%%";
    public static final String STATEMENT_LABEL = "statement";

    static {
        Global.setParameter("smt.mbqi", "true");
    }

    private final Context ctx;
    private final FPSort fp64Sort;
    private final FPRMExpr roundingMode;
    private final DatatypeSort tfuSort;
    private final Map<Tfu, Expr> tfuConstants = new EnumMap<>(Tfu.class);

    private final List<Expr> terms = new ArrayList<>();
    private final List<Expr> variables = new ArrayList<>();
    private final Map<String, Function> functions = new LinkedHashMap<>();

    private final Object lifecycleLock = new Object();
    private boolean closed = false;
    private boolean interrupted = false;

    public SolverContext() {
        this(defaultSettings());
    }

    public SolverContext(Map<String, String> settings) {
        this.ctx = new Context(settings);
        this.fp64Sort = ctx.mkFPSort64();
        this.roundingMode = ctx.mkFPRoundNearestTiesToEven();

        Tfu[] values = Tfu.values();
        Constructor[] constructors = new Constructor[values.length];
        for (int i = 0; i < values.length; i++) {
            String name = values[i].getConstructorName();
            constructors[i] = ctx.mkConstructor(name, "is_" + name, null, null, null);
        }
        this.tfuSort = ctx.mkDatatypeSort("TFU", constructors);
        FuncDecl[] constructorDecls = tfuSort.getConstructors();
        for (int i = 0; i < values.length; i++) {
            tfuConstants.put(values[i], track(ctx.mkApp(constructorDecls[i])));
        }
    }

    public static Map<String, String> defaultSettings() {
        Map<String, String> settings = new HashMap<>();
        settings.put("model", "true");
        settings.put("unsat_core", "true");
        return settings;
    }

    public Context getContext() {
        return ctx;
    }

    public FPSort getFp64Sort() {
        return fp64Sort;
    }

    public DatatypeSort getTfuSort() {
        return tfuSort;
    }

    public Sort sortOf(ValueSort sort) {
        switch (sort) {
            case INTEGER:
                return ctx.getIntSort();
            case STRING:
                return ctx.getStringSort();
            case FP64:
                return fp64Sort;
            case TFU:
                return tfuSort;
            case BOOLEAN:
                return ctx.getBoolSort();
            default:
                throw new IllegalArgumentException("Unknown sort " + sort);
        }
    }

    public ValueSort valueSortOf(Sort sort) {
        for (ValueSort candidate : ValueSort.values()) {
            if (sortOf(candidate).equals(sort)) {
                return candidate;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------- registry

    public void register(Function function) {
        if (functions.containsKey(function.getName())) {
            throw new IllegalArgumentException("Function already declared: " + function.getName());
        }
        functions.put(function.getName(), function);
    }

    public Optional<Function> findFunction(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Collection<Function> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public int termCount() {
        return terms.size();
    }

    public int variableCount() {
        return variables.size();
    }

    private <T extends Expr> T track(T term) {
        terms.add(term);
        return term;
    }

    // ---------------------------------------------------------------- constants

    public Expr tfu(Tfu value) {
        return tfuConstants.get(value);
    }

    public Expr mkInt(long value) {
        return track(ctx.mkInt(value));
    }

    public Expr mkString(String value) {
        return track(ctx.mkString(value));
    }

    public Expr mkFp64(double value) {
        return track(Fp64Codec.encode(ctx, value));
    }

    public Expr mkNaN() {
        return track(ctx.mkFPNaN(fp64Sort));
    }

    public BoolExpr mkBool(boolean value) {
        return track(ctx.mkBool(value));
    }

    public Expr mkVar(String name, ValueSort sort) {
        Expr variable = ctx.mkConst(name, sortOf(sort));
        variables.add(variable);
        return variable;
    }

    /**
     * Value a relation takes where no fact defines it.
     */
    public Expr undefinedFor(ValueSort sort) {
        switch (sort) {
            case FP64:
                return mkNaN();
            case TFU:
                return tfu(Tfu.UNKNOWN);
            case STRING:
                return mkString(UNDEFINED_STRING);
            default:
                throw new UnsupportedSemanticsException("No undefined value for sort " + sort);
        }
    }

    /**
     * Declared sort wins; otherwise sentinels, then dotted numbers as Float64
     * and integral numbers as Int.
     */
    public Expr convertLiteral(Object value, ValueSort knownSort) {
        if (value instanceof Expr) {
            return (Expr) value;
        }
        if (value instanceof Tfu) {
            return tfu((Tfu) value);
        }
        if (value instanceof Boolean) {
            return mkBool((Boolean) value);
        }
        if (value == null) {
            throw new CompileException("Cannot convert null literal");
        }
        String text = value.toString().trim();
        if (knownSort != ValueSort.STRING) {
            Expr sentinel = sentinel(text);
            if (sentinel != null) {
                return sentinel;
            }
        }
        try {
            if (knownSort != null) {
                switch (knownSort) {
                    case INTEGER:
                        return mkInt(value instanceof Number ? ((Number) value).longValue() : Long.parseLong(text));
                    case FP64:
                        return mkFp64(value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(text));
                    case STRING:
                        return mkString(value.toString());
                    default:
                        throw new CompileException("Cannot convert " + text + " to " + knownSort);
                }
            }
            if (value instanceof Double || value instanceof Float) {
                return mkFp64(((Number) value).doubleValue());
            }
            if (value instanceof Number) {
                return mkInt(((Number) value).longValue());
            }
            if (text.contains(".")) {
                return mkFp64(Double.parseDouble(text));
            }
            return mkInt(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new CompileException("Cannot convert literal <" + text + ">"
                    + (knownSort == null ? "" : " to " + knownSort), e);
        }
    }

    private Expr sentinel(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "true":
                return mkBool(true);
            case "false":
                return mkBool(false);
            case "nan":
                return mkNaN();
            default:
                Tfu tfu = Tfu.fromConstructorName(lower);
                return tfu == null ? null : tfu(tfu);
        }
    }

    // ---------------------------------------------------------------- terms

    public BoolExpr and(BoolExpr... children) {
        if (children.length == 0) {
            return mkBool(true);
        }
        if (children.length == 1) {
            return children[0];
        }
        return track(ctx.mkAnd(children));
    }

    public BoolExpr and(List<BoolExpr> children) {
        return and(children.toArray(new BoolExpr[0]));
    }

    public BoolExpr or(BoolExpr... children) {
        if (children.length == 0) {
            return mkBool(false);
        }
        if (children.length == 1) {
            return children[0];
        }
        return track(ctx.mkOr(children));
    }

    public BoolExpr or(List<BoolExpr> children) {
        return or(children.toArray(new BoolExpr[0]));
    }

    public BoolExpr not(Expr term) {
        return track(ctx.mkNot(asBool(term)));
    }

    public BoolExpr implies(Expr premise, Expr conclusion) {
        return track(ctx.mkImplies(asBool(premise), asBool(conclusion)));
    }

    public BoolExpr eq(Expr left, Expr right) {
        return track(ctx.mkEq(left, right));
    }

    public BoolExpr fpEq(Expr left, Expr right) {
        return track(ctx.mkFPEq(left, right));
    }

    public BoolExpr lt(Expr left, Expr right) {
        return track(ctx.mkLt(left, right));
    }

    public BoolExpr leq(Expr left, Expr right) {
        return track(ctx.mkLe(left, right));
    }

    public BoolExpr gt(Expr left, Expr right) {
        return track(ctx.mkGt(left, right));
    }

    public BoolExpr geq(Expr left, Expr right) {
        return track(ctx.mkGe(left, right));
    }

    public BoolExpr fpLt(Expr left, Expr right) {
        return track(ctx.mkFPLt(left, right));
    }

    public BoolExpr fpLeq(Expr left, Expr right) {
        return track(ctx.mkFPLEq(left, right));
    }

    public BoolExpr fpGt(Expr left, Expr right) {
        return track(ctx.mkFPGt(left, right));
    }

    public BoolExpr fpGeq(Expr left, Expr right) {
        return track(ctx.mkFPGEq(left, right));
    }

    public BoolExpr forall(Expr[] bound, Expr body, Expr trigger) {
        return track(ctx.mkForall(bound, asBool(body), 1, patterns(trigger), null, null, null));
    }

    public BoolExpr exists(Expr[] bound, Expr body, Expr trigger) {
        return track(ctx.mkExists(bound, asBool(body), 1, patterns(trigger), null, null, null));
    }

    private Pattern[] patterns(Expr trigger) {
        return trigger == null ? null : new Pattern[]{ctx.mkPattern(trigger)};
    }

    public Expr apply(Function function, Expr... args) {
        if (args.length != function.getArity()) {
            throw new CompileException(function.getName() + " expects " + function.getArity()
                    + " argument(s) but got " + args.length);
        }
        return track(ctx.mkApp(function.getDecl(), args));
    }

    /**
     * Operator-table dispatch used by the compiler. Quantifiers are built by the
     * compiler itself because they need their binders.
     */
    public Expr mkTerm(TermKind kind, Expr... c) {
        switch (kind) {
            case EQUAL:
                requireAtLeast(kind, c, 2);
                List<BoolExpr> links = new ArrayList<>();
                for (int i = 1; i < c.length; i++) {
                    links.add(eq(c[i - 1], c[i]));
                }
                return and(links);
            case FP_EQUAL:
                requireArity(kind, c, 2);
                return fpEq(c[0], c[1]);
            case AND:
                return and(bools(c));
            case OR:
                return or(bools(c));
            case NOT:
                requireArity(kind, c, 1);
                return not(c[0]);
            case IMPLIES:
                requireArity(kind, c, 2);
                return implies(c[0], c[1]);
            case LT:
                requireArity(kind, c, 2);
                return lt(c[0], c[1]);
            case LEQ:
                requireArity(kind, c, 2);
                return leq(c[0], c[1]);
            case GT:
                requireArity(kind, c, 2);
                return gt(c[0], c[1]);
            case GEQ:
                requireArity(kind, c, 2);
                return geq(c[0], c[1]);
            case ADD:
                requireAtLeast(kind, c, 2);
                return track(ctx.mkAdd(c));
            case SUB:
                requireAtLeast(kind, c, 1);
                return c.length == 1 ? track(ctx.mkUnaryMinus(c[0])) : track(ctx.mkSub(c));
            case MUL:
                requireAtLeast(kind, c, 2);
                return track(ctx.mkMul(c));
            case DIV:
                requireArity(kind, c, 2);
                return track(ctx.mkDiv(c[0], c[1]));
            case FP_LT:
                requireArity(kind, c, 2);
                return fpLt(c[0], c[1]);
            case FP_LEQ:
                requireArity(kind, c, 2);
                return fpLeq(c[0], c[1]);
            case FP_GT:
                requireArity(kind, c, 2);
                return fpGt(c[0], c[1]);
            case FP_GEQ:
                requireArity(kind, c, 2);
                return fpGeq(c[0], c[1]);
            case FP_ADD:
                requireArity(kind, c, 2);
                return track(ctx.mkFPAdd(roundingMode, c[0], c[1]));
            case FP_SUB:
                requireArity(kind, c, 2);
                return track(ctx.mkFPSub(roundingMode, c[0], c[1]));
            case FP_MUL:
                requireArity(kind, c, 2);
                return track(ctx.mkFPMul(roundingMode, c[0], c[1]));
            case FP_DIV:
                requireArity(kind, c, 2);
                return track(ctx.mkFPDiv(roundingMode, c[0], c[1]));
            default:
                throw new CompileException("Operator " + kind.symbol() + " cannot be built from children alone");
        }
    }

    private static void requireArity(TermKind kind, Expr[] children, int arity) {
        if (children.length != arity) {
            throw new CompileException(kind.symbol() + " expects " + arity + " argument(s) but got " + children.length);
        }
    }

    private static void requireAtLeast(TermKind kind, Expr[] children, int min) {
        if (children.length < min) {
            throw new CompileException(kind.symbol() + " expects at least " + min + " argument(s) but got " + children.length);
        }
    }

    private static BoolExpr[] bools(Expr[] children) {
        BoolExpr[] result = new BoolExpr[children.length];
        for (int i = 0; i < children.length; i++) {
            result[i] = asBool(children[i]);
        }
        return result;
    }

    static BoolExpr asBool(Expr term) {
        if (term instanceof BoolExpr) {
            return (BoolExpr) term;
        }
        throw new CompileException("Expected a boolean term but got " + term + " of sort " + term.getSort());
    }

    // ---------------------------------------------------------------- theory

    public List<BoolExpr> generateAllAxioms(List<Fact> facts) {
        List<BoolExpr> axioms = new ArrayList<>();
        for (Function function : functions.values()) {
            axioms.addAll(function.generateCoreAxioms(facts));
            axioms.addAll(function.generateCwaAxioms(facts));
        }
        Log.debug("Generated " + axioms.size() + " axioms for " + functions.size() + " functions");
        return axioms;
    }

    public List<String> factsAsNaturalLanguage(List<Fact> facts) {
        List<String> sentences = new ArrayList<>();
        for (Fact fact : facts) {
            sentences.add(fact.asNaturalLanguage());
        }
        return sentences;
    }

    // ---------------------------------------------------------------- checking

    /**
     * Asserts the axioms and the statement and runs the engine. Engine
     * failures propagate as {@link Z3Exception}.
     */
    public Status check(List<BoolExpr> axioms, BoolExpr statement) {
        Solver solver = ctx.mkSolver();
        if (Config.solverTimeoutMs > 0) {
            Params params = ctx.mkParams();
            params.add("timeout", Config.solverTimeoutMs);
            solver.setParameters(params);
        }

        Map<String, BoolExpr> labelled = new LinkedHashMap<>();
        if (Config.trackAssertions) {
            for (int i = 0; i < axioms.size(); i++) {
                String label = "axiom_" + i;
                labelled.put(label, axioms.get(i));
                solver.assertAndTrack(axioms.get(i), ctx.mkBoolConst(label));
            }
            labelled.put(STATEMENT_LABEL, statement);
            solver.assertAndTrack(statement, ctx.mkBoolConst(STATEMENT_LABEL));
        } else {
            solver.add(axioms.toArray(new BoolExpr[0]));
            solver.add(statement);
        }

        synchronized (lifecycleLock) {
            if (interrupted || closed) {
                Log.info("Check skipped, context already cancelled");
                return Status.UNKNOWN;
            }
        }
        Status status = solver.check();
        Log.info("check -> " + status);
        showDiagnostics(solver, status, labelled);
        return status;
    }

    private void showDiagnostics(Solver solver, Status status, Map<String, BoolExpr> labelled) {
        if (status == Status.UNSATISFIABLE && !labelled.isEmpty()) {
            for (BoolExpr label : solver.getUnsatCore()) {
                String name = label.toString().replace("|", "");
                BoolExpr formula = labelled.get(name);
                Log.info("Unsat core> " + name + ": " + (formula == null ? "?" : TermPrinter.print(this, formula)));
            }
        } else if (status == Status.SATISFIABLE && Log.isDebugEnabled()) {
            Model model = solver.getModel();
            Log.debug("Model:\n" + model);
        } else if (status == Status.UNKNOWN) {
            Log.info("Reason unknown: " + solver.getReasonUnknown());
        }
    }

    /**
     * Cancels a running check from another thread. No-op once closed.
     */
    public void interrupt() {
        synchronized (lifecycleLock) {
            interrupted = true;
            if (!closed) {
                ctx.interrupt();
            }
        }
    }

    public boolean isClosed() {
        synchronized (lifecycleLock) {
            return closed;
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            // drop every handle into the engine before the context goes away
            functions.clear();
            terms.clear();
            variables.clear();
            tfuConstants.clear();
            ctx.close();
        }
    }
}
