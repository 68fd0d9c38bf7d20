package solver;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Z3Exception;
import model.Argument;
import model.Function;
import model.ValueSort;
import parser.SExpr;
import parser.SExprParser;
import utils.Log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a parsed statement into a term of one {@link SolverContext}.
 * <p>
 * A symbol resolves to, in order: a quantifier-bound variable (innermost
 * binder first), a zero-arity function, then a literal. A list head resolves
 * to a declared function, then an operator of {@link TermKind}. Untyped
 * numeric literals take the sort of their siblings, so {@code (= age 72)}
 * compares against 72.0 when age is a Float64.
 */
public class TermCompiler {

    private final SolverContext solver;
    private final Deque<Map<String, Expr>> scopes = new ArrayDeque<>();

    public TermCompiler(SolverContext solver) {
        this.solver = solver;
    }

    public BoolExpr compileStatement(String text) {
        Expr term = compile(text);
        if (!(term instanceof BoolExpr)) {
            throw new CompileException("Statement is not a proposition: " + text);
        }
        return (BoolExpr) term;
    }

    public Expr compile(String text) {
        Optional<SExpr> parsed = SExprParser.parse(text);
        if (!parsed.isPresent()) {
            throw new CompileException("Cannot parse statement: " + text);
        }
        return compile(parsed.get());
    }

    public Expr compile(SExpr sexpr) {
        scopes.clear();
        try {
            return compile(sexpr, null);
        } catch (Z3Exception | ClassCastException e) {
            throw new CompileException("Ill-formed term " + sexpr + ": " + e.getMessage(), e);
        }
    }

    private Expr compile(SExpr sexpr, ValueSort hint) {
        if (!sexpr.isList()) {
            return compileAtom((SExpr.Atom) sexpr, hint);
        }
        SExpr.Lst list = (SExpr.Lst) sexpr;
        String head = list.head();
        if (head == null) {
            throw new CompileException("Expected an operator or function at the head of " + list);
        }
        List<SExpr> rest = list.getChildren().subList(1, list.size());

        Optional<Function> function = solver.findFunction(head);
        if (function.isPresent()) {
            return compileApplication(function.get(), rest);
        }
        TermKind kind = TermKind.fromSymbol(head);
        if (kind == null) {
            throw new CompileException("Unknown operator or function '" + head + "' in " + list);
        }
        if (kind.isQuantifier()) {
            return compileQuantifier(kind, rest, list);
        }
        return solver.mkTerm(kind, compileOperands(kind, rest));
    }

    private Expr compileAtom(SExpr.Atom atom, ValueSort hint) {
        if (atom.isQuoted()) {
            return solver.mkString(atom.getText());
        }
        Expr symbol = resolveSymbol(atom.getText());
        if (symbol != null) {
            return symbol;
        }
        return solver.convertLiteral(atom.getText(), hint);
    }

    private Expr resolveSymbol(String name) {
        for (Map<String, Expr> scope : scopes) {
            Expr bound = scope.get(name);
            if (bound != null) {
                return bound;
            }
        }
        Optional<Function> function = solver.findFunction(name);
        if (function.isPresent() && function.get().getArity() == 0) {
            return solver.apply(function.get());
        }
        return null;
    }

    private Expr compileApplication(Function function, List<SExpr> rest) {
        List<Argument> formals = function.getArgs();
        if (rest.size() != formals.size()) {
            throw new CompileException(function.getName() + " expects " + formals.size()
                    + " argument(s) but got " + rest.size());
        }
        Expr[] args = new Expr[rest.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = compile(rest.get(i), formals.get(i).getSort());
        }
        return solver.apply(function, args);
    }

    /**
     * Non-literal operands are compiled first; the first sort they reveal
     * types the bare literals.
     */
    private Expr[] compileOperands(TermKind kind, List<SExpr> operands) {
        Expr[] compiled = new Expr[operands.size()];
        ValueSort hint = defaultHint(kind);
        for (int i = 0; i < compiled.length; i++) {
            SExpr operand = operands.get(i);
            if (isBareLiteral(operand)) {
                continue;
            }
            compiled[i] = compile(operand, null);
            if (hint == null) {
                hint = solver.valueSortOf(compiled[i].getSort());
            }
        }
        for (int i = 0; i < compiled.length; i++) {
            if (compiled[i] == null) {
                compiled[i] = compile(operands.get(i), hint);
            }
        }
        return compiled;
    }

    private boolean isBareLiteral(SExpr operand) {
        if (operand.isList()) {
            return false;
        }
        SExpr.Atom atom = (SExpr.Atom) operand;
        return !atom.isQuoted() && resolveSymbol(atom.getText()) == null;
    }

    private static ValueSort defaultHint(TermKind kind) {
        switch (kind) {
            case FP_EQUAL:
            case FP_LT:
            case FP_LEQ:
            case FP_GT:
            case FP_GEQ:
            case FP_ADD:
            case FP_SUB:
            case FP_MUL:
            case FP_DIV:
                return ValueSort.FP64;
            default:
                return null;
        }
    }

    // (forall ((x Int) (y FP)) body)
    private Expr compileQuantifier(TermKind kind, List<SExpr> rest, SExpr.Lst whole) {
        if (rest.size() != 2 || !rest.get(0).isList()) {
            throw new CompileException(kind.symbol() + " expects a binder list and a body: " + whole);
        }
        Map<String, Expr> scope = new LinkedHashMap<>();
        for (SExpr binder : ((SExpr.Lst) rest.get(0)).getChildren()) {
            if (!binder.isList() || ((SExpr.Lst) binder).size() != 2 || ((SExpr.Lst) binder).get(1).isList()) {
                throw new CompileException("Malformed binder " + binder + " in " + whole);
            }
            SExpr.Lst pair = (SExpr.Lst) binder;
            String name = pair.head();
            if (name == null) {
                throw new CompileException("Malformed binder " + binder + " in " + whole);
            }
            String tag = ((SExpr.Atom) pair.get(1)).getText();
            ValueSort sort = ValueSort.fromTypeTag(tag);
            if (sort != ValueSort.INTEGER && sort != ValueSort.FP64) {
                throw new CompileException("Unsupported binder type '" + tag + "' for " + name);
            }
            scope.put(name, solver.mkVar(name, sort));
        }
        if (scope.isEmpty()) {
            throw new CompileException(kind.symbol() + " binds no variables: " + whole);
        }

        scopes.push(scope);
        Expr body;
        try {
            body = compile(rest.get(1), null);
        } finally {
            scopes.pop();
        }
        Expr[] bound = new ArrayList<>(scope.values()).toArray(new Expr[0]);
        Log.debug("Compiled " + kind.symbol() + " over " + scope.keySet());
        return kind == TermKind.FORALL
                ? solver.forall(bound, body, null)
                : solver.exists(bound, body, null);
    }
}
