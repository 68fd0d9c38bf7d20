package solver;

import com.microsoft.z3.Expr;
import com.microsoft.z3.FPRMExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Pattern;
import com.microsoft.z3.Quantifier;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Symbol;
import init.Config;
import model.ValueSort;
import utils.Log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Prints solver terms back in the statement language, so an axiom or a
 * compiled statement reads the way a user would have typed it.
 */
public class TermPrinter {

    private static final Map<String, String> OPERATOR_MAP = new HashMap<String, String>() {{
        put("fp.eq", "fp=");
        put("fp.lt", "fp<");
        put("fp.leq", "fp<=");
        put("fp.gt", "fp>");
        put("fp.geq", "fp>=");
        put("fp.add", "fp+");
        put("fp.sub", "fp-");
        put("fp.mul", "fp*");
        put("fp.div", "fp/");
    }};

    private final SolverContext solver;
    private final int width;
    // names of enclosing binders, innermost quantifier first
    private final Deque<String[]> binders = new ArrayDeque<>();

    private TermPrinter(SolverContext solver, int width) {
        this.solver = solver;
        this.width = width;
    }

    public static String print(SolverContext solver, Expr expr) {
        return print(solver, expr, Config.prettyPrintWidth);
    }

    public static String print(SolverContext solver, Expr expr, int width) {
        if (expr == null) return "";
        TermPrinter printer = new TermPrinter(solver, width);
        Node node = printer.toNode(expr);
        IndentedWriter out = new IndentedWriter();
        printer.render(node, out);
        return out.toString();
    }

    private Node toNode(Expr expr) {
        if (expr.isVar()) {
            return Node.atom(boundName(expr.getIndex()));
        }
        if (expr.isQuantifier()) {
            return quantifierNode((Quantifier) expr);
        }
        if (Fp64Codec.isLiteral(expr)) {
            double value = Fp64Codec.decode(expr);
            return Node.atom(Double.isNaN(value) ? "NaN" : Double.toString(value));
        }
        if (expr instanceof IntNum) {
            return Node.atom(((IntNum) expr).getBigInteger().toString());
        }
        if (expr.isString()) {
            return Node.atom("\"" + expr.getString() + "\"");
        }
        if (expr.isTrue()) return Node.atom("true");
        if (expr.isFalse()) return Node.atom("false");
        if (!expr.isApp()) {
            Log.warn("Unknown term shape: " + expr);
            return Node.atom(expr.toString());
        }

        String declName = expr.getFuncDecl().getName().toString();
        String op = OPERATOR_MAP.getOrDefault(declName, declName);
        Expr[] args = expr.getArgs();
        if (args.length == 0) {
            return Node.atom(op);
        }
        List<Node> children = new ArrayList<>();
        for (Expr arg : args) {
            if (arg instanceof FPRMExpr) {
                continue;
            }
            children.add(toNode(arg));
        }
        return Node.list(op, children);
    }

    private Node quantifierNode(Quantifier q) {
        Symbol[] names = q.getBoundVariableNames();
        Sort[] sorts = q.getBoundVariableSorts();
        String[] frame = new String[names.length];
        List<Node> binderNodes = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            frame[i] = names[i].toString();
            ValueSort sort = solver.valueSortOf(sorts[i]);
            String tag = sort == null ? sorts[i].toString() : sort.getTypeTag();
            binderNodes.add(Node.list(frame[i], Collections.singletonList(Node.atom(tag))));
        }

        binders.push(frame);
        Node body;
        try {
            body = toNode(q.getBody());
            Pattern[] patterns = q.getPatterns();
            if (patterns.length > 0) {
                List<Node> triggers = new ArrayList<>();
                for (Pattern pattern : patterns) {
                    for (Expr term : pattern.getTerms()) {
                        triggers.add(toNode(term));
                    }
                }
                List<Node> annotated = new ArrayList<>();
                annotated.add(body);
                annotated.add(Node.atom(":pattern"));
                annotated.add(Node.group(triggers));
                body = Node.list("!", annotated);
            }
        } finally {
            binders.pop();
        }

        List<Node> children = new ArrayList<>();
        children.add(Node.group(binderNodes));
        children.add(body);
        return Node.list(q.isUniversal() ? "forall" : "exists", children);
    }

    // de Bruijn index 0 is the last variable of the innermost quantifier
    private String boundName(int index) {
        int remaining = index;
        for (String[] frame : binders) {
            if (remaining < frame.length) {
                return frame[frame.length - 1 - remaining];
            }
            remaining -= frame.length;
        }
        return "?" + index;
    }

    private void render(Node node, IndentedWriter out) {
        String flat = node.flat();
        if (node.isAtom() || out.column() + flat.length() <= width) {
            out.write(flat);
            return;
        }
        out.write("(");
        if (node.head != null) {
            out.write(node.head);
            if (node.children.isEmpty()) {
                out.write(")");
                return;
            }
            out.write(" ");
        }
        int indent = out.column();
        for (int i = 0; i < node.children.size(); i++) {
            if (i > 0) {
                out.newline(indent);
            }
            render(node.children.get(i), out);
        }
        out.write(")");
    }

    private static class Node {
        final String text;
        final String head;
        final List<Node> children;
        private String flat;

        private Node(String text, String head, List<Node> children) {
            this.text = text;
            this.head = head;
            this.children = children;
        }

        static Node atom(String text) {
            return new Node(text, null, Collections.emptyList());
        }

        static Node list(String head, List<Node> children) {
            return new Node(null, head, children);
        }

        // headless list, used for binder and trigger groups
        static Node group(List<Node> children) {
            return new Node(null, null, children);
        }

        boolean isAtom() {
            return text != null;
        }

        String flat() {
            if (flat != null) return flat;
            if (isAtom()) {
                flat = text;
                return flat;
            }
            StringBuilder sb = new StringBuilder("(");
            if (head != null) {
                sb.append(head);
            }
            for (int i = 0; i < children.size(); i++) {
                if (head != null || i > 0) sb.append(' ');
                sb.append(children.get(i).flat());
            }
            flat = sb.append(')').toString();
            return flat;
        }
    }
}
