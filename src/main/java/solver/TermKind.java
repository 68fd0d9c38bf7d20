package solver;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Operators a statement may use, keyed by their s-expression spelling.
 */
public enum TermKind {
    EQUAL("="),
    FP_EQUAL("fp="),
    AND("and"),
    OR("or"),
    NOT("not"),
    IMPLIES("=>", "implies", "->"),

    LT("<"),
    LEQ("<="),
    GT(">"),
    GEQ(">="),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),

    FP_LT("fp<"),
    FP_LEQ("fp<="),
    FP_GT("fp>"),
    FP_GEQ("fp>="),
    FP_ADD("fp+"),
    FP_SUB("fp-"),
    FP_MUL("fp*"),
    FP_DIV("fp/"),

    FORALL("forall"),
    EXISTS("exists");

    private static final Map<String, TermKind> BY_SYMBOL = new HashMap<>();

    static {
        for (TermKind kind : values()) {
            for (String symbol : kind.symbols) {
                BY_SYMBOL.put(symbol, kind);
            }
        }
    }

    private final String[] symbols;

    TermKind(String... symbols) {
        this.symbols = symbols;
    }

    public String symbol() {
        return symbols[0];
    }

    public boolean isQuantifier() {
        return this == FORALL || this == EXISTS;
    }

    /**
     * Case-insensitive lookup, null when the symbol is not an operator.
     */
    public static TermKind fromSymbol(String symbol) {
        if (symbol == null) {
            return null;
        }
        return BY_SYMBOL.get(symbol.toLowerCase(Locale.ROOT));
    }
}
