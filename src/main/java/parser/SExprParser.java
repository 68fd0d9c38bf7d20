package parser;

import utils.Log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Reader for a single s-expression. Open lists are kept on an explicit
 * stack, so nesting depth is bounded by {@link #MAX_DEPTH} and not by the
 * thread stack. Numbers stay as raw symbol text; typing happens in the
 * compiler.
 */
public class SExprParser {
    public static final int MAX_DEPTH = 1000;

    private final String text;
    private int pos = 0;

    private SExprParser(String text) {
        this.text = text;
    }

    /**
     * Empty when the text is malformed. Never throws.
     */
    public static Optional<SExpr> parse(String text) {
        if (text == null) {
            Log.warn("Cannot parse null s-expression");
            return Optional.empty();
        }
        SExprParser parser = new SExprParser(text);
        try {
            parser.skipWhitespace();
            if (parser.atEnd()) {
                throw new ParseException("empty input", parser.pos);
            }
            SExpr result = parser.parseExpr();
            parser.skipWhitespace();
            if (!parser.atEnd()) {
                throw new ParseException("unexpected '" + parser.peek() + "' after expression", parser.pos);
            }
            return Optional.of(result);
        } catch (ParseException e) {
            String shown = text.length() > 200 ? text.substring(0, 200) + "..." : text;
            Log.warn("Invalid s-expression (" + e.getMessage() + "): " + shown);
            return Optional.empty();
        }
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private SExpr parseExpr() throws ParseException {
        Deque<List<SExpr>> open = new ArrayDeque<>();
        Deque<Integer> openedAt = new ArrayDeque<>();
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                if (open.isEmpty()) {
                    throw new ParseException("unexpected end of input", pos);
                }
                throw new ParseException("unbalanced '(' opened", openedAt.peek());
            }
            char c = peek();
            SExpr done;
            if (c == '(') {
                if (open.size() >= MAX_DEPTH) {
                    throw new ParseException("nesting deeper than " + MAX_DEPTH, pos);
                }
                openedAt.push(pos);
                open.push(new ArrayList<>());
                pos++;
                continue;
            } else if (c == ')') {
                if (open.isEmpty()) {
                    throw new ParseException("unbalanced ')'", pos);
                }
                pos++;
                openedAt.pop();
                done = SExpr.list(open.pop());
            } else if (c == '"') {
                done = parseString();
            } else {
                done = parseSymbol();
            }
            if (open.isEmpty()) {
                return done;
            }
            open.peek().add(done);
        }
    }

    private SExpr parseString() throws ParseException {
        int start = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && peek() != '"') {
            char c = peek();
            if (c == '\\' && pos + 1 < text.length()) {
                char next = text.charAt(pos + 1);
                if (next == '"' || next == '\\') {
                    sb.append(next);
                } else {
                    sb.append(c).append(next);
                }
                pos += 2;
            } else {
                sb.append(c);
                pos++;
            }
        }
        if (atEnd()) {
            throw new ParseException("unterminated string", start);
        }
        pos++; // closing quote
        return SExpr.quoted(sb.toString());
    }

    private SExpr parseSymbol() {
        int start = pos;
        while (!atEnd()) {
            char c = peek();
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"') {
                break;
            }
            pos++;
        }
        return SExpr.symbol(text.substring(start, pos));
    }

    static class ParseException extends Exception {
        ParseException(String message, int position) {
            super(message + " at offset " + position);
        }
    }
}
