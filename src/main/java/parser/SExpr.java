package parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed s-expression node: an atom or a parenthesized list.
 */
public abstract class SExpr {

    public abstract boolean isList();

    /**
     * Nested List/String view; quoted atoms lose their quotes.
     */
    public abstract Object toPlain();

    public static Atom symbol(String text) {
        return new Atom(text, false);
    }

    public static Atom quoted(String text) {
        return new Atom(text, true);
    }

    public static Lst list(List<SExpr> children) {
        return new Lst(children);
    }

    public static class Atom extends SExpr {
        private final String text;
        private final boolean quoted;

        private Atom(String text, boolean quoted) {
            this.text = text;
            this.quoted = quoted;
        }

        public String getText() {
            return text;
        }

        public boolean isQuoted() {
            return quoted;
        }

        @Override
        public boolean isList() {
            return false;
        }

        @Override
        public Object toPlain() {
            return text;
        }

        @Override
        public String toString() {
            if (!quoted) {
                return text;
            }
            return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
    }

    public static class Lst extends SExpr {
        private final List<SExpr> children;

        private Lst(List<SExpr> children) {
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
        }

        public List<SExpr> getChildren() {
            return children;
        }

        public int size() {
            return children.size();
        }

        public SExpr get(int i) {
            return children.get(i);
        }

        /**
         * Text of the leading symbol, or null when the list is empty or headed by a list.
         */
        public String head() {
            if (children.isEmpty() || children.get(0).isList()) {
                return null;
            }
            return ((Atom) children.get(0)).getText();
        }

        @Override
        public boolean isList() {
            return true;
        }

        @Override
        public Object toPlain() {
            List<Object> plain = new ArrayList<>();
            for (SExpr child : children) {
                plain.add(child.toPlain());
            }
            return plain;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            return sb.append(')').toString();
        }
    }
}
