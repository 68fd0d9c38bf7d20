package solver;

/**
 * StringBuilder that knows its current column, so nested lists can be
 * aligned under their first argument.
 */
class IndentedWriter {
    private final StringBuilder out = new StringBuilder();
    private int column = 0;

    IndentedWriter write(String text) {
        out.append(text);
        int newline = text.lastIndexOf('\n');
        column = newline < 0 ? column + text.length() : text.length() - newline - 1;
        return this;
    }

    IndentedWriter newline(int indent) {
        out.append('\n');
        for (int i = 0; i < indent; i++) {
            out.append(' ');
        }
        column = indent;
        return this;
    }

    int column() {
        return column;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
