package info.isaksson.erland.xdlc.render;

/**
 * Line-oriented text sink with four-space indentation.
 *
 * <p>Text passed to {@link #line(String)} may span several lines; each one is indented. Empty lines never carry
 * trailing whitespace.</p>
 */
public final class CodeWriter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth;

    public CodeWriter line(String text) {
        for (String part : text.split("\n", -1)) {
            if (!part.isEmpty()) {
                out.append(INDENT.repeat(depth));
            }
            out.append(part).append('\n');
        }
        return this;
    }

    public CodeWriter blank() {
        out.append('\n');
        return this;
    }

    /** Preprocessor line, always at column 0. */
    public CodeWriter directive(String text) {
        out.append(text).append('\n');
        return this;
    }

    /** Line one level left of the current indentation, for {@code public:} / {@code private:}. */
    public CodeWriter outdented(String text) {
        out.append(INDENT.repeat(Math.max(0, depth - 1))).append(text).append('\n');
        return this;
    }

    /** Writes {@code {} and indents. */
    public CodeWriter open() {
        line("{");
        depth++;
        return this;
    }

    public CodeWriter close() {
        return close("");
    }

    /** Outdents and writes {@code }} followed by {@code suffix}, e.g. {@code ";"}. */
    public CodeWriter close(String suffix) {
        if (depth == 0) throw new IllegalStateException("unbalanced close");
        depth--;
        line("}" + suffix);
        return this;
    }

    public CodeWriter indent() {
        depth++;
        return this;
    }

    public CodeWriter outdent() {
        if (depth == 0) throw new IllegalStateException("unbalanced outdent");
        depth--;
        return this;
    }

    public int depth() {
        return depth;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
