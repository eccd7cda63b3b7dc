package info.isaksson.erland.xdlc.parse;

/**
 * Position in source text. All components are 0-based; {@link #toString()} renders {@code line,column} 1-based.
 */
public record TextPosition(int offset, int line, int column) {

    public static final TextPosition START = new TextPosition(0, 0, 0);

    public TextPosition {
        if (offset < 0 || line < 0 || column < 0) {
            throw new IllegalArgumentException("negative text position: " + offset + "/" + line + "/" + column);
        }
    }

    /** Position after consuming {@code c}. */
    public TextPosition advance(char c) {
        if (c == '\n') return new TextPosition(offset + 1, line + 1, 0);
        return new TextPosition(offset + 1, line, column + 1);
    }

    @Override
    public String toString() {
        return (line + 1) + "," + (column + 1);
    }
}
