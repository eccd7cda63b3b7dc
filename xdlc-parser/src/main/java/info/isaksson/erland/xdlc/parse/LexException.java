package info.isaksson.erland.xdlc.parse;

import info.isaksson.erland.xdlc.ast.XdlException;

/** Lexical error, currently only an unterminated string or character literal. */
public final class LexException extends XdlException {

    private final String sourceName;
    private final TextPosition position;

    public LexException(String sourceName, TextPosition position, String message) {
        super(sourceName + ":" + position + ": " + message);
        this.sourceName = sourceName;
        this.position = position;
    }

    public String sourceName() {
        return sourceName;
    }

    public TextPosition position() {
        return position;
    }
}
