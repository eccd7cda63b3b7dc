package info.isaksson.erland.xdlc.parse;

import info.isaksson.erland.xdlc.ast.XdlException;

/** Syntax error. Parsing stops at the first one. */
public final class ParseException extends XdlException {

    public enum Reason {
        /** A token that cannot start or continue the current construct. */
        UNEXPECTED_TOKEN,
        /** A specific token was required and another one was found. */
        EXPECTED_TOKEN,
        /** The input ended inside a construct. */
        END_OF_INPUT
    }

    private final String sourceName;
    private final TextPosition position;
    private final Reason reason;

    public ParseException(String sourceName, TextPosition position, Reason reason, String message) {
        super(sourceName + ":" + position + ": " + message);
        this.sourceName = sourceName;
        this.position = position;
        this.reason = reason;
    }

    public String sourceName() {
        return sourceName;
    }

    public TextPosition position() {
        return position;
    }

    public Reason reason() {
        return reason;
    }
}
