package info.isaksson.erland.xdlc.parse;

import java.util.Objects;

/** @param text the exact source text of the token, quotes included for literals */
public record Token(TokenKind kind, String text, TextPosition position) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(position, "position");
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + position;
    }
}
