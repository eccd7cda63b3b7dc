package info.isaksson.erland.xdlc.parse;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * On-demand tokenizer over an immutable source text.
 *
 * <p>The lexer knows nothing about the grammar. The cursor can be saved with {@link #position()} and restored
 * with {@link #reset(TextPosition)}, which is how the parser peeks.</p>
 */
public final class Lexer implements Iterator<Token> {

    private final String sourceName;
    private final String text;
    private TextPosition position = TextPosition.START;

    public Lexer(String sourceName, String text) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.text = Objects.requireNonNull(text, "text");
    }

    public TextPosition position() {
        return position;
    }

    public void reset(TextPosition position) {
        Objects.requireNonNull(position, "position");
        if (position.offset() > text.length()) {
            throw new IllegalArgumentException("position beyond end of text: " + position.offset());
        }
        this.position = position;
    }

    public String sourceName() {
        return sourceName;
    }

    /** Skips whitespace and comments; true when a token follows. */
    @Override
    public boolean hasNext() {
        skipWhitespaceAndComments();
        return position.offset() < text.length();
    }

    @Override
    public Token next() {
        if (!hasNext()) throw new NoSuchElementException("end of input");

        TextPosition start = position;
        char c = text.charAt(start.offset());
        TokenKind kind;
        if (c == '"' || c == '\'') {
            kind = scanLiteral(c);
        } else if (Character.isDigit(c)) {
            scanNumber();
            kind = TokenKind.NUMBER;
        } else if (Character.isLetter(c) || c == '_') {
            while (position.offset() < text.length() && isIdentifierChar(text.charAt(position.offset()))) {
                advance(1);
            }
            kind = TokenKind.keywordOrIdentifier(text.substring(start.offset(), position.offset()));
        } else {
            TokenKind p = TokenKind.punctuation(c);
            advance(1);
            kind = p == null ? TokenKind.UNKNOWN : p;
        }
        return new Token(kind, text.substring(start.offset(), position.offset()), start);
    }

    private void skipWhitespaceAndComments() {
        while (position.offset() < text.length()) {
            int at = position.offset();
            char c = text.charAt(at);
            if (Character.isWhitespace(c)) {
                advance(1);
            } else if (text.startsWith("//", at)) {
                int nl = text.indexOf('\n', at);
                advanceTo(nl < 0 ? text.length() : nl + 1);
            } else if (text.startsWith("/*", at)) {
                int end = text.indexOf("*/", at + 2);
                advanceTo(end < 0 ? text.length() : end + 2);
            } else {
                return;
            }
        }
    }

    private TokenKind scanLiteral(char quote) {
        TextPosition start = position;
        int i = start.offset() + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') break;
            if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) != '\n') {
                i += 2;
                continue;
            }
            if (c == quote) {
                advanceTo(i + 1);
                return quote == '"' ? TokenKind.STRING_LITERAL : TokenKind.CHARACTER_LITERAL;
            }
            i++;
        }
        throw new LexException(sourceName, start, "literal has missing terminator");
    }

    private void scanNumber() {
        int at = position.offset();
        if (at + 1 < text.length() && text.charAt(at) == '0' && (text.charAt(at + 1) == 'x' || text.charAt(at + 1) == 'X')) {
            advance(2);
            while (position.offset() < text.length() && isHexDigit(text.charAt(position.offset()))) {
                advance(1);
            }
            return;
        }
        boolean decimalPoint = false;
        while (position.offset() < text.length()) {
            char c = text.charAt(position.offset());
            if (c == '.' && !decimalPoint) {
                decimalPoint = true;
            } else if (!Character.isDigit(c)) {
                return;
            }
            advance(1);
        }
    }

    private void advance(int count) {
        TextPosition p = position;
        for (int i = 0; i < count; i++) {
            p = p.advance(text.charAt(p.offset()));
        }
        position = p;
    }

    private void advanceTo(int offset) {
        advance(offset - position.offset());
    }

    private static boolean isIdentifierChar(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private static boolean isHexDigit(char c) {
        return Character.isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
