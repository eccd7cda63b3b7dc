package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/** String literal; {@code value} is the unquoted, unescaped text. */
public record StringLiteral(String value) implements Expression {

    public StringLiteral {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Object fold() {
        return value;
    }

    @Override
    public String toString() {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
