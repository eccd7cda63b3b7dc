package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/** A bare identifier; folds to its own name (e.g. {@code conditional(_WIN64)}). */
public record IdentifierExpression(String name) implements Expression {

    public IdentifierExpression {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public Object fold() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
