package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

public record UnaryNegation(Expression operand) implements Expression {

    public UnaryNegation {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public Object fold() {
        Object v = operand.fold();
        if (!(v instanceof Long)) {
            throw new SemanticException(String.valueOf(operand), "cannot negate a non-integer constant");
        }
        return -(Long) v;
    }

    @Override
    public String toString() {
        return "-" + operand;
    }
}
