package info.isaksson.erland.xdlc.ast;

public record IntegerLiteral(long value) implements Expression {

    @Override
    public Object fold() {
        return value;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
