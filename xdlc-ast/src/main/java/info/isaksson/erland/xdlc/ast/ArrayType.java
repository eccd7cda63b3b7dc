package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/**
 * One array dimension. {@code int x[2][3]} is {@code Array(Array(int, 3), 2)}: the outermost
 * dimension is written first.
 *
 * @param length dimension expression, or {@code null} for {@code []}
 */
public record ArrayType(TypeRef element, Expression length) implements TypeRef {

    public ArrayType {
        Objects.requireNonNull(element, "element");
    }

    @Override
    public boolean constQualified() {
        return false;
    }

    @Override
    public ArrayType withConst(boolean constQualified) {
        return new ArrayType(element.withConst(constQualified), length);
    }
}
