package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/** {@code element &}. */
public record ReferenceType(TypeRef element, boolean constQualified) implements TypeRef {

    public ReferenceType {
        Objects.requireNonNull(element, "element");
    }

    @Override
    public ReferenceType withConst(boolean constQualified) {
        return new ReferenceType(element, constQualified);
    }
}
