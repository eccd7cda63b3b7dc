package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/** {@code element *}; a {@link SignatureType} element makes this a function pointer. */
public record PointerType(TypeRef element, boolean constQualified) implements TypeRef {

    public PointerType {
        Objects.requireNonNull(element, "element");
    }

    public static PointerType to(TypeRef element) {
        return new PointerType(element, false);
    }

    @Override
    public PointerType withConst(boolean constQualified) {
        return new PointerType(element, constQualified);
    }
}
