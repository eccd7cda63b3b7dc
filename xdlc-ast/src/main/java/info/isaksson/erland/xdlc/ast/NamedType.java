package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

public record NamedType(String name, boolean constQualified) implements TypeRef {

    public NamedType {
        Objects.requireNonNull(name, "name");
    }

    public static NamedType of(String name) {
        return new NamedType(name, false);
    }

    @Override
    public NamedType withConst(boolean constQualified) {
        return new NamedType(name, constQualified);
    }
}
