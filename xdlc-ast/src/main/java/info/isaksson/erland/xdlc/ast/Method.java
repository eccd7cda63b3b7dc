package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

public record Method(Attributes attributes, String name, SignatureType signature, boolean staticMember, boolean forceInline)
        implements Member {

    public Method {
        attributes = attributes == null ? Attributes.NONE : attributes;
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(signature, "signature");
    }

    public TypeRef returnType() {
        return signature.returnType();
    }

    public boolean returnsVoid() {
        return signature.returnType() instanceof NamedType n && "void".equals(n.name());
    }
}
