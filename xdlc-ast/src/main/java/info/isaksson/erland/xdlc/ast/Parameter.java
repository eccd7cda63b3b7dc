package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/** @param name parameter name, or {@code null} when omitted */
public record Parameter(Attributes attributes, TypeRef type, String name) {

    public Parameter {
        attributes = attributes == null ? Attributes.NONE : attributes;
        Objects.requireNonNull(type, "type");
    }

    public static Parameter of(TypeRef type, String name) {
        return new Parameter(Attributes.NONE, type, name);
    }
}
