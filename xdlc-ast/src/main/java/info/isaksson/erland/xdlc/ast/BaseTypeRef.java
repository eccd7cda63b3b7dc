package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/** Entry of a base-type list; its attributes can make the inheritance version-conditional. */
public record BaseTypeRef(Attributes attributes, String name) {

    public BaseTypeRef {
        attributes = attributes == null ? Attributes.NONE : attributes;
        Objects.requireNonNull(name, "name");
    }

    public static BaseTypeRef of(String name) {
        return new BaseTypeRef(Attributes.NONE, name);
    }
}
