package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/**
 * Data member.
 *
 * @param name     field name; {@code null} only for an anonymous inline declaration
 * @param bitWidth bit-field width, or {@code null}
 */
public record Field(Attributes attributes, String name, TypeRef type, Expression bitWidth, boolean staticMember)
        implements Member {

    public Field {
        attributes = attributes == null ? Attributes.NONE : attributes;
        Objects.requireNonNull(type, "type");
    }

    public static Field of(TypeRef type, String name) {
        return new Field(Attributes.NONE, name, type, null, false);
    }
}
