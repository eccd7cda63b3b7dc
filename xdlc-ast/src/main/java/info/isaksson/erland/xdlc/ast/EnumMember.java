package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/** @param value explicit value, or {@code null} */
public record EnumMember(Attributes attributes, String name, Expression value) implements Member {

    public EnumMember {
        attributes = attributes == null ? Attributes.NONE : attributes;
        Objects.requireNonNull(name, "name");
    }
}
