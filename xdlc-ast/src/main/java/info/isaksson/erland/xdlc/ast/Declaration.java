package info.isaksson.erland.xdlc.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Enum, struct, class, union or interface.
 *
 * <p>Top-level declarations are always named; inline declarations used as member types may be anonymous.
 * {@code hasBody} is false for a forward form such as {@code struct X;}. {@code namespace} is the dotted
 * namespace path the parser was in, or {@code null} at file scope.</p>
 */
public record Declaration(
        DeclarationKind kind,
        Attributes attributes,
        String name,
        List<BaseTypeRef> baseTypes,
        List<Member> members,
        boolean hasBody,
        boolean constQualified,
        String namespace
) implements TypeRef, XdlNode {

    public Declaration {
        Objects.requireNonNull(kind, "kind");
        attributes = attributes == null ? Attributes.NONE : attributes;
        baseTypes = baseTypes == null ? List.of() : List.copyOf(baseTypes);
        members = members == null ? List.of() : List.copyOf(members);
    }

    public Declaration withNamespace(String namespace) {
        return new Declaration(kind, attributes, name, baseTypes, members, hasBody, constQualified, namespace);
    }

    @Override
    public Declaration withConst(boolean constQualified) {
        return new Declaration(kind, attributes, name, baseTypes, members, hasBody, constQualified, namespace);
    }

    @JsonIgnore
    public boolean isInterface() {
        return kind == DeclarationKind.INTERFACE;
    }

    @JsonIgnore
    public boolean isEnum() {
        return kind == DeclarationKind.ENUM;
    }

    /** {@code a::b::Name}, or the bare name at file scope. */
    public String qualifiedName() {
        if (namespace == null || namespace.isEmpty() || name == null) return name;
        return namespace.replace(".", "::") + "::" + name;
    }

    /** True when any base-type entry carries {@code added} or {@code removed}. */
    public boolean hasConditionalBases() {
        for (BaseTypeRef b : baseTypes) {
            if (b.attributes().hasVersionAttribute()) return true;
        }
        return false;
    }

    /** True when the body contains at least one field, blocks included. */
    public boolean hasFields() {
        return Members.anyMatch(members, m -> m instanceof Field);
    }
}
