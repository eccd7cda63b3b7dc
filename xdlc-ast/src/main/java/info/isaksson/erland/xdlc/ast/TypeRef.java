package info.isaksson.erland.xdlc.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Type reference as written in a field, parameter or return position.
 *
 * <p>Inline declarations ({@code struct { ... } name;}) are type references too, see {@link Declaration}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NamedType.class, name = "named"),
        @JsonSubTypes.Type(value = PointerType.class, name = "pointer"),
        @JsonSubTypes.Type(value = ReferenceType.class, name = "reference"),
        @JsonSubTypes.Type(value = ArrayType.class, name = "array"),
        @JsonSubTypes.Type(value = SignatureType.class, name = "signature"),
        @JsonSubTypes.Type(value = Declaration.class, name = "declaration")
})
public interface TypeRef {

    boolean constQualified();

    /** Copy with a different {@code const} qualifier. */
    TypeRef withConst(boolean constQualified);
}
