package info.isaksson.erland.xdlc.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Entry of a declaration body. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Field.class, name = "field"),
        @JsonSubTypes.Type(value = Method.class, name = "method"),
        @JsonSubTypes.Type(value = MemberBlock.class, name = "block"),
        @JsonSubTypes.Type(value = EnumMember.class, name = "enumMember")
})
public interface Member {

    Attributes attributes();
}
