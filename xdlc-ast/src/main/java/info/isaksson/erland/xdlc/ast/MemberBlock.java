package info.isaksson.erland.xdlc.ast;

import java.util.List;

/**
 * Brace-delimited group of members sharing one attribute set.
 *
 * <p>A child is alive only when every enclosing block is alive too.</p>
 */
public record MemberBlock(Attributes attributes, List<Member> members) implements Member {

    public MemberBlock {
        attributes = attributes == null ? Attributes.NONE : attributes;
        members = members == null ? List.of() : List.copyOf(members);
    }
}
