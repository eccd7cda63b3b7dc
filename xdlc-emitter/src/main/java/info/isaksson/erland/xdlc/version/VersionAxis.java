package info.isaksson.erland.xdlc.version;

import info.isaksson.erland.xdlc.ast.AttributeKind;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.Field;
import info.isaksson.erland.xdlc.ast.Member;
import info.isaksson.erland.xdlc.ast.MemberBlock;
import info.isaksson.erland.xdlc.ast.Method;
import info.isaksson.erland.xdlc.ast.Members;
import info.isaksson.erland.xdlc.ast.walk.WalkPolicy;

/**
 * Independent dimensions along which a declaration's shape changes between versions. Each axis is the walk
 * policy that gathers the breakpoints relevant to it.
 *
 * <p>Only {@link #ENUM} looks at the attributes written on the declaration itself; on the other axes those
 * attributes describe the declaration's own lifetime, not its layout.</p>
 */
public enum VersionAxis implements WalkPolicy {

    /** Fields, and blocks holding at least one field. */
    DATA {
        @Override
        public boolean enterMethod(Method method) {
            return false;
        }

        @Override
        public boolean enterBlock(MemberBlock block) {
            return Members.anyMatch(block.members(), m -> m instanceof Field);
        }
    },

    /** Methods, and blocks holding at least one method. */
    CODE {
        @Override
        public boolean enterField(Field field) {
            return false;
        }

        @Override
        public boolean enterBlock(MemberBlock block) {
            return Members.anyMatch(block.members(), m -> m instanceof Method);
        }
    },

    /** Attributes on base-type entries. */
    BASE_TYPE {
        @Override
        public boolean enterBaseType(BaseTypeRef baseType) {
            return true;
        }

        @Override
        public boolean enterField(Field field) {
            return false;
        }

        @Override
        public boolean enterMethod(Method method) {
            return false;
        }

        @Override
        public boolean enterBlock(MemberBlock block) {
            return false;
        }
    },

    /** Hidden-return methods and the blocks enclosing them. */
    HIDDEN_RETURN {
        @Override
        public boolean enterField(Field field) {
            return false;
        }

        @Override
        public boolean enterMethod(Method method) {
            return isHiddenReturn(method);
        }

        @Override
        public boolean enterBlock(MemberBlock block) {
            return Members.anyMatch(block.members(), VersionAxis::isHiddenReturn);
        }
    },

    /** Everything reachable from an enum: its own attributes, underlying type and members. */
    ENUM {
        @Override
        public boolean visitOwnAttributes(Declaration declaration) {
            return true;
        }

        @Override
        public boolean enterBaseType(BaseTypeRef baseType) {
            return true;
        }
    };

    @Override
    public boolean visitOwnAttributes(Declaration declaration) {
        return false;
    }

    @Override
    public boolean enterBaseType(BaseTypeRef baseType) {
        return false;
    }

    private static boolean isHiddenReturn(Member member) {
        return member instanceof Method && member.attributes().has(AttributeKind.HIDDEN_RETURN);
    }
}
