package info.isaksson.erland.xdlc.ast.walk;

import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.Field;
import info.isaksson.erland.xdlc.ast.MemberBlock;
import info.isaksson.erland.xdlc.ast.Method;

/**
 * Descent filter for {@link AstWalker}. Each hook decides whether the walker enters a branch; a skipped
 * branch contributes nothing, its attributes included.
 */
public interface WalkPolicy {

    /** Walks every node. */
    WalkPolicy EVERYTHING = new WalkPolicy() {
    };

    /** Whether the attributes written on the walked declaration itself are reported. Nested declarations always report theirs. */
    default boolean visitOwnAttributes(Declaration declaration) {
        return true;
    }

    default boolean enterBaseType(BaseTypeRef baseType) {
        return true;
    }

    default boolean enterField(Field field) {
        return true;
    }

    default boolean enterMethod(Method method) {
        return true;
    }

    default boolean enterBlock(MemberBlock block) {
        return true;
    }
}
