package info.isaksson.erland.xdlc.ast.walk;

import info.isaksson.erland.xdlc.ast.AttributeNode;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.NamedType;

/** Callbacks fired by {@link AstWalker}. All default to no-ops. */
public interface AstListener {

    default void onAttribute(AttributeNode attribute) {
    }

    default void onBaseType(BaseTypeRef baseType) {
    }

    default void onNamedType(NamedType type) {
    }
}
