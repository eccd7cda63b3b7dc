package info.isaksson.erland.xdlc.ast.walk;

import info.isaksson.erland.xdlc.ast.ArrayType;
import info.isaksson.erland.xdlc.ast.AttributeNode;
import info.isaksson.erland.xdlc.ast.Attributes;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.EnumMember;
import info.isaksson.erland.xdlc.ast.Field;
import info.isaksson.erland.xdlc.ast.Member;
import info.isaksson.erland.xdlc.ast.MemberBlock;
import info.isaksson.erland.xdlc.ast.Method;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.ast.Parameter;
import info.isaksson.erland.xdlc.ast.PointerType;
import info.isaksson.erland.xdlc.ast.ReferenceType;
import info.isaksson.erland.xdlc.ast.SignatureType;
import info.isaksson.erland.xdlc.ast.TypeRef;

import java.util.Objects;

/**
 * Depth-first traversal of a declaration in source order.
 *
 * <p>Visit order per node: its attributes, then its children. Base types are reported to
 * {@link AstListener#onBaseType} before their attributes. Attribute argument expressions are not walked.</p>
 */
public final class AstWalker {

    private final WalkPolicy policy;
    private final AstListener listener;

    public AstWalker(WalkPolicy policy, AstListener listener) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public static void walk(Declaration declaration, WalkPolicy policy, AstListener listener) {
        new AstWalker(policy, listener).walk(declaration);
    }

    public void walk(Declaration declaration) {
        walkDeclaration(declaration, policy.visitOwnAttributes(declaration));
    }

    private void walkDeclaration(Declaration d, boolean ownAttributes) {
        if (ownAttributes) attributes(d.attributes());
        for (BaseTypeRef b : d.baseTypes()) {
            if (!policy.enterBaseType(b)) continue;
            listener.onBaseType(b);
            attributes(b.attributes());
        }
        for (Member m : d.members()) {
            member(m);
        }
    }

    private void member(Member m) {
        if (m instanceof Field f) {
            if (!policy.enterField(f)) return;
            attributes(f.attributes());
            type(f.type());
        } else if (m instanceof Method method) {
            if (!policy.enterMethod(method)) return;
            attributes(method.attributes());
            type(method.signature());
        } else if (m instanceof MemberBlock b) {
            if (!policy.enterBlock(b)) return;
            attributes(b.attributes());
            for (Member child : b.members()) {
                member(child);
            }
        } else if (m instanceof EnumMember e) {
            attributes(e.attributes());
        }
    }

    public void type(TypeRef t) {
        if (t instanceof NamedType n) {
            listener.onNamedType(n);
        } else if (t instanceof PointerType p) {
            type(p.element());
        } else if (t instanceof ReferenceType r) {
            type(r.element());
        } else if (t instanceof ArrayType a) {
            type(a.element());
        } else if (t instanceof SignatureType s) {
            for (Parameter p : s.parameters()) {
                attributes(p.attributes());
                type(p.type());
            }
            type(s.returnType());
        } else if (t instanceof Declaration inline) {
            walkDeclaration(inline, true);
        }
    }

    private void attributes(Attributes attributes) {
        for (AttributeNode a : attributes.nodes()) {
            listener.onAttribute(a);
        }
    }
}
