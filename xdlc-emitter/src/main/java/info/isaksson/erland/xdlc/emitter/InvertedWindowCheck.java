package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.ast.Attributes;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.EnumMember;
import info.isaksson.erland.xdlc.ast.Existence;
import info.isaksson.erland.xdlc.ast.Field;
import info.isaksson.erland.xdlc.ast.Member;
import info.isaksson.erland.xdlc.ast.MemberBlock;
import info.isaksson.erland.xdlc.ast.Method;

/** Reports nodes whose {@code added} version is not below their {@code removed} version. */
final class InvertedWindowCheck {

    private final EmitterWarnings warnings;

    InvertedWindowCheck(EmitterWarnings warnings) {
        this.warnings = warnings;
    }

    void scan(Declaration declaration) {
        String owner = declaration.qualifiedName();
        check(declaration.attributes(), owner, null);
        for (BaseTypeRef b : declaration.baseTypes()) {
            check(b.attributes(), owner, "base " + b.name());
        }
        members(declaration, owner);
    }

    private void members(Declaration declaration, String owner) {
        for (Member m : declaration.members()) {
            member(m, owner);
        }
    }

    private void member(Member m, String owner) {
        if (m instanceof MemberBlock b) {
            check(b.attributes(), owner, "block");
            for (Member child : b.members()) {
                member(child, owner);
            }
        } else if (m instanceof Field f) {
            check(f.attributes(), owner, f.name());
            if (f.type() instanceof Declaration inline) members(inline, owner);
        } else if (m instanceof Method method) {
            check(method.attributes(), owner, method.name());
        } else if (m instanceof EnumMember e) {
            check(e.attributes(), owner, e.name());
        }
    }

    private void check(Attributes attributes, String owner, String member) {
        if (!Existence.isInverted(attributes)) return;
        String message = "added " + attributes.added().orElseThrow()
                + " is not below removed " + attributes.removed().orElseThrow()
                + "; never emitted";
        warnings.warn(EmitterWarning.INVERTED_VERSION_WINDOW, message, owner, member);
    }
}
