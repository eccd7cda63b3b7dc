package info.isaksson.erland.xdlc.ast.walk;

import info.isaksson.erland.xdlc.ast.AttributeNode;
import info.isaksson.erland.xdlc.ast.Attributes;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.DeclarationKind;
import info.isaksson.erland.xdlc.ast.Field;
import info.isaksson.erland.xdlc.ast.Member;
import info.isaksson.erland.xdlc.ast.MemberBlock;
import info.isaksson.erland.xdlc.ast.Method;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.ast.Parameter;
import info.isaksson.erland.xdlc.ast.PointerType;
import info.isaksson.erland.xdlc.ast.SignatureType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstWalkerTest {

    private static Attributes tag(String name) {
        return Attributes.of(AttributeNode.of(name));
    }

    private static Declaration sample() {
        Declaration inline = new Declaration(DeclarationKind.STRUCT, Attributes.NONE, null, List.of(),
                List.of(new Field(tag("inlineField"), "x", NamedType.of("Inner"), null, false)), true, false, null);
        Method m = new Method(tag("method"), "Run",
                new SignatureType(NamedType.of("HRESULT"),
                        List.of(new Parameter(tag("param"), PointerType.to(NamedType.of("Arg")), "arg")), false),
                false, false);
        MemberBlock block = new MemberBlock(tag("block"), List.<Member>of(Field.of(NamedType.of("Blocked"), "b")));
        return new Declaration(DeclarationKind.INTERFACE, tag("own"), "IThing",
                List.of(new BaseTypeRef(tag("base"), "IBase")),
                List.of(new Field(tag("field"), "inline", inline, null, false), m, block),
                true, false, "demo");
    }

    @Test
    void everythingVisitsAllAttributesInSourceOrder() {
        Recorder r = new Recorder();
        AstWalker.walk(sample(), WalkPolicy.EVERYTHING, r);
        assertEquals(List.of("own", "base", "field", "inlineField", "method", "param", "block"), r.attributes);
        assertEquals(List.of("IBase"), r.baseTypes);
        assertEquals(List.of("Inner", "Arg", "HRESULT", "Blocked"), r.namedTypes);
    }

    @Test
    void policySkipsBranchesEntirely() {
        Recorder r = new Recorder();
        WalkPolicy onlyMethods = new WalkPolicy() {
            @Override
            public boolean visitOwnAttributes(Declaration declaration) {
                return false;
            }

            @Override
            public boolean enterBaseType(BaseTypeRef baseType) {
                return false;
            }

            @Override
            public boolean enterField(Field field) {
                return false;
            }
        };
        AstWalker.walk(sample(), onlyMethods, r);
        assertEquals(List.of("method", "param", "block"), r.attributes);
        assertTrue(r.baseTypes.isEmpty());
        assertEquals(List.of("Arg", "HRESULT"), r.namedTypes);
    }

    private static final class Recorder implements AstListener {
        final List<String> attributes = new ArrayList<>();
        final List<String> baseTypes = new ArrayList<>();
        final List<String> namedTypes = new ArrayList<>();

        @Override
        public void onAttribute(AttributeNode attribute) {
            attributes.add(attribute.name());
        }

        @Override
        public void onBaseType(BaseTypeRef baseType) {
            baseTypes.add(baseType.name());
        }

        @Override
        public void onNamedType(NamedType type) {
            namedTypes.add(type.name());
        }
    }
}
