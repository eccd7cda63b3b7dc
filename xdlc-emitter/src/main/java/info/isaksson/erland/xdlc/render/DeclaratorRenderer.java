package info.isaksson.erland.xdlc.render;

import info.isaksson.erland.xdlc.ast.ArrayType;
import info.isaksson.erland.xdlc.ast.AttributeKind;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.EnumMember;
import info.isaksson.erland.xdlc.ast.Existence;
import info.isaksson.erland.xdlc.ast.Expression;
import info.isaksson.erland.xdlc.ast.Field;
import info.isaksson.erland.xdlc.ast.Member;
import info.isaksson.erland.xdlc.ast.Members;
import info.isaksson.erland.xdlc.ast.Method;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.ast.Parameter;
import info.isaksson.erland.xdlc.ast.PointerType;
import info.isaksson.erland.xdlc.ast.ReferenceType;
import info.isaksson.erland.xdlc.ast.SignatureType;
import info.isaksson.erland.xdlc.ast.TypeRef;
import info.isaksson.erland.xdlc.ast.Version;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders type references as C-family declarators.
 *
 * <p>Pointers and references bind innermost-out ({@code char const *const p}), array dimensions follow the
 * identifier ({@code int m[4][2]}), and a pointer to a signature parenthesizes the {@code *} and identifier
 * between the return type and the parameter list ({@code HRESULT(*Get)(void *, int i)}). Named types go through
 * the {@link NameResolver}.</p>
 *
 * <p>Inline declarations render their body over several lines. When a version is given only the members alive
 * at that version are rendered.</p>
 */
public final class DeclaratorRenderer {

    private static final String INDENT = "    ";

    /** Rendered type text; {@code needsSpace} tells whether an identifier appended to it must be space separated. */
    public record Rendered(String text, boolean needsSpace) {
    }

    private final NameResolver names;
    private final Version version;

    public DeclaratorRenderer(NameResolver names) {
        this(names, null);
    }

    /** @param version version used to filter inline declaration bodies, {@code null} to render every member */
    public DeclaratorRenderer(NameResolver names, Version version) {
        this.names = Objects.requireNonNull(names, "names");
        this.version = version;
    }

    public Rendered type(TypeRef type) {
        StringBuilder sb = new StringBuilder();
        boolean space = writeType(sb, type, null);
        return new Rendered(sb.toString(), space);
    }

    /** Full declarator of {@code identifier} (which may be {@code null} for an abstract declarator). */
    public String declarator(TypeRef type, String identifier) {
        StringBuilder sb = new StringBuilder();
        boolean space = writeType(sb, type, identifier);
        if (!consumesIdentifier(type) && identifier != null && !identifier.isEmpty()) {
            if (space) sb.append(' ');
            sb.append(identifier);
        }
        return sb.toString();
    }

    /** Field declaration without the trailing semicolon. */
    public String field(Field field) {
        StringBuilder sb = new StringBuilder();
        if (field.staticMember()) sb.append("static ");
        sb.append(declarator(field.type(), field.name()));
        if (field.bitWidth() != null) {
            sb.append(" : ").append(expression(field.bitWidth()));
        }
        return sb.toString();
    }

    public String parameter(Parameter parameter) {
        return declarator(parameter.type(), parameter.name());
    }

    public String parameters(List<Parameter> parameters) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Parameter p : parameters) {
            joiner.add(parameter(p));
        }
        return joiner.toString();
    }

    /** Method declaration without the trailing semicolon, modifiers and {@code reg_return_t<>} included. */
    public String method(Method method) {
        StringBuilder sb = new StringBuilder();
        if (method.staticMember()) sb.append("static ");
        if (method.forceInline()) sb.append("FORCEINLINE ");
        sb.append(returnPrefix(method));
        SignatureType signature = method.signature();
        sb.append(method.name()).append('(').append(parameters(signature.parameters())).append(')');
        if (signature.constQualified()) sb.append(" const");
        return sb.toString();
    }

    /** Return type as written in front of a method name, including the separating space when one is needed. */
    public String returnPrefix(Method method) {
        if (method.attributes().has(AttributeKind.REGISTER_RETURN)) {
            return "reg_return_t<" + declarator(method.returnType(), null) + "> ";
        }
        Rendered r = type(method.returnType());
        return r.needsSpace() ? r.text() + ' ' : r.text();
    }

    /** Function-table entry: a pointer to the method's signature with a leading opaque {@code void *}. */
    public String tableEntry(String name, SignatureType signature) {
        Parameter self = Parameter.of(PointerType.to(NamedType.of("void")), null);
        return declarator(new PointerType(signature.withLeadingParameter(self), false), name);
    }

    public String expression(Expression expression) {
        return String.valueOf(expression.fold());
    }

    private static boolean consumesIdentifier(TypeRef type) {
        if (type instanceof ArrayType) return true;
        if (type instanceof PointerType p) return p.element() instanceof SignatureType;
        if (type instanceof ReferenceType r) return r.element() instanceof SignatureType;
        return false;
    }

    private boolean writeType(StringBuilder sb, TypeRef type, String identifier) {
        if (type instanceof PointerType p) {
            return writeIndirection(sb, p.element(), '*', p.constQualified(), identifier);
        }
        if (type instanceof ReferenceType r) {
            return writeIndirection(sb, r.element(), '&', r.constQualified(), identifier);
        }
        if (type instanceof NamedType n) {
            sb.append(names.resolve(n.name()));
            if (n.constQualified()) sb.append(" const");
            return true;
        }
        if (type instanceof ArrayType a) {
            return writeArray(sb, a, identifier);
        }
        if (type instanceof Declaration d) {
            writeInline(sb, d);
            return true;
        }
        if (type instanceof SignatureType s) {
            // A bare signature only appears as a method's own type; render it abstractly.
            writeType(sb, s.returnType(), null);
            sb.append('(').append(parameters(s.parameters())).append(')');
            if (s.constQualified()) sb.append(" const");
            return false;
        }
        throw new IllegalArgumentException("Unsupported type reference: " + type);
    }

    private boolean writeIndirection(StringBuilder sb, TypeRef element, char symbol, boolean constQualified, String identifier) {
        if (element instanceof SignatureType s) {
            writeType(sb, s.returnType(), null);
            sb.append('(').append(symbol);
            if (constQualified) sb.append("const");
            if (identifier != null && !identifier.isEmpty()) {
                if (constQualified) sb.append(' ');
                sb.append(identifier);
            }
            sb.append(")(").append(parameters(s.parameters())).append(')');
            if (s.constQualified()) sb.append(" const");
            return true;
        }

        boolean elementIndirect = element instanceof PointerType || element instanceof ReferenceType;
        writeType(sb, element, null);
        if (element.constQualified() || !elementIndirect) sb.append(' ');
        sb.append(symbol);
        if (constQualified) {
            sb.append("const");
            return true;
        }
        return false;
    }

    private boolean writeArray(StringBuilder sb, ArrayType array, String identifier) {
        List<Expression> dimensions = new ArrayList<>();
        TypeRef element = array;
        while (element instanceof ArrayType a) {
            dimensions.add(a.length());
            element = a.element();
        }
        boolean space = writeType(sb, element, null);
        if (identifier != null && !identifier.isEmpty()) {
            if (space) sb.append(' ');
            sb.append(identifier);
        }
        for (Expression length : dimensions) {
            sb.append('[').append(length == null ? "" : expression(length)).append(']');
        }
        return false;
    }

    private void writeInline(StringBuilder sb, Declaration d) {
        sb.append(d.kind().emittedKeyword());
        if (d.name() != null) sb.append(' ').append(names.resolve(d.name()));
        if (d.hasBody()) {
            sb.append("\n{\n");
            for (Member m : inlineMembers(d)) {
                String text = inlineMember(m);
                if (text == null) continue;
                for (String line : text.split("\n", -1)) {
                    if (!line.isEmpty()) sb.append(INDENT);
                    sb.append(line).append('\n');
                }
            }
            sb.append('}');
        }
        if (d.constQualified()) sb.append(" const");
    }

    private List<Member> inlineMembers(Declaration d) {
        if (version == null) return Members.flatten(d.members());
        List<Member> out = new ArrayList<>();
        for (Existence.Slot slot : Existence.aliveMembers(d.members(), version)) {
            if (!slot.isBoundary()) out.add(slot.member());
        }
        return out;
    }

    private String inlineMember(Member m) {
        if (m instanceof Field f) return field(f) + ";";
        if (m instanceof Method method) return method(method) + ";";
        if (m instanceof EnumMember e) {
            return e.value() == null ? e.name() + "," : e.name() + " = " + expression(e.value()) + ",";
        }
        return null;
    }
}
