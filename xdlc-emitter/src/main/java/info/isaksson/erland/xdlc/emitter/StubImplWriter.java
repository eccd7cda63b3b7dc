package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.ast.AttributeKind;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.Members;
import info.isaksson.erland.xdlc.ast.Method;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.classify.AbiClassification;
import info.isaksson.erland.xdlc.io.DeclarationTable;
import info.isaksson.erland.xdlc.render.CodeWriter;
import info.isaksson.erland.xdlc.render.DeclaratorRenderer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders {@code impls_<stem>.g.h}: one {@code NameStub<ABI>} per interface with every inherited method declared
 * and defined out of line as {@code IMPLEMENT_STUB()} plus a default return.
 *
 * <p>Stubs declare the union of methods over all versions; a method missing from a given version's interface
 * simply overrides nothing there.</p>
 */
final class StubImplWriter {

    private final AbiClassification abi;
    private final HiddenReturnThunkWriter thunks;
    private final CodeWriter w = new CodeWriter();

    StubImplWriter(AbiClassification abi) {
        this.abi = abi;
        this.thunks = new HiddenReturnThunkWriter(abi, w);
    }

    String render(String stem, List<DeclarationTable.Entry> roots) {
        String guard = HeaderEmitter.guardName("impls_" + stem + ".g.h");
        w.line("#pragma once");
        w.line("#ifndef " + guard);
        w.line("#define " + guard);
        w.blank();
        w.line("#include \"" + stem + ".g.h\"");
        w.blank();

        NamespaceScope scope = new NamespaceScope(w);
        int written = 0;
        for (DeclarationTable.Entry e : roots) {
            Declaration d = e.declaration();
            if (!d.isInterface() || !d.hasBody()) continue;
            if (d.attributes().has(AttributeKind.NO_EMIT) || d.attributes().has(AttributeKind.NO_IMPL)) continue;
            scope.enter(d.namespace());
            if (written++ > 0) w.blank();
            writeStub(e);
        }
        scope.leave();

        if (written > 0) w.blank();
        w.line("#endif // " + guard);
        return w.toString();
    }

    private void writeStub(DeclarationTable.Entry e) {
        Declaration d = e.declaration();
        String stub = d.name() + "Stub";
        String parent = thunks.needsThunk(d)
                ? abi.qualifiedName(e.id()) + HiddenReturnThunkWriter.SUFFIX + "<ABI, " + stub + "<ABI>>"
                : abi.emissionName(e.id());
        DeclaratorRenderer renderer = new DeclaratorRenderer(abi);
        List<Method> methods = distinct(inheritedMethods(d), renderer);

        w.line("template<abi_t ABI>");
        w.line("class " + stub + " : public " + parent);
        w.open();
        w.outdented("public:");
        for (Method m : methods) {
            w.line(renderer.method(new Method(m.attributes(), m.name(), m.signature(), false, false)) + ";");
        }
        w.close(";");

        for (Method m : methods) {
            w.blank();
            w.line("template<abi_t ABI>");
            w.line(renderer.method(new Method(m.attributes(), stub + "<ABI>::" + m.name(), m.signature(), false, false)));
            w.open();
            w.line("IMPLEMENT_STUB();");
            String value = defaultReturn(m);
            if (value != null) w.line("return " + value + ";");
            w.close();
        }
    }

    /** Non-static methods of {@code d} and its bases, bases first, each declaration visited once. */
    private List<Method> inheritedMethods(Declaration d) {
        List<Method> out = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(d.name());
        collect(d, visited, out);
        return out;
    }

    private void collect(Declaration d, Set<String> visited, List<Method> out) {
        for (BaseTypeRef b : d.baseTypes()) {
            if (!visited.add(b.name())) continue;
            abi.declaration(b.name()).ifPresent(base -> collect(base, visited, out));
        }
        for (Method m : Members.methods(d.members())) {
            if (!m.staticMember()) out.add(m);
        }
    }

    /** Drops redeclarations, e.g. a method re-added later to move its table slot. */
    private static List<Method> distinct(List<Method> methods, DeclaratorRenderer renderer) {
        List<Method> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Method m : methods) {
            if (seen.add(renderer.method(new Method(m.attributes(), m.name(), m.signature(), false, false)))) out.add(m);
        }
        return out;
    }

    private static String defaultReturn(Method m) {
        if (m.returnsVoid()) return null;
        if (!m.attributes().has(AttributeKind.REGISTER_RETURN)
                && m.returnType() instanceof NamedType n
                && "HRESULT".equals(n.name())) {
            return "E_NOTIMPL";
        }
        return "{}";
    }
}
