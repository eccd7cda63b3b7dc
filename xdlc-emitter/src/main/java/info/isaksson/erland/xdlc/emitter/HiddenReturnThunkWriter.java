package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.ast.AttributeKind;
import info.isaksson.erland.xdlc.ast.Attributes;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.Existence;
import info.isaksson.erland.xdlc.ast.Members;
import info.isaksson.erland.xdlc.ast.Method;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.ast.Parameter;
import info.isaksson.erland.xdlc.ast.PointerType;
import info.isaksson.erland.xdlc.ast.SignatureType;
import info.isaksson.erland.xdlc.classify.AbiClassification;
import info.isaksson.erland.xdlc.io.DeclarationTable;
import info.isaksson.erland.xdlc.render.CodeWriter;
import info.isaksson.erland.xdlc.render.DeclaratorRenderer;
import info.isaksson.erland.xdlc.version.Breakpoints;
import info.isaksson.erland.xdlc.version.VersionAxis;
import info.isaksson.erland.xdlc.version.VersionWindow;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Writes {@code NameHiddenReturn<ABI, TImpl, TInterface>}: the bridge from the ABI form of a hidden-return
 * method ({@code Ret *Name_HiddenReturn(void *pResult, ...)}) to the implementation's by-value method.
 *
 * <p>The implementation method is called through a reinterpreted member pointer whose first two arguments are the
 * result slot and the object, the way a by-value return is passed by the platform calling convention.</p>
 */
final class HiddenReturnThunkWriter {

    static final String SUFFIX = "HiddenReturn";

    private final AbiClassification abi;
    private final CodeWriter w;

    HiddenReturnThunkWriter(AbiClassification abi, CodeWriter writer) {
        this.abi = abi;
        this.w = writer;
    }

    /** Abstract ABI form of a hidden-return method: {@code Ret *Name_HiddenReturn(void *pResult, params)}. */
    static Method abstractDeclaration(Method m) {
        List<Parameter> params = new ArrayList<>();
        params.add(Parameter.of(PointerType.to(NamedType.of("void")), "pResult"));
        params.addAll(m.signature().parameters());
        SignatureType signature = new SignatureType(PointerType.to(m.returnType()), params, m.signature().constQualified());
        return new Method(Attributes.NONE, m.name() + "_" + SUFFIX, signature, false, false);
    }

    /** True when the declaration or any declaration it inherits from declares a hidden-return method. */
    boolean needsThunk(Declaration d) {
        return needsThunk(d, new HashSet<>());
    }

    private boolean needsThunk(Declaration d, Set<String> visited) {
        if (d.name() != null) visited.add(d.name());
        if (Members.anyMatch(d.members(), m -> m instanceof Method && m.attributes().has(AttributeKind.HIDDEN_RETURN))) {
            return true;
        }
        for (BaseTypeRef b : d.baseTypes()) {
            if (!visited.add(b.name())) continue;
            Optional<DeclarationTable.Entry> base = abi.table().lookup(b.name());
            if (base.isPresent() && needsThunk(base.get().declaration(), visited)) return true;
        }
        return false;
    }

    void write(DeclarationTable.Entry e) {
        Declaration d = e.declaration();
        String thunk = d.name() + SUFFIX;
        List<VersionWindow> windows = VersionWindow.partition(Breakpoints.collect(d, VersionAxis.HIDDEN_RETURN));

        for (int i = 0; i < windows.size(); i++) {
            VersionWindow window = windows.get(i);
            if (i > 0) w.blank();
            if (window.isPrimary()) {
                w.line("template<abi_t ABI, typename TImpl, typename TInterface = " + abi.emissionName(e.id()) + ">");
                w.line("struct " + thunk + " : " + parent(d, window));
            } else {
                w.line("template<abi_t ABI, typename TImpl, typename TInterface>");
                w.line(window.requiresClause());
                w.line("struct " + thunk + "<ABI, TImpl, TInterface> : " + parent(d, window));
            }
            w.open();

            DeclaratorRenderer renderer = new DeclaratorRenderer(abi, window.at());
            int written = 0;
            for (Existence.Slot slot : Existence.aliveMembers(d.members(), window.at())) {
                if (slot.isBoundary() || !(slot.member() instanceof Method m)) continue;
                if (m.staticMember() || !m.attributes().has(AttributeKind.HIDDEN_RETURN)) continue;
                if (written++ > 0) w.blank();
                writeOverride(m, renderer);
            }
            w.close(";");
        }
    }

    private String parent(Declaration d, VersionWindow window) {
        for (BaseTypeRef b : Existence.aliveBaseTypes(d.baseTypes(), window.at())) {
            Optional<DeclarationTable.Entry> base = abi.table().lookup(b.name());
            if (base.isPresent() && needsThunk(base.get().declaration())) {
                return abi.qualifiedName(base.get().id()) + SUFFIX + "<ABI, TImpl, TInterface>";
            }
        }
        return "TInterface";
    }

    private void writeOverride(Method m, DeclaratorRenderer renderer) {
        List<Parameter> params = new ArrayList<>();
        List<Parameter> declared = m.signature().parameters();
        for (int i = 0; i < declared.size(); i++) {
            Parameter p = declared.get(i);
            params.add(p.name() == null ? new Parameter(p.attributes(), p.type(), "arg" + i) : p);
        }
        Method named = new Method(m.attributes(), m.name(),
                new SignatureType(m.returnType(), params, m.signature().constQualified()), false, false);

        List<Parameter> callParams = new ArrayList<>();
        callParams.add(Parameter.of(PointerType.to(NamedType.of("void")), null));
        callParams.add(Parameter.of(PointerType.to(NamedType.of("void")), null));
        callParams.addAll(params);
        SignatureType call = new SignatureType(PointerType.to(m.returnType()), callParams, false);

        StringJoiner args = new StringJoiner(", ");
        args.add("pResult");
        args.add(m.signature().constQualified()
                ? "const_cast<TImpl *>(static_cast<const TImpl *>(this))"
                : "static_cast<TImpl *>(this)");
        params.forEach(p -> args.add(p.name()));

        w.line(renderer.method(abstractDeclaration(named)) + " override");
        w.open();
        w.line("using TAbi = " + renderer.declarator(PointerType.to(call), null) + ";");
        w.line("auto method = &TImpl::" + m.name() + ";");
        w.line("return (*reinterpret_cast<TAbi *>(&method))(" + args + ");");
        w.close();
    }
}
