package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.ast.AttributeKind;
import info.isaksson.erland.xdlc.ast.BaseTypeRef;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.DeclarationKind;
import info.isaksson.erland.xdlc.ast.EnumMember;
import info.isaksson.erland.xdlc.ast.Existence;
import info.isaksson.erland.xdlc.ast.Field;
import info.isaksson.erland.xdlc.ast.Member;
import info.isaksson.erland.xdlc.ast.MemberBlock;
import info.isaksson.erland.xdlc.ast.Members;
import info.isaksson.erland.xdlc.ast.Method;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.ast.SemanticException;
import info.isaksson.erland.xdlc.ast.SignatureType;
import info.isaksson.erland.xdlc.classify.AbiClassification;
import info.isaksson.erland.xdlc.io.DeclarationTable;
import info.isaksson.erland.xdlc.render.CodeWriter;
import info.isaksson.erland.xdlc.render.DeclaratorRenderer;
import info.isaksson.erland.xdlc.version.Breakpoints;
import info.isaksson.erland.xdlc.version.VersionAxis;
import info.isaksson.erland.xdlc.version.VersionWindow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Writes forward declarations and versioned bodies of the root declarations.
 *
 * <p>An ABI declaration is written as a primary {@code template<abi_t ABI>} followed by one constrained
 * specialization per breakpoint. A non-ABI declaration is a single plain body.</p>
 */
final class DeclarationWriter {

    private final AbiClassification abi;
    private final CodeWriter w;
    private final HiddenReturnThunkWriter thunks;

    DeclarationWriter(AbiClassification abi, CodeWriter writer) {
        this.abi = abi;
        this.w = writer;
        this.thunks = new HiddenReturnThunkWriter(abi, writer);
    }

    void writeTypes(List<DeclarationTable.Entry> roots) {
        NamespaceScope scope = new NamespaceScope(w);

        for (DeclarationTable.Entry e : roots) {
            Declaration d = e.declaration();
            if (d.attributes().has(AttributeKind.NO_EMIT)) continue;
            boolean isAbi = abi.isAbi(e.id());
            // An alias template cannot be forward declared, and an enum without an underlying type cannot either.
            if (d.isEnum() && (isAbi || d.baseTypes().isEmpty())) continue;

            scope.enter(d.namespace());
            if (isAbi) w.line("template<abi_t ABI>");
            w.line(forwardDeclaration(d));
            w.blank();
            if (d.isInterface()) {
                if (isAbi) w.line("template<abi_t ABI>");
                w.line("struct " + d.name() + "Vtbl;");
                w.blank();
            }
        }

        int written = 0;
        for (DeclarationTable.Entry e : roots) {
            Declaration d = e.declaration();
            if (d.attributes().has(AttributeKind.NO_EMIT) || !d.hasBody()) continue;
            scope.enter(d.namespace());
            if (written++ > 0) w.blank();
            write(e);
        }
        scope.leave();
    }

    private String forwardDeclaration(Declaration d) {
        if (d.isEnum()) {
            return "enum " + d.name() + " : " + abi.resolve(d.baseTypes().get(0).name()) + ";";
        }
        return d.kind().emittedKeyword() + " " + d.name() + ";";
    }

    private void write(DeclarationTable.Entry e) {
        Declaration d = e.declaration();
        boolean isAbi = abi.isAbi(e.id());
        if (d.isEnum()) {
            if (isAbi) {
                writeVersionedEnum(d);
            } else {
                writeEnumBody("enum " + d.name(), d, d.baseTypes(), new VersionWindow(null, null));
            }
            return;
        }

        boolean data = d.isInterface() && d.hasFields();
        boolean conditionalBases = d.hasConditionalBases();
        if (data || conditionalBases) {
            w.line("namespace details");
            w.open();
            if (data) writeDataBodies(d, isAbi);
            if (conditionalBases) {
                if (data) w.blank();
                writeBaseBodies(d);
            }
            w.close();
            w.blank();
        }

        writeMainBodies(d, isAbi, data, conditionalBases);

        if (d.isInterface()) {
            w.blank();
            writeVtblBodies(d, isAbi, conditionalBases);
            if (thunks.needsThunk(d)) {
                w.blank();
                thunks.write(e);
            }
        }
    }

    // ---- enums

    private void writeVersionedEnum(Declaration d) {
        w.line("namespace details");
        w.open();
        List<VersionWindow> windows = VersionWindow.partition(Breakpoints.collect(d, VersionAxis.ENUM));
        for (int i = 0; i < windows.size(); i++) {
            VersionWindow window = windows.get(i);
            if (i > 0) w.blank();
            templateHeader(true, window);
            w.line("struct " + d.name() + "Enum" + specialization(true, window));
            w.open();
            writeEnumBody("enum type", d, Existence.aliveBaseTypes(d.baseTypes(), window.at()), window);
            w.close(";");
        }
        w.close();
        w.blank();
        w.line("template<abi_t ABI>");
        w.line("using " + d.name() + " = typename details::" + d.name() + "Enum<ABI>::type;");
    }

    private void writeEnumBody(String head, Declaration d, List<BaseTypeRef> bases, VersionWindow window) {
        w.line(bases.isEmpty() ? head : head + " : " + abi.resolve(bases.get(0).name()));
        w.open();
        DeclaratorRenderer renderer = new DeclaratorRenderer(abi, window.at());
        writeMembers(d.members(), window, m -> m instanceof EnumMember, m -> {
            EnumMember em = (EnumMember) m;
            w.line(em.value() == null ? em.name() + "," : em.name() + " = " + renderer.expression(em.value()) + ",");
        });
        w.close(";");
    }

    // ---- details::NameData / NameBase / NameVtblBase

    private void writeDataBodies(Declaration d, boolean isAbi) {
        List<VersionWindow> windows = windows(d, isAbi, VersionAxis.DATA);
        for (int i = 0; i < windows.size(); i++) {
            VersionWindow window = windows.get(i);
            if (i > 0) w.blank();
            DeclaratorRenderer renderer = new DeclaratorRenderer(abi, window.at());
            templateHeader(isAbi, window);
            w.line("struct " + d.name() + "Data" + specialization(isAbi, window));
            w.open();
            writeMembers(d.members(), window, m -> m instanceof Field, m -> w.line(renderer.field((Field) m) + ";"));
            w.close(";");
        }
    }

    private void writeBaseBodies(Declaration d) {
        List<VersionWindow> windows = VersionWindow.partition(Breakpoints.collect(d, VersionAxis.BASE_TYPE));
        for (int i = 0; i < windows.size(); i++) {
            VersionWindow window = windows.get(i);
            if (i > 0) w.blank();
            List<BaseTypeRef> alive = Existence.aliveBaseTypes(d.baseTypes(), window.at());

            List<String> bases = new ArrayList<>();
            for (BaseTypeRef b : alive) bases.add(abi.emissionName(resolveBase(d, b)));
            templateHeader(true, window);
            w.line("struct " + d.name() + "Base" + specialization(true, window) + inheritance(bases) + " {};");

            if (d.isInterface()) {
                List<String> vtbls = new ArrayList<>();
                for (BaseTypeRef b : alive) vtbls.add(abi.vtblEmissionName(resolveBase(d, b)));
                w.blank();
                templateHeader(true, window);
                w.line("struct " + d.name() + "VtblBase" + specialization(true, window) + inheritance(vtbls) + " {};");
            }
        }
    }

    // ---- main body

    private void writeMainBodies(Declaration d, boolean isAbi, boolean data, boolean conditionalBases) {
        List<VersionWindow> windows = d.isInterface()
                ? windows(d, isAbi, VersionAxis.CODE)
                : windows(d, isAbi, VersionAxis.DATA);
        String access = d.kind() == DeclarationKind.CLASS ? "public " : "";

        for (int i = 0; i < windows.size(); i++) {
            VersionWindow window = windows.get(i);
            if (i > 0) w.blank();
            DeclaratorRenderer renderer = new DeclaratorRenderer(abi, window.at());

            List<String> bases = new ArrayList<>();
            if (conditionalBases) {
                bases.add(access + "details::" + d.name() + "Base<ABI>");
            } else {
                for (BaseTypeRef b : Existence.aliveBaseTypes(d.baseTypes(), window.at())) {
                    bases.add(access + abi.emissionName(resolveBase(d, b)));
                }
            }
            if (data) bases.add(access + "details::" + d.name() + "Data" + (isAbi ? "<ABI>" : ""));

            templateHeader(isAbi, window);
            w.line(d.kind().emittedKeyword() + " " + d.name() + specialization(isAbi, window) + inheritance(bases));
            w.open();
            if (d.kind() == DeclarationKind.CLASS) w.outdented("public:");
            if (d.isInterface()) {
                writeMembers(d.members(), window, m -> m instanceof Method, m -> interfaceMethod((Method) m, renderer));
            } else {
                // structs, classes and unions carry their layout only
                writeMembers(d.members(), window, m -> m instanceof Field, m -> w.line(renderer.field((Field) m) + ";"));
            }
            w.close(";");
        }
    }

    private void interfaceMethod(Method m, DeclaratorRenderer renderer) {
        if (m.attributes().has(AttributeKind.HIDDEN_RETURN)) {
            w.outdented("private:");
            w.line("virtual " + renderer.method(HiddenReturnThunkWriter.abstractDeclaration(m)) + " = 0;");
            w.outdented("public:");
        } else if (m.staticMember()) {
            w.line(renderer.method(m) + ";");
        } else {
            w.line("virtual " + renderer.method(m) + " = 0;");
        }
    }

    // ---- NameVtbl

    private void writeVtblBodies(Declaration d, boolean isAbi, boolean conditionalBases) {
        List<VersionWindow> windows = windows(d, isAbi, VersionAxis.CODE);
        for (int i = 0; i < windows.size(); i++) {
            VersionWindow window = windows.get(i);
            if (i > 0) w.blank();
            DeclaratorRenderer renderer = new DeclaratorRenderer(abi, window.at());

            List<String> bases = new ArrayList<>();
            if (conditionalBases) {
                bases.add("details::" + d.name() + "VtblBase<ABI>");
            } else {
                for (BaseTypeRef b : Existence.aliveBaseTypes(d.baseTypes(), window.at())) {
                    bases.add(abi.vtblEmissionName(resolveBase(d, b)));
                }
            }

            templateHeader(isAbi, window);
            w.line("struct " + d.name() + "Vtbl" + specialization(isAbi, window) + inheritance(bases));
            w.open();
            writeMembers(d.members(), window,
                    m -> m instanceof Method method && !method.staticMember(),
                    m -> w.line(tableEntry((Method) m, renderer) + ";"));
            w.close(";");
        }
    }

    private static String tableEntry(Method m, DeclaratorRenderer renderer) {
        if (m.attributes().has(AttributeKind.HIDDEN_RETURN)) {
            return renderer.tableEntry(m.name(), HiddenReturnThunkWriter.abstractDeclaration(m).signature());
        }
        SignatureType signature = m.signature();
        if (m.attributes().has(AttributeKind.REGISTER_RETURN)) {
            NamedType wrapped = NamedType.of("reg_return_t<" + renderer.declarator(m.returnType(), null) + ">");
            signature = new SignatureType(wrapped, signature.parameters(), signature.constQualified());
        }
        return renderer.tableEntry(m.name(), signature);
    }

    // ---- shared

    /**
     * Writes the members alive in {@code window} that {@code accept} selects. Conditional members and conditional
     * blocks holding selected members are wrapped in {@code #if} / {@code #endif}.
     */
    private void writeMembers(List<Member> members, VersionWindow window, Predicate<Member> accept, Consumer<Member> emit) {
        for (Existence.Slot slot : Existence.aliveMembers(members, window.at())) {
            Member m = slot.member();
            switch (slot.kind()) {
                case ENTER_BLOCK -> {
                    MemberBlock block = (MemberBlock) m;
                    if (Members.anyMatch(block.members(), accept)) {
                        block.attributes().condition().ifPresent(c -> w.directive("#if " + c));
                    }
                }
                case EXIT_BLOCK -> {
                    MemberBlock block = (MemberBlock) m;
                    if (Members.anyMatch(block.members(), accept) && block.attributes().condition().isPresent()) {
                        w.directive("#endif");
                    }
                }
                case MEMBER -> {
                    if (accept.test(m)) {
                        Optional<String> condition = m.attributes().condition();
                        condition.ifPresent(c -> w.directive("#if " + c));
                        emit.accept(m);
                        if (condition.isPresent()) w.directive("#endif");
                    }
                }
            }
        }
    }

    private List<VersionWindow> windows(Declaration d, boolean isAbi, VersionAxis axis) {
        if (!isAbi) return List.of(new VersionWindow(null, null));
        return VersionWindow.partition(Breakpoints.collect(d, axis));
    }

    private void templateHeader(boolean isAbi, VersionWindow window) {
        if (!isAbi) return;
        w.line("template<abi_t ABI>");
        if (!window.isPrimary()) w.line(window.requiresClause());
    }

    private static String specialization(boolean isAbi, VersionWindow window) {
        return isAbi && !window.isPrimary() ? "<ABI>" : "";
    }

    private static String inheritance(List<String> bases) {
        if (bases.isEmpty()) return "";
        StringJoiner joiner = new StringJoiner(", ", " : ", "");
        bases.forEach(joiner::add);
        return joiner.toString();
    }

    private int resolveBase(Declaration owner, BaseTypeRef base) {
        return abi.table().lookup(base.name())
                .map(DeclarationTable.Entry::id)
                .orElseThrow(() -> new SemanticException(owner.name(), "base type '" + base.name() + "' is not declared"));
    }
}
