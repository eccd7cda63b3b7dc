package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.ast.ImportDirective;
import info.isaksson.erland.xdlc.ast.Version;
import info.isaksson.erland.xdlc.classify.AbiClassification;
import info.isaksson.erland.xdlc.classify.AbiClassifier;
import info.isaksson.erland.xdlc.io.DeclarationTable;
import info.isaksson.erland.xdlc.io.XdlSourceSet;
import info.isaksson.erland.xdlc.render.CodeWriter;
import info.isaksson.erland.xdlc.version.Breakpoints;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Public API: emit the versioned C++ header (and optionally the stub header) for a loaded source set.
 *
 * <p>Emission is purely in memory; {@link #emitTo} writes the files only after every artifact has rendered, so a
 * failing input leaves the output directory untouched.</p>
 */
public final class HeaderEmitter {

    public EmissionResult emit(XdlSourceSet sources, EmitterOptions options) {
        if (sources == null) throw new IllegalArgumentException("sources must not be null");
        if (options == null) options = EmitterOptions.defaults();

        DeclarationTable table = sources.table();
        List<DeclarationTable.Entry> roots = table.roots();
        AbiClassification abi = AbiClassifier.classify(table);

        EmitterWarnings warnings = new EmitterWarnings();
        InvertedWindowCheck check = new InvertedWindowCheck(warnings);
        TreeSet<Version> versions = new TreeSet<>();
        for (DeclarationTable.Entry e : roots) {
            check.scan(e.declaration());
            versions.addAll(Breakpoints.transitive(e.declaration(), table));
        }

        String stem = sources.rootStem();
        String headerName = stem + ".g.h";
        String header = renderHeader(headerName, sources.imports(), roots, abi, options.factoryName, new ArrayList<>(versions));

        String stubsName = null;
        String stubs = null;
        if (options.emitStubs) {
            stubsName = "impls_" + stem + ".g.h";
            stubs = new StubImplWriter(abi).render(stem, roots);
        }

        List<String> breakpoints = new ArrayList<>();
        versions.forEach(v -> breakpoints.add(v.toString()));
        return new EmissionResult(headerName, header, stubsName, stubs, breakpoints, abi, warnings.toDeterministicList());
    }

    /** Emits and then writes the artifacts into {@code outputDir}, creating it when missing. */
    public EmissionResult emitTo(XdlSourceSet sources, EmitterOptions options, Path outputDir) throws IOException {
        if (outputDir == null) throw new IllegalArgumentException("outputDir must not be null");
        EmissionResult result = emit(sources, options);
        ArtifactWriter writer = new ArtifactWriter();
        stage(writer, result, outputDir);
        writer.commit();
        return result;
    }

    /** Stages the header and, when rendered, the stub header of {@code result} under {@code outputDir}. */
    public static void stage(ArtifactWriter writer, EmissionResult result, Path outputDir) throws IOException {
        writer.stage(outputDir.resolve(result.headerFileName), result.headerText);
        if (result.hasStubs()) {
            writer.stage(outputDir.resolve(result.stubsFileName), result.stubsText);
        }
    }

    private static String renderHeader(
            String headerName,
            List<ImportDirective> imports,
            List<DeclarationTable.Entry> roots,
            AbiClassification abi,
            String factoryName,
            List<Version> breakpoints
    ) {
        String guard = guardName(headerName);
        CodeWriter w = new CodeWriter();
        w.line("#pragma once");
        w.line("#ifndef " + guard);
        w.line("#define " + guard);
        w.blank();
        w.line("#include <xcom/base.h>");
        if (!imports.isEmpty()) {
            w.blank();
            for (ImportDirective i : imports) {
                w.line("#include \"" + i.stem() + ".g.h\"");
            }
        }
        w.blank();

        new DeclarationWriter(abi, w).writeTypes(roots);
        w.blank();
        UuidTableWriter.write(w, abi, roots);

        if (factoryName != null) {
            FactoryWriter.write(w, factoryName, breakpoints);
            w.blank();
        }
        w.line("#endif // " + guard);
        return w.toString();
    }

    /** {@code demo.g.h} becomes {@code __demo_g_h__}. */
    static String guardName(String fileName) {
        return "__" + fileName.replaceAll("[^A-Za-z0-9_]", "_") + "__";
    }
}
