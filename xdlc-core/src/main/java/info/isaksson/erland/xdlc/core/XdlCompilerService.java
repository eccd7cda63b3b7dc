package info.isaksson.erland.xdlc.core;

import info.isaksson.erland.xdlc.ast.json.AstJson;
import info.isaksson.erland.xdlc.emitter.ArtifactWriter;
import info.isaksson.erland.xdlc.emitter.EmissionResult;
import info.isaksson.erland.xdlc.emitter.EmitterOptions;
import info.isaksson.erland.xdlc.emitter.HeaderEmitter;
import info.isaksson.erland.xdlc.io.XdlSourceLoader;
import info.isaksson.erland.xdlc.io.XdlSourceSet;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Core API: one compilation run from a root {@code .xdl} file to generated headers.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline. Every artifact is
 * rendered in memory first; on any {@link info.isaksson.erland.xdlc.ast.XdlException} nothing is written, and
 * an I/O failure while staging the files leaves every target untouched.</p>
 */
public final class XdlCompilerService {

    /** Compile and write the artifacts into {@code outputDir}. */
    public XdlCompileResult compile(Path input, Path outputDir, XdlCompileOptions options) throws IOException {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        if (outputDir == null) throw new IllegalArgumentException("outputDir must not be null");
        if (options == null) options = XdlCompileOptions.defaults();

        XdlSourceSet sources = XdlSourceLoader.load(input);
        String astJson = options.astOutput == null ? null : AstJson.toJsonString(sources.rootAst());
        EmissionResult emission = new HeaderEmitter().emit(sources, emitterOptions(options));

        ArtifactWriter writer = new ArtifactWriter();
        HeaderEmitter.stage(writer, emission, outputDir);
        Path ast = null;
        if (astJson != null) {
            ast = options.astOutput;
            writer.stage(ast, astJson);
        }
        writer.commit();

        Path header = outputDir.resolve(emission.headerFileName);
        Path stubs = emission.hasStubs() ? outputDir.resolve(emission.stubsFileName) : null;
        return new XdlCompileResult(sources, emission, astJson, header, stubs, ast);
    }

    /** Compile without touching the file system beyond reading the sources. */
    public XdlCompileResult render(Path input, XdlCompileOptions options) throws IOException {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        if (options == null) options = XdlCompileOptions.defaults();

        XdlSourceSet sources = XdlSourceLoader.load(input);
        EmissionResult emission = new HeaderEmitter().emit(sources, emitterOptions(options));
        String astJson = options.astOutput == null ? null : AstJson.toJsonString(sources.rootAst());
        return new XdlCompileResult(sources, emission, astJson, null, null, null);
    }

    private static EmitterOptions emitterOptions(XdlCompileOptions options) {
        return EmitterOptions.defaults().withFactoryName(options.factoryName);
    }
}
