package info.isaksson.erland.xdlc.core;

import info.isaksson.erland.xdlc.emitter.EmissionResult;
import info.isaksson.erland.xdlc.emitter.EmitterWarning;
import info.isaksson.erland.xdlc.io.XdlSourceSet;

import java.nio.file.Path;
import java.util.List;

/** Compilation result container for programmatic usage. */
public final class XdlCompileResult {

    public final XdlSourceSet sources;
    public final EmissionResult emission;

    /** Written {@code <stem>.g.h}; {@code null} when nothing was written. */
    public final Path headerFile;

    /** Written {@code impls_<stem>.g.h}, or {@code null}. */
    public final Path stubsFile;

    /** Written AST dump, or {@code null}. */
    public final Path astFile;

    /** AST dump text when one was requested. */
    public final String astJson;

    XdlCompileResult(XdlSourceSet sources, EmissionResult emission, String astJson, Path headerFile, Path stubsFile, Path astFile) {
        this.sources = sources;
        this.emission = emission;
        this.astJson = astJson;
        this.headerFile = headerFile;
        this.stubsFile = stubsFile;
        this.astFile = astFile;
    }

    public List<EmitterWarning> warnings() {
        return emission.warnings;
    }

    /** Number of declarations in the compiled file. */
    public int rootDeclarationCount() {
        return sources.table().roots().size();
    }

    /** Number of declarations emitted as version templates, imported ones included. */
    public int abiTypeCount() {
        return emission.classification.abiIds().size();
    }
}
