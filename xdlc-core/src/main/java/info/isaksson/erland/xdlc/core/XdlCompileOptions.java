package info.isaksson.erland.xdlc.core;

import java.nio.file.Path;

/**
 * Options of one compilation run.
 *
 * <p>Mirrors the CLI arguments in structured form.</p>
 */
public final class XdlCompileOptions {

    /**
     * Runtime version dispatcher to emit. When set, the stub header {@code impls_<stem>.g.h} is produced as well;
     * when {@code null} neither is.
     */
    public final String factoryName;

    /** Where to dump the parsed root file as JSON, or {@code null}. */
    public final Path astOutput;

    public XdlCompileOptions(String factoryName, Path astOutput) {
        this.factoryName = factoryName == null || factoryName.isBlank() ? null : factoryName.trim();
        this.astOutput = astOutput;
    }

    public static XdlCompileOptions defaults() {
        return new XdlCompileOptions(null, null);
    }

    public XdlCompileOptions withFactoryName(String name) {
        return new XdlCompileOptions(name, astOutput);
    }

    public XdlCompileOptions withAstOutput(Path path) {
        return new XdlCompileOptions(factoryName, path);
    }

    @Override
    public String toString() {
        return "XdlCompileOptions{factoryName='" + factoryName + "', astOutput=" + astOutput + '}';
    }
}
