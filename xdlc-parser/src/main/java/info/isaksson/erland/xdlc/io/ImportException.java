package info.isaksson.erland.xdlc.io;

import info.isaksson.erland.xdlc.ast.XdlException;

import java.io.IOException;
import java.nio.file.Path;

/** A source file (the root or an import) could not be read. */
public final class ImportException extends XdlException {

    private final Path path;

    public ImportException(Path path, IOException cause) {
        super("cannot read " + path + ": " + describe(cause), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }

    private static String describe(IOException e) {
        String msg = e.getMessage();
        String type = e.getClass().getSimpleName();
        return msg == null || msg.isBlank() ? type : type + " (" + msg + ")";
    }
}
