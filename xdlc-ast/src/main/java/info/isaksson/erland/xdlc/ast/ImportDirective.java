package info.isaksson.erland.xdlc.ast;

import java.util.Objects;

/** {@code import "path";} with {@code path} unquoted and relative to the importing file. */
public record ImportDirective(String path) implements XdlNode {

    public ImportDirective {
        Objects.requireNonNull(path, "path");
    }

    /** File name without directory and extension, e.g. {@code base} for {@code ../idl/base.xdl}. */
    public String stem() {
        String p = path.replace('\\', '/');
        int slash = p.lastIndexOf('/');
        String file = slash >= 0 ? p.substring(slash + 1) : p;
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
