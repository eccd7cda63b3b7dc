package info.isaksson.erland.xdlc.ast;

import java.util.List;
import java.util.Objects;

/** Parse result of one source file, imports and declarations in file order. */
public record XdlFile(String sourceName, List<ImportDirective> imports, List<Declaration> declarations) {

    public XdlFile {
        Objects.requireNonNull(sourceName, "sourceName");
        imports = imports == null ? List.of() : List.copyOf(imports);
        declarations = declarations == null ? List.of() : List.copyOf(declarations);
    }
}
