package info.isaksson.erland.xdlc.io;

import info.isaksson.erland.xdlc.ast.ImportDirective;
import info.isaksson.erland.xdlc.ast.XdlFile;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of loading a root file with its transitive imports.
 *
 * @param rootFile    canonical path of the compiled file
 * @param rootAst     parse result of the compiled file alone
 * @param imports     every distinct import in first-visit order, nested imports included
 * @param loadedFiles canonical paths of every parsed file, root first
 * @param table       all declarations; treat as read-only once loading is done
 */
public record XdlSourceSet(
        Path rootFile,
        XdlFile rootAst,
        List<ImportDirective> imports,
        List<Path> loadedFiles,
        DeclarationTable table
) {

    public XdlSourceSet {
        Objects.requireNonNull(rootFile, "rootFile");
        Objects.requireNonNull(rootAst, "rootAst");
        Objects.requireNonNull(table, "table");
        imports = imports == null ? List.of() : List.copyOf(imports);
        loadedFiles = loadedFiles == null ? List.of() : List.copyOf(loadedFiles);
    }

    /** File name of the root without extension. */
    public String rootStem() {
        String file = rootFile.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
