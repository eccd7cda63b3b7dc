package info.isaksson.erland.xdlc.io;

import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.ImportDirective;
import info.isaksson.erland.xdlc.ast.XdlFile;
import info.isaksson.erland.xdlc.ast.XdlNode;
import info.isaksson.erland.xdlc.parse.XdlParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parses a root file and, depth-first, every file it imports.
 *
 * <p>Imports are resolved relative to the importing file and deduplicated by canonical path, so cyclic and
 * diamond imports terminate and each file is parsed once. An import is expanded as soon as the parser reaches
 * it, before the declarations that follow it.</p>
 */
public final class XdlSourceLoader {

    private final DeclarationTable table = new DeclarationTable();
    private final Set<Path> visited = new HashSet<>();
    private final List<ImportDirective> imports = new ArrayList<>();
    private final List<Path> loadedFiles = new ArrayList<>();

    private XdlSourceLoader() {}

    public static XdlSourceSet load(Path rootFile) {
        Objects.requireNonNull(rootFile, "rootFile");
        return new XdlSourceLoader().run(rootFile);
    }

    private XdlSourceSet run(Path rootFile) {
        Path root = canonical(rootFile);
        visited.add(root);
        XdlFile rootAst = parseFile(root, DeclarationTable.Origin.ROOT);
        return new XdlSourceSet(root, rootAst, imports, loadedFiles, table);
    }

    private XdlFile parseFile(Path file, DeclarationTable.Origin origin) {
        loadedFiles.add(file);
        String text = read(file);
        Path dir = file.getParent();
        XdlParser parser = new XdlParser(file.getFileName().toString(), text);

        List<ImportDirective> ownImports = new ArrayList<>();
        List<Declaration> ownDeclarations = new ArrayList<>();
        for (XdlNode node = parser.readNext(); node != null; node = parser.readNext()) {
            if (node instanceof ImportDirective directive) {
                ownImports.add(directive);
                Path target = canonical(dir == null ? Path.of(directive.path()) : dir.resolve(directive.path()));
                if (!visited.add(target)) continue;
                imports.add(directive);
                parseFile(target, DeclarationTable.Origin.IMPORTED);
            } else if (node instanceof Declaration declaration) {
                ownDeclarations.add(declaration);
                table.register(declaration, origin, file);
            }
        }
        return new XdlFile(file.getFileName().toString(), ownImports, ownDeclarations);
    }

    private static Path canonical(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new ImportException(path.toAbsolutePath().normalize(), e);
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ImportException(file, e);
        }
    }
}
