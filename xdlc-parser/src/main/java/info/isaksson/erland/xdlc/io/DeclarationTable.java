package info.isaksson.erland.xdlc.io;

import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.SemanticException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Arena of every declaration seen during one compilation, with stable integer ids in registration order.
 *
 * <p>Name lookup returns the first registration of a name: a later file declaring the same name is kept in the
 * arena (and emitted when it is a root declaration) but never wins resolution. Declaring a name twice in the same
 * file is an error.</p>
 */
public final class DeclarationTable {

    public enum Origin {
        /** Declared in the file being compiled; emitted. */
        ROOT,
        /** Declared in a transitively imported file; used for resolution only. */
        IMPORTED
    }

    public record Entry(int id, Declaration declaration, Origin origin, Path sourceFile) {

        public String name() {
            return declaration.name();
        }

        public boolean isRoot() {
            return origin == Origin.ROOT;
        }
    }

    private final List<Entry> entries = new ArrayList<>();
    private final Map<String, Integer> byName = new HashMap<>();
    private final Map<Path, Set<String>> namesByFile = new HashMap<>();

    /**
     * @return the new entry's id
     * @throws SemanticException when {@code sourceFile} already declared the same name
     */
    public int register(Declaration declaration, Origin origin, Path sourceFile) {
        Objects.requireNonNull(declaration, "declaration");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(sourceFile, "sourceFile");
        String name = declaration.name();
        if (name == null) throw new IllegalArgumentException("top-level declarations must be named");

        Set<String> fileNames = namesByFile.computeIfAbsent(sourceFile, k -> new HashSet<>());
        if (!fileNames.add(name)) {
            throw new SemanticException(name, "declared more than once in " + sourceFile.getFileName());
        }

        int id = entries.size();
        entries.add(new Entry(id, declaration, origin, sourceFile));
        byName.putIfAbsent(name, id);
        return id;
    }

    public Entry get(int id) {
        return entries.get(id);
    }

    public int size() {
        return entries.size();
    }

    public Optional<Entry> lookup(String name) {
        Integer id = byName.get(name);
        return id == null ? Optional.empty() : Optional.of(entries.get(id));
    }

    /** Every entry in registration order, shadowed names included. */
    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /** Entries that win name resolution, in registration order. */
    public List<Entry> allTypes() {
        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) {
            if (byName.get(e.name()) == e.id()) out.add(e);
        }
        return out;
    }

    /** Declarations of the compiled file, in source order. */
    public List<Entry> roots() {
        return byOrigin(Origin.ROOT);
    }

    public List<Entry> imported() {
        return byOrigin(Origin.IMPORTED);
    }

    private List<Entry> byOrigin(Origin origin) {
        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e.origin() == origin) out.add(e);
        }
        return out;
    }
}
