package info.isaksson.erland.xdlc.emitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes a group of text artifacts all together or not at all.
 *
 * <p>Each {@link #stage} writes a temporary sibling of its target. {@link #commit} renames the staged files into
 * place once every artifact is staged. If staging fails, the temporary files and any directories created for them
 * are removed, and no target is touched.</p>
 */
public final class ArtifactWriter {

    private final Map<Path, Path> staged = new LinkedHashMap<>();
    private final List<Path> createdDirectories = new ArrayList<>();

    /** Writes {@code text} next to {@code target}; rolls back everything staged so far on failure. */
    public ArtifactWriter stage(Path target, String text) throws IOException {
        if (target == null) throw new IllegalArgumentException("target must not be null");
        if (text == null) throw new IllegalArgumentException("text must not be null");
        Path file = target.toAbsolutePath().normalize();
        try {
            if (Files.isDirectory(file)) throw new IOException("output path is a directory: " + file);
            Path parent = file.getParent();
            createDirectories(parent);
            // a plain file rather than createTempFile, so the result keeps the usual permissions
            Path tmp = parent.resolve("." + file.getFileName() + "." + UUID.randomUUID() + ".tmp");
            staged.put(file, tmp);
            Files.writeString(tmp, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            rollback(e);
            throw e;
        }
        return this;
    }

    /** Moves every staged file onto its target, in staging order. */
    public void commit() throws IOException {
        try {
            for (Map.Entry<Path, Path> e : staged.entrySet()) {
                move(e.getValue(), e.getKey());
            }
        } catch (IOException e) {
            rollback(e);
            throw e;
        }
        staged.clear();
        createdDirectories.clear();
    }

    private void createDirectories(Path dir) throws IOException {
        List<Path> missing = new ArrayList<>();
        for (Path p = dir; p != null && !Files.exists(p); p = p.getParent()) {
            missing.add(0, p);
        }
        Files.createDirectories(dir);
        createdDirectories.addAll(missing);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void rollback(IOException failure) {
        for (Path tmp : staged.values()) {
            deleteQuietly(tmp, failure);
        }
        for (int i = createdDirectories.size() - 1; i >= 0; i--) {
            deleteQuietly(createdDirectories.get(i), failure);
        }
        staged.clear();
        createdDirectories.clear();
    }

    private static void deleteQuietly(Path path, IOException failure) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
