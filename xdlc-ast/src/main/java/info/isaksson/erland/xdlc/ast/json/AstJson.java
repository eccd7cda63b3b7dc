package info.isaksson.erland.xdlc.ast.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import info.isaksson.erland.xdlc.ast.XdlFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON dump of a parsed file, for debugging and golden tests.
 *
 * <p>Writing is deterministic: record components keep declaration order, maps are key-sorted.</p>
 */
public final class AstJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private AstJson() {}

    public static void write(XdlFile file, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        if (file == null) throw new IllegalArgumentException("file is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, file);
            // Trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(XdlFile file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file is null");
        return MAPPER.writer(PRETTY).writeValueAsString(file) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        // Absent optional parts (name, bit width, enum value) are left out rather than written as null.
        om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
