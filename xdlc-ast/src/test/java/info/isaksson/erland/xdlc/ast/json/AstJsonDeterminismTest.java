package info.isaksson.erland.xdlc.ast.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.xdlc.ast.AttributeNode;
import info.isaksson.erland.xdlc.ast.Attributes;
import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.DeclarationKind;
import info.isaksson.erland.xdlc.ast.EnumMember;
import info.isaksson.erland.xdlc.ast.Field;
import info.isaksson.erland.xdlc.ast.ImportDirective;
import info.isaksson.erland.xdlc.ast.IntegerLiteral;
import info.isaksson.erland.xdlc.ast.NamedType;
import info.isaksson.erland.xdlc.ast.PointerType;
import info.isaksson.erland.xdlc.ast.XdlFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonDeterminismTest {

    private static XdlFile sample() {
        Declaration e = new Declaration(DeclarationKind.ENUM, Attributes.NONE, "Mode", List.of(),
                List.of(new EnumMember(Attributes.NONE, "A", new IntegerLiteral(1))), true, false, "demo");
        Declaration s = new Declaration(DeclarationKind.STRUCT,
                Attributes.of(AttributeNode.of("added", new IntegerLiteral(10), new IntegerLiteral(0))),
                "Point", List.of(),
                List.of(Field.of(NamedType.of("int"), "x"), Field.of(PointerType.to(NamedType.of("Mode")), "mode")),
                true, false, "demo");
        return new XdlFile("sample.xdl", List.of(new ImportDirective("base.xdl")), List.of(e, s));
    }

    @Test
    void writesStableTaggedJson(@TempDir Path dir) throws Exception {
        String json = AstJson.toJsonString(sample());
        assertTrue(json.endsWith("}\n"));

        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals("sample.xdl", root.get("sourceName").asText());
        assertEquals("base.xdl", root.get("imports").get(0).get("path").asText());
        JsonNode point = root.get("declarations").get(1);
        assertEquals("declaration", point.get("node").asText());
        assertEquals("STRUCT", point.get("kind").asText());
        assertEquals("added", point.get("attributes").get(0).get("name").asText());
        assertEquals("pointer", point.get("members").get(1).get("type").get("node").asText());
        assertFalse(point.get("members").get(0).has("bitWidth"), "null components are omitted");

        Path a = dir.resolve("a.json");
        Path b = dir.resolve("nested/b.json");
        AstJson.write(sample(), a);
        AstJson.write(sample(), b);
        assertEquals(Files.readString(a, StandardCharsets.UTF_8), Files.readString(b, StandardCharsets.UTF_8));
        assertEquals(json, Files.readString(a, StandardCharsets.UTF_8));
    }
}
