package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.io.XdlSourceLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EmitterWarningsTest {

    @Test
    void warningsAreSortedByCodeMessageAndContext() {
        EmitterWarnings w = new EmitterWarnings();
        w.warn("B", "second", Map.of("k", "v"));
        w.warn("A", "zeta", "S", "x");
        w.warn("A", "alpha", "T", null);
        w.warn("A", "alpha", "S", null);

        List<EmitterWarning> list = w.toDeterministicList();
        assertEquals(4, w.size());
        assertEquals("A", list.get(0).code);
        assertEquals("alpha", list.get(0).message);
        assertEquals("S", list.get(0).context.get("declaration"));
        assertEquals("T", list.get(1).context.get("declaration"));
        assertEquals("zeta", list.get(2).message);
        assertEquals("B", list.get(3).code);
        assertThrows(UnsupportedOperationException.class, () -> list.add(list.get(0)));
    }

    @Test
    void formatIncludesContextInInsertionOrder() {
        EmitterWarning warning = new EmitterWarning("CODE", "message", null);
        assertEquals("CODE: message", warning.format());
        assertTrue(warning.context.isEmpty());

        EmitterWarnings w = new EmitterWarnings();
        w.warn("CODE", "message", "demo::S", "field");
        assertEquals("CODE: message (declaration=demo::S, member=field)", w.toDeterministicList().get(0).format());
    }

    @Test
    void invertedWindowsAreReportedAndNeverEmitted(@TempDir Path dir) throws Exception {
        Path root = dir.resolve("inverted.xdl");
        Files.writeString(root, """
                namespace demo {
                    struct W {
                        [added(3,0), removed(2,0)] int never;
                        int x;
                    };
                }
                """, StandardCharsets.UTF_8);

        EmissionResult result = new HeaderEmitter().emit(XdlSourceLoader.load(root), EmitterOptions.defaults());

        assertEquals(1, result.warnings.size());
        EmitterWarning warning = result.warnings.get(0);
        assertEquals(EmitterWarning.INVERTED_VERSION_WINDOW, warning.code);
        assertEquals("demo::W", warning.context.get("declaration"));
        assertEquals("never", warning.context.get("member"));
        assertTrue(warning.message.contains("3.0.0.0"), warning.message);
        assertFalse(result.headerText.contains("never"));
        assertTrue(result.headerText.contains("int x;"));
    }
}
