package info.isaksson.erland.xdlc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MainArgsTest {

    @Test
    void parsesPositionalsAfterTheVerb() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {"compile", "in.xdl", "out", "Make", "--write-ast", "a.json"});

        assertEquals("in.xdl", a.input);
        assertEquals("out", a.outputDir);
        assertEquals("Make", a.factoryName);
        assertEquals("a.json", a.writeAst);
        assertFalse(a.help);
    }

    @Test
    void fileNamedCompileAfterTheVerbIsTheInput() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {"compile", "compile", "out"});

        assertEquals("compile", a.input);
        assertEquals("out", a.outputDir);
    }

    @Test
    void supportsEqualsFormOfWriteAst() {
        assertEquals("x.json", Main.CliArgs.parse(new String[] {"in.xdl", "out", "--write-ast=x.json"}).writeAst);
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"in.xdl", "out", "9lives"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"in.xdl", "out", "F", "extra"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"in.xdl", "--write-ast"}));
    }

    @Test
    void usageErrorsExitWithOne() {
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"only-input.xdl"}));
        assertEquals(1, Main.run(new String[] {"in.xdl", "out", "not-an-identifier"}));
    }

    @Test
    void helpExitsWithZero() {
        assertEquals(0, Main.run(new String[] {"--help"}));
        assertEquals(0, Main.run(new String[] {"-h"}));
    }
}
