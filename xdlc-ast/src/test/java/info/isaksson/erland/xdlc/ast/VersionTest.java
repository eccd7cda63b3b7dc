package info.isaksson.erland.xdlc.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VersionTest {

    @Test
    void ordersLexicographically() {
        assertTrue(Version.of(6, 2, 9200, 0).compareTo(Version.of(10, 0, 0, 0)) < 0);
        assertTrue(Version.of(10, 0, 15063, 0).compareTo(Version.of(10, 0, 9999, 9)) > 0);
        assertEquals(0, Version.of(1, 2, 3, 4).compareTo(Version.parse("1.2.3.4")));
        assertTrue(Version.of(1, 0, 0, 1).isAtLeast(Version.of(1, 0, 0, 0)));
    }

    @Test
    void parsesShortFormsWithZeroPadding() {
        assertEquals(Version.of(10, 0, 0, 0), Version.parse("10.0"));
        assertEquals(Version.of(10, 0, 15063, 0), Version.parse("10.0.15063"));
        assertThrows(IllegalArgumentException.class, () -> Version.parse("10"));
        assertThrows(IllegalArgumentException.class, () -> Version.parse("1.x"));
        assertThrows(IllegalArgumentException.class, () -> Version.parse("1.2.3.4.5"));
    }

    @Test
    void rendersAbiLiterals() {
        assertEquals("abi_t{}", Version.ZERO.toAbiLiteral());
        assertEquals("abi_t{10,0,15063,0}", Version.of(10, 0, 15063, 0).toAbiLiteral());
        assertEquals("6.2.9200.0", Version.of(6, 2, 9200, 0).toString());
    }
}
