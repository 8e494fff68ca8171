package me.internalizable.quickplay.score;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("NameSanitizer Tests")
class NameSanitizerTest {

    private final NameSanitizer sanitizer = new NameSanitizer("\u0001");

    @Test
    @DisplayName("Leading marker is detected")
    void testLeadingMarker() {
        assertTrue(sanitizer.hasLeadingMarker("\u0001Best Server"));
        assertFalse(sanitizer.hasLeadingMarker("Best \u0001Server"));
        assertFalse(sanitizer.hasLeadingMarker(""));
    }

    @Test
    @DisplayName("Markers, control characters and padding are stripped")
    void testSanitize() {
        assertEquals("Best Server", sanitizer.sanitize("\u0001\u0001 Best\u0007 Server\n "));
        assertEquals("Uncletopia | Amsterdam", sanitizer.sanitize("Uncletopia | Amsterdam"));
    }

    @Test
    @DisplayName("Spelled-out escapes are decoded before the marker check")
    void testEscapedMarker() {
        assertTrue(sanitizer.hasLeadingMarker("\\x01Best Server"));
        assertTrue(sanitizer.hasLeadingMarker("\\u0001Best Server"));
        assertTrue(sanitizer.hasLeadingMarker("\\001Best Server"));
        assertFalse(sanitizer.hasLeadingMarker("\\x41Best Server"));
        assertEquals("Best Server", sanitizer.sanitize("\\x01\\tBest Server\\n"));
    }

    @Test
    @DisplayName("Escapes decode to their characters")
    void testDecodeEscapes() {
        assertEquals("\u2605 Star", NameSanitizer.decodeEscapes("\\u2605 Star"));
        assertEquals("\uD83D\uDE00", NameSanitizer.decodeEscapes("\\U0001F600"));
        assertEquals("a\\b", NameSanitizer.decodeEscapes("a\\\\b"));
        assertEquals("Plain name", NameSanitizer.decodeEscapes("Plain name"));
    }

    @Test
    @DisplayName("Malformed escapes are kept as written")
    void testMalformedEscapes() {
        assertEquals("C:\\games", NameSanitizer.decodeEscapes("C:\\games"));
        assertEquals("\\x4", NameSanitizer.decodeEscapes("\\x4"));
        assertEquals("\\xZZ", NameSanitizer.decodeEscapes("\\xZZ"));
        assertEquals("trailing\\", NameSanitizer.decodeEscapes("trailing\\"));
        assertEquals("Server \\q", sanitizer.sanitize("Server \\q"));
    }
}
