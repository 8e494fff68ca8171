package me.internalizable.quickplay.candidate;

import me.internalizable.quickplay.api.capability.DirectoryServer;
import me.internalizable.quickplay.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@DisplayName("RawCandidate Tests")
class RawCandidateTest {

    @Test
    @DisplayName("Directory descriptor address splits into host and port")
    void testAddress() {
        RawCandidate candidate = RawCandidate.fromDirectory(
                Fixtures.server("203.0.113.10:27015", "1", "cp_testmap", "cp", 12, 24));

        assertEquals("203.0.113.10", candidate.host());
        assertEquals(27015, candidate.port());
        assertEquals(9000, candidate.version());
    }

    @Test
    @DisplayName("Missing or malformed port is absent")
    void testMissingPort() {
        DirectoryServer bare = new DirectoryServer("198.51.100.2", "5", null, 440, null, null,
                0, 0, 0, null, null, null);
        RawCandidate candidate = RawCandidate.fromDirectory(bare);

        assertEquals("198.51.100.2", candidate.host());
        assertNull(candidate.port());
        assertNull(RawCandidate.fromDirectory(
                Fixtures.server("198.51.100.2:abc", "6", "cp_testmap", "cp", 1, 24)).port());
        assertEquals(0, candidate.version());
    }

    @Test
    @DisplayName("Unparsable versions read as zero")
    void testParseVersion() {
        assertEquals(8622567, RawCandidate.parseVersion(" 8622567 "));
        assertEquals(0, RawCandidate.parseVersion("1.2.3"));
        assertEquals(0, RawCandidate.parseVersion(null));
    }
}
