package me.internalizable.quickplay.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RefreshOptionsBuilder Tests")
class RefreshOptionsBuilderTest {

    @Test
    @DisplayName("Defaults publish without diagnostics")
    void testDefaults() {
        QuickplayAPI.RefreshOptions options = QuickplayAPI.RefreshOptions.defaults();

        assertTrue(options.isPublish());
        assertFalse(options.isDiagnostics());
    }

    @Test
    @DisplayName("Builder overrides both flags")
    void testBuilder() {
        QuickplayAPI.RefreshOptions options = QuickplayAPI.RefreshOptions.builder()
                .diagnostics(true)
                .publish(false)
                .build();

        assertTrue(options.isDiagnostics());
        assertFalse(options.isPublish());
    }
}
