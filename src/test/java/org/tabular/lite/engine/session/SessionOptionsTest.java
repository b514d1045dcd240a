package org.tabular.lite.engine.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for session options and their environment overrides.
 */
public class SessionOptionsTest {

    @Test
    @DisplayName("Empty environment gives the defaults")
    void testDefaults() {
        SessionOptions options = SessionOptions.fromEnvironment(Map.of());

        assertEquals(SessionOptions.DEFAULTS, options);
        assertEquals(0, options.maxUndoHistory());
        assertTrue(options.formulaFixup());
    }

    @Test
    @DisplayName("Environment variables override the defaults")
    void testOverrides() {
        SessionOptions options = SessionOptions.fromEnvironment(Map.of(
                SessionOptions.MAX_UNDO_HISTORY_ENV, " 50 ",
                SessionOptions.FORMULA_FIXUP_ENV, "FALSE"));

        assertEquals(new SessionOptions(50, false), options);
    }

    @Test
    @DisplayName("Unparseable values fall back to the defaults")
    void testInvalidValues() {
        SessionOptions options = SessionOptions.fromEnvironment(Map.of(
                SessionOptions.MAX_UNDO_HISTORY_ENV, "lots",
                SessionOptions.FORMULA_FIXUP_ENV, "maybe"));

        assertEquals(SessionOptions.DEFAULTS, options);
        assertEquals(SessionOptions.DEFAULTS,
                SessionOptions.fromEnvironment(Map.of(SessionOptions.MAX_UNDO_HISTORY_ENV, "-3")));
    }

    @Test
    @DisplayName("Negative history limit is rejected when constructed directly")
    void testNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> new SessionOptions(-1, true));
        assertThrows(IllegalArgumentException.class, () -> SessionOptions.DEFAULTS.withMaxUndoHistory(-1));
    }

    @Test
    @DisplayName("Withers change one setting")
    void testWithers() {
        SessionOptions options = SessionOptions.DEFAULTS.withMaxUndoHistory(10).withFormulaFixup(false);

        assertEquals(10, options.maxUndoHistory());
        assertFalse(options.formulaFixup());
    }
}
