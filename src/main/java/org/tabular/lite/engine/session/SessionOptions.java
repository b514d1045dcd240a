package org.tabular.lite.engine.session;

import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.Map;

/**
 * Settings of a modeling session.
 *
 * Defaults can be overridden from the environment:
 * - TABULAR_MAX_UNDO_HISTORY: number of undoable transactions kept, 0 for no limit
 * - TABULAR_FORMULA_FIXUP: true or false, whether renames and moves rewrite formulas
 *
 * @param maxUndoHistory Maximum undoable transactions, 0 for no limit
 * @param formulaFixup   Whether renames and moves rewrite dependent formulas
 */
public record SessionOptions(int maxUndoHistory, boolean formulaFixup) {

    private static final Logger LOG = Logger.getLogger(SessionOptions.class);

    public static final String MAX_UNDO_HISTORY_ENV = "TABULAR_MAX_UNDO_HISTORY";
    public static final String FORMULA_FIXUP_ENV = "TABULAR_FORMULA_FIXUP";

    public static final SessionOptions DEFAULTS = new SessionOptions(0, true);

    public SessionOptions {
        if (maxUndoHistory < 0) {
            throw new IllegalArgumentException("Undo history limit cannot be negative: " + maxUndoHistory);
        }
    }

    /**
     * @return Options read from the process environment
     */
    public static SessionOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads options from environment-style variables. Unparseable values are logged and
     * replaced by the default.
     */
    public static SessionOptions fromEnvironment(Map<String, String> env) {
        int maxUndoHistory = DEFAULTS.maxUndoHistory();
        String envHistory = env.get(MAX_UNDO_HISTORY_ENV);
        if (envHistory != null && !envHistory.isBlank()) {
            try {
                maxUndoHistory = Integer.parseInt(envHistory.trim());
                if (maxUndoHistory < 0) {
                    LOG.warnf("Negative %s ignored: %s", MAX_UNDO_HISTORY_ENV, envHistory);
                    maxUndoHistory = DEFAULTS.maxUndoHistory();
                }
            } catch (NumberFormatException e) {
                LOG.warnf("Invalid %s ignored: %s", MAX_UNDO_HISTORY_ENV, envHistory);
            }
        }

        boolean formulaFixup = DEFAULTS.formulaFixup();
        String envFixup = env.get(FORMULA_FIXUP_ENV);
        if (envFixup != null && !envFixup.isBlank()) {
            switch (envFixup.trim().toLowerCase(Locale.ROOT)) {
                case "true" -> formulaFixup = true;
                case "false" -> formulaFixup = false;
                default -> LOG.warnf("Invalid %s ignored: %s", FORMULA_FIXUP_ENV, envFixup);
            }
        }

        return new SessionOptions(maxUndoHistory, formulaFixup);
    }

    public SessionOptions withMaxUndoHistory(int value) {
        return new SessionOptions(value, formulaFixup);
    }

    public SessionOptions withFormulaFixup(boolean value) {
        return new SessionOptions(maxUndoHistory, value);
    }
}
