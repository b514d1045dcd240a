package org.tabular.lite.dax;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Spelling of object names inside DAX formula text.
 *
 * - Tables: 'Sales Order', with ' doubled inside; plain identifiers may stay unquoted
 * - Columns and measures: [Amount], with ] doubled inside
 */
public final class DaxNames {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> KEYWORDS = Set.of(
            "VAR", "RETURN", "TRUE", "FALSE", "IN", "NOT", "AND", "OR",
            "DEFINE", "EVALUATE", "ORDER", "BY", "ASC", "DESC", "MEASURE", "COLUMN", "TABLE", "START", "AT");

    private DaxNames() {
    }

    public static String quoteTable(String name) {
        return "'" + name.replace("'", "''") + "'";
    }

    public static String bracket(String name) {
        return "[" + name.replace("]", "]]") + "]";
    }

    public static String unquote(String text) {
        if (text.length() < 2 || text.charAt(0) != '\'' || text.charAt(text.length() - 1) != '\'') {
            throw new IllegalArgumentException("Not a quoted name: " + text);
        }
        return text.substring(1, text.length() - 1).replace("''", "'");
    }

    public static String unbracket(String text) {
        if (text.length() < 2 || text.charAt(0) != '[' || text.charAt(text.length() - 1) != ']') {
            throw new IllegalArgumentException("Not a bracketed name: " + text);
        }
        return text.substring(1, text.length() - 1).replace("]]", "]");
    }

    /**
     * @return true if the name can be written as a table reference without quotes
     */
    public static boolean isPlainIdentifier(String name) {
        return PLAIN_IDENTIFIER.matcher(name).matches() && !isKeyword(name);
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word.toUpperCase(Locale.ROOT));
    }

    /**
     * Spells a table name the way an existing reference spelled the old one: quoted
     * references stay quoted, bare ones stay bare while the new name allows it.
     *
     * @param previous The text of the existing table reference
     * @param newName  The new table name
     * @return The replacement text
     */
    public static String tableReference(String previous, String newName) {
        if (!previous.startsWith("'") && isPlainIdentifier(newName)) {
            return newName;
        }
        return quoteTable(newName);
    }
}
