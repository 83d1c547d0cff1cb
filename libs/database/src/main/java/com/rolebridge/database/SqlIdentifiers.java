package com.rolebridge.database;

/**
 * Quoting for SQL text that cannot be passed as a bind parameter, such as role names in DDL and
 * the literal of {@code COMMENT ON ROLE}.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
        // utility class
    }

    /** Quotes an identifier: {@code smith"x} becomes {@code "smith""x"}. */
    public static String quote(String identifier) {
        requireText(identifier, "identifier");
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /** Quotes a string literal, assuming {@code standard_conforming_strings} is on. */
    public static String literal(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        if (text.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("text must not contain NUL characters");
        }
        return '\'' + text.replace("'", "''") + '\'';
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be null or empty");
        }
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException(name + " must not contain NUL characters");
        }
    }
}
