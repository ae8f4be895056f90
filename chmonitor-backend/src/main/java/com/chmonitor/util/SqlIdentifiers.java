package com.chmonitor.util;

import java.util.regex.Pattern;

/**
 * Guards for database, table and column names that end up interpolated into SQL text.
 */
public final class SqlIdentifiers {
    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private SqlIdentifiers() {
    }

    public static boolean isSafe(String identifier) {
        return identifier != null && SAFE.matcher(identifier).matches();
    }

    /**
     * Returns the identifier unchanged when it only contains {@code [A-Za-z0-9_.-]}.
     *
     * @param identifier identifier
     * @return the same identifier
     * @throws IllegalArgumentException for anything else
     */
    public static String validate(String identifier) {
        if (!isSafe(identifier)) {
            throw new IllegalArgumentException("Invalid identifier: " + identifier);
        }
        return identifier;
    }

    /**
     * Wraps an identifier in backticks, doubling any backtick it contains.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * Validates and splits a {@code database.table} name.
     *
     * @param qualifiedName qualified name
     * @return two element array: database, table
     */
    public static String[] splitQualified(String qualifiedName) {
        validate(qualifiedName);
        int dot = qualifiedName.indexOf('.');
        if (dot <= 0 || dot == qualifiedName.length() - 1 || qualifiedName.indexOf('.', dot + 1) != -1) {
            throw new IllegalArgumentException("Expected database.table but got: " + qualifiedName);
        }
        return new String[]{qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1)};
    }
}
