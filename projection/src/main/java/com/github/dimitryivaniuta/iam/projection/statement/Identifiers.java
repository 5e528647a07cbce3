package com.github.dimitryivaniuta.iam.projection.statement;

import java.util.regex.Pattern;

/**
 * Guards table and column names, which end up in SQL text rather than bind values.
 */
public final class Identifiers {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern QUALIFIED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private Identifiers() {}

    public static String requireValid(String name) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }

    /** Accepts {@code table} or {@code schema.table}. */
    public static String requireValidTable(String table) {
        if (table == null || !QUALIFIED.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        return table;
    }
}
