package com.syncgen.schemagen.introspect;

import com.syncgen.schemagen.GenerationException;

/**
 * An enum is stored as integers. Generation cannot continue until the column stores strings.
 */
public class EnumStorageException extends GenerationException {
    private final String table;
    private final String column;

    public EnumStorageException(String entity, String table, String column) {
        super(message(entity, table, column));
        this.table = table;
        this.column = column;
    }

    public String table() {
        return table;
    }

    public String column() {
        return column;
    }

    private static String message(String entity, String table, String column) {
        return "Integer-backed enum detected: " + entity + "." + column + " (table " + table + ").\n"
                + "Typed client code requires string storage. To fix:\n"
                + "  1. Add a migration converting " + table + "." + column + " to a string column,\n"
                + "     rewriting each stored integer to its label.\n"
                + "  2. Change the enum declaration of " + entity + " to map labels to string values,\n"
                + "     e.g. { open: \"open\", done: \"done\" }.\n"
                + "  3. Run the migration and regenerate.";
    }
}
