package com.dragnet.service.storage.sqlite;

import com.dragnet.core.exception.CompileException;
import java.util.regex.Pattern;

public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {}

    /** Field name to column name: {@code .} and {@code -} become {@code _}. */
    public static String escape(String field) {
        String escaped = field.replace('.', '_').replace('-', '_');
        if (!IDENTIFIER.matcher(escaped).matches()) {
            throw new CompileException("field \"" + field + "\" cannot be used as an index column");
        }
        return escaped;
    }
}
