package com.fiscaladmin.gam.transactionimporter.mapping;

import com.fiscaladmin.gam.transactionimporter.parser.HeaderNames;

/**
 * An immutable mapping from a bank's column name to a {@link CanonicalField}.
 * <p>
 * Columns are matched by name, not position, using {@link HeaderNames#normalize(String)}
 * so that case, quoting and extra whitespace in the export do not matter.
 * A {@code required} column must be present in every row; an optional one may be
 * missing from the file altogether.
 */
public class FieldMapping {

    private final String columnName;
    private final CanonicalField field;
    private final boolean required;

    public FieldMapping(String columnName, CanonicalField field, boolean required) {
        if (columnName == null || columnName.trim().isEmpty()) {
            throw new IllegalArgumentException("columnName is required");
        }
        if (field == null) {
            throw new IllegalArgumentException("field is required for column " + columnName);
        }
        this.columnName = columnName;
        this.field = field;
        this.required = required;
    }

    /**
     * Returns the column name as the bank writes it (e.g. {@code Transaction Date}).
     */
    public String getColumnName() {
        return columnName;
    }

    /**
     * Returns the normalized column name used for lookups.
     */
    public String getColumnKey() {
        return HeaderNames.normalize(columnName);
    }

    public CanonicalField getField() {
        return field;
    }

    public boolean isRequired() {
        return required;
    }
}
