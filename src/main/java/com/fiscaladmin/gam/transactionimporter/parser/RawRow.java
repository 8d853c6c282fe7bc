package com.fiscaladmin.gam.transactionimporter.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One data row of a statement, keyed by normalized column name.
 * <p>
 * {@link #get(String)} distinguishes a column that is absent (short row or
 * column not in the file), which returns {@code null}, from an empty cell,
 * which returns {@code ""}.
 */
public class RawRow {

    private final int rowNumber;
    private final Map<String, String> values;

    public RawRow(int rowNumber, Map<String, String> values) {
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Builds a row from positional cells aligned with the header. When a column name
     * repeats, the first occurrence wins. Missing trailing cells stay absent.
     */
    public static RawRow of(int rowNumber, List<String> headerKeys, List<String> cells) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < headerKeys.size() && i < cells.size(); i++) {
            String key = headerKeys.get(i);
            if (!values.containsKey(key)) {
                String cell = cells.get(i);
                values.put(key, cell != null ? cell.trim() : "");
            }
        }
        return new RawRow(rowNumber, values);
    }

    /**
     * Returns the 1-based data row number (the header row is not counted).
     */
    public int getRowNumber() {
        return rowNumber;
    }

    public String get(String columnName) {
        return values.get(HeaderNames.normalize(columnName));
    }

    public Map<String, String> getValues() {
        return values;
    }

    boolean isBlank() {
        for (String v : values.values()) {
            if (v != null && !v.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
