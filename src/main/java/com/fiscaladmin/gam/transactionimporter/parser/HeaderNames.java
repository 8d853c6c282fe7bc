package com.fiscaladmin.gam.transactionimporter.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Column-name normalization shared by detection and mapping.
 * <p>
 * Strips a UTF-8 BOM and quote characters, collapses runs of whitespace,
 * trims and lowercases, so {@code "\"Transaction  Date \""} (with or without a BOM) and
 * {@code transaction date} compare equal.
 */
public class HeaderNames {

    private HeaderNames() {
        // utility class
    }

    public static String normalize(String columnName) {
        if (columnName == null) {
            return "";
        }
        String s = columnName;
        if (s.startsWith("\uFEFF")) {
            s = s.substring(1);
        }
        s = s.replaceAll("[\"']", "");
        s = s.replaceAll("\\s+", " ").trim();
        return s.toLowerCase(Locale.ROOT);
    }

    public static List<String> normalizeAll(List<String> columnNames) {
        List<String> keys = new ArrayList<>(columnNames.size());
        for (String name : columnNames) {
            keys.add(normalize(name));
        }
        return keys;
    }
}
