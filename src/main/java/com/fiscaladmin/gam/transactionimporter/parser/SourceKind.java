package com.fiscaladmin.gam.transactionimporter.parser;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported statement containers, selected by file extension.
 */
public enum SourceKind {

    CSV(".csv"),
    XLSX(".xlsx");

    private final String extension;

    SourceKind(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static Optional<SourceKind> of(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toString().toLowerCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (lower.endsWith(kind.extension)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
