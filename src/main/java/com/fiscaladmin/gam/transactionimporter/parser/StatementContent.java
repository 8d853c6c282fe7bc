package com.fiscaladmin.gam.transactionimporter.parser;

import java.util.Collections;
import java.util.List;

/**
 * Header and data rows read from one statement file.
 */
public class StatementContent {

    private final SourceKind sourceKind;
    private final List<String> header;
    private final List<RawRow> rows;

    public StatementContent(SourceKind sourceKind, List<String> header, List<RawRow> rows) {
        this.sourceKind = sourceKind;
        this.header = Collections.unmodifiableList(header);
        this.rows = Collections.unmodifiableList(rows);
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    /**
     * Returns the header cells as written in the file (BOM removed).
     */
    public List<String> getHeader() {
        return header;
    }

    public List<RawRow> getRows() {
        return rows;
    }
}
