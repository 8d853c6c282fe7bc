package com.fiscaladmin.gam.transactionimporter.model;

/**
 * Row-level rejection reasons. Each code belongs to exactly one {@link Kind},
 * which decides the ImportRun counter it increments.
 */
public enum RowErrorCode {

    MISSING_COLUMN(Kind.MAPPING),
    UNPARSEABLE_DATE(Kind.MAPPING),
    UNPARSEABLE_AMOUNT(Kind.MAPPING),

    DATE_IN_FUTURE(Kind.VALIDATION),
    ZERO_AMOUNT(Kind.VALIDATION),
    AMOUNT_OUT_OF_RANGE(Kind.VALIDATION),
    UNKNOWN_ACCOUNT(Kind.VALIDATION),
    EMPTY_DESCRIPTION(Kind.VALIDATION),
    DESCRIPTION_TOO_LONG(Kind.VALIDATION),
    CATEGORY_TOO_LONG(Kind.VALIDATION),
    ACCOUNT_NAME_TOO_LONG(Kind.VALIDATION),

    DUPLICATE(Kind.DUPLICATE);

    public enum Kind {
        MAPPING,
        VALIDATION,
        DUPLICATE
    }

    private final Kind kind;

    RowErrorCode(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Mapping and validation failures both count as "invalid" rows.
     */
    public boolean isInvalid() {
        return kind != Kind.DUPLICATE;
    }
}
