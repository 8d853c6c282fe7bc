package com.fiscaladmin.gam.transactionimporter.mapping;

/**
 * How a bank encodes the direction of money in its export.
 * All conventions are normalized to a signed amount: negative = debit.
 */
public enum AmountConvention {

    /** One {@link CanonicalField#AMOUNT} column, already signed. */
    SIGNED,

    /** Separate {@link CanonicalField#DEBIT} and {@link CanonicalField#CREDIT} columns. */
    SPLIT_DEBIT_CREDIT,

    /**
     * Unsigned {@link CanonicalField#AMOUNT} plus a {@link CanonicalField#TYPE} column;
     * types listed as debit types make the amount negative.
     */
    TYPE_COLUMN
}
