package com.fiscaladmin.gam.transactionimporter.mapping;

import com.fiscaladmin.gam.transactionimporter.model.RowError;
import com.fiscaladmin.gam.transactionimporter.model.RowErrorCode;
import com.fiscaladmin.gam.transactionimporter.parser.RawRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a {@link RawRow} to a {@link TransactionDraft} according to a {@link BankProfile}.
 * <p>
 * Key behaviours:
 * <ul>
 *   <li>A required column absent from the row yields {@code MISSING_COLUMN}</li>
 *   <li>Dates are tried against the profile's patterns in order, then ISO-8601;
 *       no match yields {@code UNPARSEABLE_DATE}</li>
 *   <li>Amounts follow the profile's {@link AmountConvention}; debits are always negative.
 *       A bad or missing amount yields {@code UNPARSEABLE_AMOUNT}</li>
 *   <li>A memo different from the description is appended as {@code "description - memo"}</li>
 *   <li>A blank category becomes {@code null}</li>
 *   <li>A non-blank account column overrides the file's account, which defaults to
 *       the profile's default account</li>
 * </ul>
 * Mapping is pure: it never throws for bad row content.
 */
public class ProfileMapper {

    private ProfileMapper() {
        // utility class
    }

    public static MappingResult map(RawRow row, BankProfile profile) {
        return map(row, profile, profile.getDefaultAccountName());
    }

    /**
     * @param fileAccountName account for rows without an account column value,
     *                        usually {@link BankProfile#accountNameFor(String)} of the source file
     */
    public static MappingResult map(RawRow row, BankProfile profile, String fileAccountName) {
        int rowNumber = row.getRowNumber();

        for (FieldMapping mapping : profile.getFieldMappings()) {
            if (mapping.isRequired() && row.get(mapping.getColumnName()) == null) {
                return failure(rowNumber, RowErrorCode.MISSING_COLUMN,
                        "Missing column '" + mapping.getColumnName() + "'");
            }
        }

        String rawDate = value(row, profile, CanonicalField.POSTED_DATE);
        LocalDate postedDate = parseDate(rawDate, profile);
        if (postedDate == null) {
            return failure(rowNumber, RowErrorCode.UNPARSEABLE_DATE,
                    "Cannot parse date '" + nullToEmpty(rawDate) + "'");
        }

        BigDecimal amount;
        switch (profile.getAmountConvention()) {
            case SPLIT_DEBIT_CREDIT:
                amount = splitAmount(value(row, profile, CanonicalField.DEBIT),
                        value(row, profile, CanonicalField.CREDIT));
                break;
            case TYPE_COLUMN:
                amount = typedAmount(value(row, profile, CanonicalField.AMOUNT),
                        value(row, profile, CanonicalField.TYPE), profile);
                break;
            default:
                amount = Amounts.parse(value(row, profile, CanonicalField.AMOUNT));
                break;
        }
        if (amount == null) {
            return failure(rowNumber, RowErrorCode.UNPARSEABLE_AMOUNT,
                    "Cannot parse amount in row " + rowNumber);
        }

        String description = nullToEmpty(value(row, profile, CanonicalField.DESCRIPTION)).trim();
        String memo = nullToEmpty(value(row, profile, CanonicalField.MEMO)).trim();
        if (!memo.isEmpty() && !memo.equals(description)) {
            description = description.isEmpty() ? memo : description + " - " + memo;
        }

        String category = value(row, profile, CanonicalField.CATEGORY);
        if (Amounts.isBlank(category)) {
            category = null;
        }

        String accountName = value(row, profile, CanonicalField.ACCOUNT);
        if (Amounts.isBlank(accountName)) {
            accountName = fileAccountName;
        }

        return MappingResult.success(new TransactionDraft(rowNumber, accountName.trim(),
                profile.getInstitutionId(), postedDate, amount, description,
                category != null ? category.trim() : null));
    }

    /**
     * Parses a date cell with the profile's patterns, falling back to ISO-8601.
     *
     * @return the date, or {@code null} if no pattern matches
     */
    static LocalDate parseDate(String raw, BankProfile profile) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String s = raw.trim();
        for (DateTimeFormatter formatter : profile.getDateFormatters()) {
            LocalDate date = tryParse(s, formatter);
            if (date != null) {
                return date;
            }
        }
        return tryParse(s, DateTimeFormatter.ISO_LOCAL_DATE);
    }

    private static LocalDate tryParse(String s, DateTimeFormatter formatter) {
        try {
            return LocalDate.parse(s, formatter);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Debit and credit columns: the result is {@code credit - debit}, both taken as magnitudes.
     * A row with neither column filled has no amount.
     */
    private static BigDecimal splitAmount(String rawDebit, String rawCredit) {
        boolean hasDebit = !Amounts.isBlank(rawDebit);
        boolean hasCredit = !Amounts.isBlank(rawCredit);
        if (!hasDebit && !hasCredit) {
            return null;
        }
        BigDecimal debit = hasDebit ? Amounts.parse(rawDebit) : BigDecimal.ZERO.setScale(2);
        BigDecimal credit = hasCredit ? Amounts.parse(rawCredit) : BigDecimal.ZERO.setScale(2);
        if (debit == null || credit == null) {
            return null;
        }
        return credit.abs().subtract(debit.abs());
    }

    /**
     * Unsigned amount plus a type label: debit labels make the amount negative.
     */
    private static BigDecimal typedAmount(String rawAmount, String rawType, BankProfile profile) {
        BigDecimal amount = Amounts.parse(rawAmount);
        if (amount == null) {
            return null;
        }
        String type = nullToEmpty(rawType).trim().toLowerCase(Locale.ROOT);
        return profile.getDebitTypes().contains(type) ? amount.abs().negate() : amount.abs();
    }

    private static String value(RawRow row, BankProfile profile, CanonicalField field) {
        Optional<FieldMapping> mapping = profile.getMapping(field);
        return mapping.map(m -> row.get(m.getColumnName())).orElse(null);
    }

    private static MappingResult failure(int rowNumber, RowErrorCode code, String message) {
        return MappingResult.failure(new RowError(rowNumber, code, message));
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
