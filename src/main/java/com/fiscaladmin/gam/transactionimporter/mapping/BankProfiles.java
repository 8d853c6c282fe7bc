package com.fiscaladmin.gam.transactionimporter.mapping;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Built-in bank profiles.
 * <p>
 * {@link #ALL} is ordered most-specific first; the format detector returns the first
 * profile whose header signature matches, so {@link #GENERIC} must stay last.
 */
public class BankProfiles {

    /**
     * PNC checking export: withdrawals and deposits in separate columns, running balance.
     */
    public static final BankProfile PNC = BankProfile.builder("PNC")
            .institution("pnc")
            .defaultAccount("PNC Checking")
            .header("Date", "Description", "Withdrawals", "Deposits", "Category", "Balance")
            .column("Date", CanonicalField.POSTED_DATE)
            .column("Description", CanonicalField.DESCRIPTION)
            .column("Withdrawals", CanonicalField.DEBIT)
            .column("Deposits", CanonicalField.CREDIT)
            .optionalColumn("Category", CanonicalField.CATEGORY)
            .datePatterns("MM/dd/yyyy", "yyyy-MM-dd")
            .amountConvention(AmountConvention.SPLIT_DEBIT_CREDIT)
            .build();

    /**
     * Chase card export: unsigned amounts, direction given by the Type column.
     * Memo text is appended to the description. The export does not name the card,
     * so the file name picks the account.
     */
    public static final BankProfile CHASE = BankProfile.builder("CHASE")
            .institution("chase")
            .defaultAccount("Chase SW")
            .fileAccount("star_wars", "Chase Star Wars")
            .header("Transaction Date", "Post Date", "Description", "Category", "Type", "Amount")
            .column("Transaction Date", CanonicalField.POSTED_DATE)
            .column("Description", CanonicalField.DESCRIPTION)
            .column("Amount", CanonicalField.AMOUNT)
            .column("Type", CanonicalField.TYPE)
            .optionalColumn("Memo", CanonicalField.MEMO)
            .optionalColumn("Category", CanonicalField.CATEGORY)
            .datePatterns("MM/dd/yyyy", "yyyy-MM-dd")
            .amountConvention(AmountConvention.TYPE_COLUMN)
            .debitTypes("Sale", "Payment")
            .build();

    /**
     * Capital One card export: debit and credit columns.
     */
    public static final BankProfile CAPITAL_ONE = BankProfile.builder("CAPITAL_ONE")
            .institution("capital_one")
            .defaultAccount("Capital One")
            .header("Transaction Date", "Posted Date", "Card No.", "Description", "Category", "Debit", "Credit")
            .column("Transaction Date", CanonicalField.POSTED_DATE)
            .column("Description", CanonicalField.DESCRIPTION)
            .column("Debit", CanonicalField.DEBIT)
            .column("Credit", CanonicalField.CREDIT)
            .optionalColumn("Category", CanonicalField.CATEGORY)
            .datePatterns("yyyy-MM-dd", "MM/dd/yyyy")
            .amountConvention(AmountConvention.SPLIT_DEBIT_CREDIT)
            .build();

    /**
     * Minimal signed layout {@code Date,Description,Amount}, optionally with
     * {@code Category} and {@code Account}. Also the layout written by the CSV export.
     */
    public static final BankProfile GENERIC = BankProfile.builder("GENERIC")
            .institution("generic")
            .defaultAccount("Imported")
            .header("Date", "Description", "Amount")
            .column("Date", CanonicalField.POSTED_DATE)
            .column("Description", CanonicalField.DESCRIPTION)
            .column("Amount", CanonicalField.AMOUNT)
            .optionalColumn("Category", CanonicalField.CATEGORY)
            .optionalColumn("Account", CanonicalField.ACCOUNT)
            .datePatterns("yyyy-MM-dd", "MM/dd/yyyy")
            .amountConvention(AmountConvention.SIGNED)
            .build();

    public static final List<BankProfile> ALL =
            Collections.unmodifiableList(Arrays.asList(PNC, CHASE, CAPITAL_ONE, GENERIC));

    /**
     * Looks up a built-in profile by id (case-insensitive).
     */
    public static Optional<BankProfile> byId(String id) {
        for (BankProfile profile : ALL) {
            if (profile.getId().equalsIgnoreCase(id)) {
                return Optional.of(profile);
            }
        }
        return Optional.empty();
    }

    private BankProfiles() {
        // utility class
    }
}
