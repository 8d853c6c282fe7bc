package com.fiscaladmin.gam.transactionimporter.validation;

import com.fiscaladmin.gam.transactionimporter.mapping.TransactionDraft;
import com.fiscaladmin.gam.transactionimporter.model.RowError;
import com.fiscaladmin.gam.transactionimporter.model.RowErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Semantic checks on mapped drafts. A failing row is excluded with a
 * {@link RowError}; the other rows of the file are unaffected.
 * <p>
 * Checks, in order (the first failure is reported):
 * <ol>
 *   <li>description non-empty after trim ({@code EMPTY_DESCRIPTION})</li>
 *   <li>description at most {@value #MAX_DESCRIPTION_LENGTH} characters ({@code DESCRIPTION_TOO_LONG})</li>
 *   <li>category at most {@value #MAX_CATEGORY_LENGTH} characters ({@code CATEGORY_TOO_LONG})</li>
 *   <li>account name at most {@value #MAX_ACCOUNT_NAME_LENGTH} characters ({@code ACCOUNT_NAME_TOO_LONG})</li>
 *   <li>posted date no later than today plus the tolerance ({@code DATE_IN_FUTURE})</li>
 *   <li>amount non-zero ({@code ZERO_AMOUNT})</li>
 *   <li>|amount| at most the configured bound ({@code AMOUNT_OUT_OF_RANGE})</li>
 *   <li>account resolvable ({@code UNKNOWN_ACCOUNT})</li>
 * </ol>
 * The account is resolved last so that rejected rows never auto-create accounts.
 * The length limits match the store's column sizes, so a row that passes can always be inserted.
 */
public class TransactionValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionValidator.class);

    public static final int MAX_DESCRIPTION_LENGTH = 1024;
    public static final int MAX_CATEGORY_LENGTH = 255;
    public static final int MAX_ACCOUNT_NAME_LENGTH = 255;

    private final int futureToleranceDays;
    private final BigDecimal maxAbsAmount;
    private final Clock clock;

    public TransactionValidator(int futureToleranceDays, BigDecimal maxAbsAmount, Clock clock) {
        if (futureToleranceDays < 0) {
            throw new IllegalArgumentException("futureToleranceDays must not be negative");
        }
        if (maxAbsAmount == null || maxAbsAmount.signum() <= 0) {
            throw new IllegalArgumentException("maxAbsAmount must be positive");
        }
        this.futureToleranceDays = futureToleranceDays;
        this.maxAbsAmount = maxAbsAmount;
        this.clock = clock;
    }

    public ValidationResult validate(List<TransactionDraft> drafts, AccountResolver accounts) {
        LocalDate latestAllowed = LocalDate.now(clock).plusDays(futureToleranceDays);
        List<ValidatedDraft> valid = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();

        for (TransactionDraft draft : drafts) {
            RowError error = check(draft, latestAllowed);
            if (error == null) {
                Optional<String> accountId = accounts.resolve(draft.getAccountName(), draft.getInstitutionId());
                if (accountId.isPresent()) {
                    valid.add(new ValidatedDraft(draft, accountId.get()));
                    continue;
                }
                error = new RowError(draft.getRowNumber(), RowErrorCode.UNKNOWN_ACCOUNT,
                        "Unknown account '" + draft.getAccountName() + "'");
            }
            errors.add(error);
        }

        if (!errors.isEmpty()) {
            LOG.warn("Validation rejected {} of {} rows", errors.size(), drafts.size());
        }
        return new ValidationResult(valid, errors);
    }

    private RowError check(TransactionDraft draft, LocalDate latestAllowed) {
        int row = draft.getRowNumber();
        String description = draft.getDescription();
        if (description == null || description.trim().isEmpty()) {
            return new RowError(row, RowErrorCode.EMPTY_DESCRIPTION, "Description cannot be empty");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            return new RowError(row, RowErrorCode.DESCRIPTION_TOO_LONG,
                    "Description longer than " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        String category = draft.getCategory();
        if (category != null && category.length() > MAX_CATEGORY_LENGTH) {
            return new RowError(row, RowErrorCode.CATEGORY_TOO_LONG,
                    "Category longer than " + MAX_CATEGORY_LENGTH + " characters");
        }
        String accountName = draft.getAccountName();
        if (accountName != null && accountName.trim().length() > MAX_ACCOUNT_NAME_LENGTH) {
            return new RowError(row, RowErrorCode.ACCOUNT_NAME_TOO_LONG,
                    "Account name longer than " + MAX_ACCOUNT_NAME_LENGTH + " characters");
        }
        if (draft.getPostedDate().isAfter(latestAllowed)) {
            return new RowError(row, RowErrorCode.DATE_IN_FUTURE,
                    "Posted date " + draft.getPostedDate() + " is in the future");
        }
        if (draft.getAmount().signum() == 0) {
            return new RowError(row, RowErrorCode.ZERO_AMOUNT, "Amount cannot be zero");
        }
        if (draft.getAmount().abs().compareTo(maxAbsAmount) > 0) {
            return new RowError(row, RowErrorCode.AMOUNT_OUT_OF_RANGE,
                    "Amount " + draft.getAmount().toPlainString() + " exceeds limit " + maxAbsAmount.toPlainString());
        }
        return null;
    }
}
