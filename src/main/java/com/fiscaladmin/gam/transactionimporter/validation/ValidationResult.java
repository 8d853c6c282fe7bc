package com.fiscaladmin.gam.transactionimporter.validation;

import com.fiscaladmin.gam.transactionimporter.model.RowError;

import java.util.Collections;
import java.util.List;

/**
 * Valid drafts in input order, plus one error per rejected row.
 */
public class ValidationResult {

    private final List<ValidatedDraft> valid;
    private final List<RowError> errors;

    public ValidationResult(List<ValidatedDraft> valid, List<RowError> errors) {
        this.valid = Collections.unmodifiableList(valid);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<ValidatedDraft> getValid() {
        return valid;
    }

    public List<RowError> getErrors() {
        return errors;
    }
}
