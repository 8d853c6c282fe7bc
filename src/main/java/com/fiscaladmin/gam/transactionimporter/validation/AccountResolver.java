package com.fiscaladmin.gam.transactionimporter.validation;

import java.util.Optional;

/**
 * Resolves an account display name to a stored account id.
 */
public interface AccountResolver {

    /**
     * @param accountName   display name from the statement or the bank profile
     * @param institutionId institution to record if the account has to be created
     * @return the account id, or empty if the account is unknown and may not be created
     */
    Optional<String> resolve(String accountName, String institutionId);
}
