package com.fiscaladmin.gam.transactionimporter.validation;

import com.fiscaladmin.gam.transactionimporter.model.Account;
import com.fiscaladmin.gam.transactionimporter.persister.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AccountResolver} backed by the account store and an {@link AccountPolicy}.
 * <p>
 * Lookups are cached per instance; the orchestrator uses one instance per file, so
 * a file touching the same account on every row hits the store once.
 * Not thread-safe.
 */
public class PolicyAccountResolver implements AccountResolver {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyAccountResolver.class);

    private final AccountRepository accounts;
    private final AccountPolicy policy;
    private final Map<String, Optional<String>> cache = new HashMap<>();

    public PolicyAccountResolver(AccountRepository accounts, AccountPolicy policy) {
        this.accounts = accounts;
        this.policy = policy;
    }

    @Override
    public Optional<String> resolve(String accountName, String institutionId) {
        if (accountName == null || accountName.trim().isEmpty()) {
            return Optional.empty();
        }
        String name = accountName.trim();
        Optional<String> cached = cache.get(name);
        if (cached != null) {
            return cached;
        }

        Optional<String> resolved;
        Optional<Account> existing = accounts.findByName(name);
        if (existing.isPresent()) {
            resolved = Optional.of(existing.get().getId());
        } else if (policy == AccountPolicy.AUTO_CREATE) {
            Account created = accounts.findOrCreate(name, institutionId);
            LOG.info("Auto-created account '{}' for institution {}", name, institutionId);
            resolved = Optional.of(created.getId());
        } else {
            resolved = Optional.empty();
        }
        cache.put(name, resolved);
        return resolved;
    }
}
