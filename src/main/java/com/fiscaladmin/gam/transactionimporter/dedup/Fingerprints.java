package com.fiscaladmin.gam.transactionimporter.dedup;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Computes the duplicate-detection fingerprint of a transaction.
 * <p>
 * The fingerprint is the lowercase hex SHA-256 of
 * {@code accountId|yyyy-MM-dd|amount|DESCRIPTION}, where the amount is written with
 * exactly two decimals and the description is trimmed, whitespace-collapsed and
 * uppercased. Category is not part of the fingerprint, so re-categorising a stored
 * transaction does not make a re-import look new.
 */
public class Fingerprints {

    private Fingerprints() {
        // utility class
    }

    public static String of(String accountId, LocalDate postedDate, BigDecimal amount, String description) {
        String canonical = accountId + "|" + postedDate + "|"
                + amount.setScale(2).toPlainString() + "|" + normalizeDescription(description);
        return sha256Hex(canonical);
    }

    static String normalizeDescription(String description) {
        if (description == null) {
            return "";
        }
        return description.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
