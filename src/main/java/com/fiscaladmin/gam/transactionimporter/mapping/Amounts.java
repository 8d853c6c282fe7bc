package com.fiscaladmin.gam.transactionimporter.mapping;

import java.math.BigDecimal;

/**
 * Parses monetary cells as banks export them.
 * <p>
 * Accepted forms: {@code -12.50}, {@code 1,234.56}, {@code $45.00}, {@code (45.00)}
 * (accounting negative), {@code +3}. Amounts with more than two decimal places
 * are rejected rather than rounded.
 */
public class Amounts {

    private Amounts() {
        // utility class
    }

    /**
     * Parses a monetary cell.
     *
     * @param raw the cell text
     * @return the amount with scale 2, or {@code null} if the text is blank or not a valid amount
     */
    public static BigDecimal parse(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return null;
        }

        boolean negative = false;
        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1);
        }
        s = s.replace("$", "").replace(",", "").replaceAll("\\s+", "");
        if (s.isEmpty()) {
            return null;
        }

        BigDecimal value;
        try {
            value = new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
        if (value.stripTrailingZeros().scale() > 2) {
            return null;
        }
        value = value.setScale(2);
        return negative ? value.negate() : value;
    }

    /**
     * Returns {@code true} if the cell is absent or contains only whitespace.
     */
    static boolean isBlank(String raw) {
        return raw == null || raw.trim().isEmpty();
    }
}
