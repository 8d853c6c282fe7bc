package com.fiscaladmin.gam.transactionimporter.dedup;

import org.junit.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.Assert.*;

public class FingerprintsTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 1);

    @Test
    public void fingerprintIsLowercaseSha256Hex() {
        String fp = Fingerprints.of("acct", DAY, new BigDecimal("-4.50"), "COFFEE");

        assertEquals(64, fp.length());
        assertTrue(fp.matches("[0-9a-f]{64}"));
    }

    @Test
    public void descriptionCaseAndSpacingDoNotMatter() {
        assertEquals(
                Fingerprints.of("acct", DAY, new BigDecimal("-4.50"), "Coffee   Shop"),
                Fingerprints.of("acct", DAY, new BigDecimal("-4.50"), "  COFFEE SHOP "));
    }

    @Test
    public void amountScaleDoesNotMatter() {
        assertEquals(
                Fingerprints.of("acct", DAY, new BigDecimal("-4.5"), "COFFEE"),
                Fingerprints.of("acct", DAY, new BigDecimal("-4.50"), "COFFEE"));
    }

    @Test
    public void everyKeyFieldChangesTheFingerprint() {
        String base = Fingerprints.of("acct", DAY, new BigDecimal("-4.50"), "COFFEE");

        assertNotEquals(base, Fingerprints.of("other", DAY, new BigDecimal("-4.50"), "COFFEE"));
        assertNotEquals(base, Fingerprints.of("acct", DAY.plusDays(1), new BigDecimal("-4.50"), "COFFEE"));
        assertNotEquals(base, Fingerprints.of("acct", DAY, new BigDecimal("4.50"), "COFFEE"));
        assertNotEquals(base, Fingerprints.of("acct", DAY, new BigDecimal("-4.50"), "TEA"));
    }

    @Test
    public void normalizeDescription() {
        assertEquals("A B C", Fingerprints.normalizeDescription(" a \t b\n c "));
        assertEquals("", Fingerprints.normalizeDescription(null));
    }
}
