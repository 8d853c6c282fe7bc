package com.fiscaladmin.gam.transactionimporter.export;

import com.fiscaladmin.gam.transactionimporter.model.Transaction;
import org.junit.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class TransactionCsvExporterTest {

    private static Transaction tx(String account, String date, String amount, String desc, String category) {
        return new Transaction("id-" + desc.hashCode(), account, LocalDate.parse(date), new BigDecimal(amount),
                desc, category, "f".repeat(64), "run-1");
    }

    @Test
    public void writesHeaderAndRowsInOrder() {
        Map<String, String> names = new HashMap<>();
        names.put("a1", "PNC Checking");

        byte[] csv = TransactionCsvExporter.export(Arrays.asList(
                tx("a1", "2024-06-02", "-45.2", "GROCERY STORE", "Groceries"),
                tx("a1", "2024-06-01", "1500", "PAYROLL", null)), names);

        String[] lines = new String(csv, StandardCharsets.UTF_8).split("\r\n");
        assertEquals("Date,Account,Description,Amount,Category", lines[0]);
        assertEquals("2024-06-02,PNC Checking,GROCERY STORE,-45.20,Groceries", lines[1]);
        assertEquals("2024-06-01,PNC Checking,PAYROLL,1500.00,", lines[2]);
    }

    @Test
    public void quotesFieldsWithDelimiters() {
        byte[] csv = TransactionCsvExporter.export(Collections.singletonList(
                tx("a1", "2024-06-01", "-3.00", "ACME, INC \"STORE\"", null)), Collections.<String, String>emptyMap());

        String body = new String(csv, StandardCharsets.UTF_8);
        assertTrue(body.contains("\"ACME, INC \"\"STORE\"\"\""));
    }

    @Test
    public void unknownAccountIsWrittenAsId() {
        byte[] csv = TransactionCsvExporter.export(Collections.singletonList(
                tx("orphan-id", "2024-06-01", "-3.00", "X", null)), Collections.<String, String>emptyMap());

        assertTrue(new String(csv, StandardCharsets.UTF_8).contains("2024-06-01,orphan-id,X,-3.00,"));
    }

    @Test
    public void emptyListWritesHeaderOnly() {
        byte[] csv = TransactionCsvExporter.export(Collections.<Transaction>emptyList(),
                Collections.<String, String>emptyMap());

        assertEquals("Date,Account,Description,Amount,Category\r\n", new String(csv, StandardCharsets.UTF_8));
    }
}
