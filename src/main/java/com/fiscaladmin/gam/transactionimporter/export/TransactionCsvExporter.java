package com.fiscaladmin.gam.transactionimporter.export;

import com.fiscaladmin.gam.transactionimporter.model.Transaction;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Writes transactions as UTF-8 CSV with the header
 * {@code Date,Account,Description,Amount,Category}.
 * <p>
 * Dates are ISO-8601, amounts plain with two decimals, a missing category is an
 * empty cell. The layout matches the generic import profile, so an export can be
 * imported again.
 */
public class TransactionCsvExporter {

    static final String[] HEADER = {"Date", "Account", "Description", "Amount", "Category"};

    private TransactionCsvExporter() {
        // utility class
    }

    /**
     * @param transactions rows to write, in the order given
     * @param accountNames account id to display name; unknown ids are written as the id
     */
    public static byte[] export(List<Transaction> transactions, Map<String, String> accountNames) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CSVFormat format = CSVFormat.RFC4180.builder()
                .setHeader(HEADER)
                .build();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Transaction t : transactions) {
                printer.printRecord(
                        t.getPostedDate().toString(),
                        accountNames.getOrDefault(t.getAccountId(), t.getAccountId()),
                        t.getDescription(),
                        t.getAmount().setScale(2).toPlainString(),
                        t.getCategory() != null ? t.getCategory() : "");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write CSV export", e);
        }
        return out.toByteArray();
    }
}
