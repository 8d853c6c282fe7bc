package com.fiscaladmin.gam.transactionimporter.parser;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Reads a statement file into a header plus {@link RawRow}s.
 * <p>
 * Key behaviours:
 * <ul>
 *   <li>{@code .csv}: Apache Commons CSV, UTF-8, a leading BOM ({@code EF BB BF}) is skipped.
 *       The delimiter is sniffed from the header line: semicolon if the header has
 *       semicolons but no commas, otherwise comma</li>
 *   <li>{@code .xlsx}: Apache POI, first sheet only; the first non-empty row is the header.
 *       Date-formatted cells are rendered as ISO dates, numeric cells as plain decimals</li>
 *   <li>Cells are trimmed; rows whose cells are all empty are skipped</li>
 *   <li>Row numbers count data rows only, starting at 1</li>
 * </ul>
 */
public class StatementReader {

    private static final Logger LOG = LoggerFactory.getLogger(StatementReader.class);

    private StatementReader() {
        // utility class
    }

    /**
     * Reads the full statement.
     *
     * @param file the statement file
     * @return header and data rows; both empty for an empty file
     * @throws IOException if the file cannot be read or has an unsupported extension
     */
    public static StatementContent read(Path file) throws IOException {
        SourceKind kind = requireKind(file);
        StatementContent content = kind == SourceKind.XLSX ? readXlsx(file, false) : readCsv(file, false);
        LOG.info("Read {} data rows from {} ({})", content.getRows().size(), file.getFileName(), kind);
        return content;
    }

    /**
     * Reads only the header row.
     *
     * @return the header cells, or an empty list for an empty file
     * @throws IOException if the file cannot be read or has an unsupported extension
     */
    public static List<String> readHeader(Path file) throws IOException {
        SourceKind kind = requireKind(file);
        StatementContent content = kind == SourceKind.XLSX ? readXlsx(file, true) : readCsv(file, true);
        return content.getHeader();
    }

    private static SourceKind requireKind(Path file) throws IOException {
        return SourceKind.of(file).orElseThrow(() ->
                new IOException("Unsupported file type: " + file.getFileName()));
    }

    // -------------------------------------------------------------------------
    // CSV
    // -------------------------------------------------------------------------

    private static StatementContent readCsv(Path file, boolean headerOnly) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {

            // Skip UTF-8 BOM if present
            reader.mark(1);
            int firstChar = reader.read();
            if (firstChar != '\uFEFF' && firstChar != -1) {
                reader.reset();
            }

            // Peek at the header line to choose the delimiter
            reader.mark(64 * 1024);
            String headerLine = reader.readLine();
            if (headerLine == null) {
                return new StatementContent(SourceKind.CSV, Collections.emptyList(), Collections.emptyList());
            }
            reader.reset();

            CSVFormat csvFormat = CSVFormat.RFC4180.builder()
                    .setDelimiter(sniffDelimiter(headerLine))
                    .setIgnoreEmptyLines(true)
                    .setTrim(true)
                    .setQuote('"')
                    .build();

            List<String> header = null;
            List<String> headerKeys = null;
            List<RawRow> rows = new ArrayList<>();
            int rowNumber = 0;

            try (CSVParser csvParser = new CSVParser(reader, csvFormat)) {
                for (CSVRecord record : csvParser) {
                    List<String> cells = new ArrayList<>(record.size());
                    for (String value : record) {
                        cells.add(value != null ? value : "");
                    }
                    if (header == null) {
                        header = cells;
                        headerKeys = HeaderNames.normalizeAll(cells);
                        if (headerOnly) {
                            break;
                        }
                        continue;
                    }
                    RawRow row = RawRow.of(rowNumber + 1, headerKeys, cells);
                    if (row.isBlank()) {
                        continue;
                    }
                    rowNumber++;
                    rows.add(row);
                }
            } catch (UncheckedIOException e) {
                throw e.getCause();
            } catch (IllegalStateException e) {
                // commons-csv reports malformed quoting this way
                throw new IOException("Malformed CSV in " + file.getFileName() + ": " + e.getMessage(), e);
            }

            return new StatementContent(SourceKind.CSV,
                    header != null ? header : Collections.emptyList(), rows);
        }
    }

    static char sniffDelimiter(String headerLine) {
        if (headerLine.indexOf(';') >= 0 && headerLine.indexOf(',') < 0) {
            return ';';
        }
        return ',';
    }

    // -------------------------------------------------------------------------
    // XLSX
    // -------------------------------------------------------------------------

    private static StatementContent readXlsx(Path file, boolean headerOnly) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new StatementContent(SourceKind.XLSX, Collections.emptyList(), Collections.emptyList());
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter(Locale.ROOT);

            List<String> header = null;
            List<String> headerKeys = null;
            List<RawRow> rows = new ArrayList<>();
            int rowNumber = 0;

            for (Row row : sheet) {
                if (header == null) {
                    List<String> cells = readCells(row, row.getLastCellNum(), formatter);
                    if (allEmpty(cells)) {
                        continue;
                    }
                    header = cells;
                    headerKeys = HeaderNames.normalizeAll(cells);
                    if (headerOnly) {
                        break;
                    }
                    continue;
                }
                List<String> cells = readCells(row, header.size(), formatter);
                RawRow raw = RawRow.of(rowNumber + 1, headerKeys, cells);
                if (raw.isBlank()) {
                    continue;
                }
                rowNumber++;
                rows.add(raw);
            }

            return new StatementContent(SourceKind.XLSX,
                    header != null ? header : Collections.emptyList(), rows);
        } catch (IOException e) {
            throw e;
        } catch (RuntimeException e) {
            // POI signals corrupt or non-OOXML content with unchecked exceptions
            throw new IOException("Unreadable spreadsheet " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static List<String> readCells(Row row, int width, DataFormatter formatter) {
        List<String> cells = new ArrayList<>();
        for (int i = 0; i < Math.max(width, 0); i++) {
            Cell cell = row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            cells.add(cellText(cell, formatter));
        }
        return cells;
    }

    private static String cellText(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case BLANK:
                return "";
            default:
                return formatter.formatCellValue(cell).trim();
        }
    }

    private static boolean allEmpty(List<String> cells) {
        for (String c : cells) {
            if (!c.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
