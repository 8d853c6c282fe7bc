package com.fiscaladmin.gam.transactionimporter.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fiscaladmin.gam.transactionimporter.mapping.AmountConvention;
import com.fiscaladmin.gam.transactionimporter.mapping.BankProfile;
import com.fiscaladmin.gam.transactionimporter.mapping.BankProfiles;
import com.fiscaladmin.gam.transactionimporter.mapping.CanonicalField;
import com.fiscaladmin.gam.transactionimporter.validation.AccountPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link ImporterConfig} from JSON.
 * <p>
 * Every key is optional; an absent key keeps the default. Example:
 * <pre>
 * {
 *   "jdbc": { "url": "jdbc:h2:./data/transactions", "user": "sa", "password": "" },
 *   "archiveRoot": "csv_files/csv_files_added",
 *   "workerThreads": 4,
 *   "fileTimeoutSeconds": 60,
 *   "lockTimeoutSeconds": 10,
 *   "futureToleranceDays": 1,
 *   "maxAbsAmount": "50000",
 *   "accountPolicy": "AUTO_CREATE",
 *   "archiveAttempts": 3,
 *   "profiles": [ {
 *     "id": "MY_CU", "institution": "my_cu", "defaultAccount": "Credit Union",
 *     "header": ["Posted", "Memo", "Value"],
 *     "columns": { "Posted": "POSTED_DATE", "Memo": "DESCRIPTION", "Value": "AMOUNT" },
 *     "optionalColumns": { "Tag": "CATEGORY" },
 *     "datePatterns": ["dd.MM.yyyy"],
 *     "amountConvention": "SIGNED",
 *     "debitTypes": [],
 *     "fileAccounts": { "savings": "Credit Union Savings" }
 *   } ]
 * }
 * </pre>
 * Custom profiles are tried before the built-in ones.
 */
public class ImporterConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ImporterConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/transaction-importer.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ImporterConfigLoader() {
        // utility class
    }

    /**
     * Loads the classpath default {@value #DEFAULT_RESOURCE}, or built-in defaults if it is absent.
     */
    public static ImporterConfig loadDefault() throws IOException {
        try (InputStream in = ImporterConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LOG.info("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return ImporterConfig.defaults();
            }
            return fromJson(MAPPER.readTree(in));
        }
    }

    /**
     * @throws IOException              if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if a value is invalid
     */
    public static ImporterConfig load(Path file) throws IOException {
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = MAPPER.readTree(in);
        }
        LOG.info("Loaded importer configuration from {}", file);
        return fromJson(root);
    }

    public static ImporterConfig fromJson(String json) throws IOException {
        return fromJson(MAPPER.readTree(json));
    }

    static ImporterConfig fromJson(JsonNode root) {
        ImporterConfig.Builder b = ImporterConfig.builder();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return b.build();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Configuration must be a JSON object");
        }

        JsonNode jdbc = root.path("jdbc");
        if (jdbc.isObject()) {
            b.jdbc(text(jdbc, "url", ImporterConfig.DEFAULT_JDBC_URL),
                    text(jdbc, "user", "sa"),
                    text(jdbc, "password", ""));
        }
        if (root.hasNonNull("archiveRoot")) {
            b.archiveRoot(Paths.get(root.get("archiveRoot").asText()));
        }
        if (root.hasNonNull("workerThreads")) {
            b.workerThreads(root.get("workerThreads").asInt());
        }
        if (root.hasNonNull("fileTimeoutSeconds")) {
            b.fileTimeout(Duration.ofSeconds(root.get("fileTimeoutSeconds").asLong()));
        }
        if (root.hasNonNull("lockTimeoutSeconds")) {
            b.lockTimeout(Duration.ofSeconds(root.get("lockTimeoutSeconds").asLong()));
        }
        if (root.hasNonNull("futureToleranceDays")) {
            b.futureToleranceDays(root.get("futureToleranceDays").asInt());
        }
        if (root.hasNonNull("maxAbsAmount")) {
            b.maxAbsAmount(decimal(root.get("maxAbsAmount")));
        }
        if (root.hasNonNull("accountPolicy")) {
            b.accountPolicy(enumValue(AccountPolicy.class, root.get("accountPolicy").asText(), "accountPolicy"));
        }
        if (root.hasNonNull("archiveAttempts")) {
            b.archiveAttempts(root.get("archiveAttempts").asInt());
        }

        JsonNode profiles = root.path("profiles");
        if (profiles.isArray() && profiles.size() > 0) {
            List<BankProfile> all = new ArrayList<>();
            for (JsonNode node : profiles) {
                all.add(profile(node));
            }
            all.addAll(BankProfiles.ALL);
            b.profiles(all);
            LOG.info("Registered {} custom bank profile(s)", profiles.size());
        }
        return b.build();
    }

    private static BankProfile profile(JsonNode node) {
        String id = text(node, "id", null);
        if (id == null) {
            throw new IllegalArgumentException("Custom profile without an id");
        }
        BankProfile.Builder b = BankProfile.builder(id)
                .institution(text(node, "institution", id.toLowerCase(Locale.ROOT)))
                .defaultAccount(text(node, "defaultAccount", id));

        b.header(strings(node.path("header")).toArray(new String[0]));
        Iterator<Map.Entry<String, JsonNode>> columns = node.path("columns").fields();
        while (columns.hasNext()) {
            Map.Entry<String, JsonNode> e = columns.next();
            b.column(e.getKey(), enumValue(CanonicalField.class, e.getValue().asText(), "column " + e.getKey()));
        }
        Iterator<Map.Entry<String, JsonNode>> optional = node.path("optionalColumns").fields();
        while (optional.hasNext()) {
            Map.Entry<String, JsonNode> e = optional.next();
            b.optionalColumn(e.getKey(), enumValue(CanonicalField.class, e.getValue().asText(), "column " + e.getKey()));
        }
        b.datePatterns(strings(node.path("datePatterns")).toArray(new String[0]));
        if (node.hasNonNull("amountConvention")) {
            b.amountConvention(enumValue(AmountConvention.class, node.get("amountConvention").asText(),
                    "amountConvention"));
        }
        b.debitTypes(strings(node.path("debitTypes")).toArray(new String[0]));
        Iterator<Map.Entry<String, JsonNode>> fileAccounts = node.path("fileAccounts").fields();
        while (fileAccounts.hasNext()) {
            Map.Entry<String, JsonNode> e = fileAccounts.next();
            b.fileAccount(e.getKey(), e.getValue().asText());
        }
        return b.build();
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : fallback;
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode n : array) {
                values.add(n.asText());
            }
        }
        return values;
    }

    private static BigDecimal decimal(JsonNode node) {
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("maxAbsAmount is not a number: " + node.asText(), e);
        }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, String what) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value, e);
        }
    }
}
