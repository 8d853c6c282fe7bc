package com.fiscaladmin.gam.transactionimporter.mapping;

import com.fiscaladmin.gam.transactionimporter.parser.HeaderNames;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.*;

/**
 * Immutable description of one institution's export layout.
 * <p>
 * A profile holds everything the generic {@link ProfileMapper} needs to turn a raw
 * row into a {@link TransactionDraft}:
 * <ul>
 *   <li>{@code headerSignature}: column names that must all appear in the header
 *       row for the file to be recognised as this profile</li>
 *   <li>{@code fieldMappings}: column name to canonical field</li>
 *   <li>{@code datePatterns}: tried in order; parsing is strict, so impossible
 *       dates such as 02/30/2024 are rejected</li>
 *   <li>{@code amountConvention} and, for {@link AmountConvention#TYPE_COLUMN},
 *       the set of type labels that denote debits</li>
 *   <li>{@code defaultAccountName}: the account rows belong to unless an
 *       {@link CanonicalField#ACCOUNT} column says otherwise</li>
 *   <li>{@code fileAccounts}: file-name fragment to account name, for institutions
 *       whose exports do not name the account (two Chase cards, for example).
 *       The first fragment found in the file name wins over the default account</li>
 * </ul>
 * Profiles are created once at start-up (see {@link BankProfiles}) and never mutated.
 */
public class BankProfile {

    private final String id;
    private final String institutionId;
    private final String defaultAccountName;
    private final List<String> headerSignature;
    private final List<FieldMapping> fieldMappings;
    private final List<String> datePatterns;
    private final List<DateTimeFormatter> dateFormatters;
    private final AmountConvention amountConvention;
    private final Set<String> debitTypes;
    private final Map<String, String> fileAccounts;

    private BankProfile(Builder b) {
        this.id = b.id;
        this.institutionId = b.institutionId;
        this.defaultAccountName = b.defaultAccountName;
        this.headerSignature = Collections.unmodifiableList(new ArrayList<>(b.headerSignature));
        this.fieldMappings = Collections.unmodifiableList(new ArrayList<>(b.fieldMappings));
        this.datePatterns = Collections.unmodifiableList(new ArrayList<>(b.datePatterns));
        this.amountConvention = b.amountConvention;

        Set<String> types = new HashSet<>();
        for (String t : b.debitTypes) {
            types.add(t.trim().toLowerCase(Locale.ROOT));
        }
        this.debitTypes = Collections.unmodifiableSet(types);
        this.fileAccounts = Collections.unmodifiableMap(new LinkedHashMap<>(b.fileAccounts));

        List<DateTimeFormatter> formatters = new ArrayList<>();
        for (String pattern : datePatterns) {
            formatters.add(strictFormatter(pattern));
        }
        this.dateFormatters = Collections.unmodifiableList(formatters);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getInstitutionId() {
        return institutionId;
    }

    public String getDefaultAccountName() {
        return defaultAccountName;
    }

    public List<String> getHeaderSignature() {
        return headerSignature;
    }

    public List<FieldMapping> getFieldMappings() {
        return fieldMappings;
    }

    public List<String> getDatePatterns() {
        return datePatterns;
    }

    List<DateTimeFormatter> getDateFormatters() {
        return dateFormatters;
    }

    public AmountConvention getAmountConvention() {
        return amountConvention;
    }

    public Set<String> getDebitTypes() {
        return debitTypes;
    }

    /**
     * File-name fragments (normalized with {@link #normalizeFileName(String)}) to account names, in match order.
     */
    public Map<String, String> getFileAccounts() {
        return fileAccounts;
    }

    /**
     * Returns the account a file of this profile belongs to: the account of the first
     * {@code fileAccounts} fragment contained in the file name, else the default account.
     * An {@link CanonicalField#ACCOUNT} column still overrides this per row.
     */
    public String accountNameFor(String fileName) {
        if (fileName != null) {
            String name = normalizeFileName(fileName);
            for (Map.Entry<String, String> rule : fileAccounts.entrySet()) {
                if (name.contains(rule.getKey())) {
                    return rule.getValue();
                }
            }
        }
        return defaultAccountName;
    }

    /**
     * Lower-cases and turns spaces and hyphens into underscores, so
     * {@code "Star Wars.csv"} and {@code "star-wars.csv"} both contain {@code star_wars}.
     */
    static String normalizeFileName(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    /**
     * Returns the mapping for a canonical field, if this profile has one.
     */
    public Optional<FieldMapping> getMapping(CanonicalField field) {
        for (FieldMapping m : fieldMappings) {
            if (m.getField() == field) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns {@code true} if every signature column is present in the given header.
     *
     * @param headerKeys header column names already normalized with {@link HeaderNames#normalize(String)}
     */
    public boolean matchesHeader(Collection<String> headerKeys) {
        for (String column : headerSignature) {
            if (!headerKeys.contains(HeaderNames.normalize(column))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return id;
    }

    /**
     * Builds a strict formatter: {@code yyyy} is rewritten to the proleptic year {@code uuuu},
     * which {@link ResolverStyle#STRICT} requires.
     */
    private static DateTimeFormatter strictFormatter(String pattern) {
        String strict = pattern.replace('y', 'u');
        return DateTimeFormatter.ofPattern(strict, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    public static class Builder {

        private final String id;
        private String institutionId;
        private String defaultAccountName;
        private final List<String> headerSignature = new ArrayList<>();
        private final List<FieldMapping> fieldMappings = new ArrayList<>();
        private final List<String> datePatterns = new ArrayList<>();
        private AmountConvention amountConvention = AmountConvention.SIGNED;
        private final List<String> debitTypes = new ArrayList<>();
        private final Map<String, String> fileAccounts = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder institution(String institutionId) {
            this.institutionId = institutionId;
            return this;
        }

        public Builder defaultAccount(String accountName) {
            this.defaultAccountName = accountName;
            return this;
        }

        public Builder header(String... columns) {
            headerSignature.addAll(Arrays.asList(columns));
            return this;
        }

        public Builder column(String columnName, CanonicalField field) {
            fieldMappings.add(new FieldMapping(columnName, field, true));
            return this;
        }

        public Builder optionalColumn(String columnName, CanonicalField field) {
            fieldMappings.add(new FieldMapping(columnName, field, false));
            return this;
        }

        public Builder datePatterns(String... patterns) {
            datePatterns.addAll(Arrays.asList(patterns));
            return this;
        }

        public Builder amountConvention(AmountConvention convention) {
            this.amountConvention = convention;
            return this;
        }

        public Builder debitTypes(String... types) {
            debitTypes.addAll(Arrays.asList(types));
            return this;
        }

        /**
         * Routes files whose name contains {@code fileNameFragment} to {@code accountName}.
         */
        public Builder fileAccount(String fileNameFragment, String accountName) {
            if (fileNameFragment == null || fileNameFragment.trim().isEmpty()) {
                throw new IllegalArgumentException("Profile " + id + ": file name fragment must not be blank");
            }
            if (accountName == null || accountName.trim().isEmpty()) {
                throw new IllegalArgumentException("Profile " + id + ": account for '" + fileNameFragment
                        + "' must not be blank");
            }
            fileAccounts.put(normalizeFileName(fileNameFragment), accountName.trim());
            return this;
        }

        /**
         * @throws IllegalArgumentException if the profile is incomplete or its columns
         *                                  do not support the amount convention
         */
        public BankProfile build() {
            require(id, "id");
            require(institutionId, "institutionId");
            require(defaultAccountName, "defaultAccountName");
            if (headerSignature.isEmpty()) {
                throw new IllegalArgumentException("Profile " + id + " has no header signature");
            }
            if (datePatterns.isEmpty()) {
                throw new IllegalArgumentException("Profile " + id + " has no date patterns");
            }
            requireField(CanonicalField.POSTED_DATE);
            requireField(CanonicalField.DESCRIPTION);
            switch (amountConvention) {
                case SIGNED:
                    requireField(CanonicalField.AMOUNT);
                    break;
                case SPLIT_DEBIT_CREDIT:
                    requireField(CanonicalField.DEBIT);
                    requireField(CanonicalField.CREDIT);
                    break;
                case TYPE_COLUMN:
                    requireField(CanonicalField.AMOUNT);
                    requireField(CanonicalField.TYPE);
                    if (debitTypes.isEmpty()) {
                        throw new IllegalArgumentException("Profile " + id
                                + " uses TYPE_COLUMN but declares no debit types");
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported amount convention: " + amountConvention);
            }
            return new BankProfile(this);
        }

        private void require(String value, String name) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Profile " + id + ": " + name + " is required");
            }
        }

        private void requireField(CanonicalField field) {
            for (FieldMapping m : fieldMappings) {
                if (m.getField() == field) {
                    return;
                }
            }
            throw new IllegalArgumentException("Profile " + id + " has no column mapped to " + field);
        }
    }
}
