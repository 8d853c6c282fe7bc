package com.fiscaladmin.gam.transactionimporter.persister;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Pooled JDBC access to the transaction store.
 * <p>
 * Opens a HikariCP pool over the configured JDBC URL (H2 in practice) and applies
 * {@code /db/schema.sql} from the classpath. The schema uses {@code IF NOT EXISTS}
 * throughout, so opening an existing store is safe.
 */
public class Database implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Database.class);

    static final String SCHEMA_RESOURCE = "/db/schema.sql";

    private final HikariDataSource dataSource;

    private Database(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Opens the pool and applies the schema.
     *
     * @param maxPoolSize upper bound on concurrent connections; one per import worker plus one for queries
     * @throws StorageException if the store cannot be reached or the schema cannot be applied
     */
    public static Database open(String jdbcUrl, String username, String password, int maxPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setPoolName("transaction-importer-pool");
        config.setMaximumPoolSize(Math.max(2, maxPoolSize));
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30000);

        HikariDataSource ds;
        try {
            ds = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new StorageException("Cannot open store " + jdbcUrl + ": " + e.getMessage(), e);
        }

        Database database = new Database(ds);
        try {
            database.applySchema();
        } catch (StorageException e) {
            ds.close();
            throw e;
        }
        LOG.info("Opened store {} (maxPoolSize={})", jdbcUrl, config.getMaximumPoolSize());
        return database;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    private void applySchema() {
        List<String> statements = splitStatements(readSchema());
        try (Connection con = getConnection(); Statement stmt = con.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            throw new StorageException("Cannot apply schema: " + e.getMessage(), e);
        }
    }

    private static String readSchema() {
        try (InputStream in = Database.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new StorageException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Cannot read schema resource: " + e.getMessage(), e);
        }
    }

    /**
     * Splits a script into statements on {@code ;} outside string literals, after
     * dropping {@code --} comments. Comments and literals may contain {@code ;}.
     */
    static List<String> splitStatements(String script) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inString = false;
        for (int i = 0; i < script.length(); i++) {
            char c = script.charAt(i);
            if (inString) {
                current.append(c);
                if (c == '\'') {
                    inString = false;
                }
            } else if (c == '\'') {
                inString = true;
                current.append(c);
            } else if (c == '-' && i + 1 < script.length() && script.charAt(i + 1) == '-') {
                int eol = script.indexOf('\n', i);
                i = eol < 0 ? script.length() : eol - 1;
            } else if (c == ';') {
                addStatement(statements, current);
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String sql = current.toString().trim();
        if (!sql.isEmpty()) {
            statements.add(sql);
        }
        current.setLength(0);
    }

    @Override
    public void close() {
        dataSource.close();
        LOG.info("Closed store");
    }
}
