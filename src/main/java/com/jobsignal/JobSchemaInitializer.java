package com.jobsignal;

import com.jobsignal.config.JobSignalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned SQL scripts under {@code jobsignal/migration} that the database has not
 * seen yet, recording each in {@code jobsignal_schema_migrations}. On PostgreSQL concurrent
 * starts are serialized with an advisory lock.
 */
public class JobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern SCRIPT_NAME = Pattern.compile("^V(\\d+(?:_\\d+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    static final String MIGRATION_LOCATION = "classpath*:jobsignal/migration/V*__*.sql";
    private static final long ADVISORY_LOCK_KEY = 4_711_238_905_117_336_201L;

    private final DataSource dataSource;
    private final PathMatchingResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public JobSchemaInitializer(DataSource dataSource, JobSignalProperties properties) {
        this.dataSource = dataSource;
        this.tablePrefix = normalizePrefix(properties.getDatabase().getTablePrefix());
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        try {
            migrate();
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("JobSignal schema migration failed", e);
            }
            log.error("JobSignal schema migration failed; continuing because "
                    + "jobsignal.database.fail-on-migration-error=false", e);
        }
    }

    int migrate() throws SQLException, IOException {
        String historyTable = qualify("jobsignal_schema_migrations");
        List<Migration> available = discoverMigrations();
        if (available.isEmpty()) {
            throw new IllegalStateException("No JobSignal migrations found at " + MIGRATION_LOCATION);
        }

        try (Connection connection = dataSource.getConnection()) {
            boolean locked = lockIfPostgres(connection);
            try {
                createHistoryTable(connection, historyTable);
                Map<String, String> appliedChecksums = readHistory(connection, historyTable);
                verifyHistory(available, appliedChecksums);

                int applied = 0;
                for (Migration migration : available) {
                    if (!appliedChecksums.containsKey(migration.version())) {
                        apply(connection, historyTable, migration);
                        applied++;
                    }
                }
                log.info("JobSignal schema up to date ({} applied now, {} before)", applied, appliedChecksums.size());
                return applied;
            } finally {
                unlockIfPostgres(connection, locked);
            }
        }
    }

    List<Migration> discoverMigrations() throws IOException {
        List<Migration> migrations = new ArrayList<>();
        for (Resource resource : resourceResolver.getResources(MIGRATION_LOCATION)) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = SCRIPT_NAME.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Migration file '" + fileName
                        + "' does not match V<version>__<description>.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            migrations.add(new Migration(matcher.group(1), matcher.group(2).replace('_', ' '), fileName, sql,
                    sha256(sql)));
        }
        migrations.sort(Comparator.comparing(Migration::versionParts, Arrays::compare));

        Map<String, String> seen = new HashMap<>();
        for (Migration migration : migrations) {
            String previous = seen.putIfAbsent(migration.version(), migration.fileName());
            if (previous != null) {
                throw new IllegalStateException("Migration version V" + migration.version() + " is defined by both "
                        + previous + " and " + migration.fileName());
            }
        }
        return migrations;
    }

    private void createHistoryTable(Connection connection, String historyTable) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version VARCHAR(64) PRIMARY KEY,
                        description VARCHAR(255) NOT NULL,
                        checksum VARCHAR(64) NOT NULL,
                        installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP
                    )
                    """.formatted(historyTable));
        }
    }

    private Map<String, String> readHistory(Connection connection, String historyTable) throws SQLException {
        Map<String, String> checksums = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + historyTable);
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                checksums.put(rs.getString("version"), rs.getString("checksum"));
            }
        }
        return checksums;
    }

    private void verifyHistory(List<Migration> available, Map<String, String> appliedChecksums) {
        Map<String, Migration> byVersion = new HashMap<>();
        available.forEach(migration -> byVersion.put(migration.version(), migration));
        appliedChecksums.forEach((version, checksum) -> {
            Migration migration = byVersion.get(version);
            if (migration == null) {
                throw new IllegalStateException("Migration V" + version + " is recorded as applied but no longer "
                        + "exists on the classpath");
            }
            if (!migration.checksum().equals(checksum)) {
                throw new IllegalStateException("Migration " + migration.fileName() + " changed after it was applied");
            }
        });
    }

    private void apply(Connection connection, String historyTable, Migration migration) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            String sql = tablePrefix.isEmpty() ? migration.sql() : migration.sql().replace("jobsignal_", tablePrefix + "jobsignal_");
            ScriptUtils.executeSqlScript(connection, new EncodedResource(
                    new ByteArrayResource(sql.getBytes(StandardCharsets.UTF_8), migration.fileName()),
                    StandardCharsets.UTF_8));
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO " + historyTable + " (version, description, checksum) VALUES (?, ?, ?)")) {
                statement.setString(1, migration.version());
                statement.setString(2, migration.description());
                statement.setString(3, migration.checksum());
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied JobSignal migration V{} ({})", migration.version(), migration.description());
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw new IllegalStateException("Failed to apply migration " + migration.fileName(), e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private boolean lockIfPostgres(Connection connection) throws SQLException {
        if (!isPostgres(connection)) {
            return false;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
        return true;
    }

    private void unlockIfPostgres(Connection connection, boolean locked) {
        if (!locked) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release JobSignal migration lock", e);
        }
    }

    private static boolean isPostgres(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    private String qualify(String table) {
        return tablePrefix + table;
    }

    private static String normalizePrefix(String configuredPrefix) {
        String trimmed = configuredPrefix == null ? "" : configuredPrefix.trim();
        if (!trimmed.isEmpty() && !SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported jobsignal.database.table-prefix: " + trimmed);
        }
        return trimmed;
    }

    private static String sha256(String content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    record Migration(String version, String description, String fileName, String sql, String checksum) {

        int[] versionParts() {
            return Arrays.stream(version.split("_")).mapToInt(Integer::parseInt).toArray();
        }
    }
}
