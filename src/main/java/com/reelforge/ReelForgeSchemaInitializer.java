package com.reelforge;

import com.reelforge.config.ReelForgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.DigestUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Brings the {@code users} credit columns, the ledger and the job table up to
 * date from the scripts under {@code reelforge/migration}.
 * <p>
 * All pending scripts run in one transaction under a transaction-scoped
 * advisory lock, so a failed script leaves nothing half applied and two
 * instances starting together never both apply the same version.
 */
@Component
@ConditionalOnProperty(prefix = "reelforge.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class ReelForgeSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(ReelForgeSchemaInitializer.class);

    static final String SCRIPT_LOCATION = "classpath*:reelforge/migration/V*__*.sql";
    static final String HISTORY_TABLE = "reelforge_schema_migrations";
    private static final Pattern SCRIPT_NAME = Pattern.compile("V(\\d+)__(\\w+)\\.sql");
    private static final long MIGRATION_LOCK_ID = 0x5245454C464F5247L;

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final boolean failOnMigrationError;

    public ReelForgeSchemaInitializer(DataSource dataSource, ReelForgeProperties properties) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        try {
            List<Migration> migrations = bundledMigrations();
            Integer applied = transactionTemplate.execute(status -> migrate(migrations));
            log.info("ReelForge schema up to date at V{} ({} script(s) applied now)",
                    migrations.get(migrations.size() - 1).version(), applied);
        } catch (RuntimeException e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("ReelForge schema migration failed", e);
            }
            log.error("ReelForge schema migration failed; continuing because "
                    + "reelforge.database.fail-on-migration-error=false", e);
        }
    }

    private int migrate(List<Migration> migrations) {
        jdbcTemplate.queryForList("SELECT pg_advisory_xact_lock(?)", MIGRATION_LOCK_ID);
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + HISTORY_TABLE + " ("
                + "version INTEGER PRIMARY KEY, "
                + "script VARCHAR(255) NOT NULL, "
                + "checksum VARCHAR(32) NOT NULL, "
                + "applied_at TIMESTAMPTZ NOT NULL DEFAULT NOW())");

        Map<Integer, String> recorded = jdbcTemplate.query("SELECT version, checksum FROM " + HISTORY_TABLE,
                rs -> {
                    Map<Integer, String> rows = new HashMap<>();
                    while (rs.next()) {
                        rows.put(rs.getInt("version"), rs.getString("checksum"));
                    }
                    return rows;
                });
        Map<Integer, Migration> byVersion = migrations.stream()
                .collect(Collectors.toMap(Migration::version, migration -> migration));
        recorded.forEach((version, checksum) -> {
            Migration migration = byVersion.get(version);
            if (migration == null) {
                throw new IllegalStateException("Database records V" + version + " but no such script is bundled");
            }
            if (!migration.checksum().equals(checksum)) {
                throw new IllegalStateException(migration.script() + " was modified after it was applied");
            }
        });

        int applied = 0;
        for (Migration migration : migrations) {
            if (recorded.containsKey(migration.version())) {
                continue;
            }
            new ResourceDatabasePopulator(migration.resource()).execute(dataSource);
            jdbcTemplate.update("INSERT INTO " + HISTORY_TABLE + " (version, script, checksum) VALUES (?, ?, ?)",
                    migration.version(), migration.script(), migration.checksum());
            log.info("Applied {}", migration.script());
            applied++;
        }
        return applied;
    }

    List<Migration> bundledMigrations() {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(SCRIPT_LOCATION);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + SCRIPT_LOCATION, e);
        }
        List<Migration> migrations = new ArrayList<>();
        for (Resource resource : resources) {
            migrations.add(Migration.of(resource));
        }
        if (migrations.isEmpty()) {
            throw new IllegalStateException("No migration scripts found at " + SCRIPT_LOCATION);
        }
        migrations.sort(Comparator.comparingInt(Migration::version));
        for (int i = 1; i < migrations.size(); i++) {
            if (migrations.get(i).version() == migrations.get(i - 1).version()) {
                throw new IllegalStateException("Two scripts share version V" + migrations.get(i).version() + ": "
                        + migrations.get(i - 1).script() + ", " + migrations.get(i).script());
            }
        }
        return migrations;
    }

    record Migration(int version, String script, String checksum, Resource resource) {

        static Migration of(Resource resource) {
            String script = resource.getFilename();
            Matcher matcher = SCRIPT_NAME.matcher(script == null ? "" : script);
            if (!matcher.matches()) {
                throw new IllegalStateException("Migration script '" + script + "' is not named V<n>__<name>.sql");
            }
            try (InputStream content = resource.getInputStream()) {
                return new Migration(Integer.parseInt(matcher.group(1)), script, DigestUtils.md5DigestAsHex(content),
                        resource);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + script, e);
            }
        }
    }
}
