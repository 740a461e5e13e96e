package com.foundry.core.persistence;

import com.foundry.core.config.FoundryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} that provides the SQLite {@link DataSource} and the
 * {@link StateStore} bean.
 * <p>
 * The database file lives under the project's state directory and is created on
 * first use, so a crashed run and its recovery share the same file.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    private static final int BUSY_TIMEOUT_MS = 5000;

    @Bean
    @ConditionalOnMissingBean(DataSource.class)
    public DataSource stateDataSource(FoundryProperties properties) throws IOException {
        Path dbPath = properties.getDatabasePath().toAbsolutePath();
        Files.createDirectories(dbPath.getParent());
        log.info("Using state database at {}", dbPath);
        return sqliteDataSource(dbPath);
    }

    /**
     * JDBC-backed state store. Creates the required tables on startup.
     */
    @Bean
    public StateStore stateStore(DataSource dataSource) {
        var store = new JdbcStateStore(dataSource);
        store.createTables();
        return store;
    }

    /**
     * Builds an SQLite data source with WAL journaling and a busy timeout,
     * so concurrent connections wait on locks instead of failing.
     */
    public static DataSource sqliteDataSource(Path dbPath) {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource;
    }
}
