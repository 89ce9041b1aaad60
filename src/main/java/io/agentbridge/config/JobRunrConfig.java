package io.agentbridge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JobRunr configuration. Provides the SQLite DataSource JobRunr keeps its recurring
 * retention jobs in; the jobrunr-spring-boot-3-starter builds its StorageProvider from it.
 * The job database is separate from the shared memory store.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);
    private static final String JDBC_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSource dataSource(
            @Value("${agentbridge.jobrunr.database-url:jdbc:sqlite:./data/agent-bridge-jobs.db}") String url
    ) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(5000);

        createParentDirectory(url);
        var ds = new SQLiteDataSource(config);
        ds.setUrl(url);
        log.info("JobRunr SQLite DataSource configured: {}", url);
        return ds;
    }

    private static void createParentDirectory(String url) {
        String file = url.startsWith(JDBC_PREFIX) ? url.substring(JDBC_PREFIX.length()) : "";
        if (file.isEmpty() || file.startsWith(":memory:") || file.startsWith("file:")) {
            return;
        }
        Path parent = Path.of(file).toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create directory for JobRunr database: " + parent, e);
        }
    }
}
