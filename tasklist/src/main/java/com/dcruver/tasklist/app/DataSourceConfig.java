package com.dcruver.tasklist.app;

import com.dcruver.tasklist.config.TaskListProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configuration for the SQLite task database.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(TaskListProperties properties) throws Exception {
        // Ensure parent directory exists
        Path dbPath = Path.of(properties.getDatabase());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath() + "?busy_timeout=5000");

        return dataSource;
    }
}
