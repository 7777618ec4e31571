package com.dcruver.beliefgraph.app;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration for the SQLite data source holding nodes, edges and embeddings.
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(@Value("${beliefgraph.database-path}") String databasePath) throws IOException {
        Path dbPath = Paths.get(databasePath.replace("${user.home}", System.getProperty("user.home")));
        log.info("Using belief graph database at {}", dbPath.toAbsolutePath());
        return sqliteDataSource(dbPath);
    }

    /**
     * SQLite data source with foreign keys enforced. Parent directories are created.
     */
    public static DataSource sqliteDataSource(Path dbPath) throws IOException {
        if (dbPath.toAbsolutePath().getParent() != null) {
            Files.createDirectories(dbPath.toAbsolutePath().getParent());
        }

        Properties properties = new Properties();
        properties.setProperty("foreign_keys", "true");

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        dataSource.setConnectionProperties(properties);

        return dataSource;
    }
}
