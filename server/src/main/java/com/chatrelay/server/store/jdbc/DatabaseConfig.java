package com.chatrelay.server.store.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Database configuration using HikariCP connection pool
 */
@Configuration
public class DatabaseConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    @Value("${db.url}")
    private String url;

    @Value("${db.username}")
    private String username;

    @Value("${db.password}")
    private String password;

    @Value("${db.driver:org.postgresql.Driver}")
    private String driver;

    // Connection pool settings
    @Value("${db.pool.maximumPoolSize:20}")
    private int maximumPoolSize;

    @Value("${db.pool.minimumIdle:5}")
    private int minimumIdle;

    @Value("${db.pool.connectionTimeout:30000}")
    private long connectionTimeout;

    @Value("${db.pool.idleTimeout:600000}")
    private long idleTimeout;

    @Value("${db.pool.maxLifetime:1800000}")
    private long maxLifetime;

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("chatrelay-db");
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName(driver);

        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setConnectionTimeout(connectionTimeout);
        config.setIdleTimeout(idleTimeout);
        config.setMaxLifetime(maxLifetime);

        HikariDataSource dataSource = new HikariDataSource(config);
        log.info("Database connection pool initialized: url={}, poolSize={}, minIdle={}",
                url, maximumPoolSize, minimumIdle);
        return dataSource;
    }
}
