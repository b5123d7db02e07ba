package com.perfhub.ticketsync.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;

@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.perfhub.ticketsync.repository.jira")
@EntityScan(basePackages = "com.perfhub.ticketsync.model.jira")
public class DatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

    // Ticket store (jira_tickets + jira_configurations)
    @Primary
    @Bean(name = "ticketDataSource")
    public DataSource ticketDataSource(
            @Value("${spring.datasource.tickets.url}") String url,
            @Value("${spring.datasource.tickets.username:}") String username,
            @Value("${spring.datasource.tickets.password:}") String password,
            @Value("${spring.datasource.tickets.driver-class-name}") String driverClassName) {

        // Log connection info (without password)
        logger.info("Configuring ticket store DataSource:");
        logger.info("  URL: {}", url);
        logger.info("  Username: {}", username);
        logger.info("  Password: {}", password.isEmpty() ? "[EMPTY]" : "[SET]");
        logger.info("  Driver: {}", driverClassName);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);

        // Windows Authentication carries identity in the URL itself
        boolean useWindowsAuth = url.contains("integratedSecurity=true") || url.contains("authenticationScheme=JavaKerberos");

        if (useWindowsAuth) {
            logger.info("  Using Windows Authentication - skipping username/password");
        } else {
            if (username != null && !username.trim().isEmpty()) {
                config.setUsername(username);
            }
            if (password != null && !password.trim().isEmpty()) {
                config.setPassword(password);
            }
        }

        config.setDriverClassName(driverClassName);
        config.setPoolName("ticket-store");
        config.setMaximumPoolSize(10);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(60000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        config.setValidationTimeout(5000);
        config.setConnectionTestQuery("SELECT 1");

        // Allow the app to start while the database is temporarily unavailable
        config.setInitializationFailTimeout(-1);
        config.setAutoCommit(true);

        HikariDataSource dataSource = new HikariDataSource(config);

        try (Connection testConn = dataSource.getConnection()) {
            logger.info("Ticket store connection successful ({})", testConn.getMetaData().getDatabaseProductName());
        } catch (Exception e) {
            logger.error("Ticket store connection test failed: {}", e.getMessage(), e);
        }

        return dataSource;
    }

    /**
     * Measurement instant for interval reconstruction; tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
