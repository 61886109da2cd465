package tech.yump.gateway.probe;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;
import tech.yump.gateway.config.GatewayProperties;

import java.util.Properties;

/**
 * Opens database connections to verify that the static account and issued credentials work.
 * Failures are reported as {@code false}, never thrown.
 */
@Slf4j
@Component
public class DatabaseConnectivityChecker {

    private final JdbcTemplate staticJdbcTemplate;
    private final GatewayProperties.DatabaseProperties databaseProperties;

    public DatabaseConnectivityChecker(JdbcTemplate jdbcTemplate, GatewayProperties properties) {
        this.staticJdbcTemplate = jdbcTemplate;
        this.databaseProperties = properties.database();
    }

    /**
     * Checks the pooled connection of the static database account.
     */
    public boolean checkStaticConnection() {
        try {
            staticJdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Static DB connection test failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Logs in with the given credentials on a fresh, unpooled connection and runs {@code SELECT version()}.
     */
    public boolean testCredentials(String username, String password) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(databaseProperties.jdbcUrl(), username, password);
        Properties connectionProperties = new Properties();
        connectionProperties.setProperty("connectTimeout", String.valueOf(databaseProperties.connectTimeout().toSeconds()));
        dataSource.setConnectionProperties(connectionProperties);

        try {
            String version = new JdbcTemplate(dataSource).queryForObject("SELECT version()", String.class);
            log.info("Database connection successful: {}", version);
            return true;
        } catch (DataAccessException e) {
            log.warn("Database connection test failed for user '{}': {}", username, e.getMessage());
            return false;
        }
    }
}
