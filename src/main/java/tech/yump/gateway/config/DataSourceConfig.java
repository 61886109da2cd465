package tech.yump.gateway.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Pool for the static (bootstrap) database account, used by health checks.
 * Dynamic credentials never go through this pool.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataSourceConfig {

    private final GatewayProperties gatewayProperties;

    @Bean
    @Primary
    public DataSource dataSource() {
        GatewayProperties.DatabaseProperties dbProps = gatewayProperties.database();
        char[] passwordChars = dbProps.password();
        if (passwordChars == null || passwordChars.length == 0) {
            log.error("Static database password is empty or null in configuration.");
            throw new IllegalStateException("Static database password cannot be empty.");
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(dbProps.jdbcUrl());
        config.setUsername(dbProps.username());
        // HikariCP has no char[] setter.
        config.setPassword(new String(passwordChars));
        config.setDriverClassName("org.postgresql.Driver");
        config.setPoolName("SecretsGatewayPool");
        config.setMaximumPoolSize(4);
        config.setMinimumIdle(0);
        config.setConnectionTimeout(dbProps.connectTimeout().toMillis());
        // Start without a database; the health endpoint reports it as disconnected.
        config.setInitializationFailTimeout(-1);

        log.info("Creating HikariDataSource for URL: {}, User: {}", config.getJdbcUrl(), config.getUsername());
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }
}
