package tech.yump.gateway.probe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import tech.yump.gateway.config.TestGatewayProperties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatabaseConnectivityCheckerTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("checkStaticConnection: true when SELECT 1 succeeds, false when the pool cannot connect")
    void checkStaticConnection() {
        DatabaseConnectivityChecker checker = new DatabaseConnectivityChecker(jdbcTemplate, TestGatewayProperties.defaults());

        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(1);
        assertThat(checker.checkStaticConnection()).isTrue();

        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new CannotGetJdbcConnectionException("Connection refused"));
        assertThat(checker.checkStaticConnection()).isFalse();
    }
}
