package tech.yump.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the gateway under the 'gateway' prefix.
 */
@ConfigurationProperties(prefix = "gateway")
@Validated
public record GatewayProperties(

        @Valid
        @NotNull(message = "Vault configuration (gateway.vault) is required.")
        VaultProperties vault,

        @Valid
        @NotNull(message = "Database configuration (gateway.database) is required.")
        DatabaseProperties database,

        @Valid
        DynamicSecretsProperties dynamic,

        @Valid
        CorsProperties cors
) {

    public GatewayProperties {
        if (dynamic == null) {
            dynamic = new DynamicSecretsProperties(true, null);
        }
        if (cors == null) {
            cors = new CorsProperties(null);
        }
    }

    // --- VaultProperties ---
    @Validated
    public record VaultProperties(
            @NotBlank(message = "Vault address (gateway.vault.uri) must be provided.")
            String uri,

            @NotNull(message = "Vault token (gateway.vault.token) must be provided.")
            char[] token,

            Duration connectTimeout,

            Duration readTimeout,

            @NotBlank(message = "KV mount (gateway.vault.kv-mount) must not be blank.")
            String kvMount,

            @NotBlank(message = "Database secrets mount (gateway.vault.database-mount) must not be blank.")
            String databaseMount,

            @Valid
            StartupCheckProperties startupCheck
    ) {
        public VaultProperties {
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(15);
            }
            if (startupCheck == null) {
                startupCheck = new StartupCheckProperties(true, 20, Duration.ofSeconds(2));
            }
        }

        @AssertTrue(message = "Vault token (gateway.vault.token) must not be empty.")
        private boolean isTokenNotEmpty() {
            return token != null && token.length > 0;
        }

        @Override
        public String toString() {
            // Avoid logging the token in toString()
            return "VaultProperties[" +
                    "uri='" + uri + '\'' +
                    ", token=******" +
                    ", connectTimeout=" + connectTimeout +
                    ", readTimeout=" + readTimeout +
                    ", kvMount='" + kvMount + '\'' +
                    ", databaseMount='" + databaseMount + '\'' +
                    ", startupCheck=" + startupCheck +
                    ']';
        }
    }

    /**
     * Connection check run once at startup before the gateway accepts traffic.
     */
    @Validated
    public record StartupCheckProperties(
            boolean enabled,

            @Min(value = 1, message = "Startup check attempts must be at least 1.")
            int maxAttempts,

            @NotNull(message = "Startup check interval must be provided.")
            Duration interval
    ) {}

    // --- DatabaseProperties ---
    @Validated
    public record DatabaseProperties(
            @NotBlank(message = "Database host (gateway.database.host) must be provided.")
            String host,

            @Min(1) @Max(65535)
            int port,

            @NotBlank(message = "Database name (gateway.database.name) must be provided.")
            String name,

            @NotBlank(message = "Database username (gateway.database.username) must be provided.")
            String username,

            @NotNull(message = "Database password (gateway.database.password) must be provided.")
            char[] password,

            Duration connectTimeout
    ) {
        public DatabaseProperties {
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
        }

        public String jdbcUrl() {
            return "jdbc:postgresql://" + host + ":" + port + "/" + name;
        }

        @Override
        public String toString() {
            return "DatabaseProperties[" +
                    "host='" + host + '\'' +
                    ", port=" + port +
                    ", name='" + name + '\'' +
                    ", username='" + username + '\'' +
                    ", password=******" +
                    ", connectTimeout=" + connectTimeout +
                    ']';
        }
    }

    // --- DynamicSecretsProperties ---
    @Validated
    public record DynamicSecretsProperties(
            Boolean connectionTestEnabled,

            @Valid
            Map<String, DynamicRoleProperties> roles
    ) {
        public DynamicSecretsProperties {
            if (connectionTestEnabled == null) {
                connectionTestEnabled = Boolean.TRUE;
            }
            if (roles == null || roles.isEmpty()) {
                roles = defaultRoles();
            }
        }

        private static Map<String, DynamicRoleProperties> defaultRoles() {
            Map<String, DynamicRoleProperties> defaults = new LinkedHashMap<>();
            defaults.put("readonly", new DynamicRoleProperties(
                    "dynamic_database_credentials", "automatic_1h", "db_readonly", true));
            defaults.put("admin", new DynamicRoleProperties(
                    "dynamic_database_admin_credentials", "automatic_1h", "db_admin", false));
            return defaults;
        }
    }

    /**
     * How one dynamic role is presented in API responses.
     */
    @Validated
    public record DynamicRoleProperties(
            @NotBlank(message = "Dynamic role secret type must be provided.")
            String secretType,

            String rotation,

            String responseKey,

            boolean includeConnectionInfo
    ) {
        public DynamicRoleProperties {
            if (!StringUtils.hasText(rotation)) {
                rotation = "automatic_1h";
            }
        }
    }

    // --- CorsProperties ---
    public record CorsProperties(
            List<String> allowedOrigins
    ) {
        public CorsProperties {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                allowedOrigins = List.of("http://localhost:3000");
            }
        }
    }
}
