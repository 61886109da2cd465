package tech.yump.gateway.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.gateway.api.dto.DynamicSecretResponse;
import tech.yump.gateway.config.GatewayProperties;
import tech.yump.gateway.lease.CredentialLease;
import tech.yump.gateway.lease.ExpiryClock;
import tech.yump.gateway.lease.RefreshCoordinator;
import tech.yump.gateway.probe.DatabaseConnectivityChecker;
import tech.yump.gateway.secrets.RoleNotFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class DynamicCredentialServiceImpl implements DynamicCredentialService {

    static final String CACHE_STATUS_NEW = "new_credentials";
    static final String CACHE_STATUS_CACHED = "cached";
    static final String CONNECTION_TEST_SUCCESSFUL = "successful";
    static final String CONNECTION_TEST_FAILED = "failed";
    static final String CONNECTION_TEST_SKIPPED = "skipped";

    private final RefreshCoordinator refreshCoordinator;
    private final DatabaseConnectivityChecker connectivityChecker;
    private final ExpiryClock clock;
    private final GatewayProperties.DynamicSecretsProperties dynamicProperties;
    private final GatewayProperties.DatabaseProperties databaseProperties;

    public DynamicCredentialServiceImpl(RefreshCoordinator refreshCoordinator,
                                        DatabaseConnectivityChecker connectivityChecker,
                                        ExpiryClock clock,
                                        GatewayProperties properties) {
        this.refreshCoordinator = refreshCoordinator;
        this.connectivityChecker = connectivityChecker;
        this.clock = clock;
        this.dynamicProperties = properties.dynamic();
        this.databaseProperties = properties.database();
    }

    @Override
    public DynamicSecretResponse getCredentials(String role) {
        GatewayProperties.DynamicRoleProperties roleProperties = dynamicProperties.roles().get(role);
        if (roleProperties == null) {
            log.warn("Service layer: Requested dynamic role '{}' is not configured", role);
            throw new RoleNotFoundException(role);
        }

        Instant requestedAt = clock.now();
        CredentialLease lease = refreshCoordinator.resolve(role);
        String cacheStatus = lease.issuedAt().isBefore(requestedAt) ? CACHE_STATUS_CACHED : CACHE_STATUS_NEW;
        log.info("Service layer: Serving {} credentials for role '{}', expires at {}", cacheStatus, role, lease.expiresAt());

        return new DynamicSecretResponse(
                roleProperties.secretType(),
                roleProperties.rotation(),
                buildData(lease, roleProperties),
                new DynamicSecretResponse.Metadata(
                        lease.issuedAt(),
                        lease.expiresAt(),
                        testConnection(lease),
                        cacheStatus
                )
        );
    }

    @Override
    public Map<String, DynamicSecretResponse> getAllCredentials() {
        Map<String, DynamicSecretResponse> all = new LinkedHashMap<>();
        dynamicProperties.roles().forEach((role, roleProperties) ->
                all.put(responseKey(role, roleProperties), getCredentials(role)));
        return all;
    }

    @Override
    public Set<String> configuredRoles() {
        return dynamicProperties.roles().keySet();
    }

    private Map<String, Object> buildData(CredentialLease lease, GatewayProperties.DynamicRoleProperties roleProperties) {
        Map<String, Object> data = new LinkedHashMap<>(lease.credentials());
        if (roleProperties.includeConnectionInfo()) {
            data.put("host", databaseProperties.host());
            data.put("port", String.valueOf(databaseProperties.port()));
            data.put("database", databaseProperties.name());
        }
        data.put("lease_duration", lease.leaseDurationSeconds());
        data.put("renewable", lease.renewable());
        return data;
    }

    private String testConnection(CredentialLease lease) {
        if (!dynamicProperties.connectionTestEnabled()) {
            return CONNECTION_TEST_SKIPPED;
        }
        Object username = lease.credentials().get("username");
        Object password = lease.credentials().get("password");
        if (!(username instanceof String user) || !(password instanceof String pass) || !StringUtils.hasText(user)) {
            log.warn("Service layer: Credentials for role '{}' have no username/password; skipping connection test", lease.role());
            return CONNECTION_TEST_SKIPPED;
        }
        return connectivityChecker.testCredentials(user, pass) ? CONNECTION_TEST_SUCCESSFUL : CONNECTION_TEST_FAILED;
    }

    private static String responseKey(String role, GatewayProperties.DynamicRoleProperties roleProperties) {
        return StringUtils.hasText(roleProperties.responseKey()) ? roleProperties.responseKey() : "db_" + role;
    }
}
