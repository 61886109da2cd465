package tech.yump.gateway.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.gateway.api.dto.HealthResponse;
import tech.yump.gateway.api.dto.StaticSecretView;
import tech.yump.gateway.api.dto.VaultDebugResponse;
import tech.yump.gateway.config.GatewayProperties;
import tech.yump.gateway.lease.CredentialLease;
import tech.yump.gateway.lease.ExpiryClock;
import tech.yump.gateway.lease.LeaseStore;
import tech.yump.gateway.lease.RefreshCoordinator;
import tech.yump.gateway.probe.DatabaseConnectivityChecker;
import tech.yump.gateway.probe.VaultBackendProbe;
import tech.yump.gateway.secrets.SecretsEngineException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health and diagnostics of the backends the gateway depends on.
 */
@Slf4j
@Service
public class BackendStatusService {

    private final VaultBackendProbe vaultBackendProbe;
    private final DatabaseConnectivityChecker connectivityChecker;
    private final StaticSecretService staticSecretService;
    private final LeaseStore leaseStore;
    private final RefreshCoordinator refreshCoordinator;
    private final ExpiryClock clock;
    private final String databaseMount;

    public BackendStatusService(VaultBackendProbe vaultBackendProbe,
                                DatabaseConnectivityChecker connectivityChecker,
                                StaticSecretService staticSecretService,
                                LeaseStore leaseStore,
                                RefreshCoordinator refreshCoordinator,
                                ExpiryClock clock,
                                GatewayProperties properties) {
        this.vaultBackendProbe = vaultBackendProbe;
        this.connectivityChecker = connectivityChecker;
        this.staticSecretService = staticSecretService;
        this.leaseStore = leaseStore;
        this.refreshCoordinator = refreshCoordinator;
        this.clock = clock;
        this.databaseMount = properties.vault().databaseMount();
    }

    public HealthResponse health() {
        boolean vaultConnected = vaultBackendProbe.isAuthenticated();
        boolean databaseConnected = connectivityChecker.checkStaticConnection();

        Map<String, String> services = new LinkedHashMap<>();
        services.put("vault", vaultConnected ? "connected" : "disconnected");
        services.put("database", databaseConnected ? "connected" : "disconnected");
        services.put("backend", "running");

        String status = vaultConnected && databaseConnected ? "healthy" : "degraded";
        if (!"healthy".equals(status)) {
            log.warn("Health check degraded: vault={}, database={}", services.get("vault"), services.get("database"));
        }
        return new HealthResponse(status, vaultConnected, databaseConnected, clock.now(), services);
    }

    public VaultDebugResponse debugVault() {
        List<String> engines = vaultBackendProbe.listSecretsEngines();
        boolean databaseMounted = engines.contains(databaseMount + "/");

        List<String> roles = new ArrayList<>();
        if (databaseMounted) {
            try {
                roles.addAll(vaultBackendProbe.listDatabaseRoles(databaseMount));
            } catch (SecretsEngineException e) {
                log.warn("Debug: could not list database roles: {}", e.getMessage());
                roles.add("Error listing roles: " + e.getMessage());
            }
        }

        Map<String, StaticSecretView> staticSecrets = staticSecretService.listAll();

        return new VaultDebugResponse(
                vaultBackendProbe.isAuthenticated(),
                engines,
                databaseMounted,
                roles,
                staticSecrets.size(),
                new ArrayList<>(staticSecrets.keySet()),
                cachedLeases(),
                clock.now()
        );
    }

    private Map<String, VaultDebugResponse.CachedLeaseInfo> cachedLeases() {
        Instant now = clock.now();
        Map<String, VaultDebugResponse.CachedLeaseInfo> leases = new LinkedHashMap<>();
        for (Map.Entry<String, CredentialLease> entry : leaseStore.snapshot().entrySet()) {
            CredentialLease lease = entry.getValue();
            leases.put(entry.getKey(), new VaultDebugResponse.CachedLeaseInfo(
                    lease.issuedAt(),
                    lease.expiresAt(),
                    leaseStore.isFresh(lease, now),
                    refreshCoordinator.isRefreshing(entry.getKey())
            ));
        }
        return leases;
    }
}
