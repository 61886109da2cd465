package tech.yump.gateway.probe;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Contributes Vault authentication status to the actuator health endpoint.
 */
@Component("vault")
@RequiredArgsConstructor
public class VaultHealthIndicator implements HealthIndicator {

    private final VaultBackendProbe vaultBackendProbe;

    @Override
    public Health health() {
        return vaultBackendProbe.isAuthenticated()
                ? Health.up().withDetail("authenticated", true).build()
                : Health.down().withDetail("authenticated", false).build();
    }
}
