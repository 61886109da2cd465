package tech.yump.gateway.probe;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.FixedBackOff;
import tech.yump.gateway.audit.AuditHelper;
import tech.yump.gateway.config.GatewayProperties;
import tech.yump.gateway.secrets.kv.KVEngineException;
import tech.yump.gateway.secrets.kv.StaticSecretStore;

import java.util.Map;

/**
 * Blocks startup until Vault accepts the configured token, retrying with a fixed back-off.
 * Startup fails once all attempts are used up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "gateway.vault.startup-check.enabled", havingValue = "true", matchIfMissing = true)
public class VaultStartupVerifier implements ApplicationRunner {

    private final VaultBackendProbe vaultBackendProbe;
    private final StaticSecretStore staticSecretStore;
    private final GatewayProperties gatewayProperties;
    private final AuditHelper auditHelper;

    @Override
    public void run(ApplicationArguments args) {
        GatewayProperties.StartupCheckProperties check = gatewayProperties.vault().startupCheck();
        verify(check.maxAttempts(), check.interval().toMillis());
    }

    void verify(int maxAttempts, long intervalMillis) {
        BackOffExecution backOff = new FixedBackOff(intervalMillis, maxAttempts - 1L).start();
        int attempt = 1;
        while (true) {
            if (vaultBackendProbe.isAuthenticated()) {
                log.info("Vault client authenticated successfully (attempt {}/{})", attempt, maxAttempts);
                auditHelper.logInternalEvent("probe", "vault_startup_check", "success", Map.of("attempts", attempt));
                verifyKvAccess();
                return;
            }

            long waitMillis = backOff.nextBackOff();
            if (waitMillis == BackOffExecution.STOP) {
                auditHelper.logInternalEvent("probe", "vault_startup_check", "failure", Map.of("attempts", attempt));
                throw new IllegalStateException("Vault not available after " + maxAttempts + " attempts");
            }
            log.warn("Vault connection attempt {}/{} failed, retrying in {} ms", attempt, maxAttempts, waitMillis);
            sleep(waitMillis);
            attempt++;
        }
    }

    private void verifyKvAccess() {
        try {
            staticSecretStore.list();
            log.info("Vault KV secrets access verified");
        } catch (KVEngineException e) {
            log.warn("KV access test failed: {}", e.getMessage());
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for Vault", e);
        }
    }
}
