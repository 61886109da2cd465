package tech.yump.gateway.secrets.db;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.vault.VaultException;
import org.springframework.vault.core.VaultOperations;
import org.springframework.vault.support.VaultResponse;
import org.springframework.web.client.RestClientException;
import tech.yump.gateway.config.GatewayProperties;
import tech.yump.gateway.lease.CredentialProvider;
import tech.yump.gateway.lease.IssuedCredential;
import tech.yump.gateway.secrets.CredentialProviderException;
import tech.yump.gateway.secrets.RoleNotFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Issues dynamic database credentials through Vault's database secrets engine
 * ({@code <mount>/creds/<role>}).
 */
@Slf4j
@Service
public class VaultDatabaseCredentialProvider implements CredentialProvider {

    private final VaultOperations vaultOperations;
    private final String databaseMount;

    public VaultDatabaseCredentialProvider(VaultOperations vaultOperations, GatewayProperties properties) {
        this.vaultOperations = vaultOperations;
        this.databaseMount = properties.vault().databaseMount();
    }

    @Override
    public IssuedCredential issue(String role) {
        String path = credentialsPath(role);
        log.info("Requesting credentials from path: {}", path);

        VaultResponse response;
        try {
            response = vaultOperations.read(path);
        } catch (VaultException e) {
            if (isUnknownRole(e)) {
                log.warn("Vault has no database role '{}' at {}", role, path);
                throw new RoleNotFoundException(role, e);
            }
            log.error("Vault refused or failed to issue credentials at {}: {}", path, e.getMessage());
            throw new CredentialProviderException(role, e);
        } catch (RestClientException e) {
            log.error("Vault refused or failed to issue credentials at {}: {}", path, e.getMessage());
            throw new CredentialProviderException(role, e);
        }

        // Null means Vault answered 404 for the path, e.g. no engine at the configured mount.
        if (response == null) {
            log.warn("No response from Vault for path {}", path);
            throw new RoleNotFoundException(role);
        }
        Map<String, Object> data = response.getData();
        if (data == null || data.isEmpty()) {
            throw new CredentialProviderException(role, "No data in response from Vault for path " + path);
        }

        IssuedCredential issued = new IssuedCredential(
                new LinkedHashMap<>(data),
                response.getLeaseDuration(),
                response.isRenewable(),
                response.getLeaseId()
        );
        log.debug("Vault issued credentials for role '{}' (username: {}, lease: {}s)",
                role, data.get("username"), issued.leaseDurationSeconds());
        return issued;
    }

    // The database engine answers "400 ... unknown role: <name>" for roles it has no definition for.
    static boolean isUnknownRole(VaultException e) {
        String message = e.getMessage();
        return message != null && message.contains("Status 400") && message.contains("unknown role");
    }

    String credentialsPath(String role) {
        return databaseMount + "/creds/" + role;
    }
}
