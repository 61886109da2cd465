package tech.yump.gateway.lease;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Raw result of a {@link CredentialProvider#issue(String)} call.
 *
 * @param payload              Credential fields, treated as opaque by the cache.
 * @param leaseDurationSeconds Lease length reported by the backend. Zero or less means "already expired".
 * @param renewable            Backend renewal flag.
 * @param leaseId              Backend lease identifier, if the backend reports one.
 */
public record IssuedCredential(
        Map<String, Object> payload,
        long leaseDurationSeconds,
        boolean renewable,
        @Nullable String leaseId
) {

    public IssuedCredential(Map<String, Object> payload, long leaseDurationSeconds, boolean renewable) {
        this(payload, leaseDurationSeconds, renewable, null);
    }
}
