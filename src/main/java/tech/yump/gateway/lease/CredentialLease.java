package tech.yump.gateway.lease;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A cached grant of dynamically issued credentials for a single role.
 * Instances are immutable: the credential payload is copied into an unmodifiable map
 * and the expiry is always derived from {@code issuedAt + leaseDurationSeconds}.
 *
 * @param role                 The role the credentials were issued for. Unique cache key.
 * @param credentials          Opaque credential fields as returned by the provider (e.g. username, password).
 * @param issuedAt             The instant the lease was obtained from the provider.
 * @param leaseDurationSeconds Lease length granted by the provider, never negative.
 * @param renewable            Provider renewal flag, informational only.
 */
public record CredentialLease(
        String role,
        Map<String, Object> credentials,
        Instant issuedAt,
        long leaseDurationSeconds,
        boolean renewable
) {

    public CredentialLease {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(issuedAt, "issuedAt must not be null");
        if (leaseDurationSeconds < 0) {
            throw new IllegalArgumentException("leaseDurationSeconds must not be negative: " + leaseDurationSeconds);
        }
        // LinkedHashMap keeps the provider's field order for the JSON view; nulls are allowed in payloads.
        credentials = credentials == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(credentials));
    }

    /**
     * Builds a lease from a provider result at the given issue time.
     */
    public static CredentialLease of(String role, IssuedCredential issued, Instant issuedAt) {
        return new CredentialLease(
                role,
                issued.payload(),
                issuedAt,
                Math.max(0L, issued.leaseDurationSeconds()),
                issued.renewable()
        );
    }

    public Instant expiresAt() {
        return issuedAt.plusSeconds(leaseDurationSeconds);
    }

    /**
     * @return true iff {@code now} is strictly before {@link #expiresAt()}.
     */
    public boolean isFreshAt(Instant now) {
        return now.isBefore(expiresAt());
    }

    @Override
    public String toString() {
        // Never print credential values.
        return "CredentialLease[role=" + role
                + ", fields=" + credentials.keySet()
                + ", issuedAt=" + issuedAt
                + ", leaseDurationSeconds=" + leaseDurationSeconds
                + ", renewable=" + renewable + ']';
    }
}
