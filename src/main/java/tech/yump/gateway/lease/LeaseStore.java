package tech.yump.gateway.lease;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the current {@link CredentialLease} for each role.
 * <p>
 * The store never talks to a provider. Writers replace whole entries, so readers either
 * see the previous lease or the new one, never a partially written entry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeaseStore {

    private final ExpiryClock clock;

    private final ConcurrentHashMap<String, CredentialLease> leases = new ConcurrentHashMap<>();

    public Optional<CredentialLease> get(String role) {
        return Optional.ofNullable(leases.get(role));
    }

    /**
     * Publishes a lease as the current one for {@code role}. Last writer wins.
     *
     * @throws IllegalArgumentException if the lease belongs to another role or is already expired.
     */
    public void put(String role, CredentialLease lease) {
        put(role, lease, clock.now());
    }

    /**
     * Publishes a lease, judging its freshness at {@code now} instead of reading the clock again.
     * Callers that already decided the lease is fresh pass the instant of that decision.
     *
     * @throws IllegalArgumentException if the lease belongs to another role or is not fresh at {@code now}.
     */
    public void put(String role, CredentialLease lease, Instant now) {
        if (lease == null) {
            throw new IllegalArgumentException("Lease cannot be null.");
        }
        if (!lease.role().equals(role)) {
            throw new IllegalArgumentException(
                    "Lease for role '" + lease.role() + "' cannot be stored under role '" + role + "'.");
        }
        if (!isFresh(lease, now)) {
            throw new IllegalArgumentException(
                    "Refusing to cache lease for role '" + role + "' expiring at " + lease.expiresAt() + " (now " + now + ").");
        }
        leases.put(role, lease);
        log.debug("Cached lease for role '{}' until {}", role, lease.expiresAt());
    }

    public boolean isFresh(CredentialLease lease, Instant now) {
        return lease.isFreshAt(now);
    }

    /**
     * Drops every entry that is no longer fresh. An entry replaced concurrently by a newer
     * lease is left alone.
     *
     * @return number of entries removed.
     */
    public int evictExpired() {
        Instant now = clock.now();
        int removed = 0;
        for (Map.Entry<String, CredentialLease> entry : leases.entrySet()) {
            CredentialLease lease = entry.getValue();
            if (!isFresh(lease, now) && leases.remove(entry.getKey(), lease)) {
                removed++;
                log.debug("Evicted expired lease for role '{}' (expired at {})", entry.getKey(), lease.expiresAt());
            }
        }
        return removed;
    }

    /**
     * @return a sorted, read-only copy of the current entries.
     */
    public Map<String, CredentialLease> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(leases));
    }
}
