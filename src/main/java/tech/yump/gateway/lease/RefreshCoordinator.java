package tech.yump.gateway.lease;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.gateway.secrets.CredentialProviderException;
import tech.yump.gateway.secrets.LeaseWaitInterruptedException;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Resolves credentials for a role from the {@link LeaseStore}, refreshing through the
 * {@link CredentialProvider} when the cached lease is missing or expired.
 * <p>
 * At most one provider call per role is outstanding at any time. The first caller to find
 * the role stale becomes the leader of a refresh round; callers arriving while the round is
 * open wait for its outcome and receive the same lease or the same
 * {@link CredentialProviderException}. A failed round stores nothing, so expired credentials
 * are never handed out. Rounds for different roles are independent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RefreshCoordinator {

    private final LeaseStore leaseStore;
    private final CredentialProvider credentialProvider;
    private final ExpiryClock clock;

    // Open refresh rounds, one per role at most.
    private final ConcurrentHashMap<String, CompletableFuture<CredentialLease>> rounds = new ConcurrentHashMap<>();

    /**
     * Returns a fresh lease for {@code role}, issuing new credentials if needed.
     *
     * @throws CredentialProviderException   if the round this caller took part in failed.
     * @throws LeaseWaitInterruptedException if the calling thread was interrupted while waiting on another caller's round.
     */
    public CredentialLease resolve(String role) {
        Optional<CredentialLease> cached = freshLease(role);
        if (cached.isPresent()) {
            log.debug("Using cached credentials for role '{}' (expires: {})", role, cached.get().expiresAt());
            return cached.get();
        }

        CompletableFuture<CredentialLease> round = new CompletableFuture<>();
        CompletableFuture<CredentialLease> current = rounds.putIfAbsent(role, round);
        if (current != null) {
            log.debug("Refresh for role '{}' already in flight, waiting for its outcome", role);
            return await(role, current);
        }
        return lead(role, round);
    }

    /**
     * @return true if a refresh round is currently open for the role.
     */
    public boolean isRefreshing(String role) {
        return rounds.containsKey(role);
    }

    private CredentialLease lead(String role, CompletableFuture<CredentialLease> round) {
        CredentialLease lease;
        try {
            // A round may have finished between the cache check and winning leadership.
            Optional<CredentialLease> published = freshLease(role);
            lease = published.isPresent() ? published.get() : refresh(role);
        } catch (RuntimeException e) {
            CredentialProviderException failure = asProviderException(role, e);
            rounds.remove(role, round);
            round.completeExceptionally(failure);
            throw failure;
        } catch (Error e) {
            rounds.remove(role, round);
            round.completeExceptionally(e);
            throw e;
        }
        rounds.remove(role, round);
        round.complete(lease);
        return lease;
    }

    private CredentialLease refresh(String role) {
        log.info("Issuing new credentials for role '{}'", role);
        IssuedCredential issued = credentialProvider.issue(role);
        if (issued == null) {
            throw new CredentialProviderException(role, "Provider returned no credentials for role '" + role + "'");
        }
        Instant issuedAt = clock.now();
        CredentialLease lease = CredentialLease.of(role, issued, issuedAt);

        if (leaseStore.isFresh(lease, issuedAt)) {
            leaseStore.put(role, lease, issuedAt);
            log.info("Issued new credentials for role '{}', expires at {}", role, lease.expiresAt());
        } else {
            log.warn("Credentials for role '{}' were issued with lease duration {}s; returning them uncached",
                    role, issued.leaseDurationSeconds());
        }
        return lease;
    }

    private CredentialLease await(String role, CompletableFuture<CredentialLease> round) {
        try {
            return round.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Stopped waiting for refresh of role '{}': thread interrupted", role);
            throw new LeaseWaitInterruptedException(role, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CredentialProviderException(role, cause);
        }
    }

    private Optional<CredentialLease> freshLease(String role) {
        Instant now = clock.now();
        return leaseStore.get(role).filter(lease -> leaseStore.isFresh(lease, now));
    }

    private static CredentialProviderException asProviderException(String role, RuntimeException e) {
        if (e instanceof CredentialProviderException providerException) {
            return providerException;
        }
        return new CredentialProviderException(role, e);
    }
}
