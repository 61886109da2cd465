package tech.yump.gateway.lease;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired leases from the {@link LeaseStore}.
 * Entries of roles that are no longer requested would otherwise stay in the store forever.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "gateway.cache.sweep-enabled", havingValue = "true", matchIfMissing = true)
public class LeaseSweeper {

    private final LeaseStore leaseStore;

    @Scheduled(
            initialDelayString = "${gateway.cache.sweep-interval:PT5M}",
            fixedDelayString = "${gateway.cache.sweep-interval:PT5M}")
    public void sweep() {
        int removed = leaseStore.evictExpired();
        if (removed > 0) {
            log.info("Lease sweep removed {} expired credential lease(s)", removed);
        } else {
            log.trace("Lease sweep found no expired leases");
        }
    }
}
