package tech.yump.gateway.lease;

import java.time.Clock;
import java.time.Instant;

/**
 * Time source for lease freshness decisions.
 */
@FunctionalInterface
public interface ExpiryClock {

    Instant now();

    static ExpiryClock system() {
        return of(Clock.systemUTC());
    }

    static ExpiryClock of(Clock clock) {
        return clock::instant;
    }
}
