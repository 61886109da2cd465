package tech.yump.gateway.lease;

import java.time.Duration;
import java.time.Instant;

/**
 * Test clock that only moves when told to.
 */
class MutableExpiryClock implements ExpiryClock {

    private volatile Instant now;

    MutableExpiryClock(Instant start) {
        this.now = start;
    }

    @Override
    public Instant now() {
        return now;
    }

    void advance(Duration duration) {
        now = now.plus(duration);
    }

    void set(Instant instant) {
        now = instant;
    }
}
