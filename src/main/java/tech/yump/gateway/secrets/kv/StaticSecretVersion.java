package tech.yump.gateway.secrets.kv;

import java.time.Instant;

/**
 * Version metadata returned after writing a static secret.
 */
public record StaticSecretVersion(int version, Instant createdTime) {
}
