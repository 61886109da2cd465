package tech.yump.gateway.secrets.kv;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest version of a static key/value secret.
 *
 * @param name        Secret name, i.e. its path below the KV mount (e.g. "api").
 * @param data        Key/value pairs of the latest version.
 * @param version     Version number assigned by the backend.
 * @param createdTime When the latest version was written.
 */
public record StaticSecret(
        String name,
        Map<String, Object> data,
        int version,
        Instant createdTime
) {
    public StaticSecret {
        data = data == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public boolean containsKey(String key) {
        return data.containsKey(key);
    }
}
