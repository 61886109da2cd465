package tech.yump.gateway.secrets.kv;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static (non-leased) key/value secrets kept in the backend's KV store.
 * Each secret is a named map of key/value pairs; the backend versions every write.
 */
public interface StaticSecretStore {

    /**
     * Reads the latest version of a secret.
     *
     * @param name The secret name below the mount. Must not be null or empty.
     * @return The secret, or Optional.empty() if it does not exist or its latest version is deleted.
     * @throws KVEngineException If the backend cannot be reached or rejects the request.
     * @throws IllegalArgumentException if the name is invalid.
     */
    Optional<StaticSecret> read(String name) throws KVEngineException;

    /**
     * Lists the names of all secrets at the top level of the mount.
     * Names of nested folders keep the backend's trailing '/'.
     *
     * @throws KVEngineException If listing fails.
     */
    List<String> list() throws KVEngineException;

    /**
     * Writes a new version of a secret, replacing all of its key/value pairs.
     *
     * @param name The secret name. Must not be null or empty.
     * @param data The complete key/value map of the new version. Must not be null.
     * @return Version metadata of the written version.
     * @throws KVEngineException If the write fails.
     * @throws IllegalArgumentException if the name or data is invalid.
     */
    StaticSecretVersion write(String name, Map<String, Object> data) throws KVEngineException;

    /**
     * Permanently deletes a secret with all its versions and metadata.
     *
     * @throws KVEngineException If the delete fails.
     */
    void destroy(String name) throws KVEngineException;
}
