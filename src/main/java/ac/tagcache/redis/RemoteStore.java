package ac.tagcache.redis;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * The primitive operations a remote key-value medium must offer to host a tag cache.
 * Values are opaque bytes; set members are strings.
 * <p>
 * Implementations report an unreachable or timed out medium with
 * {@link ac.tagcache.exception.CacheConnectionException}, never as an absent result.
 */
public interface RemoteStore {

    /**
     * @return stored bytes, or {@code null} when the key does not exist
     */
    byte[] get(String key);

    void set(String key, byte[] value);

    void setWithTtl(String key, byte[] value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    boolean expire(String key, Duration ttl);

    List<String> keysMatchingPrefix(String prefix);

    void setAdd(String setKey, Collection<String> members);

    boolean setRemove(String setKey, String member);

    Set<String> setMembers(String setKey);

    int setCardinality(String setKey);

    void shutdown();
}
