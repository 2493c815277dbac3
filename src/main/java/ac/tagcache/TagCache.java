package ac.tagcache;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value cache with secondary lookup and bulk invalidation by tag.
 * <p>
 * Every backend implements this contract on its own; a missing key or unknown tag is a
 * normal result, never an exception. Connectivity and serialization failures surface as
 * {@link ac.tagcache.exception.TagCacheException} subclasses.
 */
public interface TagCache {

    /**
     * @return the cached value, or empty when the key is not present or holds null;
     * use {@link #exists(String)} to tell the two apart
     */
    Optional<Object> get(String key);

    default <T> Optional<T> get(String key, Class<T> valueType) {
        return get(key).map(valueType::cast);
    }

    /**
     * @return every live entry currently associated with {@code tag}, null values included;
     * empty for an unknown tag
     */
    Map<String, Object> getByTag(String tag);

    /**
     * @return every live entry in this cache's namespace
     */
    Map<String, Object> getAll();

    default void set(String key, Object value) {
        set(key, value, Collections.emptySet(), null);
    }

    default void set(String key, Object value, Collection<String> tags) {
        set(key, value, tags, null);
    }

    /**
     * Stores or overwrites {@code key}, replacing all of its previous tag associations with
     * exactly {@code tags}.
     *
     * @param tags tags to attach; {@code null} or empty clears every association
     * @param ttl  time to live, or {@code null} for none; ignored by backends without expiry
     */
    void set(String key, Object value, Collection<String> tags, Duration ttl);

    /**
     * @return true if the key existed and was removed
     */
    boolean delete(String key);

    /**
     * @return number of keys actually removed
     */
    int deleteByTag(String tag);

    boolean exists(String key);

    /**
     * Releases the connections held by this cache.
     */
    void shutdown();
}
