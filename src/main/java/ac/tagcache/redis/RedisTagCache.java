package ac.tagcache.redis;

import ac.tagcache.CacheArguments;
import ac.tagcache.CacheConfiguration;
import ac.tagcache.TagCache;
import ac.tagcache.codec.ValueCodec;
import ac.tagcache.exception.CacheConfigurationException;
import ac.tagcache.exception.CacheConnectionException;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

/**
 * {@link TagCache} stored in Redis.
 * <p>
 * For a prefix {@code P} the cache owns three key families:
 * <ul>
 *     <li>{@code P<key>} - the encoded value, expiring with the entry's TTL</li>
 *     <li>{@code P tag:<tag>} - set of keys carrying the tag, never expiring, deleted once empty</li>
 *     <li>{@code P key_tags:<key>} - set of the key's tags, expiring with the entry</li>
 * </ul>
 * The index is not updated transactionally. Tag sets may keep references to values that
 * expired on their own; every tag read checks the value before returning it, and every
 * {@code set}/{@code delete} rebuilds the key's index entries from scratch.
 * Concurrent {@code set} calls on the same key are not serialized: the last value write
 * wins but the tag sets may end up holding a mix of both callers' tags.
 */
public class RedisTagCache implements TagCache {
    private static final Logger logger = LoggerFactory.getLogger(RedisTagCache.class);

    static final String TAG_SEGMENT = "tag:";
    static final String KEY_TAGS_SEGMENT = "key_tags:";

    private final StoreRouter router;
    private final ValueCodec codec;
    private final String prefix;
    private final String tagPrefix;
    private final String keyTagsPrefix;

    public RedisTagCache(CacheConfiguration configuration) {
        this(new RedissonRemoteStore(createClient(configuration)), configuration.getCodec(), configuration.getPrefix());
        logger.info("Redis tag cache connected to {} (database {}, prefix '{}')",
                configuration.getAddress(), configuration.getDatabase(), prefix);
    }

    public RedisTagCache(RemoteStore store, ValueCodec codec, String prefix) {
        this(StoreRouter.fixed(store), codec, prefix);
    }

    public RedisTagCache(StoreRouter router, ValueCodec codec, String prefix) {
        this.router = Objects.requireNonNull(router, "Store router cannot be null");
        this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "Prefix cannot be null");
        this.tagPrefix = prefix + TAG_SEGMENT;
        this.keyTagsPrefix = prefix + KEY_TAGS_SEGMENT;
    }

    private static RedissonClient createClient(CacheConfiguration configuration) {
        if (configuration.getHost() == null || configuration.getHost().isBlank()) {
            throw new CacheConfigurationException("Redis backend requires a host");
        }
        Config config = new Config();
        SingleServerConfig server = config.useSingleServer()
                .setAddress(configuration.getAddress())
                .setDatabase(configuration.getDatabase())
                .setTimeout(configuration.getTimeoutMillis())
                .setConnectTimeout(configuration.getConnectTimeoutMillis())
                .setKeepAlive(configuration.isKeepAlive())
                .setPingConnectionInterval(configuration.getPingConnectionIntervalMillis());
        if (configuration.getPassword() != null) {
            server.setPassword(configuration.getPassword());
        }

        try {
            return Redisson.create(config);
        } catch (RedisException e) {
            throw new CacheConnectionException("Cannot connect to Redis at " + configuration.getAddress(), e);
        }
    }

    // KEY LAYOUT
    String valueKey(String key) {
        return prefix + key;
    }

    String tagKey(String tag) {
        return tagPrefix + tag;
    }

    String keyTagsKey(String key) {
        return keyTagsPrefix + key;
    }

    // READ OPERATIONS
    @Override
    public Optional<Object> get(String key) {
        CacheArguments.requireKey(key);
        byte[] bytes = router.forRead().get(valueKey(key));
        if (bytes == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codec.decode(bytes));
    }

    @Override
    public Map<String, Object> getByTag(String tag) {
        CacheArguments.requireTag(tag);
        Map<String, Object> result = new HashMap<>();
        Set<String> taggedKeys = router.forRead().setMembers(tagKey(tag));

        for (String key : taggedKeys) {
            byte[] bytes = router.forRead().get(valueKey(key));
            // members whose value already expired are skipped, not reported
            if (bytes != null) {
                result.put(key, codec.decode(bytes));
            }
        }
        return result;
    }

    @Override
    public Map<String, Object> getAll() {
        Map<String, Object> result = new HashMap<>();
        for (String storageKey : router.forRead().keysMatchingPrefix(prefix)) {
            if (storageKey.startsWith(tagPrefix) || storageKey.startsWith(keyTagsPrefix)) {
                continue;
            }
            byte[] bytes = router.forRead().get(storageKey);
            if (bytes != null) {
                result.put(storageKey.substring(prefix.length()), codec.decode(bytes));
            }
        }
        return result;
    }

    @Override
    public boolean exists(String key) {
        CacheArguments.requireKey(key);
        return router.forRead().exists(valueKey(key));
    }

    // WRITE OPERATIONS
    @Override
    public void set(String key, Object value, Collection<String> tags, Duration ttl) {
        CacheArguments.requireEntry(key, ttl);
        Set<String> tagSet = CacheArguments.distinctTags(tags);
        byte[] encoded = codec.encode(value);

        detachFromTags(key);

        if (ttl != null) {
            router.forWrite().setWithTtl(valueKey(key), encoded, ttl);
        } else {
            router.forWrite().set(valueKey(key), encoded);
        }

        if (!tagSet.isEmpty()) {
            String keyTagsKey = keyTagsKey(key);
            router.forWrite().setAdd(keyTagsKey, tagSet);
            if (ttl != null) {
                router.forWrite().expire(keyTagsKey, ttl);
            }
            // tag sets carry no TTL; they are pruned when their last member is detached
            for (String tag : tagSet) {
                router.forWrite().setAdd(tagKey(tag), Collections.singleton(key));
            }
        }
        logger.debug("Stored key '{}' with tags {} and ttl {}", key, tagSet, ttl);
    }

    @Override
    public boolean delete(String key) {
        CacheArguments.requireKey(key);
        if (!router.forWrite().exists(valueKey(key))) {
            return false;
        }
        detachFromTags(key);
        router.forWrite().delete(valueKey(key));
        logger.debug("Deleted key '{}'", key);
        return true;
    }

    @Override
    public int deleteByTag(String tag) {
        CacheArguments.requireTag(tag);
        String tagKey = tagKey(tag);
        Set<String> taggedKeys = router.forRead().setMembers(tagKey);
        if (taggedKeys.isEmpty()) {
            return 0;
        }

        int count = 0;
        for (String key : new ArrayList<>(taggedKeys)) {
            if (delete(key)) {
                count++;
            } else {
                // value expired on its own; drop the dangling reference from this tag
                router.forWrite().setRemove(tagKey, key);
            }
        }
        if (count < taggedKeys.size() && router.forWrite().setCardinality(tagKey) == 0) {
            router.forWrite().delete(tagKey);
        }
        logger.debug("Deleted {} of {} keys referenced by tag '{}'", count, taggedKeys.size(), tag);
        return count;
    }

    @Override
    public void shutdown() {
        router.shutdown();
    }

    private void detachFromTags(String key) {
        String keyTagsKey = keyTagsKey(key);
        Set<String> previousTags = router.forWrite().setMembers(keyTagsKey);

        for (String tag : previousTags) {
            String tagKey = tagKey(tag);
            router.forWrite().setRemove(tagKey, key);
            if (router.forWrite().setCardinality(tagKey) == 0) {
                router.forWrite().delete(tagKey);
            }
        }
        router.forWrite().delete(keyTagsKey);
    }
}
