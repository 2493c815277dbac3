package ac.tagcache;

import ac.tagcache.exception.CacheConfigurationException;
import ac.tagcache.memory.MemoryTagCache;
import ac.tagcache.redis.RedisTagCache;
import ac.tagcache.sentinel.RedisSentinelTagCache;
import ac.tagcache.stats.CacheStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the library: picks a backend from a {@link CacheConfiguration} and
 * forwards every call to it unchanged.
 *
 * <pre>{@code
 * TaggedCache cache = new TaggedCache(CacheConfiguration.builder()
 *         .backend("redis")
 *         .host("localhost")
 *         .prefix("orders:")
 *         .build());
 * cache.set("order-17", order, List.of("customer-4", "open"), Duration.ofMinutes(10));
 * cache.deleteByTag("customer-4");
 * }</pre>
 */
public class TaggedCache implements TagCache {
    private static final Logger logger = LoggerFactory.getLogger(TaggedCache.class);

    private final BackendType backendType;
    private final TagCache backend;
    private final CacheStatistics statistics = new CacheStatistics();

    public TaggedCache() {
        this(CacheConfiguration.builder().build());
    }

    public TaggedCache(CacheConfiguration configuration) {
        Objects.requireNonNull(configuration, "Cache configuration cannot be null");
        if (configuration.getBackend() == null) {
            throw new CacheConfigurationException("No backend configured");
        }
        this.backendType = configuration.getBackend();
        this.backend = createBackend(configuration);
        logger.info("Tagged cache using '{}' backend", backendType.getBackendName());
    }

    /**
     * Wraps an already built backend, e.g. one sharing a Redisson client with the caller.
     */
    public TaggedCache(BackendType backendType, TagCache backend) {
        this.backendType = Objects.requireNonNull(backendType, "Backend type cannot be null");
        this.backend = Objects.requireNonNull(backend, "Backend cannot be null");
    }

    public static TaggedCache create(String backendName, CacheConfiguration.Builder builder) {
        return new TaggedCache(builder.backend(backendName).build());
    }

    private static TagCache createBackend(CacheConfiguration configuration) {
        switch (configuration.getBackend()) {
            case MEMORY:
                return new MemoryTagCache();
            case REDIS:
                return new RedisTagCache(configuration);
            case REDIS_SENTINEL:
                return new RedisSentinelTagCache(configuration);
            default:
                throw new CacheConfigurationException("Unsupported backend: " + configuration.getBackend());
        }
    }

    public BackendType getBackendType() {
        return backendType;
    }

    public TagCache getBackend() {
        return backend;
    }

    public CacheStatistics getStatistics() {
        return statistics;
    }

    @Override
    public Optional<Object> get(String key) {
        Optional<Object> value = backend.get(key);
        if (value.isPresent()) {
            statistics.incrementHits();
        } else {
            statistics.incrementMisses();
        }
        return value;
    }

    @Override
    public Map<String, Object> getByTag(String tag) {
        statistics.incrementTagLookups();
        return backend.getByTag(tag);
    }

    @Override
    public Map<String, Object> getAll() {
        return backend.getAll();
    }

    @Override
    public void set(String key, Object value, Collection<String> tags, Duration ttl) {
        backend.set(key, value, tags, ttl);
        statistics.incrementWrites();
    }

    @Override
    public boolean delete(String key) {
        boolean deleted = backend.delete(key);
        if (deleted) {
            statistics.incrementDeletes();
        }
        return deleted;
    }

    @Override
    public int deleteByTag(String tag) {
        int removed = backend.deleteByTag(tag);
        statistics.recordTagInvalidation(removed);
        return removed;
    }

    @Override
    public boolean exists(String key) {
        return backend.exists(key);
    }

    @Override
    public void shutdown() {
        backend.shutdown();
        logger.info("Tagged cache shut down: {}", statistics);
    }
}
