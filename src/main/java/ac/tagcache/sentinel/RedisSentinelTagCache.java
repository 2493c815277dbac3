package ac.tagcache.sentinel;

import ac.tagcache.CacheConfiguration;
import ac.tagcache.TagCache;
import ac.tagcache.codec.ValueCodec;
import ac.tagcache.exception.CacheConnectionException;
import ac.tagcache.redis.RedisTagCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TagCache} on a Sentinel-managed Redis deployment. Writes go to the current
 * primary, reads to a replica; both are resolved again for every Redis command.
 * <p>
 * The index protocol is the one of {@link RedisTagCache}, driven through a
 * {@link FailoverStoreRouter}. A failover between two commands of one {@code set} or
 * {@code delete} is tolerated per command, not across the whole sequence.
 */
public class RedisSentinelTagCache implements TagCache {
    private static final Logger logger = LoggerFactory.getLogger(RedisSentinelTagCache.class);

    private final String serviceName;
    private final RedisTagCache delegate;

    public RedisSentinelTagCache(CacheConfiguration configuration) {
        this(new SentinelConnectionResolver(configuration), configuration.getServiceName(),
                configuration.getCodec(), configuration.getPrefix());
    }

    public RedisSentinelTagCache(ConnectionResolver resolver, String serviceName, ValueCodec codec, String prefix) {
        Objects.requireNonNull(resolver, "Connection resolver cannot be null");
        this.serviceName = Objects.requireNonNull(serviceName, "Service name cannot be null");
        FailoverStoreRouter router = new FailoverStoreRouter(resolver, serviceName);
        requirePrimary(router, serviceName);
        this.delegate = new RedisTagCache(router, codec, prefix);
        logger.info("Sentinel tag cache ready for service '{}' (prefix '{}')", serviceName, prefix);
    }

    private static void requirePrimary(FailoverStoreRouter router, String serviceName) {
        try {
            router.forWrite();
        } catch (CacheConnectionException e) {
            logger.error("Initial primary lookup failed for service '{}'", serviceName, e);
            router.shutdown();
            throw e;
        }
    }

    public String getServiceName() {
        return serviceName;
    }

    @Override
    public Optional<Object> get(String key) {
        return delegate.get(key);
    }

    @Override
    public Map<String, Object> getByTag(String tag) {
        return delegate.getByTag(tag);
    }

    @Override
    public Map<String, Object> getAll() {
        return delegate.getAll();
    }

    @Override
    public void set(String key, Object value, Collection<String> tags, Duration ttl) {
        delegate.set(key, value, tags, ttl);
    }

    @Override
    public boolean delete(String key) {
        return delegate.delete(key);
    }

    @Override
    public int deleteByTag(String tag) {
        return delegate.deleteByTag(tag);
    }

    @Override
    public boolean exists(String key) {
        return delegate.exists(key);
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }
}
