package ac.tagcache.sentinel;

import ac.tagcache.CacheConfiguration;
import ac.tagcache.exception.CacheConfigurationException;
import ac.tagcache.exception.CacheConnectionException;
import ac.tagcache.redis.RedissonRemoteStore;
import ac.tagcache.redis.RemoteStore;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.config.Config;
import org.redisson.config.ReadMode;
import org.redisson.config.SentinelServersConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionResolver} backed by Redis Sentinel.
 * <p>
 * Holds two Redisson sentinel-mode clients for the configured master name: one pinned to
 * the master, one reading from replicas. Redisson tracks the sentinels' failover
 * notifications, so each resolved store always talks to whatever node is current when
 * the command is sent.
 */
public class SentinelConnectionResolver implements ConnectionResolver {
    private static final Logger logger = LoggerFactory.getLogger(SentinelConnectionResolver.class);

    private final String serviceName;
    private final RemoteStore primary;
    private final RemoteStore replica;

    public SentinelConnectionResolver(CacheConfiguration configuration) {
        validate(configuration);
        this.serviceName = configuration.getServiceName();
        RedissonClient primaryClient = createClient(configuration, ReadMode.MASTER);
        RedissonClient replicaClient;
        try {
            replicaClient = createClient(configuration, ReadMode.SLAVE);
        } catch (RuntimeException e) {
            primaryClient.shutdown();
            throw e;
        }
        this.primary = new RedissonRemoteStore(primaryClient);
        this.replica = new RedissonRemoteStore(replicaClient);
        logger.info("Sentinel resolver ready for service '{}' via {}", serviceName, configuration.getSentinels());
    }

    private static void validate(CacheConfiguration configuration) {
        if (configuration.getSentinels().isEmpty()) {
            throw new CacheConfigurationException("Sentinel backend requires at least one sentinel address");
        }
        if (configuration.getServiceName() == null || configuration.getServiceName().isBlank()) {
            throw new CacheConfigurationException("Sentinel backend requires a service name");
        }
    }

    private static RedissonClient createClient(CacheConfiguration configuration, ReadMode readMode) {
        Config config = new Config();
        SentinelServersConfig sentinel = config.useSentinelServers()
                .setMasterName(configuration.getServiceName())
                .setDatabase(configuration.getDatabase())
                .setReadMode(readMode)
                .setCheckSentinelsList(false)
                .setTimeout(configuration.getTimeoutMillis())
                .setConnectTimeout(configuration.getConnectTimeoutMillis())
                .setKeepAlive(configuration.isKeepAlive())
                .setPingConnectionInterval(configuration.getPingConnectionIntervalMillis());
        for (String address : configuration.getSentinels()) {
            sentinel.addSentinelAddress(toUri(address));
        }
        if (configuration.getPassword() != null) {
            sentinel.setPassword(configuration.getPassword());
        }
        if (configuration.getSentinelPassword() != null) {
            sentinel.setSentinelPassword(configuration.getSentinelPassword());
        }

        try {
            return Redisson.create(config);
        } catch (RedisException e) {
            logger.error("Cannot resolve master '{}' through sentinels {}",
                    configuration.getServiceName(), configuration.getSentinels(), e);
            throw new CacheConnectionException("Cannot resolve primary for service '"
                    + configuration.getServiceName() + "'", e);
        }
    }

    static String toUri(String address) {
        return address.contains("://") ? address : "redis://" + address;
    }

    @Override
    public RemoteStore resolvePrimary(String serviceName) {
        requireKnownService(serviceName);
        return primary;
    }

    @Override
    public RemoteStore resolveReplica(String serviceName) {
        requireKnownService(serviceName);
        return replica;
    }

    @Override
    public void shutdown() {
        primary.shutdown();
        replica.shutdown();
    }

    private void requireKnownService(String requested) {
        if (!serviceName.equals(requested)) {
            throw new IllegalArgumentException("Resolver is bound to service '" + serviceName
                    + "', not '" + requested + "'");
        }
    }
}
