package ac.tagcache.sentinel;

import ac.tagcache.redis.RemoteStore;

/**
 * Discovery of the current primary and replica connections of a replicated Redis service.
 */
public interface ConnectionResolver {

    /**
     * @return a store that writes to the service's current primary, or {@code null} when
     * discovery currently knows no primary (e.g. mid-failover); callers treat null as
     * the primary being unreachable
     * @throws ac.tagcache.exception.CacheConnectionException when discovery itself fails
     */
    RemoteStore resolvePrimary(String serviceName);

    /**
     * @return a store that reads from one of the service's replicas, or {@code null} when
     * no replica is known; callers then read from the primary
     */
    RemoteStore resolveReplica(String serviceName);

    void shutdown();
}
