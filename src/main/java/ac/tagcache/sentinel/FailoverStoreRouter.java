package ac.tagcache.sentinel;

import ac.tagcache.exception.CacheConnectionException;
import ac.tagcache.redis.RemoteStore;
import ac.tagcache.redis.StoreRouter;

/**
 * Resolves the primary or a replica afresh on every primitive call, so a failover between
 * two calls of one cache operation is picked up by the next call.
 */
public class FailoverStoreRouter implements StoreRouter {

    private final ConnectionResolver resolver;
    private final String serviceName;

    public FailoverStoreRouter(ConnectionResolver resolver, String serviceName) {
        this.resolver = resolver;
        this.serviceName = serviceName;
    }

    @Override
    public RemoteStore forWrite() {
        RemoteStore primary = resolver.resolvePrimary(serviceName);
        if (primary == null) {
            throw new CacheConnectionException("No primary available for service '" + serviceName + "'");
        }
        return primary;
    }

    @Override
    public RemoteStore forRead() {
        RemoteStore replica = resolver.resolveReplica(serviceName);
        return replica != null ? replica : forWrite();
    }

    @Override
    public void shutdown() {
        resolver.shutdown();
    }
}
