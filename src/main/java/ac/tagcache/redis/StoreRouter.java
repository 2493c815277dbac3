package ac.tagcache.redis;

/**
 * Picks the {@link RemoteStore} for each primitive call. Called once per call, so an
 * implementation may return a different store every time.
 */
public interface StoreRouter {

    RemoteStore forWrite();

    RemoteStore forRead();

    void shutdown();

    /**
     * Router that sends every call to the same store.
     */
    static StoreRouter fixed(RemoteStore store) {
        return new StoreRouter() {
            @Override
            public RemoteStore forWrite() {
                return store;
            }

            @Override
            public RemoteStore forRead() {
                return store;
            }

            @Override
            public void shutdown() {
                store.shutdown();
            }
        };
    }
}
