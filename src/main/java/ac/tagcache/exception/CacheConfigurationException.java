package ac.tagcache.exception;

/**
 * Raised while building a cache: unknown backend, missing connection parameters.
 */
public class CacheConfigurationException extends TagCacheException {

    private static final long serialVersionUID = 1L;

    public CacheConfigurationException(String message) {
        super(message);
    }

    public CacheConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
