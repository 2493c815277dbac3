package ac.tagcache.exception;

/**
 * The underlying store could not be reached or did not answer in time.
 */
public class CacheConnectionException extends TagCacheException {

    private static final long serialVersionUID = 1L;

    public CacheConnectionException(String message) {
        super(message);
    }

    public CacheConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
