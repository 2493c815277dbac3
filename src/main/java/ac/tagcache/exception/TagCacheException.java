package ac.tagcache.exception;

/**
 * Base exception for all tag cache failures.
 * A missing key or an unknown tag is never reported through this hierarchy.
 */
public class TagCacheException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TagCacheException(String message) {
        super(message);
    }

    public TagCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
