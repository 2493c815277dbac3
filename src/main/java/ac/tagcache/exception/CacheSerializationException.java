package ac.tagcache.exception;

public class CacheSerializationException extends TagCacheException {

    private static final long serialVersionUID = 1L;

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
