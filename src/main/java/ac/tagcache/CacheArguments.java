package ac.tagcache;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Argument checks shared by the backends.
 */
public final class CacheArguments {

    public static final Duration MIN_TTL = Duration.ofMillis(1);

    private CacheArguments() {
    }

    public static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key cannot be null");
        }
    }

    public static void requireTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Tag cannot be null");
        }
    }

    /**
     * Checks the arguments of a {@code set}. Values may be null; a TTL, when given, must
     * be at least one millisecond, the smallest expiry Redis accepts.
     */
    public static void requireEntry(String key, Duration ttl) {
        requireKey(key);
        if (ttl != null && ttl.compareTo(MIN_TTL) < 0) {
            throw new IllegalArgumentException("TTL must be at least 1 ms, got " + ttl);
        }
    }

    /**
     * Deduplicates {@code tags}, keeping first-seen order.
     */
    public static Set<String> distinctTags(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String tag : tags) {
            requireTag(tag);
            distinct.add(tag);
        }
        return distinct;
    }
}
