package ac.tagcache.memory;

import ac.tagcache.CacheArguments;
import ac.tagcache.TagCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process {@link TagCache}. Values, null included, are held by reference; there is
 * no expiry.
 * <p>
 * The value map and both tag indices are one unit guarded by a single read/write lock, so
 * a reader never sees a key attached to both its old and new tags halfway through a
 * {@code set}.
 */
public class MemoryTagCache implements TagCache {
    private static final Logger logger = LoggerFactory.getLogger(MemoryTagCache.class);

    private final Map<String, Object> values = new HashMap<>();
    // tag -> keys
    private final Map<String, Set<String>> tagRegistry = new HashMap<>();
    // key -> tags
    private final Map<String, Set<String>> keyTags = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<Object> get(String key) {
        CacheArguments.requireKey(key);
        lock.readLock().lock();
        try {
            return Optional.ofNullable(values.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, Object> getByTag(String tag) {
        CacheArguments.requireTag(tag);
        lock.readLock().lock();
        try {
            Set<String> keys = tagRegistry.get(tag);
            if (keys == null) {
                return new HashMap<>();
            }
            Map<String, Object> result = new HashMap<>();
            for (String key : keys) {
                if (values.containsKey(key)) {
                    result.put(key, values.get(key));
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, Object> getAll() {
        lock.readLock().lock();
        try {
            return new HashMap<>(values);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(String key, Object value, Collection<String> tags, Duration ttl) {
        CacheArguments.requireEntry(key, ttl);
        Set<String> tagSet = CacheArguments.distinctTags(tags);
        if (ttl != null) {
            logger.debug("Memory backend has no expiry, ignoring TTL {} for key '{}'", ttl, key);
        }

        lock.writeLock().lock();
        try {
            detachFromTags(key);
            values.put(key, value);
            if (!tagSet.isEmpty()) {
                keyTags.put(key, new HashSet<>(tagSet));
                for (String tag : tagSet) {
                    tagRegistry.computeIfAbsent(tag, t -> new HashSet<>()).add(key);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Stored key '{}' with tags {}", key, tagSet);
    }

    @Override
    public boolean delete(String key) {
        CacheArguments.requireKey(key);
        lock.writeLock().lock();
        try {
            return deleteLocked(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteByTag(String tag) {
        CacheArguments.requireTag(tag);
        int count = 0;
        lock.writeLock().lock();
        try {
            Set<String> keys = tagRegistry.get(tag);
            if (keys == null) {
                return 0;
            }
            // deleting prunes the live set, so walk a copy
            for (String key : new ArrayList<>(keys)) {
                if (deleteLocked(key)) {
                    count++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Deleted {} keys under tag '{}'", count, tag);
        return count;
    }

    @Override
    public boolean exists(String key) {
        CacheArguments.requireKey(key);
        lock.readLock().lock();
        try {
            return values.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void shutdown() {
        // nothing to release
    }

    /**
     * Tags currently recorded for {@code key}; empty when it has none.
     */
    Set<String> tagsOf(String key) {
        lock.readLock().lock();
        try {
            Set<String> tags = keyTags.get(key);
            return tags == null ? Collections.emptySet() : new HashSet<>(tags);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Tags that currently have at least one member.
     */
    Set<String> knownTags() {
        lock.readLock().lock();
        try {
            return new HashSet<>(tagRegistry.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean deleteLocked(String key) {
        if (!values.containsKey(key)) {
            return false;
        }
        values.remove(key);
        detachFromTags(key);
        logger.debug("Deleted key '{}'", key);
        return true;
    }

    private void detachFromTags(String key) {
        Set<String> tags = keyTags.remove(key);
        if (tags == null) {
            return;
        }
        for (String tag : tags) {
            Set<String> keys = tagRegistry.get(tag);
            if (keys != null && keys.remove(key) && keys.isEmpty()) {
                tagRegistry.remove(tag);
            }
        }
    }
}
