package ac.tagcache.stats;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Operation counters for a tagged cache.
 * Thread-safe implementation using atomic operations.
 */
public class CacheStatistics {
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong writes = new AtomicLong(0);
    private final AtomicLong deletes = new AtomicLong(0);
    private final AtomicLong tagLookups = new AtomicLong(0);
    private final AtomicLong tagInvalidations = new AtomicLong(0);
    private final AtomicLong invalidatedKeys = new AtomicLong(0);

    private final LocalDateTime createdAt = LocalDateTime.now();
    private volatile LocalDateTime lastResetAt = createdAt;

    // ==================== READS ====================

    public void incrementHits() {
        hits.incrementAndGet();
    }

    public void incrementMisses() {
        misses.incrementAndGet();
    }

    public void incrementTagLookups() {
        tagLookups.incrementAndGet();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getTagLookups() {
        return tagLookups.get();
    }

    public long getTotalRequests() {
        return getHits() + getMisses();
    }

    public double getHitRate() {
        long total = hits.get() + misses.get();
        return total == 0 ? 0.0 : (double) hits.get() / total;
    }

    public double getMissRate() {
        return getTotalRequests() == 0 ? 0.0 : 1.0 - getHitRate();
    }

    // ==================== WRITES ====================

    public void incrementWrites() {
        writes.incrementAndGet();
    }

    public void incrementDeletes() {
        deletes.incrementAndGet();
    }

    /**
     * Records one tag invalidation that removed {@code removedKeys} entries.
     */
    public void recordTagInvalidation(int removedKeys) {
        tagInvalidations.incrementAndGet();
        invalidatedKeys.addAndGet(removedKeys);
    }

    public long getWrites() {
        return writes.get();
    }

    public long getDeletes() {
        return deletes.get();
    }

    public long getTagInvalidations() {
        return tagInvalidations.get();
    }

    public long getInvalidatedKeys() {
        return invalidatedKeys.get();
    }

    // ==================== LIFECYCLE ====================

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getLastResetAt() {
        return lastResetAt;
    }

    public void reset() {
        hits.set(0);
        misses.set(0);
        writes.set(0);
        deletes.set(0);
        tagLookups.set(0);
        tagInvalidations.set(0);
        invalidatedKeys.set(0);
        lastResetAt = LocalDateTime.now();
    }

    public CacheStatisticsSnapshot getSnapshot() {
        return new CacheStatisticsSnapshot(this);
    }

    @Override
    public String toString() {
        return String.format("CacheStatistics{hits=%d, misses=%d, hitRate=%.2f%%, writes=%d, deletes=%d, "
                        + "tagLookups=%d, tagInvalidations=%d, invalidatedKeys=%d}",
                getHits(), getMisses(), getHitRate() * 100, getWrites(), getDeletes(),
                getTagLookups(), getTagInvalidations(), getInvalidatedKeys());
    }

    /**
     * Immutable copy of the counters at one point in time.
     */
    public static class CacheStatisticsSnapshot {
        private final long hits;
        private final long misses;
        private final long writes;
        private final long deletes;
        private final long tagLookups;
        private final long tagInvalidations;
        private final long invalidatedKeys;
        private final double hitRate;
        private final LocalDateTime snapshotAt;

        private CacheStatisticsSnapshot(CacheStatistics stats) {
            this.hits = stats.getHits();
            this.misses = stats.getMisses();
            this.writes = stats.getWrites();
            this.deletes = stats.getDeletes();
            this.tagLookups = stats.getTagLookups();
            this.tagInvalidations = stats.getTagInvalidations();
            this.invalidatedKeys = stats.getInvalidatedKeys();
            this.hitRate = stats.getHitRate();
            this.snapshotAt = LocalDateTime.now();
        }

        public long getHits() { return hits; }
        public long getMisses() { return misses; }
        public long getWrites() { return writes; }
        public long getDeletes() { return deletes; }
        public long getTagLookups() { return tagLookups; }
        public long getTagInvalidations() { return tagInvalidations; }
        public long getInvalidatedKeys() { return invalidatedKeys; }
        public double getHitRate() { return hitRate; }
        public LocalDateTime getSnapshotAt() { return snapshotAt; }
    }
}
