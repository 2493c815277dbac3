package ac.tagcache.stats;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class CacheStatisticsTest {

    private CacheStatistics statistics;

    @BeforeEach
    void setUp() {
        statistics = new CacheStatistics();
    }

    @Test
    void testEmptyStatistics() {
        assertThat(statistics.getTotalRequests()).isZero();
        assertThat(statistics.getHitRate()).isEqualTo(0.0);
        assertThat(statistics.getMissRate()).isEqualTo(0.0);
    }

    @Test
    void testHitAndMissRates() {
        // Given
        statistics.incrementHits();
        statistics.incrementHits();
        statistics.incrementHits();
        statistics.incrementMisses();

        // Then
        assertThat(statistics.getTotalRequests()).isEqualTo(4);
        assertThat(statistics.getHitRate()).isEqualTo(0.75);
        assertThat(statistics.getMissRate()).isEqualTo(0.25);
    }

    @Test
    void testTagInvalidations() {
        statistics.recordTagInvalidation(3);
        statistics.recordTagInvalidation(0);

        assertThat(statistics.getTagInvalidations()).isEqualTo(2);
        assertThat(statistics.getInvalidatedKeys()).isEqualTo(3);
    }

    @Test
    void testReset() {
        // Given - populate some statistics
        statistics.incrementHits();
        statistics.incrementMisses();
        statistics.incrementWrites();
        statistics.incrementDeletes();
        statistics.incrementTagLookups();
        statistics.recordTagInvalidation(2);

        LocalDateTime beforeReset = LocalDateTime.now();

        // When
        statistics.reset();

        // Then
        assertThat(statistics.getHits()).isEqualTo(0);
        assertThat(statistics.getMisses()).isEqualTo(0);
        assertThat(statistics.getWrites()).isEqualTo(0);
        assertThat(statistics.getDeletes()).isEqualTo(0);
        assertThat(statistics.getTagLookups()).isEqualTo(0);
        assertThat(statistics.getTagInvalidations()).isEqualTo(0);
        assertThat(statistics.getInvalidatedKeys()).isEqualTo(0);
        assertThat(statistics.getLastResetAt()).isAfterOrEqualTo(beforeReset);

        // Creation time should remain unchanged
        assertThat(statistics.getCreatedAt()).isBeforeOrEqualTo(statistics.getLastResetAt());
    }

    @Test
    void testSnapshot() {
        // Given
        statistics.incrementHits();
        statistics.incrementMisses();
        statistics.incrementWrites();

        // When
        CacheStatistics.CacheStatisticsSnapshot snapshot = statistics.getSnapshot();
        statistics.incrementHits();

        // Then
        assertThat(snapshot.getHits()).isEqualTo(1);
        assertThat(snapshot.getMisses()).isEqualTo(1);
        assertThat(snapshot.getWrites()).isEqualTo(1);
        assertThat(snapshot.getHitRate()).isEqualTo(0.5);
        assertThat(snapshot.getSnapshotAt()).isNotNull();
    }

    @Test
    void testToString() {
        statistics.incrementHits();
        statistics.recordTagInvalidation(4);

        assertThat(statistics.toString())
                .contains("hits=1")
                .contains("tagInvalidations=1")
                .contains("invalidatedKeys=4");
    }
}
