package ac.tagcache.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MemoryTagCacheTest {

    private MemoryTagCache cache;

    @BeforeEach
    void setUp() {
        cache = new MemoryTagCache();
    }

    @Test
    void testSetAndGet() {
        // Act
        cache.set("key1", "value1");

        // Assert
        assertEquals(Optional.of("value1"), cache.get("key1"));
        assertEquals(Optional.of("value1"), cache.get("key1", String.class));
        assertTrue(cache.exists("key1"));
        assertEquals(Optional.empty(), cache.get("missing"));
        assertFalse(cache.exists("missing"));
    }

    @Test
    void testTypedGetRejectsWrongType() {
        cache.set("count", 42);

        assertThrows(ClassCastException.class, () -> cache.get("count", String.class));
    }

    @Test
    void testTagScenario() {
        // Arrange
        cache.set("k1", "v1", List.of("t1", "t2"));
        cache.set("k2", "v2", List.of("t1", "t3"));
        cache.set("k3", "v3", List.of("t2", "t3"));

        // Act
        Map<String, Object> t1 = cache.getByTag("t1");
        int removed = cache.deleteByTag("t1");

        // Assert
        assertEquals(Map.of("k1", "v1", "k2", "v2"), t1);
        assertEquals(2, removed);
        assertFalse(cache.exists("k1"));
        assertFalse(cache.exists("k2"));
        assertEquals(Map.of("k3", "v3"), cache.getByTag("t2"));
        assertEquals(Map.of("k3", "v3"), cache.getByTag("t3"));
        assertEquals(Set.of("t2", "t3"), cache.knownTags());
    }

    @Test
    void testOverwriteReplacesTags() {
        cache.set("k", "old", List.of("a", "b"));
        cache.set("k", "new", List.of("c"));

        assertEquals(Map.of(), cache.getByTag("a"));
        assertEquals(Map.of(), cache.getByTag("b"));
        assertEquals(Map.of("k", "new"), cache.getByTag("c"));
        assertEquals(Set.of("c"), cache.tagsOf("k"));
        assertEquals(Set.of("c"), cache.knownTags());
    }

    @Test
    void testSetWithoutTagsDropsOldTags() {
        cache.set("k", "v", List.of("a"));
        cache.set("k", "v2");

        assertEquals(Set.of(), cache.tagsOf("k"));
        assertEquals(Set.of(), cache.knownTags());
        assertEquals(Optional.of("v2"), cache.get("k"));
    }

    @Test
    void testDuplicateTagsCollapse() {
        cache.set("k", "v", List.of("a", "a", "b"));

        assertEquals(Set.of("a", "b"), cache.tagsOf("k"));
        assertEquals(1, cache.getByTag("a").size());
    }

    @Test
    void testDeleteDetachesFromTags() {
        cache.set("k", "v", List.of("a", "b"));
        cache.set("other", "v", List.of("b"));

        assertTrue(cache.delete("k"));
        assertFalse(cache.delete("k"));

        assertEquals(Map.of(), cache.getByTag("a"));
        assertEquals(Map.of("other", "v"), cache.getByTag("b"));
        assertEquals(Set.of("b"), cache.knownTags());
    }

    @Test
    void testDeleteByUnknownTag() {
        cache.set("k", "v", List.of("a"));

        assertEquals(0, cache.deleteByTag("nope"));
        assertTrue(cache.exists("k"));
    }

    @Test
    void testNullValueIsStoredAndTagged() {
        // Act
        cache.set("k", null, List.of("t"));

        // Assert
        assertTrue(cache.exists("k"));
        assertEquals(Optional.empty(), cache.get("k"));
        Map<String, Object> tagged = cache.getByTag("t");
        assertTrue(tagged.containsKey("k"));
        assertNull(tagged.get("k"));
        assertTrue(cache.getAll().containsKey("k"));
        assertEquals(1, cache.deleteByTag("t"));
        assertFalse(cache.exists("k"));
    }

    @Test
    void testTtlIsIgnored() {
        cache.set("k", "v", List.of("a"), Duration.ofMillis(1));

        assertEquals(Optional.of("v"), cache.get("k"));
        assertEquals(Map.of("k", "v"), cache.getByTag("a"));
    }

    @Test
    void testValuesAreHeldByReference() {
        List<String> items = new ArrayList<>(List.of("x"));
        cache.set("list", items);

        items.add("y");

        assertSame(items, cache.get("list").orElseThrow());
    }

    @Test
    void testGetAllReturnsIndependentCopy() {
        cache.set("a", 1, List.of("t"));
        cache.set("b", 2);

        Map<String, Object> all = cache.getAll();
        all.clear();

        assertEquals(Map.of("a", 1, "b", 2), cache.getAll());
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> cache.set(null, "v"));
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v", List.of(), Duration.ofNanos(500)));
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v", Arrays.asList("a", null)));
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v", List.of(), Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> cache.get(null));
        assertThrows(IllegalArgumentException.class, () -> cache.deleteByTag(null));
    }

    @Test
    void testConcurrentWritersKeepIndicesConsistent() throws Exception {
        int threads = 8;
        int rounds = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int id = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    String key = "k" + (i % 10);
                    switch ((id + i) % 4) {
                        case 0:
                            cache.set(key, i, List.of("even", "t" + id));
                            break;
                        case 1:
                            cache.set(key, i, List.of("odd"));
                            break;
                        case 2:
                            cache.delete(key);
                            break;
                        default:
                            cache.deleteByTag("t" + id);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // every key listed under a tag is live and records that tag, and vice versa
        for (String tag : cache.knownTags()) {
            for (String key : cache.getByTag(tag).keySet()) {
                assertTrue(cache.tagsOf(key).contains(tag), key + " missing back-reference to " + tag);
            }
        }
        for (String key : cache.getAll().keySet()) {
            for (String tag : cache.tagsOf(key)) {
                assertTrue(cache.getByTag(tag).containsKey(key), tag + " missing " + key);
            }
        }
    }

    @Test
    void testShutdownKeepsNothingToRelease() {
        cache.set("k", "v");

        cache.shutdown();

        assertTrue(cache.exists("k"));
    }
}
