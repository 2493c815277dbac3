package ac.tagcache.redis;

import ac.tagcache.exception.CacheConnectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.redisson.api.RBucket;
import org.redisson.api.RKeys;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisTimeoutException;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RedissonRemoteStoreTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RBucket<byte[]> bucket;

    @Mock
    private RSet<String> set;

    @Mock
    private RKeys keys;

    private RedissonRemoteStore store;

    @BeforeEach
    void setUp() {
        store = new RedissonRemoteStore(redissonClient);

        doReturn(bucket).when(redissonClient).getBucket(anyString(), eq(ByteArrayCodec.INSTANCE));
        doReturn(set).when(redissonClient).getSet(anyString(), eq(StringCodec.INSTANCE));
        when(redissonClient.getKeys()).thenReturn(keys);
    }

    @Test
    void testGetReadsBytesThroughByteArrayCodec() {
        byte[] payload = {1, 2, 3};
        when(bucket.get()).thenReturn(payload);

        assertArrayEquals(payload, store.get("cache:k"));
        verify(redissonClient).getBucket("cache:k", ByteArrayCodec.INSTANCE);
    }

    @Test
    void testSetWithTtlUsesMilliseconds() {
        byte[] payload = {9};

        store.setWithTtl("cache:k", payload, Duration.ofSeconds(2));

        verify(bucket).set(payload, 2000L, TimeUnit.MILLISECONDS);
    }

    @Test
    void testDeleteAndExistsGoThroughKeys() {
        when(keys.delete("cache:k")).thenReturn(1L);
        when(keys.countExists("cache:gone")).thenReturn(0L);

        assertTrue(store.delete("cache:k"));
        assertFalse(store.exists("cache:gone"));
    }

    @Test
    void testExpire() {
        when(keys.expire("cache:key_tags:k", 5000L, TimeUnit.MILLISECONDS)).thenReturn(true);

        assertTrue(store.expire("cache:key_tags:k", Duration.ofSeconds(5)));
    }

    @Test
    void testSetOperationsUseStringCodec() {
        when(set.readAll()).thenReturn(new HashSet<>(Arrays.asList("a", "b")));
        when(set.size()).thenReturn(2);
        when(set.remove("a")).thenReturn(true);

        store.setAdd("cache:tag:t", List.of("a", "b"));

        verify(set).addAll(List.of("a", "b"));
        assertEquals(Set.of("a", "b"), store.setMembers("cache:tag:t"));
        assertEquals(2, store.setCardinality("cache:tag:t"));
        assertTrue(store.setRemove("cache:tag:t", "a"));
        verify(redissonClient, atLeastOnce()).getSet("cache:tag:t", StringCodec.INSTANCE);
    }

    @Test
    void testSetAddWithNoMembersSkipsRedis() {
        store.setAdd("cache:tag:t", Collections.emptyList());

        verifyNoInteractions(set);
    }

    @Test
    void testKeysMatchingPrefixEscapesGlobCharacters() {
        when(keys.getKeysByPattern("app\\*\\[1\\]:*")).thenReturn(List.of("app*[1]:a", "app*[1]:b"));

        List<String> found = store.keysMatchingPrefix("app*[1]:");

        assertEquals(List.of("app*[1]:a", "app*[1]:b"), found);
    }

    @Test
    void testEscapeGlob() {
        assertEquals("cache:", RedissonRemoteStore.escapeGlob("cache:"));
        assertEquals("a\\?b\\\\c", RedissonRemoteStore.escapeGlob("a?b\\c"));
    }

    @Test
    void testTimeoutSurfacesAsConnectionFailure() {
        when(bucket.get()).thenThrow(new RedisTimeoutException("Command execution timeout"));

        CacheConnectionException e = assertThrows(CacheConnectionException.class, () -> store.get("cache:k"));
        assertTrue(e.getMessage().contains("GET cache:k"));
        assertInstanceOf(RedisTimeoutException.class, e.getCause());
    }

    @Test
    void testUnreachableServerSurfacesAsConnectionFailure() {
        when(set.readAll()).thenThrow(new RedisConnectionException("Unable to connect"));

        assertThrows(CacheConnectionException.class, () -> store.setMembers("cache:tag:t"));
    }

    @Test
    void testShutdownIsIdempotent() {
        when(redissonClient.isShutdown()).thenReturn(false, true);

        store.shutdown();
        store.shutdown();

        verify(redissonClient, times(1)).shutdown();
    }
}
