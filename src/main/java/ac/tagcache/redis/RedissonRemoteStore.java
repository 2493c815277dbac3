package ac.tagcache.redis;

import ac.tagcache.exception.CacheConnectionException;
import org.redisson.api.RBucket;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link RemoteStore} on top of a {@link RedissonClient}. Values go through
 * {@link ByteArrayCodec} and set members through {@link StringCodec}, so the client's
 * own default codec never touches cache data.
 */
public class RedissonRemoteStore implements RemoteStore {

    private final RedissonClient redissonClient;

    public RedissonRemoteStore(RedissonClient redissonClient) {
        this.redissonClient = Objects.requireNonNull(redissonClient, "RedissonClient cannot be null");
    }

    @Override
    public byte[] get(String key) {
        return call("GET " + key, () -> bucket(key).get());
    }

    @Override
    public void set(String key, byte[] value) {
        call("SET " + key, () -> {
            bucket(key).set(value);
            return null;
        });
    }

    @Override
    public void setWithTtl(String key, byte[] value, Duration ttl) {
        call("PSETEX " + key, () -> {
            bucket(key).set(value, ttl.toMillis(), TimeUnit.MILLISECONDS);
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return call("DEL " + key, () -> redissonClient.getKeys().delete(key) > 0);
    }

    @Override
    public boolean exists(String key) {
        return call("EXISTS " + key, () -> redissonClient.getKeys().countExists(key) > 0);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return call("PEXPIRE " + key,
                () -> redissonClient.getKeys().expire(key, ttl.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public List<String> keysMatchingPrefix(String prefix) {
        return call("SCAN " + prefix + "*", () -> {
            List<String> keys = new ArrayList<>();
            for (String key : redissonClient.getKeys().getKeysByPattern(escapeGlob(prefix) + "*")) {
                keys.add(key);
            }
            return keys;
        });
    }

    @Override
    public void setAdd(String setKey, Collection<String> members) {
        if (members.isEmpty()) {
            return;
        }
        call("SADD " + setKey, () -> set(setKey).addAll(members));
    }

    @Override
    public boolean setRemove(String setKey, String member) {
        return call("SREM " + setKey, () -> set(setKey).remove(member));
    }

    @Override
    public Set<String> setMembers(String setKey) {
        return call("SMEMBERS " + setKey, () -> set(setKey).readAll());
    }

    @Override
    public int setCardinality(String setKey) {
        return call("SCARD " + setKey, () -> set(setKey).size());
    }

    @Override
    public void shutdown() {
        if (!redissonClient.isShutdown()) {
            redissonClient.shutdown();
        }
    }

    private RBucket<byte[]> bucket(String key) {
        return redissonClient.getBucket(key, ByteArrayCodec.INSTANCE);
    }

    private RSet<String> set(String setKey) {
        return redissonClient.getSet(setKey, StringCodec.INSTANCE);
    }

    private <R> R call(String command, Supplier<R> operation) {
        try {
            return operation.get();
        } catch (RedisException e) {
            throw new CacheConnectionException("Redis command failed: " + command, e);
        }
    }

    /**
     * Escapes the glob metacharacters Redis honours in KEYS/SCAN patterns.
     */
    static String escapeGlob(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
