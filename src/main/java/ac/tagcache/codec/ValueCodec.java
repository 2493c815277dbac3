package ac.tagcache.codec;

/**
 * Turns cached values into bytes and back.
 * Implementations must round-trip every value they accept, including {@code null}
 * and nested containers.
 */
public interface ValueCodec {

    byte[] encode(Object value);

    Object decode(byte[] bytes);
}
