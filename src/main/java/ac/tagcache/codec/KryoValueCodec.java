package ac.tagcache.codec;

import ac.tagcache.exception.CacheSerializationException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.redisson.client.codec.Codec;

/**
 * {@link ValueCodec} backed by Redisson's Kryo 5 codec, so cached values carry the same
 * Kryo object graphs a Redisson client would write. Collection views such as
 * {@code Collections.unmodifiableMap} are handled by {@link CollectionViewKryo5Codec}.
 */
public class KryoValueCodec implements ValueCodec {

    private final Codec codec;

    public KryoValueCodec() {
        this(new CollectionViewKryo5Codec());
    }

    public KryoValueCodec(ClassLoader classLoader) {
        this(new CollectionViewKryo5Codec(classLoader));
    }

    KryoValueCodec(Codec codec) {
        this.codec = codec;
    }

    @Override
    public byte[] encode(Object value) {
        ByteBuf buf = null;
        try {
            buf = codec.getValueEncoder().encode(value);
            return ByteBufUtil.getBytes(buf);
        } catch (Exception e) {
            String type = value == null ? "null" : value.getClass().getName();
            throw new CacheSerializationException("Failed to encode value of type " + type, e);
        } finally {
            if (buf != null) {
                buf.release();
            }
        }
    }

    @Override
    public Object decode(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes to decode cannot be null");
        }
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        try {
            return codec.getValueDecoder().decode(buf, null);
        } catch (Exception e) {
            throw new CacheSerializationException("Failed to decode " + bytes.length + " stored bytes", e);
        } finally {
            buf.release();
        }
    }
}
