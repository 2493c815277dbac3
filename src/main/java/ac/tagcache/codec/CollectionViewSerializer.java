package ac.tagcache.codec;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.util.function.UnaryOperator;

/**
 * Writes an unmodifiable or synchronized JDK collection view as a plain copy of its
 * contents and wraps the copy again on read. Kryo's field serializer cannot rebuild
 * these views itself.
 */
final class CollectionViewSerializer<C> extends Serializer<C> {

    private final UnaryOperator<C> copy;
    private final UnaryOperator<C> wrap;

    CollectionViewSerializer(UnaryOperator<C> copy, UnaryOperator<C> wrap) {
        this.copy = copy;
        this.wrap = wrap;
    }

    @Override
    public void write(Kryo kryo, Output output, C view) {
        C contents;
        // synchronized views lock on themselves
        synchronized (view) {
            contents = copy.apply(view);
        }
        kryo.writeClassAndObject(output, contents);
    }

    @Override
    @SuppressWarnings("unchecked")
    public C read(Kryo kryo, Input input, Class<? extends C> type) {
        return wrap.apply((C) kryo.readClassAndObject(input));
    }
}
