package ac.tagcache.codec;

import com.esotericsoftware.kryo.Kryo;
import org.redisson.codec.Kryo5Codec;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * {@link Kryo5Codec} that also round-trips the {@code Collections.unmodifiable*} and
 * {@code Collections.synchronized*} views.
 */
public class CollectionViewKryo5Codec extends Kryo5Codec {

    public CollectionViewKryo5Codec() {
        super();
    }

    public CollectionViewKryo5Codec(ClassLoader classLoader) {
        super(classLoader);
    }

    @Override
    protected Kryo createKryo(ClassLoader classLoader) {
        Kryo kryo = super.createKryo(classLoader);
        registerViews(kryo);
        return kryo;
    }

    static void registerViews(Kryo kryo) {
        // UNMODIFIABLE
        register(kryo, Collections.unmodifiableCollection(new ArrayList<>()),
                c -> new ArrayList<>(c), Collections::unmodifiableCollection);
        register(kryo, Collections.unmodifiableList(new ArrayList<>()),
                l -> new ArrayList<>(l), Collections::unmodifiableList);
        register(kryo, Collections.unmodifiableList(new LinkedList<>()),
                l -> new LinkedList<>(l), Collections::unmodifiableList);
        register(kryo, Collections.unmodifiableSet(new HashSet<>()),
                s -> new LinkedHashSet<>(s), Collections::unmodifiableSet);
        register(kryo, Collections.unmodifiableSortedSet(new TreeSet<>()),
                s -> new TreeSet<>(s), Collections::unmodifiableSortedSet);
        register(kryo, Collections.unmodifiableNavigableSet(new TreeSet<>()),
                s -> new TreeSet<>(s), Collections::unmodifiableNavigableSet);
        register(kryo, Collections.unmodifiableMap(new HashMap<>()),
                m -> new LinkedHashMap<>(m), Collections::unmodifiableMap);
        register(kryo, Collections.unmodifiableSortedMap(new TreeMap<>()),
                m -> new TreeMap<>(m), Collections::unmodifiableSortedMap);
        register(kryo, Collections.unmodifiableNavigableMap(new TreeMap<>()),
                m -> new TreeMap<>(m), Collections::unmodifiableNavigableMap);

        // SYNCHRONIZED
        register(kryo, Collections.synchronizedCollection(new ArrayList<>()),
                c -> new ArrayList<>(c), Collections::synchronizedCollection);
        register(kryo, Collections.synchronizedList(new ArrayList<>()),
                l -> new ArrayList<>(l), Collections::synchronizedList);
        register(kryo, Collections.synchronizedList(new LinkedList<>()),
                l -> new LinkedList<>(l), Collections::synchronizedList);
        register(kryo, Collections.synchronizedSet(new HashSet<>()),
                s -> new LinkedHashSet<>(s), Collections::synchronizedSet);
        register(kryo, Collections.synchronizedSortedSet(new TreeSet<>()),
                s -> new TreeSet<>(s), Collections::synchronizedSortedSet);
        register(kryo, Collections.synchronizedNavigableSet(new TreeSet<>()),
                s -> new TreeSet<>(s), Collections::synchronizedNavigableSet);
        register(kryo, Collections.synchronizedMap(new HashMap<>()),
                m -> new LinkedHashMap<>(m), Collections::synchronizedMap);
        register(kryo, Collections.synchronizedSortedMap(new TreeMap<>()),
                m -> new TreeMap<>(m), Collections::synchronizedSortedMap);
        register(kryo, Collections.synchronizedNavigableMap(new TreeMap<>()),
                m -> new TreeMap<>(m), Collections::synchronizedNavigableMap);
    }

    private static <C> void register(Kryo kryo, C sample, UnaryOperator<C> copy, UnaryOperator<C> wrap) {
        kryo.register(sample.getClass(), new CollectionViewSerializer<>(copy, wrap));
    }
}
