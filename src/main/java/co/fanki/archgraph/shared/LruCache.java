package co.fanki.archgraph.shared;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Least-recently-used {@link BoundedCache} backed by an access-ordered
 * {@link LinkedHashMap}.
 *
 * <p>Reads reorder the map, so every operation runs under the instance
 * lock.</p>
 *
 * @param <K> the key type
 * @param <V> the value type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LruCache<K, V> implements BoundedCache<K, V> {

    private final int capacity;

    private final Map<K, V> entries;

    /**
     * Creates an empty cache.
     *
     * @param theCapacity the maximum number of entries, must be positive
     */
    public LruCache(final int theCapacity) {
        this.capacity = Preconditions.requirePositive(theCapacity,
                "Cache capacity must be positive");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {

            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(
                    final Map.Entry<K, V> eldest) {
                return size() > capacity;
            }
        };
    }

    /** {@inheritDoc} */
    @Override
    public synchronized Optional<V> get(final K key) {
        Preconditions.requireNonNull(key, "Cache key is required");
        return Optional.ofNullable(entries.get(key));
    }

    /** {@inheritDoc} */
    @Override
    public synchronized void put(final K key, final V value) {
        Preconditions.requireNonNull(key, "Cache key is required");
        Preconditions.requireNonNull(value, "Cache value is required");
        entries.put(key, value);
    }

    /** {@inheritDoc} */
    @Override
    public synchronized int size() {
        return entries.size();
    }

    /** {@inheritDoc} */
    @Override
    public int capacity() {
        return capacity;
    }

}
