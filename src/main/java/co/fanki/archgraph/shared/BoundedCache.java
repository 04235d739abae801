package co.fanki.archgraph.shared;

import java.util.Optional;

/**
 * An in-memory cache holding at most {@link #capacity()} entries.
 *
 * <p>Implementations are safe for concurrent use.</p>
 *
 * @param <K> the key type, a value object
 * @param <V> the value type, immutable
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface BoundedCache<K, V> {

    /**
     * Returns the value stored under a key and marks it most recently
     * used.
     *
     * @param key the key
     * @return the value, empty on a miss
     */
    Optional<V> get(K key);

    /**
     * Stores a value, marking it most recently used and evicting the
     * least recently used entry when the capacity is exceeded.
     *
     * @param key the key
     * @param value the value
     */
    void put(K key, V value);

    /**
     * Returns the number of entries.
     *
     * @return the size
     */
    int size();

    /**
     * Returns the maximum number of entries.
     *
     * @return the capacity
     */
    int capacity();

}
