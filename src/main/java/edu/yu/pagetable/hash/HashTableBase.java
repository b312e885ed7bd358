package edu.yu.pagetable.hash;

/**
 * An in-memory associative table. Absence is never an error: {@link #find}
 * returns {@code null} and {@link #remove} returns {@code false} for a key
 * that is not present. Neither keys nor values may be {@code null}.
 * 
 * Implementations must be safe for use by multiple threads without external
 * synchronization.
 * 
 * @param <K> key type
 * @param <V> value type
 */
public abstract class HashTableBase<K, V> {

    /**
     * Look up the value associated with the key.
     * 
     * @param key
     * @return the value, or null if the key isn't in the table
     * @throws IllegalArgumentException if the key is null
     */
    public abstract V find(K key);

    /**
     * Remove the key and its value.
     * 
     * @param key
     * @return true iff the key was present
     * @throws IllegalArgumentException if the key is null
     */
    public abstract boolean remove(K key);

    /**
     * Associate the value with the key, replacing any existing value.
     * 
     * @param key
     * @param value
     * @throws IllegalArgumentException if the key or value is null
     * @throws TableFullException       if the table can't make room for the key
     */
    public abstract void insert(K key, V value);

    /**
     * @return the number of key/value pairs in the table
     */
    public abstract int size();

}
