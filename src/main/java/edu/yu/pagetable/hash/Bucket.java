package edu.yu.pagetable.hash;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * A fixed-capacity group of key/value pairs whose keys agree on the low
 * {@code localDepth} bits of their hash. Callers hold {@link #lock()} around
 * every read or write.
 */
public class Bucket<K, V> {

    private final int id;
    private final int capacity;
    private final List<K> keys;
    private final List<V> values;
    private final ReentrantLock lock;
    private int localDepth;

    public Bucket(int id, int capacity, int localDepth) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        if (localDepth < 0) {
            throw new IllegalArgumentException("Local depth must be >= 0");
        }

        this.id = id;
        this.capacity = capacity;
        this.keys = new ArrayList<>(capacity);
        this.values = new ArrayList<>(capacity);
        this.lock = new ReentrantLock();
        this.localDepth = localDepth;
    }

    public int getId() {
        return this.id;
    }

    public int getLocalDepth() {
        return this.localDepth;
    }

    void setLocalDepth(int localDepth) {
        this.localDepth = localDepth;
    }

    public int capacity() {
        return this.capacity;
    }

    public int size() {
        return this.keys.size();
    }

    public boolean isFull() {
        return this.keys.size() >= this.capacity;
    }

    public boolean containsKey(K key) {
        return indexOf(key) != -1;
    }

    /**
     * @param key
     * @return the value for the key, or null if it isn't in this bucket
     */
    public V find(K key) {
        int i = indexOf(key);
        return i == -1 ? null : this.values.get(i);
    }

    /**
     * Remove the key if present. The last entry is moved into the vacated slot.
     * 
     * @param key
     * @return true iff an entry was removed
     */
    public boolean remove(K key) {
        int i = indexOf(key);
        if (i == -1) {
            return false;
        }

        int last = this.keys.size() - 1;
        this.keys.set(i, this.keys.get(last));
        this.values.set(i, this.values.get(last));
        this.keys.remove(last);
        this.values.remove(last);
        return true;
    }

    /**
     * Overwrite the value of an existing key or append a new entry.
     * 
     * @param key
     * @param value
     * @throws IllegalStateException if the key is new and the bucket is full
     */
    public void insert(K key, V value) {
        if (!tryInsert(key, value)) {
            throw new IllegalStateException("Bucket " + this.id + " is full, split before inserting");
        }
    }

    /**
     * Same as {@link #insert} but reports a full bucket instead of throwing.
     * 
     * @param key
     * @param value
     * @return false iff the key is new and there is no room for it
     */
    boolean tryInsert(K key, V value) {
        int i = indexOf(key);
        if (i != -1) {
            this.values.set(i, value);
            return true;
        }

        if (isFull()) {
            return false;
        }

        this.keys.add(key);
        this.values.add(value);
        return true;
    }

    /**
     * Move every entry whose key matches the predicate into the target bucket.
     * The target must have room for all of them.
     * 
     * @param target
     * @param moveKey
     * @return the number of entries moved
     */
    int moveEntriesTo(Bucket<K, V> target, Predicate<K> moveKey) {
        int moved = 0;
        int i = 0;
        while (i < this.keys.size()) {
            K key = this.keys.get(i);
            if (moveKey.test(key)) {
                target.insert(key, this.values.get(i));
                remove(key);
                moved++;
            } else {
                i++;
            }
        }
        return moved;
    }

    void lock() {
        this.lock.lock();
    }

    void unlock() {
        this.lock.unlock();
    }

    private int indexOf(K key) {
        for (int i = 0; i < this.keys.size(); i++) {
            if (this.keys.get(i).equals(key)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        StringBuilder stb = new StringBuilder();
        stb.append("Bucket: [id: ")
                .append(this.id)
                .append(", localDepth: ")
                .append(this.localDepth)
                .append(", size: ")
                .append(this.keys.size())
                .append("/")
                .append(this.capacity)
                .append("]");
        return stb.toString();
    }

}
