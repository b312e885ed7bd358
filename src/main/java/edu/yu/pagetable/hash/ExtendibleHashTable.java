package edu.yu.pagetable.hash;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.ToIntFunction;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * A growable hash table using extendible hashing. The directory holds
 * {@code 2^globalDepth} bucket ids and is indexed by the low {@code globalDepth}
 * bits of a key's hash. A bucket with local depth {@code d} is shared by
 * {@code 2^(globalDepth - d)} directory slots. A full bucket is split in two on
 * the next hash bit, doubling the directory first when the bucket is already
 * referenced by a single slot. Buckets are never merged and the directory never
 * shrinks.
 *
 * Locking: every operation takes the structure lock in shared mode to resolve a
 * bucket and then that bucket's own lock. Directory growth and bucket splits
 * hold the structure lock exclusively. The structure lock is always acquired
 * before a bucket lock and no thread holds two bucket locks.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ExtendibleHashTable<K, V> extends HashTableBase<K, V> {

    private static final Logger logger = LogManager.getLogger(ExtendibleHashTable.class);

    /** The directory is an int[] so it can't outgrow 2^30 slots. */
    public static final int MAX_DEPTH_LIMIT = 30;

    private static final HashFunction MURMUR = Hashing.murmur3_32_fixed();

    private final int bucketCapacity;
    private final int maxDepth;
    private final ToIntFunction<? super K> hasher;
    private final ReentrantReadWriteLock structureLock;
    private final List<Bucket<K, V>> buckets;
    private int[] directory;
    private int globalDepth;

    public ExtendibleHashTable(int bucketCapacity) {
        this(bucketCapacity, MAX_DEPTH_LIMIT);
    }

    public ExtendibleHashTable(int bucketCapacity, int maxDepth) {
        this(bucketCapacity, maxDepth, key -> MURMUR.hashInt(key.hashCode()).asInt());
    }

    /**
     * @param bucketCapacity entries per bucket
     * @param maxDepth       the largest local depth a bucket may be split to
     * @param hasher         hash function used to place keys; must be
     *                       deterministic for the life of the table
     */
    public ExtendibleHashTable(int bucketCapacity, int maxDepth, ToIntFunction<? super K> hasher) {
        if (bucketCapacity <= 0) {
            throw new IllegalArgumentException("Bucket capacity must be positive");
        }
        if (maxDepth < 0 || maxDepth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException("Max depth must be between 0 and " + MAX_DEPTH_LIMIT);
        }
        if (hasher == null) {
            throw new IllegalArgumentException("Hasher can't be null");
        }

        this.bucketCapacity = bucketCapacity;
        this.maxDepth = maxDepth;
        this.hasher = hasher;
        this.structureLock = new ReentrantReadWriteLock();
        this.buckets = new ArrayList<>();
        this.buckets.add(new Bucket<>(0, bucketCapacity, 0));
        this.directory = new int[] { 0 };
        this.globalDepth = 0;
    }

    /**
     * @param key
     * @return the hash used to place the key in the directory
     */
    public int hashKey(K key) {
        return this.hasher.applyAsInt(key);
    }

    /**
     * Must be called while holding the structure lock.
     */
    private int directoryIndex(int hash) {
        return hash & ((1 << this.globalDepth) - 1);
    }

    @Override
    public V find(K key) {
        if (key == null) {
            throw new IllegalArgumentException("Key can't be null");
        }

        int hash = hashKey(key);
        this.structureLock.readLock().lock();
        try {
            Bucket<K, V> bucket = this.buckets.get(this.directory[directoryIndex(hash)]);
            bucket.lock();
            try {
                return bucket.find(key);
            } finally {
                bucket.unlock();
            }
        } finally {
            this.structureLock.readLock().unlock();
        }
    }

    @Override
    public boolean remove(K key) {
        if (key == null) {
            throw new IllegalArgumentException("Key can't be null");
        }

        int hash = hashKey(key);
        this.structureLock.readLock().lock();
        try {
            Bucket<K, V> bucket = this.buckets.get(this.directory[directoryIndex(hash)]);
            bucket.lock();
            try {
                return bucket.remove(key);
            } finally {
                bucket.unlock();
            }
        } finally {
            this.structureLock.readLock().unlock();
        }
    }

    @Override
    public void insert(K key, V value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Key and value can't be null");
        }

        int hash = hashKey(key);
        while (true) {
            int fullBucketId;
            this.structureLock.readLock().lock();
            try {
                Bucket<K, V> bucket = this.buckets.get(this.directory[directoryIndex(hash)]);
                bucket.lock();
                try {
                    if (bucket.tryInsert(key, value)) {
                        return;
                    }
                    fullBucketId = bucket.getId();
                } finally {
                    bucket.unlock();
                }
            } finally {
                this.structureLock.readLock().unlock();
            }

            splitIfStillFull(key, hash, fullBucketId);
        }
    }

    /**
     * Split the bucket the key maps to, unless another thread already made room
     * for the key while no lock was held.
     */
    private void splitIfStillFull(K key, int hash, int fullBucketId) {
        this.structureLock.writeLock().lock();
        try {
            Bucket<K, V> bucket = this.buckets.get(this.directory[directoryIndex(hash)]);
            if (bucket.getId() != fullBucketId || !bucket.isFull() || bucket.containsKey(key)) {
                return;
            }

            split(bucket, hash);
        } finally {
            this.structureLock.writeLock().unlock();
        }
    }

    /**
     * Split a full bucket on hash bit {@code localDepth}, doubling the directory
     * first if needed. Must be called while holding the structure write lock.
     *
     * @param bucket
     * @param hash   hash of a key that maps to the bucket
     * @throws TableFullException if the bucket is already at the max depth
     */
    private void split(Bucket<K, V> bucket, int hash) {
        int oldDepth = bucket.getLocalDepth();
        if (oldDepth >= this.maxDepth) {
            logger.error("Can't split bucket {} past depth {}, table holds {} buckets",
                    bucket.getId(), this.maxDepth, this.buckets.size());
            throw new TableFullException("Bucket " + bucket.getId() + " is full at max depth " + this.maxDepth);
        }

        if (oldDepth == this.globalDepth) {
            growDirectory();
        }

        Bucket<K, V> sibling = new Bucket<>(this.buckets.size(), this.bucketCapacity, oldDepth + 1);
        this.buckets.add(sibling);
        bucket.setLocalDepth(oldDepth + 1);

        int splitBit = 1 << oldDepth;
        int moved = bucket.moveEntriesTo(sibling, k -> (hashKey(k) & splitBit) != 0);

        // the old bucket's slots are those ending in its low oldDepth bits; the ones with the split bit set move
        int low = hash & (splitBit - 1);
        for (int i = low | splitBit; i < this.directory.length; i += splitBit << 1) {
            this.directory[i] = sibling.getId();
        }

        logger.debug("Split bucket {} into {} at depth {} ({} entries moved)",
                bucket.getId(), sibling.getId(), oldDepth + 1, moved);
    }

    /**
     * Double the directory. Slot {@code i + oldLength} starts out sharing slot
     * {@code i}'s bucket.
     */
    private void growDirectory() {
        int oldLength = this.directory.length;
        int[] grown = Arrays.copyOf(this.directory, oldLength * 2);
        System.arraycopy(this.directory, 0, grown, oldLength, oldLength);
        this.directory = grown;
        this.globalDepth++;

        logger.debug("Grew directory to {} slots (global depth {})", grown.length, this.globalDepth);
    }

    public int getGlobalDepth() {
        this.structureLock.readLock().lock();
        try {
            return this.globalDepth;
        } finally {
            this.structureLock.readLock().unlock();
        }
    }

    /**
     * @param bucketId a bucket id, as returned by {@link #bucketIdAt(int)}
     * @return the local depth of the bucket
     */
    public int getLocalDepth(int bucketId) {
        this.structureLock.readLock().lock();
        try {
            if (bucketId < 0 || bucketId >= this.buckets.size()) {
                throw new IllegalArgumentException("No bucket with id " + bucketId);
            }
            return this.buckets.get(bucketId).getLocalDepth();
        } finally {
            this.structureLock.readLock().unlock();
        }
    }

    public int getNumBuckets() {
        this.structureLock.readLock().lock();
        try {
            return this.buckets.size();
        } finally {
            this.structureLock.readLock().unlock();
        }
    }

    public int directorySize() {
        this.structureLock.readLock().lock();
        try {
            return this.directory.length;
        } finally {
            this.structureLock.readLock().unlock();
        }
    }

    /**
     * @param slot directory slot
     * @return the id of the bucket the slot refers to
     */
    public int bucketIdAt(int slot) {
        this.structureLock.readLock().lock();
        try {
            if (slot < 0 || slot >= this.directory.length) {
                throw new IllegalArgumentException("Slot out of range: " + slot);
            }
            return this.directory[slot];
        } finally {
            this.structureLock.readLock().unlock();
        }
    }

    /**
     * @param key
     * @return true iff the bucket the key maps to has no free slot
     */
    public boolean isBucketFull(K key) {
        if (key == null) {
            throw new IllegalArgumentException("Key can't be null");
        }

        int hash = hashKey(key);
        this.structureLock.readLock().lock();
        try {
            Bucket<K, V> bucket = this.buckets.get(this.directory[directoryIndex(hash)]);
            bucket.lock();
            try {
                return bucket.isFull();
            } finally {
                bucket.unlock();
            }
        } finally {
            this.structureLock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        this.structureLock.writeLock().lock();
        try {
            int size = 0;
            for (Bucket<K, V> bucket : this.buckets) {
                size += bucket.size();
            }
            return size;
        } finally {
            this.structureLock.writeLock().unlock();
        }
    }

    public int getBucketCapacity() {
        return this.bucketCapacity;
    }

    public int getMaxDepth() {
        return this.maxDepth;
    }

    @Override
    public String toString() {
        StringBuilder stb = new StringBuilder();
        stb.append("ExtendibleHashTable: [globalDepth: ")
                .append(getGlobalDepth())
                .append(", buckets: ")
                .append(getNumBuckets())
                .append(", capacity: ")
                .append(this.bucketCapacity)
                .append("]");
        return stb.toString();
    }

}
