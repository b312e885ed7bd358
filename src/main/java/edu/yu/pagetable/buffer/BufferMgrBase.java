package edu.yu.pagetable.buffer;

import edu.yu.pagetable.file.BlockId;
import edu.yu.pagetable.file.FileMgr;

/**
 * Manages a fixed pool of buffers, each able to hold one block. Clients pin a
 * block to get a buffer holding its contents and unpin the buffer when done.
 * A buffer with no pins may be reassigned to another block.
 */
public abstract class BufferMgrBase {

    /**
     * How an unpinned buffer is chosen when a block has to be read in.
     */
    public enum EvictionPolicy {
        /** The first unpinned buffer in pool order. */
        NAIVE,
        /** The next unpinned buffer after the last one replaced, wrapping around. */
        CLOCK
    }

    /**
     * @param fileMgr     source of block contents
     * @param nBuffers    number of buffers in the pool
     * @param maxWaitTime max milliseconds to wait for an unpinned buffer
     * @param policy      eviction policy
     */
    public BufferMgrBase(FileMgr fileMgr, int nBuffers, int maxWaitTime, EvictionPolicy policy) {
        if (fileMgr == null) {
            throw new IllegalArgumentException("FileMgr can't be null");
        }
        if (nBuffers <= 0) {
            throw new IllegalArgumentException("Number of buffers must be positive");
        }
        if (maxWaitTime <= 0) {
            throw new IllegalArgumentException("Max wait time must be positive");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Eviction policy can't be null");
        }
    }

    /**
     * @return the number of unpinned buffers
     */
    public abstract int available();

    /**
     * Write every buffer last modified by the transaction to disk.
     * 
     * @param txnum
     */
    public abstract void flushAll(int txnum);

    /**
     * Release one pin on the buffer.
     * 
     * @param buffer
     * @throws IllegalArgumentException if the buffer isn't pinned
     */
    public abstract void unpin(Buffer buffer);

    /**
     * Pin a buffer holding the block's contents, reading the block in if it
     * isn't already buffered.
     * 
     * @param blk
     * @return the pinned buffer
     * @throws BufferAbortException if no buffer became available in time
     */
    public abstract Buffer pin(BlockId blk);

    public abstract EvictionPolicy getEvictionPolicy();

}
