package edu.yu.pagetable.buffer;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.pagetable.config.DBConfiguration;
import edu.yu.pagetable.file.BlockId;
import edu.yu.pagetable.file.FileMgr;
import edu.yu.pagetable.hash.ExtendibleHashTable;

/**
 * Buffer pool whose block to frame mapping is an {@link ExtendibleHashTable}.
 * The semaphore holds one permit per unpinned buffer. Pinning a buffer that is
 * already pinned goes through the page table alone. Reading a block in or
 * giving an unpinned buffer its first pin is serialized on this manager.
 */
public class BufferMgr extends BufferMgrBase {

    private static final Logger logger = LogManager.getLogger(BufferMgr.class);

    private final EvictionPolicy evictionPolicy;
    private final int maxWaitTime;
    private final Semaphore semaphore;
    private final Buffer[] bufferPool;
    private final ExtendibleHashTable<BlockId, Integer> pageTable;
    private int clockHand;

    public BufferMgr(FileMgr fileMgr, int nBuffers, int maxWaitTime, EvictionPolicy policy) {
        super(fileMgr, nBuffers, maxWaitTime, policy);

        this.evictionPolicy = policy;
        this.maxWaitTime = maxWaitTime;
        this.semaphore = new Semaphore(nBuffers);
        this.bufferPool = new Buffer[nBuffers];
        for (int i = 0; i < nBuffers; i++) {
            this.bufferPool[i] = new Buffer(fileMgr, i);
        }
        this.pageTable = new ExtendibleHashTable<>(
                DBConfiguration.INSTANCE.bucketCapacity(),
                DBConfiguration.INSTANCE.maxGlobalDepth());

        logger.info("Created buffer pool | buffers = {}, policy = {}, page table bucket capacity = {}",
                nBuffers, policy, this.pageTable.getBucketCapacity());
    }

    public BufferMgr(FileMgr fileMgr, int nBuffers, int maxWaitTime) {
        this(fileMgr, nBuffers, maxWaitTime, EvictionPolicy.NAIVE);
    }

    @Override
    public int available() {
        return this.semaphore.availablePermits();
    }

    @Override
    public void flushAll(int txnum) {
        if (txnum < 0) {
            throw new IllegalArgumentException("Tx number must be >= 0");
        }

        for (Buffer buffer : this.bufferPool) {
            buffer.flush(txnum);
        }
    }

    @Override
    public void unpin(Buffer buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("Buffer can't be null");
        }
        if (buffer.frame() < 0 || buffer.frame() >= this.bufferPool.length
                || this.bufferPool[buffer.frame()] != buffer) {
            throw new IllegalArgumentException("Buffer doesn't belong to this buffer manager");
        }

        try {
            if (!buffer.unpin()) {
                this.semaphore.release();
            }
        } catch (IllegalStateException e) {
            throw new IllegalArgumentException("Buffer must be pinned to unpin", e);
        }
    }

    @Override
    public Buffer pin(BlockId blk) {
        if (blk == null) {
            throw new IllegalArgumentException("BlockID can't be null");
        }

        // the block is buffered and pinned by someone else
        Integer frame = this.pageTable.find(blk);
        if (frame != null && this.bufferPool[frame].pinIfPinned(blk)) {
            return this.bufferPool[frame];
        }

        try {
            if (!this.semaphore.tryAcquire(this.maxWaitTime, TimeUnit.MILLISECONDS)) {
                throw new BufferAbortException("No buffers available at this time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Thread interrupted while pinning", e);
        }

        try {
            return pinWithPermit(blk);
        } catch (RuntimeException e) {
            this.semaphore.release();
            throw e;
        }
    }

    /**
     * Pin the block while holding a semaphore permit. The permit is kept only if
     * an unpinned buffer was pinned.
     * 
     * @param blk
     * @return the pinned buffer
     */
    private synchronized Buffer pinWithPermit(BlockId blk) {
        Integer frame = this.pageTable.find(blk);
        if (frame != null) {
            Buffer buffer = this.bufferPool[frame];
            if (!buffer.pin()) {
                // pinned by someone else in the meantime, no buffer was consumed
                this.semaphore.release();
            }
            return buffer;
        }

        logger.debug("Page table miss for {}", blk);

        int victim = nextUnpinnedFrame();
        if (victim == -1) {
            throw new IllegalStateException("Holding a permit but found no unpinned buffer");
        }

        Buffer buffer = this.bufferPool[victim];
        BlockId previous = buffer.block();

        // if the write back or read fails the frame still holds previous, so its mapping stays
        buffer.assignToBlock(blk);
        if (previous != null) {
            this.pageTable.remove(previous);
        }
        this.pageTable.insert(blk, victim);
        buffer.pin();
        return buffer;
    }

    /**
     * Choose an unpinned buffer according to the eviction policy. Must be called
     * while holding this manager's monitor.
     * 
     * @return the frame of an unpinned buffer or -1 if every buffer is pinned
     */
    private int nextUnpinnedFrame() {
        int start = this.evictionPolicy == EvictionPolicy.CLOCK ? this.clockHand : 0;
        for (int i = 0; i < this.bufferPool.length; i++) {
            int index = (start + i) % this.bufferPool.length;
            if (!this.bufferPool[index].isPinned()) {
                if (this.evictionPolicy == EvictionPolicy.CLOCK) {
                    this.clockHand = (index + 1) % this.bufferPool.length;
                }
                return index;
            }
        }
        return -1;
    }

    @Override
    public EvictionPolicy getEvictionPolicy() {
        return this.evictionPolicy;
    }

    ExtendibleHashTable<BlockId, Integer> pageTable() {
        return this.pageTable;
    }

}
