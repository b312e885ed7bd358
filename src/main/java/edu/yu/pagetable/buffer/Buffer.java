package edu.yu.pagetable.buffer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.pagetable.file.BlockId;
import edu.yu.pagetable.file.FileMgr;
import edu.yu.pagetable.file.Page;

/**
 * One frame of the buffer pool. Pin counts are only changed through the buffer
 * manager.
 */
public class Buffer {

    private static final Logger logger = LogManager.getLogger(Buffer.class);

    private final FileMgr fileMgr;
    private final int frame;
    private final Page page;
    private volatile BlockId block;
    private int pins;
    private int txnum;

    public Buffer(FileMgr fileMgr, int frame) {
        if (fileMgr == null) {
            throw new IllegalArgumentException("FileMgr can't be null");
        }

        this.fileMgr = fileMgr;
        this.frame = frame;
        this.page = new Page(fileMgr.blockSize());
        this.txnum = -1;
    }

    public Page contents() {
        return this.page;
    }

    public BlockId block() {
        return this.block;
    }

    /**
     * @return this buffer's position in the pool
     */
    public int frame() {
        return this.frame;
    }

    /**
     * Record that the transaction changed the page so it is written back before
     * the buffer is reassigned.
     * 
     * @param txnum
     */
    public void setModified(int txnum) {
        if (txnum < 0) {
            throw new IllegalArgumentException("Tx number must be >= 0");
        }

        synchronized (this.page) {
            this.txnum = txnum;
        }
    }

    public int modifyingTx() {
        synchronized (this.page) {
            return this.txnum;
        }
    }

    /**
     * Write the page back if it was last modified by the transaction.
     * 
     * @param txnum
     */
    public void flush(int txnum) {
        synchronized (this.page) {
            if (this.txnum == txnum) {
                flush();
            }
        }
    }

    /**
     * Flush the current block if it is dirty, then read the new block's contents.
     * 
     * @param blk
     */
    void assignToBlock(BlockId blk) {
        synchronized (this.page) {
            if (this.block != null && this.txnum != -1) {
                logger.debug("Writing back {} before reading {}", this.block, blk);
                flush();
            }

            this.fileMgr.read(blk, this.page);
            this.block = blk;
        }
    }

    private void flush() {
        this.fileMgr.write(this.block, this.page);
        this.txnum = -1;
    }

    public synchronized boolean isPinned() {
        return this.pins > 0;
    }

    synchronized int pinCount() {
        return this.pins;
    }

    /**
     * @return true iff the buffer was unpinned before this pin
     */
    synchronized boolean pin() {
        return this.pins++ == 0;
    }

    /**
     * Add a pin only if the buffer already has one. An unpinned buffer may be
     * chosen for replacement at any time, so its first pin goes through the
     * buffer manager.
     * 
     * @param blk the block the caller expects this buffer to hold
     * @return true iff the pin was added
     */
    synchronized boolean pinIfPinned(BlockId blk) {
        if (this.pins == 0 || !blk.equals(this.block)) {
            return false;
        }
        this.pins++;
        return true;
    }

    /**
     * @return true iff the buffer is still pinned
     * @throws IllegalStateException if the buffer isn't pinned
     */
    synchronized boolean unpin() {
        if (this.pins <= 0) {
            throw new IllegalStateException("Can't decrement when pin count <= 0 (unpinned)");
        }
        this.pins--;
        return this.pins > 0;
    }

    @Override
    public String toString() {
        StringBuilder stb = new StringBuilder();
        stb.append("Buffer: [frame: ")
                .append(this.frame)
                .append(", block: ")
                .append(this.block)
                .append(", pins: ")
                .append(pinCount())
                .append(", txnum: ")
                .append(modifyingTx())
                .append("]");
        return stb.toString();
    }

}
