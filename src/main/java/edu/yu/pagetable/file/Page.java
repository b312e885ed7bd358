package edu.yu.pagetable.file;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The in-memory contents of one block. Variable length values are stored as a
 * 4 byte length followed by the bytes.
 */
public class Page {

    public static final Charset CHARSET = StandardCharsets.US_ASCII;

    private final ReadWriteLock lock;
    private final int blockSize;
    private final ByteBuffer buffer;

    public Page(int blockSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Blocksize must be positive");
        }

        this.lock = new ReentrantReadWriteLock();
        this.blockSize = blockSize;
        this.buffer = ByteBuffer.allocate(blockSize);
    }

    public int blockSize() {
        return this.blockSize;
    }

    public int getInt(int offset) {
        this.lock.readLock().lock();
        try {
            return this.buffer.getInt(offset);
        } catch (IndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Error getting int at " + offset, e);
        } finally {
            this.lock.readLock().unlock();
        }
    }

    public void setInt(int offset, int n) {
        this.lock.writeLock().lock();
        try {
            this.buffer.putInt(offset, n);
        } catch (IndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Error setting int at " + offset, e);
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    public byte[] getBytes(int offset) {
        this.lock.readLock().lock();
        try {
            int len = this.buffer.getInt(offset);
            byte[] val = new byte[len];
            this.buffer.get(offset + Integer.BYTES, val, 0, len);
            return val;
        } catch (IndexOutOfBoundsException | NegativeArraySizeException e) {
            throw new IllegalArgumentException("Error getting bytes at " + offset, e);
        } finally {
            this.lock.readLock().unlock();
        }
    }

    public void setBytes(int offset, byte[] b) {
        if (b == null) {
            throw new IllegalArgumentException("Byte array can't be null");
        }
        if (offset < 0 || (long) offset + Integer.BYTES + b.length > this.blockSize) {
            throw new IllegalArgumentException("Byte array exceeds max length");
        }

        this.lock.writeLock().lock();
        try {
            this.buffer.putInt(offset, b.length);
            this.buffer.put(offset + Integer.BYTES, b, 0, b.length);
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    public String getString(int offset) {
        return new String(getBytes(offset), CHARSET);
    }

    public void setString(int offset, String s) {
        if (s == null) {
            throw new IllegalArgumentException("String can't be null");
        }
        setBytes(offset, s.getBytes(CHARSET));
    }

    /**
     * Overwrite the whole page with the buffer's remaining bytes.
     * 
     * @param data
     */
    void propagateData(ByteBuffer data) {
        this.lock.writeLock().lock();
        try {
            this.buffer.put(0, data, data.position(), Math.min(data.remaining(), this.blockSize));
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    /**
     * @return a copy of the page's bytes
     */
    byte[] extractData() {
        this.lock.readLock().lock();
        try {
            byte[] data = new byte[this.blockSize];
            this.buffer.get(0, data, 0, this.blockSize);
            return data;
        } finally {
            this.lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "Page(" + this.blockSize + ")";
    }

}
