package edu.yu.pagetable.buffer;

/**
 * Thrown when no buffer frees up within the buffer manager's max wait time.
 */
public class BufferAbortException extends RuntimeException {

    public BufferAbortException(String message) {
        super(message);
    }

}
