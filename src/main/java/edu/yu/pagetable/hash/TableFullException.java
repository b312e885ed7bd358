package edu.yu.pagetable.hash;

/**
 * Thrown when a bucket can't be split because its local depth has already
 * reached the table's maximum depth. Seeing this means too many keys share
 * every usable hash bit.
 */
public class TableFullException extends RuntimeException {

    public TableFullException(String message) {
        super(message);
    }

}
