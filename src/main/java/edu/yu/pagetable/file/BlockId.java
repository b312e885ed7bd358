package edu.yu.pagetable.file;

import java.util.Objects;

/**
 * Identifies a page on disk: block {@code number} of file {@code fileName}.
 * This is the key of the buffer pool's page table.
 */
public class BlockId {

    private final String fileName;
    private final int number;

    public BlockId(String fileName, int number) {
        if (fileName == null) {
            throw new IllegalArgumentException("Filename can't be null");
        }

        this.fileName = fileName.trim();
        if (this.fileName.isEmpty()) {
            throw new IllegalArgumentException("Filename must have a length greater than 0");
        }

        if (number < 0) {
            throw new IllegalArgumentException("Block number must be >= 0");
        }
        this.number = number;
    }

    public String fileName() {
        return this.fileName;
    }

    public int number() {
        return this.number;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof BlockId) {
            BlockId otherBlock = (BlockId) other;
            return this.number == otherBlock.number && this.fileName.equals(otherBlock.fileName);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.fileName, this.number);
    }

    @Override
    public String toString() {
        return "BlockId: [file: " + this.fileName + ", block: " + this.number + "]";
    }

}
