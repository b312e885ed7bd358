package edu.yu.pagetable.file;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.pagetable.config.DBConfiguration;

/**
 * Reads and writes whole blocks of the files in one database directory. Each
 * file has its own read/write lock and a channel that stays open until
 * {@link #close()}.
 */
public class FileMgr implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(FileMgr.class);

    private final File dbDirectory;
    private final int blockSize;
    private final ConcurrentHashMap<String, ReentrantReadWriteLock> lockMap;
    private final ConcurrentHashMap<String, FileChannel> channelMap;

    public FileMgr(File dbDirectory, int blockSize) {
        if (dbDirectory == null) {
            throw new IllegalArgumentException("Root dir can't be null");
        }
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Blocksize must be positive");
        }

        this.dbDirectory = dbDirectory.getAbsoluteFile();
        this.blockSize = blockSize;
        this.lockMap = new ConcurrentHashMap<>();
        this.channelMap = new ConcurrentHashMap<>();

        // check config to see if this is a new db or existing
        boolean startup;
        try {
            startup = DBConfiguration.INSTANCE.isDBStartup();
        } catch (Exception e) {
            throw new IllegalStateException("Config couldn't supply startup info", e);
        }

        logger.info("Starting FileMgr | DBConfiguration startup = {}", startup);

        if (startup && this.dbDirectory.exists()) {
            logger.info("Deleting prior DB instance");
            deleteDir(this.dbDirectory.toPath());
        }
        this.dbDirectory.mkdirs();

        logger.info("DB initialized: {}", this.dbDirectory.getAbsolutePath());
    }

    private static void deleteDir(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            throw new RuntimeException("Error deleting " + dir, e);
        }
    }

    private ReadWriteLock lockFor(String filename) {
        return this.lockMap.computeIfAbsent(filename, k -> new ReentrantReadWriteLock());
    }

    private FileChannel channelFor(String filename) {
        return this.channelMap.computeIfAbsent(filename, k -> {
            try {
                return FileChannel.open(new File(this.dbDirectory, k).toPath(),
                        StandardOpenOption.READ,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.CREATE);
            } catch (IOException e) {
                throw new RuntimeException("Problem opening file " + k, e);
            }
        });
    }

    public void read(BlockId blk, Page page) {
        if (blk == null || page == null) {
            throw new IllegalArgumentException("Input can't be null");
        }
        checkPageSize(page);

        ReadWriteLock rwl = lockFor(blk.fileName());
        rwl.readLock().lock();
        try {
            ByteBuffer buffer = ByteBuffer.allocate(this.blockSize);
            channelFor(blk.fileName()).read(buffer, (long) blk.number() * this.blockSize);
            buffer.rewind();
            page.propagateData(buffer);
        } catch (IOException e) {
            throw new RuntimeException("Error reading from block " + blk, e);
        } finally {
            rwl.readLock().unlock();
        }
    }

    public void write(BlockId blk, Page page) {
        if (blk == null || page == null) {
            throw new IllegalArgumentException("Input can't be null");
        }
        checkPageSize(page);

        ReadWriteLock rwl = lockFor(blk.fileName());
        rwl.writeLock().lock();
        try {
            channelFor(blk.fileName()).write(ByteBuffer.wrap(page.extractData()), (long) blk.number() * this.blockSize);
        } catch (IOException e) {
            throw new RuntimeException("Error writing to block " + blk, e);
        } finally {
            rwl.writeLock().unlock();
        }
    }

    /**
     * Extend the file by one zeroed block.
     * 
     * @param filename
     * @return the id of the new block
     */
    public BlockId append(String filename) {
        if (filename == null) {
            throw new IllegalArgumentException("Filename can't be null");
        }

        ReadWriteLock rwl = lockFor(filename);
        rwl.writeLock().lock();
        try {
            FileChannel channel = channelFor(filename);
            long oldLength = channel.size();
            channel.write(ByteBuffer.allocate(this.blockSize), oldLength);
            return new BlockId(filename, (int) (oldLength / this.blockSize));
        } catch (IOException e) {
            throw new RuntimeException("Error appending block to " + filename, e);
        } finally {
            rwl.writeLock().unlock();
        }
    }

    /**
     * @param filename
     * @return the number of blocks in the file
     */
    public int length(String filename) {
        if (filename == null) {
            throw new IllegalArgumentException("Filename can't be null");
        }

        ReadWriteLock rwl = lockFor(filename);
        rwl.readLock().lock();
        try {
            return (int) (channelFor(filename).size() / this.blockSize);
        } catch (IOException e) {
            throw new RuntimeException("Error getting file length", e);
        } finally {
            rwl.readLock().unlock();
        }
    }

    public int blockSize() {
        return this.blockSize;
    }

    private void checkPageSize(Page page) {
        if (page.blockSize() != this.blockSize) {
            throw new IllegalArgumentException("Page size " + page.blockSize() + " doesn't match block size " + this.blockSize);
        }
    }

    @Override
    public void close() {
        for (String filename : this.channelMap.keySet()) {
            FileChannel channel = this.channelMap.remove(filename);
            if (channel == null) {
                continue;
            }
            try {
                channel.close();
            } catch (IOException e) {
                logger.warn("Error closing channel for file {}", filename, e);
            }
        }
    }

}
