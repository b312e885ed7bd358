package edu.yu.pagetable.hash;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class ExtendibleHashTableConcurrencyTest {

    private static final int THREADS = 8;
    private static final int KEYS_PER_THREAD = 5_000;

    private static List<Future<?>> runAll(ExecutorService pool, CountDownLatch start, List<Runnable> tasks) {
        List<Future<?>> futures = new ArrayList<>();
        for (Runnable task : tasks) {
            futures.add(pool.submit(() -> {
                start.await();
                task.run();
                return null;
            }));
        }
        start.countDown();
        return futures;
    }

    private static void awaitAll(ExecutorService pool, List<Future<?>> futures) throws Exception {
        for (Future<?> f : futures) {
            f.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    }

    @Test
    @Order(0)
    public void disjoint_concurrent_inserts_are_all_findable() throws Exception {
        ExtendibleHashTable<Integer, Integer> table = new ExtendibleHashTable<>(4);
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);

        List<Runnable> tasks = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            final int base = t * 1_000_000;
            tasks.add(() -> {
                for (int i = 0; i < KEYS_PER_THREAD; i++) {
                    table.insert(base + i, base + i * 2);
                }
            });
        }
        awaitAll(pool, runAll(pool, start, tasks));

        assertEquals(THREADS * KEYS_PER_THREAD, table.size());
        for (int t = 0; t < THREADS; t++) {
            int base = t * 1_000_000;
            for (int i = 0; i < KEYS_PER_THREAD; i++) {
                assertEquals(base + i * 2, table.find(base + i), "key " + (base + i));
            }
        }

        // every bucket is still referenced by 2^(global - local) slots
        int globalDepth = table.getGlobalDepth();
        int[] refs = new int[table.getNumBuckets()];
        for (int slot = 0; slot < table.directorySize(); slot++) {
            refs[table.bucketIdAt(slot)]++;
        }
        for (int id = 0; id < refs.length; id++) {
            assertEquals(1 << (globalDepth - table.getLocalDepth(id)), refs[id]);
        }
    }

    @Test
    @Order(1)
    public void colliding_keys_from_many_threads() throws Exception {
        // low 4 bits are always zero so every split has to go deep
        ExtendibleHashTable<Integer, Integer> table = new ExtendibleHashTable<>(8, 24, k -> k << 4);
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);

        List<Runnable> tasks = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            final int thread = t;
            tasks.add(() -> {
                for (int i = 0; i < 500; i++) {
                    int key = i * THREADS + thread;
                    table.insert(key, -key);
                }
            });
        }
        awaitAll(pool, runAll(pool, start, tasks));

        assertEquals(THREADS * 500, table.size());
        for (int key = 0; key < THREADS * 500; key++) {
            assertEquals(-key, table.find(key));
        }
        assertTrue(table.getGlobalDepth() > 4);
    }

    @Test
    @Order(2)
    public void readers_never_miss_stable_keys_while_writers_split() throws Exception {
        ExtendibleHashTable<Integer, String> table = new ExtendibleHashTable<>(3);
        final int stableKeys = 1_000;
        for (int i = 0; i < stableKeys; i++) {
            table.insert(-1 - i, "stable" + i);
        }

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Runnable> tasks = new ArrayList<>();

        for (int t = 0; t < THREADS / 2; t++) {
            final int base = t * 100_000;
            tasks.add(() -> {
                for (int i = 0; i < 10_000; i++) {
                    table.insert(base + i, "w" + i);
                    if (i % 3 == 0) {
                        table.remove(base + i);
                    }
                }
            });
        }
        for (int t = 0; t < THREADS / 2; t++) {
            tasks.add(() -> {
                for (int round = 0; round < 20; round++) {
                    for (int i = 0; i < stableKeys; i++) {
                        if (!("stable" + i).equals(table.find(-1 - i))) {
                            throw new AssertionError("Lost stable key " + (-1 - i));
                        }
                    }
                }
            });
        }
        awaitAll(pool, runAll(pool, start, tasks));

        for (int t = 0; t < THREADS / 2; t++) {
            int base = t * 100_000;
            for (int i = 0; i < 10_000; i++) {
                if (i % 3 == 0) {
                    assertNull(table.find(base + i));
                } else {
                    assertEquals("w" + i, table.find(base + i));
                }
            }
        }
    }

    @Test
    @Order(3)
    public void concurrent_upserts_of_same_keys_keep_one_entry_each() throws Exception {
        ExtendibleHashTable<Integer, Integer> table = new ExtendibleHashTable<>(4);
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);

        List<Runnable> tasks = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            final int value = t;
            tasks.add(() -> {
                for (int i = 0; i < 3_000; i++) {
                    table.insert(i, value);
                }
            });
        }
        awaitAll(pool, runAll(pool, start, tasks));

        assertEquals(3_000, table.size());
        for (int i = 0; i < 3_000; i++) {
            Integer v = table.find(i);
            assertNotNull(v);
            assertTrue(v >= 0 && v < THREADS);
        }
    }

}
