package alpha.amsterdam.mediumtest;

import alpha.amsterdam.Channels;
import alpha.amsterdam.Receiver;
import alpha.amsterdam.RecvException;
import alpha.amsterdam.SendException;
import alpha.amsterdam.Sender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Medium tests of channels used by many threads.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ConcurrencyTest
{
    private ExecutorService pool;
    
    @BeforeEach
    void newPool() {
        pool = Executors.newCachedThreadPool();
    }
    
    @AfterEach
    void killPool() throws InterruptedException {
        pool.shutdownNow();
        assertThat(pool.awaitTermination(3, SECONDS)).isTrue();
    }
    
    @Test
    void spsc_ordered() {
        var ch = Channels.<Integer>open();
        var tx = ch.sender();
        Future<?> producer = pool.submit(() -> {
            try (tx) {
                for (int i = 0; i < 1024; ++i) {
                    tx.push(i);
                }
            }
        });
        try (var rx = ch.receiver()) {
            Future<?> consumer = pool.submit(() -> {
                for (int i = 0; i < 1024; ++i) {
                    assertThat(rx.pop()).isEqualTo(i);
                }
                return null;
            });
            assertThat(producer).succeedsWithin(3, SECONDS);
            assertThat(consumer).succeedsWithin(3, SECONDS);
        }
    }
    
    @ParameterizedTest
    @CsvSource({"1, 4", "4, 1", "4, 4", "8, 3"})
    void mpmc_noLoss_noDuplicates(int producers, int consumers)
            throws InterruptedException {
        final int perProducer = 10_000;
        final int n = producers * perProducer;
        var seen = new BitSet(n);
        var consumed = new AtomicInteger();
        var start = new CountDownLatch(1);
        List<Future<?>> tasks = new ArrayList<>();
        
        var ch = Channels.<Integer>open();
        try (Sender<Integer> tx = ch.sender();
             Receiver<Integer> rx = ch.receiver())
        {
            for (int p = 0; p < producers; ++p) {
                final int base = p * perProducer;
                final var mine = tx.copy();
                tasks.add(pool.submit(() -> {
                    start.await();
                    try (mine) {
                        for (int i = 0; i < perProducer; ++i) {
                            mine.push(base + i);
                        }
                    }
                    return null;
                }));
            }
            for (int c = 0; c < consumers; ++c) {
                final var mine = rx.copy();
                tasks.add(pool.submit(() -> {
                    start.await();
                    try (mine) {
                        int prev = -1;
                        for (;;) {
                            int x;
                            try {
                                x = mine.pop();
                            } catch (RecvException e) {
                                return null;
                            }
                            synchronized (seen) {
                                assertThat(seen.get(x)).as("duplicate: " + x).isFalse();
                                seen.set(x);
                            }
                            if (producers == 1) {
                                // Single producer, each consumer sees increasing values
                                assertThat(x).isGreaterThan(prev);
                                prev = x;
                            }
                            consumed.incrementAndGet();
                        }
                    }
                }));
            }
        }
        // Only the copies remain; when all producers are done, consumers hang up
        
        start.countDown();
        for (Future<?> f : tasks) {
            assertThat(f).succeedsWithin(10, SECONDS);
        }
        assertThat(consumed).hasValue(n);
        synchronized (seen) {
            assertThat(seen.cardinality()).isEqualTo(n);
        }
    }
    
    @RepeatedTest(50)
    void withJitter_lastSenderWakesAllWaiters() throws Exception {
        final int receivers = 4;
        var rnd = ThreadLocalRandom.current();
        var ch = Channels.<Integer>open();
        var ready = new CountDownLatch(receivers);
        List<Future<Integer>> results = new ArrayList<>();
        
        try (var rx = ch.receiver()) {
            for (int i = 0; i < receivers; ++i) {
                var mine = rx.copy();
                results.add(pool.submit(() -> {
                    int got = 0;
                    try (mine) {
                        ready.countDown();
                        for (;;) {
                            mine.pop();
                            ++got;
                        }
                    } catch (RecvException e) {
                        return got;
                    }
                }));
            }
            ready.await();
            try (var tx = ch.sender()) {
                for (int i = 0; i < 100; ++i) {
                    jitter(rnd);
                    tx.push(i);
                }
            }
            int total = 0;
            for (Future<Integer> f : results) {
                assertThat(f).succeedsWithin(3, SECONDS);
                total += f.get();
            }
            assertThat(total).isEqualTo(100);
        }
    }
    
    @Test
    void lastReceiverGone_sendersFail() throws InterruptedException {
        var ch = Channels.<Integer>open();
        var failed = new CountDownLatch(2);
        var tx = ch.sender();
        var rx = ch.receiver();
        for (int i = 0; i < 2; ++i) {
            var mine = tx.copy();
            pool.submit(() -> {
                try (mine) {
                    for (;;) {
                        mine.push(1);
                        Thread.onSpinWait();
                    }
                } catch (SendException e) {
                    failed.countDown();
                }
            });
        }
        tx.close();
        // Let them fill up a bit
        rx.pop();
        rx.close();
        assertThat(failed.await(3, SECONDS)).isTrue();
    }
    
    private static void jitter(ThreadLocalRandom rnd) {
        // 1/16 chance to give the scheduler a chance
        if ((rnd.nextInt() & 15) != 0) {
            return;
        }
        LockSupport.parkNanos(rnd.nextInt(50_000));
    }
}
