package alpha.amsterdam.testutil;

import org.assertj.core.groups.Tuple;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static alpha.amsterdam.testutil.LogRecords.toJUL;
import static java.lang.System.Logger.Level;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Logging utilities.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Logging
{
    private Logging() {
        // Empty
    }
    
    /**
     * Start recording the log records of a component's package.<p>
     * 
     * The package logger is set to level {@code ALL} until the recorder is
     * closed, at which point the old level is restored.
     * 
     * @param component whose package logger to record
     * 
     * @return a recorder
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static Recorder startRecording(Class<?> component) {
        var r = new Recorder(Logger.getLogger(component.getPackageName()));
        r.install();
        return r;
    }
    
    /**
     * Collects the records of one logger.<p>
     * 
     * {@link #await(Level, String)} waits 3 seconds unless configured
     * otherwise using {@link #timeoutAfter(long, TimeUnit)}.
     */
    public static final class Recorder extends Handler implements AutoCloseable {
        // Strong ref, or the JUL manager may forget our level
        private final Logger logger;
        private final java.util.logging.Level oldLevel;
        private final List<LogRecord> records;
        private final List<Waiter> waiters;
        private long timeout;
        private TimeUnit unit;
        
        private Recorder(Logger logger) {
            this.logger = logger;
            this.oldLevel = logger.getLevel();
            this.records = new ArrayList<>();
            this.waiters = new ArrayList<>();
            this.timeout = 3;
            this.unit = SECONDS;
            setLevel(java.util.logging.Level.ALL);
        }
        
        private void install() {
            logger.setLevel(java.util.logging.Level.ALL);
            logger.addHandler(this);
        }
        
        /**
         * Set a new timeout for {@link #await(Level, String)}.
         * 
         * @param timeout value
         * @param unit of timeout
         * @return this for chaining/fluency
         */
        public Recorder timeoutAfter(long timeout, TimeUnit unit) {
            this.timeout = timeout;
            this.unit = requireNonNull(unit);
            return this;
        }
        
        /**
         * Return immediately if a record of the given level whose message
         * starts with the given text has been published, or await its arrival.
         * 
         * @param level of record
         * @param messageStartsWith of record
         * 
         * @return {@code true} if observed, {@code false} on timeout
         * 
         * @throws InterruptedException
         *             if the current thread is interrupted while waiting
         */
        public boolean await(Level level, String messageStartsWith)
                throws InterruptedException {
            requireNonNull(messageStartsWith);
            var jul = toJUL(level);
            var w = new Waiter(r -> r.getLevel().equals(jul) &&
                                    r.getMessage().startsWith(messageStartsWith));
            synchronized (this) {
                records.forEach(w);
                waiters.add(w);
            }
            return w.latch.await(timeout, unit);
        }
        
        /**
         * Assert that the observed records contain each given value exactly
         * once.
         * 
         * @param values use {@link LogRecords#rec(Level, String)}
         */
        public void assertThatLogContainsOnlyOnce(Tuple... values) {
            List<LogRecord> snapshot;
            synchronized (this) {
                snapshot = List.copyOf(records);
            }
            assertThat(snapshot)
                .extracting(LogRecord::getLevel, LogRecord::getMessage)
                .containsOnlyOnce(values);
        }
        
        @Override
        public synchronized void publish(LogRecord record) {
            records.add(record);
            waiters.forEach(w -> w.accept(record));
        }
        
        @Override
        public void flush() {
            // Empty
        }
        
        /**
         * Stop recording. Records observed so far remain available.
         */
        @Override
        public void close() {
            logger.removeHandler(this);
            logger.setLevel(oldLevel);
        }
    }
    
    private static final class Waiter implements Consumer<LogRecord> {
        final Predicate<LogRecord> test;
        final CountDownLatch latch = new CountDownLatch(1);
        
        Waiter(Predicate<LogRecord> test) {
            this.test = test;
        }
        
        @Override
        public void accept(LogRecord r) {
            if (test.test(r)) {
                latch.countDown();
            }
        }
    }
}
