package alpha.amsterdam;

import alpha.amsterdam.internal.ChannelCore;
import alpha.amsterdam.internal.TypedChannel;

import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * Factory of channels.<p>
 * 
 * A channel is an unbounded FIFO queue connecting any number of {@link
 * Sender}s to any number of {@link Receiver}s, across threads. It is created
 * with one sender and one receiver; more are created by copying them.<p>
 * 
 * The channel tracks how many senders and receivers are open. When the last
 * receiver closes, sending fails with {@link SendException}. When the last
 * sender closes, receiving still yields the values already queued, then fails
 * with {@link RecvException}.
 * 
 * <pre>{@code
 *   Channels.Pair<String> ch = Channels.open();
 *   try (Sender<String> tx = ch.sender();
 *        Receiver<String> rx = ch.receiver()) {
 *       Thread t = new Thread(() -> {
 *           try (Sender<String> mine = tx.copy()) {
 *               mine.push("Hello");
 *           }
 *       });
 *       t.start();
 *       String hello = rx.pop();
 *   }
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Channels
{
    private static final AtomicLong SEQ = new AtomicLong();
    
    private Channels() {
        // Empty
    }
    
    /**
     * Creates a new channel.<p>
     * 
     * The channel is named "channel-N", where N is a process-wide sequence.
     * 
     * @param <T> type of value
     * 
     * @return the channel's first sender and receiver
     */
    public static <T> Pair<T> open() {
        return open("channel-" + SEQ.incrementAndGet());
    }
    
    /**
     * Creates a new channel with the given name.<p>
     * 
     * The name is used in log records and exception messages. It needs not be
     * unique.
     * 
     * @param <T> type of value
     * @param name of channel
     * 
     * @return the channel's first sender and receiver
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public static <T> Pair<T> open(String name) {
        var ch = new TypedChannel<T>(new ChannelCore(name));
        return new Pair<>(new Sender<>(ch), new Receiver<>(ch));
    }
    
    /**
     * The first sender and receiver of a new channel.
     * 
     * @param <T> type of value
     * @param sender of channel
     * @param receiver of channel
     */
    public record Pair<T>(Sender<T> sender, Receiver<T> receiver) {
        /**
         * Initializes this object.
         * 
         * @param sender of channel
         * @param receiver of channel
         * 
         * @throws NullPointerException if any argument is {@code null}
         */
        public Pair {
            requireNonNull(sender);
            requireNonNull(receiver);
        }
    }
}
