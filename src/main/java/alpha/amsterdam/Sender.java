package alpha.amsterdam;

import alpha.amsterdam.internal.HandleLink;
import alpha.amsterdam.internal.TypedChannel;

import java.util.function.Supplier;

import static java.lang.ref.Reference.reachabilityFence;
import static java.util.Objects.requireNonNull;

/**
 * The sending half of a channel.<p>
 * 
 * A sender is obtained from {@link Channels#open()}. More senders for the same
 * channel are created using {@link #copy()}. Each open sender counts as one
 * live sender of the channel, and the channel's receivers will observe a
 * hang-up ({@link RecvException}) only after every sender has been closed and
 * the channel has been drained.<p>
 * 
 * A sender that is no longer needed should be closed, preferably using a
 * try-with-resources statement. A sender that becomes unreachable without
 * having been closed is eventually closed by a cleaner thread, but exactly when
 * that happens is up to the garbage collector.<p>
 * 
 * The channel is thread-safe, the handle is not. One thread should not use a
 * sender while another thread closes or {@linkplain #assign(Sender) assigns}
 * it. Give each thread its own copy.
 * 
 * @param <T> type of value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see Receiver
 */
public final class Sender<T> implements AutoCloseable
{
    private TypedChannel<T> channel;
    private HandleLink link;
    
    // Adopts the channel as-is, the caller has already accounted for us
    Sender(TypedChannel<T> channel) {
        adopt(channel);
    }
    
    /**
     * Enqueues a value.
     * 
     * @param value to enqueue
     * 
     * @throws NullPointerException
     *             if {@code value} is {@code null}
     * @throws IllegalStateException
     *             if this sender is closed
     * @throws SendException
     *             if no receiver remains
     */
    public void push(T value) {
        requireNonNull(value);
        try {
            open().push(value);
        } finally {
            reachabilityFence(this);
        }
    }
    
    /**
     * Enqueues a value created by the given factory.<p>
     * 
     * The factory is called once by the calling thread. If the factory returns
     * exceptionally, the exception propagates and nothing is enqueued.
     * 
     * @param factory of value
     * 
     * @throws NullPointerException
     *             if {@code factory} is {@code null}, or it returns {@code null}
     * @throws IllegalStateException
     *             if this sender is closed
     * @throws SendException
     *             if no receiver remains
     */
    public void emplace(Supplier<? extends T> factory) {
        requireNonNull(factory);
        try {
            open().emplace(factory);
        } finally {
            reachabilityFence(this);
        }
    }
    
    /**
     * Creates a new sender connected to the same channel as this sender.
     * 
     * @return a new sender
     * 
     * @throws IllegalStateException if this sender is closed
     */
    public Sender<T> copy() {
        try {
            var ch = open();
            ch.connectTx();
            return new Sender<>(ch);
        } finally {
            // Until connected, our disconnect could take the count to zero
            reachabilityFence(this);
        }
    }
    
    /**
     * Connects this sender to the channel of the given sender.<p>
     * 
     * If both senders are already connected to the same channel, this method is
     * NOP. Otherwise, this sender is first disconnected from its current channel
     * (unless closed), then connected to the other channel.<p>
     * 
     * A closed sender may be re-opened this way.
     * 
     * @param other sender
     * 
     * @throws NullPointerException
     *             if {@code other} is {@code null}
     * @throws IllegalStateException
     *             if {@code other} is closed
     */
    public void assign(Sender<T> other) {
        try {
            var ch = other.open();
            if (ch == channel) {
                return;
            }
            close();
            ch.connectTx();
            adopt(ch);
        } finally {
            reachabilityFence(other);
        }
    }
    
    /**
     * Returns {@code true} if this sender is closed.
     * 
     * @return {@code true} if this sender is closed
     */
    public boolean isClosed() {
        return channel == null;
    }
    
    /**
     * Disconnects this sender from its channel.<p>
     * 
     * If this was the last open sender, all receivers blocked in {@link
     * Receiver#pop()} wake up and fail with {@link RecvException}.<p>
     * 
     * This method is idempotent.
     */
    @Override
    public void close() {
        if (channel != null) {
            link.close();
            link = null;
            channel = null;
        }
    }
    
    @Override
    public String toString() {
        return "Sender{" + (channel == null ? "closed" : channel.name()) + "}";
    }
    
    private void adopt(TypedChannel<T> ch) {
        link = HandleLink.register(this, "Sender of " + ch.name(), ch::disconnectTx);
        channel = ch;
    }
    
    private TypedChannel<T> open() {
        var ch = channel;
        if (ch == null) {
            throw new IllegalStateException("Sender is closed.");
        }
        return ch;
    }
}
