package alpha.amsterdam;

import alpha.amsterdam.internal.HandleLink;
import alpha.amsterdam.internal.TypedChannel;

import java.util.Optional;

import static java.lang.ref.Reference.reachabilityFence;

/**
 * The receiving half of a channel.<p>
 * 
 * A receiver is obtained from {@link Channels#open()}. More receivers for the
 * same channel are created using {@link #copy()}. Each open receiver counts as
 * one live receiver of the channel. When the last receiver is closed, values
 * still queued are discarded and all senders fail with {@link
 * SendException}.<p>
 * 
 * Values are received in the order they were sent. Many receivers compete for
 * the values of one channel; each value is received exactly once.<p>
 * 
 * Same as {@link Sender}, the handle is not thread-safe; give each thread its
 * own copy.
 * 
 * @param <T> type of value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see Sender
 */
public final class Receiver<T> implements AutoCloseable
{
    private TypedChannel<T> channel;
    private HandleLink link;
    
    Receiver(TypedChannel<T> channel) {
        adopt(channel);
    }
    
    /**
     * Dequeues a value, waiting for one if necessary.<p>
     * 
     * The calling thread blocks while the channel is empty and at least one
     * sender remains.
     * 
     * @return the value (never {@code null})
     * 
     * @throws IllegalStateException
     *             if this receiver is closed
     * @throws RecvException
     *             if the channel is empty and no sender remains
     * @throws InterruptedException
     *             if the current thread is interrupted while waiting
     */
    public T pop() throws InterruptedException {
        try {
            return open().pop();
        } finally {
            // Or the cleaner could disconnect us mid-wait
            reachabilityFence(this);
        }
    }
    
    /**
     * Dequeues a value, if there is one.<p>
     * 
     * This method does not wait for a value to arrive. An empty channel is only
     * an error if no sender remains.
     * 
     * @return the value, or an empty optional
     * 
     * @throws IllegalStateException
     *             if this receiver is closed
     * @throws RecvException
     *             if the channel is empty and no sender remains
     */
    public Optional<T> tryPop() {
        try {
            return open().tryPop();
        } finally {
            reachabilityFence(this);
        }
    }
    
    /**
     * Returns the number of values currently queued.<p>
     * 
     * The value is stale as soon as it is returned, other threads may have
     * sent or received since.
     * 
     * @return the number of values currently queued
     * 
     * @throws IllegalStateException if this receiver is closed
     */
    public int size() {
        try {
            return open().size();
        } finally {
            reachabilityFence(this);
        }
    }
    
    /**
     * Returns {@code true} if no values are currently queued.
     * 
     * @return {@code true} if no values are currently queued
     * 
     * @throws IllegalStateException if this receiver is closed
     * @see #size()
     */
    public boolean isEmpty() {
        return size() == 0;
    }
    
    /**
     * Creates a new receiver connected to the same channel as this receiver.
     * 
     * @return a new receiver
     * 
     * @throws IllegalStateException if this receiver is closed
     */
    public Receiver<T> copy() {
        try {
            var ch = open();
            ch.connectRx();
            return new Receiver<>(ch);
        } finally {
            // Until connected, our disconnect could take the count to zero
            reachabilityFence(this);
        }
    }
    
    /**
     * Connects this receiver to the channel of the given receiver.<p>
     * 
     * If both receivers are already connected to the same channel, this method
     * is NOP. Otherwise, this receiver is first disconnected from its current
     * channel (unless closed), then connected to the other channel.<p>
     * 
     * A closed receiver may be re-opened this way.
     * 
     * @param other receiver
     * 
     * @throws NullPointerException
     *             if {@code other} is {@code null}
     * @throws IllegalStateException
     *             if {@code other} is closed
     */
    public void assign(Receiver<T> other) {
        try {
            var ch = other.open();
            if (ch == channel) {
                return;
            }
            close();
            ch.connectRx();
            adopt(ch);
        } finally {
            reachabilityFence(other);
        }
    }
    
    /**
     * Returns {@code true} if this receiver is closed.
     * 
     * @return {@code true} if this receiver is closed
     */
    public boolean isClosed() {
        return channel == null;
    }
    
    /**
     * Disconnects this receiver from its channel.<p>
     * 
     * If this was the last open receiver, the values still queued are
     * discarded.<p>
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
        return "Receiver{" + (channel == null ? "closed" : channel.name()) + "}";
    }
    
    private void adopt(TypedChannel<T> ch) {
        link = HandleLink.register(this, "Receiver of " + ch.name(), ch::disconnectRx);
        channel = ch;
    }
    
    private TypedChannel<T> open() {
        var ch = channel;
        if (ch == null) {
            throw new IllegalStateException("Receiver is closed.");
        }
        return ch;
    }
}
