package alpha.amsterdam.internal;

import alpha.amsterdam.RecvException;
import alpha.amsterdam.SendException;

import java.util.Optional;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Binds a value type to a {@link ChannelCore}.<p>
 * 
 * This class allocates the node that carries a value into the queue and takes
 * the value out of the node on the way out. Everything else is delegated to the
 * core.
 * 
 * @param <T> type of value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class TypedChannel<T>
{
    private final ChannelCore core;
    
    /**
     * Initializes this object.
     * 
     * @param core to wrap
     * 
     * @throws NullPointerException if {@code core} is {@code null}
     */
    public TypedChannel(ChannelCore core) {
        this.core = requireNonNull(core);
    }
    
    /**
     * Enqueues a value.
     * 
     * @param value to enqueue
     * 
     * @throws NullPointerException if {@code value} is {@code null}
     * @throws SendException if no receiver remains
     */
    public void push(T value) {
        core.push(new ValueNode<>(requireNonNull(value)));
    }
    
    /**
     * Enqueues a value created by the given factory.<p>
     * 
     * The factory is called exactly once, by the calling thread, before the
     * channel is locked. Any exception from the factory propagates as-is and
     * nothing is enqueued.
     * 
     * @param factory of value
     * 
     * @throws NullPointerException
     *             if {@code factory} is {@code null}, or it returns {@code null}
     * @throws SendException if no receiver remains
     */
    public void emplace(Supplier<? extends T> factory) {
        T v = factory.get();
        if (v == null) {
            throw new NullPointerException("Factory returned null.");
        }
        core.push(new ValueNode<>(v));
    }
    
    /**
     * Dequeues a value, waiting for one if necessary.
     * 
     * @return the value
     * 
     * @throws RecvException
     *             if the channel is empty and no sender remains
     * @throws InterruptedException
     *             if the current thread is interrupted while waiting
     */
    public T pop() throws InterruptedException {
        return take(core.pop());
    }
    
    /**
     * Dequeues a value, if there is one.
     * 
     * @return the value, or an empty optional if the channel is empty but at
     *         least one sender remains
     * 
     * @throws RecvException
     *             if the channel is empty and no sender remains
     */
    public Optional<T> tryPop() {
        Node n = core.tryPop();
        return n == null ? Optional.empty() : Optional.of(take(n));
    }
    
    /**
     * Returns the number of queued values.
     * 
     * @return the number of queued values
     */
    public int size() {
        return core.size();
    }
    
    /**
     * Returns the name of the channel.
     * 
     * @return the name of the channel
     */
    public String name() {
        return core.name();
    }
    
    /** Same as {@link ChannelCore#connectTx()}. */
    public void connectTx() {
        core.connectTx();
    }
    
    /** Same as {@link ChannelCore#connectRx()}. */
    public void connectRx() {
        core.connectRx();
    }
    
    /** Same as {@link ChannelCore#disconnectTx()}. */
    public void disconnectTx() {
        core.disconnectTx();
    }
    
    /** Same as {@link ChannelCore#disconnectRx()}. */
    public void disconnectRx() {
        core.disconnectRx();
    }
    
    @SuppressWarnings("unchecked")
    private T take(Node n) {
        var vn = (ValueNode<T>) n;
        T v = vn.value;
        vn.value = null;
        return v;
    }
    
    @Override
    public String toString() {
        return core.toString();
    }
    
    private static final class ValueNode<T> extends Node {
        T value;
        
        ValueNode(T value) {
            this.value = value;
        }
    }
}
