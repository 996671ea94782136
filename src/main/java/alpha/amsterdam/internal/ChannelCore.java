package alpha.amsterdam.internal;

import alpha.amsterdam.RecvException;
import alpha.amsterdam.SendException;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;
import static java.util.Objects.requireNonNull;

/**
 * A FIFO queue of {@link Node}s shared by any number of senders and
 * receivers.<p>
 * 
 * The core is a singly-linked list guarded by one lock and one condition. The
 * same lock guards the live count of senders and receivers. Checking a count
 * and acting on the list is therefore always one atomic step; there is no
 * window between "the queue looks empty" and "the last sender just left".<p>
 * 
 * Both counts start at 1, matching the one sender and one receiver created
 * together with the channel. A count may only be incremented while it is
 * already positive (a handle is always copied from a live handle). Once a
 * count reaches zero, it stays zero.
 * 
 * <ul>
 *   <li>Sender count zero: {@link #pop()} and {@link #tryPop()} drain what is
 *       left, then fail with {@link RecvException}. All threads waiting in
 *       {@code pop()} are woken up.</li>
 *   <li>Receiver count zero: {@link #push(Node)} fails with {@link
 *       SendException}. Nodes still queued are unlinked, nobody can ever
 *       dequeue them.</li>
 * </ul>
 * 
 * This class is type-agnostic. {@link TypedChannel} puts a payload in the
 * nodes.<p>
 * 
 * This class is thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ChannelCore
{
    private static final System.Logger LOG
            = System.getLogger(ChannelCore.class.getPackageName());
    
    private final String name;
    private final ReentrantLock lock;
    private final Condition nonEmptyOrHungUp;
    private Node head, tail;
    private int size, txCount, rxCount;
    
    /**
     * Initializes this object.<p>
     * 
     * The new channel is empty and has one sender and one receiver.
     * 
     * @param name of channel (used for logging)
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public ChannelCore(String name) {
        this.name = requireNonNull(name);
        this.lock = new ReentrantLock();
        this.nonEmptyOrHungUp = lock.newCondition();
        this.txCount = 1;
        this.rxCount = 1;
    }
    
    /**
     * Returns the name of this channel.
     * 
     * @return the name of this channel
     */
    public String name() {
        return name;
    }
    
    /**
     * Appends a node to the tail of the queue.<p>
     * 
     * If this method returns exceptionally, the node was not consumed.
     * 
     * @param node to append
     * 
     * @throws NullPointerException if {@code node} is {@code null}
     * @throws SendException if no receiver remains
     */
    public void push(Node node) {
        requireNonNull(node);
        lock.lock();
        try {
            // Only the tail of a list has no successor
            assert node.next == null && node != tail : "Node is queued";
            if (rxCount == 0) {
                throw new SendException(name);
            }
            if (tail == null) {
                assert head == null;
                head = node;
            } else {
                tail.next = node;
            }
            tail = node;
            ++size;
            nonEmptyOrHungUp.signal();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Removes the head of the queue, if there is one.<p>
     * 
     * This method never blocks (other than on the lock).
     * 
     * @return the head, or {@code null} if the queue is empty
     *         but at least one sender remains
     * 
     * @throws RecvException
     *             if the queue is empty and no sender remains
     */
    public Node tryPop() {
        lock.lock();
        try {
            return dequeue();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Removes the head of the queue, waiting for one if necessary.<p>
     * 
     * The calling thread waits while the queue is empty and at least one
     * sender remains. The condition is re-checked after every wakeup.
     * 
     * @return the head (never {@code null})
     * 
     * @throws RecvException
     *             if the queue is empty and no sender remains
     * @throws InterruptedException
     *             if the current thread is interrupted while waiting
     *             (nothing was dequeued)
     */
    public Node pop() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (head == null && txCount > 0) {
                nonEmptyOrHungUp.await();
            }
            Node n = dequeue();
            assert n != null;
            return n;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Returns the number of queued nodes.
     * 
     * @return the number of queued nodes
     */
    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Increments the sender count.<p>
     * 
     * Must only be called on behalf of a new sender copied from a live one.
     */
    public void connectTx() {
        lock.lock();
        try {
            assert txCount > 0 : "Senders already hung up";
            ++txCount;
            LOG.log(TRACE, () -> name + " senders: " + txCount);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Increments the receiver count.<p>
     * 
     * Must only be called on behalf of a new receiver copied from a live one.
     */
    public void connectRx() {
        lock.lock();
        try {
            assert rxCount > 0 : "Receivers already hung up";
            ++rxCount;
            LOG.log(TRACE, () -> name + " receivers: " + rxCount);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Decrements the sender count.<p>
     * 
     * If the count reaches zero, all threads waiting in {@link #pop()} are
     * woken up.
     */
    public void disconnectTx() {
        lock.lock();
        try {
            assert txCount > 0 : "Senders already hung up";
            if (--txCount == 0) {
                LOG.log(DEBUG, () -> "All senders hung up on " + name + ".");
                nonEmptyOrHungUp.signalAll();
            } else {
                LOG.log(TRACE, () -> name + " senders: " + txCount);
            }
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Decrements the receiver count.<p>
     * 
     * If the count reaches zero, all queued nodes are discarded.
     */
    public void disconnectRx() {
        lock.lock();
        try {
            assert rxCount > 0 : "Receivers already hung up";
            if (--rxCount == 0) {
                LOG.log(DEBUG, () -> "All receivers hung up on " + name + ".");
                discardAll();
            } else {
                LOG.log(TRACE, () -> name + " receivers: " + rxCount);
            }
        } finally {
            lock.unlock();
        }
    }
    
    private Node dequeue() {
        assert lock.isHeldByCurrentThread();
        final Node n = head;
        if (n == null) {
            assert tail == null;
            if (txCount == 0) {
                throw new RecvException(name);
            }
            return null;
        }
        head = n.next;
        if (head == null) {
            tail = null;
        }
        n.next = null;
        --size;
        return n;
    }
    
    // Iterative, a long queue must not become a deep chain of anything
    private void discardAll() {
        assert lock.isHeldByCurrentThread();
        final int n = size;
        Node curr = head;
        while (curr != null) {
            Node next = curr.next;
            curr.next = null;
            curr = next;
        }
        head = tail = null;
        size = 0;
        if (n > 0) {
            LOG.log(DEBUG, () -> "Discarded " + n + " undelivered item(s) on " + name + ".");
        }
    }
    
    @Override
    public String toString() {
        return name;
    }
}
