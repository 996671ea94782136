package alpha.amsterdam.internal;

/**
 * A link in the intrusive list of a {@link ChannelCore}.<p>
 * 
 * The core knows nothing about what a node carries. Subclasses add the
 * payload. A node is owned by at most one list at a time and must not be
 * re-pushed after it has been dequeued.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public abstract class Node
{
    // Guarded by the lock of the channel whose list this node is in
    Node next;
    
    /**
     * Initializes this object.
     */
    protected Node() {
        // Empty
    }
}
