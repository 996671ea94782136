package alpha.amsterdam;

/**
 * Thrown when a channel operation can never succeed because all peers on the
 * other side of the channel have hung up.<p>
 * 
 * The condition is permanent for the channel instance. Retrying the operation
 * will fail the same way.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see SendException
 * @see RecvException
 */
public abstract class ChannelException extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    
    private final String channel;
    
    /**
     * Initializes this object.
     * 
     * @param channel name of channel
     * @param message detail message
     */
    protected ChannelException(String channel, String message) {
        super(message);
        this.channel = channel;
    }
    
    /**
     * Returns the name of the channel that has hung up.
     * 
     * @return the name of the channel that has hung up
     */
    public final String channel() {
        return channel;
    }
}
