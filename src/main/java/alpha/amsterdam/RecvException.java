package alpha.amsterdam;

/**
 * Thrown by {@link Receiver#pop()} and {@link Receiver#tryPop()} if the
 * channel is empty and no sender remains.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class RecvException extends ChannelException
{
    private static final long serialVersionUID = 1L;
    
    /**
     * Initializes this object.
     * 
     * @param channel name of channel
     */
    public RecvException(String channel) {
        super(channel, "No sender remains on " + channel + " and it is empty.");
    }
}
