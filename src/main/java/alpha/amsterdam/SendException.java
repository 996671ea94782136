package alpha.amsterdam;

/**
 * Thrown by {@link Sender#push(Object)} if no receiver remains.<p>
 * 
 * The value was not enqueued.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class SendException extends ChannelException
{
    private static final long serialVersionUID = 1L;
    
    /**
     * Initializes this object.
     * 
     * @param channel name of channel
     */
    public SendException(String channel) {
        super(channel, "No receiver remains on " + channel + ".");
    }
}
