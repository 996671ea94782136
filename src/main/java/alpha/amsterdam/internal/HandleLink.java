package alpha.amsterdam.internal;

import java.lang.ref.Cleaner;

import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * The connection of one sender or receiver to its channel.<p>
 * 
 * A link is closed exactly once; explicitly through {@link #close()}, or by a
 * cleaner thread after the handle it was registered for became phantom
 * reachable. Either way, the given disconnect action runs at most once. A link
 * closed by the cleaner is logged as a warning, the handle leaked.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HandleLink
{
    private static final System.Logger LOG
            = System.getLogger(HandleLink.class.getPackageName());
    
    private static final Cleaner CLEANER = Cleaner.create(r -> {
            Thread t = new Thread(r);
            t.setName("Channel handle cleaner");
            t.setDaemon(true);
            return t; });
    
    /**
     * Registers a disconnect action for the given handle.
     * 
     * @param handle to monitor (must not be captured by {@code disconnect})
     * @param description of handle (for logging)
     * @param disconnect action
     * 
     * @return a link
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static HandleLink register(
            Object handle, String description, Runnable disconnect) {
        var act = new Disconnect(requireNonNull(description), requireNonNull(disconnect));
        return new HandleLink(act, CLEANER.register(handle, act));
    }
    
    private final Disconnect action;
    private final Cleaner.Cleanable cleanable;
    
    private HandleLink(Disconnect action, Cleaner.Cleanable cleanable) {
        this.action = action;
        this.cleanable = cleanable;
    }
    
    /**
     * Runs the disconnect action, unless it has already run.
     */
    public void close() {
        action.explicit = true;
        cleanable.clean();
    }
    
    private static final class Disconnect implements Runnable {
        private final String description;
        private final Runnable delegate;
        volatile boolean explicit;
        
        Disconnect(String description, Runnable delegate) {
            this.description = description;
            this.delegate = delegate;
        }
        
        @Override
        public void run() {
            if (!explicit) {
                LOG.log(WARNING, () ->
                        description + " was never closed, disconnecting.");
            }
            delegate.run();
        }
    }
}
