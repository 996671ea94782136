package alpha.amsterdam.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Base class for immutable builders.<p>
 * 
 * Each builder instance links back to the builder it was derived from and
 * holds one modifier of a mutable state object. Building replays all modifiers,
 * oldest first, against a fresh state object. So any builder in the chain may
 * be shared and reused; deriving from it never affects it.
 * 
 * <pre>{@code
 *   final class MyBuilder extends AbstractImmutableBuilder<MyBuilder.State> {
 *       static final class State { int x = 1; }
 * 
 *       MyBuilder x(int newVal) {
 *           return new MyBuilder(this, s -> s.x = newVal);
 *       }
 * 
 *       My build() {
 *           return new My(constructState(State::new));
 *       }
 *   }
 * }</pre>
 * 
 * @param <S> type of mutable state
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public abstract class AbstractImmutableBuilder<S>
{
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs a root builder (no modifier).
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a builder derived from {@code prev}.
     * 
     * @param prev builder
     * @param modifier of state
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates a state object and applies all modifiers of the chain.
     * 
     * @param factory of state
     * 
     * @return the modified state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> chain = new ArrayDeque<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            chain.push(b.modifier);
        }
        final S s = factory.get();
        chain.forEach(m -> m.accept(s));
        return s;
    }
}
