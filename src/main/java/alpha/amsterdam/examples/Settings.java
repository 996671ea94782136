package alpha.amsterdam.examples;

import alpha.amsterdam.util.AbstractImmutableBuilder;

import java.time.Duration;
import java.util.function.Consumer;

import static java.time.Duration.ofMillis;
import static java.util.Objects.requireNonNull;

/**
 * Settings of {@link ProducersAndConsumers}.<p>
 * 
 * Instances are immutable. Use {@link #DEFAULT}{@code .toBuilder()} to derive
 * new settings.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Settings
{
    /**
     * Four producers, sixteen consumers, eight messages per producer and 100
     * milliseconds between messages.
     */
    public static final Settings DEFAULT = Builder.ROOT.build();
    
    private final Builder  builder;
    private final int      producers,
                           consumers,
                           messagesPerProducer;
    private final Duration produceInterval;
    
    private Settings(Builder b, Builder.MutableState s) {
        builder             = b;
        producers           = s.producers;
        consumers           = s.consumers;
        messagesPerProducer = s.messagesPerProducer;
        produceInterval     = s.produceInterval;
    }
    
    /**
     * Returns the number of producer threads.
     * 
     * @return the number of producer threads
     */
    public int producers() {
        return producers;
    }
    
    /**
     * Returns the number of consumer threads.
     * 
     * @return the number of consumer threads
     */
    public int consumers() {
        return consumers;
    }
    
    /**
     * Returns the number of messages each producer sends.
     * 
     * @return the number of messages each producer sends
     */
    public int messagesPerProducer() {
        return messagesPerProducer;
    }
    
    /**
     * Returns how long a producer sleeps before each message.
     * 
     * @return how long a producer sleeps before each message
     */
    public Duration produceInterval() {
        return produceInterval;
    }
    
    /**
     * Returns the builder that built this object.
     * 
     * @return the builder that built this object
     */
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return "Settings{producers=" + producers +
               ", consumers=" + consumers +
               ", messagesPerProducer=" + messagesPerProducer +
               ", produceInterval=" + produceInterval + "}";
    }
    
    /**
     * Builder of {@link Settings}.
     */
    public static final class Builder
            extends AbstractImmutableBuilder<Builder.MutableState>
    {
        static final Builder ROOT = new Builder();
        
        static final class MutableState {
            int      producers           = 4,
                     consumers           = 16,
                     messagesPerProducer = 8;
            Duration produceInterval     = ofMillis(100);
        }
        
        private Builder() {
            // super()
        }
        
        private Builder(Builder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        /**
         * Sets the number of producer threads.
         * 
         * @param newVal new value
         * @return a new builder
         */
        public Builder producers(int newVal) {
            return new Builder(this, s -> s.producers = newVal);
        }
        
        /**
         * Sets the number of consumer threads.
         * 
         * @param newVal new value
         * @return a new builder
         */
        public Builder consumers(int newVal) {
            return new Builder(this, s -> s.consumers = newVal);
        }
        
        /**
         * Sets the number of messages each producer sends.
         * 
         * @param newVal new value
         * @return a new builder
         */
        public Builder messagesPerProducer(int newVal) {
            return new Builder(this, s -> s.messagesPerProducer = newVal);
        }
        
        /**
         * Sets how long a producer sleeps before each message.
         * 
         * @param newVal new value
         * @return a new builder
         * @throws NullPointerException if {@code newVal} is {@code null}
         */
        public Builder produceInterval(Duration newVal) {
            requireNonNull(newVal);
            return new Builder(this, s -> s.produceInterval = newVal);
        }
        
        /**
         * Builds settings.
         * 
         * @return new settings
         * 
         * @throws IllegalArgumentException
         *             if there is not at least one producer and consumer,
         *             the message count is negative,
         *             or the interval is negative
         */
        public Settings build() {
            var s = constructState(MutableState::new);
            if (s.producers < 1 || s.consumers < 1) {
                throw new IllegalArgumentException(
                        "Need at least one producer and consumer.");
            }
            if (s.messagesPerProducer < 0) {
                throw new IllegalArgumentException(
                        "Negative message count: " + s.messagesPerProducer);
            }
            if (s.produceInterval.isNegative()) {
                throw new IllegalArgumentException(
                        "Negative interval: " + s.produceInterval);
            }
            return new Settings(this, s);
        }
    }
}
