package alpha.amsterdam.examples;

import alpha.amsterdam.Channels;
import alpha.amsterdam.Receiver;
import alpha.amsterdam.RecvException;
import alpha.amsterdam.Sender;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

/**
 * A few producer threads send messages to many consumer threads over one
 * channel.<p>
 * 
 * Each thread gets its own copy of the channel's sender or receiver. A
 * producer closes its sender when it is done, and when the last one has done
 * so, consumers drain what is left and then observe a {@link RecvException},
 * which is their cue to stop.<p>
 * 
 * Arguments, all optional: {@code [producers] [consumers] [messagesPerProducer]}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class ProducersAndConsumers
{
    private static final System.Logger LOG
            = System.getLogger(ProducersAndConsumers.class.getPackageName());
    
    /**
     * Application entry point.
     * 
     * @param args see class JavaDoc
     * 
     * @throws NumberFormatException
     *             if an argument is not an integer
     * @throws IllegalArgumentException
     *             if an argument is out of range
     * @throws InterruptedException
     *             if interrupted while waiting on the threads
     */
    public static void main(String... args) throws InterruptedException {
        var b = Settings.DEFAULT.toBuilder();
        if (args.length > 0) {
            b = b.producers(Integer.parseInt(args[0]));
        }
        if (args.length > 1) {
            b = b.consumers(Integer.parseInt(args[1]));
        }
        if (args.length > 2) {
            b = b.messagesPerProducer(Integer.parseInt(args[2]));
        }
        
        Map<String, List<String>> tally = run(b.build());
        
        tally.forEach((consumer, messages) ->
                System.out.println(consumer + " consumed " + messages.size() + ": " + messages));
    }
    
    /**
     * Runs producers and consumers until all messages have been consumed.<p>
     * 
     * Messages have the format "{@code <producer id>: <index>}".
     * 
     * @param settings to use
     * 
     * @return messages consumed, keyed by consumer thread name
     * 
     * @throws InterruptedException
     *             if interrupted while waiting on the threads
     */
    public static Map<String, List<String>> run(Settings settings)
            throws InterruptedException
    {
        LOG.log(INFO, () -> "Running with " + settings);
        
        Map<String, List<String>> tally = new ConcurrentHashMap<>();
        List<Thread> threads = new ArrayList<>();
        int tid = 0;
        
        Channels.Pair<String> ch = Channels.open("messages");
        try (Sender<String> tx = ch.sender();
             Receiver<String> rx = ch.receiver())
        {
            for (int i = 0; i < settings.producers(); ++i) {
                final int id = tid++;
                final Sender<String> mine = tx.copy();
                threads.add(start("producer-" + id, () -> produce(id, mine, settings)));
            }
            for (int i = 0; i < settings.consumers(); ++i) {
                final Receiver<String> mine = rx.copy();
                final List<String> consumed = new ArrayList<>();
                Thread t = start("consumer-" + tid++, () -> consume(mine, consumed));
                tally.put(t.getName(), consumed);
                threads.add(t);
            }
        }
        // Only the copies remain
        
        for (Thread t : threads) {
            t.join();
        }
        
        LOG.log(INFO, "All threads done.");
        return new TreeMap<>(tally);
    }
    
    private static Thread start(String name, Runnable task) {
        Thread t = new Thread(task, name);
        t.start();
        return t;
    }
    
    private static void produce(int id, Sender<String> tx, Settings settings) {
        try (tx) {
            for (int i = 0; i < settings.messagesPerProducer(); ++i) {
                Thread.sleep(settings.produceInterval().toMillis());
                String msg = id + ": " + i;
                LOG.log(INFO, () -> "Produced '" + msg + "'.");
                tx.push(msg);
            }
        } catch (InterruptedException e) {
            LOG.log(WARNING, "Interrupted, stop producing.");
            Thread.currentThread().interrupt();
        }
    }
    
    private static void consume(Receiver<String> rx, List<String> consumed) {
        try (rx) {
            for (;;) {
                String msg = rx.pop();
                consumed.add(msg);
                LOG.log(INFO, () -> "Consumed '" + msg + "'.");
            }
        } catch (RecvException e) {
            LOG.log(DEBUG, "Producers are gone, stop consuming.");
        } catch (InterruptedException e) {
            LOG.log(WARNING, "Interrupted, stop consuming.");
            Thread.currentThread().interrupt();
        }
    }
}
