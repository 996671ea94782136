/**
 * Multi-producer, multi-consumer channels.<p>
 * 
 * <strong>Architectural Overview</strong>. {@link alpha.amsterdam.Channels
 * Channels} creates a channel and returns its first {@link
 * alpha.amsterdam.Sender Sender} and {@link alpha.amsterdam.Receiver Receiver}.
 * The handles may be copied, for example one copy per thread, and each copy
 * must eventually be closed. A channel knows how many handles of each kind are
 * open and uses this knowledge to detect a hang-up; an operation that can never
 * succeed fails with a {@link alpha.amsterdam.ChannelException
 * ChannelException}.<p>
 * 
 * <strong>Examples</strong>. See package {@link alpha.amsterdam.examples}.
 */
package alpha.amsterdam;
