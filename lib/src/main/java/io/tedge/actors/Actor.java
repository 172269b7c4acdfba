package io.tedge.actors;

import io.tedge.actors.mailbox.ChannelException;

/**
 * A sequential unit of computation that owns its message box.
 *
 * <p>An actor is produced by an {@link io.tedge.actors.builder.ActorBuilder} once all its links
 * are established, then run exactly once on a runtime thread. It consumes messages from its input
 * mailbox, sends to the peers it was linked to, and returns when its input reaches end-of-stream or
 * after observing {@link RuntimeRequest#SHUTDOWN}.
 *
 * <p>{@code run()} may throw:
 * <ul>
 *   <li>{@link ActorException} for domain failures,</li>
 *   <li>{@link ChannelException} when a peer went away; during shutdown this counts as a normal
 *   stop, otherwise as a failure,</li>
 *   <li>{@link InterruptedException} when the runtime thread is interrupted.</li>
 * </ul>
 */
public interface Actor {

    /**
     * @return a human readable name used in logs and runtime events
     */
    String name();

    /**
     * Processes messages until end-of-stream or shutdown.
     *
     * @throws ChannelException if a channel the actor depends on is closed
     * @throws InterruptedException if the thread is interrupted while blocked
     */
    void run() throws ChannelException, InterruptedException;
}
