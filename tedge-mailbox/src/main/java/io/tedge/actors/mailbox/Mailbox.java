package io.tedge.actors.mailbox;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * The receiving end of an actor's inbound channel.
 * <p>
 * A mailbox has many producers and exactly one consumer. Producers are accounted for with
 * {@link #attachSender()} / {@link #detachSender()}: once every attached sender has detached,
 * the mailbox closes itself. The owning actor may also close it explicitly with {@link #close()}.
 * Messages already queued when a mailbox closes are still delivered; afterwards
 * {@link #receive()} returns end-of-stream instead of waiting forever.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the message, waiting while the mailbox is full.
     *
     * @param message the message to add
     * @throws ChannelException with reason CLOSED if the mailbox is or becomes closed
     * @throws InterruptedException if interrupted while waiting
     */
    void send(T message) throws ChannelException, InterruptedException;

    /**
     * Inserts the message only if this can be done immediately.
     *
     * @param message the message to add
     * @throws ChannelException with reason FULL if there is no room, CLOSED if closed
     */
    void trySend(T message) throws ChannelException;

    /**
     * Inserts the message, waiting up to the given time for room to become available.
     *
     * @param message the message to add
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return true if the message was added, false if the timeout elapsed
     * @throws ChannelException with reason CLOSED if the mailbox is or becomes closed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean offer(T message, long timeout, TimeUnit unit) throws ChannelException, InterruptedException;

    /**
     * Retrieves the next message, waiting while the mailbox is empty and open.
     *
     * @return the next message, or empty once the mailbox is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> receive() throws InterruptedException;

    /**
     * Retrieves the next message, waiting up to the given time.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the next message, or null if none arrived in time or the mailbox is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Removes up to maxElements queued messages without waiting.
     *
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * Registers one more producer handle.
     *
     * @throws ChannelException with reason CLOSED if the mailbox is already closed
     */
    void attachSender() throws ChannelException;

    /**
     * Releases one producer handle; the last release closes the mailbox.
     */
    void detachSender();

    /**
     * Closes the mailbox for sending. Queued messages remain receivable.
     */
    void close();

    boolean isClosed();

    int size();

    boolean isEmpty();

    /**
     * Returns the number of messages this mailbox can hold, or Integer.MAX_VALUE if unbounded.
     */
    int capacity();

    /**
     * Returns the number of additional messages this mailbox can accept
     * without blocking, or Integer.MAX_VALUE if unbounded.
     */
    default int remainingCapacity() {
        int capacity = capacity();
        if (capacity == Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return Math.max(0, capacity - size());
    }

    /**
     * Name used in logs and error messages.
     */
    String name();
}
