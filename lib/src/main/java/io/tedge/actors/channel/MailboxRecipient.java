package io.tedge.actors.channel;

import io.tedge.actors.mailbox.ChannelException;
import io.tedge.actors.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recipient writing directly into a {@link Mailbox}.
 *
 * <p>A counted handle is registered as a sender of the mailbox and keeps it open until closed. A
 * control handle, see {@link #control(Mailbox, Class)}, reaches the mailbox while it is open but
 * does not keep it open: the runtime uses it to deliver shutdown requests without preventing an
 * actor from observing end-of-stream when its real producers are gone.
 *
 * <p>Closing a handle does not wait for sends in progress through it: a send that started before
 * {@link #close()}, possibly blocked on a full mailbox, may still be delivered. Every send
 * starting after {@code close()} returns fails with {@link ChannelException.Reason#CLOSED}.
 *
 * @param <M> the type of messages accepted
 */
public final class MailboxRecipient<M> implements Recipient<M> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxRecipient.class);

    private final Mailbox<M> mailbox;
    private final Class<?> type;
    private final boolean counted;
    private final AtomicBoolean closed;

    private MailboxRecipient(Mailbox<M> mailbox, Class<?> type, boolean counted, boolean closed) {
        this.mailbox = mailbox;
        this.type = type;
        this.counted = counted;
        this.closed = new AtomicBoolean(closed);
    }

    /**
     * Registers a new sender on the mailbox.
     *
     * @param mailbox the target mailbox
     * @param type the accepted message type
     * @param <M> the accepted message type
     * @return a counted handle, already closed if the mailbox is
     */
    public static <M> MailboxRecipient<M> of(Mailbox<M> mailbox, Class<?> type) {
        try {
            mailbox.attachSender();
            return new MailboxRecipient<>(mailbox, type, true, false);
        } catch (ChannelException e) {
            logger.debug("Mailbox {} is closed, returning a closed sender", mailbox.name());
            return new MailboxRecipient<>(mailbox, type, true, true);
        }
    }

    /**
     * Creates a handle that does not take part in sender accounting.
     *
     * @param mailbox the target mailbox
     * @param type the accepted message type
     * @param <M> the accepted message type
     * @return a control handle
     */
    public static <M> MailboxRecipient<M> control(Mailbox<M> mailbox, Class<?> type) {
        return new MailboxRecipient<>(mailbox, type, false, false);
    }

    @Override
    public void send(M message) throws ChannelException, InterruptedException {
        ensureOpen();
        mailbox.send(message);
    }

    @Override
    public void trySend(M message) throws ChannelException {
        ensureOpen();
        mailbox.trySend(message);
    }

    private void ensureOpen() throws ChannelException {
        if (closed.get()) {
            throw ChannelException.closed(mailbox.name());
        }
    }

    @Override
    public MailboxRecipient<M> clone() {
        if (!counted) {
            return new MailboxRecipient<>(mailbox, type, false, closed.get());
        }
        if (closed.get()) {
            return new MailboxRecipient<>(mailbox, type, true, true);
        }
        return of(mailbox, type);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && counted) {
            mailbox.detachSender();
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get() || mailbox.isClosed();
    }

    @Override
    public Class<?> messageType() {
        return type;
    }

    @Override
    public String toString() {
        return "MailboxRecipient{" + mailbox.name() + (counted ? "" : ", control") + "}";
    }
}
