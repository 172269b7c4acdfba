package io.tedge.actors.mailbox.config;

import io.tedge.actors.mailbox.Mailbox;

/**
 * Creates actor mailboxes.
 * Implementations decide which {@link Mailbox} implementation backs a given configuration.
 *
 * @param <M> The type of messages the mailbox will hold.
 */
@FunctionalInterface
public interface MailboxProvider<M> {

    /**
     * Creates a mailbox for the named actor.
     *
     * @param name the name of the owning actor
     * @param config the mailbox configuration, or null for defaults
     * @return a new, open mailbox with no sender attached
     */
    Mailbox<M> createMailbox(String name, MailboxConfig config);
}
