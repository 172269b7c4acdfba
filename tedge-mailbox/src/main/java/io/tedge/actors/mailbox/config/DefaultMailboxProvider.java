package io.tedge.actors.mailbox.config;

import io.tedge.actors.mailbox.BoundedMailbox;
import io.tedge.actors.mailbox.Mailbox;
import io.tedge.actors.mailbox.UnboundedMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default mailbox provider:
 * a {@link BoundedMailbox} for a positive capacity, an {@link UnboundedMailbox} otherwise.
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    @Override
    public Mailbox<M> createMailbox(String name, MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        logger.debug("Creating mailbox for {} with {}", name, effectiveConfig);

        if (effectiveConfig.isBounded()) {
            return new BoundedMailbox<>(name, effectiveConfig.getCapacity());
        }
        return new UnboundedMailbox<>(name, effectiveConfig.getChunkSize());
    }
}
