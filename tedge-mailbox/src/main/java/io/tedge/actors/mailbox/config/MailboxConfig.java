package io.tedge.actors.mailbox.config;

/**
 * Configuration for creating a mailbox.
 * A capacity of zero or less asks for an unbounded mailbox.
 */
public class MailboxConfig {

    public static final int DEFAULT_CAPACITY = 16;

    private int capacity = DEFAULT_CAPACITY;
    private int chunkSize = 128;

    public MailboxConfig() {
    }

    public MailboxConfig(int capacity) {
        this.capacity = capacity;
    }

    public static MailboxConfig bounded(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("A bounded mailbox needs a capacity of at least 1, got " + capacity);
        }
        return new MailboxConfig(capacity);
    }

    public static MailboxConfig unbounded() {
        return new MailboxConfig(0);
    }

    public int getCapacity() {
        return capacity;
    }

    public MailboxConfig setCapacity(int capacity) {
        this.capacity = capacity;
        return this;
    }

    /**
     * Chunk size of the queue backing an unbounded mailbox; ignored for bounded ones.
     */
    public int getChunkSize() {
        return chunkSize;
    }

    public MailboxConfig setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
        return this;
    }

    public boolean isBounded() {
        return capacity > 0;
    }

    @Override
    public String toString() {
        return isBounded() ? "MailboxConfig{capacity=" + capacity + "}" : "MailboxConfig{unbounded}";
    }
}
