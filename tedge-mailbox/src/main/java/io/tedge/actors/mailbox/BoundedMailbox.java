package io.tedge.actors.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default mailbox implementation: a fixed-capacity FIFO guarded by a single lock.
 * <p>
 * A producer sending to a full mailbox waits until the consumer takes a message,
 * which is how backpressure propagates from a slow actor to its peers.
 * Messages from one producer are delivered in the order they were sent.
 *
 * Recommended for:
 * - Regular actor inputs
 * - Any channel where an unbounded backlog would hide a stuck consumer
 *
 * @param <T> The type of messages
 */
public class BoundedMailbox<T> implements Mailbox<T> {

    private static final Logger logger = LoggerFactory.getLogger(BoundedMailbox.class);

    private final String name;
    private final int capacity;
    private final ArrayDeque<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed = false;
    private int senders = 0;

    /**
     * Creates a bounded mailbox.
     *
     * @param name the name used in logs and errors, usually the owning actor's name
     * @param capacity the maximum number of queued messages, at least 1
     */
    public BoundedMailbox(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Mailbox capacity must be at least 1, got " + capacity);
        }
        this.name = Objects.requireNonNull(name, "Mailbox name cannot be null");
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
    }

    @Override
    public void send(T message) throws ChannelException, InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lockInterruptibly();
        try {
            while (!closed && queue.size() >= capacity) {
                notFull.await();
            }
            enqueue(message);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void trySend(T message) throws ChannelException {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lock();
        try {
            if (!closed && queue.size() >= capacity) {
                throw ChannelException.full(name);
            }
            enqueue(message);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) throws ChannelException, InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!closed && queue.size() >= capacity) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            enqueue(message);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // Must hold the lock
    private void enqueue(T message) throws ChannelException {
        if (closed) {
            throw ChannelException.closed(name);
        }
        queue.addLast(message);
        notEmpty.signal();
    }

    @Override
    public Optional<T> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed) {
                notEmpty.await();
            }
            return Optional.ofNullable(dequeue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    // Must hold the lock
    private T dequeue() {
        T message = queue.pollFirst();
        if (message != null) {
            notFull.signal();
        }
        return message;
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        lock.lock();
        try {
            int count = 0;
            while (count < maxElements && !queue.isEmpty()) {
                collection.add(queue.pollFirst());
                count++;
            }
            if (count > 0) {
                notFull.signalAll();
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void attachSender() throws ChannelException {
        lock.lock();
        try {
            if (closed) {
                throw ChannelException.closed(name);
            }
            senders++;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void detachSender() {
        lock.lock();
        try {
            if (senders > 0) {
                senders--;
                if (senders == 0 && !closed) {
                    logger.debug("Mailbox {} has no more senders, closing", name);
                    closeLocked();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (!closed) {
                logger.debug("Closing mailbox {} with {} pending messages", name, queue.size());
                closeLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    // Must hold the lock
    private void closeLocked() {
        closed = true;
        notEmpty.signalAll();
        notFull.signalAll();
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "BoundedMailbox[" + name + ", capacity=" + capacity + "]";
    }
}
