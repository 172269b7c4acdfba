package io.tedge.actors.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mailbox backed by a JCTools MPSC (Multi-Producer Single-Consumer) queue.
 * <p>
 * Sends never wait: producers only share a read lock, taken so that closing the
 * mailbox (write lock) cannot race with a message being enqueued.
 * The consumer parks on a condition only when the queue is empty.
 *
 * Recommended for:
 * - Control traffic that must not be held back by a full input queue
 * - Runtime-internal channels (task completions, runtime events)
 *
 * Trade-offs:
 * - No backpressure: a slow consumer lets the backlog grow without bound
 *
 * @param <T> The type of messages
 */
public class UnboundedMailbox<T> implements Mailbox<T> {

    private static final Logger logger = LoggerFactory.getLogger(UnboundedMailbox.class);
    private static final int DEFAULT_CHUNK_SIZE = 128;
    // Upper bound on a single park; the waiting flag is a hint, not a fence
    private static final long MAX_PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

    private final String name;
    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();
    private final ReentrantLock waitLock = new ReentrantLock();
    private final Condition notEmpty = waitLock.newCondition();
    private final AtomicInteger senders = new AtomicInteger();

    private volatile boolean closed = false;
    private volatile boolean hasWaitingConsumer = false;

    public UnboundedMailbox(String name) {
        this(name, DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates an unbounded mailbox.
     *
     * @param name the name used in logs and errors
     * @param chunkSize the size of the queue's internal array chunks, rounded up to a power of 2
     */
    public UnboundedMailbox(String name, int chunkSize) {
        this.name = Objects.requireNonNull(name, "Mailbox name cannot be null");
        // JCTools requires a chunk size of at least 2
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(Math.max(2, chunkSize)));
    }

    @Override
    public void send(T message) throws ChannelException {
        trySend(message);
    }

    @Override
    public void trySend(T message) throws ChannelException {
        Objects.requireNonNull(message, "Message cannot be null");
        closeLock.readLock().lock();
        try {
            if (closed) {
                throw ChannelException.closed(name);
            }
            queue.offer(message);
        } finally {
            closeLock.readLock().unlock();
        }
        signalNotEmpty();
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) throws ChannelException {
        trySend(message);
        return true;
    }

    @Override
    public Optional<T> receive() throws InterruptedException {
        T message = queue.poll();
        if (message != null) {
            return Optional.of(message);
        }
        waitLock.lockInterruptibly();
        try {
            hasWaitingConsumer = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return Optional.of(message);
                }
                if (closed) {
                    // A producer holding the read lock may have enqueued just before the close
                    return Optional.ofNullable(queue.poll());
                }
                notEmpty.awaitNanos(MAX_PARK_NANOS);
            }
        } finally {
            hasWaitingConsumer = false;
            waitLock.unlock();
        }
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = queue.poll();
        if (message != null || timeout <= 0) {
            return message;
        }
        long nanos = unit.toNanos(timeout);
        waitLock.lockInterruptibly();
        try {
            hasWaitingConsumer = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                if (closed) {
                    return queue.poll();
                }
                if (nanos <= 0) {
                    return null;
                }
                long park = Math.min(nanos, MAX_PARK_NANOS);
                long left = notEmpty.awaitNanos(park);
                nanos -= park - Math.max(0, left);
            }
        } finally {
            hasWaitingConsumer = false;
            waitLock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        int count = 0;
        while (count < maxElements) {
            T message = queue.poll();
            if (message == null) {
                break;
            }
            collection.add(message);
            count++;
        }
        return count;
    }

    @Override
    public void attachSender() throws ChannelException {
        closeLock.readLock().lock();
        try {
            if (closed) {
                throw ChannelException.closed(name);
            }
            senders.incrementAndGet();
        } finally {
            closeLock.readLock().unlock();
        }
    }

    @Override
    public void detachSender() {
        int previous = senders.getAndUpdate(count -> count > 0 ? count - 1 : 0);
        if (previous == 1) {
            logger.debug("Mailbox {} has no more senders, closing", name);
            close();
        }
    }

    @Override
    public void close() {
        closeLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            closeLock.writeLock().unlock();
        }
        logger.debug("Closed mailbox {} with {} pending messages", name, queue.size());
        waitLock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            waitLock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int capacity() {
        return Integer.MAX_VALUE;
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Signals the consumer that a message is available.
     * Only takes the lock if the consumer is actually waiting.
     */
    private void signalNotEmpty() {
        if (hasWaitingConsumer) {
            waitLock.lock();
            try {
                notEmpty.signal();
            } finally {
                waitLock.unlock();
            }
        }
    }

    private static int nextPowerOfTwo(int value) {
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }

    @Override
    public String toString() {
        return "UnboundedMailbox[" + name + "]";
    }
}
