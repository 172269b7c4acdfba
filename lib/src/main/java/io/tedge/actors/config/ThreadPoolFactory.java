package io.tedge.actors.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the thread pools running actors.
 *
 * <p>Every running actor occupies a thread until it returns, so the pool must be able to run all
 * actors at once. The default cached pool grows as needed. A fixed pool smaller than the number of
 * actors leaves some of them waiting for a thread forever.
 */
public class ThreadPoolFactory {
    private static final int DEFAULT_FIXED_POOL_SIZE = Math.max(4, Runtime.getRuntime().availableProcessors());

    private ThreadPoolType executorType = ThreadPoolType.CACHED;
    private int fixedPoolSize = DEFAULT_FIXED_POOL_SIZE;
    private int workStealingParallelism = Runtime.getRuntime().availableProcessors();
    private boolean useNamedThreads = true;
    private boolean daemonThreads = true;

    /**
     * Enum defining the types of thread pools that can be used.
     */
    public enum ThreadPoolType {
        /**
         * Creates threads on demand and reuses idle ones. Suits any number of actors.
         */
        CACHED,

        /**
         * Uses a fixed number of threads. The size must cover every actor spawned.
         */
        FIXED,

        /**
         * Uses a work-stealing pool. Its parallelism must cover every actor spawned.
         */
        WORK_STEALING
    }

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
    }

    /**
     * Creates an executor service based on the current configuration.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new executor service
     */
    public ExecutorService createExecutorService(String poolName) {
        switch (executorType) {
            case CACHED:
                return useNamedThreads
                        ? Executors.newCachedThreadPool(createNamedThreadFactory(poolName))
                        : Executors.newCachedThreadPool();
            case FIXED:
                return useNamedThreads
                        ? Executors.newFixedThreadPool(fixedPoolSize, createNamedThreadFactory(poolName))
                        : Executors.newFixedThreadPool(fixedPoolSize);
            case WORK_STEALING:
                return Executors.newWorkStealingPool(workStealingParallelism);
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    /**
     * Creates a fixed pool of {@code size} named threads, independent of the configured type.
     *
     * @param poolName Name prefix for the threads in this pool
     * @param size number of threads
     * @return A new executor service
     */
    public ExecutorService createFixedExecutorService(String poolName, int size) {
        return Executors.newFixedThreadPool(size, createNamedThreadFactory(poolName));
    }

    /**
     * Creates a cached pool of named threads, independent of the configured type.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new executor service
     */
    public ExecutorService createCachedExecutorService(String poolName) {
        return Executors.newCachedThreadPool(createNamedThreadFactory(poolName));
    }

    /**
     * Creates a named thread factory for better thread identification in logs and profilers.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory that creates threads named {@code prefix-n}
     */
    public ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
                thread.setDaemon(daemonThreads);
                return thread;
            }
        };
    }

    // Getters and setters

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        this.executorType = executorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        if (fixedPoolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + fixedPoolSize);
        }
        this.fixedPoolSize = fixedPoolSize;
        return this;
    }

    public int getWorkStealingParallelism() {
        return workStealingParallelism;
    }

    public ThreadPoolFactory setWorkStealingParallelism(int workStealingParallelism) {
        this.workStealingParallelism = workStealingParallelism;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }
}
