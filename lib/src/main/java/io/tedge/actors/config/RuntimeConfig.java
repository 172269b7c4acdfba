package io.tedge.actors.config;

import io.tedge.actors.RuntimeEvent;
import io.tedge.actors.channel.NullRecipient;
import io.tedge.actors.channel.Recipient;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a {@link io.tedge.actors.Runtime}.
 */
public class RuntimeConfig {
    /** How long the runtime waits for actors to stop once a shutdown has been requested. */
    public static final Duration DEFAULT_CLEANUP_TIMEOUT = Duration.ofSeconds(60);

    private String name = "tedge-runtime";
    private Duration cleanupTimeout = DEFAULT_CLEANUP_TIMEOUT;
    private ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();
    private SupervisionStrategy supervisionStrategy = SupervisionStrategy.SHUTDOWN_ALL;
    private Recipient<RuntimeEvent> eventsRecipient = new NullRecipient<>();

    public RuntimeConfig() {
    }

    public String getName() {
        return name;
    }

    /**
     * @param name prefix of the runtime thread names
     * @return this config
     */
    public RuntimeConfig setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
        return this;
    }

    public Duration getCleanupTimeout() {
        return cleanupTimeout;
    }

    public RuntimeConfig setCleanupTimeout(Duration cleanupTimeout) {
        if (cleanupTimeout.isNegative()) {
            throw new IllegalArgumentException("Cleanup timeout cannot be negative: " + cleanupTimeout);
        }
        this.cleanupTimeout = cleanupTimeout;
        return this;
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    public RuntimeConfig setThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory");
        return this;
    }

    public SupervisionStrategy getSupervisionStrategy() {
        return supervisionStrategy;
    }

    public RuntimeConfig setSupervisionStrategy(SupervisionStrategy supervisionStrategy) {
        this.supervisionStrategy = Objects.requireNonNull(supervisionStrategy, "supervisionStrategy");
        return this;
    }

    public Recipient<RuntimeEvent> getEventsRecipient() {
        return eventsRecipient;
    }

    /**
     * @param eventsRecipient where {@link RuntimeEvent}s are published; the runtime closes it on
     *                        completion
     * @return this config
     */
    public RuntimeConfig setEventsRecipient(Recipient<RuntimeEvent> eventsRecipient) {
        this.eventsRecipient = Objects.requireNonNull(eventsRecipient, "eventsRecipient");
        return this;
    }
}
