package io.tedge.actors.test;

import io.tedge.actors.ActorException;
import io.tedge.actors.Runtime;
import io.tedge.actors.builder.ActorBuilder;
import io.tedge.actors.builder.PeerLinker;
import io.tedge.actors.config.RuntimeConfig;
import io.tedge.actors.config.ThreadPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Main entry point for testing actors.
 * Runs a {@link Runtime} in the background and creates probes and test boxes to link to the
 * actors under test.
 *
 * <p>Usage:
 * <pre>{@code
 * try (TestKit testKit = TestKit.create()) {
 *     ConvertingActorBuilder<String, String> upper = ConvertingActorBuilder.of("Upper", converter, String.class, String.class);
 *     TestBox<String, String> client = testKit.connect("client", upper, String.class, String.class);
 *     testKit.spawn(upper);
 *
 *     client.send("hello");
 *     client.assertReceived("HELLO");
 * }
 * }</pre>
 */
public class TestKit implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TestKit.class);

    private final Runtime runtime;
    private final ExecutorService runner;
    private Duration defaultTimeout;
    private Future<?> completion;

    private TestKit(Runtime runtime, Duration defaultTimeout) {
        this.runtime = runtime;
        this.defaultTimeout = defaultTimeout;
        this.runner = new ThreadPoolFactory().createFixedExecutorService("testkit", 1);
    }

    /**
     * Creates a new TestKit with its own runtime.
     */
    public static TestKit create() {
        return create(new RuntimeConfig().setCleanupTimeout(Duration.ofSeconds(5)));
    }

    /**
     * Creates a new TestKit with a runtime built from the given configuration.
     *
     * @param config the runtime configuration
     */
    public static TestKit create(RuntimeConfig config) {
        return new TestKit(new Runtime(config), Duration.ofSeconds(5));
    }

    /**
     * Gets the underlying runtime.
     *
     * @return the Runtime used by this TestKit
     */
    public Runtime runtime() {
        return runtime;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Sets the default timeout used by test boxes and by {@link #awaitCompletion()}.
     *
     * @param timeout the new default timeout
     * @return this TestKit for chaining
     */
    public TestKit withDefaultTimeout(Duration timeout) {
        this.defaultTimeout = timeout;
        return this;
    }

    /**
     * Spawns actors; the runtime starts with the first call.
     *
     * @param builders the actors to spawn
     * @return this TestKit for chaining
     */
    public synchronized TestKit spawn(ActorBuilder... builders) {
        runtime.spawnAll(builders);
        if (completion == null) {
            completion = runner.submit(() -> {
                runtime.runToCompletion();
                return null;
            });
        }
        return this;
    }

    /**
     * Creates a test probe for capturing and asserting on messages.
     *
     * @param name the probe name
     * @param type the captured message type
     * @param <T> the message type
     * @return a new TestProbe
     */
    public <T> TestProbe<T> createProbe(String name, Class<T> type) {
        return TestProbe.create(name, type);
    }

    /**
     * Connects a test box to an actor builder, before it is spawned.
     *
     * @param name the name of the test box
     * @param actor the actor under test
     * @param inputType the type of the messages the actor sends
     * @param outputType the type of the messages the actor receives
     * @param <I> the type of the messages the actor sends
     * @param <O> the type of the messages the actor receives
     * @return the test side of the connection
     */
    public <I, O> TestBox<I, O> connect(String name, PeerLinker<O, I> actor, Class<I> inputType, Class<O> outputType) {
        return TestBox.connect(name, actor, inputType, outputType, defaultTimeout);
    }

    /**
     * Waits for every spawned actor to return.
     *
     * @throws ActorException the failure reported by the runtime
     * @throws AssertionError if the actors are still running after the default timeout
     */
    public void awaitCompletion() {
        Future<?> running;
        synchronized (this) {
            running = completion;
        }
        if (running == null) {
            return;
        }
        try {
            running.get(defaultTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ActorException actorException) {
                throw actorException;
            }
            throw new AssertionError("Runtime failed", e.getCause());
        } catch (TimeoutException e) {
            throw new AssertionError("Actors still running after " + defaultTimeout + ": " + runtime.runningActors(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for the runtime", e);
        }
    }

    /**
     * Asks all actors to shut down and waits for them.
     *
     * @throws ActorException the failure reported by the runtime
     */
    public void shutdown() {
        runtime.requestShutdown();
        awaitCompletion();
    }

    /**
     * Shuts the runtime down. A failure is logged rather than thrown: tests asserting on failures
     * use {@link #awaitCompletion()}.
     */
    @Override
    public void close() {
        try {
            shutdown();
        } catch (ActorException e) {
            logger.warn("Runtime completed with failure: {}", e.getMessage());
        } finally {
            runner.shutdownNow();
        }
    }
}
