package io.tedge.actors;

import io.tedge.actors.box.MessageBox;
import io.tedge.actors.builder.ActorBuilder;
import io.tedge.actors.channel.Recipient;
import io.tedge.actors.config.RuntimeConfig;
import io.tedge.actors.mailbox.ChannelException;
import io.tedge.actors.mailbox.Mailbox;
import io.tedge.actors.mailbox.UnboundedMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs actors and coordinates their shutdown.
 *
 * <p>Actors are added with {@link #spawn(ActorBuilder)}, each on its own runtime thread.
 * {@link #runToCompletion()} then waits until every actor has returned. A shutdown is initiated by
 * {@link #requestShutdown()} or, under the default supervision strategy, by the first actor
 * failure: every running actor receives {@link RuntimeRequest#SHUTDOWN} and the runtime waits for
 * them for at most the configured cleanup timeout.
 *
 * <pre>{@code
 * Runtime runtime = new Runtime();
 * runtime.spawnAll(source, converter, sink);
 * runtime.runToCompletion();
 * }</pre>
 */
public class Runtime {
    private static final Logger logger = LoggerFactory.getLogger(Runtime.class);

    private final RuntimeConfig config;
    private final ExecutorService executor;
    private final ExecutorService signalExecutor;
    private final Mailbox<Notice> notices;
    private final Supervisor supervisor;
    private final Recipient<RuntimeEvent> events;
    private final AtomicBoolean started = new AtomicBoolean();

    private final Object lock = new Object();
    private final Map<String, RunningActor> running = new LinkedHashMap<>();
    private int spawnCount;
    private boolean terminated;
    private volatile boolean shuttingDown;

    /** Notifications handled by the thread running {@link #runToCompletion()}. */
    private sealed interface Notice permits Finished, ShutdownRequested {
    }

    private record Finished(String task, ActorException failure) implements Notice {
    }

    private record ShutdownRequested(String reason) implements Notice {
    }

    public Runtime() {
        this(new RuntimeConfig());
    }

    public Runtime(RuntimeConfig config) {
        this.config = config;
        this.executor = config.getThreadPoolFactory().createExecutorService(config.getName() + "-actor");
        this.signalExecutor = config.getThreadPoolFactory().createCachedExecutorService(config.getName() + "-signal");
        this.notices = new UnboundedMailbox<>(config.getName() + "-notices");
        this.supervisor = new Supervisor(config.getSupervisionStrategy());
        this.events = config.getEventsRecipient();
    }

    /**
     * Builds an actor and starts it.
     *
     * @param builder the actor builder, consumed by this call
     * @throws io.tedge.actors.builder.LinkException if the builder was already spawned
     * @throws IllegalStateException if the runtime has completed
     */
    public void spawn(ActorBuilder builder) {
        RuntimeHandle handle = new RuntimeHandle(this);
        try {
            builder.spawn(handle);
        } finally {
            handle.invalidate();
        }
    }

    /**
     * Builds and starts several actors, in order.
     */
    public void spawnAll(ActorBuilder... builders) {
        spawnAll(Arrays.asList(builders));
    }

    public void spawnAll(Collection<? extends ActorBuilder> builders) {
        for (ActorBuilder builder : builders) {
            spawn(builder);
        }
    }

    void register(Actor actor, Recipient<RuntimeRequest> signalSender, MessageBox box) {
        RunningActor runningActor;
        boolean lateForShutdown;
        synchronized (lock) {
            if (terminated) {
                throw new IllegalStateException("Runtime has completed, cannot start " + actor.name());
            }
            String task = actor.name() + "-" + spawnCount++;
            runningActor = new RunningActor(task, actor, signalSender, box, this);
            running.put(task, runningActor);
            lateForShutdown = shuttingDown;
        }
        logger.info("Running {}", runningActor.task());
        publish(new RuntimeEvent.Started(runningActor.task()));
        executor.execute(runningActor);
        if (lateForShutdown) {
            sendShutdown(runningActor);
        }
    }

    /**
     * Asks every running actor to shut down. Idempotent; non-blocking.
     */
    public void requestShutdown() {
        beginShutdown("shutdown requested");
    }

    private void beginShutdown(String reason) {
        List<RunningActor> targets;
        synchronized (lock) {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
            targets = new ArrayList<>(running.values());
        }
        logger.info("Shutting down {} actor(s): {}", targets.size(), reason);
        for (RunningActor target : targets) {
            sendShutdown(target);
        }
        post(new ShutdownRequested(reason));
    }

    private void sendShutdown(RunningActor target) {
        // A full mailbox must not hold back the requests to the other actors
        signalExecutor.execute(target::requestShutdown);
    }

    /**
     * Waits until every spawned actor has returned, or until the cleanup timeout expires once a
     * shutdown has been requested. Can only be called once.
     *
     * @throws ActorException the first actor failure, with later ones attached as suppressed
     * @throws InterruptedException if interrupted while waiting
     * @throws IllegalStateException if called twice
     */
    public void runToCompletion() throws InterruptedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Runtime " + config.getName() + " has already been run");
        }
        logger.info("Runtime {} started", config.getName());
        Duration cleanupTimeout = config.getCleanupTimeout();
        long deadline = 0;
        boolean deadlineArmed = false;
        try {
            while (true) {
                synchronized (lock) {
                    if (running.isEmpty()) {
                        break;
                    }
                    if (shuttingDown && !deadlineArmed) {
                        deadline = System.nanoTime() + cleanupTimeout.toNanos();
                        deadlineArmed = true;
                    }
                }
                Notice notice;
                if (deadlineArmed) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        logger.warn("Actors still running after {}: {}", cleanupTimeout, runningActors());
                        break;
                    }
                    notice = notices.poll(remaining, TimeUnit.NANOSECONDS);
                } else {
                    notice = notices.receive().orElse(null);
                }
                if (notice instanceof Finished finished) {
                    onFinished(finished);
                }
            }
        } finally {
            synchronized (lock) {
                terminated = true;
            }
            executor.shutdown();
            signalExecutor.shutdownNow();
            events.close();
        }
        Optional<ActorException> failure = supervisor.firstFailure();
        if (failure.isPresent()) {
            logger.info("Runtime {} completed with failure: {}", config.getName(), failure.get().getMessage());
            throw failure.get();
        }
        logger.info("Runtime {} completed", config.getName());
    }

    private void onFinished(Finished finished) {
        synchronized (lock) {
            running.remove(finished.task());
        }
        ActorException failure = finished.failure();
        if (failure == null) {
            logger.info("Actor {} has finished", finished.task());
            publish(new RuntimeEvent.Stopped(finished.task()));
            return;
        }
        logger.error("Actor {} has failed", finished.task(), failure);
        publish(new RuntimeEvent.Aborted(finished.task(), failure.getMessage()));
        supervisor.onFailure(finished.task(), failure);
    }

    void failing(String task) {
        if (supervisor.escalates(task)) {
            beginShutdown(task + " failed");
        }
    }

    void finished(String task, ActorException failure) {
        post(new Finished(task, failure));
    }

    private void post(Notice notice) {
        try {
            notices.trySend(notice);
        } catch (ChannelException e) {
            logger.error("Runtime {} cannot record {}", config.getName(), notice, e);
        }
    }

    private void publish(RuntimeEvent event) {
        // never blocks the supervision loop
        try {
            events.trySend(event);
        } catch (ChannelException e) {
            if (e.isClosed()) {
                logger.debug("Runtime events are no longer consumed: {}", e.getMessage());
            } else {
                logger.warn("Dropped runtime event {}: {}", event, e.getMessage());
            }
        }
    }

    /**
     * @return true once a shutdown has been requested or triggered by a failure
     */
    public boolean isShuttingDown() {
        return shuttingDown;
    }

    /**
     * @return names of the actors still running
     */
    public Set<String> runningActors() {
        synchronized (lock) {
            return Set.copyOf(running.keySet());
        }
    }

    public RuntimeConfig getConfig() {
        return config;
    }
}
