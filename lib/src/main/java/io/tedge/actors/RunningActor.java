package io.tedge.actors;

import io.tedge.actors.box.MessageBox;
import io.tedge.actors.channel.Recipient;
import io.tedge.actors.mailbox.ChannelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An actor registered with the runtime, run once on a runtime thread.
 */
final class RunningActor implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(RunningActor.class);

    private final String task;
    private final Actor actor;
    private final Recipient<RuntimeRequest> signalSender;
    private final MessageBox box;
    private final Runtime runtime;

    RunningActor(String task, Actor actor, Recipient<RuntimeRequest> signalSender, MessageBox box, Runtime runtime) {
        this.task = task;
        this.actor = actor;
        this.signalSender = signalSender;
        this.box = box;
        this.runtime = runtime;
    }

    @Override
    public void run() {
        ActorException failure = null;
        try {
            actor.run();
        } catch (ChannelException e) {
            if (runtime.isShuttingDown()) {
                logger.debug("{} lost a channel while shutting down: {}", task, e.getMessage());
            } else {
                failure = ActorException.wrap(actor.name(), e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!runtime.isShuttingDown()) {
                failure = ActorException.wrap(actor.name(), e);
            }
        } catch (Throwable e) {
            failure = ActorException.wrap(actor.name(), e);
        } finally {
            if (failure != null) {
                // peers must see the shutdown before they see this box closed
                runtime.failing(task);
            }
            if (box != null) {
                box.close();
            }
            signalSender.close();
        }
        runtime.finished(task, failure);
    }

    /**
     * Delivers a shutdown request through the actor's signal sender.
     */
    void requestShutdown() {
        try {
            signalSender.send(RuntimeRequest.SHUTDOWN);
        } catch (ChannelException e) {
            logger.debug("{} already stopped: {}", task, e.getMessage());
        } catch (InterruptedException e) {
            logger.warn("Interrupted while sending shutdown request to {}", task);
            Thread.currentThread().interrupt();
        }
    }

    String task() {
        return task;
    }
}
