package io.tedge.actors.server;

import io.tedge.actors.Actor;
import io.tedge.actors.ActorException;
import io.tedge.actors.box.SimpleMessageBox;
import io.tedge.actors.channel.Keyed;
import io.tedge.actors.config.ThreadPoolFactory;
import io.tedge.actors.mailbox.ChannelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Actor handling up to {@code maxConcurrency} requests of a {@link Server} at once.
 *
 * <p>Each response is sent as soon as it is ready, so responses to different requests may be
 * sent out of order. The first failing request stops the intake of new requests; requests in
 * flight are completed before the failure is reported.
 *
 * @param <Req> the request type
 * @param <Res> the response type
 */
public class ConcurrentServerActor<Req, Res> implements Actor {
    private static final Logger logger = LoggerFactory.getLogger(ConcurrentServerActor.class);

    private final Server<Req, Res> server;
    private final SimpleMessageBox<Keyed<Req>, Keyed<Res>> box;
    private final int maxConcurrency;
    private final ThreadPoolFactory threadPoolFactory;

    public ConcurrentServerActor(Server<Req, Res> server, SimpleMessageBox<Keyed<Req>, Keyed<Res>> box,
                                 int maxConcurrency, ThreadPoolFactory threadPoolFactory) {
        this.server = server;
        this.box = box;
        this.maxConcurrency = maxConcurrency;
        this.threadPoolFactory = threadPoolFactory;
    }

    @Override
    public String name() {
        return server.name();
    }

    @Override
    public void run() throws ChannelException, InterruptedException {
        ExecutorService workers = threadPoolFactory.createFixedExecutorService(server.name() + "-worker", maxConcurrency);
        Semaphore permits = new Semaphore(maxConcurrency);
        AtomicReference<ActorException> failure = new AtomicReference<>();
        try {
            Optional<Keyed<Req>> next;
            while (failure.get() == null && (next = box.receiveMessage()).isPresent()) {
                Keyed<Req> request = next.get();
                permits.acquire();
                workers.execute(() -> {
                    try {
                        Res response = ServerActor.handle(server, request.message());
                        box.send(new Keyed<>(request.clientId(), response));
                    } catch (ActorException e) {
                        if (failure.compareAndSet(null, e)) {
                            // wakes up the intake loop
                            box.closeInput();
                        }
                    } catch (ChannelException e) {
                        logger.debug("{} cannot send response: {}", server.name(), e.getMessage());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        permits.release();
                    }
                });
            }
            // wait for the requests in flight
            permits.acquire(maxConcurrency);
        } finally {
            workers.shutdown();
        }
        ActorException error = failure.get();
        if (error != null) {
            throw error;
        }
    }

    SimpleMessageBox<Keyed<Req>, Keyed<Res>> box() {
        return box;
    }
}
