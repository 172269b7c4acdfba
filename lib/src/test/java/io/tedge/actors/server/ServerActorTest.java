package io.tedge.actors.server;

import io.tedge.actors.ActorException;
import io.tedge.actors.Runtime;
import io.tedge.actors.box.ClientMessageBox;
import io.tedge.actors.builder.LinkException;
import io.tedge.actors.channel.MailboxRecipient;
import io.tedge.actors.mailbox.ChannelException;
import io.tedge.actors.mailbox.UnboundedMailbox;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class ServerActorTest {

    /** Doubles its input; fails on negative numbers. */
    static class Doubler implements Server<Integer, Integer> {
        @Override
        public String name() {
            return "Doubler";
        }

        @Override
        public Integer handle(Integer request) {
            if (request < 0) {
                throw new IllegalArgumentException("negative input: " + request);
            }
            return request * 2;
        }
    }

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Future<?> runInBackground(Runtime runtime) {
        return executor.submit(() -> {
            runtime.runToCompletion();
            return null;
        });
    }

    @Test
    void testResponsesAreRoutedToTheRequestingClient() throws Exception {
        ServerActorBuilder<Integer, Integer> server = new ServerActorBuilder<>(new Doubler(), Integer.class, Integer.class);
        ClientMessageBox<Integer, Integer> first = new ClientMessageBox<>("first", server, Integer.class, Integer.class);
        ClientMessageBox<Integer, Integer> second = new ClientMessageBox<>("second", server, Integer.class, Integer.class);

        Runtime runtime = new Runtime();
        runtime.spawn(server);
        Future<?> completion = runInBackground(runtime);

        assertEquals(2, first.awaitResponse(1));
        assertEquals(20, second.awaitResponse(10));
        assertEquals(4, first.awaitResponse(2));

        runtime.requestShutdown();
        completion.get(5, TimeUnit.SECONDS);

        assertThrows(ChannelException.class, () -> first.awaitResponse(3));
    }

    @Test
    void testClientsDisconnectWithoutStoppingTheServer() throws Exception {
        ServerActorBuilder<Integer, Integer> server = new ServerActorBuilder<>(new Doubler(), Integer.class, Integer.class);
        ClientMessageBox<Integer, Integer> first = new ClientMessageBox<>("first", server, Integer.class, Integer.class);
        ClientMessageBox<Integer, Integer> second = new ClientMessageBox<>("second", server, Integer.class, Integer.class);

        Runtime runtime = new Runtime();
        runtime.spawn(server);
        Future<?> completion = runInBackground(runtime);

        assertEquals(2, first.awaitResponse(1));
        first.close();
        assertEquals(6, second.awaitResponse(3));

        // once every client is gone the request mailbox reaches end-of-stream
        second.close();
        completion.get(5, TimeUnit.SECONDS);
    }

    @Test
    void testConnectAfterSpawnIsRejected() throws Exception {
        ServerActorBuilder<Integer, Integer> server = new ServerActorBuilder<>(new Doubler(), Integer.class, Integer.class);
        Runtime runtime = new Runtime();
        runtime.spawn(server);

        LinkException e = assertThrows(LinkException.class,
                () -> new ClientMessageBox<>("late", server, Integer.class, Integer.class));
        assertEquals(LinkException.Reason.ALREADY_SPAWNED, e.getReason());
        runtime.runToCompletion();
    }

    @Test
    void testClientOfAnotherResponseTypeIsRejected() {
        ServerMessageBoxBuilder<Integer, Integer> server = new ServerMessageBoxBuilder<>("Doubler", Integer.class, Integer.class);
        LinkException e = assertThrows(LinkException.class,
                () -> server.connect(MailboxRecipient.of(new UnboundedMailbox<>("strings"), String.class)));
        assertEquals(LinkException.Reason.TYPE_MISMATCH, e.getReason());
    }

    @Test
    void testHandlerFailureFailsTheServer() throws Exception {
        ServerActorBuilder<Integer, Integer> server = new ServerActorBuilder<>(new Doubler(), Integer.class, Integer.class);
        ClientMessageBox<Integer, Integer> client = new ClientMessageBox<>("client", server, Integer.class, Integer.class);

        Runtime runtime = new Runtime();
        runtime.spawn(server);
        Future<?> completion = runInBackground(runtime);

        assertThrows(ChannelException.class, () -> client.awaitResponse(-1));
        Exception e = assertThrows(Exception.class, () -> completion.get(5, TimeUnit.SECONDS));
        ActorException failure = assertInstanceOf(ActorException.class, e.getCause());
        assertEquals("Doubler", failure.getActorName());
    }

    @Test
    void testHandlerFailureFailsTheConcurrentServer() throws Exception {
        ServerActorBuilder<Integer, Integer> server =
                new ServerActorBuilder<>(new Doubler(), Integer.class, Integer.class).withMaxConcurrency(2);
        ClientMessageBox<Integer, Integer> client = new ClientMessageBox<>("client", server, Integer.class, Integer.class);

        Runtime runtime = new Runtime();
        runtime.spawn(server);
        Future<?> completion = runInBackground(runtime);

        assertEquals(4, client.awaitResponse(2));
        // no further request arrives after the failing one
        assertThrows(ChannelException.class, () -> client.awaitResponse(-1));
        Exception e = assertThrows(Exception.class, () -> completion.get(5, TimeUnit.SECONDS));
        ActorException failure = assertInstanceOf(ActorException.class, e.getCause());
        assertEquals("Doubler", failure.getActorName());
    }

    @Test
    void testMaxConcurrencyIsRejectedBelowOne() {
        ServerMessageBoxBuilder<Integer, Integer> server = new ServerMessageBoxBuilder<>("Doubler", Integer.class, Integer.class);
        assertThrows(IllegalArgumentException.class, () -> server.withMaxConcurrency(0));
    }

    @Test
    void testConcurrentServerHandlesRequestsInParallel() throws Exception {
        int clients = 3;
        CyclicBarrier allInFlight = new CyclicBarrier(clients);
        Server<Integer, Integer> rendezvous = new Server<>() {
            @Override
            public String name() {
                return "Rendezvous";
            }

            @Override
            public Integer handle(Integer request) throws Exception {
                // only returns once every request is being handled at the same time
                allInFlight.await(5, TimeUnit.SECONDS);
                return request + 100;
            }
        };
        ServerActorBuilder<Integer, Integer> server =
                new ServerActorBuilder<>(rendezvous, Integer.class, Integer.class).withMaxConcurrency(clients);
        List<ClientMessageBox<Integer, Integer>> boxes = new ArrayList<>();
        for (int i = 0; i < clients; i++) {
            boxes.add(new ClientMessageBox<>("client-" + i, server, Integer.class, Integer.class));
        }

        Runtime runtime = new Runtime();
        runtime.spawn(server);
        Future<?> completion = runInBackground(runtime);

        List<Future<Integer>> responses = new ArrayList<>();
        for (int i = 0; i < clients; i++) {
            ClientMessageBox<Integer, Integer> box = boxes.get(i);
            int request = i;
            responses.add(executor.submit(() -> box.awaitResponse(request)));
        }
        for (int i = 0; i < clients; i++) {
            assertEquals(i + 100, responses.get(i).get(5, TimeUnit.SECONDS));
        }

        runtime.requestShutdown();
        completion.get(5, TimeUnit.SECONDS);
    }
}
