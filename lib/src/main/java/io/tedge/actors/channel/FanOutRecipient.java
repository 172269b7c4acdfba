package io.tedge.actors.channel;

import io.tedge.actors.mailbox.ChannelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Recipient copying every message to several peers, in registration order.
 *
 * <p>A peer that turns out to be closed is dropped from the list. Sending fails with
 * {@link ChannelException.Reason#CLOSED} only once no peer remains.
 *
 * @param <M> the type of messages accepted
 */
public final class FanOutRecipient<M> implements Recipient<M> {
    private static final Logger logger = LoggerFactory.getLogger(FanOutRecipient.class);

    private final Class<?> type;
    private final List<Recipient<? super M>> peers;

    public FanOutRecipient(Class<?> type, List<? extends Recipient<? super M>> peers) {
        this.type = type;
        this.peers = new CopyOnWriteArrayList<>(peers);
    }

    @Override
    public void send(M message) throws ChannelException, InterruptedException {
        for (Recipient<? super M> peer : peers) {
            try {
                peer.send(message);
            } catch (ChannelException e) {
                dropClosedPeer(peer, e);
            }
        }
        ensurePeersLeft();
    }

    @Override
    public void trySend(M message) throws ChannelException {
        for (Recipient<? super M> peer : peers) {
            try {
                peer.trySend(message);
            } catch (ChannelException e) {
                dropClosedPeer(peer, e);
            }
        }
        ensurePeersLeft();
    }

    private void dropClosedPeer(Recipient<? super M> peer, ChannelException e) throws ChannelException {
        if (!e.isClosed()) {
            throw e;
        }
        logger.debug("Removing closed peer {}", peer);
        peers.remove(peer);
        peer.close();
    }

    private void ensurePeersLeft() throws ChannelException {
        if (peers.isEmpty()) {
            throw ChannelException.closed("fan-out");
        }
    }

    @Override
    public FanOutRecipient<M> clone() {
        List<Recipient<? super M>> copies = new ArrayList<>(peers.size());
        for (Recipient<? super M> peer : peers) {
            copies.add(peer.clone());
        }
        return new FanOutRecipient<>(type, copies);
    }

    @Override
    public void close() {
        for (Recipient<? super M> peer : peers) {
            peer.close();
        }
    }

    @Override
    public boolean isClosed() {
        return peers.stream().allMatch(Recipient::isClosed);
    }

    @Override
    public Class<?> messageType() {
        return type;
    }

    /**
     * @return number of peers still reachable
     */
    public int size() {
        return peers.size();
    }
}
