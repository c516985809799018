package com.prozchain.network;

import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.network.protocol.consensus.ConsensusEngine;
import com.prozchain.network.protocol.consensus.codec.CodecUtils;
import com.prozchain.network.protocol.consensus.codec.ConsensusMessageWriter;
import com.prozchain.utils.async.AsyncExecutor;
import lombok.extern.java.Log;

import java.util.function.Consumer;
import java.util.logging.Level;

/**
 * {@link NetworkService} over a {@link PeerTransport}: outbound messages are encoded once and sent to every
 * connected peer in the background; inbound bytes go through the {@link ConsensusEngine}.
 */
@Log
public class PeerMessageCoordinator implements NetworkService {

    private static final int SEND_POOL_SIZE = 8;

    private final PeerTransport transport;
    private final ConsensusEngine consensusEngine;
    private final AsyncExecutor asyncExecutor;

    public PeerMessageCoordinator(PeerTransport transport, ConsensusEngine consensusEngine) {
        this.transport = transport;
        this.consensusEngine = consensusEngine;

        asyncExecutor = AsyncExecutor.withPoolSize(SEND_POOL_SIZE);
    }

    @Override
    public void broadcast(ConsensusMessage message) {
        byte[] encoded = CodecUtils.Encode.encode(ConsensusMessageWriter.getInstance(), message);
        sendMessageToActivePeers(peerId -> asyncExecutor.executeAndForget(() -> send(peerId, encoded)));
    }

    @Override
    public void registerHandler(ConsensusMessageHandler handler) {
        consensusEngine.setHandler(handler);
    }

    /**
     * Entry point for bytes received from a peer.
     */
    public void receive(String peerId, byte[] message) {
        consensusEngine.receiveRequest(message, peerId);
    }

    public void shutdown() {
        asyncExecutor.shutdown();
    }

    private void send(String peerId, byte[] encoded) {
        try {
            transport.send(peerId, encoded);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Failed to send consensus message to peer " + peerId, e);
        }
    }

    private void sendMessageToActivePeers(Consumer<String> messageAction) {
        transport.getPeerIds().forEach(messageAction);
    }
}
