package com.prozchain.network.protocol.consensus;

import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.exception.MessageDecodingException;
import com.prozchain.network.ConsensusMessageHandler;
import com.prozchain.network.protocol.consensus.codec.CodecUtils;
import com.prozchain.network.protocol.consensus.codec.ConsensusMessageReader;
import lombok.Setter;
import lombok.extern.java.Log;

import java.util.logging.Level;

/**
 * Decodes consensus messages received from peers and delivers them to the registered handler.
 */
@Log
public class ConsensusEngine {

    @Setter
    private volatile ConsensusMessageHandler handler;

    /**
     * Handles an incoming message: undecodable bytes are logged and dropped, anything else is delivered.
     *
     * @param message received message as byte array
     * @param peerId  sender of the message
     */
    public void receiveRequest(byte[] message, String peerId) {
        if (message.length == 0) {
            log.log(Level.WARNING, "Empty consensus message from peer " + peerId);
            return;
        }

        ConsensusMessage decoded;
        try {
            decoded = CodecUtils.Decode.decode(message, ConsensusMessageReader.getInstance());
        } catch (MessageDecodingException e) {
            log.log(Level.WARNING, String.format("Malformed consensus message from peer %s: %s",
                    peerId, e.getMessage()));
            return;
        }

        ConsensusMessageHandler current = handler;
        if (current == null) {
            log.fine("No consensus handler registered, dropping message from peer " + peerId);
            return;
        }
        log.log(Level.FINE, String.format("Received %s from peer %s", decoded, peerId));
        current.deliver(decoded);
    }
}
