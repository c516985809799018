package com.prozchain.network.protocol.consensus;

import com.prozchain.consensus.vote.Vote;
import com.prozchain.network.ConsensusMessageHandler;
import com.prozchain.network.protocol.consensus.codec.CodecUtils;
import com.prozchain.network.protocol.consensus.codec.ConsensusMessageWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.prozchain.ConsensusTestKit.prevote;
import static com.prozchain.ConsensusTestKit.signers;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ConsensusEngineTest {

    private static final String PEER_ID = "peer-1";

    @InjectMocks
    private ConsensusEngine consensusEngine;

    @Mock
    private ConsensusMessageHandler handler;

    @BeforeEach
    void setup() {
        consensusEngine.setHandler(handler);
    }

    @Test
    void deliversDecodedMessage() {
        Vote vote = prevote(signers(1).get(0), 4, 1, null);
        byte[] encoded = CodecUtils.Encode.encode(ConsensusMessageWriter.getInstance(), vote);

        consensusEngine.receiveRequest(encoded, PEER_ID);

        verify(handler).deliver(vote);
    }

    @Test
    void dropsEmptyMessage() {
        consensusEngine.receiveRequest(new byte[0], PEER_ID);

        verifyNoInteractions(handler);
    }

    @Test
    void dropsMalformedMessage() {
        consensusEngine.receiveRequest(new byte[]{1, 2, 3}, PEER_ID);

        verifyNoInteractions(handler);
    }

    @Test
    void dropsMessageWhenNoHandlerIsRegistered() {
        consensusEngine.setHandler(null);
        byte[] encoded = CodecUtils.Encode.encode(ConsensusMessageWriter.getInstance(),
                prevote(signers(1).get(0), 4, 1, null));

        assertDoesNotThrow(() -> consensusEngine.receiveRequest(encoded, PEER_ID));
        verifyNoInteractions(handler);
    }
}
