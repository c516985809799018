package com.prozchain.consensus;

import com.prozchain.consensus.pool.VotePool;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.crypto.Ed25519Signer;
import com.prozchain.exception.StateCorruptionException;
import com.prozchain.network.NetworkService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

import static com.prozchain.ConsensusTestKit.config;
import static com.prozchain.ConsensusTestKit.prevote;
import static com.prozchain.ConsensusTestKit.signers;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsensusEventLoopTest {

    @Mock
    private ConsensusDriver driver;

    @Mock
    private VotePool votePool;

    @Mock
    private NetworkService network;

    private ConsensusEventLoop eventLoop;
    private Ed25519Signer signer;

    @BeforeEach
    void setup() {
        eventLoop = new ConsensusEventLoop(driver, votePool, network, config(), Clock.systemUTC());
        signer = signers(1).get(0);
    }

    @AfterEach
    void teardown() {
        eventLoop.stop();
    }

    @Test
    void startRegistersHandlerStartsDriverAndTicks() throws Exception {
        eventLoop.start();
        eventLoop.drain().get(5, TimeUnit.SECONDS);

        verify(network).registerHandler(eventLoop);
        verify(driver).start();
        verify(driver, timeout(2000).atLeastOnce()).tick(any());
    }

    @Test
    void verifiedMessagesReachDriverInDeliveryOrder() throws Exception {
        when(votePool.verifySignature(any())).thenReturn(true);
        Vote first = prevote(signer, 1, 0, null);
        Vote second = prevote(signer, 1, 1, null);
        Vote third = prevote(signer, 1, 2, null);

        eventLoop.deliver(first);
        eventLoop.deliver(second);
        eventLoop.deliver(third);
        eventLoop.drain().get(5, TimeUnit.SECONDS);

        InOrder order = inOrder(driver);
        order.verify(driver).handleVerifiedMessage(first);
        order.verify(driver).handleVerifiedMessage(second);
        order.verify(driver).handleVerifiedMessage(third);
    }

    @Test
    void invalidSignatureIsReportedInsteadOfHandled() throws Exception {
        Vote vote = prevote(signer, 1, 0, null);
        when(votePool.verifySignature(vote)).thenReturn(false);

        eventLoop.deliver(vote);
        eventLoop.drain().get(5, TimeUnit.SECONDS);

        verify(driver).onInvalidSignature(vote);
        verify(driver, never()).handleVerifiedMessage(any());
    }

    @Test
    void failingVerificationCountsAsInvalidSignature() throws Exception {
        Vote vote = prevote(signer, 1, 0, null);
        when(votePool.verifySignature(vote)).thenThrow(new IllegalStateException("verifier crashed"));

        eventLoop.deliver(vote);
        eventLoop.drain().get(5, TimeUnit.SECONDS);

        verify(driver).onInvalidSignature(vote);
    }

    @Test
    void corruptedStateHaltsTheLoop() throws Exception {
        when(votePool.verifySignature(any())).thenReturn(true);
        Vote first = prevote(signer, 1, 0, null);
        Vote second = prevote(signer, 1, 1, null);
        doThrow(new StateCorruptionException("round regression")).when(driver).handleVerifiedMessage(first);

        eventLoop.deliver(first);
        eventLoop.drain().get(5, TimeUnit.SECONDS);
        eventLoop.deliver(second);

        assertTrue(eventLoop.isHalted());
        verify(driver, never()).handleVerifiedMessage(second);
    }
}
