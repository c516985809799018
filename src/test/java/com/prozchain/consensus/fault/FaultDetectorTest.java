package com.prozchain.consensus.fault;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.consensus.pool.MessageValidator;
import com.prozchain.consensus.pool.VotePool;
import com.prozchain.consensus.proposer.ProposerScheduler;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.crypto.Ed25519Signer;
import com.prozchain.metrics.ConsensusMetrics;
import com.prozchain.network.protocol.consensus.codec.SigningPayloadWriter;
import com.prozchain.types.BlockHash;
import com.prozchain.validator.StaticValidatorSet;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.prozchain.ConsensusTestKit.CHAIN_ID;
import static com.prozchain.ConsensusTestKit.address;
import static com.prozchain.ConsensusTestKit.block;
import static com.prozchain.ConsensusTestKit.config;
import static com.prozchain.ConsensusTestKit.precommit;
import static com.prozchain.ConsensusTestKit.prevote;
import static com.prozchain.ConsensusTestKit.proposal;
import static com.prozchain.ConsensusTestKit.signerOf;
import static com.prozchain.ConsensusTestKit.signers;
import static com.prozchain.ConsensusTestKit.validatorSet;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class FaultDetectorTest {

    private static final BlockHash HASH_A = block(1, "A").getHash();
    private static final BlockHash HASH_B = block(1, "B").getHash();

    @Mock
    private SlashingModule slashingModule;

    private List<Ed25519Signer> signers;
    private ProposerScheduler scheduler;
    private VotePool votePool;
    private CollectorRegistry registry;
    private FaultDetector faultDetector;

    @BeforeEach
    void setup() {
        signers = signers(4);
        StaticValidatorSet validatorSet = validatorSet(signers);
        ConsensusConfig config = config();
        scheduler = new ProposerScheduler(validatorSet, 1);
        votePool = new VotePool(validatorSet,
                new MessageValidator(validatorSet, scheduler, signers.get(0), new SigningPayloadWriter(CHAIN_ID)),
                config);
        registry = new CollectorRegistry();
        faultDetector = new FaultDetector(votePool, validatorSet, slashingModule,
                new ConsensusMetrics(registry, config.getLivenessAlertRounds()), config,
                Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void equivocationIsReportedOnceWithBothVotes() {
        Vote first = prevote(signers.get(1), 1, 0, HASH_A);
        Vote second = prevote(signers.get(1), 1, 0, HASH_B);
        votePool.submit(first);
        votePool.submit(second);

        List<Evidence> evidence = faultDetector.scan(votePool.snapshot(1));

        assertEquals(1, evidence.size());
        Evidence found = evidence.get(0);
        assertEquals(EvidenceKind.EQUIVOCATION, found.getKind());
        assertEquals(address(signers.get(1)), found.getValidator());
        assertEquals(VoteType.PREVOTE, found.getVoteType());
        assertSame(first, found.getFirst());
        assertSame(second, found.getSecond());
        assertEquals(first.getSignature(), ((Vote) found.getFirst()).getSignature());
        verify(slashingModule).submitEvidence(found);
        assertEquals(1.0, registry.getSampleValue(ConsensusMetrics.MetricKeys.EVIDENCE,
                new String[]{"kind"}, new String[]{"EQUIVOCATION"}));
    }

    @Test
    void rescanningDoesNotReportAgain() {
        votePool.submit(precommit(signers.get(2), 1, 0, HASH_A));
        votePool.submit(precommit(signers.get(2), 1, 0, null));

        assertEquals(1, faultDetector.scan(votePool.snapshot(1)).size());
        assertTrue(faultDetector.scan(votePool.snapshot(1)).isEmpty());
        faultDetector.scanRetainedHeights();

        verify(slashingModule, times(1)).submitEvidence(any());
    }

    @Test
    void votesOfDifferentRoundsOrTypesAreNotEquivocation() {
        votePool.submit(prevote(signers.get(0), 1, 0, HASH_A));
        votePool.submit(precommit(signers.get(0), 1, 0, null));
        votePool.submit(prevote(signers.get(0), 1, 1, HASH_B));

        assertTrue(faultDetector.scan(votePool.snapshot(1)).isEmpty());
    }

    @Test
    void doubleProposalIsReported() {
        Ed25519Signer proposer = signerOf(signers, scheduler.proposerFor(1, 0));
        Proposal first = proposal(proposer, block(1, "A"), 0, Proposal.NO_POL_ROUND);
        Proposal second = proposal(proposer, block(1, "B"), 0, Proposal.NO_POL_ROUND);
        votePool.submit(first);
        votePool.submit(second);

        List<Evidence> evidence = faultDetector.scan(votePool.snapshot(1));

        assertEquals(1, evidence.size());
        assertEquals(EvidenceKind.DOUBLE_PROPOSAL, evidence.get(0).getKind());
        assertSame(first, evidence.get(0).getFirst());
        assertSame(second, evidence.get(0).getSecond());
    }

    @Test
    void refusedEvidenceIsRetriedOnNextScan() {
        doThrow(new IllegalStateException("slashing unavailable"))
                .doNothing()
                .when(slashingModule).submitEvidence(any());
        votePool.submit(prevote(signers.get(3), 1, 0, HASH_A));
        votePool.submit(prevote(signers.get(3), 1, 0, HASH_B));

        assertTrue(faultDetector.scan(votePool.snapshot(1)).isEmpty());
        assertEquals(1, faultDetector.scan(votePool.snapshot(1)).size());

        verify(slashingModule, times(2)).submitEvidence(any());
    }

    @Test
    void downtimeIsReportedOncePerAbsenceStreak() {
        Ed25519Signer absent = signers.get(3);

        // downtime threshold is 3 heights
        for (long height = 1; height <= 3; height++) {
            commitWithout(height, absent);
            assertTrue(faultDetector.recordCommittedHeight(height).isEmpty());
        }

        commitWithout(4, absent);
        List<Evidence> evidence = faultDetector.recordCommittedHeight(4);
        assertEquals(1, evidence.size());
        assertEquals(EvidenceKind.DOWNTIME, evidence.get(0).getKind());
        assertEquals(address(absent), evidence.get(0).getValidator());
        assertEquals(4, evidence.get(0).getMissedHeights());

        commitWithout(5, absent);
        assertTrue(faultDetector.recordCommittedHeight(5).isEmpty());

        commitWithout(6, null);
        assertTrue(faultDetector.recordCommittedHeight(6).isEmpty());

        for (long height = 7; height <= 9; height++) {
            commitWithout(height, absent);
            assertTrue(faultDetector.recordCommittedHeight(height).isEmpty());
        }
        commitWithout(10, absent);
        assertEquals(1, faultDetector.recordCommittedHeight(10).size());

        verify(slashingModule, times(2)).submitEvidence(any());
    }

    @Test
    void refusedDowntimeEvidenceIsRetried() {
        doThrow(new IllegalStateException("slashing unavailable"))
                .doNothing()
                .when(slashingModule).submitEvidence(any());
        Ed25519Signer absent = signers.get(3);

        for (long height = 1; height <= 4; height++) {
            commitWithout(height, absent);
            assertTrue(faultDetector.recordCommittedHeight(height).isEmpty());
        }

        List<Evidence> retried = faultDetector.retryPendingDowntime();
        assertEquals(1, retried.size());
        assertEquals(EvidenceKind.DOWNTIME, retried.get(0).getKind());
        assertEquals(address(absent), retried.get(0).getValidator());
        assertEquals(4, retried.get(0).getMissedHeights());

        assertTrue(faultDetector.retryPendingDowntime().isEmpty());
        commitWithout(5, absent);
        assertTrue(faultDetector.recordCommittedHeight(5).isEmpty());

        verify(slashingModule, times(2)).submitEvidence(any());
    }

    @Test
    void refusedDowntimeEvidenceIsRetriedByThePeriodicScan() {
        doThrow(new IllegalStateException("slashing unavailable"))
                .doNothing()
                .when(slashingModule).submitEvidence(any());
        Ed25519Signer absent = signers.get(3);

        for (long height = 1; height <= 4; height++) {
            commitWithout(height, absent);
            faultDetector.recordCommittedHeight(height);
        }
        faultDetector.scanRetainedHeights();

        verify(slashingModule, times(2)).submitEvidence(any());
        commitWithout(5, absent);
        assertTrue(faultDetector.recordCommittedHeight(5).isEmpty());
    }

    @Test
    void committedHeightIsRecordedOnlyOnce() {
        for (long height = 1; height <= 4; height++) {
            commitWithout(height, signers.get(0));
            faultDetector.recordCommittedHeight(height);
        }

        assertTrue(faultDetector.recordCommittedHeight(4).isEmpty());
        verify(slashingModule, times(1)).submitEvidence(any());
    }

    private void commitWithout(long height, Ed25519Signer absent) {
        votePool.advanceTo(height, 0);
        for (Ed25519Signer signer : signers) {
            if (signer != absent) {
                assertTrue(votePool.submit(precommit(signer, height, 0, HASH_A)).isAccepted());
            }
        }
    }
}
