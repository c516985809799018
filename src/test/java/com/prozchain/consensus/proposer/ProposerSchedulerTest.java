package com.prozchain.consensus.proposer;

import com.prozchain.crypto.Ed25519Signer;
import com.prozchain.types.Address;
import com.prozchain.validator.StaticValidatorSet;
import com.prozchain.validator.Validator;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.prozchain.ConsensusTestKit.address;
import static com.prozchain.ConsensusTestKit.signers;
import static com.prozchain.ConsensusTestKit.validatorSet;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ProposerSchedulerTest {

    @Test
    void roundsOfAHeightRotateThroughEqualValidators() {
        ProposerScheduler scheduler = new ProposerScheduler(validatorSet(signers(4)), 1);

        Set<Address> proposers = new HashSet<>();
        for (int round = 0; round < 4; round++) {
            proposers.add(scheduler.proposerFor(1, round));
        }

        assertEquals(4, proposers.size());
    }

    @Test
    void equalValidatorsProposeEquallyOften() {
        ProposerScheduler scheduler = new ProposerScheduler(validatorSet(signers(4)), 1);

        Map<Address, Integer> counts = countProposers(scheduler, 1, 8);

        assertEquals(4, counts.size());
        counts.values().forEach(count -> assertEquals(2, count));
    }

    @Test
    void selectionFrequencyFollowsVotingPower() {
        List<Ed25519Signer> signers = signers(2);
        ProposerScheduler scheduler = new ProposerScheduler(validatorSet(signers, 3, 1), 1);

        Map<Address, Integer> counts = countProposers(scheduler, 1, 8);

        assertEquals(6, counts.get(address(signers.get(0))));
        assertEquals(2, counts.get(address(signers.get(1))));
    }

    @Test
    void consecutiveRoundsNeverRepeatTheProposer() {
        ProposerScheduler scheduler = new ProposerScheduler(validatorSet(signers(2), 3, 1), 1);

        for (long height = 1; height <= 5; height++) {
            for (int round = 1; round < 6; round++) {
                assertNotEquals(scheduler.proposerFor(height, round - 1), scheduler.proposerFor(height, round));
            }
        }
    }

    @Test
    void independentSchedulersAgree() {
        List<Ed25519Signer> signers = signers(5);
        ProposerScheduler first = new ProposerScheduler(validatorSet(signers, 5, 1, 3, 2, 4), 1);
        ProposerScheduler second = new ProposerScheduler(validatorSet(signers, 5, 1, 3, 2, 4), 1);

        // query in a different order so the caches diverge
        second.proposerFor(90, 2);

        for (long height = 1; height <= 100; height += 7) {
            for (int round = 0; round < 3; round++) {
                assertEquals(first.proposerFor(height, round), second.proposerFor(height, round));
            }
        }
    }

    @Test
    void newcomerDoesNotProposeRightAfterJoining() {
        List<Ed25519Signer> signers = signers(4);
        StaticValidatorSet validatorSet = validatorSet(signers.subList(0, 3));
        List<Validator> extended = signers.stream()
                .map(s -> Validator.fromPublicKey(s.getPublicKey(), 1))
                .toList();
        validatorSet.scheduleChange(5, extended);
        ProposerScheduler scheduler = new ProposerScheduler(validatorSet, 1);

        Address newcomer = address(signers.get(3));

        assertNotEquals(newcomer, scheduler.proposerFor(5, 0));
        assertEquals(4, countProposers(scheduler, 5, 12).size());
    }

    @Test
    void heightBelowInitialHeightIsRejected() {
        ProposerScheduler scheduler = new ProposerScheduler(validatorSet(signers(3)), 10);

        assertThrows(IllegalArgumentException.class, () -> scheduler.proposerFor(9, 0));
        assertThrows(IllegalArgumentException.class, () -> scheduler.proposerFor(10, -1));
    }

    @Test
    void heightsWithinTheRecentWindowAreServedWithoutReplay() {
        StaticValidatorSet validatorSet = spy(validatorSet(signers(5), 5, 1, 3, 2, 4));
        ProposerScheduler scheduler = new ProposerScheduler(validatorSet, 1, 101);
        scheduler.proposerFor(3000, 0);
        clearInvocations(validatorSet);

        Address proposer = scheduler.proposerFor(2900, 1);

        verify(validatorSet, times(1)).currentValidators(anyLong());
        assertEquals(new ProposerScheduler(validatorSet(signers(5), 5, 1, 3, 2, 4), 1).proposerFor(2900, 1),
                proposer);
    }

    @Test
    void olderHeightsReplayFromTheClosestCheckpoint() {
        StaticValidatorSet validatorSet = spy(validatorSet(signers(5), 5, 1, 3, 2, 4));
        ProposerScheduler scheduler = new ProposerScheduler(validatorSet, 1, 8);
        scheduler.proposerFor(5000, 0);
        clearInvocations(validatorSet);

        Address proposer = scheduler.proposerFor(1500, 0);

        // at most two lookups per replayed height, plus the one for the queried height
        verify(validatorSet, atMost((int) (2 * ProposerScheduler.CHECKPOINT_INTERVAL + 1)))
                .currentValidators(anyLong());
        assertEquals(new ProposerScheduler(validatorSet(signers(5), 5, 1, 3, 2, 4), 1).proposerFor(1500, 0),
                proposer);
        assertEquals(scheduler.proposerFor(5000, 0),
                new ProposerScheduler(validatorSet(signers(5), 5, 1, 3, 2, 4), 1).proposerFor(5000, 0));
    }

    private static Map<Address, Integer> countProposers(ProposerScheduler scheduler, long from, int heights) {
        Map<Address, Integer> counts = new HashMap<>();
        for (long height = from; height < from + heights; height++) {
            counts.merge(scheduler.proposerFor(height, 0), 1, Integer::sum);
        }
        return counts;
    }
}
