package com.prozchain.consensus.round;

import com.prozchain.block.Block;
import com.prozchain.block.BlockExecutor;
import com.prozchain.consensus.pool.Quorum;
import com.prozchain.consensus.pool.VotePool;
import com.prozchain.consensus.proposer.ProposerScheduler;
import com.prozchain.consensus.state.PersistedConsensusState;
import com.prozchain.consensus.state.RoundState;
import com.prozchain.consensus.state.Step;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.exception.InvalidBlockException;
import com.prozchain.types.Address;
import com.prozchain.types.BlockHash;
import com.prozchain.validator.ValidatorSet;
import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.extern.java.Log;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Drives one height through Propose, Prevote, Precommit and Commit, round after round.
 * <p>
 * Not thread safe: every call must come from the consensus thread. Quorums are read from the {@link VotePool};
 * votes, proposals and commits leave through {@link RoundActions}.
 */
@Log
@Getter
public class RoundStateMachine {

    private final VotePool votePool;
    private final ProposerScheduler proposerScheduler;
    private final ValidatorSet validatorSet;
    private final BlockExecutor blockExecutor;
    private final RoundTimeouts timeouts;
    private final RoundActions actions;
    private final Address localAddress;

    private RoundState state;
    private StageState stage;
    private Instant now = Instant.EPOCH;

    /**
     * Incremented on every round and stage change. {@link #process} loops until it stops moving.
     */
    private long transitions;

    public RoundStateMachine(VotePool votePool,
                             ProposerScheduler proposerScheduler,
                             ValidatorSet validatorSet,
                             BlockExecutor blockExecutor,
                             RoundTimeouts timeouts,
                             RoundActions actions,
                             Address localAddress) {
        this.votePool = votePool;
        this.proposerScheduler = proposerScheduler;
        this.validatorSet = validatorSet;
        this.blockExecutor = blockExecutor;
        this.timeouts = timeouts;
        this.actions = actions;
        this.localAddress = localAddress;
    }

    /**
     * Starts round 0 of a fresh height, without any lock.
     */
    public void startHeight(long height, Instant now) {
        this.now = now;
        beginHeight(height);
        process(now);
    }

    private void beginHeight(long height) {
        log.info(String.format("Starting height %d", height));
        this.state = new RoundState(height);
        startRound(0);
    }

    /**
     * Resumes a height from persisted state, keeping the lock taken before the restart. Votes of the persisted
     * round may already have been sent, so the node resumes in the following round.
     */
    public void restore(PersistedConsensusState persisted, Instant now) {
        this.now = now;
        log.info(String.format("Resuming height %d after round %d", persisted.getHeight(), persisted.getRound()));
        this.state = new RoundState(persisted.getHeight());
        if (persisted.getLockedValue() != null) {
            state.lock(persisted.getLockedValue(), persisted.getLockedRound());
            state.updateValid(persisted.getLockedValue(), persisted.getLockedRound());
        }
        startRound(persisted.getRound() + 1);
        process(now);
    }

    /**
     * Re-evaluates the current height after new messages reached the pool. Stops once the height commits; the
     * next height is evaluated on the following message or tick.
     */
    public void process(Instant now) {
        this.now = now;
        if (state == null) {
            return;
        }

        long height = state.getHeight();
        long before;
        do {
            before = transitions;
            if (stage.getStep() != Step.COMMIT && checkCommit()) {
                continue;
            }
            if (stage.getStep() != Step.COMMIT && checkCatchUp()) {
                continue;
            }
            stage.evaluate(this);
        } while (transitions != before && state.getHeight() == height);
    }

    /**
     * Fires the timeout of the current stage if its deadline has passed, then re-evaluates.
     */
    public void tick(Instant now) {
        this.now = now;
        if (state == null) {
            return;
        }

        Optional<Instant> deadline = state.getDeadline(stage.getStep());
        if (deadline.isPresent() && !now.isBefore(deadline.get())) {
            log.fine(String.format("Height %d round %d: %s timeout expired",
                    state.getHeight(), state.getRound(), stage.getStep()));
            stage.end(this);
        }
        process(now);
    }

    public long getHeight() {
        return state.getHeight();
    }

    public int getRound() {
        return state.getRound();
    }

    public Step getStep() {
        return stage.getStep();
    }

    /**
     * Enters {@code round} of the current height. Before moving on, a lock is released when a prevote quorum
     * for a different value has been seen in a round newer than the locked round.
     */
    void startRound(int round) {
        releaseLockIfSuperseded(round);

        state.enterRound(round);
        transitions++;
        log.info(String.format("Height %d: entering round %d", state.getHeight(), round));

        actions.onNewRound(state.getHeight(), round);
        setStage(new ProposeStage());
    }

    void setStage(StageState next) {
        this.stage = next;
        state.setStep(next.getStep());
        transitions++;
        next.start(this);
    }

    void scheduleDeadline(Step step) {
        state.setDeadline(step, now.plus(timeouts.timeoutFor(step, state.getRound())));
    }

    void prevote(@Nullable BlockHash blockHash) {
        actions.broadcastVote(state.getHeight(), state.getRound(), VoteType.PREVOTE, blockHash);
        setStage(new PrevoteStage());
    }

    void precommit(@Nullable BlockHash blockHash) {
        actions.broadcastVote(state.getHeight(), state.getRound(), VoteType.PRECOMMIT, blockHash);
        setStage(new PrecommitStage());
    }

    void decide(int round, BlockHash blockHash) {
        state.setDecision(blockHash);
        state.setDecisionRound(round);
        setStage(new CommitStage());
    }

    boolean isLocalProposer() {
        return localAddress != null && localAddress.equals(expectedProposer());
    }

    Address expectedProposer() {
        return proposerScheduler.proposerFor(state.getHeight(), state.getRound());
    }

    Optional<Quorum> quorum(int round, VoteType voteType) {
        return votePool.getQuorum(state.getHeight(), round, voteType);
    }

    Optional<Block> findBlock(BlockHash blockHash) {
        return votePool.findBlock(state.getHeight(), blockHash);
    }

    /**
     * Locking rule: precommitting {@code value} in {@code round} is allowed when there is no lock, the lock is on
     * the same value, or the prevote quorum backing it is newer than the locked round.
     */
    boolean canPrecommit(BlockHash value, int round) {
        return !state.isLocked()
                || state.getLockedValue().equals(value)
                || round > state.getLockedRound();
    }

    /**
     * A proposal may be prevoted when its block validates and it does not contradict the lock: either no lock is
     * held, the lock is on the proposed value, or the proposal carries a proof-of-lock round no older than the
     * locked round.
     */
    boolean canPrevote(Proposal proposal) {
        Optional<Block> block = findBlock(proposal.getBlockHash());
        if (block.isEmpty() || !isValid(block.get())) {
            return false;
        }
        if (!state.isLocked() || state.getLockedValue().equals(proposal.getBlockHash())) {
            return true;
        }
        return proposal.hasPolRound() && proposal.getPolRound() >= state.getLockedRound();
    }

    boolean isValid(Block block) {
        return state.getValidatedBlocks().computeIfAbsent(block.getHash(), hash -> {
            try {
                blockExecutor.validateBlock(block);
                return true;
            } catch (InvalidBlockException e) {
                log.log(Level.WARNING, String.format("Invalid block %s at height %d: %s",
                        hash, block.getHeight(), e.getMessage()));
                return false;
            }
        });
    }

    void commitDecision() {
        BlockHash decision = state.getDecision();
        Optional<Block> block = findBlock(decision);
        if (block.isEmpty()) {
            log.fine(String.format("Height %d: waiting for block %s before committing", state.getHeight(), decision));
            return;
        }

        long height = state.getHeight();
        int round = state.getDecisionRound();
        votePool.buildCertificate(height, round, VoteType.PRECOMMIT, decision).ifPresentOrElse(certificate -> {
            log.info(String.format("Committed block %s at height %d in round %d", decision, height, round));
            actions.commit(height, round, block.get(), certificate);
            beginHeight(height + 1);
        }, () -> log.severe(String.format("Precommit quorum for %s at %d/%d disappeared", decision, height, round)));
    }

    private boolean checkCommit() {
        for (int round : votePool.getRounds(state.getHeight())) {
            Optional<Quorum> quorum = quorum(round, VoteType.PRECOMMIT);
            if (quorum.isPresent() && !quorum.get().isNil()) {
                log.fine(String.format("Height %d: precommit quorum for %s in round %d",
                        state.getHeight(), quorum.get().getBlockHash(), round));
                decide(round, quorum.get().getBlockHash());
                return true;
            }
        }
        return false;
    }

    /**
     * Jumps to the highest later round of this height in which validators holding more than one third of the
     * voting power have voted.
     */
    private boolean checkCatchUp() {
        long height = state.getHeight();
        long catchUpPower = validatorSet.totalVotingPower(height) / 3 + 1;

        for (int round : votePool.getRounds(height).tailSet(state.getRound(), false).descendingSet()) {
            if (votePool.getRoundPower(height, round) >= catchUpPower) {
                log.info(String.format("Height %d: catching up from round %d to round %d",
                        height, state.getRound(), round));
                startRound(round);
                return true;
            }
        }
        return false;
    }

    private void releaseLockIfSuperseded(int nextRound) {
        if (!state.isLocked()) {
            return;
        }

        for (int round = nextRound - 1; round > state.getLockedRound(); round--) {
            Optional<Quorum> polka = quorum(round, VoteType.PREVOTE);
            if (polka.isPresent() && !polka.get().isNil()
                    && !Objects.equals(polka.get().getBlockHash(), state.getLockedValue())) {
                log.info(String.format("Height %d: releasing lock on %s from round %d, newer polka for %s in round %d",
                        state.getHeight(), state.getLockedValue(), state.getLockedRound(),
                        polka.get().getBlockHash(), round));
                state.releaseLock();
                if (round > state.getValidRound()) {
                    state.updateValid(polka.get().getBlockHash(), round);
                }
                return;
            }
        }
    }
}
