package com.prozchain.consensus.state;

import com.prozchain.consensus.vote.Proposal;
import com.prozchain.types.BlockHash;
import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of the height being decided. Owned by the consensus thread; votes themselves live in the
 * vote pool.
 */
@Getter
@Setter
public class RoundState {

    public static final int NO_ROUND = -1;

    private final long height;
    private int round;
    private Step step = Step.PROPOSE;

    /**
     * Proposal accepted for the current round. Null until one from the expected proposer has been seen.
     */
    @Nullable
    private Proposal proposal;

    @Nullable
    private BlockHash lockedValue;
    private int lockedRound = NO_ROUND;

    @Nullable
    private BlockHash validValue;
    private int validRound = NO_ROUND;

    /**
     * Hash that reached a precommit quorum, set on entering {@link Step#COMMIT}.
     */
    @Nullable
    private BlockHash decision;
    private int decisionRound = NO_ROUND;

    private final Map<Step, Instant> deadlines = new EnumMap<>(Step.class);
    private final Map<BlockHash, Boolean> validatedBlocks = new HashMap<>();

    public RoundState(long height) {
        this.height = height;
    }

    public void lock(BlockHash value, int round) {
        this.lockedValue = value;
        this.lockedRound = round;
    }

    public void releaseLock() {
        this.lockedValue = null;
        this.lockedRound = NO_ROUND;
    }

    public void updateValid(BlockHash value, int round) {
        this.validValue = value;
        this.validRound = round;
    }

    public boolean isLocked() {
        return lockedValue != null;
    }

    public Optional<Instant> getDeadline(Step step) {
        return Optional.ofNullable(deadlines.get(step));
    }

    public void setDeadline(Step step, Instant deadline) {
        deadlines.put(step, deadline);
    }

    /**
     * Moves to a new round of the same height; lock and valid value carry over.
     */
    public void enterRound(int round) {
        this.round = round;
        this.step = Step.PROPOSE;
        this.proposal = null;
        this.deadlines.clear();
    }

    @Override
    public String toString() {
        return String.format("RoundState{h=%d, r=%d, step=%s, locked=%s@%d, valid=%s@%d}",
                height, round, step, lockedValue, lockedRound, validValue, validRound);
    }
}
