package com.prozchain.consensus.state;

import com.prozchain.types.BlockHash;
import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Value;

/**
 * Local safety state written on every round change and commit, and read back on restart.
 */
@Value
@Builder
public class PersistedConsensusState {

    /**
     * Last committed height, or one less than the initial height when nothing has been committed.
     */
    long lastCommittedHeight;
    long height;
    int round;
    @Nullable
    BlockHash lockedValue;
    @Builder.Default
    int lockedRound = RoundState.NO_ROUND;
}
