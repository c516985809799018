package com.prozchain.consensus.round;

import com.prozchain.block.Block;
import com.prozchain.consensus.vote.QuorumCertificate;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.types.BlockHash;
import jakarta.annotation.Nullable;

/**
 * Effects requested by the {@link RoundStateMachine}. Implementations must not call back into the machine.
 */
public interface RoundActions {

    void onNewRound(long height, int round);

    /**
     * Invoked when the local node is the proposer of (height, round).
     *
     * @param validValue block to re-propose, null when a fresh block should be built
     * @param validRound round of the prevote quorum for {@code validValue}, -1 if none
     */
    void propose(long height, int round, @Nullable BlockHash validValue, int validRound);

    /**
     * Signs and broadcasts a vote. A null {@code blockHash} is a nil vote.
     */
    void broadcastVote(long height, int round, VoteType voteType, @Nullable BlockHash blockHash);

    void commit(long height, int round, Block block, QuorumCertificate certificate);
}
