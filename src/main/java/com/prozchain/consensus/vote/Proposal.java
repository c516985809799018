package com.prozchain.consensus.vote;

import com.prozchain.block.Block;
import com.prozchain.types.Address;
import com.prozchain.types.BlockHash;
import com.prozchain.types.Signature;
import lombok.Builder;
import lombok.Value;

/**
 * Proposal of a block for (height, round). A {@code polRound} of {@value #NO_POL_ROUND} means the proposer
 * claims no earlier prevote quorum for the block.
 */
@Value
@Builder(toBuilder = true)
public class Proposal implements ConsensusMessage {

    public static final int NO_POL_ROUND = -1;

    long height;
    int round;
    BlockHash blockHash;
    Address proposer;
    @Builder.Default
    int polRound = NO_POL_ROUND;
    Block block;
    Signature signature;

    public boolean hasPolRound() {
        return polRound != NO_POL_ROUND;
    }

    @Override
    public MessageType getType() {
        return MessageType.PROPOSAL;
    }

    @Override
    public Address getSender() {
        return proposer;
    }

    @Override
    public boolean hasSameContent(ConsensusMessage other) {
        if (!(other instanceof Proposal proposal)) {
            return false;
        }
        return height == proposal.height
                && round == proposal.round
                && polRound == proposal.polRound
                && blockHash.equals(proposal.blockHash)
                && proposer.equals(proposal.proposer);
    }

    @Override
    public String toString() {
        return String.format("PROPOSAL{h=%d, r=%d, hash=%s, polRound=%d, from=%s}",
                height, round, blockHash, polRound, proposer);
    }
}
