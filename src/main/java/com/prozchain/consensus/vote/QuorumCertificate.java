package com.prozchain.consensus.vote;

import com.prozchain.types.BlockHash;
import lombok.Value;

import java.util.List;

/**
 * Votes of a single (height, round, type) for one block hash whose combined power reaches two thirds of the
 * total voting power at that height.
 */
@Value
public class QuorumCertificate {

    long height;
    int round;
    VoteType voteType;
    BlockHash blockHash;
    List<Vote> votes;
    long power;

    public QuorumCertificate(long height, int round, VoteType voteType, BlockHash blockHash,
                             List<Vote> votes, long power) {
        this.height = height;
        this.round = round;
        this.voteType = voteType;
        this.blockHash = blockHash;
        this.votes = List.copyOf(votes);
        this.power = power;
    }
}
