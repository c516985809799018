package com.prozchain.consensus.pool;

import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.types.Address;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Immutable copy of what the pool holds for one height, in arrival order. Conflicting messages are included.
 */
@Value
public class VotePoolSnapshot {

    long height;
    List<Vote> votes;
    List<Proposal> proposals;
    /**
     * Validators with a counted precommit in any round of the height.
     */
    Set<Address> precommitters;

    public VotePoolSnapshot(long height, List<Vote> votes, List<Proposal> proposals, Set<Address> precommitters) {
        this.height = height;
        this.votes = List.copyOf(votes);
        this.proposals = List.copyOf(proposals);
        this.precommitters = Set.copyOf(precommitters);
    }
}
