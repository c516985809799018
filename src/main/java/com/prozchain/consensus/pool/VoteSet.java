package com.prozchain.consensus.pool;

import com.prozchain.consensus.vote.Vote;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.types.Address;
import com.prozchain.types.BlockHash;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Votes of one (height, round, type). Only the first vote of each validator is counted; later differing votes
 * are kept aside as conflicts.
 */
@Getter
class VoteSet {

    enum AddResult {
        ADDED,
        DUPLICATE,
        CONFLICT
    }

    private final long height;
    private final int round;
    private final VoteType voteType;

    private final Map<Address, Vote> votes = new LinkedHashMap<>();
    private final Map<Address, List<Vote>> conflicts = new LinkedHashMap<>();

    private final Map<BlockHash, Long> powerByHash = new HashMap<>();
    private long nilPower;
    private long totalPower;

    VoteSet(long height, int round, VoteType voteType) {
        this.height = height;
        this.round = round;
        this.voteType = voteType;
    }

    AddResult add(Vote vote, long power) {
        Vote counted = votes.get(vote.getValidator());
        if (counted == null) {
            votes.put(vote.getValidator(), vote);
            if (vote.isNil()) {
                nilPower += power;
            } else {
                powerByHash.merge(vote.getBlockHash(), power, Long::sum);
            }
            totalPower += power;
            return AddResult.ADDED;
        }

        if (counted.hasSameContent(vote)) {
            return AddResult.DUPLICATE;
        }

        List<Vote> validatorConflicts = conflicts.computeIfAbsent(vote.getValidator(), a -> new ArrayList<>());
        if (validatorConflicts.stream().anyMatch(v -> v.hasSameContent(vote))) {
            return AddResult.DUPLICATE;
        }
        validatorConflicts.add(vote);
        return AddResult.CONFLICT;
    }

    Optional<Quorum> getQuorum(long threshold) {
        if (nilPower >= threshold) {
            return Optional.of(new Quorum(null, nilPower));
        }
        return powerByHash.entrySet().stream()
                .filter(e -> e.getValue() >= threshold)
                .findFirst()
                .map(e -> new Quorum(e.getKey(), e.getValue()));
    }

    long getPowerFor(BlockHash blockHash) {
        if (blockHash == null) {
            return nilPower;
        }
        return powerByHash.getOrDefault(blockHash, 0L);
    }

    List<Vote> getVotesFor(BlockHash blockHash) {
        return votes.values().stream()
                .filter(v -> Objects.equals(v.getBlockHash(), blockHash))
                .toList();
    }
}
