package com.prozchain.consensus.pool;

import com.prozchain.block.Block;
import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.types.Address;
import com.prozchain.types.BlockHash;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Everything the pool holds for a single height, indexed by round and by validator.
 */
@Getter
class HeightVotes {

    private final long height;
    private final NavigableMap<Integer, RoundVotes> rounds = new TreeMap<>();
    private final Map<Address, List<ConsensusMessage>> byValidator = new LinkedHashMap<>();

    HeightVotes(long height) {
        this.height = height;
    }

    RoundVotes getOrCreateRound(int round) {
        return rounds.computeIfAbsent(round, r -> new RoundVotes(height, r));
    }

    Optional<RoundVotes> getRound(int round) {
        return Optional.ofNullable(rounds.get(round));
    }

    void index(ConsensusMessage message) {
        byValidator.computeIfAbsent(message.getSender(), a -> new ArrayList<>()).add(message);
    }

    Optional<Block> findBlock(BlockHash blockHash) {
        for (RoundVotes roundVotes : rounds.values()) {
            Optional<Block> block = roundVotes.findBlock(blockHash);
            if (block.isPresent()) {
                return block;
            }
        }
        return Optional.empty();
    }

    @Getter
    static class RoundVotes {

        private final VoteSet prevotes;
        private final VoteSet precommits;
        private final Map<Address, Proposal> proposals = new LinkedHashMap<>();
        private final Map<Address, List<Proposal>> proposalConflicts = new LinkedHashMap<>();
        private final Map<Address, Long> participants = new LinkedHashMap<>();

        RoundVotes(long height, int round) {
            this.prevotes = new VoteSet(height, round, VoteType.PREVOTE);
            this.precommits = new VoteSet(height, round, VoteType.PRECOMMIT);
        }

        VoteSet getVoteSet(VoteType voteType) {
            return switch (voteType) {
                case PREVOTE -> prevotes;
                case PRECOMMIT -> precommits;
                default -> throw new IllegalArgumentException("No vote set for " + voteType);
            };
        }

        VoteSet.AddResult addVote(Vote vote, long power) {
            VoteSet.AddResult result = getVoteSet(vote.getVoteType()).add(vote, power);
            if (result == VoteSet.AddResult.ADDED) {
                participants.putIfAbsent(vote.getValidator(), power);
            }
            return result;
        }

        VoteSet.AddResult addProposal(Proposal proposal) {
            Proposal existing = proposals.get(proposal.getProposer());
            if (existing == null) {
                proposals.put(proposal.getProposer(), proposal);
                return VoteSet.AddResult.ADDED;
            }
            if (existing.hasSameContent(proposal)) {
                return VoteSet.AddResult.DUPLICATE;
            }

            List<Proposal> conflicts = proposalConflicts.computeIfAbsent(proposal.getProposer(),
                    a -> new ArrayList<>());
            if (conflicts.stream().anyMatch(p -> p.hasSameContent(proposal))) {
                return VoteSet.AddResult.DUPLICATE;
            }
            conflicts.add(proposal);
            return VoteSet.AddResult.CONFLICT;
        }

        long getParticipantPower() {
            return participants.values().stream().mapToLong(Long::longValue).sum();
        }

        Optional<Block> findBlock(BlockHash blockHash) {
            return proposals.values().stream()
                    .filter(p -> p.getBlockHash().equals(blockHash))
                    .map(Proposal::getBlock)
                    .findFirst()
                    .or(() -> proposalConflicts.values().stream()
                            .flatMap(List::stream)
                            .filter(p -> p.getBlockHash().equals(blockHash))
                            .map(Proposal::getBlock)
                            .findFirst());
        }
    }
}
