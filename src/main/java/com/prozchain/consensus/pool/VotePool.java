package com.prozchain.consensus.pool;

import com.prozchain.block.Block;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.QuorumCertificate;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.types.Address;
import com.prozchain.types.BlockHash;
import com.prozchain.validator.Validator;
import com.prozchain.validator.ValidatorSet;
import lombok.extern.java.Log;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Validates, stores and indexes proposals and votes, and answers quorum queries over them.
 * <p>
 * Writes are serialised through the write lock; queries take the read lock. The first valid vote of a validator
 * for a (height, round, type) is the one counted. A later differing vote is stored as a conflict for the fault
 * detector and never counted. Resubmitting a message with identical content is a no-op.
 */
@Log
public class VotePool {

    private final ValidatorSet validatorSet;
    private final MessageValidator messageValidator;
    private final ConsensusConfig config;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final NavigableMap<Long, HeightVotes> heights = new TreeMap<>();

    private long currentHeight;
    private int currentRound;

    public VotePool(ValidatorSet validatorSet, MessageValidator messageValidator, ConsensusConfig config) {
        this.validatorSet = validatorSet;
        this.messageValidator = messageValidator;
        this.config = config;
        this.currentHeight = config.getInitialHeight();
    }

    /**
     * Threshold for a super-majority: two thirds of the total weight, rounded up. For a total of 10 this is 7,
     * for a total of 6 it is 4.
     */
    public static long quorumThreshold(long totalPower) {
        return (2 * totalPower + 2) / 3;
    }

    public SubmitResult submit(ConsensusMessage message) {
        Optional<RejectReason> rejection = precheck(message);
        if (rejection.isPresent()) {
            return reject(message, rejection.get());
        }
        if (!messageValidator.verifySignature(message)) {
            return reject(message, RejectReason.INVALID_SIGNATURE);
        }
        return checkProposerAndStore(message);
    }

    /**
     * Same as {@link #submit} for a message whose signature has already been verified.
     */
    public SubmitResult submitVerified(ConsensusMessage message) {
        Optional<RejectReason> rejection = precheck(message);
        if (rejection.isPresent()) {
            return reject(message, rejection.get());
        }
        return checkProposerAndStore(message);
    }

    private Optional<RejectReason> precheck(ConsensusMessage message) {
        Optional<RejectReason> structural = messageValidator.checkStructure(message);
        if (structural.isPresent()) {
            return structural;
        }
        return read(() -> checkWindow(message));
    }

    private SubmitResult checkProposerAndStore(ConsensusMessage message) {
        Optional<RejectReason> wrongProposer = messageValidator.checkProposer(message);
        if (wrongProposer.isPresent()) {
            return reject(message, wrongProposer.get());
        }
        return store(message);
    }

    public boolean verifySignature(ConsensusMessage message) {
        return messageValidator.verifySignature(message);
    }

    private SubmitResult store(ConsensusMessage message) {
        lock.writeLock().lock();
        try {
            Optional<RejectReason> outOfWindow = checkWindow(message);
            if (outOfWindow.isPresent()) {
                return reject(message, outOfWindow.get());
            }

            HeightVotes heightVotes = heights.computeIfAbsent(message.getHeight(), HeightVotes::new);
            HeightVotes.RoundVotes roundVotes = heightVotes.getOrCreateRound(message.getRound());

            VoteSet.AddResult result;
            if (message instanceof Vote vote) {
                result = roundVotes.addVote(vote, votingPowerOf(vote));
            } else {
                result = roundVotes.addProposal((Proposal) message);
            }

            switch (result) {
                case DUPLICATE -> {
                    log.fine("Duplicate " + message);
                    return SubmitResult.duplicate();
                }
                case CONFLICT -> {
                    heightVotes.index(message);
                    log.warning("Conflicting message stored as evidence: " + message);
                    return SubmitResult.conflicting();
                }
                default -> {
                    heightVotes.index(message);
                    log.fine("Accepted " + message);
                    return SubmitResult.accepted();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Optional<RejectReason> checkWindow(ConsensusMessage message) {
        long oldestHeight = Math.max(0, currentHeight - config.getEvidenceWindowHeights());
        if (message.getHeight() < oldestHeight || message.getHeight() > currentHeight + config.getFutureHeights()) {
            return Optional.of(RejectReason.HEIGHT_OUT_OF_WINDOW);
        }
        if (message.getRound() > highestAcceptedRound(message.getHeight())) {
            return Optional.of(RejectReason.ROUND_OUT_OF_WINDOW);
        }
        return Optional.empty();
    }

    /**
     * Rounds are bounded relative to the current round at the current height, to the highest round already held
     * for an older height, and to round 0 for a future height.
     */
    private long highestAcceptedRound(long height) {
        long base = 0;
        if (height == currentHeight) {
            base = currentRound;
        } else if (height < currentHeight) {
            HeightVotes heightVotes = heights.get(height);
            if (heightVotes != null && !heightVotes.getRounds().isEmpty()) {
                base = heightVotes.getRounds().lastKey();
            }
        }
        return base + config.getFutureRounds();
    }

    private long votingPowerOf(Vote vote) {
        return validatorSet.findValidator(vote.getHeight(), vote.getValidator())
                .map(Validator::getVotingPower)
                .orElse(0L);
    }

    private SubmitResult reject(ConsensusMessage message, RejectReason reason) {
        log.warning(String.format("Rejected %s: %s", message, reason));
        return SubmitResult.rejected(reason);
    }

    /**
     * Moves the acceptance window. The window never moves backwards.
     */
    public void advanceTo(long height, int round) {
        lock.writeLock().lock();
        try {
            if (height > currentHeight) {
                currentHeight = height;
                currentRound = round;
            } else if (height == currentHeight && round > currentRound) {
                currentRound = round;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops every height older than the evidence window.
     */
    public void prune() {
        lock.writeLock().lock();
        try {
            long oldestRetained = currentHeight - config.getEvidenceWindowHeights();
            NavigableMap<Long, HeightVotes> expired = heights.headMap(oldestRetained, false);
            if (!expired.isEmpty()) {
                log.fine(String.format("Pruning %d heights below %d", expired.size(), oldestRetained));
                expired.clear();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long getQuorumThreshold(long height) {
        return quorumThreshold(validatorSet.totalVotingPower(height));
    }

    /**
     * Sums the voting power per block hash, nil being its own bucket, and returns the bucket holding at least
     * two thirds of the total voting power, if any.
     */
    public Optional<Quorum> getQuorum(long height, int round, VoteType voteType) {
        long threshold = getQuorumThreshold(height);
        return read(() -> findVoteSet(height, round, voteType)
                .flatMap(voteSet -> voteSet.getQuorum(threshold)));
    }

    public long getTotalPower(long height, int round, VoteType voteType) {
        return read(() -> findVoteSet(height, round, voteType)
                .map(VoteSet::getTotalPower)
                .orElse(0L));
    }

    public long getPowerFor(long height, int round, VoteType voteType, BlockHash blockHash) {
        return read(() -> findVoteSet(height, round, voteType)
                .map(voteSet -> voteSet.getPowerFor(blockHash))
                .orElse(0L));
    }

    /**
     * Power of the distinct validators with a counted vote of any type in the round.
     */
    public long getRoundPower(long height, int round) {
        return read(() -> findRound(height, round)
                .map(HeightVotes.RoundVotes::getParticipantPower)
                .orElse(0L));
    }

    /**
     * Rounds of the height for which the pool holds any message.
     */
    public NavigableSet<Integer> getRounds(long height) {
        return read(() -> {
            HeightVotes heightVotes = heights.get(height);
            return heightVotes == null ? new TreeSet<>() : new TreeSet<>(heightVotes.getRounds().keySet());
        });
    }

    public Optional<Proposal> getProposal(long height, int round, Address proposer) {
        return read(() -> findRound(height, round)
                .map(r -> r.getProposals().get(proposer)));
    }

    public Optional<Block> findBlock(long height, BlockHash blockHash) {
        return read(() -> Optional.ofNullable(heights.get(height))
                .flatMap(h -> h.findBlock(blockHash)));
    }

    /**
     * Builds a certificate from the counted votes for {@code blockHash}, if they form a quorum.
     */
    public Optional<QuorumCertificate> buildCertificate(long height, int round, VoteType voteType,
                                                        BlockHash blockHash) {
        long threshold = getQuorumThreshold(height);
        return read(() -> findVoteSet(height, round, voteType)
                .filter(voteSet -> voteSet.getPowerFor(blockHash) >= threshold)
                .map(voteSet -> new QuorumCertificate(height, round, voteType, blockHash,
                        voteSet.getVotesFor(blockHash), voteSet.getPowerFor(blockHash))));
    }

    /**
     * Validators with a counted precommit in any round of the height.
     */
    public Set<Address> getPrecommitters(long height) {
        return read(() -> Optional.ofNullable(heights.get(height))
                .map(this::collectPrecommitters)
                .orElseGet(Set::of));
    }

    public List<ConsensusMessage> getMessagesFrom(long height, Address validator) {
        return read(() -> Optional.ofNullable(heights.get(height))
                .map(h -> h.getByValidator().getOrDefault(validator, List.of()))
                .map(List::copyOf)
                .orElseGet(List::of));
    }

    public VotePoolSnapshot snapshot(long height) {
        return read(() -> {
            HeightVotes heightVotes = heights.get(height);
            if (heightVotes == null) {
                return new VotePoolSnapshot(height, List.of(), List.of(), Set.of());
            }

            List<Vote> votes = new ArrayList<>();
            List<Proposal> proposals = new ArrayList<>();
            heightVotes.getByValidator().values().forEach(messages -> messages.forEach(message -> {
                if (message instanceof Vote vote) {
                    votes.add(vote);
                } else {
                    proposals.add((Proposal) message);
                }
            }));
            return new VotePoolSnapshot(height, votes, proposals, collectPrecommitters(heightVotes));
        });
    }

    public NavigableSet<Long> getRetainedHeights() {
        return read(() -> new TreeSet<>(heights.keySet()));
    }

    public long getCurrentHeight() {
        return read(() -> currentHeight);
    }

    public int getCurrentRound() {
        return read(() -> currentRound);
    }

    private Set<Address> collectPrecommitters(HeightVotes heightVotes) {
        Set<Address> precommitters = new HashSet<>();
        heightVotes.getRounds().values()
                .forEach(r -> precommitters.addAll(r.getPrecommits().getVotes().keySet()));
        return precommitters;
    }

    private Optional<HeightVotes.RoundVotes> findRound(long height, int round) {
        return Optional.ofNullable(heights.get(height))
                .flatMap(h -> h.getRound(round));
    }

    private Optional<VoteSet> findVoteSet(long height, int round, VoteType voteType) {
        return findRound(height, round).map(r -> r.getVoteSet(voteType));
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
