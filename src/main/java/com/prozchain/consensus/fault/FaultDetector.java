package com.prozchain.consensus.fault;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.consensus.pool.VotePool;
import com.prozchain.consensus.pool.VotePoolSnapshot;
import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.metrics.ConsensusMetrics;
import com.prozchain.types.Address;
import com.prozchain.validator.Validator;
import com.prozchain.validator.ValidatorSet;
import lombok.extern.java.Log;
import org.javatuples.Pair;
import org.javatuples.Triplet;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;

/**
 * Finds equivocation, double proposals and downtime in the vote pool and hands the resulting evidence to the
 * {@link SlashingModule}. Each piece of evidence is emitted once, however often the same height is rescanned.
 */
@Log
public class FaultDetector {

    private final VotePool votePool;
    private final ValidatorSet validatorSet;
    private final SlashingModule slashingModule;
    private final ConsensusMetrics metrics;
    private final ConsensusConfig config;
    private final Clock clock;

    private final NavigableMap<Long, Set<Evidence>> emittedByHeight = new TreeMap<>();
    private final Map<Address, Integer> absenceStreaks = new HashMap<>();
    private final Set<Address> reportedAbsences = new HashSet<>();
    private final Map<Address, Evidence> pendingAbsences = new HashMap<>();
    private long lastRecordedHeight = -1;

    public FaultDetector(VotePool votePool,
                         ValidatorSet validatorSet,
                         SlashingModule slashingModule,
                         ConsensusMetrics metrics,
                         ConsensusConfig config,
                         Clock clock) {
        this.votePool = votePool;
        this.validatorSet = validatorSet;
        this.slashingModule = slashingModule;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Scans one height for conflicting votes and proposals.
     *
     * @return evidence emitted by this scan, empty when everything found had already been reported
     */
    public synchronized List<Evidence> scan(VotePoolSnapshot snapshot) {
        List<Evidence> found = new ArrayList<>();

        Map<Triplet<Address, Integer, VoteType>, List<Vote>> votesBySlot = new LinkedHashMap<>();
        for (Vote vote : snapshot.getVotes()) {
            votesBySlot.computeIfAbsent(Triplet.with(vote.getValidator(), vote.getRound(), vote.getVoteType()),
                    k -> new ArrayList<>()).add(vote);
        }
        votesBySlot.values().forEach(votes -> conflictingPairs(votes).forEach(pair ->
                found.add(equivocation(pair.getValue0(), pair.getValue1()))));

        Map<Pair<Address, Integer>, List<Proposal>> proposalsBySlot = new LinkedHashMap<>();
        for (Proposal proposal : snapshot.getProposals()) {
            proposalsBySlot.computeIfAbsent(Pair.with(proposal.getProposer(), proposal.getRound()),
                    k -> new ArrayList<>()).add(proposal);
        }
        proposalsBySlot.values().forEach(proposals -> conflictingPairs(proposals).forEach(pair ->
                found.add(doubleProposal(pair.getValue0(), pair.getValue1()))));

        return emitAll(found);
    }

    /**
     * Records who precommitted at a committed height and reports validators whose absence streak went past the
     * configured number of heights. One evidence is emitted per streak; a streak counts as reported only once the
     * slashing module accepted its evidence.
     */
    public synchronized List<Evidence> recordCommittedHeight(long height) {
        if (height <= lastRecordedHeight) {
            return List.of();
        }
        lastRecordedHeight = height;

        Set<Address> participants = votePool.getPrecommitters(height);
        List<Validator> validators = validatorSet.currentValidators(height);
        Set<Address> active = new HashSet<>();

        List<Evidence> found = new ArrayList<>();
        for (Validator validator : validators) {
            Address address = validator.getAddress();
            active.add(address);

            if (participants.contains(address)) {
                absenceStreaks.remove(address);
                reportedAbsences.remove(address);
                pendingAbsences.remove(address);
                continue;
            }

            int streak = absenceStreaks.merge(address, 1, Integer::sum);
            if (streak > config.getDowntimeHeights() && !reportedAbsences.contains(address)) {
                pendingAbsences.remove(address);
                found.add(Evidence.builder()
                        .kind(EvidenceKind.DOWNTIME)
                        .validator(address)
                        .height(height)
                        .round(-1)
                        .missedHeights(streak)
                        .timestamp(clock.instant())
                        .build());
            }
        }

        absenceStreaks.keySet().retainAll(active);
        reportedAbsences.retainAll(active);
        pendingAbsences.keySet().retainAll(active);
        return emitDowntime(found);
    }

    /**
     * Retries downtime evidence the slashing module refused earlier.
     */
    public synchronized List<Evidence> retryPendingDowntime() {
        if (pendingAbsences.isEmpty()) {
            return List.of();
        }
        List<Evidence> pending = new ArrayList<>(pendingAbsences.values());
        pendingAbsences.clear();
        return emitDowntime(pending);
    }

    private List<Evidence> emitDowntime(List<Evidence> candidates) {
        List<Evidence> emitted = emitAll(candidates);
        for (Evidence evidence : candidates) {
            if (emitted.contains(evidence)) {
                reportedAbsences.add(evidence.getValidator());
            } else {
                pendingAbsences.put(evidence.getValidator(), evidence);
            }
        }
        return emitted;
    }

    /**
     * Rescans every height retained by the vote pool and retries refused downtime evidence.
     */
    @Scheduled(fixedDelayString = "${consensus.fault.scan-period-ms:5000}")
    public void scanRetainedHeights() {
        for (long height : votePool.getRetainedHeights()) {
            scan(votePool.snapshot(height));
        }
        retryPendingDowntime();
        forgetBefore(votePool.getCurrentHeight() - config.getEvidenceWindowHeights());
    }

    private synchronized void forgetBefore(long height) {
        emittedByHeight.headMap(height, false).clear();
    }

    private <T extends ConsensusMessage> List<Pair<T, T>> conflictingPairs(List<T> messages) {
        if (messages.size() < 2) {
            return List.of();
        }

        T first = messages.get(0);
        List<Pair<T, T>> pairs = new ArrayList<>();
        for (T other : messages.subList(1, messages.size())) {
            if (!first.hasSameContent(other)) {
                pairs.add(Pair.with(first, other));
            }
        }
        return pairs;
    }

    private Evidence equivocation(Vote first, Vote second) {
        return Evidence.builder()
                .kind(EvidenceKind.EQUIVOCATION)
                .validator(first.getValidator())
                .height(first.getHeight())
                .round(first.getRound())
                .voteType(first.getVoteType())
                .first(first)
                .second(second)
                .timestamp(clock.instant())
                .build();
    }

    private Evidence doubleProposal(Proposal first, Proposal second) {
        return Evidence.builder()
                .kind(EvidenceKind.DOUBLE_PROPOSAL)
                .validator(first.getProposer())
                .height(first.getHeight())
                .round(first.getRound())
                .first(first)
                .second(second)
                .timestamp(clock.instant())
                .build();
    }

    private List<Evidence> emitAll(List<Evidence> candidates) {
        List<Evidence> emitted = new ArrayList<>();
        for (Evidence evidence : candidates) {
            Set<Evidence> known = emittedByHeight.computeIfAbsent(evidence.getHeight(), h -> new HashSet<>());
            if (known.contains(evidence)) {
                continue;
            }

            try {
                slashingModule.submitEvidence(evidence);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Slashing module refused evidence " + evidence + ", retrying on next scan", e);
                continue;
            }

            known.add(evidence);
            emitted.add(evidence);
            metrics.onEvidence(evidence.getKind().name());
            log.warning("Emitted evidence " + evidence);
        }
        return emitted;
    }
}
