package com.prozchain.consensus;

import com.prozchain.block.Block;
import com.prozchain.block.BlockExecutor;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.consensus.fault.FaultDetector;
import com.prozchain.consensus.pool.RejectReason;
import com.prozchain.consensus.pool.SubmitResult;
import com.prozchain.consensus.pool.VotePool;
import com.prozchain.consensus.proposer.ProposerScheduler;
import com.prozchain.consensus.round.RoundActions;
import com.prozchain.consensus.round.RoundStateMachine;
import com.prozchain.consensus.round.RoundTimeouts;
import com.prozchain.consensus.state.ConsensusStateStore;
import com.prozchain.consensus.state.PersistedConsensusState;
import com.prozchain.consensus.state.RoundState;
import com.prozchain.consensus.state.Step;
import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.QuorumCertificate;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.crypto.Signer;
import com.prozchain.exception.StateCorruptionException;
import com.prozchain.metrics.ConsensusMetrics;
import com.prozchain.network.NetworkService;
import com.prozchain.network.protocol.consensus.codec.SigningPayloadWriter;
import com.prozchain.storage.block.BlockStore;
import com.prozchain.types.Address;
import com.prozchain.types.BlockHash;
import com.prozchain.types.Signature;
import com.prozchain.validator.ValidatorSet;
import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.extern.java.Log;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;

/**
 * Orchestrates the consensus core: feeds messages into the {@link VotePool}, lets the {@link RoundStateMachine}
 * react, and carries out what the machine decides against the network, the block executor and the block store.
 */
@Log
public class ConsensusDriver implements RoundActions {

    private final ConsensusConfig config;
    private final ValidatorSet validatorSet;
    private final VotePool votePool;
    private final FaultDetector faultDetector;
    private final BlockExecutor blockExecutor;
    private final BlockStore blockStore;
    private final NetworkService network;
    private final Signer signer;
    private final SigningPayloadWriter signingPayloadWriter;
    private final ConsensusStateStore stateStore;
    private final ConsensusMetrics metrics;
    private final Clock clock;

    @Getter
    private final Address localAddress;
    @Getter
    private final RoundStateMachine stateMachine;

    private final List<HeightCommittedListener> listeners = new CopyOnWriteArrayList<>();

    @Getter
    private long lastCommittedHeight;
    @Getter
    private boolean started;

    public ConsensusDriver(ConsensusConfig config,
                           ValidatorSet validatorSet,
                           VotePool votePool,
                           ProposerScheduler proposerScheduler,
                           FaultDetector faultDetector,
                           BlockExecutor blockExecutor,
                           BlockStore blockStore,
                           NetworkService network,
                           Signer signer,
                           ConsensusStateStore stateStore,
                           ConsensusMetrics metrics,
                           Clock clock) {
        this.config = config;
        this.validatorSet = validatorSet;
        this.votePool = votePool;
        this.faultDetector = faultDetector;
        this.blockExecutor = blockExecutor;
        this.blockStore = blockStore;
        this.network = network;
        this.signer = signer;
        this.signingPayloadWriter = new SigningPayloadWriter(config.getChainId());
        this.stateStore = stateStore;
        this.metrics = metrics;
        this.clock = clock;

        this.localAddress = Address.fromPublicKey(signer.getPublicKey());
        this.lastCommittedHeight = config.getInitialHeight() - 1;
        this.stateMachine = new RoundStateMachine(votePool, proposerScheduler, validatorSet, blockExecutor,
                new RoundTimeouts(config), this, localAddress);
    }

    /**
     * Loads the persisted safety state and starts deciding the next height.
     *
     * @throws StateCorruptionException when the persisted state disagrees with the block store
     */
    public synchronized void start() {
        if (started) {
            return;
        }

        long storedHeight = blockStore.getLatestCommittedHeight().orElse(config.getInitialHeight() - 1);
        Optional<PersistedConsensusState> persisted = stateStore.load();
        Instant now = clock.instant();

        if (persisted.isEmpty()) {
            lastCommittedHeight = storedHeight;
            started = true;
            log.info(String.format("Starting consensus of %s at height %d", localAddress, storedHeight + 1));
            votePool.advanceTo(storedHeight + 1, 0);
            stateMachine.startHeight(storedHeight + 1, now);
            return;
        }

        PersistedConsensusState state = persisted.get();
        if (state.getLastCommittedHeight() + 1 == storedHeight && state.getHeight() == storedHeight) {
            // stopped between storing the block and persisting the round state
            log.info(String.format("Block %d was stored before the crash, resuming consensus at height %d",
                    storedHeight, storedHeight + 1));
            lastCommittedHeight = storedHeight;
            started = true;
            votePool.advanceTo(storedHeight + 1, 0);
            stateMachine.startHeight(storedHeight + 1, now);
            return;
        }
        if (state.getLastCommittedHeight() != storedHeight) {
            log.log(Level.SEVERE, String.format("Persisted committed height %d does not match block store height %d",
                    state.getLastCommittedHeight(), storedHeight));
            throw new StateCorruptionException(String.format(
                    "Persisted committed height %d does not match block store height %d",
                    state.getLastCommittedHeight(), storedHeight));
        }

        lastCommittedHeight = state.getLastCommittedHeight();
        started = true;
        votePool.advanceTo(state.getHeight(), state.getRound() + 1);
        stateMachine.restore(state, now);
    }

    /**
     * Validates and stores an inbound message, then lets the state machine react to it.
     */
    public synchronized SubmitResult handleMessage(ConsensusMessage message) {
        return afterSubmit(message, votePool.submit(message));
    }

    /**
     * Same as {@link #handleMessage} for a message whose signature was verified upstream.
     */
    public synchronized SubmitResult handleVerifiedMessage(ConsensusMessage message) {
        return afterSubmit(message, votePool.submitVerified(message));
    }

    public synchronized void onInvalidSignature(ConsensusMessage message) {
        log.warning("Dropped message with invalid signature: " + message);
        metrics.onRejected(RejectReason.INVALID_SIGNATURE.name());
    }

    /**
     * Fires expired step timeouts.
     */
    public synchronized void tick(Instant now) {
        if (!started) {
            return;
        }
        stateMachine.tick(now);
    }

    public void addHeightCommittedListener(HeightCommittedListener listener) {
        listeners.add(listener);
    }

    public synchronized long getHeight() {
        return stateMachine.getHeight();
    }

    public synchronized int getRound() {
        return stateMachine.getRound();
    }

    public synchronized Step getStep() {
        return stateMachine.getStep();
    }

    private SubmitResult afterSubmit(ConsensusMessage message, SubmitResult result) {
        if (result.isRejected()) {
            metrics.onRejected(result.getReason().name());
            return result;
        }
        if (result.isDuplicate()) {
            return result;
        }

        if (result.isConflicting()) {
            faultDetector.scan(votePool.snapshot(message.getHeight()));
        }
        if (started) {
            stateMachine.process(clock.instant());
        }
        return result;
    }

    @Override
    public void onNewRound(long height, int round) {
        votePool.advanceTo(height, round);
        metrics.onRound(height, round);
        if (metrics.isLivenessAlertRaised()) {
            log.warning(String.format("Height %d has not committed after %d rounds", height, round));
        }
        persistState();
    }

    @Override
    public void propose(long height, int round, @Nullable BlockHash validValue, int validRound) {
        if (!isValidator(height)) {
            return;
        }

        Block block = null;
        int polRound = Proposal.NO_POL_ROUND;
        if (validValue != null) {
            block = votePool.findBlock(height, validValue).orElse(null);
            if (block != null) {
                polRound = validRound;
            } else {
                log.fine("Valid value " + validValue + " is no longer available, building a new block");
            }
        }

        if (block == null) {
            try {
                block = blockExecutor.proposeBlock(height);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, String.format("Could not build a block for height %d round %d",
                        height, round), e);
                return;
            }
            if (block == null) {
                log.warning(String.format("Block executor built no block for height %d", height));
                return;
            }
        }

        Proposal unsigned = Proposal.builder()
                .height(height)
                .round(round)
                .blockHash(block.getHash())
                .proposer(localAddress)
                .polRound(polRound)
                .block(block)
                .signature(Signature.empty())
                .build();
        Proposal proposal = unsigned.toBuilder()
                .signature(signer.sign(signingPayloadWriter.payload(unsigned)))
                .build();

        log.info(String.format("Proposing %s at height %d round %d (polRound %d)",
                block.getHash(), height, round, polRound));
        SubmitResult result = votePool.submitVerified(proposal);
        if (result.isRejected()) {
            log.warning("Own proposal rejected: " + result);
            return;
        }
        network.broadcast(proposal);
    }

    @Override
    public void broadcastVote(long height, int round, VoteType voteType, @Nullable BlockHash blockHash) {
        if (!isValidator(height)) {
            return;
        }
        if (voteType == VoteType.PRECOMMIT) {
            persistState();
        }

        Vote unsigned = Vote.builder()
                .height(height)
                .round(round)
                .voteType(voteType)
                .blockHash(blockHash)
                .validator(localAddress)
                .signature(Signature.empty())
                .build();
        Vote vote = unsigned.toBuilder()
                .signature(signer.sign(signingPayloadWriter.payload(unsigned)))
                .build();

        log.fine("Voting " + vote);
        votePool.submitVerified(vote);
        network.broadcast(vote);
    }

    @Override
    public void commit(long height, int round, Block block, QuorumCertificate certificate) {
        blockStore.storeCommitted(height, block.getHash(), certificate);
        lastCommittedHeight = height;
        metrics.onCommit(round);

        for (HeightCommittedListener listener : listeners) {
            try {
                listener.onHeightCommitted(height, block, certificate);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Height committed listener failed", e);
            }
        }

        faultDetector.recordCommittedHeight(height);
        votePool.advanceTo(height + 1, 0);
        votePool.prune();
    }

    private void persistState() {
        RoundState state = stateMachine.getState();
        stateStore.save(PersistedConsensusState.builder()
                .lastCommittedHeight(lastCommittedHeight)
                .height(state.getHeight())
                .round(state.getRound())
                .lockedValue(state.getLockedValue())
                .lockedRound(state.getLockedRound())
                .build());
    }

    private boolean isValidator(long height) {
        return validatorSet.findValidator(height, localAddress).isPresent();
    }
}
