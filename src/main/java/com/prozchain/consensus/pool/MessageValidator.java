package com.prozchain.consensus.pool;

import com.prozchain.consensus.proposer.ProposerScheduler;
import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.crypto.Signer;
import com.prozchain.exception.ValidatorSetException;
import com.prozchain.network.protocol.consensus.codec.SigningPayloadWriter;
import com.prozchain.validator.Validator;
import com.prozchain.validator.ValidatorSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;

import java.util.Optional;

/**
 * Stateless checks on inbound consensus messages. Safe to call from any thread.
 */
@Log
@RequiredArgsConstructor
public class MessageValidator {

    private final ValidatorSet validatorSet;
    private final ProposerScheduler proposerScheduler;
    private final Signer signer;
    private final SigningPayloadWriter signingPayloadWriter;

    /**
     * Checks well-formedness, validator set membership and, for proposals, the block hash. The expected proposer
     * is checked separately by {@link #checkProposer}.
     *
     * @return the reason to reject the message, empty if it passes
     */
    public Optional<RejectReason> checkStructure(ConsensusMessage message) {
        if (message.getSender() == null || message.getSignature() == null
                || message.getHeight() < 0 || message.getRound() < 0) {
            return Optional.of(RejectReason.MALFORMED);
        }

        if (message instanceof Vote vote && (vote.getVoteType() == null || vote.getVoteType() == VoteType.UNKNOWN)) {
            return Optional.of(RejectReason.MALFORMED);
        }

        if (findSigner(message).isEmpty()) {
            return Optional.of(RejectReason.UNKNOWN_VALIDATOR);
        }

        if (message instanceof Proposal proposal) {
            return checkProposal(proposal);
        }
        return Optional.empty();
    }

    private Optional<RejectReason> checkProposal(Proposal proposal) {
        if (proposal.getBlock() == null || proposal.getBlockHash() == null) {
            return Optional.of(RejectReason.MALFORMED);
        }
        if (proposal.getPolRound() < Proposal.NO_POL_ROUND || proposal.getPolRound() >= proposal.getRound()) {
            return Optional.of(RejectReason.MALFORMED);
        }
        if (proposal.getBlock().getHeight() != proposal.getHeight()
                || !proposal.getBlock().getHash().equals(proposal.getBlockHash())) {
            return Optional.of(RejectReason.BLOCK_HASH_MISMATCH);
        }
        return Optional.empty();
    }

    /**
     * Checks that a proposal comes from the proposer scheduled for its height and round. Votes always pass.
     * Replaying the schedule can be costly, so this runs after the window and signature checks.
     */
    public Optional<RejectReason> checkProposer(ConsensusMessage message) {
        if (!(message instanceof Proposal proposal)) {
            return Optional.empty();
        }
        try {
            if (!proposerScheduler.proposerFor(proposal.getHeight(), proposal.getRound())
                    .equals(proposal.getProposer())) {
                return Optional.of(RejectReason.WRONG_PROPOSER);
            }
        } catch (IllegalArgumentException e) {
            return Optional.of(RejectReason.MALFORMED);
        }
        return Optional.empty();
    }

    /**
     * Verifies the signature against the public key registered for the sender at the message height.
     */
    public boolean verifySignature(ConsensusMessage message) {
        Optional<Validator> validator = findSigner(message);
        if (validator.isEmpty() || message.getSignature() == null) {
            return false;
        }

        byte[] payload = signingPayloadWriter.payload(message);
        return signer.verify(validator.get().getPublicKey(), payload, message.getSignature());
    }

    private Optional<Validator> findSigner(ConsensusMessage message) {
        if (message.getSender() == null) {
            return Optional.empty();
        }
        try {
            return validatorSet.findValidator(message.getHeight(), message.getSender());
        } catch (ValidatorSetException e) {
            log.fine(String.format("No validator set for height %d: %s", message.getHeight(), e.getMessage()));
            return Optional.empty();
        }
    }
}
