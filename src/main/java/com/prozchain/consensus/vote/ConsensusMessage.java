package com.prozchain.consensus.vote;

import com.prozchain.types.Address;
import com.prozchain.types.Signature;

/**
 * A signed consensus message travelling between validators: either a {@link Proposal} or a {@link Vote}.
 */
public interface ConsensusMessage {

    MessageType getType();

    long getHeight();

    int getRound();

    Address getSender();

    Signature getSignature();

    /**
     * Compares everything the signature covers, ignoring the signature itself.
     */
    boolean hasSameContent(ConsensusMessage other);
}
