package com.prozchain.consensus.vote;

import com.prozchain.types.Address;
import com.prozchain.types.BlockHash;
import com.prozchain.types.Signature;
import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class Vote implements ConsensusMessage {

    long height;
    int round;
    VoteType voteType;
    /**
     * Null for a nil vote.
     */
    @Nullable
    BlockHash blockHash;
    Address validator;
    Signature signature;

    public boolean isNil() {
        return blockHash == null;
    }

    public Optional<BlockHash> getBlockHashOptional() {
        return Optional.ofNullable(blockHash);
    }

    @Override
    public MessageType getType() {
        return MessageType.VOTE;
    }

    @Override
    public Address getSender() {
        return validator;
    }

    @Override
    public boolean hasSameContent(ConsensusMessage other) {
        if (!(other instanceof Vote vote)) {
            return false;
        }
        return height == vote.height
                && round == vote.round
                && voteType == vote.voteType
                && Objects.equals(blockHash, vote.blockHash)
                && validator.equals(vote.validator);
    }

    @Override
    public String toString() {
        return String.format("%s{h=%d, r=%d, hash=%s, from=%s}",
                voteType, height, round, isNil() ? "nil" : blockHash, validator);
    }
}
