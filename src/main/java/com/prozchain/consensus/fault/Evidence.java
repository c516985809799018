package com.prozchain.consensus.fault;

import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.types.Address;
import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;

/**
 * Proof of validator misbehaviour. Equivocation and double proposals carry both signed messages; downtime
 * carries the number of consecutive heights missed. Two evidences are equal when they prove the same thing,
 * whenever they were detected.
 */
@Getter
@Builder
@EqualsAndHashCode(exclude = "timestamp")
public class Evidence {

    private final EvidenceKind kind;
    private final Address validator;
    private final long height;
    private final int round;
    @Nullable
    private final VoteType voteType;
    @Nullable
    private final ConsensusMessage first;
    @Nullable
    private final ConsensusMessage second;
    private final int missedHeights;
    private final Instant timestamp;

    @Override
    public String toString() {
        if (kind == EvidenceKind.DOWNTIME) {
            return String.format("%s{validator=%s, height=%d, missed=%d}", kind, validator, height, missedHeights);
        }
        return String.format("%s{validator=%s, h=%d, r=%d, first=%s, second=%s}",
                kind, validator, height, round, first, second);
    }
}
