package com.prozchain.consensus.pool;

import com.prozchain.types.BlockHash;
import jakarta.annotation.Nullable;
import lombok.Value;

import java.util.Optional;

/**
 * A block hash (or nil) backed by at least two thirds of the voting power.
 */
@Value
public class Quorum {

    @Nullable
    BlockHash blockHash;
    long power;

    public boolean isNil() {
        return blockHash == null;
    }

    public Optional<BlockHash> getBlockHashOptional() {
        return Optional.ofNullable(blockHash);
    }
}
