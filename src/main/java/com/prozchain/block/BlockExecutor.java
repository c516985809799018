package com.prozchain.block;

import com.prozchain.exception.InvalidBlockException;

/**
 * Builds and checks block contents. Consensus never looks inside a block.
 */
public interface BlockExecutor {

    /**
     * Builds a new block to be proposed at the given height.
     */
    Block proposeBlock(long height);

    /**
     * @throws InvalidBlockException when the block must not be prevoted
     */
    void validateBlock(Block block);
}
