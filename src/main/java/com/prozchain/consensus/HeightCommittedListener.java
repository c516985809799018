package com.prozchain.consensus;

import com.prozchain.block.Block;
import com.prozchain.consensus.vote.QuorumCertificate;

@FunctionalInterface
public interface HeightCommittedListener {

    void onHeightCommitted(long height, Block block, QuorumCertificate certificate);
}
