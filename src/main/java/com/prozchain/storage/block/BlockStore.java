package com.prozchain.storage.block;

import com.prozchain.consensus.vote.QuorumCertificate;
import com.prozchain.types.BlockHash;

import java.util.Optional;

/**
 * Chain storage as seen by consensus: committed hashes with their commit certificates.
 */
public interface BlockStore {

    void storeCommitted(long height, BlockHash blockHash, QuorumCertificate certificate);

    Optional<BlockHash> getCommittedHash(long height);

    Optional<QuorumCertificate> getCertificate(long height);

    /**
     * @return the highest committed height, empty when nothing has been committed
     */
    Optional<Long> getLatestCommittedHeight();
}
