package com.prozchain.storage.block;

import com.prozchain.consensus.vote.QuorumCertificate;
import com.prozchain.exception.ConsensusGenericException;
import com.prozchain.storage.DBConstants;
import com.prozchain.storage.KVRepository;
import com.prozchain.types.BlockHash;
import lombok.extern.java.Log;

import java.util.Optional;
import java.util.logging.Level;

@Log
public class InMemoryBlockStore implements BlockStore {

    private final KVRepository<String, Object> repository;
    private Long latestCommittedHeight;

    public InMemoryBlockStore(KVRepository<String, Object> repository) {
        this.repository = repository;
        this.latestCommittedHeight = repository.findKeysByPrefix(DBConstants.COMMITTED_HASH_PREFIX, Integer.MAX_VALUE)
                .stream()
                .map(key -> Long.parseLong(key.substring(DBConstants.COMMITTED_HASH_PREFIX.length())))
                .max(Long::compare)
                .orElse(null);
    }

    @Override
    public synchronized void storeCommitted(long height, BlockHash blockHash, QuorumCertificate certificate) {
        Optional<BlockHash> existing = getCommittedHash(height);
        if (existing.isPresent()) {
            if (existing.get().equals(blockHash)) {
                return;
            }
            throw new ConsensusGenericException(String.format(
                    "Height %d already committed as %s, refusing %s", height, existing.get(), blockHash));
        }

        repository.save(DBConstants.COMMITTED_HASH_PREFIX + height, blockHash.getBytes());
        repository.save(DBConstants.COMMITTED_CERTIFICATE_PREFIX + height, certificate);
        if (latestCommittedHeight == null || height > latestCommittedHeight) {
            latestCommittedHeight = height;
        }
        log.log(Level.INFO, String.format("Stored block #%d %s", height, blockHash));
    }

    @Override
    public Optional<BlockHash> getCommittedHash(long height) {
        return repository.find(DBConstants.COMMITTED_HASH_PREFIX + height)
                .map(bytes -> new BlockHash((byte[]) bytes));
    }

    @Override
    public Optional<QuorumCertificate> getCertificate(long height) {
        return repository.find(DBConstants.COMMITTED_CERTIFICATE_PREFIX + height)
                .map(QuorumCertificate.class::cast);
    }

    @Override
    public synchronized Optional<Long> getLatestCommittedHeight() {
        return Optional.ofNullable(latestCommittedHeight);
    }
}
