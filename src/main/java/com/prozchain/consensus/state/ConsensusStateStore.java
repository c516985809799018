package com.prozchain.consensus.state;

import com.prozchain.exception.StateCorruptionException;
import com.prozchain.storage.DBConstants;
import com.prozchain.storage.KVRepository;
import com.prozchain.types.BlockHash;
import lombok.extern.java.Log;

import java.util.Optional;
import java.util.logging.Level;

/**
 * Persists the local safety state. Height and round may only move forward; any attempt to write or load a
 * regressed state raises {@link StateCorruptionException}.
 */
@Log
public class ConsensusStateStore {

    private final KVRepository<String, Object> repository;

    private PersistedConsensusState lastSaved;

    public ConsensusStateStore(KVRepository<String, Object> repository) {
        this.repository = repository;
    }

    public synchronized Optional<PersistedConsensusState> load() {
        Optional<Object> height = repository.find(DBConstants.CURRENT_HEIGHT);
        if (height.isEmpty()) {
            return Optional.empty();
        }

        byte[] lockedValue = repository.find(DBConstants.LOCKED_VALUE, null);
        PersistedConsensusState state = PersistedConsensusState.builder()
                .lastCommittedHeight(repository.find(DBConstants.LAST_COMMITTED_HEIGHT, 0L))
                .height((Long) height.get())
                .round(repository.find(DBConstants.CURRENT_ROUND, 0))
                .lockedValue(lockedValue != null ? new BlockHash(lockedValue) : null)
                .lockedRound(repository.find(DBConstants.LOCKED_ROUND, RoundState.NO_ROUND))
                .build();

        if (state.getHeight() <= state.getLastCommittedHeight()) {
            throw corruption(String.format("Current height %d is not above last committed height %d",
                    state.getHeight(), state.getLastCommittedHeight()));
        }
        if (state.getLockedValue() != null && state.getLockedRound() > state.getRound()) {
            throw corruption(String.format("Locked round %d is ahead of current round %d",
                    state.getLockedRound(), state.getRound()));
        }

        lastSaved = state;
        log.fine("Loaded consensus state " + state);
        return Optional.of(state);
    }

    public synchronized void save(PersistedConsensusState state) {
        if (lastSaved != null) {
            if (state.getLastCommittedHeight() < lastSaved.getLastCommittedHeight()) {
                throw corruption(String.format("Committed height regression from %d to %d",
                        lastSaved.getLastCommittedHeight(), state.getLastCommittedHeight()));
            }
            if (state.getHeight() < lastSaved.getHeight()
                    || (state.getHeight() == lastSaved.getHeight() && state.getRound() < lastSaved.getRound())) {
                throw corruption(String.format("Round regression from %d/%d to %d/%d",
                        lastSaved.getHeight(), lastSaved.getRound(), state.getHeight(), state.getRound()));
            }
        }

        repository.save(DBConstants.LAST_COMMITTED_HEIGHT, state.getLastCommittedHeight());
        repository.save(DBConstants.CURRENT_HEIGHT, state.getHeight());
        repository.save(DBConstants.CURRENT_ROUND, state.getRound());
        if (state.getLockedValue() != null) {
            repository.save(DBConstants.LOCKED_VALUE, state.getLockedValue().getBytes());
        } else {
            repository.delete(DBConstants.LOCKED_VALUE);
        }
        repository.save(DBConstants.LOCKED_ROUND, state.getLockedRound());

        lastSaved = state;
    }

    public synchronized Optional<PersistedConsensusState> getLastSaved() {
        return Optional.ofNullable(lastSaved);
    }

    private StateCorruptionException corruption(String message) {
        log.log(Level.SEVERE, "Persisted consensus state is corrupt: " + message);
        return new StateCorruptionException(message);
    }
}
