package com.prozchain.validator;

import com.prozchain.exception.ValidatorSetException;
import com.prozchain.types.Address;
import lombok.extern.java.Log;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Validator set fixed at construction, with optional changes scheduled to take effect from a given height.
 */
@Log
public class StaticValidatorSet implements ValidatorSet {

    private final NavigableMap<Long, List<Validator>> validatorsByHeight = new ConcurrentSkipListMap<>();

    public StaticValidatorSet(long fromHeight, List<Validator> validators) {
        scheduleChange(fromHeight, validators);
    }

    public StaticValidatorSet(List<Validator> validators) {
        this(0, validators);
    }

    /**
     * Makes {@code validators} the active set from {@code fromHeight} onwards.
     */
    public void scheduleChange(long fromHeight, List<Validator> validators) {
        if (validators.isEmpty()) {
            throw new ValidatorSetException("Validator set must not be empty");
        }

        Set<Address> seen = new HashSet<>();
        for (Validator validator : validators) {
            if (!seen.add(validator.getAddress())) {
                throw new ValidatorSetException("Duplicate validator " + validator.getAddress());
            }
        }

        List<Validator> sorted = validators.stream()
                .sorted(Comparator.comparing(Validator::getAddress))
                .toList();
        validatorsByHeight.put(fromHeight, sorted);
        log.fine(String.format("Validator set of %d members active from height %d", sorted.size(), fromHeight));
    }

    @Override
    public List<Validator> currentValidators(long height) {
        Map.Entry<Long, List<Validator>> entry = validatorsByHeight.floorEntry(height);
        if (entry == null) {
            throw new ValidatorSetException("No validator set known for height " + height);
        }
        return entry.getValue();
    }
}
