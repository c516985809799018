package com.prozchain.validator;

import com.prozchain.types.Address;

import java.util.List;
import java.util.Optional;

/**
 * Source of validator weights. How weights are derived is not a consensus concern.
 */
public interface ValidatorSet {

    /**
     * @return validators active at the given height, ordered by address
     */
    List<Validator> currentValidators(long height);

    default long totalVotingPower(long height) {
        return currentValidators(height).stream()
                .mapToLong(Validator::getVotingPower)
                .sum();
    }

    default Optional<Validator> findValidator(long height, Address address) {
        return currentValidators(height).stream()
                .filter(v -> v.getAddress().equals(address))
                .findFirst();
    }
}
