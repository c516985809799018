package com.prozchain.consensus.proposer;

import com.prozchain.types.Address;
import com.prozchain.validator.Validator;
import com.prozchain.validator.ValidatorSet;
import lombok.extern.java.Log;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Deterministic stake-weighted proposer rotation.
 * <p>
 * Every validator carries a priority. One step adds each validator's voting power to its priority, selects the
 * highest priority (ties go to the lower address) and subtracts the total power from the winner. Heights advance
 * the priorities by exactly one step; rounds within a height take further steps from the height's starting
 * priorities. Within a height a step never re-selects the proposer of the previous round, so an unresponsive
 * proposer cannot stall the height.
 * <p>
 * The result is a pure function of the validator snapshots, so every node computes the same schedule without
 * exchanging messages.
 */
@Log
public class ProposerScheduler {

    private static final int DEFAULT_RECENT_HEIGHTS = 128;
    static final long CHECKPOINT_INTERVAL = 1024;
    private static final int MAX_CHECKPOINTS = 1024;

    private final ValidatorSet validatorSet;
    private final long initialHeight;
    private final int recentHeights;

    /**
     * Priorities at the start of each of the most recent heights.
     */
    private final NavigableMap<Long, Map<Address, Long>> recent = new TreeMap<>();
    /**
     * Priorities at every {@link #CHECKPOINT_INTERVAL}-th height, bounding the replay for older heights.
     */
    private final NavigableMap<Long, Map<Address, Long>> checkpoints = new TreeMap<>();

    public ProposerScheduler(ValidatorSet validatorSet, long initialHeight) {
        this(validatorSet, initialHeight, DEFAULT_RECENT_HEIGHTS);
    }

    /**
     * @param recentHeights number of consecutive heights, ending at the highest height computed so far, whose
     *                      starting priorities are kept; should cover the vote pool's evidence window
     */
    public ProposerScheduler(ValidatorSet validatorSet, long initialHeight, int recentHeights) {
        this.validatorSet = validatorSet;
        this.initialHeight = initialHeight;
        this.recentHeights = Math.max(1, recentHeights);
    }

    public synchronized Address proposerFor(long height, int round) {
        if (height < initialHeight) {
            throw new IllegalArgumentException(
                    String.format("Height %d is below the initial height %d", height, initialHeight));
        }
        if (round < 0) {
            throw new IllegalArgumentException("Round must not be negative, got " + round);
        }

        List<Validator> validators = validatorSet.currentValidators(height);
        Map<Address, Long> priorities = new HashMap<>(prioritiesAt(height));

        Address selected = null;
        for (int r = 0; r <= round; r++) {
            selected = step(priorities, validators, selected);
        }
        return selected;
    }

    private Map<Address, Long> prioritiesAt(long height) {
        Map.Entry<Long, Map<Address, Long>> cached = closest(height);

        long current;
        Map<Address, Long> priorities;
        if (cached == null) {
            current = initialHeight;
            priorities = new HashMap<>();
            for (Validator validator : validatorSet.currentValidators(initialHeight)) {
                priorities.put(validator.getAddress(), 0L);
            }
            remember(current, priorities);
        } else {
            current = cached.getKey();
            priorities = new HashMap<>(cached.getValue());
        }

        while (current < height) {
            step(priorities, validatorSet.currentValidators(current), null);
            current++;
            priorities = reseed(priorities, validatorSet.currentValidators(current));
            remember(current, priorities);
        }
        return priorities;
    }

    private Map.Entry<Long, Map<Address, Long>> closest(long height) {
        Map.Entry<Long, Map<Address, Long>> fromRecent = recent.floorEntry(height);
        Map.Entry<Long, Map<Address, Long>> fromCheckpoint = checkpoints.floorEntry(height);
        if (fromRecent == null) {
            return fromCheckpoint;
        }
        if (fromCheckpoint == null || fromRecent.getKey() >= fromCheckpoint.getKey()) {
            return fromRecent;
        }
        return fromCheckpoint;
    }

    private void remember(long height, Map<Address, Long> priorities) {
        if ((height - initialHeight) % CHECKPOINT_INTERVAL == 0) {
            checkpoints.put(height, Map.copyOf(priorities));
            while (checkpoints.size() > MAX_CHECKPOINTS) {
                checkpoints.pollFirstEntry();
            }
        }

        // replaying an old height must not evict the heights around the tip
        if (!recent.isEmpty() && height <= recent.lastKey() - recentHeights) {
            return;
        }
        recent.put(height, Map.copyOf(priorities));
        while (recent.size() > recentHeights) {
            recent.pollFirstEntry();
        }
    }

    /**
     * Carries priorities over to a new validator set. Removed validators are dropped; newcomers start at
     * -1.125 x total power so that joining does not grant an immediate turn.
     */
    private Map<Address, Long> reseed(Map<Address, Long> priorities, List<Validator> validators) {
        long totalPower = totalPower(validators);
        long newcomerPriority = -(totalPower + totalPower / 8);

        Map<Address, Long> reseeded = new HashMap<>();
        boolean changed = priorities.size() != validators.size();
        for (Validator validator : validators) {
            Long priority = priorities.get(validator.getAddress());
            if (priority == null) {
                changed = true;
                priority = newcomerPriority;
            }
            reseeded.put(validator.getAddress(), priority);
        }

        if (changed) {
            log.fine(String.format("Validator set changed, re-seeding priorities for %d validators",
                    validators.size()));
            centre(reseeded);
        }
        return reseeded;
    }

    private Address step(Map<Address, Long> priorities, List<Validator> validators, Address excluded) {
        long totalPower = totalPower(validators);
        rescale(priorities, 2 * totalPower);
        centre(priorities);

        Address selected = null;
        long selectedPriority = Long.MIN_VALUE;
        for (Validator validator : validators) {
            Address address = validator.getAddress();
            long priority = priorities.merge(address, validator.getVotingPower(), Long::sum);

            if (validators.size() > 1 && address.equals(excluded)) {
                continue;
            }
            if (selected == null
                    || priority > selectedPriority
                    || (priority == selectedPriority && address.compareTo(selected) < 0)) {
                selected = address;
                selectedPriority = priority;
            }
        }

        priorities.put(selected, selectedPriority - totalPower);
        return selected;
    }

    private static void rescale(Map<Address, Long> priorities, long maxSpread) {
        if (priorities.isEmpty() || maxSpread <= 0) {
            return;
        }
        long max = priorities.values().stream().mapToLong(Long::longValue).max().orElse(0);
        long min = priorities.values().stream().mapToLong(Long::longValue).min().orElse(0);
        long spread = max - min;
        if (spread > maxSpread) {
            long ratio = (spread + maxSpread - 1) / maxSpread;
            priorities.replaceAll((a, p) -> p / ratio);
        }
    }

    private static void centre(Map<Address, Long> priorities) {
        if (priorities.isEmpty()) {
            return;
        }
        long sum = priorities.values().stream().mapToLong(Long::longValue).sum();
        long average = Math.floorDiv(sum, priorities.size());
        if (average != 0) {
            priorities.replaceAll((a, p) -> p - average);
        }
    }

    private static long totalPower(List<Validator> validators) {
        return validators.stream().mapToLong(Validator::getVotingPower).sum();
    }
}
