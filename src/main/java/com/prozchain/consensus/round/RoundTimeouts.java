package com.prozchain.consensus.round;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.consensus.state.Step;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Step timeouts growing linearly with the round: {@code base + round * increment}.
 */
@RequiredArgsConstructor
public class RoundTimeouts {

    private final ConsensusConfig config;

    public Duration timeoutFor(Step step, int round) {
        return switch (step) {
            case PROPOSE -> linear(config.getTimeoutProposeMs(), config.getTimeoutProposeDeltaMs(), round);
            case PREVOTE -> linear(config.getTimeoutPrevoteMs(), config.getTimeoutPrevoteDeltaMs(), round);
            case PRECOMMIT -> linear(config.getTimeoutPrecommitMs(), config.getTimeoutPrecommitDeltaMs(), round);
            case COMMIT -> Duration.ZERO;
        };
    }

    private static Duration linear(long baseMs, long incrementMs, int round) {
        return Duration.ofMillis(baseMs + round * incrementMs);
    }
}
