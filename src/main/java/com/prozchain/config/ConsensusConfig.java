package com.prozchain.config;

import lombok.Builder;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.PropertySource;
import org.springframework.stereotype.Component;

/**
 * Consensus tunables, bound from {@code consensus.properties}.
 */
@Getter
@Component
@PropertySource("classpath:consensus.properties")
public class ConsensusConfig {

    private final String chainId;
    private final long initialHeight;

    private final long timeoutProposeMs;
    private final long timeoutProposeDeltaMs;
    private final long timeoutPrevoteMs;
    private final long timeoutPrevoteDeltaMs;
    private final long timeoutPrecommitMs;
    private final long timeoutPrecommitDeltaMs;

    /**
     * How far ahead of the current height messages are still accepted.
     */
    private final long futureHeights;
    /**
     * How far ahead of the current round messages for the current height are still accepted.
     */
    private final int futureRounds;
    /**
     * Number of committed heights kept in the vote pool for fault detection.
     */
    private final long evidenceWindowHeights;
    private final int downtimeHeights;

    private final long tickPeriodMs;
    private final int verificationPoolSize;
    private final int livenessAlertRounds;

    @Builder
    public ConsensusConfig(@Value("${consensus.chain-id}") String chainId,
                           @Value("${consensus.initial-height:1}") long initialHeight,
                           @Value("${consensus.timeout.propose-ms:3000}") long timeoutProposeMs,
                           @Value("${consensus.timeout.propose-delta-ms:500}") long timeoutProposeDeltaMs,
                           @Value("${consensus.timeout.prevote-ms:1000}") long timeoutPrevoteMs,
                           @Value("${consensus.timeout.prevote-delta-ms:500}") long timeoutPrevoteDeltaMs,
                           @Value("${consensus.timeout.precommit-ms:1000}") long timeoutPrecommitMs,
                           @Value("${consensus.timeout.precommit-delta-ms:500}") long timeoutPrecommitDeltaMs,
                           @Value("${consensus.window.future-heights:2}") long futureHeights,
                           @Value("${consensus.window.future-rounds:10}") int futureRounds,
                           @Value("${consensus.window.evidence-heights:100}") long evidenceWindowHeights,
                           @Value("${consensus.fault.downtime-heights:50}") int downtimeHeights,
                           @Value("${consensus.loop.tick-period-ms:100}") long tickPeriodMs,
                           @Value("${consensus.loop.verification-pool-size:4}") int verificationPoolSize,
                           @Value("${consensus.metrics.liveness-alert-rounds:5}") int livenessAlertRounds) {
        this.chainId = chainId;
        this.initialHeight = initialHeight;
        this.timeoutProposeMs = timeoutProposeMs;
        this.timeoutProposeDeltaMs = timeoutProposeDeltaMs;
        this.timeoutPrevoteMs = timeoutPrevoteMs;
        this.timeoutPrevoteDeltaMs = timeoutPrevoteDeltaMs;
        this.timeoutPrecommitMs = timeoutPrecommitMs;
        this.timeoutPrecommitDeltaMs = timeoutPrecommitDeltaMs;
        this.futureHeights = futureHeights;
        this.futureRounds = futureRounds;
        this.evidenceWindowHeights = evidenceWindowHeights;
        this.downtimeHeights = downtimeHeights;
        this.tickPeriodMs = tickPeriodMs;
        this.verificationPoolSize = verificationPoolSize;
        this.livenessAlertRounds = livenessAlertRounds;
    }
}
