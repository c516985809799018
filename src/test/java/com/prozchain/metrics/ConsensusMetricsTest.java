package com.prozchain.metrics;

import com.prozchain.metrics.ConsensusMetrics.MetricKeys;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsensusMetricsTest {

    private CollectorRegistry registry;
    private ConsensusMetrics metrics;

    @BeforeEach
    void setup() {
        registry = new CollectorRegistry();
        metrics = new ConsensusMetrics(registry, 3);
    }

    @Test
    void roundChangesUpdateHeightRoundAndAdvancedCounter() {
        metrics.onRound(7, 0);
        metrics.onRound(7, 1);
        metrics.onRound(7, 2);

        assertEquals(7.0, registry.getSampleValue(MetricKeys.HEIGHT));
        assertEquals(2.0, registry.getSampleValue(MetricKeys.ROUND));
        assertEquals(2.0, registry.getSampleValue(MetricKeys.ROUNDS_ADVANCED));
    }

    @Test
    void livenessAlertFollowsTheRoundThreshold() {
        metrics.onRound(4, 3);
        assertTrue(metrics.isLivenessAlertRaised());

        metrics.onRound(5, 0);
        assertFalse(metrics.isLivenessAlertRaised());
        assertEquals(0.0, registry.getSampleValue(MetricKeys.LIVENESS_ALERT));
    }

    @Test
    void countsCommitsRejectionsAndEvidenceByLabel() {
        metrics.onCommit(0);
        metrics.onCommit(2);
        metrics.onRejected("UNKNOWN_VALIDATOR");
        metrics.onRejected("UNKNOWN_VALIDATOR");
        metrics.onEvidence("EQUIVOCATION");

        assertEquals(2.0, registry.getSampleValue(MetricKeys.COMMITS));
        assertEquals(2.0, registry.getSampleValue(MetricKeys.COMMIT_ROUNDS + "_count"));
        assertEquals(2.0, registry.getSampleValue(MetricKeys.REJECTED_MESSAGES,
                new String[]{"reason"}, new String[]{"UNKNOWN_VALIDATOR"}));
        assertEquals(1.0, registry.getSampleValue(MetricKeys.EVIDENCE,
                new String[]{"kind"}, new String[]{"EQUIVOCATION"}));
    }
}
