package com.prozchain.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import lombok.Getter;

/**
 * Prometheus collectors of one consensus node. Each node registers into its own {@link CollectorRegistry}.
 */
@Getter
public class ConsensusMetrics {

    public static final class MetricKeys {
        public static final String COMMITS = "consensus_commits_total";
        public static final String ROUNDS_ADVANCED = "consensus_rounds_advanced_total";
        public static final String REJECTED_MESSAGES = "consensus_rejected_messages_total";
        public static final String EVIDENCE = "consensus_evidence_total";
        public static final String HEIGHT = "consensus_height";
        public static final String ROUND = "consensus_round";
        public static final String LIVENESS_ALERT = "consensus_liveness_alert";
        public static final String COMMIT_ROUNDS = "consensus_commit_rounds";

        private MetricKeys() {
        }
    }

    private final CollectorRegistry registry;
    private final int livenessAlertRounds;

    private final Counter commits;
    private final Counter roundsAdvanced;
    private final Counter rejectedMessages;
    private final Counter evidence;
    private final Gauge height;
    private final Gauge round;
    private final Gauge livenessAlert;
    private final Histogram commitRounds;

    public ConsensusMetrics(CollectorRegistry registry, int livenessAlertRounds) {
        this.registry = registry;
        this.livenessAlertRounds = livenessAlertRounds;

        this.commits = Counter.build()
                .name(MetricKeys.COMMITS).help("Committed heights.")
                .register(registry);
        this.roundsAdvanced = Counter.build()
                .name(MetricKeys.ROUNDS_ADVANCED).help("Round changes without a commit.")
                .register(registry);
        this.rejectedMessages = Counter.build()
                .name(MetricKeys.REJECTED_MESSAGES).help("Inbound consensus messages rejected by the vote pool.")
                .labelNames("reason")
                .register(registry);
        this.evidence = Counter.build()
                .name(MetricKeys.EVIDENCE).help("Misbehaviour evidence handed to the slashing module.")
                .labelNames("kind")
                .register(registry);
        this.height = Gauge.build()
                .name(MetricKeys.HEIGHT).help("Height being decided.")
                .register(registry);
        this.round = Gauge.build()
                .name(MetricKeys.ROUND).help("Round of the height being decided.")
                .register(registry);
        this.livenessAlert = Gauge.build()
                .name(MetricKeys.LIVENESS_ALERT)
                .help("1 while the current height has gone through more rounds than the alert threshold.")
                .register(registry);
        this.commitRounds = Histogram.build()
                .name(MetricKeys.COMMIT_ROUNDS).help("Round in which heights were committed.")
                .buckets(0, 1, 2, 4, 8, 16)
                .register(registry);
    }

    public void onRound(long currentHeight, int currentRound) {
        height.set(currentHeight);
        round.set(currentRound);
        if (currentRound > 0) {
            roundsAdvanced.inc();
        }
        livenessAlert.set(currentRound >= livenessAlertRounds ? 1 : 0);
    }

    public void onCommit(int commitRound) {
        commits.inc();
        commitRounds.observe(commitRound);
    }

    public void onRejected(String reason) {
        rejectedMessages.labels(reason).inc();
    }

    public void onEvidence(String kind) {
        evidence.labels(kind).inc();
    }

    public boolean isLivenessAlertRaised() {
        return livenessAlert.get() > 0;
    }
}
