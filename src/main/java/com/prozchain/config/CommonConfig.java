package com.prozchain.config;

import com.prozchain.block.BlockExecutor;
import com.prozchain.consensus.ConsensusDriver;
import com.prozchain.consensus.ConsensusEventLoop;
import com.prozchain.consensus.fault.FaultDetector;
import com.prozchain.consensus.fault.SlashingModule;
import com.prozchain.consensus.pool.MessageValidator;
import com.prozchain.consensus.pool.VotePool;
import com.prozchain.consensus.proposer.ProposerScheduler;
import com.prozchain.consensus.state.ConsensusStateStore;
import com.prozchain.crypto.Ed25519Signer;
import com.prozchain.crypto.Signer;
import com.prozchain.metrics.ConsensusMetrics;
import com.prozchain.network.PeerMessageCoordinator;
import com.prozchain.network.PeerTransport;
import com.prozchain.network.protocol.consensus.ConsensusEngine;
import com.prozchain.network.protocol.consensus.codec.SigningPayloadWriter;
import com.prozchain.storage.InMemoryRepository;
import com.prozchain.storage.KVRepository;
import com.prozchain.storage.block.BlockStore;
import com.prozchain.storage.block.InMemoryBlockStore;
import com.prozchain.validator.ValidatorSet;
import io.prometheus.client.CollectorRegistry;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Spring configuration class used to instantiate the consensus beans. The embedding node provides the
 * {@link ValidatorSet}, {@link BlockExecutor}, {@link SlashingModule} and {@link PeerTransport} beans.
 */
@Configuration
@EnableScheduling
@Import({ConsensusConfig.class, LoggingConfig.class})
public class CommonConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KVRepository<String, Object> repository() {
        return new InMemoryRepository();
    }

    @Bean
    public Signer signer(@Value("${consensus.validator.key-seed}") String keySeed) {
        return new Ed25519Signer(Hex.decode(keySeed));
    }

    @Bean
    public CollectorRegistry collectorRegistry() {
        return CollectorRegistry.defaultRegistry;
    }

    @Bean
    public ConsensusMetrics consensusMetrics(CollectorRegistry collectorRegistry, ConsensusConfig config) {
        return new ConsensusMetrics(collectorRegistry, config.getLivenessAlertRounds());
    }

    @Bean
    public ProposerScheduler proposerScheduler(ValidatorSet validatorSet, ConsensusConfig config) {
        int recentHeights = Math.toIntExact(config.getEvidenceWindowHeights() + config.getFutureHeights() + 1);
        return new ProposerScheduler(validatorSet, config.getInitialHeight(), recentHeights);
    }

    @Bean
    public MessageValidator messageValidator(ValidatorSet validatorSet,
                                             ProposerScheduler proposerScheduler,
                                             Signer signer,
                                             ConsensusConfig config) {
        return new MessageValidator(validatorSet, proposerScheduler, signer,
                new SigningPayloadWriter(config.getChainId()));
    }

    @Bean
    public VotePool votePool(ValidatorSet validatorSet, MessageValidator messageValidator, ConsensusConfig config) {
        return new VotePool(validatorSet, messageValidator, config);
    }

    @Bean
    public ConsensusStateStore consensusStateStore(KVRepository<String, Object> repository) {
        return new ConsensusStateStore(repository);
    }

    @Bean
    public BlockStore blockStore(KVRepository<String, Object> repository) {
        return new InMemoryBlockStore(repository);
    }

    @Bean
    public FaultDetector faultDetector(VotePool votePool,
                                       ValidatorSet validatorSet,
                                       SlashingModule slashingModule,
                                       ConsensusMetrics consensusMetrics,
                                       ConsensusConfig config,
                                       Clock clock) {
        return new FaultDetector(votePool, validatorSet, slashingModule, consensusMetrics, config, clock);
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new ConsensusEngine();
    }

    @Bean(destroyMethod = "shutdown")
    public PeerMessageCoordinator peerMessageCoordinator(PeerTransport transport, ConsensusEngine consensusEngine) {
        return new PeerMessageCoordinator(transport, consensusEngine);
    }

    @Bean
    public ConsensusDriver consensusDriver(ConsensusConfig config,
                                           ValidatorSet validatorSet,
                                           VotePool votePool,
                                           ProposerScheduler proposerScheduler,
                                           FaultDetector faultDetector,
                                           BlockExecutor blockExecutor,
                                           BlockStore blockStore,
                                           PeerMessageCoordinator network,
                                           Signer signer,
                                           ConsensusStateStore consensusStateStore,
                                           ConsensusMetrics consensusMetrics,
                                           Clock clock) {
        return new ConsensusDriver(config, validatorSet, votePool, proposerScheduler, faultDetector, blockExecutor,
                blockStore, network, signer, consensusStateStore, consensusMetrics, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ConsensusEventLoop consensusEventLoop(ConsensusDriver consensusDriver,
                                                 VotePool votePool,
                                                 PeerMessageCoordinator network,
                                                 ConsensusConfig config,
                                                 Clock clock) {
        return new ConsensusEventLoop(consensusDriver, votePool, network, config, clock);
    }
}
