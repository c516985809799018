package com.prozchain.consensus;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.consensus.pool.VotePool;
import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.exception.StateCorruptionException;
import com.prozchain.network.ConsensusMessageHandler;
import com.prozchain.network.NetworkService;
import com.prozchain.utils.async.AsyncExecutor;
import lombok.extern.java.Log;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Single consensus thread in front of the {@link ConsensusDriver}. Signatures are verified on a worker pool;
 * verified messages reach the driver in the order they were delivered, interleaved with periodic ticks.
 * A corrupted safety state halts the loop.
 */
@Log
public class ConsensusEventLoop implements ConsensusMessageHandler {

    private final ConsensusDriver driver;
    private final VotePool votePool;
    private final NetworkService network;
    private final Clock clock;
    private final long tickPeriodMs;

    private final AsyncExecutor verificationExecutor;
    private final ScheduledExecutorService loopExecutor = Executors.newSingleThreadScheduledExecutor();

    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
    private volatile boolean halted;

    public ConsensusEventLoop(ConsensusDriver driver,
                              VotePool votePool,
                              NetworkService network,
                              ConsensusConfig config,
                              Clock clock) {
        this.driver = driver;
        this.votePool = votePool;
        this.network = network;
        this.clock = clock;
        this.tickPeriodMs = config.getTickPeriodMs();
        this.verificationExecutor = AsyncExecutor.withPoolSize(config.getVerificationPoolSize());
    }

    public synchronized void start() {
        network.registerHandler(this);
        tail = tail.thenRunAsync(() -> runSafely(driver::start), loopExecutor);
        loopExecutor.scheduleAtFixedRate(() -> runSafely(() -> driver.tick(clock.instant())),
                tickPeriodMs, tickPeriodMs, TimeUnit.MILLISECONDS);
        log.info("Consensus event loop started");
    }

    @Override
    public synchronized void deliver(ConsensusMessage message) {
        if (halted) {
            return;
        }

        CompletableFuture<Boolean> verified = verificationExecutor
                .executeAsync(() -> votePool.verifySignature(message))
                .exceptionally(e -> {
                    log.log(Level.WARNING, "Signature verification failed for " + message, e);
                    return false;
                });

        tail = tail.thenCombineAsync(verified, (ignored, valid) -> {
            runSafely(() -> {
                if (valid) {
                    driver.handleVerifiedMessage(message);
                } else {
                    driver.onInvalidSignature(message);
                }
            });
            return null;
        }, loopExecutor);
    }

    /**
     * Completes once every message delivered so far has been handed to the driver.
     */
    public synchronized CompletableFuture<Void> drain() {
        return tail;
    }

    public boolean isHalted() {
        return halted;
    }

    public void stop() {
        halted = true;
        loopExecutor.shutdownNow();
        verificationExecutor.shutdown();
        log.info("Consensus event loop stopped");
    }

    private void runSafely(Runnable task) {
        if (halted) {
            return;
        }
        try {
            task.run();
        } catch (StateCorruptionException e) {
            log.log(Level.SEVERE, "Consensus safety state is corrupt, halting", e);
            stop();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Consensus event failed", e);
        }
    }
}
