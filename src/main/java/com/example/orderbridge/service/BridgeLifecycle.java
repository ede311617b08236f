package com.example.orderbridge.service;

import com.example.orderbridge.config.BridgeSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Starts the ingest and retry loops once the context is up and stops them cooperatively on shutdown.
 *
 * <p>Stopping waits for each loop's batch in progress, bounded by the shutdown timeout;
 * loops still busy after that are interrupted.
 */
@Component
@Slf4j
public class BridgeLifecycle implements SmartLifecycle {

    private final List<PollingLoop> loops;
    private final ExecutorService loopExecutor;
    private final Duration shutdownTimeout;
    private final boolean autoStart;

    private volatile boolean running;

    public BridgeLifecycle(
            IngestOrchestrator ingestOrchestrator,
            RetryOrchestrator retryOrchestrator,
            @Qualifier("bridgeLoopExecutor") ExecutorService loopExecutor,
            BridgeSettings settings,
            @Value("${app.bridge.auto-start:true}") boolean autoStart) {
        this.loops = List.of(ingestOrchestrator, retryOrchestrator);
        this.loopExecutor = loopExecutor;
        this.shutdownTimeout = settings.shutdownTimeout();
        this.autoStart = autoStart;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("Starting bridge loops: {}", loops.stream().map(PollingLoop::getLoopName).toList());
        log.info("═══════════════════════════════════════════════════════════════");
        loops.forEach(loopExecutor::execute);
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping bridge loops (timeout {}s)", shutdownTimeout.toSeconds());
        loops.forEach(PollingLoop::requestStop);
        try {
            for (PollingLoop loop : loops) {
                if (!loop.awaitStopped(shutdownTimeout)) {
                    log.warn("{} loop did not finish its batch within {}s, interrupting",
                            loop.getLoopName(), shutdownTimeout.toSeconds());
                    loopExecutor.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loopExecutor.shutdownNow();
        } finally {
            running = false;
        }
        log.info("Bridge loops stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    public List<PollingLoop> getLoops() {
        return loops;
    }
}
