package com.example.orderbridge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Threads for the bridge loops.
 *
 * One dedicated platform thread per loop (ingest, retry). Both loops block on transport
 * calls and backoff sleeps, so they never share a thread.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    static final int LOOP_COUNT = 2;
    static final String THREAD_PREFIX = "bridge-loop-";

    @Bean(name = "bridgeLoopExecutor", destroyMethod = "shutdownNow")
    public ExecutorService bridgeLoopExecutor() {
        log.info("Creating bridge loop executor with {} platform threads", LOOP_COUNT);
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(THREAD_PREFIX);
        threadFactory.setDaemon(false);
        return Executors.newFixedThreadPool(LOOP_COUNT, threadFactory);
    }
}
