package com.example.orderbridge.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ContextConfiguration(classes = {ExecutorConfig.class})
class ExecutorConfigTest {

    @Autowired
    @Qualifier("bridgeLoopExecutor")
    private ExecutorService bridgeLoopExecutor;

    @Test
    void shouldRunBothLoopsConcurrentlyOnNamedPlatformThreads() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        Set<String> threadNames = ConcurrentHashMap.newKeySet();
        Set<Boolean> daemon = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < 2; i++) {
            bridgeLoopExecutor.execute(() -> {
                threadNames.add(Thread.currentThread().getName());
                daemon.add(Thread.currentThread().isDaemon());
                bothRunning.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        boolean started = bothRunning.await(5, TimeUnit.SECONDS);
        release.countDown();

        assertThat(started).isTrue();
        assertThat(threadNames).hasSize(2).allMatch(name -> name.startsWith("bridge-loop-"));
        assertThat(daemon).containsOnly(false);
    }
}
