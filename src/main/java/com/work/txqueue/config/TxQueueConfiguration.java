package com.work.txqueue.config;

import com.work.txqueue.repository.SnapshotStore;
import com.work.txqueue.service.resend.JitteredResendPolicy;
import com.work.txqueue.service.resend.ResendPolicy;
import com.work.txqueue.support.InMemorySnapshotStore;
import com.work.txqueue.support.metrics.NoopTxQueueMetrics;
import com.work.txqueue.support.metrics.TxQueueMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({TxQueueProperties.class, LedgerProperties.class})
public class TxQueueConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock txQueueClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ResendPolicy.class)
    public ResendPolicy resendPolicy(TxQueueProperties properties) {
        return JitteredResendPolicy.fromProperties(properties, new Random());
    }

    @Bean
    @ConditionalOnMissingBean(TxQueueMetrics.class)
    public TxQueueMetrics txQueueMetrics() {
        return new NoopTxQueueMetrics();
    }

    /**
     * 首次广播线程池（有界、守护线程）。
     */
    @Bean(name = "txBroadcastExecutor", destroyMethod = "shutdownNow")
    public ExecutorService txBroadcastExecutor(TxQueueProperties properties) {
        AtomicInteger seq = new AtomicInteger(1);
        return Executors.newFixedThreadPool(Math.max(1, properties.getBroadcastWorkers()), r -> {
            Thread t = new Thread(r, "tx-broadcast-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnProperty(prefix = "txqueue", name = "snapshot-store", havingValue = "memory", matchIfMissing = true)
    public SnapshotStore inMemorySnapshotStore() {
        return new InMemorySnapshotStore();
    }
}
