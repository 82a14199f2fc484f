package com.work.txqueue.service.job;

import com.work.txqueue.service.TxQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期回收终态条目（保留 txqueue.gc-retention）。默认关闭。
 */
@Component
@ConditionalOnProperty(prefix = "txqueue", name = "gc-enabled", havingValue = "true")
public class TxQueueGcJob {

    private static final Logger log = LoggerFactory.getLogger(TxQueueGcJob.class);

    private final TxQueueService queueService;

    public TxQueueGcJob(TxQueueService queueService) {
        this.queueService = queueService;
    }

    @Scheduled(fixedDelayString = "${txqueue.gc-interval-ms:600000}")
    public void runOnce() {
        try {
            int removed = queueService.gc();
            if (removed > 0) {
                log.info("tx queue gc removed {} finished entries", removed);
            }
        } catch (Exception e) {
            log.warn("tx queue gc error err={}", e.toString());
        }
    }
}
