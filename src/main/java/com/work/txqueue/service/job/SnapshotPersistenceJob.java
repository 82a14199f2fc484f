package com.work.txqueue.service.job;

import com.work.txqueue.config.TxQueueProperties;
import com.work.txqueue.repository.SnapshotStore;
import com.work.txqueue.service.TxQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.Optional;

/**
 * 队列快照持久化：
 * - 启动时从 SnapshotStore 恢复（hydrate 会清空 resigner，需要业务重新 attach）
 * - 运行中按固定间隔保存
 * - 关闭前再保存一次
 *
 * 失败只记日志：快照是尽力而为，不能阻断启动或 tick。
 */
@Component
@ConditionalOnProperty(prefix = "txqueue", name = "snapshot-enabled", havingValue = "true")
public class SnapshotPersistenceJob {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPersistenceJob.class);

    private final TxQueueProperties properties;
    private final TxQueueService queueService;
    private final SnapshotStore snapshotStore;

    public SnapshotPersistenceJob(TxQueueProperties properties, TxQueueService queueService, SnapshotStore snapshotStore) {
        this.properties = properties;
        this.queueService = queueService;
        this.snapshotStore = snapshotStore;
    }

    @PostConstruct
    public void restore() {
        String key = properties.getSnapshotKey();
        try {
            Optional<String> blob = snapshotStore.load(key);
            if (!blob.isPresent()) {
                log.info("no tx queue snapshot found key={}", key);
                return;
            }
            queueService.hydrate(blob.get());
            log.info("tx queue restored from snapshot key={} items={}", key, queueService.listAll().size());
        } catch (Exception e) {
            log.warn("tx queue snapshot restore failed key={} err={}", key, e.toString());
        }
    }

    @Scheduled(fixedDelayString = "${txqueue.snapshot-interval-ms:30000}")
    public void save() {
        String key = properties.getSnapshotKey();
        try {
            snapshotStore.save(key, queueService.dehydrate());
            log.debug("tx queue snapshot saved key={}", key);
        } catch (Exception e) {
            log.warn("tx queue snapshot save failed key={} err={}", key, e.toString());
        }
    }

    @PreDestroy
    public void saveOnShutdown() {
        save();
    }
}
