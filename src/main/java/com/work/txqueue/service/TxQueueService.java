package com.work.txqueue.service;

import com.work.txqueue.config.TxQueueProperties;
import com.work.txqueue.domain.Resigner;
import com.work.txqueue.domain.TrackedTx;
import com.work.txqueue.domain.TxMeta;
import com.work.txqueue.repository.codec.TxSnapshotCodec;
import com.work.txqueue.service.monitor.LifecycleMonitor;
import com.work.txqueue.service.queue.TxQueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.work.txqueue.support.ValidationUtils.normalizeAddress;
import static com.work.txqueue.support.ValidationUtils.normalizeHex;
import static com.work.txqueue.support.ValidationUtils.requireNonEmpty;
import static com.work.txqueue.support.ValidationUtils.requireNonNegative;

/**
 * 交易队列对外 API：入队、取消、清理、快照、查询。
 *
 * 推进由 {@link LifecycleMonitor} 负责；这里只做同步的状态读写。
 */
@Service
public class TxQueueService {

    private static final Logger log = LoggerFactory.getLogger(TxQueueService.class);

    private final TxQueueProperties props;
    private final TxQueueStore store;
    private final LifecycleMonitor monitor;
    private final TxSnapshotCodec codec;
    private final Clock clock;

    public TxQueueService(TxQueueProperties props,
                          TxQueueStore store,
                          LifecycleMonitor monitor,
                          TxSnapshotCodec codec,
                          Clock clock) {
        this.props = props;
        this.store = store;
        this.monitor = monitor;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * 入队一笔已签名交易并触发首次广播（异步，结果通过状态体现）。
     *
     * @param resigner 可为 null：没有 resigner 的条目不会重提，重提窗口耗尽后可能被判定为 dropped
     * @return 新条目（queued）的副本
     */
    public TrackedTx enqueueSigned(String from, long nonce, String signedHex, TxMeta meta, Resigner resigner) {
        requireNonEmpty(from, "from");
        requireNonEmpty(signedHex, "signedHex");
        requireNonNegative(nonce, "nonce");
        TxMeta m = meta == null ? TxMeta.empty() : meta;

        Instant now = clock.instant();
        TrackedTx tx = new TrackedTx(UUID.randomUUID().toString(), normalizeAddress(from), nonce,
                m.getTo(), m.getValue(), normalizeHex(signedHex), now);
        store.insert(tx, resigner);
        log.info("tx enqueued txId={} from={} nonce={} resigner={}", tx.getId(), tx.getFrom(), nonce, resigner != null);

        monitor.broadcastAsync(tx.getId());
        return tx.copy();
    }

    public TrackedTx enqueueSigned(String from, long nonce, String signedHex, TxMeta meta) {
        return enqueueSigned(from, nonce, signedHex, meta, null);
    }

    /**
     * 为已有条目替换 resigner（null 表示解除）。例如 hydrate 之后重新挂回回调。
     *
     * @return false 表示 id 不存在
     */
    public boolean attachResigner(String txId, Resigner resigner) {
        return store.attachResigner(txId, resigner);
    }

    /**
     * 无条件删除。进行中的网络调用不会被取消，但它们之后的写回都是 no-op。
     */
    public boolean remove(String txId) {
        boolean removed = store.remove(txId);
        if (removed) {
            log.info("tx removed txId={}", txId);
        }
        return removed;
    }

    /**
     * 删除 updatedAt 早于 now - olderThan 的终态条目；非终态条目永不回收。
     *
     * @return 删除条数
     */
    public int gc(Duration olderThan) {
        requireNonNegative(olderThan, "olderThan");
        Instant cutoff = cutoff(clock.instant(), olderThan);
        List<String> removed = store.removeIf(t -> t.isTerminal()
                && t.getUpdatedAt() != null && t.getUpdatedAt().isBefore(cutoff));
        if (!removed.isEmpty()) {
            log.info("tx gc removed={} cutoff={}", removed.size(), cutoff);
        }
        return removed.size();
    }

    public int gc() {
        return gc(props.getGcRetention());
    }

    public String dehydrate() {
        return codec.encode(store.listAll());
    }

    /**
     * 用快照整体替换当前队列。resigner 不会被持久化，这里一并清空，需要业务重新 attach。
     * 空 blob 视为“无快照”，不做任何修改。
     */
    public void hydrate(String blob) {
        if (blob == null || blob.trim().isEmpty()) {
            return;
        }
        List<TrackedTx> items = codec.decode(blob);
        int maxResends = Math.max(0, props.getMaxResends());
        for (TrackedTx t : items) {
            if (t.getResendCount() > maxResends) {
                log.warn("snapshot resendCount above maxResends, clamped txId={} resendCount={} maxResends={}",
                        t.getId(), t.getResendCount(), maxResends);
                t.setResendCount(maxResends);
            }
        }
        store.replaceAll(items);
        log.info("tx queue hydrated items={}", store.size());
    }

    public List<TrackedTx> listAll() {
        return store.listAll();
    }

    public List<TrackedTx> listPending() {
        List<TrackedTx> out = new ArrayList<>();
        for (TrackedTx t : store.listAll()) {
            if (t.getStatus().isPendingLike()) {
                out.add(t);
            }
        }
        return out;
    }

    public List<TrackedTx> listFinished() {
        List<TrackedTx> out = new ArrayList<>();
        for (TrackedTx t : store.listAll()) {
            if (t.isTerminal()) {
                out.add(t);
            }
        }
        return out;
    }

    public Optional<TrackedTx> findById(String txId) {
        return Optional.ofNullable(store.get(txId));
    }

    public Optional<TrackedTx> findByHash(String hash) {
        return store.findByHash(hash);
    }

    /**
     * now - olderThan，超出 Instant 可表示范围时饱和到 Instant.MIN（即不回收任何条目）。
     */
    private static Instant cutoff(Instant now, Duration olderThan) {
        if (olderThan.compareTo(Duration.between(Instant.MIN, now)) >= 0) {
            return Instant.MIN;
        }
        return now.minus(olderThan);
    }
}
