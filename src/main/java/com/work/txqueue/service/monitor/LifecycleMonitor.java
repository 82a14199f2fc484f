package com.work.txqueue.service.monitor;

import com.work.txqueue.chain.LedgerClient;
import com.work.txqueue.chain.LedgerReceipt;
import com.work.txqueue.config.TxQueueProperties;
import com.work.txqueue.domain.ResignContext;
import com.work.txqueue.domain.Resigner;
import com.work.txqueue.domain.TrackedTx;
import com.work.txqueue.domain.TxStatus;
import com.work.txqueue.service.queue.TxQueueStore;
import com.work.txqueue.service.resend.ResendPolicy;
import com.work.txqueue.support.metrics.TxQueueMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.work.txqueue.support.ValidationUtils.normalizeHex;
import static com.work.txqueue.support.ValidationUtils.requireNonEmpty;

/**
 * 交易生命周期推进：broadcast -> 轮询 receipt -> nonce 越过检测 -> 重提 / 丢弃判定。
 *
 * 约束：
 * - tick 单飞：上一轮未结束时，新一轮直接跳过
 * - 每一步网络 IO 都在锁外执行，写回时经 {@link TxQueueStore#update} 按 id 重新取实例，
 *   条目已被 remove 时写回是 no-op（remove 即等效取消）
 * - 查询类失败（receipt/nonce/可见性）只记 advisory error，下一轮再试；广播失败直接终态 REJECTED
 * - 单条失败不影响同一轮的其他条目，tick 不向外抛异常
 */
@Service
public class LifecycleMonitor {

    private static final Logger log = LoggerFactory.getLogger(LifecycleMonitor.class);

    private final TxQueueProperties props;
    private final TxQueueStore store;
    private final LedgerClient ledger;
    private final ResendPolicy resendPolicy;
    private final TxQueueMetrics metrics;
    private final Clock clock;
    private final Executor broadcastExecutor;

    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickFuture;

    public LifecycleMonitor(TxQueueProperties props,
                            TxQueueStore store,
                            LedgerClient ledger,
                            ResendPolicy resendPolicy,
                            TxQueueMetrics metrics,
                            Clock clock,
                            @Qualifier("txBroadcastExecutor") Executor broadcastExecutor) {
        this.props = props;
        this.store = store;
        this.ledger = ledger;
        this.resendPolicy = resendPolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.broadcastExecutor = broadcastExecutor;
    }

    @PostConstruct
    public void init() {
        if (props.isMonitorAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public synchronized void destroy() {
        stop();
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * 开始周期 tick（幂等）。
     */
    public synchronized void start() {
        if (tickFuture != null && !tickFuture.isDone()) {
            return;
        }
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "tx-monitor");
                t.setDaemon(true);
                return t;
            });
        }
        long intervalMs = Math.max(100L, props.getMonitorInterval().toMillis());
        tickFuture = scheduler.scheduleWithFixedDelay(this::scheduledTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("LifecycleMonitor started interval={}ms batchSize={}", intervalMs, props.getBatchSize());
    }

    /**
     * 停止周期 tick（幂等）。进行中的那一轮会自然跑完。
     */
    public synchronized void stop() {
        if (tickFuture == null) {
            return;
        }
        tickFuture.cancel(false);
        tickFuture = null;
        log.info("LifecycleMonitor stopped");
    }

    public synchronized boolean isRunning() {
        return tickFuture != null && !tickFuture.isDone();
    }

    private void scheduledTick() {
        // scheduleWithFixedDelay 遇到异常会停止后续调度，这里兜底
        try {
            tick();
        } catch (Exception e) {
            log.error("monitor tick error", e);
        }
    }

    /**
     * 处理一批（最新优先）非终态条目。返回 false 表示上一轮仍在进行，本次跳过。
     */
    public boolean tick() {
        if (!ticking.compareAndSet(false, true)) {
            return false;
        }
        try {
            List<TrackedTx> batch = store.listNonTerminal(Math.max(1, props.getBatchSize()));
            metrics.tickBatch(batch.size());
            for (TrackedTx tx : batch) {
                try {
                    handleOne(tx.getId());
                } catch (Exception e) {
                    log.warn("monitor handle error txId={} err={}", tx.getId(), e.toString());
                }
            }
            return true;
        } finally {
            ticking.set(false);
        }
    }

    /**
     * 入队后的首次广播：提交到后台线程，失败通过状态体现，不向调用方抛出。
     */
    public void broadcastAsync(String txId) {
        try {
            broadcastExecutor.execute(() -> {
                try {
                    broadcast(txId);
                } catch (Exception e) {
                    log.warn("async broadcast error txId={} err={}", txId, e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            // 条目仍是 QUEUED，下一轮 tick 会认领并广播
            log.warn("broadcast executor rejected txId={}, deferred to next tick", txId);
        }
    }

    void handleOne(String txId) {
        TrackedTx tx = store.get(txId);
        if (tx == null) {
            return;
        }
        switch (tx.getStatus()) {
            case QUEUED:
                broadcast(txId);
                return;
            case BROADCASTING:
                // 广播进行中
                return;
            case PENDING:
                monitorPending(tx);
                return;
            case MINED:
            case FAILED:
            case DROPPED:
            case REPLACED:
            case REJECTED:
                return;
            default:
                throw new IllegalStateException("unhandled status " + tx.getStatus());
        }
    }

    /**
     * 先认领（QUEUED -> BROADCASTING）再发 RPC：同一条目并发触发时只有一方真正发送。
     *
     * @return true 表示本次广播成功且已写回
     */
    boolean broadcast(String txId) {
        TrackedTx tx = store.claimBroadcast(txId, clock.instant());
        if (tx == null) {
            return false;
        }

        String txHash;
        try {
            txHash = ledger.sendRawTransaction(tx.getSignedHex());
        } catch (Exception e) {
            String err = "send failed: " + describe(e);
            Instant now = clock.instant();
            boolean written = store.update(txId, t -> {
                t.setStatus(TxStatus.REJECTED);
                t.setError(err);
                t.setUpdatedAt(now);
            });
            metrics.broadcast("rejected");
            if (written) {
                metrics.transition(TxStatus.REJECTED);
            }
            log.warn("broadcast rejected txId={} from={} nonce={} err={}", txId, tx.getFrom(), tx.getNonce(), e.toString());
            return false;
        }

        Instant now = clock.instant();
        Instant gate = resendPolicy.nextResendAt(0, now);
        boolean written = store.update(txId, t -> {
            t.appendHash(txHash);
            t.setStatus(TxStatus.PENDING);
            t.setError(null);
            t.setNextResendAt(gate);
            t.setUpdatedAt(now);
        });
        metrics.broadcast("success");
        if (written) {
            metrics.transition(TxStatus.PENDING);
            log.info("broadcast ok txId={} from={} nonce={} txHash={}", txId, tx.getFrom(), tx.getNonce(), txHash);
        } else {
            log.info("broadcast finished after removal txId={} txHash={}", txId, txHash);
        }
        return written;
    }

    private void monitorPending(TrackedTx tx) {
        String txId = tx.getId();
        String hash = tx.getLastHash();

        // 1) receipt
        if (hash != null) {
            Optional<LedgerReceipt> receipt;
            try {
                receipt = ledger.getReceipt(hash);
            } catch (Exception e) {
                metrics.receiptCheck("error");
                advisory(txId, "receipt check failed: " + describe(e));
                log.warn("getReceipt error txId={} txHash={} err={}", txId, hash, e.toString());
                return;
            }
            if (receipt.isPresent()) {
                metrics.receiptCheck("found");
                boolean success = receipt.get().isSuccess();
                finish(tx, success ? TxStatus.MINED : TxStatus.FAILED, success ? null : "execution reverted");
                return;
            }
            metrics.receiptCheck("not_found");
        }

        // 2) nonce 越过：同 nonce 的其他交易（可能是别的 hash）已上链
        long chainNonce;
        try {
            chainNonce = ledger.getAccountNonce(tx.getFrom());
        } catch (Exception e) {
            metrics.nonceCheck("error");
            advisory(txId, "nonce check failed: " + describe(e));
            log.warn("getAccountNonce error txId={} from={} err={}", txId, tx.getFrom(), e.toString());
            return;
        }
        metrics.nonceCheck("ok");
        if (chainNonce > tx.getNonce()) {
            finish(tx, TxStatus.REPLACED, null);
            return;
        }

        // 3) gate
        Instant now = clock.instant();
        Instant gate = tx.getNextResendAt();
        if (gate == null) {
            Instant computed = resendPolicy.nextResendAt(tx.getResendCount(), tx.getCreatedAt());
            store.update(txId, t -> {
                if (t.getNextResendAt() == null) {
                    t.setNextResendAt(computed);
                }
            });
            gate = computed;
        }
        if (now.isBefore(gate)) {
            refreshIfIdle(tx, now);
            return;
        }

        // 4) 可见性：不可见 -> 可能被节点丢弃；可见但超过 gate + stuckThreshold -> 手续费过低卡住
        boolean visible = false;
        if (hash != null) {
            try {
                visible = ledger.isVisible(hash);
            } catch (Exception e) {
                metrics.visibilityCheck("error");
                advisory(txId, "visibility check failed: " + describe(e));
                log.warn("isVisible error txId={} txHash={} err={}", txId, hash, e.toString());
                return;
            }
        }
        metrics.visibilityCheck(visible ? "visible" : "not_visible");
        boolean stuck = visible && Duration.between(gate, now).compareTo(props.getStuckThreshold()) > 0;
        if (visible && !stuck) {
            refreshIfIdle(tx, now);
            return;
        }

        // 5) 重提 or 软丢弃
        Resigner resigner = store.getResigner(txId);
        if (resigner != null && tx.getResendCount() < Math.max(0, props.getMaxResends())) {
            resend(tx, resigner);
            return;
        }
        if (!visible) {
            finish(tx, TxStatus.DROPPED, "not seen in mempool after resend window");
            return;
        }
        // 可见、卡住、但已无法重提：继续等待 receipt 或 nonce 越过
        refreshIfIdle(tx, now);
    }

    private void resend(TrackedTx tx, Resigner resigner) {
        String txId = tx.getId();
        int attempt = tx.getResendCount() + 1;

        String newHex;
        String newHash;
        try {
            String signed = resigner.resign(new ResignContext(txId, tx.getFrom(), tx.getNonce(), attempt, tx.getSignedHex()));
            newHex = normalizeHex(requireNonEmpty(signed, "resigned payload"));
            newHash = ledger.sendRawTransaction(newHex);
        } catch (Exception e) {
            // 保持 pending，推迟到下一个 gate；不计入重提次数
            Instant now = clock.instant();
            Instant retryAt = resendPolicy.nextResendAt(attempt, now);
            String err = "resend failed: " + describe(e);
            store.update(txId, t -> {
                t.setError(err);
                t.setNextResendAt(retryAt);
                t.setUpdatedAt(now);
            });
            metrics.resend("error");
            log.warn("resend failed txId={} nonce={} attempt={} next={} err={}", txId, tx.getNonce(), attempt, retryAt, e.toString());
            return;
        }

        Instant now = clock.instant();
        Instant next = resendPolicy.nextResendAt(attempt, now);
        boolean written = store.update(txId, t -> {
            t.setSignedHex(newHex);
            t.appendHash(newHash);
            t.setResendCount(attempt);
            t.setStatus(TxStatus.PENDING);
            t.setError(null);
            t.setNextResendAt(next);
            t.setUpdatedAt(now);
        });
        metrics.resend("success");
        if (written) {
            log.info("resend ok txId={} nonce={} attempt={} txHash={} next={}", txId, tx.getNonce(), attempt, newHash, next);
        }
    }

    private void finish(TrackedTx tx, TxStatus status, String error) {
        Instant now = clock.instant();
        boolean written = store.update(tx.getId(), t -> {
            t.setStatus(status);
            t.setError(error);
            t.setUpdatedAt(now);
        });
        if (written) {
            metrics.transition(status);
            log.info("tx finished txId={} from={} nonce={} status={} txHash={}",
                    tx.getId(), tx.getFrom(), tx.getNonce(), status.wireName(), tx.getLastHash());
        }
    }

    private void advisory(String txId, String error) {
        store.update(txId, t -> t.setError(error));
    }

    private void refreshIfIdle(TrackedTx tx, Instant now) {
        Instant updatedAt = tx.getUpdatedAt();
        if (updatedAt != null && Duration.between(updatedAt, now).compareTo(props.getIdleRefreshInterval()) < 0) {
            return;
        }
        store.update(tx.getId(), t -> t.setUpdatedAt(now));
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return msg == null || msg.trim().isEmpty() ? e.getClass().getSimpleName() : msg;
    }
}
