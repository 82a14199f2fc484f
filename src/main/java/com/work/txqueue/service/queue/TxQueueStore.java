package com.work.txqueue.service.queue;

import com.work.txqueue.domain.Resigner;
import com.work.txqueue.domain.TrackedTx;
import com.work.txqueue.domain.TxStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static com.work.txqueue.support.ValidationUtils.hashKey;

/**
 * 队列聚合：id -> TrackedTx 映射 + 最新优先的 order 列表 + id -> Resigner 运行时能力。
 *
 * 所有读写都经过同一把锁（对象监视器），保证 map、order 与 resigner 永远一致：
 * - 读：一律返回副本，调用方拿到的对象与队列内部实例无关
 * - 写：{@link #update} 在锁内按 id 重新取实例，条目已被删除或已是终态时直接 no-op
 * - 锁内不做任何网络 IO（mutator 只能是纯内存修改）
 * - resigner 不参与快照，只存在于进程内；条目被删除时一并删除，replaceAll 时整体清空
 */
@Component
public class TxQueueStore {

    private final Map<String, TrackedTx> byId = new HashMap<>();
    private final LinkedList<String> order = new LinkedList<>();
    private final Map<String, Resigner> resigners = new HashMap<>();

    public synchronized void insert(TrackedTx tx) {
        insert(tx, null);
    }

    /**
     * 插入条目并在同一把锁内登记 resigner（可为 null）。
     */
    public synchronized void insert(TrackedTx tx, Resigner resigner) {
        if (byId.containsKey(tx.getId())) {
            throw new IllegalStateException("duplicate txId=" + tx.getId());
        }
        byId.put(tx.getId(), tx.copy());
        order.addFirst(tx.getId());
        if (resigner != null) {
            resigners.put(tx.getId(), resigner);
        }
    }

    /**
     * 替换（null 表示解除）已有条目的 resigner。条目不存在时返回 false，不登记任何东西。
     */
    public synchronized boolean attachResigner(String id, Resigner resigner) {
        if (id == null || !byId.containsKey(id)) {
            return false;
        }
        if (resigner == null) {
            resigners.remove(id);
        } else {
            resigners.put(id, resigner);
        }
        return true;
    }

    public synchronized Resigner getResigner(String id) {
        return id == null ? null : resigners.get(id);
    }

    public synchronized int resignerCount() {
        return resigners.size();
    }

    public synchronized TrackedTx get(String id) {
        TrackedTx t = id == null ? null : byId.get(id);
        return t == null ? null : t.copy();
    }

    public synchronized boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    /**
     * 广播认领：仅当条目仍为 QUEUED 时改为 BROADCASTING 并返回副本，否则返回 null。
     * 入队后的异步广播与 tick 同时看到 QUEUED 时，只有一方能认领，payload 只发一次。
     */
    public synchronized TrackedTx claimBroadcast(String id, Instant now) {
        TrackedTx t = id == null ? null : byId.get(id);
        if (t == null || t.getStatus() != TxStatus.QUEUED) {
            return null;
        }
        t.setStatus(TxStatus.BROADCASTING);
        t.setUpdatedAt(now);
        return t.copy();
    }

    /**
     * 按 id 重新取实例后修改。返回 false 表示条目不存在（已被 remove/gc）或已是终态。
     */
    public synchronized boolean update(String id, Consumer<TrackedTx> mutator) {
        TrackedTx t = id == null ? null : byId.get(id);
        if (t == null || t.isTerminal()) {
            return false;
        }
        mutator.accept(t);
        return true;
    }

    public synchronized boolean remove(String id) {
        if (id == null) {
            return false;
        }
        resigners.remove(id);
        if (byId.remove(id) == null) {
            return false;
        }
        order.remove(id);
        return true;
    }

    /**
     * 删除所有满足条件的条目，返回被删除的 id。
     */
    public synchronized List<String> removeIf(Predicate<TrackedTx> predicate) {
        List<String> removed = new ArrayList<>();
        Iterator<String> it = order.iterator();
        while (it.hasNext()) {
            String id = it.next();
            TrackedTx t = byId.get(id);
            if (t != null && predicate.test(t)) {
                it.remove();
                byId.remove(id);
                resigners.remove(id);
                removed.add(id);
            }
        }
        return removed;
    }

    /**
     * 整体替换（hydrate）。列表顺序即新的 order（最新优先）；重复 id 只保留第一条。
     * resigner 一并清空，需要业务重新 attach。
     */
    public synchronized void replaceAll(List<TrackedTx> items) {
        byId.clear();
        order.clear();
        resigners.clear();
        for (TrackedTx t : items) {
            if (t == null || t.getId() == null || byId.containsKey(t.getId())) {
                continue;
            }
            byId.put(t.getId(), t.copy());
            order.addLast(t.getId());
        }
    }

    public synchronized List<TrackedTx> listAll() {
        List<TrackedTx> out = new ArrayList<>(order.size());
        for (String id : order) {
            out.add(byId.get(id).copy());
        }
        return out;
    }

    public synchronized List<String> listOrder() {
        return new ArrayList<>(order);
    }

    /**
     * 最新优先的前 limit 条非终态条目。
     */
    public synchronized List<TrackedTx> listNonTerminal(int limit) {
        List<TrackedTx> out = new ArrayList<>();
        for (String id : order) {
            if (out.size() >= limit) {
                break;
            }
            TrackedTx t = byId.get(id);
            if (!t.isTerminal()) {
                out.add(t.copy());
            }
        }
        return out;
    }

    /**
     * 按任意历史 hash 查找（重提会换 hash，调用方可能只知道旧的）。
     */
    public synchronized Optional<TrackedTx> findByHash(String hash) {
        if (hash == null || hash.trim().isEmpty()) {
            return Optional.empty();
        }
        String key = hashKey(hash);
        for (String id : order) {
            TrackedTx t = byId.get(id);
            for (String h : t.getHashes()) {
                if (hashKey(h).equals(key)) {
                    return Optional.of(t.copy());
                }
            }
        }
        return Optional.empty();
    }

    public synchronized int size() {
        return byId.size();
    }
}
