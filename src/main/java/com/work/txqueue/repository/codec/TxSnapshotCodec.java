package com.work.txqueue.repository.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.txqueue.domain.TrackedTx;
import com.work.txqueue.domain.TxStatus;
import com.work.txqueue.exception.TxQueueException;
import com.work.txqueue.repository.entity.TrackedTxRecord;
import com.work.txqueue.repository.entity.TxQueueSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.work.txqueue.support.ValidationUtils.normalizeAddress;
import static com.work.txqueue.support.ValidationUtils.normalizeHex;

/**
 * 队列快照 JSON 编解码。
 *
 * 读取是宽松的（兼容旧版本快照）：
 * - 未知字段忽略；toAddress/valueHex 作为 to/value 的别名
 * - 时间戳缺失或无法解析 -> epoch（nextResendAt -> null）
 * - 未知状态 -> queued；broadcasting -> queued（恢复后不可能有进行中的广播）
 * - 无 id 或重复 id 的记录跳过
 * 只有 JSON 本身不合法时才抛 {@link TxQueueException}。
 */
@Component
public class TxSnapshotCodec {

    private static final Logger log = LoggerFactory.getLogger(TxSnapshotCodec.class);

    private final ObjectMapper objectMapper;

    public TxSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * @param items 最新优先
     */
    public String encode(List<TrackedTx> items) {
        TxQueueSnapshot snapshot = new TxQueueSnapshot();
        List<TrackedTxRecord> records = new ArrayList<>(items.size());
        for (TrackedTx t : items) {
            records.add(toRecord(t));
        }
        snapshot.setItems(records);
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new TxQueueException("序列化队列快照失败", e);
        }
    }

    /**
     * @return 与快照中顺序一致（最新优先）
     */
    public List<TrackedTx> decode(String blob) {
        TxQueueSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(blob, TxQueueSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new TxQueueException("队列快照格式错误", e);
        }
        List<TrackedTx> out = new ArrayList<>();
        if (snapshot == null || snapshot.getItems() == null) {
            return out;
        }
        if (snapshot.getVersion() > TxQueueSnapshot.CURRENT_VERSION) {
            log.warn("snapshot version={} newer than supported={}, reading leniently",
                    snapshot.getVersion(), TxQueueSnapshot.CURRENT_VERSION);
        }
        Set<String> seen = new HashSet<>();
        int skipped = 0;
        for (TrackedTxRecord r : snapshot.getItems()) {
            if (r == null || r.getId() == null || r.getId().trim().isEmpty() || !seen.add(r.getId())) {
                skipped++;
                continue;
            }
            out.add(fromRecord(r));
        }
        if (skipped > 0) {
            log.warn("snapshot decode skipped {} record(s) without id or with duplicate id", skipped);
        }
        return out;
    }

    TrackedTxRecord toRecord(TrackedTx t) {
        TrackedTxRecord r = new TrackedTxRecord();
        r.setId(t.getId());
        r.setFrom(t.getFrom());
        r.setNonce(t.getNonce());
        r.setSignedHex(t.getSignedHex());
        r.setHashes(new ArrayList<>(t.getHashes()));
        r.setTo(t.getTo());
        r.setValue(t.getValue());
        r.setCreatedAt(format(t.getCreatedAt()));
        r.setUpdatedAt(format(t.getUpdatedAt()));
        r.setStatus(t.getStatus().wireName());
        r.setError(t.getError());
        r.setResendCount(t.getResendCount());
        r.setNextResendAt(format(t.getNextResendAt()));
        return r;
    }

    TrackedTx fromRecord(TrackedTxRecord r) {
        TxStatus status = TxStatus.fromWireName(r.getStatus());
        if (status == TxStatus.BROADCASTING) {
            status = TxStatus.QUEUED;
        }
        List<String> hashes = new ArrayList<>();
        if (r.getHashes() != null) {
            for (String h : r.getHashes()) {
                if (h != null && !h.trim().isEmpty()) {
                    hashes.add(h.trim());
                }
            }
        }
        String signedHex = r.getSignedHex() == null || r.getSignedHex().trim().isEmpty()
                ? "" : normalizeHex(r.getSignedHex());
        long nonce = r.getNonce() == null ? 0L : Math.max(0L, r.getNonce());
        int resendCount = r.getResendCount() == null ? 0 : r.getResendCount();
        Instant createdAt = parseOr(r.getCreatedAt(), Instant.EPOCH);
        Instant updatedAt = parseOr(r.getUpdatedAt(), Instant.EPOCH);
        return new TrackedTx(r.getId(), normalizeAddress(r.getFrom()), nonce, r.getTo(), r.getValue(), signedHex,
                hashes, status, resendCount, parseOr(r.getNextResendAt(), null), r.getError(), createdAt, updatedAt);
    }

    private static String format(Instant t) {
        return t == null ? null : t.toString();
    }

    private static Instant parseOr(String s, Instant fallback) {
        if (s == null || s.trim().isEmpty()) {
            return fallback;
        }
        String t = s.trim();
        try {
            return Instant.parse(t);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(t).toInstant();
            } catch (DateTimeParseException ignored) {
                return fallback;
            }
        }
    }
}
