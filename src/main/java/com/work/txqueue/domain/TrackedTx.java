package com.work.txqueue.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一条被跟踪的交易：固定 nonce 的一次用户意图，可能以不同手续费重提多次。
 *
 * 约束：
 * - id/from/nonce/to/value/createdAt 创建后不可变（同 nonce 是 fee-bump 重提成立的前提）
 * - hashes 只追加，不重排、不截断
 * - 队列内部实例只由 TxQueueStore 在锁内修改；对外一律返回 {@link #copy()}
 */
public class TrackedTx {

    private final String id;
    private final String from;
    private final long nonce;
    private final String to;
    private final String value;
    private final Instant createdAt;

    private String signedHex;
    private final List<String> hashes;
    private TxStatus status;
    private int resendCount;
    private Instant nextResendAt;
    private String error;
    private Instant updatedAt;

    public TrackedTx(String id, String from, long nonce, String to, String value,
                     String signedHex, Instant createdAt) {
        this(id, from, nonce, to, value, signedHex, Collections.<String>emptyList(), TxStatus.QUEUED,
                0, null, null, createdAt, createdAt);
    }

    public TrackedTx(String id,
                     String from,
                     long nonce,
                     String to,
                     String value,
                     String signedHex,
                     List<String> hashes,
                     TxStatus status,
                     int resendCount,
                     Instant nextResendAt,
                     String error,
                     Instant createdAt,
                     Instant updatedAt) {
        this.id = id;
        this.from = from;
        this.nonce = nonce;
        this.to = to;
        this.value = value;
        this.signedHex = signedHex;
        this.hashes = new ArrayList<>(hashes == null ? Collections.<String>emptyList() : hashes);
        this.status = status == null ? TxStatus.QUEUED : status;
        this.resendCount = Math.max(0, resendCount);
        this.nextResendAt = nextResendAt;
        this.error = error;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public TrackedTx copy() {
        return new TrackedTx(id, from, nonce, to, value, signedHex, hashes, status, resendCount,
                nextResendAt, error, createdAt, updatedAt);
    }

    public String getId() {
        return id;
    }

    public String getFrom() {
        return from;
    }

    public long getNonce() {
        return nonce;
    }

    public String getTo() {
        return to;
    }

    public String getValue() {
        return value;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getSignedHex() {
        return signedHex;
    }

    public void setSignedHex(String signedHex) {
        this.signedHex = signedHex;
    }

    public List<String> getHashes() {
        return Collections.unmodifiableList(hashes);
    }

    public void appendHash(String hash) {
        if (hash != null) {
            hashes.add(hash);
        }
    }

    public String getLastHash() {
        return hashes.isEmpty() ? null : hashes.get(hashes.size() - 1);
    }

    public TxStatus getStatus() {
        return status;
    }

    public void setStatus(TxStatus status) {
        this.status = status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public int getResendCount() {
        return resendCount;
    }

    public void setResendCount(int resendCount) {
        this.resendCount = resendCount;
    }

    public Instant getNextResendAt() {
        return nextResendAt;
    }

    public void setNextResendAt(Instant nextResendAt) {
        this.nextResendAt = nextResendAt;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "TrackedTx{id=" + id + ", from=" + from + ", nonce=" + nonce + ", status=" + status
                + ", hashes=" + hashes.size() + ", resendCount=" + resendCount + "}";
    }
}
