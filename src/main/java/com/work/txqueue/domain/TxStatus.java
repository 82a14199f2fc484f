package com.work.txqueue.domain;

import java.util.Locale;

/**
 * 交易生命周期状态（对外字符串化为小写名称，例如 "pending"）。
 *
 * QUEUED/BROADCASTING/PENDING 为非终态；其余为终态，终态条目不再被 monitor 修改。
 */
public enum TxStatus {
    QUEUED,
    BROADCASTING,
    /**
     * 已广播，mempool 中或尚未可见。
     */
    PENDING,
    /**
     * receipt 已出现且执行成功。
     */
    MINED,
    /**
     * receipt 已出现但执行失败（已被链接收，区别于 REJECTED）。
     */
    FAILED,
    /**
     * 软判定：重提窗口耗尽且节点不可见，链上仍可能在之后打包。
     */
    DROPPED,
    /**
     * sender nonce 已越过本条 nonce，但本条所有 hash 均无 receipt。
     */
    REPLACED,
    /**
     * 首次广播被节点直接拒绝。
     */
    REJECTED;

    public boolean isTerminal() {
        switch (this) {
            case QUEUED:
            case BROADCASTING:
            case PENDING:
                return false;
            case MINED:
            case FAILED:
            case DROPPED:
            case REPLACED:
            case REJECTED:
                return true;
            default:
                throw new IllegalStateException("unknown status " + this);
        }
    }

    public boolean isPendingLike() {
        return !isTerminal();
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 宽松解析：未知/空值回落为 QUEUED（与历史快照兼容）。
     */
    public static TxStatus fromWireName(String s) {
        if (s == null || s.trim().isEmpty()) {
            return QUEUED;
        }
        String t = s.trim().toUpperCase(Locale.ROOT);
        for (TxStatus st : values()) {
            if (st.name().equals(t)) {
                return st;
            }
        }
        return QUEUED;
    }
}
