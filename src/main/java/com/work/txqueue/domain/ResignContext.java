package com.work.txqueue.domain;

/**
 * 重签上下文（只读）。attempt 从 1 开始。
 */
public class ResignContext {

    private final String txId;
    private final String from;
    private final long nonce;
    private final int attempt;
    private final String previousSignedHex;

    public ResignContext(String txId, String from, long nonce, int attempt, String previousSignedHex) {
        this.txId = txId;
        this.from = from;
        this.nonce = nonce;
        this.attempt = attempt;
        this.previousSignedHex = previousSignedHex;
    }

    public String getTxId() {
        return txId;
    }

    public String getFrom() {
        return from;
    }

    public long getNonce() {
        return nonce;
    }

    public int getAttempt() {
        return attempt;
    }

    public String getPreviousSignedHex() {
        return previousSignedHex;
    }
}
