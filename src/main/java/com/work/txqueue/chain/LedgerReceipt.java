package com.work.txqueue.chain;

/**
 * 最小 receipt 表达：只关心是否执行成功，区块信息用于日志/展示。
 */
public class LedgerReceipt {

    private final String txHash;
    private final long blockNumber;
    private final String blockHash;
    private final boolean success;

    public LedgerReceipt(String txHash, long blockNumber, String blockHash, boolean success) {
        this.txHash = txHash;
        this.blockNumber = blockNumber;
        this.blockHash = blockHash;
        this.success = success;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public boolean isSuccess() {
        return success;
    }
}
