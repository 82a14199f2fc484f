package com.work.txqueue.exception;

/**
 * 链节点调用失败（网络/超时/JSON-RPC error）。
 *
 * 与 NotFound 严格区分：NotFound 通过 Optional.empty()/false 表达，不抛异常。
 */
public class LedgerException extends TxQueueException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
