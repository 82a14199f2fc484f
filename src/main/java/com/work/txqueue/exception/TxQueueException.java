package com.work.txqueue.exception;

/**
 * 组件内部的统一异常类型，便于业务侧捕获或转换为 HTTP 错误码。
 */
public class TxQueueException extends RuntimeException {

    public TxQueueException(String message) {
        super(message);
    }

    public TxQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
