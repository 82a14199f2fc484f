package com.work.txqueue.domain;

/**
 * 仅用于展示的附带信息（不在本组件内校验）。
 */
public class TxMeta {

    private static final TxMeta EMPTY = new TxMeta(null, null);

    private final String to;
    private final String value;

    public TxMeta(String to, String value) {
        this.to = to;
        this.value = value;
    }

    public static TxMeta empty() {
        return EMPTY;
    }

    public String getTo() {
        return to;
    }

    public String getValue() {
        return value;
    }
}
