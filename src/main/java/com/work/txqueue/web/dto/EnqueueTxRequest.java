package com.work.txqueue.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;

/**
 * 入队请求：调用方已完成签名，本服务只负责广播与跟踪。
 */
public class EnqueueTxRequest {

    @NotBlank(message = "from 不能为空")
    private String from;

    @NotNull(message = "nonce 不能为空")
    @PositiveOrZero(message = "nonce 不能为负数")
    private Long nonce;

    @NotBlank(message = "signedHex 不能为空")
    private String signedHex;

    /**
     * 仅用于展示（可选）。
     */
    private String to;

    private String value;

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public Long getNonce() {
        return nonce;
    }

    public void setNonce(Long nonce) {
        this.nonce = nonce;
    }

    public String getSignedHex() {
        return signedHex;
    }

    public void setSignedHex(String signedHex) {
        this.signedHex = signedHex;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
