package com.work.txqueue.chain;

import java.util.Optional;

/**
 * 链交互最小端口。
 *
 * 所有方法均可重复调用（幂等）；瞬时失败抛 {@link com.work.txqueue.exception.LedgerException}，
 * 调用方需要区分“失败”与“未找到”。
 */
public interface LedgerClient {

    /**
     * 广播已签名交易（eth_sendRawTransaction），返回 txHash。
     */
    String sendRawTransaction(String signedHex);

    /**
     * 查询交易 receipt。empty 表示 NotFound（尚未打包）。
     */
    Optional<LedgerReceipt> getReceipt(String txHash);

    /**
     * 节点是否认识该 hash（pending 或已打包）。
     */
    boolean isVisible(String txHash);

    /**
     * 查询 sender 已确认的 nonce（EVM: eth_getTransactionCount(latest)）。
     */
    long getAccountNonce(String address);
}
