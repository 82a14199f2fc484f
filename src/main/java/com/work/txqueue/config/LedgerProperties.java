package com.work.txqueue.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 链节点连接配置。
 *
 * mode=mock: 使用 MockLedgerClient
 * mode=web3j: 使用 Web3jLedgerClient
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }
}
