package com.work.txqueue.chain.web3j;

import com.work.txqueue.chain.LedgerClient;
import com.work.txqueue.chain.LedgerReceipt;
import com.work.txqueue.exception.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.EthTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Optional;

/**
 * 基于 Web3j 的链客户端实现：
 * - 广播 eth_sendRawTransaction
 * - 查询交易回执 eth_getTransactionReceipt
 * - 查询可见性 eth_getTransactionByHash（非 null 即节点认识该交易）
 * - 查询地址链上 nonce eth_getTransactionCount(latest)
 *
 * IOException 与 JSON-RPC error 一律转换为 {@link LedgerException}。
 */
public class Web3jLedgerClient implements LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerClient.class);

    private final Web3j web3j;

    public Web3jLedgerClient(Web3j web3j) {
        this.web3j = web3j;
    }

    @Override
    public String sendRawTransaction(String signedHex) {
        EthSendTransaction resp;
        try {
            resp = web3j.ethSendRawTransaction(signedHex).send();
        } catch (IOException e) {
            throw new LedgerException("eth_sendRawTransaction io error: " + e.getMessage(), e);
        }
        ensureNoError(resp, "eth_sendRawTransaction");
        String txHash = resp.getTransactionHash();
        if (txHash == null || txHash.trim().isEmpty()) {
            throw new LedgerException("eth_sendRawTransaction returned empty tx hash");
        }
        return txHash;
    }

    @Override
    public Optional<LedgerReceipt> getReceipt(String txHash) {
        EthGetTransactionReceipt resp;
        try {
            resp = web3j.ethGetTransactionReceipt(txHash).send();
        } catch (IOException e) {
            log.warn("Web3j getTransactionReceipt failed. txHash={} err={}", txHash, e.getMessage());
            throw new LedgerException("eth_getTransactionReceipt io error: " + e.getMessage(), e);
        }
        ensureNoError(resp, "eth_getTransactionReceipt");
        Optional<TransactionReceipt> receiptOpt = resp.getTransactionReceipt();
        if (!receiptOpt.isPresent()) {
            return Optional.empty();
        }
        TransactionReceipt r = receiptOpt.get();
        BigInteger bn = r.getBlockNumber();
        return Optional.of(new LedgerReceipt(txHash, bn == null ? -1L : bn.longValue(), r.getBlockHash(), isReceiptSuccess(r)));
    }

    @Override
    public boolean isVisible(String txHash) {
        EthTransaction resp;
        try {
            resp = web3j.ethGetTransactionByHash(txHash).send();
        } catch (IOException e) {
            throw new LedgerException("eth_getTransactionByHash io error: " + e.getMessage(), e);
        }
        ensureNoError(resp, "eth_getTransactionByHash");
        return resp.getTransaction().isPresent();
    }

    @Override
    public long getAccountNonce(String address) {
        EthGetTransactionCount resp;
        try {
            resp = web3j.ethGetTransactionCount(address, DefaultBlockParameterName.LATEST).send();
        } catch (IOException e) {
            throw new LedgerException("eth_getTransactionCount io error: " + e.getMessage(), e);
        }
        ensureNoError(resp, "eth_getTransactionCount");
        return resp.getTransactionCount().longValue();
    }

    private static void ensureNoError(Response<?> resp, String method) {
        if (resp == null) {
            throw new LedgerException(method + " returned no response");
        }
        if (resp.hasError()) {
            throw new LedgerException(method + " rpc error: " + resp.getError().getMessage());
        }
    }

    private static boolean isReceiptSuccess(TransactionReceipt receipt) {
        // EVM receipt status: 0x1 success, 0x0 failure；缺失 status（pre-Byzantium）按成功处理
        String status = receipt.getStatus();
        if (status == null) {
            return true;
        }
        return !"0x0".equalsIgnoreCase(status.trim());
    }
}
