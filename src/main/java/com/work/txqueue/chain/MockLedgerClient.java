package com.work.txqueue.chain;

import com.work.txqueue.exception.LedgerException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Demo 级链节点：仅用于跑通最小链路。
 *
 * - txHash = keccak256(payload)，与真实节点一致：同一 payload 重复广播得到同一 hash
 * - 广播即可见，并立即产生成功 receipt（autoMine=true 时）
 */
@Component
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockLedgerClient implements LedgerClient {

    private final Map<String, Long> accountNonce = new ConcurrentHashMap<>();
    private final Map<String, LedgerReceipt> receipts = new ConcurrentHashMap<>();
    private final Set<String> visible = ConcurrentHashMap.newKeySet();
    private final AtomicLong blockNumber = new AtomicLong(1);
    private final AtomicBoolean failNextSend = new AtomicBoolean(false);
    private volatile boolean autoMine = true;

    @Override
    public String sendRawTransaction(String signedHex) {
        if (failNextSend.compareAndSet(true, false)) {
            throw new LedgerException("mock node rejected transaction");
        }
        String txHash = Hash.sha3(signedHex).toLowerCase(Locale.ROOT);
        visible.add(txHash);
        if (autoMine) {
            mine(txHash, true);
        }
        return txHash;
    }

    @Override
    public Optional<LedgerReceipt> getReceipt(String txHash) {
        return Optional.ofNullable(receipts.get(key(txHash)));
    }

    @Override
    public boolean isVisible(String txHash) {
        return visible.contains(key(txHash));
    }

    @Override
    public long getAccountNonce(String address) {
        return accountNonce.getOrDefault(key(address), 0L);
    }

    public void mine(String txHash, boolean success) {
        long bn = blockNumber.getAndIncrement();
        receipts.put(key(txHash), new LedgerReceipt(key(txHash), bn, "block_" + bn, success));
    }

    public void drop(String txHash) {
        visible.remove(key(txHash));
    }

    public void setAccountNonce(String address, long nonce) {
        accountNonce.put(key(address), nonce);
    }

    public void failNextSend() {
        failNextSend.set(true);
    }

    public void setAutoMine(boolean autoMine) {
        this.autoMine = autoMine;
    }

    private static String key(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
