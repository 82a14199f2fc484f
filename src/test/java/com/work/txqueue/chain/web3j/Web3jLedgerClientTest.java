package com.work.txqueue.chain.web3j;

import com.work.txqueue.chain.LedgerReceipt;
import com.work.txqueue.exception.LedgerException;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.EthTransaction;
import org.web3j.protocol.core.methods.response.Transaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@SuppressWarnings("unchecked")
public class Web3jLedgerClientTest {

    private final Web3j web3j = mock(Web3j.class);
    private final Web3jLedgerClient client = new Web3jLedgerClient(web3j);

    @Test
    public void send_returns_hash() throws Exception {
        EthSendTransaction resp = new EthSendTransaction();
        resp.setResult("0xabc");
        Request<?, EthSendTransaction> req = mock(Request.class);
        when(req.send()).thenReturn(resp);
        doReturn(req).when(web3j).ethSendRawTransaction("0x01");

        assertEquals("0xabc", client.sendRawTransaction("0x01"));
    }

    @Test
    public void send_rpc_error_is_ledger_exception() throws Exception {
        EthSendTransaction resp = new EthSendTransaction();
        resp.setError(new Response.Error(-32000, "nonce too low"));
        Request<?, EthSendTransaction> req = mock(Request.class);
        when(req.send()).thenReturn(resp);
        doReturn(req).when(web3j).ethSendRawTransaction("0x01");

        LedgerException e = assertThrows(LedgerException.class, () -> client.sendRawTransaction("0x01"));
        assertTrue(e.getMessage().contains("nonce too low"));
    }

    @Test
    public void io_error_is_ledger_exception() throws Exception {
        Request<?, EthGetTransactionReceipt> req = mock(Request.class);
        when(req.send()).thenThrow(new IOException("connection refused"));
        doReturn(req).when(web3j).ethGetTransactionReceipt("0xh");

        assertThrows(LedgerException.class, () -> client.getReceipt("0xh"));
    }

    @Test
    public void missing_receipt_is_empty_not_error() throws Exception {
        EthGetTransactionReceipt resp = new EthGetTransactionReceipt();
        resp.setResult(null);
        Request<?, EthGetTransactionReceipt> req = mock(Request.class);
        when(req.send()).thenReturn(resp);
        doReturn(req).when(web3j).ethGetTransactionReceipt("0xh");

        assertFalse(client.getReceipt("0xh").isPresent());
    }

    @Test
    public void receipt_status_maps_to_success_flag() throws Exception {
        assertFalse(receiptWithStatus("0x0").isSuccess());
        assertTrue(receiptWithStatus("0x1").isSuccess());
        assertTrue(receiptWithStatus(null).isSuccess());
    }

    @Test
    public void visibility_follows_transaction_lookup() throws Exception {
        EthTransaction known = new EthTransaction();
        known.setResult(new Transaction());
        EthTransaction unknown = new EthTransaction();
        unknown.setResult(null);
        Request<?, EthTransaction> r1 = mock(Request.class);
        Request<?, EthTransaction> r2 = mock(Request.class);
        when(r1.send()).thenReturn(known);
        when(r2.send()).thenReturn(unknown);
        doReturn(r1).when(web3j).ethGetTransactionByHash("0xh1");
        doReturn(r2).when(web3j).ethGetTransactionByHash("0xh2");

        assertTrue(client.isVisible("0xh1"));
        assertFalse(client.isVisible("0xh2"));
    }

    @Test
    public void account_nonce_uses_latest_block() throws Exception {
        EthGetTransactionCount resp = new EthGetTransactionCount();
        resp.setResult("0x5");
        Request<?, EthGetTransactionCount> req = mock(Request.class);
        when(req.send()).thenReturn(resp);
        doReturn(req).when(web3j).ethGetTransactionCount("0xa", DefaultBlockParameterName.LATEST);

        assertEquals(5L, client.getAccountNonce("0xa"));
    }

    private LedgerReceipt receiptWithStatus(String status) throws Exception {
        TransactionReceipt r = new TransactionReceipt();
        r.setStatus(status);
        r.setBlockNumber("0xa");
        r.setBlockHash("0xblock");
        EthGetTransactionReceipt resp = new EthGetTransactionReceipt();
        resp.setResult(r);
        Request<?, EthGetTransactionReceipt> req = mock(Request.class);
        when(req.send()).thenReturn(resp);
        doReturn(req).when(web3j).ethGetTransactionReceipt("0xh");

        Optional<LedgerReceipt> out = client.getReceipt("0xh");
        assertTrue(out.isPresent());
        assertEquals(10L, out.get().getBlockNumber());
        return out.get();
    }
}
