package com.work.txqueue.service.queue;

import com.work.txqueue.domain.Resigner;
import com.work.txqueue.domain.TrackedTx;
import com.work.txqueue.domain.TxStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TxQueueStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static TrackedTx tx(String id, long nonce) {
        return new TrackedTx(id, "0xabc", nonce, null, null, "0x01", T0);
    }

    @Test
    public void insert_prepends_and_rejects_duplicate_id() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("a", 1));
        store.insert(tx("b", 2));

        assertEquals(Arrays.asList("b", "a"), store.listOrder());
        assertThrows(IllegalStateException.class, () -> store.insert(tx("a", 3)));
        assertEquals(2, store.size());
    }

    @Test
    public void reads_return_copies() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("a", 1));

        TrackedTx copy = store.get("a");
        copy.setStatus(TxStatus.MINED);
        copy.appendHash("0xdead");

        TrackedTx again = store.get("a");
        assertEquals(TxStatus.QUEUED, again.getStatus());
        assertTrue(again.getHashes().isEmpty());
    }

    @Test
    public void claim_broadcast_only_succeeds_once() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("a", 1));

        TrackedTx first = store.claimBroadcast("a", T0.plusSeconds(1));
        TrackedTx second = store.claimBroadcast("a", T0.plusSeconds(2));

        assertNotNull(first);
        assertEquals(TxStatus.BROADCASTING, first.getStatus());
        assertNull(second);
        assertNull(store.claimBroadcast("missing", T0));
    }

    @Test
    public void update_is_noop_for_missing_or_terminal_entry() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("a", 1));

        assertTrue(store.update("a", t -> t.setStatus(TxStatus.FAILED)));
        assertFalse(store.update("a", t -> t.setStatus(TxStatus.PENDING)));
        assertEquals(TxStatus.FAILED, store.get("a").getStatus());
        assertFalse(store.update("missing", t -> t.setError("x")));
    }

    @Test
    public void remove_if_returns_removed_ids_and_keeps_order_consistent() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("a", 1));
        store.insert(tx("b", 2));
        store.insert(tx("c", 3));

        List<String> removed = store.removeIf(t -> t.getNonce() != 2);

        assertEquals(Arrays.asList("c", "a"), removed);
        assertEquals(Arrays.asList("b"), store.listOrder());
        assertFalse(store.contains("a"));
        assertTrue(store.remove("b"));
        assertFalse(store.remove("b"));
        assertEquals(0, store.size());
    }

    @Test
    public void list_non_terminal_is_newest_first_and_limited() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("a", 1));
        store.insert(tx("b", 2));
        store.insert(tx("c", 3));
        store.insert(tx("d", 4));
        store.update("c", t -> t.setStatus(TxStatus.MINED));

        List<TrackedTx> batch = store.listNonTerminal(2);

        assertEquals(2, batch.size());
        assertEquals("d", batch.get(0).getId());
        assertEquals("b", batch.get(1).getId());
    }

    @Test
    public void find_by_hash_matches_any_historical_hash_case_insensitively() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("a", 1));
        store.update("a", t -> {
            t.appendHash("0xAAA1");
            t.appendHash("0xbbb2");
        });

        assertEquals("a", store.findByHash("0xaaa1").get().getId());
        assertEquals("a", store.findByHash("BBB2").get().getId());
        assertFalse(store.findByHash("0xccc3").isPresent());
        assertFalse(store.findByHash(" ").isPresent());
    }

    @Test
    public void replace_all_keeps_list_order_and_skips_duplicates() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("old", 9));

        store.replaceAll(Arrays.asList(tx("x", 1), tx("y", 2), tx("x", 3)));

        assertEquals(Arrays.asList("x", "y"), store.listOrder());
        assertEquals(1L, store.get("x").getNonce());
        assertFalse(store.contains("old"));
    }

    @Test
    public void resigner_lives_and_dies_with_its_entry() {
        TxQueueStore store = new TxQueueStore();
        Resigner resigner = ctx -> "0x02";
        store.insert(tx("a", 1), resigner);
        store.insert(tx("b", 2));

        assertSame(resigner, store.getResigner("a"));
        assertNull(store.getResigner("b"));
        assertTrue(store.attachResigner("b", resigner));
        assertEquals(2, store.resignerCount());

        assertTrue(store.remove("a"));
        assertFalse(store.attachResigner("a", resigner));
        assertNull(store.getResigner("a"));

        store.update("b", t -> t.setStatus(TxStatus.MINED));
        store.removeIf(TrackedTx::isTerminal);
        assertEquals(0, store.resignerCount());
    }

    @Test
    public void attach_with_null_detaches() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("a", 1), ctx -> "0x02");

        assertTrue(store.attachResigner("a", null));

        assertNull(store.getResigner("a"));
        assertEquals(0, store.resignerCount());
    }

    @Test
    public void replace_all_clears_resigners_but_later_inserts_keep_theirs() {
        TxQueueStore store = new TxQueueStore();
        store.insert(tx("a", 1), ctx -> "0x02");

        store.replaceAll(Arrays.asList(tx("a", 1), tx("s", 2)));
        assertNull(store.getResigner("a"));

        Resigner resigner = ctx -> "0x03";
        store.insert(tx("c", 3), resigner);
        assertSame(resigner, store.getResigner("c"));
        assertEquals(1, store.resignerCount());
    }
}
