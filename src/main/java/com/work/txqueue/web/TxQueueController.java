package com.work.txqueue.web;

import com.work.txqueue.domain.TrackedTx;
import com.work.txqueue.domain.TxMeta;
import com.work.txqueue.service.TxQueueService;
import com.work.txqueue.web.dto.EnqueueTxRequest;
import com.work.txqueue.web.dto.TrackedTxView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 交易队列 HTTP 入口（poll-only）。HTTP 入队的交易没有 resigner，不会自动重提。
 */
@RestController
@RequestMapping("/api/v1/tx-queue")
public class TxQueueController {

    private final TxQueueService queueService;

    public TxQueueController(TxQueueService queueService) {
        this.queueService = queueService;
    }

    @PostMapping
    public ResponseEntity<TrackedTxView> enqueue(@Validated @RequestBody EnqueueTxRequest req) {
        TrackedTx tx = queueService.enqueueSigned(req.getFrom(), req.getNonce(), req.getSignedHex(),
                new TxMeta(req.getTo(), req.getValue()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toView(tx));
    }

    @GetMapping
    public ResponseEntity<List<TrackedTxView>> list(@RequestParam(value = "filter", defaultValue = "all") String filter) {
        List<TrackedTx> items;
        switch (filter.trim().toLowerCase(Locale.ROOT)) {
            case "all":
                items = queueService.listAll();
                break;
            case "pending":
                items = queueService.listPending();
                break;
            case "finished":
                items = queueService.listFinished();
                break;
            default:
                throw new IllegalArgumentException("filter 只支持 all/pending/finished: " + filter);
        }
        List<TrackedTxView> out = new ArrayList<>(items.size());
        for (TrackedTx t : items) {
            out.add(toView(t));
        }
        return ResponseEntity.ok(out);
    }

    @GetMapping("/{txId}")
    public ResponseEntity<TrackedTxView> get(@PathVariable String txId) {
        return toResponse(queueService.findById(txId));
    }

    @GetMapping("/by-hash/{txHash}")
    public ResponseEntity<TrackedTxView> getByHash(@PathVariable String txHash) {
        return toResponse(queueService.findByHash(txHash));
    }

    @DeleteMapping("/{txId}")
    public ResponseEntity<Void> remove(@PathVariable String txId) {
        if (!queueService.remove(txId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/gc")
    public ResponseEntity<Integer> gc(@RequestParam(value = "olderThanSeconds", required = false) Long olderThanSeconds) {
        int removed = olderThanSeconds == null
                ? queueService.gc()
                : queueService.gc(Duration.ofSeconds(olderThanSeconds));
        return ResponseEntity.ok(removed);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    private ResponseEntity<TrackedTxView> toResponse(Optional<TrackedTx> tx) {
        if (!tx.isPresent()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toView(tx.get()));
    }

    private TrackedTxView toView(TrackedTx t) {
        TrackedTxView v = new TrackedTxView();
        v.setId(t.getId());
        v.setFrom(t.getFrom());
        v.setNonce(t.getNonce());
        v.setTo(t.getTo());
        v.setValue(t.getValue());
        v.setStatus(t.getStatus().wireName());
        v.setHashes(new ArrayList<>(t.getHashes()));
        v.setLastHash(t.getLastHash());
        v.setResendCount(t.getResendCount());
        v.setNextResendAt(t.getNextResendAt());
        v.setError(t.getError());
        v.setCreatedAt(t.getCreatedAt());
        v.setUpdatedAt(t.getUpdatedAt());
        return v;
    }
}
