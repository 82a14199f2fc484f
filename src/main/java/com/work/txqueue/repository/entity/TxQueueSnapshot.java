package com.work.txqueue.repository.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 快照根对象：items 最新优先。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TxQueueSnapshot {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private List<TrackedTxRecord> items = new ArrayList<>();

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public List<TrackedTxRecord> getItems() {
        return items;
    }

    public void setItems(List<TrackedTxRecord> items) {
        this.items = items;
    }
}
