package com.work.txqueue.support;

import com.work.txqueue.repository.SnapshotStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内快照存储，默认实现（本地开发 / 测试）。
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, String> blobs = new ConcurrentHashMap<>();

    @Override
    public void save(String key, String blob) {
        blobs.put(key, blob);
    }

    @Override
    public Optional<String> load(String key) {
        return Optional.ofNullable(blobs.get(key));
    }

    @Override
    public void delete(String key) {
        blobs.remove(key);
    }
}
