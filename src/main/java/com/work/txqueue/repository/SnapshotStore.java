package com.work.txqueue.repository;

import java.util.Optional;

/**
 * 快照 blob 的 key/value 存储。
 *
 * @see com.work.txqueue.support.InMemorySnapshotStore
 * @see com.work.txqueue.repository.impl.RedisSnapshotStore
 */
public interface SnapshotStore {

    void save(String key, String blob);

    Optional<String> load(String key);

    void delete(String key);
}
