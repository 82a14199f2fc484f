package com.work.txqueue.repository.impl;

import com.work.txqueue.exception.TxQueueException;
import com.work.txqueue.repository.SnapshotStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Redis 快照存储：单个 string key 保存整份 JSON。
 */
@Component
@ConditionalOnProperty(prefix = "txqueue", name = "snapshot-store", havingValue = "redis")
public class RedisSnapshotStore implements SnapshotStore {

    private final StringRedisTemplate redisTemplate;

    public RedisSnapshotStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
    }

    @Override
    public void save(String key, String blob) {
        try {
            redisTemplate.opsForValue().set(key, blob);
        } catch (DataAccessException e) {
            throw new TxQueueException("写入 Redis 快照失败 key=" + key, e);
        }
    }

    @Override
    public Optional<String> load(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new TxQueueException("读取 Redis 快照失败 key=" + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new TxQueueException("删除 Redis 快照失败 key=" + key, e);
        }
    }
}
