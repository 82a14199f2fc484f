package com.work.txqueue.service.resend;

import com.work.txqueue.config.TxQueueProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.work.txqueue.support.ValidationUtils.requireNonNull;

/**
 * 查表 + 抖动 + 上下限裁剪：
 * - 下标：attempt <= 0 取第 0 项，否则 min(attempt - 1, size - 1)
 * - 抖动：基础间隔的 ±jitterRatio，均匀分布
 * - 裁剪到 [minDelay, maxDelay]，防止时钟偏移或配置错误导致的极端值
 *
 * 生产使用随机源，只能按区间断言；测试可注入固定 seed 的 Random。
 */
public final class JitteredResendPolicy implements ResendPolicy {

    private final List<Duration> schedule;
    private final double jitterRatio;
    private final long minDelayMs;
    private final long maxDelayMs;
    private final Random random;

    public JitteredResendPolicy(List<Duration> schedule, double jitterRatio, Duration minDelay, Duration maxDelay, Random random) {
        requireNonNull(schedule, "schedule");
        if (schedule.isEmpty()) {
            throw new IllegalArgumentException("schedule 不能为空");
        }
        for (Duration d : schedule) {
            if (d == null || d.isNegative()) {
                throw new IllegalArgumentException("schedule 不能包含空值或负数: " + schedule);
            }
        }
        if (jitterRatio < 0 || jitterRatio >= 1) {
            throw new IllegalArgumentException("jitterRatio 必须在 [0, 1) 内, got: " + jitterRatio);
        }
        requireNonNull(minDelay, "minDelay");
        requireNonNull(maxDelay, "maxDelay");
        if (minDelay.compareTo(maxDelay) > 0) {
            throw new IllegalArgumentException("minDelay 不能大于 maxDelay");
        }
        this.schedule = new ArrayList<>(schedule);
        this.jitterRatio = jitterRatio;
        this.minDelayMs = minDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.random = requireNonNull(random, "random");
    }

    public static JitteredResendPolicy fromProperties(TxQueueProperties props, Random random) {
        return new JitteredResendPolicy(props.getResendSchedule(), props.getJitterRatio(),
                props.getMinResendDelay(), props.getMaxResendDelay(), random);
    }

    @Override
    public Instant nextResendAt(int attempt, Instant baseTime) {
        requireNonNull(baseTime, "baseTime");
        return baseTime.plusMillis(delayMs(attempt));
    }

    long delayMs(int attempt) {
        int idx = attempt <= 0 ? 0 : Math.min(attempt - 1, schedule.size() - 1);
        long base = schedule.get(idx).toMillis();
        double factor = (random.nextDouble() * 2.0 - 1.0) * jitterRatio;
        long jittered = base + (long) (base * factor);
        return Math.max(minDelayMs, Math.min(maxDelayMs, jittered));
    }
}
