package com.work.txqueue.service.resend;

import java.time.Instant;

/**
 * 计算下一次允许重提的时间点。maxResends 由 monitor 负责，不在此处判断。
 *
 * @see JitteredResendPolicy
 */
public interface ResendPolicy {

    /**
     * @param attempt  已完成（或即将完成）的重提序号，0 表示首次广播后的第一个 gate
     * @param baseTime 计时起点
     */
    Instant nextResendAt(int attempt, Instant baseTime);
}
