package com.work.txqueue.support.metrics;

import com.work.txqueue.domain.TxStatus;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；业务/平台可通过自定义 Bean 接入 Micrometer 等实现。
 */
public interface TxQueueMetrics {

    default void broadcast(String result) {
    }

    default void receiptCheck(String result) {
    }

    default void nonceCheck(String result) {
    }

    default void visibilityCheck(String result) {
    }

    default void resend(String result) {
    }

    default void transition(TxStatus to) {
    }

    default void tickBatch(int size) {
    }
}
