package com.work.txqueue.domain;

/**
 * 业务侧提供的重签回调：在同一 nonce 上产出手续费更高的新签名交易（0x hex）。
 *
 * 约束：
 * - 必须保持 {@link ResignContext#getNonce()} 不变
 * - 运行在 monitor 线程上，不应长时间阻塞
 * - 抛异常表示本轮重提放弃，条目保持 pending，下一个 gate 再试
 */
@FunctionalInterface
public interface Resigner {

    String resign(ResignContext ctx) throws Exception;
}
