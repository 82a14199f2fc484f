package com.work.txqueue.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 交易队列配置项。
 *
 * 注意：stuckThreshold 是经验阈值（没有节点侧 fee market 数据佐证），只影响“可见但卡住”的重提时机，
 * 不能用来防止网络延迟下的重复提交。
 */
@ConfigurationProperties(prefix = "txqueue")
public class TxQueueProperties {

    /**
     * monitor tick 间隔（fixed delay）。
     */
    private Duration monitorInterval = Duration.ofSeconds(7);

    /**
     * 应用启动后是否自动开始 tick。
     */
    private boolean monitorAutoStart = true;

    /**
     * 每个 tick 最多处理的非终态条目数（最新优先）。
     */
    private int batchSize = 30;

    /**
     * 首次广播线程数。
     */
    private int broadcastWorkers = 4;

    /**
     * 最大重提次数。
     */
    private int maxResends = 3;

    /**
     * 重提基础间隔表：attempt 0/1 取第一个，超出表长取最后一个。
     */
    private List<Duration> resendSchedule = new ArrayList<>(Arrays.asList(
            Duration.ofSeconds(45),
            Duration.ofSeconds(90),
            Duration.ofSeconds(180)));

    /**
     * 抖动比例（±）。
     */
    private double jitterRatio = 0.25;

    private Duration minResendDelay = Duration.ofSeconds(10);

    private Duration maxResendDelay = Duration.ofMinutes(10);

    /**
     * 过了 gate 之后仍“可见”的交易，再等多久视为手续费过低而卡住。
     */
    private Duration stuckThreshold = Duration.ofSeconds(20);

    /**
     * pending 条目空闲超过该时长时刷新 updatedAt（仅展示用途）。
     */
    private Duration idleRefreshInterval = Duration.ofMinutes(2);

    /**
     * gc 默认保留时长（终态且 updatedAt 早于 now - gcRetention 的条目会被清理）。
     */
    private Duration gcRetention = Duration.ofHours(24);

    /**
     * 快照在 SnapshotStore 中的 key。
     */
    private String snapshotKey = "txqueue:snapshot";

    public Duration getMonitorInterval() {
        return monitorInterval;
    }

    public void setMonitorInterval(Duration monitorInterval) {
        this.monitorInterval = monitorInterval;
    }

    public boolean isMonitorAutoStart() {
        return monitorAutoStart;
    }

    public void setMonitorAutoStart(boolean monitorAutoStart) {
        this.monitorAutoStart = monitorAutoStart;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getBroadcastWorkers() {
        return broadcastWorkers;
    }

    public void setBroadcastWorkers(int broadcastWorkers) {
        this.broadcastWorkers = broadcastWorkers;
    }

    public int getMaxResends() {
        return maxResends;
    }

    public void setMaxResends(int maxResends) {
        this.maxResends = maxResends;
    }

    public List<Duration> getResendSchedule() {
        return resendSchedule;
    }

    public void setResendSchedule(List<Duration> resendSchedule) {
        this.resendSchedule = resendSchedule;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
        this.jitterRatio = jitterRatio;
    }

    public Duration getMinResendDelay() {
        return minResendDelay;
    }

    public void setMinResendDelay(Duration minResendDelay) {
        this.minResendDelay = minResendDelay;
    }

    public Duration getMaxResendDelay() {
        return maxResendDelay;
    }

    public void setMaxResendDelay(Duration maxResendDelay) {
        this.maxResendDelay = maxResendDelay;
    }

    public Duration getStuckThreshold() {
        return stuckThreshold;
    }

    public void setStuckThreshold(Duration stuckThreshold) {
        this.stuckThreshold = stuckThreshold;
    }

    public Duration getIdleRefreshInterval() {
        return idleRefreshInterval;
    }

    public void setIdleRefreshInterval(Duration idleRefreshInterval) {
        this.idleRefreshInterval = idleRefreshInterval;
    }

    public Duration getGcRetention() {
        return gcRetention;
    }

    public void setGcRetention(Duration gcRetention) {
        this.gcRetention = gcRetention;
    }

    public String getSnapshotKey() {
        return snapshotKey;
    }

    public void setSnapshotKey(String snapshotKey) {
        this.snapshotKey = snapshotKey;
    }
}
