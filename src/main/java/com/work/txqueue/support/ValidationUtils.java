package com.work.txqueue.support;

import java.time.Duration;
import java.util.Locale;

/**
 * 参数校验与格式归一化工具类。
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration不能为负数（允许 0）
     */
    public static Duration requireNonNegative(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative()) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return duration;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * hex 统一为 0x 前缀（0X -> 0x，无前缀补 0x），不改变大小写。
     */
    public static String normalizeHex(String s) {
        String t = s == null ? "" : s.trim();
        if (t.startsWith("0x") || t.startsWith("0X")) {
            return "0x" + t.substring(2);
        }
        return "0x" + t;
    }

    /**
     * 地址统一为小写；0X 前缀归一为 0x。非 0x 地址（例如 bech32）同样小写。
     */
    public static String normalizeAddress(String s) {
        String t = s == null ? "" : s.trim();
        if (t.startsWith("0x") || t.startsWith("0X")) {
            return "0x" + t.substring(2).toLowerCase(Locale.ROOT);
        }
        return t.toLowerCase(Locale.ROOT);
    }

    /**
     * hash 比较用的归一形式：0x 前缀 + 小写。
     */
    public static String hashKey(String hash) {
        return normalizeHex(hash).toLowerCase(Locale.ROOT);
    }
}
