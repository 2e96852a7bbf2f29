package cn.bafuka.tiercache.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存指标快照
 * 只读副本，可以直接暴露给运维面板
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheMetricsSnapshot {

    private String domain;
    private long l1Hits;
    private long l1Misses;
    private long l2Hits;
    private long l2Misses;
    private long sets;
    private long invalidations;

    /**
     * 远程缓存已配置但调用失败的次数
     */
    private long l2Errors;

    /**
     * 计算 L1 命中率
     *
     * @return 命中率（0.0 ~ 1.0），无请求时为 0
     */
    public double l1HitRate() {
        long requestCount = l1Hits + l1Misses;
        return requestCount == 0 ? 0.0 : (double) l1Hits / requestCount;
    }

    /**
     * 计算 L2 命中率
     *
     * @return 命中率（0.0 ~ 1.0），无请求时为 0
     */
    public double l2HitRate() {
        long requestCount = l2Hits + l2Misses;
        return requestCount == 0 ? 0.0 : (double) l2Hits / requestCount;
    }

    public boolean hasActivity() {
        return l1Hits + l1Misses + l2Hits + l2Misses + sets + invalidations + l2Errors > 0;
    }
}
