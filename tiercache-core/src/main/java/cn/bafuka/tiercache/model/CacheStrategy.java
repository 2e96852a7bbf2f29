package cn.bafuka.tiercache.model;

import lombok.Builder;
import lombok.Value;

/**
 * 缓存策略
 * 每个缓存域一份，启动后只读
 */
@Value
@Builder(toBuilder = true)
public class CacheStrategy {

    /**
     * L1 内存缓存 TTL（毫秒），0 = 不使用 L1
     */
    long l1TtlMs;

    /**
     * L2 远程缓存 TTL（毫秒），0 = 不使用 L2
     */
    long l2TtlMs;

    /**
     * L1 条目上限
     */
    int l1MaxEntries;

    /**
     * L1 单值大小上限（UTF-8 字节），0 = 不限制
     * 超过上限的值只写 L2
     */
    int l1MaxValueSize;

    public boolean isL1Enabled() {
        return l1TtlMs > 0 && l1MaxEntries > 0;
    }

    public boolean isL2Enabled() {
        return l2TtlMs > 0;
    }

    public boolean hasL1ValueSizeLimit() {
        return l1MaxValueSize > 0;
    }

    /**
     * L2 过期时间（秒，向上取整）
     *
     * @return SET 命令的 EX 参数
     */
    public long l2TtlSeconds() {
        return (l2TtlMs + 999) / 1000;
    }
}
