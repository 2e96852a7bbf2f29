package cn.bafuka.tiercache.core;

import com.alibaba.fastjson.TypeReference;

/**
 * 两级缓存门面
 * 外部调用方唯一的入口。远程缓存不可用时任何方法都不会抛异常，只会退化为仅本地缓存
 */
public interface TieredCache {

    /**
     * 获取缓存值
     * L1 命中直接返回；L1 未命中查 L2，L2 命中回填 L1
     *
     * @param domain 缓存域
     * @param key    调用方键
     * @param type   值类型
     * @return 缓存值，未命中返回 null
     */
    <T> T get(CacheDomain domain, String key, Class<T> type);

    /**
     * 获取泛型缓存值（如 List&lt;Article&gt;）
     *
     * @param domain 缓存域
     * @param key    调用方键
     * @param type   值类型引用
     * @return 缓存值，未命中返回 null
     */
    <T> T get(CacheDomain domain, String key, TypeReference<T> type);

    /**
     * 写入缓存（同时写 L1 + L2）
     *
     * @param domain 缓存域
     * @param key    调用方键
     * @param value  可 JSON 序列化的值
     */
    void set(CacheDomain domain, String key, Object value);

    /**
     * 失效单条缓存
     *
     * @param domain 缓存域
     * @param key    调用方键
     */
    void invalidate(CacheDomain domain, String key);

    /**
     * 失效整个域
     * 清空本地 L1 并递增域版本号，旧 L2 条目不再可达并自然过期
     *
     * @param domain 缓存域
     */
    void invalidateByDomain(CacheDomain domain);

    /**
     * 获取指标快照
     *
     * @param domain 缓存域
     * @return 只读快照
     */
    CacheMetricsSnapshot getMetrics(CacheDomain domain);
}
