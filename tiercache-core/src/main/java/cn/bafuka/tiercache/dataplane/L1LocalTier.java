package cn.bafuka.tiercache.dataplane;

import cn.bafuka.tiercache.core.CacheDomain;

/**
 * L1 本地缓存接口
 * 进程内按域隔离的键值存储，条目数有上限，按写入时间过期
 */
public interface L1LocalTier {

    /**
     * 从 L1 获取编码后的值
     * 已过期的条目会在读取时删除并视为未命中
     *
     * @param domain       缓存域
     * @param qualifiedKey 完整缓存键
     * @return 编码后的值，未命中返回 null
     */
    String get(CacheDomain domain, String qualifiedKey);

    /**
     * 写入 L1
     * 域未启用 L1 或值超过域的大小上限时不写入
     *
     * @param domain       缓存域
     * @param qualifiedKey 完整缓存键
     * @param encodedValue 编码后的值
     */
    void set(CacheDomain domain, String qualifiedKey, String encodedValue);

    /**
     * 删除单个条目
     *
     * @param domain       缓存域
     * @param qualifiedKey 完整缓存键
     */
    void delete(CacheDomain domain, String qualifiedKey);

    /**
     * 清空整个域
     *
     * @param domain 缓存域
     */
    void clear(CacheDomain domain);

    /**
     * 当前域内条目数（包含尚未被惰性清理的过期条目）
     *
     * @param domain 缓存域
     * @return 条目数
     */
    int size(CacheDomain domain);
}
