package cn.bafuka.tiercache.consistency;

import cn.bafuka.tiercache.core.CacheDomain;

import java.util.OptionalLong;

/**
 * 域版本号登记表
 * 每个域一个单调递增的版本号，递增即可让该域下所有旧键失效，无需逐个删除
 */
public interface VersionRegistry {

    /**
     * 获取域的当前版本号
     * 本进程已缓存时直接返回；否则读取远程计数器，读取失败时视为 0
     *
     * @param domain 缓存域
     * @return 当前版本号
     */
    long currentGeneration(CacheDomain domain);

    /**
     * 递增域版本号
     * 远程自增成功则采用返回值，失败时在本地版本号基础上加一
     *
     * @param domain 缓存域
     * @return 新版本号
     */
    long bump(CacheDomain domain);

    /**
     * 本进程缓存的版本号（不触发远程读取）
     *
     * @param domain 缓存域
     * @return 尚未解析过时为空
     */
    OptionalLong cachedGeneration(CacheDomain domain);
}
