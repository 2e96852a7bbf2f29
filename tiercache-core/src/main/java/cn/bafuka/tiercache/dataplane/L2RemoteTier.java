package cn.bafuka.tiercache.dataplane;

import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.transport.RemoteReply;

/**
 * L2 远程缓存接口
 * 尽力而为的共享缓存，所有操作都可能失败；失败以 RemoteReply 返回，由调用方按未命中处理
 */
public interface L2RemoteTier {

    /**
     * 读取数据条目
     *
     * @param domain       缓存域（该域未启用 L2 时直接返回 DISABLED）
     * @param qualifiedKey 完整缓存键
     * @return 执行结果
     */
    RemoteReply get(CacheDomain domain, String qualifiedKey);

    /**
     * 写入数据条目，过期时间取自域策略的 l2TtlMs
     *
     * @param domain       缓存域
     * @param qualifiedKey 完整缓存键
     * @param encodedValue 编码后的值
     * @return 执行结果
     */
    RemoteReply set(CacheDomain domain, String qualifiedKey, String encodedValue);

    /**
     * 删除条目
     *
     * @param qualifiedKey 完整缓存键
     * @return 执行结果
     */
    RemoteReply delete(String qualifiedKey);

    /**
     * 读取任意键（不受域策略约束，用于版本号计数器）
     *
     * @param rawKey 键
     * @return 执行结果
     */
    RemoteReply read(String rawKey);

    /**
     * 原子自增（仅供版本号登记表使用）
     *
     * @param counterKey 计数器键
     * @return 执行结果，成功时为自增后的值
     */
    RemoteReply increment(String counterKey);

    /**
     * 远程缓存是否已配置
     */
    boolean isEnabled();
}
