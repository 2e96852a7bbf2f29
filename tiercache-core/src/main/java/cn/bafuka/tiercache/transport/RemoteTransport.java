package cn.bafuka.tiercache.transport;

/**
 * 远程缓存传输层接口
 * 执行 Redis 风格命令，如 ["GET", key]、["SET", key, value, "EX", seconds]、["INCR", key]、["DEL", key]
 *
 * 实现类不得因远程故障抛出异常，所有失败都以 RemoteReply.failed 返回
 */
public interface RemoteTransport {

    /**
     * 执行一条命令
     *
     * @param command 命令名及参数
     * @return 执行结果
     */
    RemoteReply execute(String... command);

    /**
     * 远程缓存是否可用（配置是否完整）
     * 进程生命周期内不变
     *
     * @return 未配置时返回 false
     */
    boolean isEnabled();

    /**
     * 传输类型标识
     *
     * @return 类型名称（如 "rest", "redis", "disabled"）
     */
    String getType();
}
