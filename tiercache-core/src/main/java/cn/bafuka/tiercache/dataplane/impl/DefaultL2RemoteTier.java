package cn.bafuka.tiercache.dataplane.impl;

import cn.bafuka.tiercache.control.StrategyTable;
import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.dataplane.L2RemoteTier;
import cn.bafuka.tiercache.model.CacheStrategy;
import cn.bafuka.tiercache.transport.RemoteReply;
import cn.bafuka.tiercache.transport.RemoteTransport;
import lombok.extern.slf4j.Slf4j;

/**
 * L2 远程缓存实现
 * 在传输层之上应用域策略（是否启用 L2、过期秒数）
 */
@Slf4j
public class DefaultL2RemoteTier implements L2RemoteTier {

    private final RemoteTransport transport;

    private final StrategyTable strategyTable;

    public DefaultL2RemoteTier(RemoteTransport transport, StrategyTable strategyTable) {
        this.transport = transport;
        this.strategyTable = strategyTable;
    }

    @Override
    public RemoteReply get(CacheDomain domain, String qualifiedKey) {
        CacheStrategy strategy = strategyTable.strategyOf(domain);
        if (!strategy.isL2Enabled()) {
            return RemoteReply.disabled();
        }
        return transport.execute("GET", qualifiedKey);
    }

    @Override
    public RemoteReply set(CacheDomain domain, String qualifiedKey, String encodedValue) {
        CacheStrategy strategy = strategyTable.strategyOf(domain);
        if (!strategy.isL2Enabled() || encodedValue == null) {
            return RemoteReply.disabled();
        }
        RemoteReply reply = transport.execute("SET", qualifiedKey, encodedValue,
                "EX", String.valueOf(strategy.l2TtlSeconds()));
        if (reply.isOk()) {
            log.debug("L2 缓存写入: domain={}, key={}, ttl={}s", domain, qualifiedKey, strategy.l2TtlSeconds());
        }
        return reply;
    }

    @Override
    public RemoteReply delete(String qualifiedKey) {
        return transport.execute("DEL", qualifiedKey);
    }

    @Override
    public RemoteReply read(String rawKey) {
        return transport.execute("GET", rawKey);
    }

    @Override
    public RemoteReply increment(String counterKey) {
        return transport.execute("INCR", counterKey);
    }

    @Override
    public boolean isEnabled() {
        return transport.isEnabled();
    }
}
