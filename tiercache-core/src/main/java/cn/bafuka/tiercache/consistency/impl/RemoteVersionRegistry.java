package cn.bafuka.tiercache.consistency.impl;

import cn.bafuka.tiercache.consistency.VersionRegistry;
import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.dataplane.L2RemoteTier;
import cn.bafuka.tiercache.support.CacheKeys;
import cn.bafuka.tiercache.transport.RemoteReply;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于远程计数器的版本号登记表
 * 版本号首次使用时从远程读取一次并缓存在进程内；递增走远程 INCR，结果立即写回本地。
 * 其他进程要到下次读取计数器时才会看到新版本（最终一致）
 */
@Slf4j
public class RemoteVersionRegistry implements VersionRegistry {

    private final L2RemoteTier remoteTier;

    /**
     * 本地版本号缓存
     * 只增不减：并发的首次读取不会覆盖已经发生的递增
     */
    private final Map<CacheDomain, Long> generations = new ConcurrentHashMap<>();

    public RemoteVersionRegistry(L2RemoteTier remoteTier) {
        this.remoteTier = remoteTier;
    }

    @Override
    public long currentGeneration(CacheDomain domain) {
        Objects.requireNonNull(domain, "domain");
        Long cached = generations.get(domain);
        if (cached != null) {
            return cached;
        }

        // 两个并发的首次读取可能都访问远程，结果幂等
        RemoteReply reply = remoteTier.read(CacheKeys.versionKey(domain));
        long fetched = Math.max(0L, reply.asLong().orElse(0L));
        if (reply.isFailed()) {
            log.debug("读取域版本号失败，使用 0: domain={}, reply={}", domain, reply);
        }

        long generation = generations.merge(domain, fetched, Math::max);
        log.debug("域版本号已加载: domain={}, generation={}", domain, generation);
        return generation;
    }

    @Override
    public long bump(CacheDomain domain) {
        Objects.requireNonNull(domain, "domain");
        RemoteReply reply = remoteTier.increment(CacheKeys.versionKey(domain));
        OptionalLong remote = reply.asLong();

        long generation = generations.compute(domain, (d, local) -> {
            long current = local == null ? 0L : local;
            if (remote.isPresent() && remote.getAsLong() > current) {
                return remote.getAsLong();
            }
            return current + 1;
        });

        if (remote.isPresent()) {
            log.info("域版本号已递增: domain={}, generation={}", domain, generation);
        } else {
            log.info("远程版本号不可用，本地递增: domain={}, generation={}, reply={}", domain, generation, reply);
        }
        return generation;
    }

    @Override
    public OptionalLong cachedGeneration(CacheDomain domain) {
        Long cached = generations.get(domain);
        return cached == null ? OptionalLong.empty() : OptionalLong.of(cached);
    }
}
