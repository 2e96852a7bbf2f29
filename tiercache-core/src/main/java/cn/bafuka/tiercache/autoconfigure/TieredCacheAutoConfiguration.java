package cn.bafuka.tiercache.autoconfigure;

import cn.bafuka.tiercache.codec.FastJsonValueCodec;
import cn.bafuka.tiercache.codec.ValueCodec;
import cn.bafuka.tiercache.config.TieredCacheProperties;
import cn.bafuka.tiercache.consistency.VersionRegistry;
import cn.bafuka.tiercache.consistency.impl.RemoteVersionRegistry;
import cn.bafuka.tiercache.control.StrategyTable;
import cn.bafuka.tiercache.core.impl.DefaultTieredCache;
import cn.bafuka.tiercache.dataplane.L1LocalTier;
import cn.bafuka.tiercache.dataplane.L2RemoteTier;
import cn.bafuka.tiercache.dataplane.impl.DefaultL2RemoteTier;
import cn.bafuka.tiercache.dataplane.impl.FifoL1LocalTier;
import cn.bafuka.tiercache.metrics.CacheMetricsCollector;
import cn.bafuka.tiercache.metrics.MetricsReporter;
import cn.bafuka.tiercache.transport.RemoteTransport;
import cn.bafuka.tiercache.transport.RemoteTransports;
import cn.bafuka.tiercache.transport.impl.DisabledRemoteTransport;
import cn.bafuka.tiercache.transport.impl.RedisTemplateRemoteTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * TierCache 自动配置类
 */
@Slf4j
@Configuration
@AutoConfigureAfter(name = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(TieredCacheProperties.class)
@ConditionalOnProperty(prefix = "tiercache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TieredCacheAutoConfiguration {

    public TieredCacheAutoConfiguration() {
        log.info("TierCache auto-configuration initializing...");
    }

    /**
     * 策略表
     */
    @Bean
    @ConditionalOnMissingBean
    public StrategyTable tieredCacheStrategyTable(TieredCacheProperties properties) {
        return properties.toStrategyTable();
    }

    /**
     * REST 网关传输（默认）
     * 地址和 Token 只在启动时解析一次，缺失则整个进程禁用 L2
     */
    @Bean
    @ConditionalOnMissingBean(RemoteTransport.class)
    @ConditionalOnProperty(prefix = "tiercache.remote", name = "mode", havingValue = "rest", matchIfMissing = true)
    public RemoteTransport restRemoteTransport(TieredCacheProperties properties, Environment environment) {
        TieredCacheProperties.Remote remote = properties.getRemote();
        String url = firstNonBlank(remote.getUrl(), environment.getProperty(RemoteTransports.URL_ENV));
        String token = firstNonBlank(remote.getToken(), environment.getProperty(RemoteTransports.TOKEN_ENV));
        return RemoteTransports.rest(url, token, remote.getConnectTimeout(), remote.getRequestTimeout());
    }

    /**
     * L1 本地缓存
     */
    @Bean
    @ConditionalOnMissingBean
    public L1LocalTier l1LocalTier(StrategyTable strategyTable) {
        return new FifoL1LocalTier(strategyTable, Clock.systemUTC());
    }

    /**
     * L2 远程缓存
     * redis 模式下没有 StringRedisTemplate 时同样退化为禁用
     */
    @Bean
    @ConditionalOnMissingBean
    public L2RemoteTier l2RemoteTier(ObjectProvider<RemoteTransport> transport, StrategyTable strategyTable) {
        RemoteTransport resolved = transport.getIfAvailable();
        if (resolved == null) {
            log.warn("未找到可用的远程缓存传输，L2 已禁用，仅使用本地缓存");
            resolved = DisabledRemoteTransport.INSTANCE;
        }
        return new DefaultL2RemoteTier(resolved, strategyTable);
    }

    /**
     * 域版本号登记表
     */
    @Bean
    @ConditionalOnMissingBean
    public VersionRegistry versionRegistry(L2RemoteTier l2RemoteTier) {
        return new RemoteVersionRegistry(l2RemoteTier);
    }

    /**
     * 缓存值编解码器
     */
    @Bean
    @ConditionalOnMissingBean
    public ValueCodec tieredCacheValueCodec() {
        return new FastJsonValueCodec();
    }

    /**
     * 指标收集器
     */
    @Bean
    @ConditionalOnMissingBean
    public CacheMetricsCollector cacheMetricsCollector() {
        return new CacheMetricsCollector();
    }

    /**
     * 指标定时输出
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "tiercache.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MetricsReporter metricsReporter(CacheMetricsCollector collector, TieredCacheProperties properties) {
        return new MetricsReporter(collector, properties.getMetrics().getFlushInterval());
    }

    /**
     * 两级缓存门面
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public DefaultTieredCache tieredCache(StrategyTable strategyTable,
                                          L1LocalTier l1LocalTier,
                                          L2RemoteTier l2RemoteTier,
                                          VersionRegistry versionRegistry,
                                          ValueCodec codec,
                                          CacheMetricsCollector metrics,
                                          ObjectProvider<MetricsReporter> metricsReporter) {
        return new DefaultTieredCache(
                strategyTable,
                l1LocalTier,
                l2RemoteTier,
                versionRegistry,
                codec,
                metrics,
                metricsReporter.getIfAvailable()
        );
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.trim().isEmpty()) {
            return preferred;
        }
        return fallback;
    }

    /**
     * Spring Data Redis 直连传输（tiercache.remote.mode=redis）
     */
    @Configuration
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnProperty(prefix = "tiercache.remote", name = "mode", havingValue = "redis")
    public static class RedisTransportConfiguration {

        @Bean
        @ConditionalOnMissingBean(RemoteTransport.class)
        public RemoteTransport redisRemoteTransport(ObjectProvider<StringRedisTemplate> redisTemplate) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                log.warn("tiercache.remote.mode=redis 但未找到 StringRedisTemplate，L2 已禁用");
                return DisabledRemoteTransport.INSTANCE;
            }
            log.info("远程缓存已启用: transport=redis");
            return new RedisTemplateRemoteTransport(template);
        }
    }
}
