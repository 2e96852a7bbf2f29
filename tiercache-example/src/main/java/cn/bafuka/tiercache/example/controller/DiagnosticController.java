package cn.bafuka.tiercache.example.controller;

import cn.bafuka.tiercache.control.StrategyTable;
import cn.bafuka.tiercache.core.CacheDomain;
import cn.bafuka.tiercache.core.CacheMetricsSnapshot;
import cn.bafuka.tiercache.core.TieredCache;
import cn.bafuka.tiercache.dataplane.L2RemoteTier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 诊断控制器
 * 用于查看缓存的运行状态和配置
 */
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    @Autowired
    private TieredCache tieredCache;

    @Autowired
    private StrategyTable strategyTable;

    @Autowired
    private L2RemoteTier l2RemoteTier;

    /**
     * 查看所有域的缓存指标
     */
    @GetMapping("/metrics")
    public Map<String, Object> metrics() {
        List<CacheMetricsSnapshot> snapshots = new ArrayList<>();
        for (CacheDomain domain : strategyTable.asMap().keySet()) {
            snapshots.add(tieredCache.getMetrics(domain));
        }

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("remoteEnabled", l2RemoteTier.isEnabled());
        result.put("metrics", snapshots);
        return result;
    }

    /**
     * 查看所有域的缓存策略
     */
    @GetMapping("/strategies")
    public Map<String, Object> strategies() {
        Map<String, Object> strategies = new HashMap<>();
        strategyTable.asMap().forEach((domain, strategy) -> strategies.put(domain.getLabel(), strategy));

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("total", strategies.size());
        result.put("strategies", strategies);
        return result;
    }

    /**
     * 整域失效（运维用）
     */
    @GetMapping("/invalidate")
    public Map<String, Object> invalidate(@RequestParam String domain) {
        Map<String, Object> result = new HashMap<>();
        CacheDomain cacheDomain;
        try {
            cacheDomain = CacheDomain.fromLabel(domain);
        } catch (IllegalArgumentException e) {
            result.put("success", false);
            result.put("message", "未知的缓存域: " + domain);
            return result;
        }

        tieredCache.invalidateByDomain(cacheDomain);
        result.put("success", true);
        result.put("message", "缓存域已失效: " + domain);
        return result;
    }
}
