package cn.bafuka.tiercache.metrics;

import cn.bafuka.tiercache.core.CacheMetricsSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 指标定时输出
 * 首次使用缓存时启动一次，按固定间隔为每个有访问的域输出一行摘要。
 * 调度线程为守护线程，不会阻止进程退出
 */
@Slf4j
public class MetricsReporter {

    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMinutes(5);

    private final CacheMetricsCollector collector;

    private final Duration flushInterval;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile ScheduledExecutorService scheduler;

    public MetricsReporter(CacheMetricsCollector collector, Duration flushInterval) {
        if (flushInterval == null || flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval 必须为正数: " + flushInterval);
        }
        this.collector = collector;
        this.flushInterval = flushInterval;
    }

    /**
     * 启动定时输出（幂等，只有第一次调用生效）
     */
    public void ensureStarted() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "tiercache-metrics");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = flushInterval.toMillis();
        executor.scheduleAtFixedRate(this::safeReport, periodMs, periodMs, TimeUnit.MILLISECONDS);
        scheduler = executor;
        log.info("缓存指标定时输出已启动: interval={}", flushInterval);
    }

    /**
     * 立即输出一次指标
     *
     * @return 本次输出的日志行
     */
    public List<String> report() {
        List<String> lines = new ArrayList<>();
        for (CacheMetricsSnapshot m : collector.activeSnapshots()) {
            String line = String.format("cache metrics [%s]: L1=%d/%d L2=%d/%d sets=%d inv=%d l2Errors=%d",
                    m.getDomain(),
                    m.getL1Hits(), m.getL1Hits() + m.getL1Misses(),
                    m.getL2Hits(), m.getL2Hits() + m.getL2Misses(),
                    m.getSets(),
                    m.getInvalidations(),
                    m.getL2Errors());
            log.info("{}", line);
            lines.add(line);
        }
        return lines;
    }

    private void safeReport() {
        try {
            report();
        } catch (RuntimeException e) {
            // 异常会终止 scheduleAtFixedRate 的后续执行
            log.warn("输出缓存指标失败", e);
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * 停止定时输出，不等待正在执行的任务
     */
    public void shutdown() {
        ScheduledExecutorService executor = scheduler;
        if (executor != null) {
            executor.shutdownNow();
            scheduler = null;
            log.info("缓存指标定时输出已停止");
        }
    }
}
