/**
 * PerformanceMetricsCollector.java
 *
 * 性能指标收集器。记录每个步骤的开始/结束时间和耗时，
 * 并在每次计时开始和结束时采集一次进程的内存和CPU占用。
 * 采样列表在一次监控会话内只追加，只有 startMonitoring 会重置。
 * 工作线程写入，控制线程（REST、定时推送）读取，所有状态都由同一把锁保护。
 */
package club.ppmc.flowdebug.debug.metrics;

import club.ppmc.flowdebug.model.metrics.CpuSample;
import club.ppmc.flowdebug.model.metrics.MemorySample;
import club.ppmc.flowdebug.model.metrics.MemoryUsage;
import club.ppmc.flowdebug.model.metrics.MetricsReport;
import club.ppmc.flowdebug.model.metrics.ResourceSample;
import club.ppmc.flowdebug.model.metrics.StepTiming;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PerformanceMetricsCollector {

    public static final int DEFAULT_EXPORT_SAMPLE_LIMIT = 100;

    private static final Logger LOGGER = LoggerFactory.getLogger(PerformanceMetricsCollector.class);
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final ProcessSampler sampler;
    private final Clock clock;
    private final Object lock = new Object();

    private final Map<Integer, StepTiming> stepTimes = new LinkedHashMap<>();
    private final List<MemorySample> memorySamples = new ArrayList<>();
    private final List<CpuSample> cpuSamples = new ArrayList<>();
    private long startTime;
    private long endTime;
    private boolean monitoring;
    private int exportSampleLimit = DEFAULT_EXPORT_SAMPLE_LIMIT;

    public PerformanceMetricsCollector(ProcessSampler sampler, Clock clock) {
        this.sampler = sampler;
        this.clock = clock;
    }

    /**
     * 开始一次新的监控会话：清空所有数据并采集一个基线样本。
     */
    public void startMonitoring() {
        synchronized (lock) {
            stepTimes.clear();
            memorySamples.clear();
            cpuSamples.clear();
            startTime = clock.millis();
            endTime = 0L;
            monitoring = true;
        }
        collectSample();
    }

    /**
     * 结束监控会话，记录结束时间。未在监控时调用无效果。
     */
    public void stopMonitoring() {
        synchronized (lock) {
            if (!monitoring) {
                return;
            }
            endTime = clock.millis();
            monitoring = false;
        }
    }

    public boolean isMonitoring() {
        synchronized (lock) {
            return monitoring;
        }
    }

    public void startStepTimer(int stepIndex) {
        synchronized (lock) {
            stepTimes.put(stepIndex, StepTiming.started(clock.millis()));
        }
        collectSample();
    }

    public void stopStepTimer(int stepIndex) {
        synchronized (lock) {
            StepTiming timing = stepTimes.get(stepIndex);
            if (timing != null) {
                stepTimes.put(stepIndex, timing.finish(clock.millis()));
            }
        }
        collectSample();
    }

    /**
     * @return 总执行时间（秒）。监控中返回从开始到现在的时间，已停止则返回开始到结束的时间。
     */
    public double getTotalExecutionTime() {
        synchronized (lock) {
            if (startTime == 0L) {
                return 0.0;
            }
            long end = endTime > 0L ? endTime : clock.millis();
            return (end - startTime) / 1000.0;
        }
    }

    /**
     * @return 指定步骤的耗时（秒），该步骤未完成时返回 0。
     */
    public double getStepExecutionTime(int stepIndex) {
        synchronized (lock) {
            StepTiming timing = stepTimes.get(stepIndex);
            return timing != null ? timing.duration() : 0.0;
        }
    }

    /**
     * @return 平均内存占用 (MB)。
     */
    public MemoryUsage getAverageMemoryUsage() {
        synchronized (lock) {
            if (memorySamples.isEmpty()) {
                return MemoryUsage.ZERO;
            }
            double rss = memorySamples.stream().mapToLong(MemorySample::rss).average().orElse(0.0);
            double vms = memorySamples.stream().mapToLong(MemorySample::vms).average().orElse(0.0);
            return new MemoryUsage(rss / BYTES_PER_MB, vms / BYTES_PER_MB);
        }
    }

    /**
     * @return 平均CPU使用率（百分比）。
     */
    public double getAverageCpuUsage() {
        synchronized (lock) {
            return cpuSamples.stream().mapToDouble(CpuSample::percent).average().orElse(0.0);
        }
    }

    public int getSampleCount() {
        synchronized (lock) {
            return memorySamples.size();
        }
    }

    public void setExportSampleLimit(int exportSampleLimit) {
        if (exportSampleLimit <= 0) {
            throw new IllegalArgumentException("exportSampleLimit 必须为正数: " + exportSampleLimit);
        }
        synchronized (lock) {
            this.exportSampleLimit = exportSampleLimit;
        }
    }

    /**
     * 生成指标报告。原始采样只保留最近的若干条，以控制导出体积。
     */
    public MetricsReport toReport() {
        synchronized (lock) {
            return new MetricsReport(
                    getTotalExecutionTime(),
                    new LinkedHashMap<>(stepTimes),
                    getAverageMemoryUsage(),
                    getAverageCpuUsage(),
                    List.copyOf(tail(memorySamples)),
                    List.copyOf(tail(cpuSamples)));
        }
    }

    private <T> List<T> tail(List<T> samples) {
        int from = Math.max(0, samples.size() - exportSampleLimit);
        return samples.subList(from, samples.size());
    }

    private void collectSample() {
        Optional<ResourceSample> sample;
        try {
            sample = sampler.sample();
        } catch (RuntimeException e) {
            LOGGER.warn("采集进程资源信息失败: {}", e.getMessage());
            return;
        }
        sample.ifPresent(value -> {
            synchronized (lock) {
                long now = clock.millis();
                memorySamples.add(new MemorySample(now, value.rss(), value.vms()));
                cpuSamples.add(new CpuSample(now, value.cpuPercent()));
            }
        });
    }
}
