/**
 * OshiProcessSampler.java
 *
 * 基于 Oshi 库的进程采样实现。
 * 内存取进程的常驻内存 (RSS) 和虚拟内存 (VMS)，CPU 使用率按两次采样之间的进程 tick 计算，
 * 因此第一次采样的 CPU 使用率是相对于进程启动以来的平均值。
 */
package club.ppmc.flowdebug.debug.metrics;

import club.ppmc.flowdebug.model.metrics.ResourceSample;
import java.util.Optional;
import oshi.SystemInfo;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

public class OshiProcessSampler implements ProcessSampler {

    private final OperatingSystem operatingSystem;
    private final int processId;

    // 上一次的进程快照，用于计算两次采样之间的CPU使用率
    private OSProcess previous;

    public OshiProcessSampler() {
        this.operatingSystem = new SystemInfo().getOperatingSystem();
        this.processId = operatingSystem.getProcessId();
    }

    @Override
    public synchronized Optional<ResourceSample> sample() {
        OSProcess process = operatingSystem.getProcess(processId);
        if (process == null) {
            return Optional.empty();
        }
        double cpuPercent = process.getProcessCpuLoadBetweenTicks(previous) * 100.0;
        this.previous = process;
        return Optional.of(new ResourceSample(process.getResidentSetSize(), process.getVirtualSize(), cpuPercent));
    }
}
