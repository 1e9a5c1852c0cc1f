package org.example.depscan.traversal;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * Reads JVM heap usage through the platform {@link MemoryMXBean}.
 */
public class HeapMemoryProbe implements MemoryProbe {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final MemoryMXBean memoryBean;

    public HeapMemoryProbe() {
        this(ManagementFactory.getMemoryMXBean());
    }

    HeapMemoryProbe(MemoryMXBean memoryBean) {
        this.memoryBean = memoryBean;
    }

    @Override
    public long usedHeapMB() {
        long used = memoryBean.getHeapMemoryUsage().getUsed();
        // round up so a live heap never reports 0
        return (used + BYTES_PER_MB - 1) / BYTES_PER_MB;
    }
}
