package work.vaultlogic.sandbox.runtime;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-thread allocation counters from HotSpot, paired with heap occupancy.
 *
 * <p>An invocation is over budget only when its worker thread has allocated more than the limit since
 * compile start and heap occupancy has risen by more than the limit above the lowest level seen since
 * then. Allocation alone would also count short-lived garbage.</p>
 */
final class AllocationMeter {
    private static final Logger LOG = LoggerFactory.getLogger(AllocationMeter.class);
    static final long UNSUPPORTED = -1L;

    private final com.sun.management.ThreadMXBean threads;
    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

    AllocationMeter() {
        com.sun.management.ThreadMXBean candidate = null;
        if (ManagementFactory.getThreadMXBean() instanceof com.sun.management.ThreadMXBean hotspot
            && hotspot.isThreadAllocatedMemorySupported()) {
            if (!hotspot.isThreadAllocatedMemoryEnabled()) {
                hotspot.setThreadAllocatedMemoryEnabled(true);
            }
            candidate = hotspot;
        } else {
            LOG.warn("Per-thread allocation accounting unavailable; memory ceiling relies on heap exhaustion only");
        }
        this.threads = candidate;
    }

    long allocatedBytes(long threadId) {
        if (threads == null || threadId < 0) {
            return UNSUPPORTED;
        }
        return threads.getThreadAllocatedBytes(threadId);
    }

    long heapUsedBytes() {
        return memory.getHeapMemoryUsage().getUsed();
    }

    /**
     * Once the worker has finished, the samples it took before releasing its context are used instead of live
     * readings; by then the thread may already be running another invocation.
     */
    boolean exceeds(InvocationMonitor monitor, long limitBytes) {
        boolean finished = monitor.isFinished();
        long used = finished ? monitor.heapAtFinish() : heapUsedBytes();
        long floor = monitor.observeHeap(used);
        long allocated = finished ? monitor.allocationAtFinish() : allocatedBytes(monitor.workerThreadId());
        if (allocated == UNSUPPORTED || monitor.allocationBaseline() == UNSUPPORTED) {
            return false;
        }
        return allocated - monitor.allocationBaseline() > limitBytes && used - floor > limitBytes;
    }
}
