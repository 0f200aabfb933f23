package fun.fengwk.scholar.core.service.crawl.runtime;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a worker pool.
 *
 * @author fengwk
 */
@Data
@Builder
public class WorkerPoolConfig {

    /**
     * Minimum worker count (0 means scale to zero when idle).
     */
    @Builder.Default
    private int minWorkers = 0;

    /**
     * Maximum worker count.
     */
    @Builder.Default
    private int maxWorkers = 5;

    /**
     * Max tasks waiting for a worker.
     */
    @Builder.Default
    private int queueCapacity = 1000;

    /**
     * Idle time before a worker above minWorkers retires, 0 means never.
     */
    @Builder.Default
    private long idleTtlMs = 60000;

    @Builder.Default
    private long refreshIntervalMs = 1000;

}
