package fun.fengwk.scholar.core.service.crawl;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Crawl engine configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "scholar.crawl")
public class CrawlProperties {

    /**
     * Worker threads kept alive when idle.
     */
    private int minWorkers = 0;

    /**
     * Max concurrent jobs, which also bounds concurrently open page sessions.
     */
    private int maxWorkers = 5;

    /**
     * Max jobs waiting for a free worker.
     */
    private int queueCapacity = 1000;

    /**
     * Idle time after which a worker above minWorkers retires, 0 means never.
     */
    private long workerIdleTtlMs = 60000;

    /**
     * Queue polling interval of idle workers.
     */
    private long workerRefreshIntervalMs = 1000;

    /**
     * Max completed jobs kept in history.
     */
    private int historyCapacity = 20;

    /**
     * Whether shutdown waits for in-flight jobs.
     */
    private boolean shutdownWait = true;

    private long shutdownTimeoutMs = 30000;

    /**
     * Pacing after the profile page navigation.
     */
    private long pageLoadDelayMs = 3000;

    /**
     * Pacing after each paper page navigation.
     */
    private long itemLoadDelayMs = 2000;

    private long clickDelayMs = 1000;

    private long showMoreDelayMs = 2000;

    private int maxShowMoreAttempts = 1000;

    /**
     * Bounded wait for profile content to appear.
     */
    private long elementWaitTimeoutMs = 10000;

    /**
     * Sort the paper list by year before collecting urls.
     */
    private boolean sortByYear = true;

    private int maxAuthors = 10;

    /**
     * Descriptions not longer than this are dropped.
     */
    private int summaryMinLength = 20;

    private int summaryMaxLength = 500;

    private int minTitleLength = 6;

}
