package fun.fengwk.scholar.core.service.crawl;

import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;
import fun.fengwk.scholar.core.service.crawl.model.PoolStats;

import java.util.List;
import java.util.Optional;

/**
 * Crawl job registry: submits author profile crawls and reports their progress.
 *
 * @author fengwk
 */
public interface ScholarCrawlService {

    /**
     * Submits a crawl of an author profile.
     *
     * <p>Returns immediately. Submitting an identity that is still running returns its job id without
     * starting new work.
     *
     * @return job id {@code "{clientId}_{searchId}"}
     * @throws IllegalArgumentException if an id is blank or the url is not http(s)
     * @throws IllegalStateException if the service is shut down
     * @throws fun.fengwk.scholar.core.service.crawl.runtime.CrawlWorkerPoolBusyException if the queue is full
     */
    String submit(String sourceUrl, String clientId, String searchId);

    /**
     * Running jobs first, then completed history.
     */
    Optional<JobSnapshot> getStatus(String clientId, String searchId);

    /**
     * Cancels a job that no worker has started.
     *
     * @return false if the job is unknown or already started
     */
    boolean cancel(String clientId, String searchId);

    /**
     * Completed jobs, most recent first.
     *
     * @param limit max results, {@code <= 0} returns all
     */
    List<JobSnapshot> recentCompleted(int limit);

    PoolStats poolStats();

    /**
     * Stops accepting jobs and drops queued ones.
     *
     * @param wait true to let running jobs finish, false to abort them
     */
    void shutdown(boolean wait);

}
