package fun.fengwk.scholar.core.service.crawl.progress;

import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;

/**
 * Pushes job snapshots to the client that submitted the job.
 *
 * @author fengwk
 */
public interface ProgressPublisher {

    /**
     * Publishes a snapshot. Implementations never throw.
     *
     * @return false if the message could not be delivered
     */
    boolean publish(ProgressEventKind kind, JobSnapshot snapshot, String clientId);

}
