package fun.fengwk.scholar.core.service.crawl.progress;

import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;

/**
 * Application event carrying one progress message for a client.
 *
 * @param message encoded wire message
 * @author fengwk
 */
public record JobProgressEvent(ProgressEventKind kind, String clientId, JobSnapshot snapshot, String message) {
}
