package fun.fengwk.scholar.core.service.crawl.progress;

import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;

/**
 * Wire envelope {@code {"event": ..., "data": ...}}.
 *
 * @author fengwk
 */
public record ProgressMessage(ProgressEventKind event, JobSnapshot data) {
}
