package fun.fengwk.scholar.core.service.crawl.progress;

import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes progress as {@link JobProgressEvent}s, a push transport listens with {@code @EventListener}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationEventProgressPublisher implements ProgressPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final ProgressMessageCodec progressMessageCodec;

    @Override
    public boolean publish(ProgressEventKind kind, JobSnapshot snapshot, String clientId) {
        try {
            String message = progressMessageCodec.encode(kind, snapshot);
            applicationEventPublisher.publishEvent(new JobProgressEvent(kind, clientId, snapshot, message));
            return true;
        } catch (Exception ex) {
            log.warn("publish progress failed, event={}, clientId={}, jobId={}, error={}",
                kind.getEventName(), clientId, snapshot == null ? null : snapshot.getJobId(), ex.getMessage());
            return false;
        }
    }

}
