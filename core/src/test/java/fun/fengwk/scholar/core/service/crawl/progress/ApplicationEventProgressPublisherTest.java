package fun.fengwk.scholar.core.service.crawl.progress;

import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;
import fun.fengwk.scholar.core.service.crawl.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * @author fengwk
 */
public class ApplicationEventProgressPublisherTest {

    private final ApplicationEventPublisher applicationEventPublisher = mock(ApplicationEventPublisher.class);
    private final ApplicationEventProgressPublisher publisher =
        new ApplicationEventProgressPublisher(applicationEventPublisher, new ProgressMessageCodec());

    @Test
    public void shouldPublishEncodedEvent() {
        JobSnapshot snapshot = JobSnapshot.builder()
            .jobId("client-1_search-1")
            .status(JobStatus.COLLECTED_INFO)
            .progress(25)
            .build();

        assertThat(publisher.publish(ProgressEventKind.UPDATE_PROGRESS, snapshot, "client-1")).isTrue();

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue()).isInstanceOf(JobProgressEvent.class);
        JobProgressEvent event = (JobProgressEvent) captor.getValue();
        assertThat(event.kind()).isEqualTo(ProgressEventKind.UPDATE_PROGRESS);
        assertThat(event.clientId()).isEqualTo("client-1");
        assertThat(event.snapshot()).isSameAs(snapshot);
        assertThat(event.message())
            .startsWith("{\"event\":\"update_fetch_a_google_scholar_url_process\"")
            .contains("\"status\":\"collected_info\"");
    }

    @Test
    public void shouldReportDeliveryFailure() {
        doThrow(new IllegalStateException("listener failed"))
            .when(applicationEventPublisher).publishEvent(any(Object.class));
        JobSnapshot snapshot = JobSnapshot.builder().jobId("client-1_search-1").build();

        assertThat(publisher.publish(ProgressEventKind.COMPLETED, snapshot, "client-1")).isFalse();
    }

}
