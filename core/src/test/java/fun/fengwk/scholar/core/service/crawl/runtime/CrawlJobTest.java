package fun.fengwk.scholar.core.service.crawl.runtime;

import fun.fengwk.scholar.core.service.crawl.model.JobId;
import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;
import fun.fengwk.scholar.core.service.crawl.model.JobStatus;
import fun.fengwk.scholar.core.service.crawl.model.PaperRecord;
import fun.fengwk.scholar.core.service.crawl.model.TaskState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class CrawlJobTest {

    private static final List<String> URLS = List.of("https://a.org/1", "https://a.org/2", "https://a.org/3");

    private final CrawlJob job = new CrawlJob(JobId.of("c1", "s1"), "https://a.org/profile", Instant.EPOCH);

    @Test
    public void shouldWalkThroughStages() {
        assertThat(job.claim("w1")).isTrue();
        job.markCollectingInfo();
        job.resolveSubject("Ada Lovelace");
        job.markCollectedInfo(URLS);

        JobSnapshot collected = job.snapshot(TaskState.RUNNING, null);
        assertThat(collected.getStatus()).isEqualTo(JobStatus.COLLECTED_INFO);
        assertThat(collected.getProgress()).isEqualTo(25.0);
        assertThat(collected.getFetchedCount()).isZero();
        assertThat(collected.getTotalCount()).isEqualTo(3);

        job.markSearching();
        job.recordFetchAttempt(0);
        job.appendItem(record("https://a.org/1"));
        assertThat(job.snapshot(TaskState.RUNNING, null).getProgress()).isEqualTo(48.33);
        job.recordFetchAttempt(1);
        job.recordSkip();
        assertThat(job.snapshot(TaskState.RUNNING, null).getProgress()).isEqualTo(71.67);
        job.recordFetchAttempt(2);
        job.appendItem(record("https://a.org/3"));
        assertThat(job.snapshot(TaskState.RUNNING, null).getProgress()).isEqualTo(95.0);

        job.markCompleted();
        JobSnapshot completed = job.snapshot(TaskState.COMPLETED, Instant.EPOCH.plusSeconds(5));
        assertThat(completed.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(completed.getProgress()).isEqualTo(100.0);
        assertThat(completed.getFetchedCount()).isEqualTo(3);
        assertThat(completed.getItems()).hasSize(2);
        assertThat(completed.getSkippedCount()).isEqualTo(1);
        assertThat(completed.getWorkerId()).isEqualTo("w1");
        assertThat(completed.getJobId()).isEqualTo("c1_s1");
        assertThat(completed.getTaskState()).isEqualTo(TaskState.COMPLETED);
        assertThat(completed.getCompletedTime()).isEqualTo(Instant.EPOCH.plusSeconds(5));
    }

    @Test
    public void shouldComputeItemProgress() {
        assertThat(CrawlJob.itemProgress(1, 3)).isEqualTo(48.33);
        assertThat(CrawlJob.itemProgress(2, 3)).isEqualTo(71.67);
        assertThat(CrawlJob.itemProgress(3, 3)).isEqualTo(95.0);
        assertThat(CrawlJob.itemProgress(1, 8)).isEqualTo(33.75);
    }

    @Test
    public void shouldFreezeProgressOnFailure() {
        job.markCollectingInfo();
        job.resolveSubject("Ada Lovelace");
        job.markCollectedInfo(URLS);
        job.markSearching();
        job.recordFetchAttempt(0);

        job.markFailed("navigation timeout");

        JobSnapshot snapshot = job.snapshot(TaskState.RUNNING, null);
        assertThat(snapshot.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(snapshot.getProgress()).isEqualTo(48.33);
        assertThat(snapshot.getErrorMessage()).isEqualTo("navigation timeout");
        assertThatThrownBy(() -> job.markFailed("again")).isInstanceOf(IllegalStateException.class);
        assertThat(job.failIfActive("again")).isFalse();
    }

    @Test
    public void shouldRejectOutOfOrderTransitions() {
        assertThatThrownBy(job::markSearching).isInstanceOf(IllegalStateException.class);
        job.markCollectingInfo();
        assertThatThrownBy(() -> job.markCollectedInfo(URLS))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("subject not resolved");
        assertThatThrownBy(job::markCompleted).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldRejectItemsFromUnknownUrls() {
        job.markCollectingInfo();
        job.resolveSubject("Ada Lovelace");
        job.markCollectedInfo(URLS);
        job.markSearching();

        assertThatThrownBy(() -> job.appendItem(record("https://elsewhere.org/1")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldMakeClaimAndCancelExclusive() {
        CrawlJob claimed = new CrawlJob(JobId.of("c1", "s2"), "https://a.org/profile", Instant.EPOCH);
        assertThat(claimed.claim("w1")).isTrue();
        assertThat(claimed.tryCancel()).isFalse();
        assertThat(claimed.claim("w2")).isFalse();

        CrawlJob cancelled = new CrawlJob(JobId.of("c1", "s3"), "https://a.org/profile", Instant.EPOCH);
        assertThat(cancelled.tryCancel()).isTrue();
        assertThat(cancelled.claim("w1")).isFalse();
        assertThat(cancelled.isCancelled()).isTrue();
    }

    @Test
    public void shouldDefaultErrorMessage() {
        job.markFailed(null);

        assertThat(job.snapshot(TaskState.RUNNING, null).getErrorMessage()).isEqualTo("unknown error");
    }

    @Test
    public void shouldExposeImmutableSnapshotRecords() {
        List<String> authors = new ArrayList<>(List.of("A Lovelace", "C Babbage"));
        job.claim("w1");
        job.markCollectingInfo();
        job.resolveSubject("Ada Lovelace");
        job.markCollectedInfo(URLS);
        job.markSearching();
        job.recordFetchAttempt(0);
        job.appendItem(PaperRecord.builder().title("Some Paper Title").authors(authors).sourceUrl(URLS.get(0)).build());
        authors.add("Mallory");

        JobSnapshot snapshot = job.snapshot(TaskState.RUNNING, null);

        assertThatThrownBy(() -> snapshot.getItems().get(0).getAuthors().add("Mallory"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> snapshot.getItems().add(record(URLS.get(1))))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(job.snapshot(TaskState.RUNNING, null).getItems().get(0).getAuthors())
            .containsExactly("A Lovelace", "C Babbage");
    }

    private PaperRecord record(String sourceUrl) {
        return PaperRecord.builder().title("Some Paper Title").sourceUrl(sourceUrl).build();
    }

}
