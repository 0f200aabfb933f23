package fun.fengwk.scholar.core.service.crawl.runtime;

import fun.fengwk.scholar.core.service.crawl.model.JobId;
import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;
import fun.fengwk.scholar.core.service.crawl.model.JobStatus;
import fun.fengwk.scholar.core.service.crawl.model.PaperRecord;
import fun.fengwk.scholar.core.service.crawl.model.TaskState;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one crawl run.
 *
 * <p>Written only by the worker that claimed the job, read through {@link #snapshot} copies.
 * Transitions follow {@link JobStatus} order, an out of order transition is a programming error.
 *
 * @author fengwk
 */
public class CrawlJob {

    public static final double COLLECTED_INFO_PROGRESS = 25.0;

    public static final double SEARCHING_PROGRESS_SPAN = 70.0;

    public static final double COMPLETED_PROGRESS = 100.0;

    private final JobId jobId;
    private final String sourceUrl;
    private final Instant startTime;

    private JobStatus status = JobStatus.PENDING;
    private double progress;
    private String subjectName;
    private Integer fetchedCount;
    private Integer totalCount;
    private List<String> itemUrls = List.of();
    private final List<PaperRecord> items = new ArrayList<>();
    private int skippedCount;
    private String errorMessage;
    private String workerId;

    private boolean claimed;
    private boolean cancelled;

    public CrawlJob(JobId jobId, String sourceUrl, Instant startTime) {
        this.jobId = jobId;
        this.sourceUrl = sourceUrl;
        this.startTime = startTime;
    }

    public JobId getJobId() {
        return jobId;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    /**
     * Claims the job for a worker.
     *
     * @return false if the job was cancelled or already claimed
     */
    public synchronized boolean claim(String workerId) {
        if (claimed || cancelled) {
            return false;
        }
        claimed = true;
        this.workerId = workerId;
        return true;
    }

    /**
     * Cancels the job unless a worker already claimed it.
     */
    public synchronized boolean tryCancel() {
        if (claimed || cancelled) {
            return false;
        }
        cancelled = true;
        return true;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized void markCollectingInfo() {
        requireStatus(JobStatus.PENDING);
        status = JobStatus.COLLECTING_INFO;
    }

    public synchronized void resolveSubject(String subjectName) {
        requireStatus(JobStatus.COLLECTING_INFO);
        this.subjectName = subjectName;
    }

    public synchronized void markCollectedInfo(List<String> itemUrls) {
        requireStatus(JobStatus.COLLECTING_INFO);
        if (subjectName == null) {
            throw new IllegalStateException("subject not resolved, jobId=" + jobId);
        }
        this.itemUrls = List.copyOf(itemUrls);
        this.fetchedCount = 0;
        this.totalCount = this.itemUrls.size();
        this.status = JobStatus.COLLECTED_INFO;
        advanceProgress(COLLECTED_INFO_PROGRESS);
    }

    public synchronized void markSearching() {
        requireStatus(JobStatus.COLLECTED_INFO);
        status = JobStatus.SEARCHING_PAPERS;
    }

    /**
     * Records that the item at {@code index} is being fetched.
     */
    public synchronized void recordFetchAttempt(int index) {
        requireStatus(JobStatus.SEARCHING_PAPERS);
        if (index < 0 || index >= itemUrls.size()) {
            throw new IllegalStateException("item index out of range, jobId=" + jobId + ", index=" + index);
        }
        fetchedCount = Math.max(fetchedCount, index + 1);
        advanceProgress(itemProgress(index + 1, totalCount));
    }

    public synchronized void appendItem(PaperRecord item) {
        requireStatus(JobStatus.SEARCHING_PAPERS);
        if (!itemUrls.contains(item.getSourceUrl())) {
            throw new IllegalStateException("item source is not a discovered url, jobId=" + jobId
                + ", sourceUrl=" + item.getSourceUrl());
        }
        if (items.size() >= itemUrls.size()) {
            throw new IllegalStateException("items exceed discovered urls, jobId=" + jobId);
        }
        items.add(item);
    }

    public synchronized void recordSkip() {
        requireStatus(JobStatus.SEARCHING_PAPERS);
        skippedCount++;
    }

    public synchronized void markCompleted() {
        requireStatus(JobStatus.SEARCHING_PAPERS);
        status = JobStatus.COMPLETED;
        advanceProgress(COMPLETED_PROGRESS);
    }

    /**
     * Moves the job to ERROR, progress stays where it was.
     */
    public synchronized void markFailed(String errorMessage) {
        if (status.isTerminal()) {
            throw new IllegalStateException("job already terminal, jobId=" + jobId + ", status=" + status);
        }
        status = JobStatus.ERROR;
        this.errorMessage = errorMessage == null || errorMessage.isBlank() ? "unknown error" : errorMessage;
    }

    /**
     * Fails the job if it has not reached a terminal state yet.
     *
     * @return true if the job was failed by this call
     */
    public synchronized boolean failIfActive(String errorMessage) {
        if (status.isTerminal()) {
            return false;
        }
        markFailed(errorMessage);
        return true;
    }

    public synchronized JobSnapshot snapshot(TaskState taskState, Instant completedTime) {
        return JobSnapshot.builder()
            .jobId(jobId.value())
            .clientId(jobId.clientId())
            .searchId(jobId.searchId())
            .sourceUrl(sourceUrl)
            .subjectName(subjectName)
            .status(status)
            .progress(progress)
            .fetchedCount(fetchedCount)
            .totalCount(totalCount)
            .itemUrls(itemUrls)
            .items(List.copyOf(items))
            .skippedCount(skippedCount)
            .errorMessage(errorMessage)
            .startTime(startTime)
            .completedTime(completedTime)
            .workerId(workerId)
            .taskState(taskState)
            .build();
    }

    /**
     * Progress after {@code fetched} of {@code total} items, rounded to two decimals.
     */
    public static double itemProgress(int fetched, int total) {
        if (total <= 0) {
            return COLLECTED_INFO_PROGRESS;
        }
        BigDecimal span = BigDecimal.valueOf(fetched)
            .multiply(BigDecimal.valueOf(SEARCHING_PROGRESS_SPAN))
            .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
        return BigDecimal.valueOf(COLLECTED_INFO_PROGRESS).add(span).doubleValue();
    }

    private void advanceProgress(double value) {
        progress = Math.max(progress, value);
    }

    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("illegal transition, jobId=" + jobId
                + ", expected=" + expected + ", actual=" + status);
        }
    }

}
