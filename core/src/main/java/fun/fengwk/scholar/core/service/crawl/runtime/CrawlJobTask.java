package fun.fengwk.scholar.core.service.crawl.runtime;

import fun.fengwk.scholar.core.service.browser.session.PageSession;
import fun.fengwk.scholar.core.service.browser.session.PageSessionFactory;
import fun.fengwk.scholar.core.service.crawl.CrawlProperties;
import fun.fengwk.scholar.core.service.crawl.extract.AuthorProfileDiscoverer;
import fun.fengwk.scholar.core.service.crawl.extract.PaperRecordExtractor;
import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;
import fun.fengwk.scholar.core.service.crawl.model.JobStatus;
import fun.fengwk.scholar.core.service.crawl.model.PaperRecord;
import fun.fengwk.scholar.core.service.crawl.model.TaskState;
import fun.fengwk.scholar.core.service.crawl.progress.ProgressEventKind;
import fun.fengwk.scholar.core.service.crawl.progress.ProgressPublisher;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Drives one {@link CrawlJob} through its stages on a worker thread.
 *
 * <p>The page session is opened once per run and closed before the job turns terminal.
 *
 * @author fengwk
 */
@Slf4j
public class CrawlJobTask {

    private final CrawlJob job;
    private final PageSessionFactory pageSessionFactory;
    private final AuthorProfileDiscoverer authorProfileDiscoverer;
    private final PaperRecordExtractor paperRecordExtractor;
    private final ProgressPublisher progressPublisher;
    private final CrawlProperties crawlProperties;

    private volatile PageSession activeSession;
    private volatile boolean aborted;

    public CrawlJobTask(CrawlJob job,
                        PageSessionFactory pageSessionFactory,
                        AuthorProfileDiscoverer authorProfileDiscoverer,
                        PaperRecordExtractor paperRecordExtractor,
                        ProgressPublisher progressPublisher,
                        CrawlProperties crawlProperties) {
        this.job = job;
        this.pageSessionFactory = pageSessionFactory;
        this.authorProfileDiscoverer = authorProfileDiscoverer;
        this.paperRecordExtractor = paperRecordExtractor;
        this.progressPublisher = progressPublisher;
        this.crawlProperties = crawlProperties;
    }

    public CrawlJob getJob() {
        return job;
    }

    /**
     * Runs the job to a terminal state, never throws for crawl failures.
     */
    public void run() {
        job.markCollectingInfo();
        log.info("crawl job started, jobId={}, url={}", job.getJobId(), job.getSourceUrl());
        try {
            crawl();
            job.markCompleted();
            log.info("crawl job completed, jobId={}", job.getJobId());
        } catch (RuntimeException ex) {
            String errorMessage = describe(ex);
            log.warn("crawl job failed, jobId={}, error={}", job.getJobId(), errorMessage);
            job.markFailed(errorMessage);
        } finally {
            activeSession = null;
        }
    }

    /**
     * Publishes the terminal event for a snapshot taken after the job left the running set.
     */
    public void publishOutcome(JobSnapshot finalSnapshot) {
        ProgressEventKind kind = finalSnapshot.getStatus() == JobStatus.COMPLETED
            ? ProgressEventKind.COMPLETED
            : ProgressEventKind.FAILED;
        publish(kind, finalSnapshot);
    }

    /**
     * Closes the live page session from another thread, the run then fails at its next step.
     */
    public void abort() {
        aborted = true;
        PageSession session = activeSession;
        if (session != null) {
            session.close();
        }
    }

    private void crawl() {
        String sourceUrl = job.getSourceUrl();
        try (PageSession session = pageSessionFactory.open()) {
            activeSession = session;
            ensureRunning(session);

            authorProfileDiscoverer.open(session, sourceUrl);
            ensureRunning(session);
            String subjectName = authorProfileDiscoverer.resolveSubjectName(session, sourceUrl);
            job.resolveSubject(subjectName);
            log.info("author resolved, jobId={}, subject={}", job.getJobId(), subjectName);
            publishProgress();

            if (crawlProperties.isSortByYear()) {
                authorProfileDiscoverer.sortByYear(session);
            }
            authorProfileDiscoverer.expandAll(session);
            ensureRunning(session);

            List<String> itemUrls = authorProfileDiscoverer.collectItemUrls(session, sourceUrl);
            job.markCollectedInfo(itemUrls);
            log.info("paper urls collected, jobId={}, total={}", job.getJobId(), itemUrls.size());
            publishProgress();

            job.markSearching();
            for (int i = 0; i < itemUrls.size(); i++) {
                ensureRunning(session);
                String itemUrl = itemUrls.get(i);
                job.recordFetchAttempt(i);
                Optional<PaperRecord> item = fetchItem(session, itemUrl);
                if (item.isPresent()) {
                    job.appendItem(item.get());
                } else {
                    job.recordSkip();
                }
                publishProgress();
            }
        }
    }

    private Optional<PaperRecord> fetchItem(PageSession session, String itemUrl) {
        try {
            session.navigate(itemUrl);
            session.pause(crawlProperties.getItemLoadDelayMs());
            Optional<PaperRecord> item = paperRecordExtractor.extract(session, itemUrl);
            if (item.isEmpty()) {
                log.warn("paper skipped, no record extracted, jobId={}, itemUrl={}", job.getJobId(), itemUrl);
            }
            return item;
        } catch (RuntimeException ex) {
            ensureRunning(session);
            log.warn("paper skipped, jobId={}, itemUrl={}, error={}", job.getJobId(), itemUrl, ex.getMessage());
            return Optional.empty();
        }
    }

    private void ensureRunning(PageSession session) {
        if (aborted || session.isClosed()) {
            throw new IllegalStateException("crawl aborted");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new IllegalStateException("crawl interrupted");
        }
    }

    private void publishProgress() {
        publish(ProgressEventKind.UPDATE_PROGRESS, job.snapshot(TaskState.RUNNING, null));
    }

    private void publish(ProgressEventKind kind, JobSnapshot snapshot) {
        try {
            if (!progressPublisher.publish(kind, snapshot, job.getJobId().clientId())) {
                log.warn("progress not delivered, jobId={}, event={}", job.getJobId(), kind.getEventName());
            }
        } catch (RuntimeException ex) {
            log.warn("publish progress failed, jobId={}, event={}, error={}",
                job.getJobId(), kind.getEventName(), ex.getMessage());
        }
    }

    private static String describe(RuntimeException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

}
