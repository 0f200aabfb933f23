package fun.fengwk.scholar.core.service.crawl.impl;

import fun.fengwk.scholar.core.service.browser.session.PageSessionFactory;
import fun.fengwk.scholar.core.service.crawl.CrawlProperties;
import fun.fengwk.scholar.core.service.crawl.ScholarCrawlService;
import fun.fengwk.scholar.core.service.crawl.extract.AuthorProfileDiscoverer;
import fun.fengwk.scholar.core.service.crawl.extract.PaperRecordExtractor;
import fun.fengwk.scholar.core.service.crawl.model.JobId;
import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;
import fun.fengwk.scholar.core.service.crawl.model.PoolStats;
import fun.fengwk.scholar.core.service.crawl.model.TaskState;
import fun.fengwk.scholar.core.service.crawl.progress.ProgressPublisher;
import fun.fengwk.scholar.core.service.crawl.runtime.CrawlJob;
import fun.fengwk.scholar.core.service.crawl.runtime.CrawlJobTask;
import fun.fengwk.scholar.core.service.crawl.runtime.CrawlWorkerPool;
import fun.fengwk.scholar.core.service.crawl.runtime.WorkerPoolConfig;
import fun.fengwk.scholar.core.service.crawl.runtime.WorkerTask;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Crawl registry backed by a bounded worker pool and a completed job history.
 *
 * <p>One lock guards the running map and the history, so a finishing job moves between them atomically.
 * Page navigation and pacing happen on worker threads outside the lock.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ScholarCrawlServiceImpl implements ScholarCrawlService {

    private final CrawlProperties crawlProperties;
    private final PageSessionFactory pageSessionFactory;
    private final AuthorProfileDiscoverer authorProfileDiscoverer;
    private final PaperRecordExtractor paperRecordExtractor;
    private final ProgressPublisher progressPublisher;
    private final CrawlWorkerPool workerPool;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<JobId, RunningJob> runningJobs = new LinkedHashMap<>();
    private final CompletedJobHistory history;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    @Autowired
    public ScholarCrawlServiceImpl(CrawlProperties crawlProperties,
                                   PageSessionFactory pageSessionFactory,
                                   AuthorProfileDiscoverer authorProfileDiscoverer,
                                   PaperRecordExtractor paperRecordExtractor,
                                   ProgressPublisher progressPublisher) {
        this(crawlProperties, pageSessionFactory, authorProfileDiscoverer, paperRecordExtractor, progressPublisher,
            new CrawlWorkerPool(toWorkerPoolConfig(crawlProperties)));
    }

    ScholarCrawlServiceImpl(CrawlProperties crawlProperties,
                            PageSessionFactory pageSessionFactory,
                            AuthorProfileDiscoverer authorProfileDiscoverer,
                            PaperRecordExtractor paperRecordExtractor,
                            ProgressPublisher progressPublisher,
                            CrawlWorkerPool workerPool) {
        this.crawlProperties = crawlProperties;
        this.pageSessionFactory = pageSessionFactory;
        this.authorProfileDiscoverer = authorProfileDiscoverer;
        this.paperRecordExtractor = paperRecordExtractor;
        this.progressPublisher = progressPublisher;
        this.workerPool = workerPool;
        this.history = new CompletedJobHistory(crawlProperties.getHistoryCapacity());
    }

    @Override
    public String submit(String sourceUrl, String clientId, String searchId) {
        JobId jobId = JobId.of(clientId, searchId);
        String url = validateUrl(sourceUrl);
        if (shutdown.get()) {
            throw new IllegalStateException("crawl service is shut down");
        }

        lock.lock();
        try {
            if (runningJobs.containsKey(jobId)) {
                log.warn("duplicate submission ignored, jobId={}", jobId);
                return jobId.value();
            }

            CrawlJob job = new CrawlJob(jobId, url, Instant.now());
            CrawlJobTask task = new CrawlJobTask(job, pageSessionFactory, authorProfileDiscoverer,
                paperRecordExtractor, progressPublisher, crawlProperties);
            RunningJob runningJob = new RunningJob(task);
            runningJobs.put(jobId, runningJob);
            try {
                workerPool.submit(runningJob);
            } catch (RuntimeException ex) {
                runningJobs.remove(jobId);
                throw ex;
            }
            if (history.remove(jobId)) {
                log.info("stale history entry replaced by resubmission, jobId={}", jobId);
            }
            log.info("job submitted, jobId={}, url={}", jobId, url);
            return jobId.value();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JobSnapshot> getStatus(String clientId, String searchId) {
        JobId jobId = JobId.of(clientId, searchId);
        lock.lock();
        try {
            RunningJob runningJob = runningJobs.get(jobId);
            if (runningJob != null) {
                return Optional.of(runningJob.job().snapshot(TaskState.RUNNING, null));
            }
            return history.get(jobId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean cancel(String clientId, String searchId) {
        JobId jobId = JobId.of(clientId, searchId);
        lock.lock();
        try {
            RunningJob runningJob = runningJobs.get(jobId);
            if (runningJob == null) {
                log.warn("cancel refused, job not running, jobId={}", jobId);
                return false;
            }
            if (!runningJob.job().tryCancel()) {
                log.warn("cancel refused, job already started, jobId={}", jobId);
                return false;
            }
            runningJobs.remove(jobId);
            workerPool.remove(runningJob);
            log.info("job cancelled, jobId={}", jobId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<JobSnapshot> recentCompleted(int limit) {
        lock.lock();
        try {
            return history.recent(limit);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PoolStats poolStats() {
        lock.lock();
        try {
            List<String> runningIds = new ArrayList<>();
            for (JobId jobId : runningJobs.keySet()) {
                runningIds.add(jobId.value());
            }
            List<String> completedIds = new ArrayList<>();
            for (JobId jobId : history.completedIds()) {
                completedIds.add(jobId.value());
            }
            return PoolStats.builder()
                .runningCount(runningJobs.size())
                .queuedCount(workerPool.getQueuedCount())
                .completedCount(history.size())
                .capacity(history.capacity())
                .maxWorkers(workerPool.getMaxWorkers())
                .activeWorkers(workerPool.getBusyWorkerCount())
                .runningJobIds(runningIds)
                .completedJobIds(completedIds)
                .build();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void shutdown(boolean wait) {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("crawl service shutting down, wait={}", wait);
        if (!wait) {
            abortRunningJobs();
        }

        List<WorkerTask> dropped = workerPool.shutdown(wait, crawlProperties.getShutdownTimeoutMs());
        lock.lock();
        try {
            for (WorkerTask workerTask : dropped) {
                if (!(workerTask instanceof RunningJob)) {
                    continue;
                }
                RunningJob runningJob = (RunningJob) workerTask;
                if (runningJob.job().tryCancel()) {
                    runningJobs.remove(runningJob.job().getJobId(), runningJob);
                    log.info("queued job dropped on shutdown, jobId={}", runningJob.job().getJobId());
                }
            }
        } finally {
            lock.unlock();
        }
        // Jobs outliving the shutdown timeout lose their sessions.
        abortRunningJobs();
    }

    @PreDestroy
    public void destroy() {
        shutdown(crawlProperties.isShutdownWait());
    }

    private void abortRunningJobs() {
        List<RunningJob> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(runningJobs.values());
        } finally {
            lock.unlock();
        }
        for (RunningJob runningJob : snapshot) {
            try {
                runningJob.task().abort();
            } catch (RuntimeException ex) {
                log.warn("abort job failed, jobId={}, error={}", runningJob.job().getJobId(), ex.getMessage());
            }
        }
    }

    private JobSnapshot onJobFinished(RunningJob runningJob) {
        CrawlJob job = runningJob.job();
        lock.lock();
        try {
            runningJobs.remove(job.getJobId(), runningJob);
            JobSnapshot finalSnapshot = job.snapshot(TaskState.COMPLETED, Instant.now());
            List<JobId> evicted = history.add(job.getJobId(), finalSnapshot);
            for (JobId evictedId : evicted) {
                log.info("history entry evicted, jobId={}", evictedId);
            }
            log.info("job moved to history, jobId={}, status={}", job.getJobId(), finalSnapshot.getStatus().getValue());
            return finalSnapshot;
        } finally {
            lock.unlock();
        }
    }

    private static String validateUrl(String sourceUrl) {
        if (!StringUtils.hasText(sourceUrl)) {
            throw new IllegalArgumentException("url is blank");
        }
        String url = sourceUrl.trim();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("url is invalid: " + url, ex);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("url must be http or https: " + url);
        }
        if (!StringUtils.hasText(uri.getHost())) {
            throw new IllegalArgumentException("url has no host: " + url);
        }
        return url;
    }

    static WorkerPoolConfig toWorkerPoolConfig(CrawlProperties crawlProperties) {
        return WorkerPoolConfig.builder()
            .minWorkers(crawlProperties.getMinWorkers())
            .maxWorkers(crawlProperties.getMaxWorkers())
            .queueCapacity(crawlProperties.getQueueCapacity())
            .idleTtlMs(crawlProperties.getWorkerIdleTtlMs())
            .refreshIntervalMs(crawlProperties.getWorkerRefreshIntervalMs())
            .build();
    }

    private class RunningJob implements WorkerTask {

        private final CrawlJobTask task;

        private RunningJob(CrawlJobTask task) {
            this.task = task;
        }

        private CrawlJob job() {
            return task.getJob();
        }

        private CrawlJobTask task() {
            return task;
        }

        @Override
        public void execute(String workerId) {
            CrawlJob job = job();
            if (!job.claim(workerId)) {
                log.debug("cancelled job skipped, jobId={}", job.getJobId());
                return;
            }
            log.info("job claimed, jobId={}, workerId={}", job.getJobId(), workerId);
            try {
                task.run();
            } finally {
                if (job.failIfActive("crawl terminated unexpectedly")) {
                    log.warn("job terminated unexpectedly, jobId={}", job.getJobId());
                }
                JobSnapshot finalSnapshot = onJobFinished(this);
                task.publishOutcome(finalSnapshot);
            }
        }

    }

}
