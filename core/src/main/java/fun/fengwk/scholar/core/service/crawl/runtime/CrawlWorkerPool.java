package fun.fengwk.scholar.core.service.crawl.runtime;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool with a bounded blocking queue, workers spawned on demand up to the max.
 *
 * @author fengwk
 */
@Slf4j
public class CrawlWorkerPool {

    static final String WORKER_NAME_PREFIX = "scholar-crawl-worker-";

    private final WorkerPoolConfig config;
    private final BlockingQueue<WorkerTask> queue;
    private final List<Thread> workerThreads = new CopyOnWriteArrayList<>();
    private final AtomicInteger workerIdGen = new AtomicInteger(1);
    private final AtomicInteger workerCount = new AtomicInteger(0);
    private final AtomicInteger idleWorkers = new AtomicInteger(0);
    private final AtomicInteger busyWorkers = new AtomicInteger(0);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public CrawlWorkerPool(WorkerPoolConfig config) {
        this.config = config;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, config.getQueueCapacity()));
        startMinWorkers();
    }

    /**
     * Enqueues the task without blocking.
     *
     * @throws CrawlWorkerPoolBusyException if the queue is full
     * @throws IllegalStateException if the pool is shut down
     */
    public void submit(WorkerTask task) {
        if (shutdown.get()) {
            throw new IllegalStateException("crawl worker pool is shut down");
        }
        if (!queue.offer(task)) {
            log.warn("worker queue full, size={}, capacity={}", queue.size(), config.getQueueCapacity());
            throw new CrawlWorkerPoolBusyException("crawl worker pool is busy");
        }
        ensureWorkerCapacity();
    }

    /**
     * Removes a task that no worker has taken yet.
     */
    public boolean remove(WorkerTask task) {
        return queue.remove(task);
    }

    public int getQueuedCount() {
        return queue.size();
    }

    public int getWorkerCount() {
        return workerCount.get();
    }

    /**
     * Workers currently executing a task.
     */
    public int getBusyWorkerCount() {
        return busyWorkers.get();
    }

    public int getMaxWorkers() {
        return normalizeMaxWorkerSize();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Stops the pool.
     *
     * @param wait true to let running tasks finish within {@code timeoutMs}, false to interrupt workers
     * @return tasks that were still queued and will never run
     */
    public List<WorkerTask> shutdown(boolean wait, long timeoutMs) {
        if (!shutdown.compareAndSet(false, true)) {
            return List.of();
        }
        List<WorkerTask> pending = new ArrayList<>();
        queue.drainTo(pending);

        if (!wait) {
            interruptWorkers();
            return pending;
        }

        long deadline = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        for (Thread thread : workerThreads) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            try {
                thread.join(remaining);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("worker pool shutdown interrupted");
                break;
            }
        }
        if (!workerThreads.isEmpty()) {
            log.warn("workers still running after shutdown timeout, count={}", workerThreads.size());
            interruptWorkers();
        }
        return pending;
    }

    private void interruptWorkers() {
        for (Thread thread : workerThreads) {
            thread.interrupt();
        }
    }

    private void startMinWorkers() {
        int minSize = normalizeMinWorkerSize();
        for (int i = 0; i < minSize; i++) {
            spawnWorker();
        }
    }

    private void ensureWorkerCapacity() {
        if (shutdown.get()) {
            return;
        }
        if (idleWorkers.get() > 0) {
            return;
        }
        int maxSize = normalizeMaxWorkerSize();
        while (workerCount.get() < maxSize && idleWorkers.get() == 0 && !queue.isEmpty()) {
            spawnWorker();
        }
    }

    private void spawnWorker() {
        int maxSize = normalizeMaxWorkerSize();
        int current = workerCount.get();
        if (current >= maxSize) {
            return;
        }
        if (!workerCount.compareAndSet(current, current + 1)) {
            return;
        }
        String workerId = WORKER_NAME_PREFIX + workerIdGen.getAndIncrement();
        Thread thread = new Thread(new Worker(workerId));
        thread.setName(workerId);
        thread.setDaemon(true);
        workerThreads.add(thread);
        thread.start();
    }

    private int normalizeMinWorkerSize() {
        return Math.max(config.getMinWorkers(), 0);
    }

    private int normalizeMaxWorkerSize() {
        return Math.max(Math.max(config.getMaxWorkers(), 1), normalizeMinWorkerSize());
    }

    private long normalizeRefreshIntervalMs() {
        return Math.max(1L, config.getRefreshIntervalMs());
    }

    private boolean shouldTerminate(long lastTaskAt) {
        long idleTtlMs = config.getIdleTtlMs();
        if (idleTtlMs <= 0) {
            return false;
        }
        if (System.currentTimeMillis() - lastTaskAt < idleTtlMs) {
            return false;
        }
        return workerCount.get() > normalizeMinWorkerSize();
    }

    private class Worker implements Runnable {

        private final String workerId;
        private long lastTaskAt = System.currentTimeMillis();

        private Worker(String workerId) {
            this.workerId = workerId;
        }

        @Override
        public void run() {
            try {
                loop();
            } catch (Exception ex) {
                log.warn("worker terminated unexpectedly, id={}", workerId, ex);
            } finally {
                workerCount.decrementAndGet();
                workerThreads.remove(Thread.currentThread());
                // A task offered while this worker was retiring still needs a worker.
                if (!shutdown.get() && !queue.isEmpty()) {
                    ensureWorkerCapacity();
                }
            }
        }

        private void loop() {
            long refreshIntervalMs = normalizeRefreshIntervalMs();
            while (!shutdown.get()) {
                WorkerTask task;
                idleWorkers.incrementAndGet();
                try {
                    // Polling interval also gates idle checks and worker retirement.
                    task = queue.poll(refreshIntervalMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                } finally {
                    idleWorkers.decrementAndGet();
                }
                if (task == null) {
                    if (shouldTerminate(lastTaskAt)) {
                        log.debug("worker retired, id={}", workerId);
                        return;
                    }
                    continue;
                }
                lastTaskAt = System.currentTimeMillis();
                executeTask(task);
            }
        }

        private void executeTask(WorkerTask task) {
            busyWorkers.incrementAndGet();
            try {
                task.execute(workerId);
            } catch (Exception ex) {
                log.warn("worker task failed, id={}, error={}", workerId, ex.getMessage(), ex);
            } finally {
                busyWorkers.decrementAndGet();
            }
        }

    }

}
