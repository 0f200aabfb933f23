package fun.fengwk.scholar.core.service.crawl.runtime;

/**
 * Unit of work executed by a {@link CrawlWorkerPool} thread.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface WorkerTask {

    void execute(String workerId);

}
