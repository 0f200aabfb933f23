package fun.fengwk.scholar.core.service.crawl.runtime;

/**
 * Exception thrown when the crawl worker queue is full.
 */
public class CrawlWorkerPoolBusyException extends RuntimeException {

    public CrawlWorkerPoolBusyException(String message) {
        super(message);
    }

}
