package fun.fengwk.scholar.core.service.crawl.extract;

/**
 * Raised when the author profile yields no usable subject or item list.
 *
 * @author fengwk
 */
public class DiscoveryException extends RuntimeException {

    public DiscoveryException(String message) {
        super(message);
    }

}
