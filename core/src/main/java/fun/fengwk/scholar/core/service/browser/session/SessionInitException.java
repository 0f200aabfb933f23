package fun.fengwk.scholar.core.service.browser.session;

/**
 * Thrown when a page session cannot be opened.
 *
 * @author fengwk
 */
public class SessionInitException extends RuntimeException {

    public SessionInitException(String message) {
        super(message);
    }

    public SessionInitException(String message, Throwable cause) {
        super(message, cause);
    }

}
