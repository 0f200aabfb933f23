package fun.fengwk.scholar.core.service.browser.session;

/**
 * Opens heavyweight page sessions.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface PageSessionFactory {

    /**
     * @throws SessionInitException when the underlying resource cannot be acquired
     */
    PageSession open();

}
