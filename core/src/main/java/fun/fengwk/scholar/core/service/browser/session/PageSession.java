package fun.fengwk.scholar.core.service.browser.session;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Navigable remote document owned by exactly one crawl job.
 *
 * <p>Selectors are CSS unless they start with {@code //}, which marks XPath. Lookups never throw for
 * a missing element: absence is reported as an empty result so callers can try the next candidate.
 * Implementations are confined to the thread that opened them, except {@link #close()} which may be
 * called from any thread and is idempotent.
 *
 * @author fengwk
 */
public interface PageSession extends AutoCloseable {

    long WAIT_POLL_INTERVAL_MS = 100L;

    void navigate(String url);

    /**
     * Current document title, empty when unavailable.
     */
    String title();

    /**
     * First element matched by the first selector that matches anything.
     */
    Optional<PageElement> findFirst(List<String> selectors);

    /**
     * All elements matched by the first selector that matches anything.
     */
    List<PageElement> findAll(List<String> selectors);

    /**
     * Clicks the element.
     *
     * @return false when the element could not be clicked, e.g. sessions without script support
     */
    boolean click(PageElement element);

    default Optional<String> findFirstText(List<String> selectors) {
        return findFirst(selectors)
            .map(PageElement::text)
            .map(String::trim)
            .filter(text -> !text.isEmpty());
    }

    /**
     * Polls the condition until it holds or the timeout elapses.
     */
    default boolean waitUntil(BooleanSupplier condition, Duration timeout) {
        long deadline = System.currentTimeMillis() + Math.max(0L, timeout.toMillis());
        while (true) {
            if (condition.getAsBoolean()) {
                return true;
            }
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            if (!pause(WAIT_POLL_INTERVAL_MS)) {
                return false;
            }
        }
    }

    /**
     * Pacing delay between steps.
     *
     * @return false when the calling thread was interrupted
     */
    default boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    boolean isClosed();

    @Override
    void close();

}
