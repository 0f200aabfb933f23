package fun.fengwk.scholar.core.service.browser.session;

import java.util.List;
import java.util.Optional;

/**
 * Element handle returned by a {@link PageSession} lookup.
 *
 * @author fengwk
 */
public interface PageElement {

    String text();

    /**
     * Attribute value; {@code href} and {@code src} are resolved to absolute urls.
     */
    Optional<String> attribute(String name);

    Optional<PageElement> findFirst(List<String> selectors);

    boolean isVisible();

    boolean isEnabled();

}
