package fun.fengwk.scholar.core.service.browser.session;

/**
 * Selector helpers shared by page session implementations.
 *
 * @author fengwk
 */
final class SelectorSupport {

    private static final String XPATH_PREFIX = "//";

    private SelectorSupport() {
    }

    static boolean isXpath(String selector) {
        return selector != null && selector.startsWith(XPATH_PREFIX);
    }

    static boolean isUrlAttribute(String name) {
        return "href".equalsIgnoreCase(name) || "src".equalsIgnoreCase(name);
    }

}
