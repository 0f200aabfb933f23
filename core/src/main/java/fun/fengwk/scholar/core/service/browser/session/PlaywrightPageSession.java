package fun.fengwk.scholar.core.service.browser.session;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Page session backed by a dedicated Playwright browser.
 *
 * <p>The session owns the whole Playwright stack (driver, browser, context, page) and releases it
 * in strict order on close.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightPageSession implements PageSession {

    private static final String CLICK_SCRIPT = "e => e.click()";

    private static final String URL_PROPERTY_SCRIPT = "(e, name) => e[name] || e.getAttribute(name)";

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext browserContext;
    private final Page page;
    private final int navigateTimeoutMs;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PlaywrightPageSession(
        Playwright playwright,
        Browser browser,
        BrowserContext browserContext,
        Page page,
        int navigateTimeoutMs
    ) {
        this.playwright = playwright;
        this.browser = browser;
        this.browserContext = browserContext;
        this.page = page;
        this.navigateTimeoutMs = navigateTimeoutMs;
    }

    @Override
    public void navigate(String url) {
        ensureOpen();
        page.navigate(url, new Page.NavigateOptions()
            .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
            .setTimeout((double) navigateTimeoutMs));
    }

    @Override
    public String title() {
        try {
            String title = page.title();
            return title == null ? "" : title;
        } catch (PlaywrightException ex) {
            log.debug("read page title failed, error={}", ex.getMessage());
            return "";
        }
    }

    @Override
    public Optional<PageElement> findFirst(List<String> selectors) {
        ensureOpen();
        for (String selector : selectors) {
            try {
                ElementHandle handle = page.querySelector(toPlaywrightSelector(selector));
                if (handle != null) {
                    return Optional.of(new PlaywrightPageElement(handle));
                }
            } catch (PlaywrightException ex) {
                log.debug("selector lookup failed, selector={}, error={}", selector, ex.getMessage());
            }
        }
        return Optional.empty();
    }

    @Override
    public List<PageElement> findAll(List<String> selectors) {
        ensureOpen();
        for (String selector : selectors) {
            try {
                List<ElementHandle> handles = page.querySelectorAll(toPlaywrightSelector(selector));
                if (handles != null && !handles.isEmpty()) {
                    List<PageElement> result = new ArrayList<>(handles.size());
                    for (ElementHandle handle : handles) {
                        result.add(new PlaywrightPageElement(handle));
                    }
                    return result;
                }
            } catch (PlaywrightException ex) {
                log.debug("selector lookup failed, selector={}, error={}", selector, ex.getMessage());
            }
        }
        return List.of();
    }

    @Override
    public boolean click(PageElement element) {
        if (!(element instanceof PlaywrightPageElement)) {
            return false;
        }
        PlaywrightPageElement playwrightElement = (PlaywrightPageElement) element;
        try {
            playwrightElement.handle.scrollIntoViewIfNeeded();
            // Script click avoids overlay interception on long lists.
            playwrightElement.handle.evaluate(CLICK_SCRIPT);
            return true;
        } catch (PlaywrightException ex) {
            log.debug("click failed, error={}", ex.getMessage());
            return false;
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeQuietly(page, "page");
        closeQuietly(browserContext, "browser context");
        closeQuietly(browser, "browser");
        closeQuietly(playwright, "playwright");
        log.debug("playwright page session closed");
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("page session is closed");
        }
    }

    private void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("{} already closed, skip close", name);
            } else {
                log.warn("failed to close {}", name, ex);
            }
        }
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

    static String toPlaywrightSelector(String selector) {
        return SelectorSupport.isXpath(selector) ? "xpath=" + selector : selector;
    }

    private static final class PlaywrightPageElement implements PageElement {

        private final ElementHandle handle;

        private PlaywrightPageElement(ElementHandle handle) {
            this.handle = handle;
        }

        @Override
        public String text() {
            try {
                String text = handle.innerText();
                return text == null ? "" : text;
            } catch (PlaywrightException ex) {
                String text = handle.textContent();
                return text == null ? "" : text;
            }
        }

        @Override
        public Optional<String> attribute(String name) {
            try {
                Object value = SelectorSupport.isUrlAttribute(name)
                    ? handle.evaluate(URL_PROPERTY_SCRIPT, name)
                    : handle.getAttribute(name);
                if (value == null || value.toString().isBlank()) {
                    return Optional.empty();
                }
                return Optional.of(value.toString().trim());
            } catch (PlaywrightException ex) {
                log.debug("read attribute failed, name={}, error={}", name, ex.getMessage());
                return Optional.empty();
            }
        }

        @Override
        public Optional<PageElement> findFirst(List<String> selectors) {
            for (String selector : selectors) {
                try {
                    ElementHandle child = handle.querySelector(toPlaywrightSelector(selector));
                    if (child != null) {
                        return Optional.of(new PlaywrightPageElement(child));
                    }
                } catch (PlaywrightException ex) {
                    log.debug("scoped selector lookup failed, selector={}, error={}", selector, ex.getMessage());
                }
            }
            return Optional.empty();
        }

        @Override
        public boolean isVisible() {
            try {
                return handle.isVisible();
            } catch (PlaywrightException ex) {
                return false;
            }
        }

        @Override
        public boolean isEnabled() {
            try {
                return handle.isEnabled();
            } catch (PlaywrightException ex) {
                return false;
            }
        }

    }

}
