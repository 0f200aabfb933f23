package fun.fengwk.scholar.core.service.browser.session;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import fun.fengwk.scholar.core.service.browser.BrowserProperties;
import fun.fengwk.scholar.core.service.browser.BrowserStealthSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Opens one Chromium browser per page session.
 *
 * @author fengwk
 */
@Slf4j
@Component
@ConditionalOnProperty(
    prefix = "scholar.browser",
    name = "session-mode",
    havingValue = BrowserProperties.SESSION_MODE_PLAYWRIGHT,
    matchIfMissing = true
)
public class PlaywrightPageSessionFactory implements PageSessionFactory {

    private final BrowserProperties browserProperties;
    private final PlaywrightLauncher playwrightLauncher;

    @Autowired
    public PlaywrightPageSessionFactory(BrowserProperties browserProperties) {
        this(browserProperties, Playwright::create);
    }

    PlaywrightPageSessionFactory(BrowserProperties browserProperties, PlaywrightLauncher playwrightLauncher) {
        this.browserProperties = browserProperties;
        this.playwrightLauncher = playwrightLauncher;
    }

    @Override
    public PageSession open() {
        Playwright playwright = null;
        Browser browser = null;
        BrowserContext browserContext = null;
        try {
            playwright = playwrightLauncher.launch();
            browser = playwright.chromium().launch(buildLaunchOptions());
            browserContext = browser.newContext(buildContextOptions());
            BrowserStealthSupport.apply(browserContext, browserProperties);
            Page page = browserContext.newPage();
            log.debug("opened playwright page session, headless={}", browserProperties.isHeadless());
            return new PlaywrightPageSession(playwright, browser, browserContext, page, browserProperties.getNavigateTimeoutMs());
        } catch (Exception ex) {
            log.warn("open playwright page session failed, error={}", ex.getMessage(), ex);
            // Creation failure must release all partially initialized resources.
            closeQuietly(browserContext);
            closeQuietly(browser);
            closeQuietly(playwright);
            throw new SessionInitException("failed to open browser session: " + ex.getMessage(), ex);
        }
    }

    BrowserType.LaunchOptions buildLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());

        if (browserProperties.isIgnoreAllDefaultArgs()) {
            options.setIgnoreAllDefaultArgs(true);
        } else if (browserProperties.getIgnoreDefaultArgs() != null
            && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }

        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }

        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }

        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }

        if (StringUtils.hasText(browserProperties.getProxyServer())) {
            Proxy proxy = new Proxy(browserProperties.getProxyServer());
            if (StringUtils.hasText(browserProperties.getProxyUsername())) {
                proxy.setUsername(browserProperties.getProxyUsername());
            }
            if (StringUtils.hasText(browserProperties.getProxyPassword())) {
                proxy.setPassword(browserProperties.getProxyPassword());
            }
            options.setProxy(proxy);
        }
        return options;
    }

    Browser.NewContextOptions buildContextOptions() {
        Browser.NewContextOptions options = new Browser.NewContextOptions()
            .setViewportSize(browserProperties.getViewportWidth(), browserProperties.getViewportHeight());

        String userAgent = browserProperties.resolveUserAgent();
        if (StringUtils.hasText(userAgent)) {
            options.setUserAgent(userAgent);
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }

        Map<String, String> headers = new HashMap<>();
        if (browserProperties.getExtraHeaders() != null) {
            browserProperties.getExtraHeaders().forEach((key, value) -> {
                if (StringUtils.hasText(key) && StringUtils.hasText(value)) {
                    headers.put(key, value);
                }
            });
        }
        if (StringUtils.hasText(browserProperties.getAcceptLanguage())) {
            headers.putIfAbsent("Accept-Language", browserProperties.getAcceptLanguage());
        }
        if (!headers.isEmpty()) {
            options.setExtraHTTPHeaders(headers);
        }
        return options;
    }

    private void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            log.debug("close resource failed, error={}", ex.getMessage());
        }
    }

    @FunctionalInterface
    interface PlaywrightLauncher {

        Playwright launch();

    }

}
