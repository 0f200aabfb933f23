package fun.fengwk.scholar.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Page session runtime configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "scholar.browser")
public class BrowserProperties {

    public static final String SESSION_MODE_PLAYWRIGHT = "playwright";

    public static final String SESSION_MODE_STATIC = "static";

    /**
     * Page session implementation: playwright (real browser) or static (jsoup, no javascript).
     */
    private String sessionMode = SESSION_MODE_PLAYWRIGHT;

    /**
     * Whether browser sessions run in headless mode.
     */
    private boolean headless = true;

    /**
     * Page navigate timeout in milliseconds.
     */
    private int navigateTimeoutMs = 30000;

    /**
     * Timeout for static document fetches in milliseconds.
     */
    private int staticFetchTimeoutMs = 15000;

    private int viewportWidth = 1200;

    private int viewportHeight = 800;

    /**
     * Optional fixed user agent.
     */
    private String userAgent = "";

    /**
     * User agent pool for random rotation.
     */
    private List<String> userAgents = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
    );

    /**
     * Optional Accept-Language header value.
     */
    private String acceptLanguage = "en-US,en;q=0.9";

    private String locale = "";

    private String timezoneId = "";

    /**
     * Extra headers for every request of the session.
     */
    private Map<String, String> extraHeaders = Map.of();

    /**
     * Proxy server, for example http://proxy:8080.
     */
    private String proxyServer = "";

    private String proxyUsername = "";

    private String proxyPassword = "";

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of(
        "--disable-gpu",
        "--no-sandbox",
        "--disable-dev-shm-usage",
        "--disable-blink-features=AutomationControlled"
    );

    /**
     * Default args to drop from browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    private boolean ignoreAllDefaultArgs = false;

    /**
     * Whether to install the stealth init script.
     */
    private boolean stealthEnabled = true;

    /**
     * Optional stealth script, empty uses default.
     */
    private String stealthScript = "";

    public String resolveStealthScript() {
        if (!stealthEnabled) {
            return "";
        }
        if (StringUtils.hasText(stealthScript)) {
            return stealthScript;
        }
        return BrowserStealthSupport.defaultScript(acceptLanguage);
    }

    public String resolveUserAgent() {
        if (StringUtils.hasText(userAgent)) {
            return userAgent;
        }
        if (userAgents == null || userAgents.isEmpty()) {
            return "";
        }
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

}
