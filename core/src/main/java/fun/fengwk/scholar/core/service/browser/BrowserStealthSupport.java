package fun.fengwk.scholar.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Stealth script helper for browser context.
 *
 * <p>The default script hides the automation flag and reports {@code navigator.languages} consistent with the
 * Accept-Language header sent to the profile host.
 *
 * @author fengwk
 */
public final class BrowserStealthSupport {

    static final List<String> FALLBACK_LANGUAGES = List.of("en-US", "en");

    private static final Pattern LANGUAGE_TAG = Pattern.compile("[A-Za-z]{1,8}(-[A-Za-z0-9]{1,8})*");

    private static final String SCRIPT_TEMPLATE = """
        (() => {
          try {
            Object.defineProperty(navigator, 'webdriver', { get: () => undefined });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'languages', { get: () => [%s] });
          } catch (e) {}
          try {
            window.chrome = window.chrome || { runtime: {} };
          } catch (e) {}
        })();
        """;

    private BrowserStealthSupport() {
    }

    public static void apply(BrowserContext context, BrowserProperties properties) {
        String script = properties.resolveStealthScript();
        if (!StringUtils.hasText(script)) {
            return;
        }
        context.addInitScript(script);
    }

    static String defaultScript(String acceptLanguage) {
        List<String> quoted = new ArrayList<>();
        for (String language : parseLanguages(acceptLanguage)) {
            quoted.add("'" + language + "'");
        }
        return String.format(SCRIPT_TEMPLATE, String.join(", ", quoted));
    }

    /**
     * Language tags of an Accept-Language value in header order, quality weights dropped.
     */
    static List<String> parseLanguages(String acceptLanguage) {
        if (!StringUtils.hasText(acceptLanguage)) {
            return FALLBACK_LANGUAGES;
        }
        List<String> languages = new ArrayList<>();
        for (String part : acceptLanguage.split(",")) {
            int weightIndex = part.indexOf(';');
            String tag = (weightIndex >= 0 ? part.substring(0, weightIndex) : part).trim();
            if (LANGUAGE_TAG.matcher(tag).matches() && !languages.contains(tag)) {
                languages.add(tag);
            }
        }
        return languages.isEmpty() ? FALLBACK_LANGUAGES : languages;
    }

}
