package fun.fengwk.scholar.core.service.browser.session;

import fun.fengwk.scholar.core.service.browser.BrowserProperties;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Opens script-less sessions that fetch documents over plain http.
 *
 * @author fengwk
 */
@Component
@ConditionalOnProperty(prefix = "scholar.browser", name = "session-mode", havingValue = BrowserProperties.SESSION_MODE_STATIC)
public class JsoupPageSessionFactory implements PageSessionFactory {

    private final DocumentLoader documentLoader;

    @Autowired
    public JsoupPageSessionFactory(BrowserProperties browserProperties) {
        this(httpDocumentLoader(browserProperties));
    }

    public JsoupPageSessionFactory(DocumentLoader documentLoader) {
        this.documentLoader = documentLoader;
    }

    @Override
    public PageSession open() {
        return new JsoupPageSession(documentLoader);
    }

    private static DocumentLoader httpDocumentLoader(BrowserProperties browserProperties) {
        return url -> {
            Connection connection = Jsoup.connect(url)
                .timeout(browserProperties.getStaticFetchTimeoutMs())
                .followRedirects(true);
            String userAgent = browserProperties.resolveUserAgent();
            if (StringUtils.hasText(userAgent)) {
                connection.userAgent(userAgent);
            }
            if (StringUtils.hasText(browserProperties.getAcceptLanguage())) {
                connection.header("Accept-Language", browserProperties.getAcceptLanguage());
            }
            if (browserProperties.getExtraHeaders() != null) {
                browserProperties.getExtraHeaders().forEach((key, value) -> {
                    if (StringUtils.hasText(key) && StringUtils.hasText(value)) {
                        connection.header(key, value);
                    }
                });
            }
            return connection.get();
        };
    }

}
