package fun.fengwk.scholar.core.service.browser.session;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Script-less page session over jsoup documents.
 *
 * <p>Clicks are not supported and always report {@code false}, so "load more" style interactions
 * simply stop after the first page.
 *
 * @author fengwk
 */
@Slf4j
public class JsoupPageSession implements PageSession {

    private final DocumentLoader documentLoader;
    private volatile boolean closed = false;
    private Document document;

    public JsoupPageSession(DocumentLoader documentLoader) {
        this.documentLoader = documentLoader;
    }

    @Override
    public void navigate(String url) {
        ensureOpen();
        try {
            document = documentLoader.load(url);
        } catch (IOException ex) {
            throw new IllegalStateException("failed to load document: " + url + ", error=" + ex.getMessage(), ex);
        }
        if (document == null) {
            throw new IllegalStateException("no document loaded for url: " + url);
        }
    }

    @Override
    public String title() {
        Document current = document;
        return current == null ? "" : current.title();
    }

    @Override
    public Optional<PageElement> findFirst(List<String> selectors) {
        Document current = document;
        if (current == null) {
            return Optional.empty();
        }
        return findFirstIn(current, selectors);
    }

    @Override
    public List<PageElement> findAll(List<String> selectors) {
        Document current = document;
        if (current == null) {
            return List.of();
        }
        for (String selector : selectors) {
            Elements elements = select(current, selector);
            if (!elements.isEmpty()) {
                List<PageElement> result = new ArrayList<>(elements.size());
                for (Element element : elements) {
                    result.add(new JsoupPageElement(element));
                }
                return result;
            }
        }
        return List.of();
    }

    @Override
    public boolean click(PageElement element) {
        log.debug("static page session does not support click");
        return false;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        document = null;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("page session is closed");
        }
    }

    private static Optional<PageElement> findFirstIn(Element root, List<String> selectors) {
        for (String selector : selectors) {
            Elements elements = select(root, selector);
            if (!elements.isEmpty()) {
                return Optional.of(new JsoupPageElement(elements.first()));
            }
        }
        return Optional.empty();
    }

    private static Elements select(Element root, String selector) {
        try {
            return SelectorSupport.isXpath(selector) ? root.selectXpath(selector) : root.select(selector);
        } catch (RuntimeException ex) {
            log.debug("selector lookup failed, selector={}, error={}", selector, ex.getMessage());
            return new Elements();
        }
    }

    private static final class JsoupPageElement implements PageElement {

        private final Element element;

        private JsoupPageElement(Element element) {
            this.element = element;
        }

        @Override
        public String text() {
            return element.text();
        }

        @Override
        public Optional<String> attribute(String name) {
            String value = SelectorSupport.isUrlAttribute(name) ? element.absUrl(name) : "";
            if (value.isEmpty()) {
                value = element.attr(name);
            }
            return value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        }

        @Override
        public Optional<PageElement> findFirst(List<String> selectors) {
            return findFirstIn(element, selectors);
        }

        @Override
        public boolean isVisible() {
            if (element.hasAttr("hidden")) {
                return false;
            }
            String style = element.attr("style").replace(" ", "").toLowerCase(Locale.ROOT);
            return !style.contains("display:none") && !style.contains("visibility:hidden");
        }

        @Override
        public boolean isEnabled() {
            return !element.hasAttr("disabled");
        }

    }

}
