package fun.fengwk.scholar.core.service.crawl.extract;

import fun.fengwk.scholar.core.service.browser.session.PageElement;
import fun.fengwk.scholar.core.service.browser.session.PageSession;
import fun.fengwk.scholar.core.service.crawl.CrawlProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks an author profile: resolves the author name, expands the paper list and collects paper urls.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorProfileDiscoverer {

    private final CrawlProperties crawlProperties;

    /**
     * Navigates to the profile and waits, bounded, for its content to appear.
     */
    public void open(PageSession session, String profileUrl) {
        session.navigate(profileUrl);
        boolean ready = session.waitUntil(
            () -> !session.findAll(ExtractionSelectors.PAPER_ROWS).isEmpty()
                || session.findFirst(ExtractionSelectors.SUBJECT_NAME).isPresent(),
            Duration.ofMillis(crawlProperties.getElementWaitTimeoutMs()));
        if (!ready) {
            log.warn("profile content not ready before timeout, url={}", profileUrl);
        }
        session.pause(crawlProperties.getPageLoadDelayMs());
    }

    /**
     * @throws DiscoveryException if neither a name element nor the page title yields a name
     */
    public String resolveSubjectName(PageSession session, String profileUrl) {
        Optional<String> name = session.findFirstText(ExtractionSelectors.SUBJECT_NAME);
        if (name.isPresent()) {
            return name.get();
        }

        String title = session.title();
        if (title != null) {
            int separatorIndex = title.indexOf(ExtractionSelectors.TITLE_SEPARATOR);
            if (separatorIndex > 0) {
                String titleName = title.substring(0, separatorIndex).trim();
                if (StringUtils.hasText(titleName)) {
                    return titleName;
                }
            }
        }
        throw new DiscoveryException("unable to resolve author name from " + profileUrl);
    }

    /**
     * Best-effort sort of the paper list by year.
     *
     * @return true if the sort control was clicked
     */
    public boolean sortByYear(PageSession session) {
        Optional<PageElement> sortControl = session.findFirst(ExtractionSelectors.SORT_BY_YEAR);
        if (sortControl.isEmpty()) {
            log.warn("sort control not found, continue unsorted");
            return false;
        }
        if (!session.click(sortControl.get())) {
            log.warn("sort control not clickable, continue unsorted");
            return false;
        }
        session.pause(crawlProperties.getClickDelayMs());
        return true;
    }

    /**
     * Clicks "show more" while it stays visible and enabled.
     *
     * @return number of successful clicks
     */
    public int expandAll(PageSession session) {
        int clicks = 0;
        int maxAttempts = crawlProperties.getMaxShowMoreAttempts();
        while (clicks < maxAttempts) {
            Optional<PageElement> showMore = session.findFirst(ExtractionSelectors.SHOW_MORE);
            if (showMore.isEmpty() || !showMore.get().isVisible() || !showMore.get().isEnabled()) {
                break;
            }
            if (!session.click(showMore.get())) {
                break;
            }
            clicks++;
            if (!session.pause(crawlProperties.getShowMoreDelayMs())) {
                break;
            }
        }
        if (clicks >= maxAttempts) {
            log.warn("show more attempts exhausted, attempts={}", clicks);
        }
        log.debug("paper list expanded, clicks={}", clicks);
        return clicks;
    }

    /**
     * Collects absolute paper urls in page order, without duplicates.
     *
     * @throws DiscoveryException if no url is found
     */
    public List<String> collectItemUrls(PageSession session, String profileUrl) {
        Set<String> urls = new LinkedHashSet<>();
        for (PageElement row : session.findAll(ExtractionSelectors.PAPER_ROWS)) {
            row.findFirst(ExtractionSelectors.PAPER_ROW_LINK)
                .flatMap(link -> link.attribute("href"))
                .map(String::trim)
                .filter(href -> href.startsWith("http://") || href.startsWith("https://"))
                .ifPresent(urls::add);
        }
        if (urls.isEmpty()) {
            throw new DiscoveryException("no paper urls discovered at " + profileUrl);
        }
        return new ArrayList<>(urls);
    }

}
