package fun.fengwk.scholar.core.service.crawl.extract;

import fun.fengwk.scholar.core.service.browser.session.JsoupPageSession;
import fun.fengwk.scholar.core.service.browser.session.PageElement;
import fun.fengwk.scholar.core.service.browser.session.PageSession;
import fun.fengwk.scholar.core.service.crawl.CrawlProperties;
import fun.fengwk.scholar.core.service.crawl.ScholarPageFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class AuthorProfileDiscovererTest {

    private final CrawlProperties properties = ScholarPageFixtures.fastCrawlProperties();

    private final AuthorProfileDiscoverer discoverer = new AuthorProfileDiscoverer(properties);

    @Test
    public void shouldResolveNameAndCollectUrls() {
        PageSession session = open(ScholarPageFixtures.profileHtml("Ada Lovelace",
            List.of("/paper/1", "/paper/2", "/paper/1", "https://other.example.org/paper/3")));

        assertThat(discoverer.resolveSubjectName(session, ScholarPageFixtures.PROFILE_URL)).isEqualTo("Ada Lovelace");
        assertThat(discoverer.collectItemUrls(session, ScholarPageFixtures.PROFILE_URL)).containsExactly(
            ScholarPageFixtures.HOST + "/paper/1",
            ScholarPageFixtures.HOST + "/paper/2",
            "https://other.example.org/paper/3"
        );
    }

    @Test
    public void shouldFallBackToPageTitleForName() {
        PageSession session = open(ScholarPageFixtures.profileHtml(null, List.of("/paper/1")));

        assertThat(discoverer.resolveSubjectName(session, ScholarPageFixtures.PROFILE_URL)).isEqualTo("Ada Lovelace");
    }

    @Test
    public void shouldFailWhenNameMissing() {
        PageSession session = open("<html><head><title>Profile</title></head><body></body></html>");

        assertThatThrownBy(() -> discoverer.resolveSubjectName(session, ScholarPageFixtures.PROFILE_URL))
            .isInstanceOf(DiscoveryException.class)
            .hasMessage("unable to resolve author name from " + ScholarPageFixtures.PROFILE_URL);
    }

    @Test
    public void shouldFailWhenNoPaperUrls() {
        PageSession session = open(ScholarPageFixtures.profileHtml("Ada Lovelace", List.of()));

        assertThatThrownBy(() -> discoverer.collectItemUrls(session, ScholarPageFixtures.PROFILE_URL))
            .isInstanceOf(DiscoveryException.class)
            .hasMessage("no paper urls discovered at " + ScholarPageFixtures.PROFILE_URL);
    }

    @Test
    public void shouldIgnoreNonHttpLinks() {
        PageSession session = open("""
            <html><body><div id="gsc_prf_in">Ada Lovelace</div><table><tbody>
            <tr class="gsc_a_tr"><td><a class="gsc_a_at" href="mailto:ada@example.org">mail</a></td></tr>
            <tr class="gsc_a_tr"><td><a class="gsc_a_at" href="/paper/7">paper</a></td></tr>
            </tbody></table></body></html>
            """);

        assertThat(discoverer.collectItemUrls(session, ScholarPageFixtures.PROFILE_URL))
            .containsExactly(ScholarPageFixtures.HOST + "/paper/7");
    }

    @Test
    public void shouldStopExpandingWhenButtonDisabled() {
        PageSession session = open(ScholarPageFixtures.profileHtml("Ada Lovelace", List.of("/paper/1")));

        assertThat(discoverer.expandAll(session)).isZero();
    }

    @Test
    public void shouldClickShowMoreUntilItDisappears() {
        PageSession session = mock(PageSession.class);
        PageElement showMore = visibleButton();
        when(session.findFirst(ExtractionSelectors.SHOW_MORE))
            .thenReturn(Optional.of(showMore), Optional.of(showMore), Optional.empty());
        when(session.click(showMore)).thenReturn(true);
        when(session.pause(anyLong())).thenReturn(true);

        assertThat(discoverer.expandAll(session)).isEqualTo(2);
        verify(session, times(2)).click(showMore);
    }

    @Test
    public void shouldCapShowMoreAttempts() {
        properties.setMaxShowMoreAttempts(3);
        PageSession session = mock(PageSession.class);
        PageElement showMore = visibleButton();
        when(session.findFirst(ExtractionSelectors.SHOW_MORE)).thenReturn(Optional.of(showMore));
        when(session.click(showMore)).thenReturn(true);
        when(session.pause(anyLong())).thenReturn(true);

        assertThat(discoverer.expandAll(session)).isEqualTo(3);
    }

    @Test
    public void shouldSortWhenControlClickable() {
        PageSession session = mock(PageSession.class);
        PageElement sortControl = mock(PageElement.class);
        when(session.findFirst(ExtractionSelectors.SORT_BY_YEAR)).thenReturn(Optional.of(sortControl));
        when(session.click(sortControl)).thenReturn(true);

        assertThat(discoverer.sortByYear(session)).isTrue();
    }

    @Test
    public void shouldContinueUnsortedWhenClickUnsupported() {
        PageSession session = open(ScholarPageFixtures.profileHtml("Ada Lovelace", List.of("/paper/1")));

        assertThat(discoverer.sortByYear(session)).isFalse();
    }

    @Test
    public void shouldOpenProfile() {
        JsoupPageSession session = new JsoupPageSession(new ScholarPageFixtures.InMemoryDocumentLoader()
            .page(ScholarPageFixtures.PROFILE_URL, ScholarPageFixtures.profileHtml("Ada Lovelace", List.of("/paper/1"))));

        discoverer.open(session, ScholarPageFixtures.PROFILE_URL);

        assertThat(session.title()).isEqualTo("Ada Lovelace - Google Scholar");
    }

    private PageElement visibleButton() {
        PageElement element = mock(PageElement.class);
        when(element.isVisible()).thenReturn(true);
        when(element.isEnabled()).thenReturn(true);
        return element;
    }

    private PageSession open(String html) {
        PageSession session = new JsoupPageSession(new ScholarPageFixtures.InMemoryDocumentLoader()
            .page(ScholarPageFixtures.PROFILE_URL, html));
        session.navigate(ScholarPageFixtures.PROFILE_URL);
        return session;
    }

}
