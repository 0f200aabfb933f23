package fun.fengwk.scholar.core.service.browser.session;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class JsoupPageSessionTest {

    private static final String URL = "https://scholar.example.org/citations?user=ada";

    private static final String HTML = """
        <html><head><title>Ada Lovelace - Google Scholar</title></head><body>
        <div id="gsc_prf_in"> Ada Lovelace </div>
        <div class="gsc_oci_field">Authors</div><div class="gsc_oci_value">A Lovelace</div>
        <table><tbody>
        <tr class="gsc_a_tr"><td><a class="gsc_a_at" href="/paper/1">One</a></td></tr>
        <tr class="gsc_a_tr"><td><a class="gsc_a_at" href="/paper/2">Two</a></td></tr>
        </tbody></table>
        <button id="hidden" hidden>hidden</button>
        <button id="styled" style="display: none">styled</button>
        <button id="disabled" disabled>disabled</button>
        <button id="ready">ready</button>
        </body></html>
        """;

    @Test
    public void shouldFindWithCssFallbacks() {
        PageSession session = open();

        assertThat(session.title()).isEqualTo("Ada Lovelace - Google Scholar");
        assertThat(session.findFirstText(List.of("#missing", "#gsc_prf_in"))).contains("Ada Lovelace");
        assertThat(session.findAll(List.of(".missing", "tr.gsc_a_tr"))).hasSize(2);
        assertThat(session.findFirst(List.of(".missing"))).isEmpty();
        assertThat(session.findAll(List.of(".missing"))).isEmpty();
    }

    @Test
    public void shouldFindWithXpath() {
        PageSession session = open();

        assertThat(session.findFirstText(List.of(
            "//div[@class='gsc_oci_field'][normalize-space(.)='Authors']/following-sibling::div[@class='gsc_oci_value']"
        ))).contains("A Lovelace");
    }

    @Test
    public void shouldTreatInvalidSelectorAsMissing() {
        PageSession session = open();

        assertThat(session.findFirst(List.of("[[invalid", "#gsc_prf_in"))).isPresent();
        assertThat(session.findFirst(List.of("//*[", "#gsc_prf_in"))).isPresent();
    }

    @Test
    public void shouldResolveAbsoluteLinksInScopedLookup() {
        PageSession session = open();

        List<PageElement> rows = session.findAll(List.of(".gsc_a_tr"));

        assertThat(rows.get(1).findFirst(List.of("a.gsc_a_at")).flatMap(link -> link.attribute("href")))
            .contains("https://scholar.example.org/paper/2");
        assertThat(rows.get(0).findFirst(List.of("a.gsc_a_at")).flatMap(link -> link.attribute("class")))
            .contains("gsc_a_at");
        assertThat(rows.get(0).attribute("data-missing")).isEmpty();
    }

    @Test
    public void shouldReportVisibilityAndEnabledState() {
        PageSession session = open();

        assertThat(element(session, "#hidden").isVisible()).isFalse();
        assertThat(element(session, "#styled").isVisible()).isFalse();
        assertThat(element(session, "#disabled").isEnabled()).isFalse();
        assertThat(element(session, "#ready").isVisible()).isTrue();
        assertThat(element(session, "#ready").isEnabled()).isTrue();
        assertThat(session.click(element(session, "#ready"))).isFalse();
    }

    @Test
    public void shouldWrapLoadFailures() {
        PageSession session = new JsoupPageSession(url -> {
            throw new IOException("connection refused");
        });

        assertThatThrownBy(() -> session.navigate(URL))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("failed to load document: " + URL + ", error=connection refused");
    }

    @Test
    public void shouldCloseIdempotently() {
        PageSession session = open();

        session.close();
        session.close();

        assertThat(session.isClosed()).isTrue();
        assertThat(session.findFirst(List.of("#gsc_prf_in"))).isEmpty();
        assertThat(session.title()).isEmpty();
        assertThatThrownBy(() -> session.navigate(URL))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("page session is closed");
    }

    @Test
    public void shouldWaitUntilConditionHolds() {
        PageSession session = open();
        int[] calls = {0};

        assertThat(session.waitUntil(() -> ++calls[0] >= 2, Duration.ofSeconds(1))).isTrue();
        assertThat(session.waitUntil(() -> false, Duration.ofMillis(150))).isFalse();
        assertThat(session.pause(0)).isTrue();
    }

    private PageElement element(PageSession session, String selector) {
        return session.findFirst(List.of(selector)).orElseThrow();
    }

    private PageSession open() {
        PageSession session = new JsoupPageSession(url -> Jsoup.parse(HTML, url));
        session.navigate(URL);
        return session;
    }

}
