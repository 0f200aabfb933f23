package fun.fengwk.scholar.core.service.crawl.parser;

import fun.fengwk.scholar.core.service.crawl.model.VenueType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class VenueParserTest {

    private final VenueParser parser = new VenueParser();

    @Test
    public void shouldParseBylineVenue() {
        assertThat(parser.parseByline("A Lovelace, C Babbage - Journal of Engines, 1993 - example.org"))
            .contains(new Venue("Journal of Engines", VenueType.JOURNAL));
    }

    @Test
    public void shouldRejectBylineWithoutVenue() {
        assertThat(parser.parseByline("A Lovelace - 1993 - example.org")).isEmpty();
        assertThat(parser.parseByline("A Lovelace")).isEmpty();
    }

    @Test
    public void shouldStripBracketsAndInferType() {
        assertThat(parser.parse("Proceedings of the Analytical Workshop (AW 1993)", null))
            .contains(new Venue("Proceedings of the Analytical Workshop", VenueType.CONFERENCE));
        assertThat(parser.parse("arXiv preprint arXiv:2101.00001", null))
            .contains(new Venue("arXiv preprint arXiv:2101.00001", VenueType.PREPRINT));
    }

    @Test
    public void shouldUseHintWhenKeywordsInconclusive() {
        assertThat(parser.parse("Engines Quarterly", VenueType.JOURNAL))
            .contains(new Venue("Engines Quarterly", VenueType.JOURNAL));
        assertThat(parser.parse("Engines Quarterly", null))
            .contains(new Venue("Engines Quarterly", VenueType.UNKNOWN));
    }

    @Test
    public void shouldPreferKeywordsOverHint() {
        assertThat(parser.parse("IEEE Transactions on Engines", VenueType.CONFERENCE))
            .contains(new Venue("IEEE Transactions on Engines", VenueType.JOURNAL));
    }

}
