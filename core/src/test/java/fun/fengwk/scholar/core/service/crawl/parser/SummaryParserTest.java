package fun.fengwk.scholar.core.service.crawl.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class SummaryParserTest {

    private final SummaryParser parser = new SummaryParser();

    @Test
    public void shouldDropShortSummaries() {
        assertThat(parser.parse("too short", 20, 500)).isEmpty();
        assertThat(parser.parse("exactly twenty chars", 20, 500)).isEmpty();
    }

    @Test
    public void shouldNormalizeAndTruncate() {
        String text = "An   analysis of\n the engine " + "x".repeat(600);

        String summary = parser.parse(text, 20, 500).orElseThrow();

        assertThat(summary).startsWith("An analysis of the engine ").hasSize(500);
    }

}
