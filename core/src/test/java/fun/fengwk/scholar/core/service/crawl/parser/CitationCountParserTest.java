package fun.fengwk.scholar.core.service.crawl.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class CitationCountParserTest {

    private final CitationCountParser parser = new CitationCountParser();

    @Test
    public void shouldParseCitedBy() {
        assertThat(parser.parse("Cited by 42")).contains(42);
        assertThat(parser.parse("cited by 1,024 Related articles")).contains(1024);
    }

    @Test
    public void shouldParseLocalizedCitedBy() {
        assertThat(parser.parse("2019 被引用次数：42")).contains(42);
        assertThat(parser.parse("引用 128 相关文章")).contains(128);
    }

    @Test
    public void shouldParseCitationsSuffix() {
        assertThat(parser.parse("Total: 17 citations")).contains(17);
    }

    @Test
    public void shouldFallBackToFirstInteger() {
        assertThat(parser.parse("Scholar articles 8")).contains(8);
    }

    @Test
    public void shouldReturnEmptyWithoutNumber() {
        assertThat(parser.parse("Related articles")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

}
