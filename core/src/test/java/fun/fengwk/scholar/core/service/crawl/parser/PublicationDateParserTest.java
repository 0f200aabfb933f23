package fun.fengwk.scholar.core.service.crawl.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class PublicationDateParserTest {

    private final PublicationDateParser parser = new PublicationDateParser();

    @Test
    public void shouldParseYearFirstDates() {
        assertThat(parser.parse("2019/3/7")).contains(new PublicationDate(2019, "2019-03-07"));
        assertThat(parser.parse("published 2020-11-30 online")).contains(new PublicationDate(2020, "2020-11-30"));
    }

    @Test
    public void shouldParseYearLastDates() {
        assertThat(parser.parse("12/25/2018")).contains(new PublicationDate(2018, "2018-12-25"));
        assertThat(parser.parse("01-02-2017")).contains(new PublicationDate(2017, "2017-01-02"));
    }

    @Test
    public void shouldFallBackToYearWhenDateInvalid() {
        assertThat(parser.parse("2019-13-45")).contains(new PublicationDate(2019, "2019-01-01"));
    }

    @Test
    public void shouldExpandBareYearToJanuaryFirst() {
        assertThat(parser.parse("A Smith, B Jones - Nature, 2019 - nature.com"))
            .contains(new PublicationDate(2019, "2019-01-01"));
    }

    @Test
    public void shouldIgnoreYearsOutOfRange() {
        assertThat(parser.parse("volume 1843")).isEmpty();
        assertThat(parser.parse("report 2099")).isEmpty();
        assertThat(parser.parse("Proceedings 1843, reprinted 1993")).contains(new PublicationDate(1993, "1993-01-01"));
    }

    @Test
    public void shouldReturnEmptyWithoutDate() {
        assertThat(parser.parse("no date here")).isEmpty();
        assertThat(parser.parse(" ")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    public void shouldBuildDefaultDate() {
        assertThat(PublicationDateParser.defaultDate(2021)).isEqualTo("2021-01-01");
        assertThat(PublicationDateParser.defaultDate(0)).isEqualTo("1900-01-01");
    }

}
