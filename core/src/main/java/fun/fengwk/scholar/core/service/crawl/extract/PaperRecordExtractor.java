package fun.fengwk.scholar.core.service.crawl.extract;

import fun.fengwk.scholar.core.service.browser.session.PageSession;
import fun.fengwk.scholar.core.service.crawl.CrawlProperties;
import fun.fengwk.scholar.core.service.crawl.model.PaperRecord;
import fun.fengwk.scholar.core.service.crawl.model.VenueType;
import fun.fengwk.scholar.core.service.crawl.parser.AuthorListParser;
import fun.fengwk.scholar.core.service.crawl.parser.CitationCountParser;
import fun.fengwk.scholar.core.service.crawl.parser.PublicationDate;
import fun.fengwk.scholar.core.service.crawl.parser.PublicationDateParser;
import fun.fengwk.scholar.core.service.crawl.parser.SummaryParser;
import fun.fengwk.scholar.core.service.crawl.parser.Venue;
import fun.fengwk.scholar.core.service.crawl.parser.VenueParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Extracts a {@link PaperRecord} from the paper page currently loaded in a session.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class PaperRecordExtractor {

    private final FieldChain<String> titleChain;
    private final FieldChain<List<String>> authorsChain;
    private final FieldChain<PublicationDate> dateChain;
    private final FieldChain<String> artifactChain;
    private final FieldChain<Integer> citationChain;
    private final FieldChain<Venue> venueChain;
    private final FieldChain<String> summaryChain;

    public PaperRecordExtractor(CrawlProperties crawlProperties,
                                PublicationDateParser publicationDateParser,
                                AuthorListParser authorListParser,
                                CitationCountParser citationCountParser,
                                VenueParser venueParser,
                                SummaryParser summaryParser) {
        int minTitleLength = crawlProperties.getMinTitleLength();
        int maxAuthors = crawlProperties.getMaxAuthors();
        int summaryMinLength = crawlProperties.getSummaryMinLength();
        int summaryMaxLength = crawlProperties.getSummaryMaxLength();

        FieldChain.Builder<String> title = FieldChain.builder("title");
        for (String selector : ExtractionSelectors.TITLE) {
            title.then(FieldExtractor.text(selector, text -> acceptTitle(text, minTitleLength)));
        }
        this.titleChain = title.build();

        FieldChain.Builder<List<String>> authors = FieldChain.builder("authors");
        for (String selector : ExtractionSelectors.AUTHORS) {
            authors.then(FieldExtractor.text(selector, text -> {
                List<String> parsed = authorListParser.parse(text, maxAuthors);
                return parsed.isEmpty() ? Optional.empty() : Optional.of(parsed);
            }));
        }
        this.authorsChain = authors.build();

        FieldChain.Builder<PublicationDate> date = FieldChain.builder("publication_date");
        for (String selector : ExtractionSelectors.PUBLICATION_DATE) {
            date.then(FieldExtractor.text(selector, publicationDateParser::parse));
        }
        this.dateChain = date.build();

        FieldChain.Builder<String> artifact = FieldChain.builder("artifact_url");
        for (String selector : ExtractionSelectors.ARTIFACT_LINKS) {
            artifact.then(FieldExtractor.attribute(selector, "href", PaperRecordExtractor::acceptArtifactUrl));
        }
        this.artifactChain = artifact.build();

        FieldChain.Builder<Integer> citation = FieldChain.builder("citation_count");
        for (String selector : ExtractionSelectors.CITATIONS) {
            citation.then(FieldExtractor.text(selector, citationCountParser::parse));
        }
        this.citationChain = citation.build();

        FieldChain.Builder<Venue> venue = FieldChain.<Venue>builder("venue")
            .then(FieldExtractor.text(ExtractionSelectors.JOURNAL_FIELD, text -> venueParser.parse(text, VenueType.JOURNAL)))
            .then(FieldExtractor.text(ExtractionSelectors.CONFERENCE_FIELD, text -> venueParser.parse(text, VenueType.CONFERENCE)));
        for (String selector : ExtractionSelectors.SOURCE_FIELDS) {
            venue.then(FieldExtractor.text(selector, text -> venueParser.parse(text, null)));
        }
        venue.then(FieldExtractor.text(ExtractionSelectors.BYLINE, venueParser::parseByline));
        for (String selector : ExtractionSelectors.VENUE_FALLBACKS) {
            venue.then(FieldExtractor.text(selector, text -> venueParser.parse(text, null)));
        }
        this.venueChain = venue.build();

        FieldChain.Builder<String> summary = FieldChain.builder("summary");
        for (String selector : ExtractionSelectors.SUMMARY) {
            summary.then(FieldExtractor.text(selector, text -> summaryParser.parse(text, summaryMinLength, summaryMaxLength)));
        }
        this.summaryChain = summary.build();
    }

    /**
     * Extracts the record of the loaded page.
     *
     * @param itemUrl url the session was navigated to
     * @return empty when no acceptable title is found
     */
    public Optional<PaperRecord> extract(PageSession session, String itemUrl) {
        Optional<String> title = titleChain.extract(session);
        if (title.isEmpty()) {
            log.debug("paper title not found, itemUrl={}", itemUrl);
            return Optional.empty();
        }

        Optional<PublicationDate> date = dateChain.extract(session);
        int year = date.map(PublicationDate::year).orElse(0);
        Optional<Venue> venue = venueChain.extract(session);

        return Optional.of(PaperRecord.builder()
            .title(title.get())
            .authors(authorsChain.extract(session).orElse(List.of()))
            .year(year)
            .publicationDate(date.map(PublicationDate::date).orElse(PublicationDateParser.defaultDate(year)))
            .sourceUrl(itemUrl)
            .artifactUrl(artifactChain.extract(session).orElse(null))
            .citationCount(citationChain.extract(session).orElse(0))
            .venue(venue.map(Venue::name).orElse(null))
            .venueType(venue.map(Venue::type).orElse(VenueType.UNKNOWN))
            .summary(summaryChain.extract(session).orElse(null))
            .build());
    }

    private static Optional<String> acceptTitle(String text, int minTitleLength) {
        if (text == null) {
            return Optional.empty();
        }
        String title = text.replaceAll("\\s+", " ").trim();
        return title.length() >= minTitleLength ? Optional.of(title) : Optional.empty();
    }

    static Optional<String> acceptArtifactUrl(String url) {
        if (url == null) {
            return Optional.empty();
        }
        String lowerCaseUrl = url.trim().toLowerCase(Locale.ROOT);
        if (!lowerCaseUrl.startsWith("http://") && !lowerCaseUrl.startsWith("https://")) {
            return Optional.empty();
        }
        int queryIndex = lowerCaseUrl.indexOf('?');
        String path = queryIndex >= 0 ? lowerCaseUrl.substring(0, queryIndex) : lowerCaseUrl;
        if (path.endsWith(".pdf") || lowerCaseUrl.contains("doi.org") || lowerCaseUrl.contains("arxiv.org")) {
            return Optional.of(url.trim());
        }
        return Optional.empty();
    }

}
