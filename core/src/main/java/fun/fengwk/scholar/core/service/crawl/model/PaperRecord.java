package fun.fengwk.scholar.core.service.crawl.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structured metadata of one discovered paper.
 *
 * @author fengwk
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaperRecord {

    public static final String UNKNOWN_PUBLICATION_DATE = "1900-01-01";

    String title;

    /**
     * Author names, immutable once built.
     */
    @Singular
    List<String> authors;

    /**
     * Publication year, 0 when unknown.
     */
    int year;

    /**
     * Publication date formatted as yyyy-MM-dd.
     */
    String publicationDate;

    /**
     * Item page the record was extracted from.
     */
    String sourceUrl;

    /**
     * Full text link, e.g. pdf, doi or arxiv.
     */
    String artifactUrl;

    int citationCount;

    String venue;

    @Builder.Default
    VenueType venueType = VenueType.UNKNOWN;

    String summary;

}
