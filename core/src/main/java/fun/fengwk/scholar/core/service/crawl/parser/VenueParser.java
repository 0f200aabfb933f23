package fun.fengwk.scholar.core.service.crawl.parser;

import fun.fengwk.scholar.core.service.crawl.model.VenueType;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses venue names and infers their type.
 *
 * @author fengwk
 */
@Component
public class VenueParser {

    private static final String BYLINE_SEPARATOR = " - ";

    private static final Pattern BRACKETS = Pattern.compile("\\([^)]*\\)");

    private static final Pattern TRAILING_YEAR = Pattern.compile("[,\\s]*\\b\\d{4}\\b\\s*$");

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\s,;:.…]+|[\\s,;:…]+$");

    /**
     * Parses a plain venue value.
     *
     * @param hint type used when keywords are inconclusive, nullable
     */
    public Optional<Venue> parse(String text, VenueType hint) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return toVenue(text, text, hint);
    }

    /**
     * Parses the venue segment of a byline {@code "authors - venue, year - host"}.
     */
    public Optional<Venue> parseByline(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String[] segments = text.split(BYLINE_SEPARATOR);
        if (segments.length < 2) {
            return Optional.empty();
        }
        return toVenue(segments[1], text, null);
    }

    private Optional<Venue> toVenue(String venueText, String classificationText, VenueType hint) {
        String name = BRACKETS.matcher(venueText).replaceAll(" ");
        name = TRAILING_YEAR.matcher(name).replaceAll("");
        name = EDGE_PUNCTUATION.matcher(name).replaceAll("").replaceAll("\\s+", " ").trim();
        if (name.isEmpty()) {
            return Optional.empty();
        }

        VenueType type = VenueType.infer(classificationText);
        if (type == VenueType.UNKNOWN && hint != null) {
            type = hint;
        }
        return Optional.of(new Venue(name, type));
    }

}
