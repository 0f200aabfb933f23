package fun.fengwk.scholar.core.service.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Publication venue classification.
 *
 * @author fengwk
 */
public enum VenueType {

    JOURNAL("Journal", List.of("journal", "nature", "science", "ieee", "acm")),

    CONFERENCE("Conference", List.of("conference", "proceedings", "workshop", "symposium")),

    PREPRINT("Preprint", List.of("arxiv", "preprint", "biorxiv")),

    UNKNOWN("Unknown", List.of());

    private final String value;
    private final List<String> keywords;

    VenueType(String value, List<String> keywords) {
        this.value = value;
        this.keywords = keywords;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Keyword classification, checked in declaration order.
     */
    public static VenueType infer(String text) {
        if (text == null || text.isBlank()) {
            return UNKNOWN;
        }
        String lowerCaseText = text.toLowerCase(Locale.ROOT);
        for (VenueType type : values()) {
            for (String keyword : type.keywords) {
                if (lowerCaseText.contains(keyword)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }

}
