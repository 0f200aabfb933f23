package fun.fengwk.scholar.core.service.crawl.parser;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes paper descriptions.
 *
 * @author fengwk
 */
@Component
public class SummaryParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @return the normalized text truncated to {@code maxLength}, or empty when not longer than {@code minLength}
     */
    public Optional<String> parse(String text, int minLength, int maxLength) {
        if (text == null) {
            return Optional.empty();
        }
        String summary = WHITESPACE.matcher(text).replaceAll(" ").trim();
        if (summary.length() <= minLength) {
            return Optional.empty();
        }
        if (maxLength > 0 && summary.length() > maxLength) {
            summary = summary.substring(0, maxLength);
        }
        return Optional.of(summary);
    }

}
