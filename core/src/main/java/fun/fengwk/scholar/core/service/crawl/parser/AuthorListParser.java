package fun.fengwk.scholar.core.service.crawl.parser;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses comma separated author lists, e.g. the byline {@code "A Smith, B Jones - Nature, 2019 - nature.com"}.
 * Text after the first {@code " - "} or the first four digit run is venue or year and is dropped.
 *
 * @author fengwk
 */
@Component
public class AuthorListParser {

    private static final String BYLINE_SEPARATOR = " - ";

    private static final Pattern YEAR = Pattern.compile("\\b\\d{4}\\b");

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final Pattern NOISE = Pattern.compile("[^\\p{L}\\p{M}\\s.'\\-]");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern LETTER = Pattern.compile("\\p{L}");

    public List<String> parse(String text, int maxAuthors) {
        if (text == null || text.isBlank() || maxAuthors <= 0) {
            return List.of();
        }

        String authorsText = text;
        int separatorIndex = authorsText.indexOf(BYLINE_SEPARATOR);
        if (separatorIndex >= 0) {
            authorsText = authorsText.substring(0, separatorIndex);
        }
        Matcher yearMatcher = YEAR.matcher(authorsText);
        if (yearMatcher.find()) {
            authorsText = authorsText.substring(0, yearMatcher.start());
        }

        Set<String> authors = new LinkedHashSet<>();
        for (String token : authorsText.split(",")) {
            String author = normalize(token);
            if (author.length() <= 1 || !LETTER.matcher(author).find()) {
                continue;
            }
            authors.add(author);
            if (authors.size() >= maxAuthors) {
                break;
            }
        }
        return List.copyOf(authors);
    }

    private String normalize(String token) {
        String author = DIGITS.matcher(token).replaceAll("");
        author = NOISE.matcher(author).replaceAll("");
        return WHITESPACE.matcher(author).replaceAll(" ").trim();
    }

}
