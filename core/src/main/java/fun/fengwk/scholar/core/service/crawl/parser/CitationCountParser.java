package fun.fengwk.scholar.core.service.crawl.parser;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses citation counts such as {@code "Cited by 1,024"} or {@code "被引用次数：42"}.
 *
 * @author fengwk
 */
@Component
public class CitationCountParser {

    private static final String NUMBER = "(\\d{1,3}(?:,\\d{3})+|\\d+)";

    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("cited by\\s*" + NUMBER, Pattern.CASE_INSENSITIVE),
        Pattern.compile("引用(?:次数)?\\s*[:：]?\\s*" + NUMBER),
        Pattern.compile(NUMBER + "\\s*citations?\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile(NUMBER)
    );

    public Optional<Integer> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                try {
                    return Optional.of(Integer.parseInt(matcher.group(1).replace(",", "")));
                } catch (NumberFormatException ex) {
                    // Overflowing number, try a looser pattern.
                }
            }
        }
        return Optional.empty();
    }

}
