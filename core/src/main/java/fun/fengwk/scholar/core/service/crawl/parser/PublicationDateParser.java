package fun.fengwk.scholar.core.service.crawl.parser;

import fun.fengwk.scholar.core.service.crawl.model.PaperRecord;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses publication dates out of free text.
 *
 * <p>Full dates ({@code yyyy/MM/dd}, {@code yyyy-MM-dd}, {@code MM/dd/yyyy}, {@code MM-dd-yyyy})
 * win over a bare year, which is accepted only within [{@value #MIN_YEAR}, {@value #MAX_YEAR}] and
 * expanded to January 1st.
 *
 * @author fengwk
 */
@Component
public class PublicationDateParser {

    public static final int MIN_YEAR = 1900;

    public static final int MAX_YEAR = 2030;

    private static final Pattern YEAR_FIRST_PATTERN = Pattern.compile("\\b(\\d{4})([/-])(\\d{1,2})\\2(\\d{1,2})\\b");

    private static final Pattern YEAR_LAST_PATTERN = Pattern.compile("\\b(\\d{1,2})([/-])(\\d{1,2})\\2(\\d{4})\\b");

    private static final Pattern YEAR_PATTERN = Pattern.compile("\\b(\\d{4})\\b");

    public Optional<PublicationDate> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Matcher yearFirst = YEAR_FIRST_PATTERN.matcher(text);
        while (yearFirst.find()) {
            Optional<PublicationDate> date = toDate(yearFirst.group(1), yearFirst.group(3), yearFirst.group(4));
            if (date.isPresent()) {
                return date;
            }
        }

        Matcher yearLast = YEAR_LAST_PATTERN.matcher(text);
        while (yearLast.find()) {
            Optional<PublicationDate> date = toDate(yearLast.group(4), yearLast.group(1), yearLast.group(3));
            if (date.isPresent()) {
                return date;
            }
        }

        Matcher bareYear = YEAR_PATTERN.matcher(text);
        while (bareYear.find()) {
            int year = Integer.parseInt(bareYear.group(1));
            if (year >= MIN_YEAR && year <= MAX_YEAR) {
                return Optional.of(new PublicationDate(year, LocalDate.of(year, 1, 1).toString()));
            }
        }
        return Optional.empty();
    }

    /**
     * Date used when nothing could be parsed.
     */
    public static String defaultDate(int year) {
        return year > 0 ? LocalDate.of(year, 1, 1).toString() : PaperRecord.UNKNOWN_PUBLICATION_DATE;
    }

    private Optional<PublicationDate> toDate(String year, String month, String day) {
        try {
            LocalDate date = LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
            return Optional.of(new PublicationDate(date.getYear(), date.toString()));
        } catch (DateTimeException | NumberFormatException ex) {
            return Optional.empty();
        }
    }

}
