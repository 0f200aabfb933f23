package fun.fengwk.scholar.core.service.crawl.parser;

/**
 * Parsed publication date.
 *
 * @param year publication year
 * @param date date formatted as yyyy-MM-dd
 * @author fengwk
 */
public record PublicationDate(int year, String date) {
}
