package fun.fengwk.scholar.core.service.crawl.parser;

import fun.fengwk.scholar.core.service.crawl.model.VenueType;

/**
 * Parsed publication venue.
 *
 * @author fengwk
 */
public record Venue(String name, VenueType type) {
}
