package fun.fengwk.scholar.core.service.crawl.progress;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of progress messages pushed to clients, with their wire event names.
 *
 * @author fengwk
 */
public enum ProgressEventKind {

    UPDATE_PROGRESS("update_fetch_a_google_scholar_url_process"),

    FAILED("failed_fetch_a_google_scholar_url"),

    COMPLETED("fetched_completed_with_papers_info");

    private final String eventName;

    ProgressEventKind(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }

}
