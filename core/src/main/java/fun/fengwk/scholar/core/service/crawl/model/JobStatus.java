package fun.fengwk.scholar.core.service.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Crawl job stages, in execution order.
 *
 * @author fengwk
 */
public enum JobStatus {

    PENDING("pending"),

    COLLECTING_INFO("collecting_info"),

    COLLECTED_INFO("collected_info"),

    SEARCHING_PAPERS("searching_papers"),

    COMPLETED("completed"),

    ERROR("error");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

}
