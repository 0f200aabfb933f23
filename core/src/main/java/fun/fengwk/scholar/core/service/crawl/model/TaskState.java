package fun.fengwk.scholar.core.service.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a job snapshot was read from.
 *
 * @author fengwk
 */
public enum TaskState {

    /**
     * Job is queued or executing.
     */
    RUNNING("running"),

    /**
     * Job reached a terminal status and lives in the completed history.
     */
    COMPLETED("completed");

    private final String value;

    TaskState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
