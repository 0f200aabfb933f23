package fun.fengwk.scholar.core.service.crawl.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a crawl job's state.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobSnapshot {

    String jobId;
    String clientId;
    String searchId;
    String sourceUrl;
    String subjectName;
    JobStatus status;
    double progress;
    Integer fetchedCount;
    Integer totalCount;

    @Builder.Default
    List<String> itemUrls = List.of();

    @Builder.Default
    List<PaperRecord> items = List.of();

    /**
     * Item urls processed without yielding a record.
     */
    int skippedCount;

    String errorMessage;
    Instant startTime;
    Instant completedTime;
    String workerId;
    TaskState taskState;

}
