package fun.fengwk.scholar.core.service.crawl.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Registry and worker pool counters.
 *
 * @author fengwk
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PoolStats {

    int runningCount;
    int queuedCount;
    int completedCount;

    /**
     * Completed history capacity.
     */
    int capacity;

    int maxWorkers;
    int activeWorkers;

    @Builder.Default
    List<String> runningJobIds = List.of();

    /**
     * Completed job ids, oldest first.
     */
    @Builder.Default
    List<String> completedJobIds = List.of();

}
