package fun.fengwk.scholar.core.service.crawl.impl;

import fun.fengwk.scholar.core.service.crawl.model.JobId;
import fun.fengwk.scholar.core.service.crawl.model.JobSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Completed jobs in completion order, oldest evicted first. Not thread-safe.
 *
 * @author fengwk
 */
public class CompletedJobHistory {

    private final int capacity;
    private final LinkedHashMap<JobId, JobSnapshot> entries = new LinkedHashMap<>();

    public CompletedJobHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("history capacity must be positive, capacity=" + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Adds the snapshot as newest entry, re-adding an id moves it to the newest position.
     *
     * @return ids evicted to respect the capacity
     */
    public List<JobId> add(JobId jobId, JobSnapshot snapshot) {
        entries.remove(jobId);
        entries.put(jobId, snapshot);

        List<JobId> evicted = new ArrayList<>();
        Iterator<Map.Entry<JobId, JobSnapshot>> iterator = entries.entrySet().iterator();
        while (entries.size() > capacity && iterator.hasNext()) {
            evicted.add(iterator.next().getKey());
            iterator.remove();
        }
        return evicted;
    }

    public Optional<JobSnapshot> get(JobId jobId) {
        return Optional.ofNullable(entries.get(jobId));
    }

    public boolean remove(JobId jobId) {
        return entries.remove(jobId) != null;
    }

    /**
     * @param limit max results, {@code <= 0} returns all
     * @return newest first
     */
    public List<JobSnapshot> recent(int limit) {
        List<JobSnapshot> snapshots = new ArrayList<>(entries.values());
        Collections.reverse(snapshots);
        if (limit > 0 && snapshots.size() > limit) {
            return new ArrayList<>(snapshots.subList(0, limit));
        }
        return snapshots;
    }

    /**
     * @return oldest first
     */
    public List<JobId> completedIds() {
        return new ArrayList<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

}
