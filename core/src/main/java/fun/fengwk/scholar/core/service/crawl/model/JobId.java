package fun.fengwk.scholar.core.service.crawl.model;

import org.springframework.util.StringUtils;

/**
 * Crawl job identity, unique per client and search.
 *
 * <p>The registry keys jobs by this tuple. {@link #value()} is a display id only: distinct tuples such as
 * {@code ("a_b", "c")} and {@code ("a", "b_c")} share the same value.
 *
 * @author fengwk
 */
public record JobId(String clientId, String searchId) {

    public JobId {
        if (!StringUtils.hasText(clientId)) {
            throw new IllegalArgumentException("clientId is blank");
        }
        if (!StringUtils.hasText(searchId)) {
            throw new IllegalArgumentException("searchId is blank");
        }
    }

    public static JobId of(String clientId, String searchId) {
        return new JobId(clientId == null ? null : clientId.trim(), searchId == null ? null : searchId.trim());
    }

    /**
     * Textual job id handed back to clients, not unique across clients.
     */
    public String value() {
        return clientId + "_" + searchId;
    }

    @Override
    public String toString() {
        return value();
    }

}
