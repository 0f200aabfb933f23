package fun.fengwk.scholar.core.service.crawl.extract;

import fun.fengwk.scholar.core.service.browser.session.PageSession;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered fallback list of extractors for one field, the first non-empty result wins.
 *
 * <p>A failing candidate is logged and skipped so it never fails the whole item.
 *
 * @author fengwk
 */
@Slf4j
public class FieldChain<T> implements FieldExtractor<T> {

    private final String field;
    private final List<FieldExtractor<T>> candidates;

    private FieldChain(String field, List<FieldExtractor<T>> candidates) {
        this.field = field;
        this.candidates = List.copyOf(candidates);
    }

    public static <T> Builder<T> builder(String field) {
        return new Builder<>(field);
    }

    @Override
    public Optional<T> extract(PageSession session) {
        for (int i = 0; i < candidates.size(); i++) {
            try {
                Optional<T> value = candidates.get(i).extract(session);
                if (value != null && value.isPresent()) {
                    return value;
                }
            } catch (RuntimeException ex) {
                log.debug("field candidate failed, field={}, candidate={}, error={}", field, i, ex.getMessage());
            }
        }
        return Optional.empty();
    }

    public String getField() {
        return field;
    }

    public int size() {
        return candidates.size();
    }

    public static class Builder<T> {

        private final String field;
        private final List<FieldExtractor<T>> candidates = new ArrayList<>();

        private Builder(String field) {
            this.field = field;
        }

        public Builder<T> then(FieldExtractor<T> candidate) {
            candidates.add(candidate);
            return this;
        }

        public FieldChain<T> build() {
            return new FieldChain<>(field, candidates);
        }

    }

}
