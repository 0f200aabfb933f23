package fun.fengwk.scholar.core.service.crawl.extract;

import fun.fengwk.scholar.core.service.browser.session.PageElement;
import fun.fengwk.scholar.core.service.browser.session.PageSession;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One extraction strategy for a single field.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface FieldExtractor<T> {

    Optional<T> extract(PageSession session);

    /**
     * Parses the text of the first element matched by the selector.
     */
    static <T> FieldExtractor<T> text(String selector, Function<String, Optional<T>> parser) {
        return session -> session.findFirstText(List.of(selector)).flatMap(parser);
    }

    /**
     * Parses the first attribute value among all elements matched by the selector that the parser accepts.
     */
    static <T> FieldExtractor<T> attribute(String selector, String name, Function<String, Optional<T>> parser) {
        return session -> {
            for (PageElement element : session.findAll(List.of(selector))) {
                Optional<T> value = element.attribute(name).flatMap(parser);
                if (value.isPresent()) {
                    return value;
                }
            }
            return Optional.empty();
        };
    }

}
