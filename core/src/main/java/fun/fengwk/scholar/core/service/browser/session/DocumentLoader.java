package fun.fengwk.scholar.core.service.browser.session;

import org.jsoup.nodes.Document;

import java.io.IOException;

/**
 * Loads a parsed document for a url.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface DocumentLoader {

    Document load(String url) throws IOException;

}
