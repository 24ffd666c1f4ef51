package fun.fengwk.readex.core.site;

import org.jsoup.nodes.Document;

/**
 * Per-site document edits applied before main-content location.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface SiteRule {

    /**
     * @param document parsed document, may be edited in place.
     * @param hostname lower-case host of the page url, empty when unknown.
     * @return the edited document.
     */
    Document apply(Document document, String hostname);

}
