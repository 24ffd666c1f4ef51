package fun.fengwk.readex.core.service;

import fun.fengwk.readex.core.service.model.Article;
import fun.fengwk.readex.core.service.model.ExtractRequest;
import fun.fengwk.readex.core.simplify.SimplifyOptions;

/**
 * @author fengwk
 */
public interface ReadabilityService {

    /**
     * Locates, simplifies and flattens the main content of a page.
     *
     * @throws fun.fengwk.readex.core.exception.ReadexException naming the failed stage.
     */
    Article extract(ExtractRequest request);

    /**
     * Runs the simplification pipeline over a whole document.
     */
    String simplify(String html, SimplifyOptions options);

    /**
     * Returns the outer html of the main content node.
     */
    String locate(String html);

}
