package fun.fengwk.readex.core.service.model;

import fun.fengwk.readex.core.extract.TextBlock;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Extraction result model.
 *
 * @author fengwk
 */
@Data
@Builder
public class Article {

    private String title;

    private String byline;

    /**
     * Publication time as an ISO-8601 UTC instant, empty when the page carries no date.
     */
    private String date;

    /**
     * Simplified html of the main content, wrapped in a full document.
     */
    private String content;

    /**
     * Plain text of the main content, one block per line.
     */
    private String plainContent;

    private List<TextBlock> plainText;

    /**
     * True when metadata extraction or content location fell back to a degraded result.
     */
    private boolean degraded;

    private Long elapsedMs;

}
