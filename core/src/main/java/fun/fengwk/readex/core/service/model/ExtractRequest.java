package fun.fengwk.readex.core.service.model;

import fun.fengwk.readex.core.simplify.SimplifyOptions;
import lombok.Builder;
import lombok.Data;

/**
 * Extraction request model.
 *
 * @author fengwk
 */
@Data
@Builder
public class ExtractRequest {

    private String html;

    /**
     * Page url, used to pick site rules. May be blank.
     */
    private String url;

    /**
     * Pipeline stages to run, defaults apply when null.
     */
    private SimplifyOptions options;

}
