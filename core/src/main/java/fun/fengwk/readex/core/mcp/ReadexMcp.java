package fun.fengwk.readex.core.mcp;

import fun.fengwk.readex.core.exception.ReadexException;
import fun.fengwk.readex.core.service.ReadabilityService;
import fun.fengwk.readex.core.service.model.Article;
import fun.fengwk.readex.core.service.model.ExtractRequest;
import fun.fengwk.readex.core.simplify.SimplifyOptions;
import fun.fengwk.readex.core.utils.StringToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadexMcp {

    static final String EXTRACT_TEMPLATE = "readex_extract_result.ftl";
    static final String SIMPLIFY_TEMPLATE = "readex_simplify_result.ftl";
    static final String ERROR_TEMPLATE = "readex_error_result.ftl";

    private final ReadabilityService readabilityService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "extract_readable",
        description = """
            Extract the readable main content of an html page.
            Return format: title, simplified html of the main content and its plain text blocks; \
            or 'Error [stage]: message' when the page cannot be processed.""",
        resultConverter = StringToolCallResultConverter.class)
    public String extractReadable(
        @ToolParam(description = "raw html of the page") String html,
        @ToolParam(description = "page url, enables site specific cleanup rules", required = false) String url,
        @ToolParam(description = "stamp data-content-digest on every content node, default false", required = false) Boolean contentDigests,
        @ToolParam(description = "stamp data-node-index on every content node, default false", required = false) Boolean nodeIndexes
    ) {
        SimplifyOptions options = SimplifyOptions.builder()
            .addContentDigests(Boolean.TRUE.equals(contentDigests))
            .addNodeIndexes(Boolean.TRUE.equals(nodeIndexes))
            .build();
        try {
            Article article = readabilityService.extract(ExtractRequest.builder()
                .html(html)
                .url(url)
                .options(options)
                .build());
            return mcpFormatter.format(EXTRACT_TEMPLATE, article);
        } catch (ReadexException ex) {
            log.warn("extract readable failed, url={}, stage={}, error={}", url, ex.getStage().getValue(), ex.getMessage());
            return formatError(ex);
        }
    }

    @Tool(name = "simplify_html",
        description = """
            Simplify a whole html document into a minimal tag vocabulary without locating the main content.
            Return format: simplified html; or 'Error [stage]: message'.""",
        resultConverter = StringToolCallResultConverter.class)
    public String simplifyHtml(@ToolParam(description = "raw html") String html) {
        try {
            return mcpFormatter.format(SIMPLIFY_TEMPLATE, Map.of("html", readabilityService.simplify(html, SimplifyOptions.defaults())));
        } catch (ReadexException ex) {
            log.warn("simplify html failed, stage={}, error={}", ex.getStage().getValue(), ex.getMessage());
            return formatError(ex);
        }
    }

    private String formatError(ReadexException ex) {
        return mcpFormatter.format(ERROR_TEMPLATE, Map.of(
            "stage", ex.getStage().getValue(),
            "message", ex.getMessage() == null ? "" : ex.getMessage()
        ));
    }

}
