package fun.fengwk.readex.core.mcp;

import fun.fengwk.readex.core.configuration.FreeMarkerConfiguration;
import fun.fengwk.readex.core.extract.TextBlock;
import fun.fengwk.readex.core.service.model.Article;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class McpFormatterTest {

    private final McpFormatter mcpFormatter = new McpFormatter(new FreeMarkerConfiguration().mcpTemplateConfiguration());

    @Test
    public void shouldFormatArticle() {
        Article article = Article.builder()
            .title("Flood Report")
            .content("<p>The river rose.</p>")
            .plainContent("The river rose.")
            .plainText(List.of(new TextBlock("The river rose.", "0.0")))
            .build();

        String result = mcpFormatter.format(ReadexMcp.EXTRACT_TEMPLATE, article);

        assertThat(result)
            .contains("# Flood Report")
            .contains("## Content\n<p>The river rose.</p>")
            .contains("[0.0] The river rose.")
            .doesNotContain("By:")
            .doesNotContain("Date:")
            .doesNotContain("degraded");
    }

    @Test
    public void shouldFormatBylineAndDate() {
        Article article = Article.builder()
            .title("Flood Report")
            .byline("Mara Quinn")
            .date("2014-10-24T15:32:46Z")
            .content("<p>The river rose.</p>")
            .plainContent("The river rose.")
            .plainText(List.of(new TextBlock("The river rose.", "")))
            .build();

        String result = mcpFormatter.format(ReadexMcp.EXTRACT_TEMPLATE, article);

        assertThat(result).contains("# Flood Report\n\nBy: Mara Quinn\nDate: 2014-10-24T15:32:46Z\n\n## Content");
    }

    @Test
    public void shouldFormatDegradedArticleWithoutText() {
        Article article = Article.builder()
            .title("")
            .content("<html><head></head><body></body></html>")
            .plainContent("")
            .plainText(List.of())
            .degraded(true)
            .build();

        String result = mcpFormatter.format(ReadexMcp.EXTRACT_TEMPLATE, article);

        assertThat(result)
            .doesNotContain("# \n")
            .contains("No text.")
            .contains("(degraded result)");
    }

    @Test
    public void shouldFormatError() {
        String result = mcpFormatter.format(ReadexMcp.ERROR_TEMPLATE, Map.of("stage", "timeout", "message", "slow"));

        assertThat(result.trim()).isEqualTo("Error [timeout]: slow");
    }

    @Test
    public void shouldHandleNullModelAndMissingTemplate() {
        assertThat(mcpFormatter.format(ReadexMcp.EXTRACT_TEMPLATE, null)).isEqualTo("empty response");
        assertThat(mcpFormatter.format("missing.ftl", Map.of())).startsWith("format error: ");
    }

}
