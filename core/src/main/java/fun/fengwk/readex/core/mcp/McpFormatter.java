package fun.fengwk.readex.core.mcp;

import freemarker.template.Template;
import freemarker.template.TemplateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Renders tool results through the mcp templates.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class McpFormatter {

    private final freemarker.template.Configuration mcpTemplateConfiguration;

    public McpFormatter(@Qualifier("mcpTemplateConfiguration") freemarker.template.Configuration mcpTemplateConfiguration) {
        this.mcpTemplateConfiguration = mcpTemplateConfiguration;
    }

    /**
     * Renders the model; a non-map model is exposed to the template as {@code data}.
     */
    public String format(String templateName, Object model) {
        if (model == null) {
            return "empty response";
        }
        StringWriter result = new StringWriter(1024);
        try {
            Template template = mcpTemplateConfiguration.getTemplate(templateName);
            Object root = model instanceof Map ? model : Map.of("data", model);
            template.process(root, result);
            return result.toString();
        } catch (IOException | TemplateException ex) {
            log.warn("format mcp result failed, template={}, error={}", templateName, ex.getMessage());
            return "format error: " + ex.getMessage();
        }
    }

}
