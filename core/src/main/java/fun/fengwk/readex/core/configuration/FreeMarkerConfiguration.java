package fun.fengwk.readex.core.configuration;

import freemarker.template.TemplateExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

/**
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    static final String TEMPLATE_PATH = "/mcp/templates/";

    @Bean(name = "mcpTemplateConfiguration")
    public freemarker.template.Configuration mcpTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_34);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), TEMPLATE_PATH);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        return cfg;
    }

}
