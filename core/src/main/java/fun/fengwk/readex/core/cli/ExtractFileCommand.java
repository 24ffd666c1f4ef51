package fun.fengwk.readex.core.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.readex.core.exception.ReadexException;
import fun.fengwk.readex.core.service.ReadabilityService;
import fun.fengwk.readex.core.service.model.Article;
import fun.fengwk.readex.core.service.model.ExtractRequest;
import fun.fengwk.readex.core.simplify.SimplifyOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * One-shot extraction of a local html file.
 *
 * <pre>
 * --extract-file=page.html [--url=https://host/path] [--format=html|text|json] [--digests] [--indexes]
 * </pre>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractFileCommand implements ApplicationRunner {

    static final String OPTION_FILE = "extract-file";
    static final String OPTION_URL = "url";
    static final String OPTION_FORMAT = "format";
    static final String OPTION_DIGESTS = "digests";
    static final String OPTION_INDEXES = "indexes";

    private final ReadabilityService readabilityService;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION_FILE)) {
            return;
        }
        int exitCode = execute(args, System.out);
        System.exit(exitCode);
    }

    int execute(ApplicationArguments args, PrintStream out) {
        String fileValue = firstValue(args, OPTION_FILE);
        if (fileValue == null || fileValue.isBlank()) {
            log.warn("extract command invalid, error=missing value of --{}", OPTION_FILE);
            return 1;
        }
        Path file = Path.of(fileValue.trim());
        try {
            OutputFormat format = OutputFormat.fromValue(firstValue(args, OPTION_FORMAT));
            String html = Files.readString(file, StandardCharsets.UTF_8);
            Article article = readabilityService.extract(ExtractRequest.builder()
                .html(html)
                .url(firstValue(args, OPTION_URL))
                .options(SimplifyOptions.builder()
                    .addContentDigests(args.containsOption(OPTION_DIGESTS))
                    .addNodeIndexes(args.containsOption(OPTION_INDEXES))
                    .build())
                .build());
            out.println(render(article, format));
            return 0;
        } catch (IOException ex) {
            log.warn("read html file failed, file={}, error={}", file, ex.getMessage());
            return 1;
        } catch (ReadexException ex) {
            log.warn("extract html file failed, file={}, stage={}, error={}", file, ex.getStage().getValue(), ex.getMessage());
            return 2;
        } catch (IllegalArgumentException ex) {
            log.warn("extract command invalid, file={}, error={}", file, ex.getMessage());
            return 1;
        }
    }

    private String render(Article article, OutputFormat format) {
        return switch (format) {
            case HTML -> article.getContent();
            case TEXT -> article.getPlainContent();
            case JSON -> toJson(article);
        };
    }

    private String toJson(Article article) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(article);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private String firstValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

}
