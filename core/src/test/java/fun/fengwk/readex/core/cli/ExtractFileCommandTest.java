package fun.fengwk.readex.core.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.readex.core.exception.ExtractionTimeoutException;
import fun.fengwk.readex.core.extract.TextBlock;
import fun.fengwk.readex.core.service.ReadabilityService;
import fun.fengwk.readex.core.service.model.Article;
import fun.fengwk.readex.core.service.model.ExtractRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class ExtractFileCommandTest {

    @Mock
    private ReadabilityService readabilityService;

    @TempDir
    Path tempDir;

    private ExtractFileCommand command;
    private ByteArrayOutputStream output;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        command = new ExtractFileCommand(readabilityService, new ObjectMapper());
        output = new ByteArrayOutputStream();
        out = new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    @Test
    public void shouldPrintExtractedHtml() throws IOException {
        Path page = writePage();
        when(readabilityService.extract(any(ExtractRequest.class))).thenReturn(article());

        int exitCode = command.execute(arguments("--extract-file=" + page, "--url=https://example.com/a", "--indexes"), out);

        assertThat(exitCode).isZero();
        assertThat(printed()).isEqualTo("<p>The river rose.</p>");
        ArgumentCaptor<ExtractRequest> captor = ArgumentCaptor.forClass(ExtractRequest.class);
        verify(readabilityService).extract(captor.capture());
        assertThat(captor.getValue().getHtml()).isEqualTo("<p>The river rose.</p>");
        assertThat(captor.getValue().getUrl()).isEqualTo("https://example.com/a");
        assertThat(captor.getValue().getOptions().isAddNodeIndexes()).isTrue();
        assertThat(captor.getValue().getOptions().isAddContentDigests()).isFalse();
    }

    @Test
    public void shouldPrintPlainText() throws IOException {
        Path page = writePage();
        when(readabilityService.extract(any(ExtractRequest.class))).thenReturn(article());

        int exitCode = command.execute(arguments("--extract-file=" + page, "--format=text"), out);

        assertThat(exitCode).isZero();
        assertThat(printed()).isEqualTo("The river rose.");
    }

    @Test
    public void shouldPrintJson() throws IOException {
        Path page = writePage();
        when(readabilityService.extract(any(ExtractRequest.class))).thenReturn(article());

        int exitCode = command.execute(arguments("--extract-file=" + page, "--format=json"), out);

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(printed());
        assertThat(json.get("title").asText()).isEqualTo("Flood Report");
        assertThat(json.get("degraded").asBoolean()).isFalse();
        assertThat(json.get("plainText").get(0).get("nodeIndex").asText()).isEqualTo("0.0");
    }

    @Test
    public void shouldFailOnMissingFile() {
        int exitCode = command.execute(arguments("--extract-file=" + tempDir.resolve("absent.html")), out);

        assertThat(exitCode).isEqualTo(1);
        verifyNoInteractions(readabilityService);
    }

    @Test
    public void shouldFailOnMissingFileValue() {
        assertThat(command.execute(arguments("--extract-file"), out)).isEqualTo(1);
    }

    @Test
    public void shouldFailOnUnsupportedFormat() throws IOException {
        Path page = writePage();

        assertThat(command.execute(arguments("--extract-file=" + page, "--format=xml"), out)).isEqualTo(1);
        verifyNoInteractions(readabilityService);
    }

    @Test
    public void shouldFailOnExtractionError() throws IOException {
        Path page = writePage();
        when(readabilityService.extract(any(ExtractRequest.class)))
            .thenThrow(new ExtractionTimeoutException(Duration.ofMillis(10)));

        assertThat(command.execute(arguments("--extract-file=" + page), out)).isEqualTo(2);
        assertThat(printed()).isEmpty();
    }

    private Path writePage() throws IOException {
        return Files.writeString(tempDir.resolve("page.html"), "<p>The river rose.</p>", StandardCharsets.UTF_8);
    }

    private Article article() {
        return Article.builder()
            .title("Flood Report")
            .content("<p>The river rose.</p>")
            .plainContent("The river rose.")
            .plainText(List.of(new TextBlock("The river rose.", "0.0")))
            .elapsedMs(3L)
            .build();
    }

    private DefaultApplicationArguments arguments(String... args) {
        return new DefaultApplicationArguments(args);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8).trim();
    }

}
