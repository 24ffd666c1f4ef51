package fun.fengwk.readex.core.service;

import fun.fengwk.readex.core.cache.ExtractionCaches;
import fun.fengwk.readex.core.dom.HtmlDocuments;
import fun.fengwk.readex.core.exception.ExhaustedFallbackException;
import fun.fengwk.readex.core.exception.ExtractionTimeoutException;
import fun.fengwk.readex.core.exception.HtmlParseException;
import fun.fengwk.readex.core.resilience.Resilience;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns raw html into a document with a body, going through the document cache, the parse deadline and the
 * repair fallback.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentLoader {

    static final String REPAIR_PREFIX = "<html><head></head><body>";
    static final String REPAIR_SUFFIX = "</body></html>";

    private final ExtractionProperties extractionProperties;
    private final Resilience resilience;
    private final ExtractionCaches extractionCaches;

    /**
     * Loads a private, mutable document for the given html.
     *
     * @throws ExhaustedFallbackException if neither the input nor its repaired form can be parsed.
     * @throws HtmlParseException if the input cannot be parsed and the fallback is disabled.
     * @throws fun.fengwk.readex.core.exception.DocumentStructureException if the document has no body.
     */
    public Document load(String html) {
        Optional<Document> cached = extractionCaches.getDocument(html);
        if (cached.isPresent()) {
            return cached.get();
        }
        Document document;
        try {
            document = parseWithDeadline(html);
        } catch (HtmlParseException ex) {
            if (!extractionProperties.isEnableFallback()) {
                throw ex;
            }
            log.warn("parse failed, retrying with repaired html, error={}", ex.getMessage());
            document = parseRepaired(html, ex);
        }
        HtmlDocuments.requireBody(document);
        extractionCaches.putDocument(html, document);
        return document;
    }

    private Document parseRepaired(String html, HtmlParseException original) {
        if (html == null) {
            throw new ExhaustedFallbackException(original);
        }
        try {
            return parseWithDeadline(REPAIR_PREFIX + html + REPAIR_SUFFIX);
        } catch (HtmlParseException ex) {
            ex.addSuppressed(original);
            throw new ExhaustedFallbackException(ex);
        }
    }

    private Document parseWithDeadline(String html) {
        Duration parseTimeout = Duration.ofMillis(extractionProperties.getParseTimeoutMs());
        return resilience.withRetry(
            extractionProperties.getMaxRetries(),
            () -> resilience.withTimeout(parseTimeout,
                () -> HtmlDocuments.parse(html, extractionProperties.getMaxInputLength())),
            ExtractionTimeoutException.class::isInstance
        );
    }

}
