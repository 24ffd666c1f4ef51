package fun.fengwk.readex.core.cache;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Process-wide memo of parsed documents, located content nodes and node scores.
 *
 * <p>Documents are stored and handed out as private copies, so callers may mutate what they get.
 * Located nodes are stored as element paths and resolved against the caller's document.</p>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ExtractionCaches implements AutoCloseable {

    private final CacheProperties cacheProperties;
    private final Duration ttl;
    private final LruTtlCache<String, Document> documents;
    private final LruTtlCache<String, List<Integer>> contentNodes;
    private final LruTtlCache<String, Double> scores;

    public ExtractionCaches(CacheProperties cacheProperties) {
        this.cacheProperties = cacheProperties;
        this.ttl = Duration.ofMillis(Math.max(1L, cacheProperties.getExpirationMs()));
        Duration sweepInterval = Duration.ofMillis(cacheProperties.getSweepIntervalMs());
        this.documents = new LruTtlCache<>("documents", cacheProperties.getDocumentMaxSize(), sweepInterval);
        this.contentNodes = new LruTtlCache<>("content-nodes", cacheProperties.getContentNodeMaxSize(), sweepInterval);
        this.scores = new LruTtlCache<>("scores", cacheProperties.getScoreMaxSize(), sweepInterval);
    }

    public Optional<Document> getDocument(String html) {
        if (!cacheProperties.isEnabled() || html == null) {
            return Optional.empty();
        }
        Optional<Document> cached = documents.get(ContentFingerprints.documentKey(html));
        cached.ifPresent(document -> log.debug("document cache hit, length={}", html.length()));
        return cached.map(Document::clone);
    }

    public void putDocument(String html, Document document) {
        if (!cacheProperties.isEnabled() || html == null || document == null) {
            return;
        }
        documents.set(ContentFingerprints.documentKey(html), document.clone(), ttl);
    }

    /**
     * Returns the memoized content node of an equivalent document, resolved inside the given document.
     */
    public Optional<Element> getContentNode(Document document) {
        if (!cacheProperties.isEnabled()) {
            return Optional.empty();
        }
        return contentNodes.get(ContentFingerprints.nodeKey(document))
            .map(path -> HtmlDocuments.resolvePath(document, path));
    }

    public void putContentNode(Document document, Element contentNode) {
        if (!cacheProperties.isEnabled() || contentNode == null) {
            return;
        }
        contentNodes.set(ContentFingerprints.nodeKey(document), List.copyOf(HtmlDocuments.pathOf(contentNode)), ttl);
    }

    public double score(Element element, ToDoubleFunction<Element> scorer) {
        if (!cacheProperties.isEnabled()) {
            return scorer.applyAsDouble(element);
        }
        String key = ContentFingerprints.scoreKey(element);
        Optional<Double> cached = scores.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        double score = scorer.applyAsDouble(element);
        scores.set(key, score, ttl);
        return score;
    }

    public Map<String, CacheStats> stats() {
        Map<String, CacheStats> stats = new LinkedHashMap<>();
        stats.put(documents.getName(), documents.stats());
        stats.put(contentNodes.getName(), contentNodes.stats());
        stats.put(scores.getName(), scores.stats());
        return stats;
    }

    public void clear() {
        documents.clear();
        contentNodes.clear();
        scores.clear();
    }

    @PreDestroy
    @Override
    public void close() {
        documents.close();
        contentNodes.close();
        scores.close();
    }

}
