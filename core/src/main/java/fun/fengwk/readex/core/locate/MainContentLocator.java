package fun.fengwk.readex.core.locate;

import fun.fengwk.readex.core.cache.ExtractionCaches;
import fun.fengwk.readex.core.concurrent.BatchSelectorExecutor;
import fun.fengwk.readex.core.concurrent.ParallelNodeMapper;
import fun.fengwk.readex.core.dom.HtmlDocuments;
import fun.fengwk.readex.core.scoring.ContentScorer;
import fun.fengwk.readex.core.scoring.ScoringProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Finds the node holding the main content of a document.
 *
 * <p>Three tiers are tried in order: scored keyword/semantic candidates, a scan of every sizable div or
 * section, and finally the body.</p>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MainContentLocator {

    /**
     * Marker attribute forcing a node into the candidate set.
     */
    public static final String FOCUS_ATTRIBUTE = "data-content-focus";

    private static final List<String> CANDIDATE_KEYWORDS = List.of("content", "article", "main", "body", "entry");

    private static final String CANDIDATE_QUERY = buildCandidateQuery();

    private final ContentScorer contentScorer;
    private final ScoringProperties scoringProperties;
    private final ParallelNodeMapper parallelNodeMapper;
    private final ExtractionCaches extractionCaches;

    public Element locate(Document document) {
        Element body = HtmlDocuments.requireBody(document);
        Optional<Element> cached = extractionCaches.getContentNode(document);
        if (cached.isPresent()) {
            log.debug("content node cache hit, tag={}", cached.get().normalName());
            return cached.get();
        }
        Element located = locateCandidate(document);
        if (located == null) {
            located = locateSizableContainer(body);
        }
        if (located == null) {
            log.debug("no content candidate qualified, falling back to body");
            located = body;
        }
        extractionCaches.putContentNode(document, located);
        return located;
    }

    Element locateCandidate(Document document) {
        List<Element> candidates = new ArrayList<>(document.select(CANDIDATE_QUERY));
        if (candidates.isEmpty()) {
            return null;
        }
        List<Double> scores = parallelNodeMapper.map(candidates, this::score);
        Element best = null;
        double bestScore = 0.0;
        for (int i = 0; i < candidates.size(); i++) {
            if (scores.get(i) > bestScore) {
                bestScore = scores.get(i);
                best = candidates.get(i);
            }
        }
        if (best != null) {
            log.debug("content candidate selected, tag={}, score={}, candidates={}",
                best.normalName(), bestScore, candidates.size());
        }
        return best;
    }

    Element locateSizableContainer(Element body) {
        List<Element> containers = new ArrayList<>();
        Consumer<Element> collector = element -> {
            if (HtmlDocuments.text(element).length() >= scoringProperties.getFallbackMinTextLength()) {
                containers.add(element);
            }
        };
        Map<String, Consumer<Element>> actions = new LinkedHashMap<>();
        actions.put("div", collector);
        actions.put("section", collector);
        BatchSelectorExecutor.execute(body, actions);
        if (containers.isEmpty()) {
            return null;
        }
        List<Double> scores = parallelNodeMapper.map(containers, this::score);
        Element best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < containers.size(); i++) {
            if (scores.get(i) > bestScore) {
                bestScore = scores.get(i);
                best = containers.get(i);
            }
        }
        log.debug("sizable container selected, tag={}, score={}, containers={}",
            best.normalName(), bestScore, containers.size());
        return best;
    }

    private double score(Element element) {
        return extractionCaches.score(element, contentScorer::score);
    }

    private static String buildCandidateQuery() {
        List<String> selectors = new ArrayList<>();
        for (String keyword : CANDIDATE_KEYWORDS) {
            selectors.add("[id*=" + keyword + "]");
        }
        for (String keyword : CANDIDATE_KEYWORDS) {
            selectors.add("[class*=" + keyword + "]");
        }
        selectors.add("article");
        selectors.add("main");
        selectors.add(".post");
        selectors.add(".hentry");
        selectors.add("[" + FOCUS_ATTRIBUTE + "=true]");
        return String.join(", ", selectors);
    }

}
