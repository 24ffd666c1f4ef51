package fun.fengwk.readex.core.extract;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import fun.fengwk.readex.core.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Scores strings found by a weighted selector list. Metadata extractors choose the selectors, this
 * primitive only collects and accumulates.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ElementExtractor {

    public Map<String, ExtractedElement> extractElement(
        String html, List<SelectorScore> selectors, UnaryOperator<Map<String, ExtractedElement>> postProcess) {
        return extractElement(HtmlDocuments.parse(html), selectors, postProcess);
    }

    /**
     * Collects the normalized text (or attribute value) of every match, keyed by that string, summing the
     * scores of all selectors that produced it. Insertion order follows the selector list.
     *
     * @param postProcess optional rewrite of the collected map, may be null.
     */
    public Map<String, ExtractedElement> extractElement(
        Document document, List<SelectorScore> selectors, UnaryOperator<Map<String, ExtractedElement>> postProcess) {
        Map<String, ExtractedElement> extracted = new LinkedHashMap<>();
        for (SelectorScore selectorScore : selectors) {
            List<Element> matches;
            try {
                matches = document.select(selectorScore.selector());
            } catch (Selector.SelectorParseException | IllegalArgumentException ex) {
                log.warn("invalid extraction selector, selector={}, error={}", selectorScore.selector(), ex.getMessage());
                continue;
            }
            for (Element match : matches) {
                String value = selectorScore.extractsAttribute()
                    ? match.attr(selectorScore.attribute())
                    : match.wholeText();
                value = TextNormalizer.normalizeWhitespace(value);
                if (value.isEmpty()) {
                    continue;
                }
                ExtractedElement existing = extracted.get(value);
                if (existing == null) {
                    extracted.put(value, new ExtractedElement(
                        selectorScore.score(), new ArrayList<>(List.of(selectorScore.describe()))));
                } else {
                    existing.merge(selectorScore.score(), List.of(selectorScore.describe()));
                }
            }
        }
        return postProcess == null ? extracted : postProcess.apply(extracted);
    }

}
