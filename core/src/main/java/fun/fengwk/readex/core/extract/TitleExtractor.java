package fun.fengwk.readex.core.extract;

import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the article title from weighted title locations.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class TitleExtractor {

    private static final List<SelectorScore> TITLE_SELECTORS = List.of(
        SelectorScore.text("h1.entry-title", 6),
        SelectorScore.text("h1[itemprop=headline]", 5),
        SelectorScore.text("header.entry-header > h1.entry-title", 4),
        SelectorScore.attribute("meta[property=og:title]", "content", 3),
        SelectorScore.text("h2[itemprop=headline]", 2),
        SelectorScore.attribute("meta[itemprop*=headline]", "content", 2),
        SelectorScore.attribute("meta[property=twitter:title]", "content", 2),
        SelectorScore.attribute("meta[name=twitter:title]", "content", 2),
        SelectorScore.attribute("meta[property=article:title]", "content", 2),
        SelectorScore.attribute("meta[name=article:title]", "content", 2),
        SelectorScore.text("div.postarea > h2 > a", 1),
        SelectorScore.text("h1.post__title", 1),
        SelectorScore.text("h1.title", 1),
        SelectorScore.text("header > h1", 1),
        SelectorScore.attribute("meta[name=dcterms.title]", "content", 1),
        SelectorScore.attribute("meta[name=fb_title]", "content", 1),
        SelectorScore.attribute("meta[name=sailthru.title]", "content", 1),
        SelectorScore.attribute("meta[name=title]", "content", 1),
        SelectorScore.text("h1", 1),
        SelectorScore.text("h2", 1),
        SelectorScore.text("h3", 1),
        SelectorScore.text("div[class*=title]", 1),
        SelectorScore.text("div[id*=title]", 1),
        SelectorScore.text("head > title", 0)
    );

    private final ElementExtractor elementExtractor;

    public String extract(Document document) {
        Map<String, ExtractedElement> titles =
            elementExtractor.extractElement(document, TITLE_SELECTORS, TitleExtractor::combineSimilarTitles);
        String bestTitle = "";
        int bestScore = -1;
        for (Map.Entry<String, ExtractedElement> entry : titles.entrySet()) {
            if (entry.getValue().getScore() > bestScore) {
                bestScore = entry.getValue().getScore();
                bestTitle = entry.getKey();
            }
        }
        return bestTitle;
    }

    /**
     * A title contained in a longer title takes over the longer one's score; case-insensitive duplicates credit
     * the variant with more capitals.
     */
    static Map<String, ExtractedElement> combineSimilarTitles(Map<String, ExtractedElement> titles) {
        List<String> keys = new ArrayList<>(titles.keySet());
        Map<String, Integer> originalScores = new HashMap<>();
        Map<String, List<String>> originalSelectors = new HashMap<>();
        for (String key : keys) {
            originalScores.put(key, titles.get(key).getScore());
            originalSelectors.put(key, List.copyOf(titles.get(key).getSelectors()));
        }
        for (String shorter : keys) {
            for (String other : keys) {
                if (shorter.equals(other)) {
                    continue;
                }
                boolean contained = shorter.length() < other.length() && other.contains(shorter);
                boolean sameIgnoringCase = shorter.equalsIgnoreCase(other) && countUppercase(shorter) > countUppercase(other);
                if (contained || sameIgnoringCase) {
                    titles.get(shorter).merge(originalScores.get(other), originalSelectors.get(other));
                }
            }
        }
        return titles;
    }

    private static int countUppercase(String value) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isUpperCase(value.charAt(i))) {
                count++;
            }
        }
        return count;
    }

}
