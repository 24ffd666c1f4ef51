package fun.fengwk.readex.core.extract;

import fun.fengwk.readex.core.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks the article author from author metadata and byline markup.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class BylineExtractor {

    private static final List<SelectorScore> BYLINE_SELECTORS = List.of(
        SelectorScore.attribute("meta[property=article:author]", "content", 10),
        SelectorScore.attribute("meta[property=og:article:author]", "content", 9),
        SelectorScore.attribute("meta[name=author]", "content", 8),
        SelectorScore.attribute("meta[name=sailthru.author]", "content", 7),
        SelectorScore.attribute("meta[name=byl]", "content", 6),
        SelectorScore.attribute("meta[name=twitter:creator]", "content", 5),
        SelectorScore.attribute("meta[property=book:author]", "content", 4),
        SelectorScore.attribute("meta[name=dc.creator]", "content", 3),
        SelectorScore.attribute("meta[name=dcterms.creator]", "content", 3),
        SelectorScore.text("a[rel=author]", 2),
        SelectorScore.text("span[class*=author]", 1),
        SelectorScore.text("p[class*=author]", 1),
        SelectorScore.text("div[class*=author]", 1),
        SelectorScore.text("span[class*=byline]", 1),
        SelectorScore.text("p[class*=byline]", 1),
        SelectorScore.text("div[class*=byline]", 1),
        SelectorScore.text("span[itemprop=author]", 1),
        SelectorScore.text("div[itemprop=author]", 1)
    );

    private static final Pattern BYLINE_PREFIX =
        Pattern.compile("^(?:(?:written|posted|published|reported)\\s+by|author:|by)\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern BYLINE_SUFFIX =
        Pattern.compile("\\s*\\|\\s*(?:author|writer|reporter|staff)$", Pattern.CASE_INSENSITIVE);

    private final ElementExtractor elementExtractor;

    /**
     * @return the cleaned byline, or an empty string when the page names no author.
     */
    public String extract(Document document) {
        Map<String, ExtractedElement> bylines = elementExtractor.extractElement(document, BYLINE_SELECTORS, null);
        String bestByline = "";
        int bestScore = -1;
        for (Map.Entry<String, ExtractedElement> entry : bylines.entrySet()) {
            String byline = cleanByline(entry.getKey());
            if (!byline.isEmpty() && entry.getValue().getScore() > bestScore) {
                bestScore = entry.getValue().getScore();
                bestByline = byline;
            }
        }
        return bestByline.isEmpty() ? findBylineParagraph(document) : bestByline;
    }

    private String findBylineParagraph(Document document) {
        for (Element paragraph : document.select("p")) {
            String text = TextNormalizer.normalizeWhitespace(paragraph.text());
            String lower = text.toLowerCase(Locale.ROOT);
            if (lower.startsWith("by ") || lower.startsWith("written by ")) {
                String byline = cleanByline(text);
                if (!byline.isEmpty()) {
                    return byline;
                }
            }
        }
        return "";
    }

    static String cleanByline(String byline) {
        if (byline == null) {
            return "";
        }
        String cleaned = TextNormalizer.normalizeWhitespace(byline);
        cleaned = BYLINE_PREFIX.matcher(cleaned).replaceFirst("");
        cleaned = BYLINE_SUFFIX.matcher(cleaned).replaceFirst("");
        return cleaned.trim();
    }

}
