package fun.fengwk.readex.core.scoring;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import fun.fengwk.readex.core.text.TextStatistics;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Scores a node by content density, keyword hints and tag type.
 * The score is a pure function of the node's attributes, text and subtree.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ContentScorer {

    private static final List<TagBonus> TAG_BONUSES = List.of(
        new TagBonus(Set.of("article", "section", "div", "main"), 10),
        new TagBonus(Set.of("p", "pre", "td"), 5),
        new TagBonus(Set.of("blockquote", "address", "ol", "ul", "dl", "dd", "dt", "li"), 3),
        new TagBonus(Set.of("form", "aside", "footer", "header", "nav"), -10)
    );

    private static final String HEADINGS = "h1, h2, h3, h4, h5, h6";

    private final ScoringProperties scoringProperties;

    public double score(Element element) {
        if (element == null) {
            return 0.0;
        }
        String text = HtmlDocuments.text(element);
        String html = HtmlDocuments.outerHtml(element);
        if (text.isEmpty() || html.isEmpty()) {
            return 0.0;
        }
        double textLength = text.length();
        double htmlLength = html.length();

        double textDensity = textLength / htmlLength;
        double paragraphDensity = HtmlDocuments.countDescendants(element, "p") / textLength * 1000;
        double sentenceDensity = TextStatistics.countSentences(text) / textLength * 1000;
        double wordDensity = TextStatistics.countWords(text) / textLength * 100;
        double density = (textDensity * scoringProperties.getTextDensityWeight()
            + paragraphDensity * scoringProperties.getParagraphDensityWeight()
            + sentenceDensity * scoringProperties.getSentenceDensityWeight()
            + wordDensity * scoringProperties.getWordDensityWeight()) * contentBoost(element);

        double linkDensityScore = 1.0 - HtmlDocuments.linkDensity(element);
        double headingDensity = HtmlDocuments.countDescendants(element, HEADINGS) / textLength * 1000;
        double listDensity = HtmlDocuments.countDescendants(element, "li") / textLength * 1000;
        double imageDensity = HtmlDocuments.countDescendants(element, "img") / htmlLength * 1000;

        return density * linkDensityScore
            + headingDensity * scoringProperties.getHeadingDensityWeight()
            + listDensity * scoringProperties.getListDensityWeight()
            + imageDensity * scoringProperties.getImageDensityWeight()
            + tagBonus(element)
            + paragraphChildren(element) * scoringProperties.getParagraphChildBonus()
            + captionedFigures(element) * scoringProperties.getFigureBonus();
    }

    double contentBoost(Element element) {
        String id = element.id();
        String className = element.className();
        double boost = 1.0;
        if (KeywordPatterns.matchesAny(id, KeywordPatterns.CONTENT)) {
            boost += scoringProperties.getIdContentBoost();
        }
        if (KeywordPatterns.matchesAny(className, KeywordPatterns.CONTENT)) {
            boost += scoringProperties.getClassContentBoost();
        }
        if (KeywordPatterns.matchesAny(id, KeywordPatterns.NON_CONTENT)
            || KeywordPatterns.matchesAny(className, KeywordPatterns.NON_CONTENT)) {
            boost *= scoringProperties.getNonContentMultiplier();
        }
        return boost;
    }

    static double tagBonus(Element element) {
        String tag = element.normalName();
        for (TagBonus tagBonus : TAG_BONUSES) {
            if (tagBonus.tags().contains(tag)) {
                return tagBonus.bonus();
            }
        }
        return 0.0;
    }

    private int paragraphChildren(Element element) {
        int count = 0;
        for (Element child : element.children()) {
            if ("p".equals(child.normalName())) {
                count++;
            }
        }
        return count;
    }

    private int captionedFigures(Element element) {
        int count = 0;
        for (Element figure : element.select("figure")) {
            if (figure != element && figure.selectFirst("img") != null && figure.selectFirst("figcaption") != null) {
                count++;
            }
        }
        return count;
    }

    private record TagBonus(Set<String> tags, double bonus) {

    }

}
