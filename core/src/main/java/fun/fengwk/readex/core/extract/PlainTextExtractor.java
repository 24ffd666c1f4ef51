package fun.fengwk.readex.core.extract;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import fun.fengwk.readex.core.simplify.ContentAnnotator;
import fun.fengwk.readex.core.text.TextNormalizer;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flattens a simplified tree into plain text blocks in document order.
 * A list becomes a single block of {@code "* item"} entries.
 *
 * @author fengwk
 */
@Component
public class PlainTextExtractor {

    private static final Set<String> LIST_TAGS = Set.of("ul", "ol");

    public List<TextBlock> extract(Element root) {
        List<TextBlock> blocks = new ArrayList<>();
        if (root != null) {
            collect(root, blocks);
        }
        return blocks;
    }

    private void collect(Element element, List<TextBlock> blocks) {
        if (LIST_TAGS.contains(element.normalName())) {
            List<String> items = new ArrayList<>();
            for (Element item : element.select("li")) {
                String text = TextNormalizer.normalizeText(HtmlDocuments.text(item));
                if (!text.isEmpty()) {
                    items.add("* " + text);
                }
            }
            if (!items.isEmpty()) {
                blocks.add(new TextBlock(String.join(", ", items), nodeIndex(element)));
            }
            return;
        }
        String ownText = TextNormalizer.normalizeText(element.ownText());
        if (!ownText.isEmpty() && !"title".equals(element.normalName())) {
            blocks.add(new TextBlock(ownText, nodeIndex(element)));
        }
        for (Element child : element.children()) {
            collect(child, blocks);
        }
    }

    private String nodeIndex(Element element) {
        return element.attr(ContentAnnotator.NODE_INDEX_ATTRIBUTE);
    }

}
