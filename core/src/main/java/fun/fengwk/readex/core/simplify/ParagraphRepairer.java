package fun.fengwk.readex.core.simplify;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import fun.fengwk.readex.core.text.TextNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Paragraph structure repairs: promoting blocks out of paragraphs and turning line breaks into
 * paragraph boundaries.
 *
 * @author fengwk
 */
final class ParagraphRepairer {

    private static final Set<String> ILLEGAL_IN_PARAGRAPH = Set.copyOf(ElementVocabulary.ILLEGAL_IN_PARAGRAPH);

    private ParagraphRepairer() {
    }

    /**
     * Promotes every block illegally nested in a paragraph to a sibling of that paragraph, splitting the
     * paragraph into the content before and after it. The outermost illegal block below the paragraph is the one
     * promoted, so a list item moves together with its list.
     */
    static void unnestParagraphs(Document document) {
        for (String tag : ElementVocabulary.ILLEGAL_IN_PARAGRAPH) {
            Element nested;
            while ((nested = document.selectFirst("p " + tag)) != null) {
                Element paragraph = nested.parent() == null ? null : nested.parent().closest("p");
                if (paragraph == null) {
                    break;
                }
                promote(paragraph, outermostBlock(paragraph, nested));
            }
        }
    }

    /**
     * A single {@code br} becomes a space. A run of two or more {@code br}, or any {@code hr}, splits the nearest
     * enclosing paragraph, and a paragraph left with no content is dropped. Outside paragraphs the marker becomes
     * a space so the text around it stays separated.
     */
    static void insertBreaks(Document document) {
        List<Element> splitMarkers = new ArrayList<>();
        for (Element lineBreak : document.select("br, hr")) {
            if (lineBreak.parent() == null) {
                continue;
            }
            if ("hr".equals(lineBreak.normalName())) {
                splitMarkers.add(lineBreak);
                continue;
            }
            List<Element> run = collectBreakRun(lineBreak);
            if (run.size() == 1) {
                replaceWithSpace(lineBreak);
            } else {
                splitMarkers.add(lineBreak);
                for (int i = 1; i < run.size(); i++) {
                    run.get(i).remove();
                }
            }
        }
        for (Element marker : splitMarkers) {
            splitAt(marker);
        }
    }

    private static void promote(Element paragraph, Element nested) {
        Split split = splitAround(paragraph, nested);
        if (!isEmptyPiece(split.before())) {
            paragraph.before(split.before());
        }
        paragraph.before(nested);
        if (!isEmptyPiece(split.after())) {
            paragraph.before(split.after());
        }
        paragraph.remove();
    }

    private static Element outermostBlock(Element paragraph, Element nested) {
        Element block = nested;
        for (Element current = nested.parent(); current != null && current != paragraph; current = current.parent()) {
            if (ILLEGAL_IN_PARAGRAPH.contains(current.normalName())) {
                block = current;
            }
        }
        return block;
    }

    private static void splitAt(Element marker) {
        Element parent = marker.parent();
        if (parent == null) {
            return;
        }
        Element paragraph = parent.closest("p");
        if (paragraph == null) {
            replaceWithSpace(marker);
            return;
        }
        Split split = splitAround(paragraph, marker);
        if (!isEmptyPiece(split.before())) {
            paragraph.before(split.before());
        }
        if (!isEmptyPiece(split.after())) {
            paragraph.before(split.after());
        }
        paragraph.remove();
    }

    /**
     * Moves the content of the container that precedes the target into one shallow copy of the container and
     * the content that follows it into another, recreating intermediate ancestors on both sides. The target
     * itself stays where it is.
     */
    private static Split splitAround(Element container, Node target) {
        Element before = container.shallowClone();
        Element after = container.shallowClone();
        Node pathChild = target;
        while (pathChild.parent() != container) {
            pathChild = pathChild.parent();
        }
        boolean passed = false;
        for (Node child : new ArrayList<>(container.childNodes())) {
            if (child == pathChild) {
                passed = true;
                if (child != target) {
                    Split inner = splitAround((Element) child, target);
                    if (!isEmptyPiece(inner.before())) {
                        before.appendChild(inner.before());
                    }
                    if (!isEmptyPiece(inner.after())) {
                        after.appendChild(inner.after());
                    }
                }
                continue;
            }
            if (passed) {
                after.appendChild(child);
            } else {
                before.appendChild(child);
            }
        }
        return new Split(before, after);
    }

    private static List<Element> collectBreakRun(Element lineBreak) {
        List<Element> run = new ArrayList<>();
        run.add(lineBreak);
        Node next = lineBreak.nextSibling();
        while (next != null) {
            if (next instanceof TextNode textNode && textNode.isBlank()) {
                next = next.nextSibling();
            } else if (next instanceof Element element && "br".equals(element.normalName())) {
                run.add(element);
                next = element.nextSibling();
            } else {
                break;
            }
        }
        return run;
    }

    private static void replaceWithSpace(Element lineBreak) {
        Element parent = lineBreak.parent();
        lineBreak.replaceWith(new TextNode(" "));
        HtmlDocuments.mergeAdjacentText(parent);
    }

    private static boolean isEmptyPiece(Element piece) {
        return piece.childrenSize() == 0 && TextNormalizer.normalizeText(piece.wholeText()).isEmpty();
    }

    private record Split(Element before, Element after) {

    }

}
