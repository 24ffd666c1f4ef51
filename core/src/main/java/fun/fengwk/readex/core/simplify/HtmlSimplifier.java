package fun.fengwk.readex.core.simplify;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import fun.fengwk.readex.core.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a document into a minimal html form over a fixed tag vocabulary.
 *
 * <p>Stages run in a fixed order and each relies on the postconditions of the earlier ones. Running the
 * pipeline on its own output with the same options yields the same html.</p>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class HtmlSimplifier {

    private static final double MAX_LINK_DENSITY = 0.5;

    public String simplify(String html, SimplifyOptions options) {
        Document document = HtmlDocuments.parse(html);
        simplify(document, options);
        return render(document);
    }

    /**
     * Runs every enabled stage over the document in place.
     */
    public void simplify(Document document, SimplifyOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("simplify options must not be null");
        }
        long startedAt = System.currentTimeMillis();
        removeMetadata(document);
        stripAttributes(document);
        if (options.isRemoveBlacklist()) {
            removeBlacklist(document);
        }
        if (options.isUnwrapElements()) {
            unwrapElements(document);
        }
        if (options.isProcessSpecial()) {
            processSpecialElements(document);
        }
        unwrapUnknownElements(document);
        if (options.isConsolidateText()) {
            consolidateText(document);
        }
        if (options.isRemoveEmpty()) {
            removeEmpty(document);
        }
        if (options.isUnnestParagraphs()) {
            ParagraphRepairer.unnestParagraphs(document);
        }
        if (options.isInsertBreaks()) {
            ParagraphRepairer.insertBreaks(document);
        }
        if (options.isWrapBareText()) {
            wrapBareText(document);
        }
        normalizeText(document);

        Element body = HtmlDocuments.findBody(document);
        if (body != null && options.isAddContentDigests()) {
            ContentAnnotator.addContentDigests(body);
        }
        if (body != null && options.isAddNodeIndexes()) {
            ContentAnnotator.addNodeIndexes(body, ContentAnnotator.ROOT_NODE_INDEX);
        }
        log.debug("html simplified, elapsedMs={}", System.currentTimeMillis() - startedAt);
    }

    /**
     * Serializes the document without inter-tag whitespace.
     */
    public String render(Document document) {
        HtmlDocuments.applyOutputSettings(document);
        return TextNormalizer.stripHtmlWhitespace(document.outerHtml());
    }

    void removeMetadata(Document document) {
        List<Node> metadata = new ArrayList<>();
        document.traverse((node, depth) -> {
            if (node instanceof Comment || node instanceof DocumentType) {
                metadata.add(node);
            }
        });
        metadata.forEach(HtmlDocuments::remove);
    }

    void stripAttributes(Document document) {
        for (Element element : document.getAllElements()) {
            List<String> removable = new ArrayList<>();
            for (Attribute attribute : element.attributes()) {
                if (!ElementVocabulary.ALLOWED_ATTRIBUTES.contains(attribute.getKey())) {
                    removable.add(attribute.getKey());
                }
            }
            removable.forEach(element::removeAttr);
        }
    }

    void removeBlacklist(Document document) {
        for (Element element : document.select(String.join(", ", ElementVocabulary.ELEMENTS_TO_DELETE))) {
            HtmlDocuments.remove(element);
        }
        removeLinkHeavy(document);
    }

    private void removeLinkHeavy(Element element) {
        for (Element child : new ArrayList<>(element.children())) {
            if (!ElementVocabulary.STRUCTURAL_ELEMENTS.contains(child.normalName())
                && HtmlDocuments.linkDensity(child) > MAX_LINK_DENSITY) {
                child.remove();
            } else {
                removeLinkHeavy(child);
            }
        }
    }

    void unwrapElements(Document document) {
        for (Element element : document.select(String.join(", ", ElementVocabulary.ELEMENTS_TO_UNWRAP))) {
            HtmlDocuments.unwrap(element);
        }
    }

    void processSpecialElements(Document document) {
        for (Element element : document.select(String.join(", ", ElementVocabulary.SPECIAL_ELEMENTS))) {
            if (!element.wholeText().isEmpty()) {
                switch (element.normalName()) {
                    case "q" -> {
                        element.prependText("\"");
                        element.appendText("\"");
                    }
                    case "sub" -> element.prependText("_");
                    case "sup" -> element.prependText("^");
                    default -> {
                    }
                }
            }
            HtmlDocuments.unwrap(element);
        }
    }

    void unwrapUnknownElements(Document document) {
        for (Element element : document.getAllElements()) {
            if (element instanceof Document) {
                continue;
            }
            if (!ElementVocabulary.KNOWN_ELEMENTS.contains(element.normalName())) {
                HtmlDocuments.unwrap(element);
            }
        }
    }

    void consolidateText(Document document) {
        for (Element element : document.getAllElements()) {
            HtmlDocuments.mergeAdjacentText(element);
        }
    }

    void removeEmpty(Document document) {
        boolean changed;
        do {
            changed = pruneEmpty(document);
        } while (changed);
    }

    private boolean pruneEmpty(Element element) {
        boolean changed = false;
        for (Node child : new ArrayList<>(element.childNodes())) {
            if (child instanceof TextNode textNode) {
                if (TextNormalizer.normalizeText(textNode.getWholeText()).isEmpty()) {
                    textNode.remove();
                    changed = true;
                }
            } else if (child instanceof Element childElement) {
                changed |= pruneEmpty(childElement);
                if (isPrunable(childElement) && childElement.childNodeSize() == 0) {
                    childElement.remove();
                    changed = true;
                }
            }
        }
        return changed;
    }

    private boolean isPrunable(Element element) {
        String tag = element.normalName();
        return !ElementVocabulary.STRUCTURAL_ELEMENTS.contains(tag)
            && !ElementVocabulary.LINEBREAK_ELEMENTS.contains(tag);
    }

    void wrapBareText(Document document) {
        for (Element container : document.select(String.join(", ", ElementVocabulary.BARE_TEXT_CONTAINERS))) {
            for (Node child : new ArrayList<>(container.childNodes())) {
                if (child instanceof TextNode textNode
                    && !TextNormalizer.normalizeText(textNode.getWholeText()).isEmpty()) {
                    Element paragraph = new Element("p");
                    textNode.before(paragraph);
                    paragraph.appendChild(textNode);
                }
            }
        }
        for (Element paragraph : document.select("p")) {
            Element parent = paragraph.parent();
            if (parent == null) {
                continue;
            }
            String parentTag = parent.normalName();
            if (ElementVocabulary.BLOCK_WHITELIST.contains(parentTag)
                && !ElementVocabulary.BARE_TEXT_CONTAINERS.contains(parentTag)
                && isSoleChild(paragraph)) {
                paragraph.unwrap();
            }
        }
    }

    private boolean isSoleChild(Element element) {
        for (Node sibling : element.parent().childNodes()) {
            if (sibling == element) {
                continue;
            }
            if (!(sibling instanceof TextNode textNode) || !textNode.isBlank()) {
                return false;
            }
        }
        return true;
    }

    void normalizeText(Document document) {
        for (TextNode textNode : HtmlDocuments.textNodes(document)) {
            String normalized = TextNormalizer.normalizeText(textNode.getWholeText());
            if (normalized.isEmpty()) {
                textNode.remove();
            } else {
                textNode.text(normalized);
            }
        }
    }

}
