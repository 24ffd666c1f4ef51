package fun.fengwk.readex.core.dom;

import fun.fengwk.readex.core.exception.DocumentStructureException;
import fun.fengwk.readex.core.exception.HtmlParseException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Document model adapter over jsoup. Every mutation is applied to the live tree immediately.
 *
 * @author fengwk
 */
public final class HtmlDocuments {

    /**
     * Default upper bound of input length, in characters.
     */
    public static final int DEFAULT_MAX_INPUT_LENGTH = 1024 * 1024;

    private HtmlDocuments() {
    }

    public static Document parse(String html) {
        return parse(html, DEFAULT_MAX_INPUT_LENGTH);
    }

    /**
     * Parses html leniently, auto-closing and auto-wrapping as the html5 tree builder does.
     *
     * @param html raw html.
     * @param maxInputLength maximum accepted length; non-positive disables the check.
     * @return parsed document with compact output settings.
     * @throws HtmlParseException if the input is missing, too long, or rejected by the parser.
     */
    public static Document parse(String html, int maxInputLength) {
        if (html == null) {
            throw new HtmlParseException("html input is null");
        }
        if (maxInputLength > 0 && html.length() > maxInputLength) {
            throw new HtmlParseException("html input too long, length=" + html.length() + ", max=" + maxInputLength);
        }
        Document document;
        try {
            document = Jsoup.parse(html);
        } catch (RuntimeException ex) {
            throw new HtmlParseException("html tokenization failed: " + ex.getMessage(), ex);
        }
        applyOutputSettings(document);
        return document;
    }

    /**
     * Creates a fresh {@code html > head + body} document holding a copy of the given node.
     * A body node contributes its children rather than itself.
     */
    public static Document newShell(Element content) {
        Document shell = Document.createShell(content.baseUri());
        applyOutputSettings(shell);
        Element body = shell.body();
        if ("body".equals(content.normalName())) {
            for (Node child : content.childNodes()) {
                body.appendChild(child.clone());
            }
        } else {
            body.appendChild(content.clone());
        }
        return shell;
    }

    public static void applyOutputSettings(Document document) {
        document.outputSettings()
            .prettyPrint(false)
            .charset(StandardCharsets.UTF_8)
            .escapeMode(Entities.EscapeMode.base);
    }

    /**
     * Returns the body element without creating one.
     */
    public static Element findBody(Document document) {
        return document.selectFirst("html > body");
    }

    public static Element requireBody(Document document) {
        Element body = findBody(document);
        if (body == null) {
            throw new DocumentStructureException();
        }
        return body;
    }

    public static Elements select(Element root, String cssQuery) {
        return root.select(cssQuery);
    }

    /**
     * Concatenated descendant text, whitespace kept as in the source.
     */
    public static String text(Element element) {
        return element == null ? "" : element.wholeText();
    }

    public static String outerHtml(Element element) {
        return element == null ? "" : element.outerHtml();
    }

    public static void setAttr(Element element, String name, String value) {
        element.attr(name, value);
    }

    public static void removeAttr(Element element, String name) {
        element.removeAttr(name);
    }

    public static void remove(Node node) {
        if (node.parent() != null) {
            node.remove();
        }
    }

    public static void replaceWith(Node node, String htmlFragment) {
        node.before(htmlFragment);
        node.remove();
    }

    public static void insertBefore(Node node, String htmlFragment) {
        node.before(htmlFragment);
    }

    public static void insertAfter(Node node, String htmlFragment) {
        node.after(htmlFragment);
    }

    /**
     * Splices the children of the node into its parent and drops the node.
     */
    public static void unwrap(Node node) {
        if (node.parent() != null) {
            node.unwrap();
        }
    }

    /**
     * Counts matches strictly below the element.
     */
    public static int countDescendants(Element element, String cssQuery) {
        int count = 0;
        for (Element match : element.select(cssQuery)) {
            if (match != element) {
                count++;
            }
        }
        return count;
    }

    /**
     * Fraction of the element's text contributed by descendant anchors. Empty text yields 0.
     */
    public static double linkDensity(Element element) {
        String text = text(element);
        if (text.isEmpty()) {
            return 0.0;
        }
        int linkLength = 0;
        for (Element anchor : element.select("a")) {
            if (anchor != element) {
                linkLength += text(anchor).length();
            }
        }
        return (double) linkLength / text.length();
    }

    /**
     * Merges runs of adjacent text node children into a single text node.
     */
    public static void mergeAdjacentText(Element element) {
        int index = 0;
        while (index < element.childNodeSize() - 1) {
            Node current = element.childNode(index);
            Node next = element.childNode(index + 1);
            if (current instanceof TextNode currentText && next instanceof TextNode nextText) {
                currentText.text(currentText.getWholeText() + nextText.getWholeText());
                nextText.remove();
            } else {
                index++;
            }
        }
    }

    public static List<TextNode> textNodes(Element root) {
        List<TextNode> textNodes = new ArrayList<>();
        root.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                textNodes.add(textNode);
            }
        });
        return textNodes;
    }

    /**
     * Path of element sibling indexes from the document root down to the element.
     */
    public static List<Integer> pathOf(Element element) {
        List<Integer> path = new ArrayList<>();
        Element current = element;
        while (current != null && !(current instanceof Document)) {
            path.add(current.elementSiblingIndex());
            current = current.parent();
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Resolves a path produced by {@link #pathOf(Element)}, or returns null when the tree no longer has it.
     */
    public static Element resolvePath(Document document, List<Integer> path) {
        Element current = document;
        for (Integer index : path) {
            if (index == null || index < 0 || index >= current.childrenSize()) {
                return null;
            }
            current = current.child(index);
        }
        return current;
    }

}
