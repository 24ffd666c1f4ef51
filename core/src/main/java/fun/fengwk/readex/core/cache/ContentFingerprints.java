package fun.fengwk.readex.core.cache;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Cache keys built from a bounded-length signature of the content.
 *
 * <p>Document and node keys hash a prefix plus a length rather than the full content, so two different
 * inputs sharing both can collide and share a cache slot. This is an accepted approximation.</p>
 *
 * @author fengwk
 */
public final class ContentFingerprints {

    private static final int DOCUMENT_SIGNATURE_LENGTH = 1024;
    private static final int BODY_SIGNATURE_LENGTH = 512;
    private static final int TEXT_SIGNATURE_LENGTH = 256;

    private ContentFingerprints() {
    }

    public static String documentKey(String html) {
        String source = Objects.toString(html, "");
        if (source.length() > DOCUMENT_SIGNATURE_LENGTH) {
            source = source.substring(0, DOCUMENT_SIGNATURE_LENGTH) + ":" + source.length();
        }
        return "doc:" + md5(source);
    }

    public static String nodeKey(Document document) {
        Element body = HtmlDocuments.findBody(document);
        String bodyHtml = body == null ? "" : body.html();
        int textLength = body == null ? 0 : HtmlDocuments.text(body).length();
        String signature = document.title()
            + "|" + StringUtils.left(bodyHtml, BODY_SIGNATURE_LENGTH)
            + "|" + textLength;
        return "node:" + md5(signature);
    }

    /**
     * Keys a node by its position in the document as well as its content, so nested wrappers around the same
     * text never share a slot.
     */
    public static String scoreKey(Element element) {
        String text = HtmlDocuments.text(element);
        String signature = element.id()
            + "|" + element.className()
            + "|" + element.normalName()
            + "|" + StringUtils.left(text, TEXT_SIGNATURE_LENGTH)
            + "|" + text.length()
            + "|" + HtmlDocuments.outerHtml(element).length()
            + "|" + element.childrenSize()
            + "|" + HtmlDocuments.pathOf(element);
        return "score:" + md5(signature);
    }

    private static String md5(String value) {
        return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8));
    }

}
