package fun.fengwk.readex.core.simplify;

import fun.fengwk.readex.core.text.TextNormalizer;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.jsoup.nodes.Element;

import java.security.MessageDigest;

/**
 * Stamps content digests and hierarchical node indexes on a simplified tree.
 *
 * @author fengwk
 */
public final class ContentAnnotator {

    public static final String CONTENT_DIGEST_ATTRIBUTE = "data-content-digest";

    public static final String NODE_INDEX_ATTRIBUTE = "data-node-index";

    public static final String ROOT_NODE_INDEX = "0";

    private ContentAnnotator() {
    }

    /**
     * Digest of the element: sha-256 of the normalized text for a leaf, or of the concatenated child digests
     * otherwise. Elements without digestible content get an empty digest.
     */
    public static String calculateContentDigest(Element element) {
        return digest(element, false);
    }

    /**
     * Stamps {@value #CONTENT_DIGEST_ATTRIBUTE} on the element and every descendant with digestible content.
     *
     * @return digest of the element, empty when it has none.
     */
    public static String addContentDigests(Element element) {
        return digest(element, true);
    }

    /**
     * Stamps {@value #NODE_INDEX_ATTRIBUTE} top-down; child {@code i} of index {@code P} gets {@code P.(i+1)}.
     */
    public static void addNodeIndexes(Element element, String index) {
        element.attr(NODE_INDEX_ATTRIBUTE, index);
        int position = 1;
        for (Element child : element.children()) {
            addNodeIndexes(child, index + "." + position);
            position++;
        }
    }

    private static String digest(Element element, boolean stamp) {
        String digest;
        if (element.childrenSize() == 0) {
            String text = TextNormalizer.normalizeText(element.wholeText());
            digest = text.isEmpty() ? "" : DigestUtils.sha256Hex(text);
        } else {
            MessageDigest messageDigest = DigestUtils.getSha256Digest();
            boolean hasContent = false;
            for (Element child : element.children()) {
                String childDigest = digest(child, stamp);
                if (!childDigest.isEmpty()) {
                    DigestUtils.updateDigest(messageDigest, childDigest);
                    hasContent = true;
                }
            }
            digest = hasContent ? Hex.encodeHexString(messageDigest.digest()) : "";
        }
        if (stamp) {
            if (digest.isEmpty()) {
                element.removeAttr(CONTENT_DIGEST_ATTRIBUTE);
            } else {
                element.attr(CONTENT_DIGEST_ATTRIBUTE, digest);
            }
        }
        return digest;
    }

}
