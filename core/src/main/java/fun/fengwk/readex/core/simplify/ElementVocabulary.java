package fun.fengwk.readex.core.simplify;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Closed tag sets driving the simplification stages.
 *
 * @author fengwk
 */
public final class ElementVocabulary {

    public static final Set<String> ELEMENTS_TO_DELETE = Set.of(
        "button", "datalist", "fieldset", "form", "input", "label", "legend", "meter", "optgroup",
        "option", "output", "progress", "select", "textarea",
        "area", "img", "map", "picture", "source", "audio", "track", "video",
        "embed", "iframe", "math", "object", "param", "svg",
        "details", "dialog", "summary", "canvas", "noscript", "script", "template", "data",
        "link", "style", "nav"
    );

    public static final Set<String> ELEMENTS_TO_UNWRAP = Set.of(
        "a", "abbr", "address", "b", "bdi", "bdo", "center", "cite", "code", "del", "dfn", "em",
        "i", "ins", "kbd", "mark", "rb", "ruby", "rp", "rt", "rtc", "s", "samp", "small", "span",
        "strong", "time", "u", "var", "wbr"
    );

    public static final Set<String> SPECIAL_ELEMENTS = Set.of("q", "sub", "sup");

    public static final Set<String> BLOCK_WHITELIST = Set.of(
        "article", "aside", "blockquote", "caption", "colgroup", "col", "div", "dl", "dt", "dd",
        "figure", "figcaption", "footer", "h1", "h2", "h3", "h4", "h5", "h6", "header", "li",
        "main", "ol", "p", "pre", "section", "table", "tbody", "thead", "tfoot", "tr", "td", "th", "ul"
    );

    public static final Set<String> STRUCTURAL_ELEMENTS = Set.of("html", "head", "body");

    public static final Set<String> METADATA_ELEMENTS = Set.of("meta", "link", "base", "title");

    public static final Set<String> LINEBREAK_ELEMENTS = Set.of("br", "hr");

    /**
     * Block elements that may not appear inside a paragraph, in the order they are promoted.
     */
    public static final List<String> ILLEGAL_IN_PARAGRAPH = List.of(
        "address", "article", "aside", "blockquote", "canvas", "dd", "div", "dl", "dt", "fieldset",
        "figcaption", "figure", "footer", "form", "h1", "h2", "h3", "h4", "h5", "h6", "header", "hr",
        "li", "main", "nav", "noscript", "ol", "p", "pre", "section", "table", "tfoot", "ul", "video"
    );

    public static final Set<String> BARE_TEXT_CONTAINERS = Set.of(
        "body", "div", "article", "section", "main", "aside", "header", "footer", "blockquote"
    );

    public static final Set<String> ALLOWED_ATTRIBUTES = Set.of(
        "href", "src", "alt", "title", "colspan", "rowspan", "headers", "scope", "lang", "dir",
        ContentAnnotator.CONTENT_DIGEST_ATTRIBUTE, ContentAnnotator.NODE_INDEX_ATTRIBUTE
    );

    public static final Set<String> KNOWN_ELEMENTS = union(
        ELEMENTS_TO_DELETE, ELEMENTS_TO_UNWRAP, SPECIAL_ELEMENTS, BLOCK_WHITELIST,
        STRUCTURAL_ELEMENTS, METADATA_ELEMENTS, LINEBREAK_ELEMENTS
    );

    private ElementVocabulary() {
    }

    @SafeVarargs
    private static Set<String> union(Set<String>... sets) {
        Set<String> union = new LinkedHashSet<>();
        for (Set<String> set : sets) {
            union.addAll(set);
        }
        return Set.copyOf(union);
    }

}
