package fun.fengwk.readex.core.extract;

/**
 * A css selector with the confidence given to what it matches. When an attribute is set the attribute value
 * is extracted instead of the element text.
 *
 * @author fengwk
 */
public record SelectorScore(String selector, String attribute, int score) {

    public static SelectorScore text(String selector, int score) {
        return new SelectorScore(selector, null, score);
    }

    public static SelectorScore attribute(String selector, String attribute, int score) {
        return new SelectorScore(selector, attribute, score);
    }

    public boolean extractsAttribute() {
        return attribute != null && !attribute.isEmpty();
    }

    /**
     * Readable form used in matched selector lists.
     */
    public String describe() {
        return extractsAttribute() ? selector + "@" + attribute : selector;
    }

}
