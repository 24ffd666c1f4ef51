package fun.fengwk.readex.core.text;

import org.apache.commons.lang3.StringUtils;
import org.jsoup.parser.Parser;

import java.text.Normalizer;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pure text normalization functions.
 *
 * @author fengwk
 */
public final class TextNormalizer {

    private static final Map<Integer, String> SYMBOL_FOLDING = Map.ofEntries(
        Map.entry(0x2013, "-"),
        Map.entry(0x2014, "--"),
        Map.entry(0x2018, "'"),
        Map.entry(0x2019, "'"),
        Map.entry(0x201C, "\""),
        Map.entry(0x201D, "\""),
        Map.entry(0x2026, "..."),
        Map.entry(0x00A0, " "),
        Map.entry(0x00AD, ""),
        Map.entry(0x2022, "*"),
        Map.entry(0x2212, "-"),
        Map.entry(0x00B7, "*"),
        Map.entry(0x00B0, "degrees"),
        Map.entry(0x00AE, "(R)"),
        Map.entry(0x00A9, "(C)"),
        Map.entry(0x2122, "(TM)"),
        Map.entry(0x00A2, "c"),
        Map.entry(0x00A3, "GBP"),
        Map.entry(0x00A5, "JPY"),
        Map.entry(0x20AC, "EUR"),
        Map.entry(0x00F7, "/"),
        Map.entry(0x00D7, "x")
    );

    private static final Pattern INTER_TAG_WHITESPACE = Pattern.compile(">\\s+<");

    private TextNormalizer() {
    }

    /**
     * Folds typographic symbols to ascii equivalents, then applies NFKC.
     * Folding runs first so that symbols NFKC would decompose (™, …) get their intended replacement.
     */
    public static String normalizeUnicode(String text) {
        if (StringUtils.isEmpty(text)) {
            return "";
        }
        StringBuilder folded = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String replacement = SYMBOL_FOLDING.get(codePoint);
            if (replacement != null) {
                folded.append(replacement);
            } else {
                folded.appendCodePoint(codePoint);
            }
        });
        return Normalizer.normalize(folded, Normalizer.Form.NFKC);
    }

    /**
     * Removes non-printable characters, keeping {@code \n}, {@code \t}, {@code \r} and {@code \f}.
     */
    public static String stripControlChars(String text) {
        if (StringUtils.isEmpty(text)) {
            return "";
        }
        StringBuilder result = new StringBuilder(text.length());
        text.codePoints()
            .filter(TextNormalizer::isKept)
            .forEach(result::appendCodePoint);
        return result.toString();
    }

    /**
     * Collapses whitespace runs to a single space and trims.
     */
    public static String normalizeWhitespace(String text) {
        if (StringUtils.isEmpty(text)) {
            return "";
        }
        return StringUtils.normalizeSpace(text);
    }

    public static String normalizeText(String text) {
        if (StringUtils.isEmpty(text)) {
            return "";
        }
        return normalizeWhitespace(stripControlChars(normalizeUnicode(text)));
    }

    public static String decodeHtmlEntities(String text) {
        if (StringUtils.isEmpty(text)) {
            return "";
        }
        return Parser.unescapeEntities(text, false);
    }

    /**
     * Drops whitespace between tags; text inside elements is untouched.
     */
    public static String stripHtmlWhitespace(String html) {
        if (StringUtils.isEmpty(html)) {
            return "";
        }
        return INTER_TAG_WHITESPACE.matcher(html).replaceAll("><").trim();
    }

    private static boolean isKept(int codePoint) {
        if (codePoint == '\n' || codePoint == '\t' || codePoint == '\r' || codePoint == '\f' || codePoint == ' ') {
            return true;
        }
        switch (Character.getType(codePoint)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

}
