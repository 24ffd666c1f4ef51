package fun.fengwk.readex.core.scoring;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * Keyword lists matched as case-insensitive substrings of id and class values.
 *
 * @author fengwk
 */
public final class KeywordPatterns {

    public static final List<String> CONTENT = List.of(
        "article", "content", "entry", "hentry", "main", "page", "pagination", "post",
        "text", "blog", "story", "body", "section", "readable"
    );

    public static final List<String> NON_CONTENT = List.of(
        "combx", "comment", "com-", "contact", "foot", "footer", "footnote", "masthead",
        "media", "meta", "outbrain", "promo", "related", "scroll", "shoutbox", "sidebar",
        "sponsor", "shopping", "tags", "tool", "widget", "nav", "menu", "header", "ad",
        "advertisement", "banner", "social", "share", "sharing", "login", "signup"
    );

    private KeywordPatterns() {
    }

    public static boolean matchesAny(String value, List<String> keywords) {
        if (StringUtils.isBlank(value)) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

}
