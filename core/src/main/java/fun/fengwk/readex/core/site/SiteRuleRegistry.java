package fun.fengwk.readex.core.site;

import fun.fengwk.readex.core.locate.MainContentLocator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Site rules keyed by host suffix. Hosts without a rule are left untouched.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class SiteRuleRegistry implements SiteRule {

    private static final DomainRule WIKIPEDIA_RULE = new DomainRule(
        "wikipedia.org",
        List.of("#mw-content-text", ".mw-parser-output"),
        List.of(
            "#mw-navigation",
            "#mw-panel",
            ".mw-editsection",
            "#footer",
            "#siteSub",
            "#contentSub",
            "#jump-to-nav",
            ".mw-jump-link",
            ".hatnote",
            ".ambox",
            "#toc",
            ".toc",
            ".navbox",
            ".vertical-navbox",
            ".printfooter",
            "#catlinks"
        )
    );

    private static final DomainRule PYTHON_DOCS_RULE = new DomainRule(
        "docs.python.org",
        List.of("div[role=main]", ".body"),
        List.of(".sphinxsidebar", ".related", ".headerlink", ".copybutton")
    );

    private static final DomainRule GITHUB_RULE = new DomainRule(
        "github.com",
        List.of("#readme"),
        List.of(
            "header",
            "footer",
            ".sidebar",
            ".js-header-wrapper",
            ".js-site-header",
            ".site-header",
            ".js-site-footer",
            ".site-footer"
        )
    );

    private static final DomainRule MEDIUM_RULE = new DomainRule(
        "medium.com",
        List.of("article"),
        List.of(
            "nav",
            "header",
            "footer",
            ".sidebar",
            "[data-test-id=post-sidebar]",
            "[data-test-id=post-footer]",
            "[data-test-id=post-header]"
        )
    );

    private static final DomainRule NYTIMES_RULE = new DomainRule(
        "nytimes.com",
        List.of("article", ".article", ".story", ".story-body"),
        List.of(
            "header",
            "footer",
            "nav",
            ".ad",
            "#commentsContainer",
            ".NYT_BELOW_MAIN_CONTENT",
            ".NYT_ABOVE_MAIN_CONTENT",
            ".newsletter-signup",
            ".comments-button"
        )
    );

    private static final List<String> BBC_FOCUS = List.of("article", ".story-body", ".story-body__inner");

    private static final List<String> BBC_STRIP = List.of(
        "header",
        "footer",
        "nav",
        ".bbccom_slot",
        ".related-content",
        ".share",
        ".share-tools",
        ".comments_module",
        ".correspondent-image"
    );

    private static final List<DomainRule> DOMAIN_RULES = List.of(
        WIKIPEDIA_RULE,
        PYTHON_DOCS_RULE,
        GITHUB_RULE,
        MEDIUM_RULE,
        NYTIMES_RULE,
        new DomainRule("bbc.com", BBC_FOCUS, BBC_STRIP),
        new DomainRule("bbc.co.uk", BBC_FOCUS, BBC_STRIP)
    );

    @Override
    public Document apply(Document document, String hostname) {
        DomainRule domainRule = resolveDomainRule(hostname);
        if (domainRule == null) {
            return document;
        }
        for (String selector : domainRule.stripSelectors()) {
            document.select(selector).remove();
        }
        for (String selector : domainRule.focusSelectors()) {
            for (Element element : document.select(selector)) {
                element.attr(MainContentLocator.FOCUS_ATTRIBUTE, "true");
            }
        }
        log.debug("site rule applied, host={}, rule={}", hostname, domainRule.hostSuffix());
        return document;
    }

    DomainRule resolveDomainRule(String hostname) {
        if (StringUtils.isBlank(hostname)) {
            return null;
        }
        String host = hostname.trim().toLowerCase(Locale.ROOT);
        for (DomainRule domainRule : DOMAIN_RULES) {
            if (domainRule.matches(host)) {
                return domainRule;
            }
        }
        return null;
    }

}
