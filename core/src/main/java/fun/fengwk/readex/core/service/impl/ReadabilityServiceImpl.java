package fun.fengwk.readex.core.service.impl;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import fun.fengwk.readex.core.extract.BylineExtractor;
import fun.fengwk.readex.core.extract.DateExtractor;
import fun.fengwk.readex.core.extract.PlainTextExtractor;
import fun.fengwk.readex.core.extract.TextBlock;
import fun.fengwk.readex.core.extract.TitleExtractor;
import fun.fengwk.readex.core.locate.MainContentLocator;
import fun.fengwk.readex.core.resilience.FallbackResult;
import fun.fengwk.readex.core.resilience.Resilience;
import fun.fengwk.readex.core.service.DocumentLoader;
import fun.fengwk.readex.core.service.ExtractionProperties;
import fun.fengwk.readex.core.service.ReadabilityService;
import fun.fengwk.readex.core.service.model.Article;
import fun.fengwk.readex.core.service.model.ExtractRequest;
import fun.fengwk.readex.core.simplify.HtmlSimplifier;
import fun.fengwk.readex.core.simplify.SimplifyOptions;
import fun.fengwk.readex.core.site.SiteRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Readability service implementation.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadabilityServiceImpl implements ReadabilityService {

    private final ExtractionProperties extractionProperties;
    private final Resilience resilience;
    private final DocumentLoader documentLoader;
    private final SiteRule siteRule;
    private final MainContentLocator mainContentLocator;
    private final HtmlSimplifier htmlSimplifier;
    private final TitleExtractor titleExtractor;
    private final BylineExtractor bylineExtractor;
    private final DateExtractor dateExtractor;
    private final PlainTextExtractor plainTextExtractor;

    @Override
    public Article extract(ExtractRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        long startAt = System.currentTimeMillis();
        SimplifyOptions options = resolveOptions(request.getOptions());
        Article article = resilience.withTimeout(extractionTimeout(), () -> doExtract(request, options));
        article.setElapsedMs(System.currentTimeMillis() - startAt);
        log.info("extract finished, url={}, elapsedMs={}, degraded={}, blocks={}",
            request.getUrl(), article.getElapsedMs(), article.isDegraded(), article.getPlainText().size());
        return article;
    }

    @Override
    public String simplify(String html, SimplifyOptions options) {
        SimplifyOptions resolved = resolveOptions(options);
        return resilience.withTimeout(extractionTimeout(), () -> {
            Document document = documentLoader.load(html);
            htmlSimplifier.simplify(document, resolved);
            return htmlSimplifier.render(document);
        });
    }

    @Override
    public String locate(String html) {
        return resilience.withTimeout(extractionTimeout(), () -> {
            Document document = documentLoader.load(html);
            return HtmlDocuments.outerHtml(mainContentLocator.locate(document));
        });
    }

    private Article doExtract(ExtractRequest request, SimplifyOptions options) {
        Document document = documentLoader.load(request.getHtml());

        FallbackResult<String> title = resilience.withFallback(() -> titleExtractor.extract(document), () -> "");
        FallbackResult<String> byline = resilience.withFallback(() -> bylineExtractor.extract(document), () -> "");
        FallbackResult<String> date = resilience.withFallback(() -> formatDate(dateExtractor.extract(document)), () -> "");

        siteRule.apply(document, resolveHost(request.getUrl()));
        Element body = HtmlDocuments.requireBody(document);
        FallbackResult<Element> mainContent = resilience.withFallback(() -> mainContentLocator.locate(document), () -> body);

        Document simplified = HtmlDocuments.newShell(mainContent.value());
        htmlSimplifier.simplify(simplified, options);
        List<TextBlock> blocks = plainTextExtractor.extract(HtmlDocuments.findBody(simplified));

        return Article.builder()
            .title(title.value())
            .byline(byline.value())
            .date(date.value())
            .content(htmlSimplifier.render(simplified))
            .plainContent(blocks.stream().map(TextBlock::text).collect(Collectors.joining("\n")))
            .plainText(blocks)
            .degraded(title.isDegraded() || byline.isDegraded() || date.isDegraded() || mainContent.isDegraded())
            .build();
    }

    private static String formatDate(Instant date) {
        return date == null ? "" : date.toString();
    }

    private Duration extractionTimeout() {
        return Duration.ofMillis(extractionProperties.getTimeoutMs());
    }

    private SimplifyOptions resolveOptions(SimplifyOptions options) {
        return options == null ? SimplifyOptions.defaults() : options;
    }

    static String resolveHost(String url) {
        if (StringUtils.isBlank(url)) {
            return "";
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? "" : host;
        } catch (IllegalArgumentException ex) {
            log.debug("url is not a valid uri, site rules skipped, url={}, error={}", url, ex.getMessage());
            return "";
        }
    }

}
