package fun.fengwk.readex.core.cache;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ExtractionCachesTest {

    private static final String HTML = "<html><head><title>t</title></head><body><div id='a'><p>one</p></div>"
        + "<div id='b'><p>two</p></div></body></html>";

    private ExtractionCaches caches = new ExtractionCaches(new CacheProperties());

    @AfterEach
    void tearDown() {
        caches.close();
    }

    @Test
    public void shouldHandOutPrivateDocumentCopies() {
        caches.putDocument(HTML, Jsoup.parse(HTML));

        Document first = caches.getDocument(HTML).orElseThrow();
        first.selectFirst("#a").remove();
        Document second = caches.getDocument(HTML).orElseThrow();

        assertThat(second).isNotSameAs(first);
        assertThat(second.selectFirst("#a")).isNotNull();
    }

    @Test
    public void shouldResolveContentNodeInEquivalentDocument() {
        Document original = Jsoup.parse(HTML);
        caches.putContentNode(original, original.selectFirst("#b"));

        Document reparsed = Jsoup.parse(HTML);
        Element resolved = caches.getContentNode(reparsed).orElseThrow();

        assertThat(resolved.id()).isEqualTo("b");
        assertThat(resolved.ownerDocument()).isSameAs(reparsed);
    }

    @Test
    public void shouldMemoizeScores() {
        Element element = Jsoup.parse(HTML).selectFirst("#a");
        AtomicInteger calls = new AtomicInteger();

        double first = caches.score(element, e -> calls.incrementAndGet() * 1.5);
        double second = caches.score(element, e -> calls.incrementAndGet() * 1.5);

        assertThat(first).isEqualTo(1.5);
        assertThat(second).isEqualTo(1.5);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(caches.stats().get("scores").hits()).isEqualTo(1);
    }

    @Test
    public void shouldBypassWhenDisabled() {
        CacheProperties properties = new CacheProperties();
        properties.setEnabled(false);
        caches.close();
        caches = new ExtractionCaches(properties);
        AtomicInteger calls = new AtomicInteger();
        Element element = Jsoup.parse(HTML).selectFirst("#a");

        caches.putDocument(HTML, Jsoup.parse(HTML));
        caches.score(element, e -> calls.incrementAndGet());
        caches.score(element, e -> calls.incrementAndGet());

        assertThat(caches.getDocument(HTML)).isEmpty();
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    public void shouldExposeStatsAndClear() {
        caches.putDocument(HTML, Jsoup.parse(HTML));

        assertThat(caches.stats()).containsOnlyKeys("documents", "content-nodes", "scores");
        assertThat(caches.stats().get("documents").size()).isEqualTo(1);

        caches.clear();

        assertThat(caches.stats().get("documents").size()).isZero();
    }

}
