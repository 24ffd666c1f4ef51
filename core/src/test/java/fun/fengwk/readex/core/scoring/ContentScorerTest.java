package fun.fengwk.readex.core.scoring;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ContentScorerTest {

    private final ContentScorer scorer = new ContentScorer(new ScoringProperties());

    @Test
    public void shouldScoreZeroWithoutText() {
        Element empty = Jsoup.parse("<div id='content'><img src='a.png'></div>").selectFirst("div");

        assertThat(scorer.score(empty)).isZero();
        assertThat(scorer.score(null)).isZero();
    }

    @Test
    public void shouldApplyTagBonus() {
        Document document = Jsoup.parse("<nav>x</nav><p>x</p><span>x</span><li>x</li><article>x</article>");

        assertThat(ContentScorer.tagBonus(document.selectFirst("nav"))).isEqualTo(-10);
        assertThat(ContentScorer.tagBonus(document.selectFirst("p"))).isEqualTo(5);
        assertThat(ContentScorer.tagBonus(document.selectFirst("li"))).isEqualTo(3);
        assertThat(ContentScorer.tagBonus(document.selectFirst("article"))).isEqualTo(10);
        assertThat(ContentScorer.tagBonus(document.selectFirst("span"))).isZero();
    }

    @Test
    public void shouldBoostContentKeywords() {
        Document document = Jsoup.parse("""
            <div id="main-content">a</div>
            <div class="post">b</div>
            <div id="sidebar">c</div>
            <div id="content" class="comment">d</div>
            <div>e</div>
            """);

        assertThat(scorer.contentBoost(document.selectFirst("#main-content"))).isEqualTo(6.0);
        assertThat(scorer.contentBoost(document.selectFirst(".post"))).isEqualTo(4.0);
        assertThat(scorer.contentBoost(document.selectFirst("#sidebar"))).isEqualTo(0.5);
        assertThat(scorer.contentBoost(document.selectFirst("#content"))).isEqualTo(3.0);
        assertThat(scorer.contentBoost(document.select("div").last())).isEqualTo(1.0);
    }

    @Test
    public void shouldPreferProseOverLinkLists() {
        Document document = Jsoup.parse("""
            <div id="links"><a href="/1">Home</a> <a href="/2">Products</a> <a href="/3">Pricing</a></div>
            <div id="story">
              <p>The committee met on Tuesday to discuss the budget. Members disagreed on several points.</p>
              <p>After a long debate, a compromise was reached. The vote is scheduled for next week.</p>
            </div>
            """);

        double links = scorer.score(document.selectFirst("#links"));
        double story = scorer.score(document.selectFirst("#story"));

        assertThat(story).isGreaterThan(links);
    }

    @Test
    public void shouldRewardCaptionedFigures() {
        Document document = Jsoup.parse("""
            <section id="a"><p>Same words here.</p><figure><img src="x.png"><span>caption</span></figure></section>
            <section id="b"><p>Same words here.</p><figure><img src="x.png"><figcaption>caption</figcaption></figure></section>
            """);
        ScoringProperties properties = new ScoringProperties();
        properties.setImageDensityWeight(0);
        ContentScorer figureScorer = new ContentScorer(properties);

        double uncaptioned = figureScorer.score(document.selectFirst("#a"));
        double captioned = figureScorer.score(document.selectFirst("#b"));

        assertThat(captioned).isGreaterThan(uncaptioned + 5);
    }

    @Test
    public void shouldBeDeterministic() {
        Element element = Jsoup.parse("<div class='article'><h2>Head</h2><p>Body text. More text.</p></div>")
            .selectFirst("div");

        assertThat(scorer.score(element)).isEqualTo(scorer.score(element));
    }

}
