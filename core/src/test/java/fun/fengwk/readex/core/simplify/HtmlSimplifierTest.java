package fun.fengwk.readex.core.simplify;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class HtmlSimplifierTest {

    private static final String ARTICLE = """
        <!DOCTYPE html>
        <html><head><title>T</title><style>.x { color: red; }</style></head>
        <body>
          <!-- comment -->
          <nav><a href="/">Home</a></nav>
          <div class="content" style="margin: 0">
            <h1>Title</h1>
            <p>Some <b>bold</b> text with a <a href="/more">link</a>.</p>
            <ul><li>one</li><li>two</li></ul>
          </div>
        </body></html>
        """;

    private static final String BREAK_SPLIT = "<p>First<br><br>Second</p>";

    private static final String RULE_SPLIT = "<div><p>above<hr>below</p></div>";

    private static final String BLOCK_IN_PARAGRAPH = "<p>Before <div>Inside</div> After</p>";

    private static final String SPECIAL_ELEMENTS = "<p>He said <q>hi</q> about H<sub>2</sub>O and x<sup>2</sup></p>";

    private static final String UNKNOWN_ELEMENT = "<section><custom-tag>Text</custom-tag><p>More</p></section>";

    private static final String BREAKS_ONLY_PARAGRAPH = "<div><p>x</p><p><br><br></p></div>";

    private static final String BREAKS_IN_LIST_ITEM = "<ul><li>First line<br><br>Second line</li></ul>";

    private static final String LINK_HEAVY = """
        <div>
          <p>A real paragraph of article text that matters.</p>
          <ul><li><a href="/a">Link one</a></li><li><a href="/b">Link two</a></li></ul>
        </div>
        """;

    private final HtmlSimplifier simplifier = new HtmlSimplifier();

    @Test
    public void shouldReduceToMinimalVocabulary() {
        String result = simplifier.simplify(ARTICLE, SimplifyOptions.defaults());

        assertThat(result).isEqualTo("<html><head><title>T</title></head><body><div><h1>Title</h1>"
            + "<p>Some bold text with a link.</p><ul><li>one</li><li>two</li></ul></div></body></html>");
    }

    static Stream<String> fixtures() {
        return Stream.of(
            ARTICLE,
            BREAK_SPLIT,
            "<p>one<br>two</p>",
            RULE_SPLIT,
            BLOCK_IN_PARAGRAPH,
            SPECIAL_ELEMENTS,
            UNKNOWN_ELEMENT,
            "<ul><li><p>item</p></li></ul>",
            BREAKS_ONLY_PARAGRAPH,
            BREAKS_IN_LIST_ITEM,
            LINK_HEAVY,
            "<div><span> </span></div><p>x</p>"
        );
    }

    @ParameterizedTest
    @MethodSource("fixtures")
    public void shouldBeIdempotent(String html) {
        String once = simplifier.simplify(html, SimplifyOptions.defaults());
        String twice = simplifier.simplify(once, SimplifyOptions.defaults());

        assertThat(twice).isEqualTo(once);
    }

    @ParameterizedTest
    @MethodSource("fixtures")
    public void shouldBeIdempotentWithAnnotations(String html) {
        SimplifyOptions options = SimplifyOptions.builder()
            .addContentDigests(true)
            .addNodeIndexes(true)
            .build();

        String once = simplifier.simplify(html, options);
        String twice = simplifier.simplify(once, options);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    public void shouldDropParagraphLeftEmptyByBreaks() {
        String result = simplifier.simplify(BREAKS_ONLY_PARAGRAPH, SimplifyOptions.defaults());

        assertThat(result).isEqualTo("<html><head></head><body><div><p>x</p></div></body></html>");
    }

    @Test
    public void shouldKeepWordsApartAcrossBreaksOutsideParagraphs() {
        String result = simplifier.simplify(BREAKS_IN_LIST_ITEM, SimplifyOptions.defaults());

        assertThat(result).isEqualTo(
            "<html><head></head><body><ul><li>First line Second line</li></ul></body></html>");
    }

    @Test
    public void shouldPromoteBlockOutOfParagraph() {
        String result = simplifier.simplify(BLOCK_IN_PARAGRAPH, SimplifyOptions.defaults());

        Document document = Jsoup.parse(result);
        assertThat(document.select("p div")).isEmpty();
        assertThat(document.body().children()).extracting(Element::normalName).containsExactly("p", "div", "p");
        assertThat(document.body().child(0).text()).isEqualTo("Before");
        assertThat(document.body().child(1).text()).isEqualTo("Inside");
        assertThat(document.body().child(2).text()).isEqualTo("After");
    }

    @Test
    public void shouldSplitParagraphAtDoubleBreak() {
        String result = simplifier.simplify(BREAK_SPLIT, SimplifyOptions.defaults());

        assertThat(result).isEqualTo("<html><head></head><body><p>First</p><p>Second</p></body></html>");
    }

    @Test
    public void shouldTurnSingleBreakIntoSpace() {
        String result = simplifier.simplify("<p>one<br>two</p>", SimplifyOptions.defaults());

        assertThat(result).isEqualTo("<html><head></head><body><p>one two</p></body></html>");
    }

    @Test
    public void shouldSplitParagraphAtRule() {
        String result = simplifier.simplify(RULE_SPLIT, SimplifyOptions.defaults());

        assertThat(Jsoup.parse(result).select("p")).extracting(Element::text).containsExactly("above", "below");
        assertThat(result).doesNotContain("<hr");
    }

    @Test
    public void shouldTransformSpecialElements() {
        String result = simplifier.simplify(SPECIAL_ELEMENTS, SimplifyOptions.defaults());

        assertThat(result).contains("<p>He said \"hi\" about H_2O and x^2</p>");
    }

    @Test
    public void shouldKeepOnlyAllowedAttributes() {
        String result = simplifier.simplify(
            "<div><p class=\"a\" style=\"b\" title=\"t\" onclick=\"x()\" lang=\"en\">y</p><p>z</p></div>",
            SimplifyOptions.defaults());

        assertThat(result).contains("<p title=\"t\" lang=\"en\">y</p>");
        assertThat(result).doesNotContain("class=").doesNotContain("style=").doesNotContain("onclick");
    }

    @Test
    public void shouldRemoveLinkHeavySubtrees() {
        String result = simplifier.simplify(LINK_HEAVY, SimplifyOptions.defaults());

        assertThat(result).contains("A real paragraph").doesNotContain("Link one").doesNotContain("<ul>");
    }

    @Test
    public void shouldPruneElementsLeftEmpty() {
        String result = simplifier.simplify("<div><span> </span></div><p>x</p>", SimplifyOptions.defaults());

        assertThat(result).isEqualTo("<html><head></head><body><p>x</p></body></html>");
    }

    @Test
    public void shouldUnwrapUnknownElements() {
        String result = simplifier.simplify(UNKNOWN_ELEMENT, SimplifyOptions.defaults());

        assertThat(result).doesNotContain("custom-tag");
        assertThat(result).contains("<section><p>Text</p><p>More</p></section>");
    }

    @Test
    public void shouldUnwrapSoleParagraphOfNonContainerBlock() {
        String result = simplifier.simplify("<ul><li><p>item</p></li></ul>", SimplifyOptions.defaults());

        assertThat(result).contains("<li>item</li>");
    }

    @Test
    public void shouldStampLeafDigest() {
        SimplifyOptions options = SimplifyOptions.builder().addContentDigests(true).build();

        String result = simplifier.simplify("<p>Hello</p>", options);

        assertThat(result).contains(
            "<p data-content-digest=\"185f8db32271fe25f561a6fc938b2e264306ec304eda518007d1764826381969\">Hello</p>");
    }

    @Test
    public void shouldStampNodeIndexes() {
        SimplifyOptions options = SimplifyOptions.builder().addNodeIndexes(true).build();

        String result = simplifier.simplify("<div><p>a</p><p>b</p></div>", options);

        assertThat(result).contains("<body data-node-index=\"0\"><div data-node-index=\"0.1\">"
            + "<p data-node-index=\"0.1.1\">a</p><p data-node-index=\"0.1.2\">b</p></div></body>");
    }

    @Test
    public void shouldLeaveBreaksWhenStageDisabled() {
        SimplifyOptions options = SimplifyOptions.builder().insertBreaks(false).build();

        String result = simplifier.simplify("<p>First<br><br>Second</p>", options);

        assertThat(result).contains("<br>");
    }

    @Test
    public void shouldRejectMissingOptions() {
        Document document = HtmlDocuments.parse("<p>x</p>");

        assertThatThrownBy(() -> simplifier.simplify(document, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

}
