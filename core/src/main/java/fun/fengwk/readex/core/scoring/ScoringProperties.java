package fun.fengwk.readex.core.scoring;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuned constants of content scoring and main-content location.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "readex.scoring")
public class ScoringProperties {

    /**
     * Weight of the text to html length ratio.
     */
    private double textDensityWeight = 50;

    /**
     * Weight of paragraphs per thousand characters.
     */
    private double paragraphDensityWeight = 20;

    /**
     * Weight of sentences per thousand characters.
     */
    private double sentenceDensityWeight = 15;

    /**
     * Weight of words per hundred characters.
     */
    private double wordDensityWeight = 15;

    /**
     * Weight of headings per thousand characters.
     */
    private double headingDensityWeight = 10;

    /**
     * Weight of list items per thousand characters.
     */
    private double listDensityWeight = 5;

    /**
     * Weight of images per thousand html characters.
     */
    private double imageDensityWeight = 3;

    /**
     * Boost added when the id matches a content keyword.
     */
    private double idContentBoost = 5;

    /**
     * Boost added when the class matches a content keyword.
     */
    private double classContentBoost = 3;

    /**
     * Multiplier applied when id or class matches a boilerplate keyword.
     */
    private double nonContentMultiplier = 0.5;

    /**
     * Bonus per direct paragraph child.
     */
    private double paragraphChildBonus = 5;

    /**
     * Bonus per figure holding both an image and a caption.
     */
    private double figureBonus = 10;

    /**
     * Minimum text length of a div or section in the full-scan fallback.
     */
    private int fallbackMinTextLength = 100;

}
