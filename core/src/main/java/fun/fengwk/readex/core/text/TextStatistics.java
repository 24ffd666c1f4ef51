package fun.fengwk.readex.core.text;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * Sentence, word and readability counters used by content scoring.
 *
 * @author fengwk
 */
public final class TextStatistics {

    private static final List<String> ABBREVIATIONS = List.of(
        "Dr.", "Mr.", "Mrs.", "Ms.", "Prof.", "St.", "Jr.", "Sr."
    );

    private static final String VOWELS = "aeiouy";

    private TextStatistics() {
    }

    /**
     * Counts punctuation-terminated runs. A trailing run without terminal punctuation counts as one sentence.
     */
    public static int countSentences(String text) {
        if (StringUtils.isEmpty(text)) {
            return 0;
        }
        String stripped = text;
        for (String abbreviation : ABBREVIATIONS) {
            stripped = stripped.replace(abbreviation, abbreviation.substring(0, abbreviation.length() - 1));
        }
        int count = 0;
        boolean inSentence = false;
        for (int i = 0; i < stripped.length(); ) {
            int codePoint = stripped.codePointAt(i);
            if (isLetterOrNumber(codePoint)) {
                inSentence = true;
            } else if (inSentence && (codePoint == '.' || codePoint == '!' || codePoint == '?')) {
                count++;
                inSentence = false;
            }
            i += Character.charCount(codePoint);
        }
        if (inSentence) {
            count++;
        }
        return count;
    }

    public static int countWords(String text) {
        if (StringUtils.isBlank(text)) {
            return 0;
        }
        return StringUtils.split(text).length;
    }

    /**
     * Flesch-Kincaid grade level, 0 when the text has no words or sentences.
     */
    public static double readingLevel(String text) {
        int words = countWords(text);
        int sentences = countSentences(text);
        if (words == 0 || sentences == 0) {
            return 0.0;
        }
        int syllables = 0;
        for (String word : StringUtils.split(text)) {
            syllables += countSyllables(word);
        }
        return 0.39 * ((double) words / sentences) + 11.8 * ((double) syllables / words) - 15.59;
    }

    static int countSyllables(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        int count = 0;
        boolean previousVowel = false;
        for (int i = 0; i < lower.length(); i++) {
            boolean vowel = VOWELS.indexOf(lower.charAt(i)) >= 0;
            if (vowel && !previousVowel) {
                count++;
            }
            previousVowel = vowel;
        }
        int length = lower.length();
        if (length > 2 && lower.charAt(length - 1) == 'e' && VOWELS.indexOf(lower.charAt(length - 2)) < 0) {
            count--;
        }
        return Math.max(count, 1);
    }

    private static boolean isLetterOrNumber(int codePoint) {
        if (Character.isLetter(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.DECIMAL_DIGIT_NUMBER
            || type == Character.LETTER_NUMBER
            || type == Character.OTHER_NUMBER;
    }

}
