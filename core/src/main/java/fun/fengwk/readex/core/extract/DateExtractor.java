package fun.fengwk.readex.core.extract;

import fun.fengwk.readex.core.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the publication time of an article.
 *
 * <p>Candidates come from date metadata and from visible date markup, tried from the highest score down.
 * Metadata is read as ISO-8601 first. A candidate carrying a time of day wins at once, otherwise the first
 * date-only candidate is used. Relative phrases such as "3 days ago" are the last resort. Results are UTC,
 * truncated to seconds.</p>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DateExtractor {

    private static final List<SelectorScore> METADATA_SELECTORS = List.of(
        SelectorScore.attribute("meta[property=article:published_time]", "content", 13),
        SelectorScore.attribute("meta[property=og:updated_time]", "content", 10),
        SelectorScore.attribute("meta[property=og:article:published_time]", "content", 10),
        SelectorScore.attribute("meta[property=og:article:modified_time]", "content", 10),
        SelectorScore.attribute("meta[name=pubdate]", "content", 10),
        SelectorScore.attribute("meta[name=publishdate]", "content", 10),
        SelectorScore.attribute("meta[name=date]", "content", 9),
        SelectorScore.attribute("meta[property=article:published]", "content", 7),
        SelectorScore.attribute("meta[itemprop=datePublished]", "content", 3),
        SelectorScore.attribute("time[datetime]", "datetime", 3),
        SelectorScore.attribute("meta[itemprop=dateModified]", "content", 2),
        SelectorScore.attribute("meta[property=article:modified_time]", "content", 2),
        SelectorScore.attribute("meta[name=DC.date.issued]", "content", 2),
        SelectorScore.attribute("meta[name=DC.date.created]", "content", 2),
        SelectorScore.attribute("meta[name=DC.date.modified]", "content", 1),
        SelectorScore.attribute("meta[name=dcterms.modified]", "content", 1),
        SelectorScore.attribute("meta[name=dcterms.created]", "content", 1)
    );

    private static final List<SelectorScore> VISIBLE_SELECTORS = List.of(
        SelectorScore.text("span[class=date]", 3),
        SelectorScore.text("span[class=time]", 3),
        SelectorScore.text("span[class=timestamp]", 3),
        SelectorScore.text("span[class=published]", 3),
        SelectorScore.text("time", 2),
        SelectorScore.text("span[class*=date]", 2),
        SelectorScore.text("div[class*=date]", 2),
        SelectorScore.text("p[class*=date]", 2),
        SelectorScore.text("p[class*=time]", 2),
        SelectorScore.text("div[class*=byline]", 1),
        SelectorScore.text("p[class*=byline]", 1),
        SelectorScore.text("[class*=dateline]", 1)
    );

    private static final List<DateTimeFormatter> ISO_FORMATS = List.of(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        formatter("yyyy-MM-dd'T'HH:mm:ss[.SSS]xx"),
        formatter("yyyyMMdd'T'HHmmssX"),
        DateTimeFormatter.ISO_DATE,
        DateTimeFormatter.RFC_1123_DATE_TIME
    );

    private static final List<DateTimeFormatter> TEXT_FORMATS = List.of(
        formatter("M/d/yyyy H:mm[:ss]"),
        formatter("M/d/yyyy h:mm[:ss] a"),
        formatter("d/M/yyyy H:mm[:ss]"),
        formatter("d/M/yyyy h:mm[:ss] a"),
        formatter("M/d/yyyy"),
        formatter("M-d-yyyy"),
        formatter("M.d.yyyy"),
        formatter("d/M/yyyy"),
        formatter("d-M-yyyy"),
        formatter("d.M.yyyy"),
        formatter("MMMM d, yyyy H:mm[:ss]"),
        formatter("MMMM d, yyyy h:mm[:ss] a"),
        formatter("MMM d, yyyy H:mm[:ss]"),
        formatter("MMM d, yyyy h:mm[:ss] a"),
        formatter("d MMMM yyyy H:mm[:ss]"),
        formatter("MMMM d, yyyy"),
        formatter("MMM d, yyyy"),
        formatter("d MMMM yyyy"),
        formatter("d MMM yyyy"),
        formatter("yyyy/M/d"),
        formatter("yyyy.M.d")
    );

    private static final String MONTH =
        "(january|february|march|april|may|june|july|august|september|october|november|december"
            + "|jan|feb|mar|apr|jun|jul|aug|sept|sep|oct|nov|dec)";

    private static final Pattern MONTH_DAY_YEAR = Pattern.compile(
        "\\b" + MONTH + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?(?:\\s*,\\s*|\\s+)(\\d{4}|\\d{2})\\b");

    private static final Pattern DAY_MONTH_YEAR = Pattern.compile(
        "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+" + MONTH + "\\.?,?\\s+(\\d{4}|\\d{2})\\b");

    private static final Pattern YEAR_MONTH_DAY = Pattern.compile(
        "\\b(\\d{4})\\s+" + MONTH + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b");

    private static final Pattern NUMERIC_YEAR_FIRST = Pattern.compile("\\b(\\d{4})[/-](\\d{1,2})[/-](\\d{1,2})\\b");

    private static final Pattern COMPACT_DATE = Pattern.compile("\\b(\\d{4})(\\d{2})(\\d{2})\\b");

    private static final Pattern YEAR_MONTH = Pattern.compile("\\b(\\d{4})[/-](\\d{1,2})\\b");

    private static final Pattern LONE_YEAR = Pattern.compile("\\b(\\d{4})\\b");

    private static final Pattern DATE_PREFIX = Pattern.compile(
        "^(?:published|updated|posted|written|last modified|modified|date|as of|on)\\b\\s*:?\\s*",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private static final List<RelativeDate> RELATIVE_DATES = List.of(
        new RelativeDate(Pattern.compile("(\\d+)\\s*(?:minute|min)s?\\s+ago"), Duration.ofMinutes(1)),
        new RelativeDate(Pattern.compile("(\\d+)\\s*(?:hour|hr)s?\\s+ago"), Duration.ofHours(1)),
        new RelativeDate(Pattern.compile("(\\d+)\\s*days?\\s+ago"), Duration.ofDays(1)),
        new RelativeDate(Pattern.compile("(\\d+)\\s*weeks?\\s+ago"), Duration.ofDays(7)),
        new RelativeDate(Pattern.compile("(\\d+)\\s*months?\\s+ago"), Duration.ofDays(30)),
        new RelativeDate(Pattern.compile("(\\d+)\\s*years?\\s+ago"), Duration.ofDays(365)),
        new RelativeDate(Pattern.compile("\\byesterday\\b"), Duration.ofDays(1)),
        new RelativeDate(Pattern.compile("\\blast\\s+week\\b"), Duration.ofDays(7)),
        new RelativeDate(Pattern.compile("\\blast\\s+month\\b"), Duration.ofDays(30))
    );

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
        Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
        Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12)
    );

    private static final int EARLIEST_YEAR = 1990;

    private final ElementExtractor elementExtractor;
    private final Clock clock;

    @Autowired
    public DateExtractor(ElementExtractor elementExtractor) {
        this(elementExtractor, Clock.systemUTC());
    }

    DateExtractor(ElementExtractor elementExtractor, Clock clock) {
        this.elementExtractor = elementExtractor;
        this.clock = clock;
    }

    /**
     * @return the publication time, or null when the page carries no recognizable date.
     */
    public Instant extract(Document document) {
        List<DateCandidate> candidates = new ArrayList<>();
        collect(document, METADATA_SELECTORS, true, candidates);
        collect(document, VISIBLE_SELECTORS, false, candidates);
        candidates.sort(Comparator.comparingInt(DateCandidate::score).reversed());

        Instant firstDate = null;
        for (DateCandidate candidate : candidates) {
            if (candidate.metadata()) {
                Instant iso = parseIsoDate(candidate.value());
                if (iso != null) {
                    return iso;
                }
            }
            Instant parsed = parseTextDate(candidate.value());
            if (parsed == null) {
                continue;
            }
            if (hasTimeOfDay(parsed)) {
                return parsed;
            }
            if (firstDate == null) {
                firstDate = parsed;
            }
        }
        if (firstDate != null) {
            return firstDate;
        }

        for (DateCandidate candidate : candidates) {
            if (!candidate.metadata()) {
                Instant relative = parseRelativeDate(candidate.value());
                if (relative != null) {
                    return relative;
                }
            }
        }
        log.debug("no publication date found, candidates={}", candidates.size());
        return null;
    }

    private void collect(Document document, List<SelectorScore> selectors, boolean metadata, List<DateCandidate> candidates) {
        Map<String, ExtractedElement> extracted = elementExtractor.extractElement(document, selectors, null);
        for (Map.Entry<String, ExtractedElement> entry : extracted.entrySet()) {
            candidates.add(new DateCandidate(entry.getKey(), entry.getValue().getScore(), metadata));
        }
    }

    static Instant parseIsoDate(String value) {
        String trimmed = TextNormalizer.normalizeWhitespace(value);
        if (trimmed.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : ISO_FORMATS) {
            Instant parsed = parseWith(trimmed, format);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * Reads dates as people write them: numeric month-first or day-first, month names, year-first forms
     * and, as a last step, a plausible lone year.
     */
    Instant parseTextDate(String value) {
        String cleaned = cleanDateText(value);
        if (cleaned.isEmpty()) {
            return null;
        }
        Instant iso = parseIsoDate(cleaned);
        if (iso != null) {
            return iso;
        }
        for (DateTimeFormatter format : TEXT_FORMATS) {
            Instant parsed = parseWith(cleaned, format);
            if (parsed != null) {
                return parsed;
            }
        }

        String lower = cleaned.toLowerCase(Locale.ROOT);
        Matcher matcher = MONTH_DAY_YEAR.matcher(lower);
        if (matcher.find()) {
            Instant date = toDate(expandYear(matcher.group(3)), monthOf(matcher.group(1)), matcher.group(2));
            if (date != null) {
                return date;
            }
        }
        matcher = DAY_MONTH_YEAR.matcher(lower);
        if (matcher.find()) {
            Instant date = toDate(expandYear(matcher.group(3)), monthOf(matcher.group(2)), matcher.group(1));
            if (date != null) {
                return date;
            }
        }
        matcher = YEAR_MONTH_DAY.matcher(lower);
        if (matcher.find()) {
            Instant date = toDate(Integer.parseInt(matcher.group(1)), monthOf(matcher.group(2)), matcher.group(3));
            if (date != null) {
                return date;
            }
        }
        matcher = NUMERIC_YEAR_FIRST.matcher(lower);
        if (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            int first = Integer.parseInt(matcher.group(2));
            int second = Integer.parseInt(matcher.group(3));
            Instant date = first > 12 ? toDate(year, second, first) : toDate(year, first, second);
            if (date != null) {
                return date;
            }
        }
        matcher = COMPACT_DATE.matcher(lower);
        if (matcher.find()) {
            Instant date = toDate(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)));
            if (date != null) {
                return date;
            }
        }
        matcher = YEAR_MONTH.matcher(lower);
        if (matcher.find()) {
            Instant date = toDate(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), 1);
            if (date != null) {
                return date;
            }
        }
        matcher = LONE_YEAR.matcher(lower);
        if (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            if (year >= EARLIEST_YEAR && year <= LocalDate.now(clock).getYear()) {
                return toDate(year, 1, 1);
            }
        }
        return null;
    }

    Instant parseRelativeDate(String value) {
        String lower = TextNormalizer.normalizeWhitespace(value).toLowerCase(Locale.ROOT);
        for (RelativeDate relativeDate : RELATIVE_DATES) {
            Matcher matcher = relativeDate.pattern().matcher(lower);
            if (matcher.find()) {
                long count = matcher.groupCount() > 0 ? Long.parseLong(matcher.group(1)) : 1;
                return clock.instant().minus(relativeDate.unit().multipliedBy(count)).truncatedTo(ChronoUnit.SECONDS);
            }
        }
        return null;
    }

    static String cleanDateText(String value) {
        String cleaned = TextNormalizer.normalizeWhitespace(TAG.matcher(value == null ? "" : value).replaceAll(" "));
        String previous;
        do {
            previous = cleaned;
            cleaned = DATE_PREFIX.matcher(cleaned).replaceFirst("").trim();
        } while (!cleaned.equals(previous));
        return cleaned;
    }

    static boolean hasTimeOfDay(Instant instant) {
        return !instant.equals(instant.truncatedTo(ChronoUnit.DAYS));
    }

    private static Instant parseWith(String value, DateTimeFormatter format) {
        try {
            TemporalAccessor parsed = format.parseBest(value, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            Instant instant;
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                instant = offsetDateTime.toInstant();
            } else if (parsed instanceof LocalDateTime localDateTime) {
                instant = localDateTime.toInstant(ZoneOffset.UTC);
            } else {
                instant = ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return instant.truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static Instant toDate(int year, int month, String day) {
        return toDate(year, month, Integer.parseInt(day));
    }

    private static Instant toDate(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeException ex) {
            return null;
        }
    }

    private static int monthOf(String name) {
        return MONTHS.get(name.substring(0, 3));
    }

    private static int expandYear(String year) {
        int value = Integer.parseInt(year);
        if (year.length() > 2) {
            return value;
        }
        return value < 50 ? 2000 + value : 1900 + value;
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }

    private record DateCandidate(String value, int score, boolean metadata) {
    }

    private record RelativeDate(Pattern pattern, Duration unit) {
    }

}
