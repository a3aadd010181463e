package com.mypodcasts.metadata;

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient RFC 5322 date header parser.
 *
 * <p>Accepts the obsolete forms mail software still sends:
 * <ul>
 *     <li>optional day name with or without a comma</li>
 *     <li><i>day month year</i> or <i>month day year</i>, with spaces or hyphens</li>
 *     <li>years below 100 in any number of digits</li>
 *     <li>times without seconds or separated by dots</li>
 *     <li>numeric, named, repeated or missing zones and trailing comments</li>
 * </ul>
 * <p>The header is first rewritten into the canonical <i>d MMM yyyy HH:mm[:ss]</i> layout, then parsed.
 * <br>Anything after the time is ignored; the calendar date is the one written in the header and no zone conversion is applied.
 */
public class MailDateParser {

    /**
     * Canonical date-time parser.
     * <p>Text following the time, zones included, is left unparsed.
     */
    static final DateTimeFormatter CANONICAL_PARSER =
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                    .appendLiteral(' ')
                    .appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT)
                    .appendLiteral(' ')
                    .appendValue(ChronoField.YEAR, 4)
                    .appendLiteral(' ')
                    .appendValue(ChronoField.HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE)
                    .appendLiteral(':')
                    .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                    .optionalStart()
                        .appendLiteral(':')
                        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                    .optionalEnd()
                    .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
                    .toFormatter(Locale.US)
                    .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern DAY_NAME = Pattern.compile("^(?i)(mon|tue|wed|thu|fri|sat|sun)[a-z]*,?\\s*");
    private static final Pattern COMMENT = Pattern.compile("\\([^()]*\\)");

    private static final Pattern DAY_MONTH_YEAR = Pattern.compile(
            "^(\\d{1,2})[\\s-]+([A-Za-z]{3})[A-Za-z]*[\\s-]+(\\d+),?\\s+(\\S+)(.*)$");
    private static final Pattern MONTH_DAY_YEAR = Pattern.compile(
            "^([A-Za-z]{3})[A-Za-z]*\\s+(\\d{1,2}),?\\s+(\\d+),?\\s+(\\S+)(.*)$");

    /**
     * Parses a date header value.
     *
     * @param value Header value, may be null.
     * @return Optional of LocalDateTime as written in the header.
     */
    public Optional<LocalDateTime> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }

        String text = COMMENT.matcher(value).replaceAll(" ").trim().replaceAll("\\s+", " ");
        text = DAY_NAME.matcher(text).replaceFirst("");

        Optional<String> canonical = canonicalize(text);
        if (canonical.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.of(LocalDateTime.from(CANONICAL_PARSER.parse(canonical.get(), new ParsePosition(0))));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Rewrites a date without day name into <i>d MMM yyyy time rest</i>.
     *
     * @param text Date string.
     * @return Optional of canonical string, empty if the layout is not recognized.
     */
    private Optional<String> canonicalize(String text) {
        String day;
        String month;
        String year;
        String time;
        String rest;

        Matcher dmy = DAY_MONTH_YEAR.matcher(text);
        Matcher mdy = MONTH_DAY_YEAR.matcher(text);
        if (dmy.matches()) {
            day = dmy.group(1);
            month = dmy.group(2);
            year = dmy.group(3);
            time = dmy.group(4);
            rest = dmy.group(5);
        } else if (mdy.matches()) {
            month = mdy.group(1);
            day = mdy.group(2);
            year = mdy.group(3);
            time = mdy.group(4);
            rest = mdy.group(5);
        } else {
            return Optional.empty();
        }

        if (year.length() > 4) {
            return Optional.empty();
        }

        // Some clients separate time fields with dots.
        if (time.indexOf(':') < 0) {
            time = time.replace('.', ':');
        }

        return Optional.of(day + " " + month + " " + String.format(Locale.ROOT, "%04d", fullYear(Integer.parseInt(year))) + " " + time + rest);
    }

    /**
     * Expands years below 100: above 68 is the 1900s, otherwise the 2000s.
     *
     * @param year Year as written.
     * @return Full year.
     */
    static int fullYear(int year) {
        if (year < 100) {
            return year + (year > 68 ? 1900 : 2000);
        }
        return year;
    }
}
