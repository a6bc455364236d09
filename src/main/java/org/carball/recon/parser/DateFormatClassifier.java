package org.carball.recon.parser;

import org.carball.recon.model.date.DateSample;
import org.carball.recon.model.date.FormatTag;
import org.carball.recon.model.table.RawTable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Labels date-like strings with a {@link FormatTag}. Values are never turned into calendar dates.
 * <p>
 * Patterns are tried in a fixed order and the first match wins. ISO-shaped values are additionally
 * checked for a possible month and day.
 */
public class DateFormatClassifier {

    private static final Pattern ISO_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}");

    private static final Pattern TIME_SEPARATOR = Pattern.compile("[T\\s]");

    private static final Pattern INCOMPLETE =
            Pattern.compile("^(?:\\d{1,2}([/.-])\\d{1,2}\\1|[/.-])$");

    private static final Pattern MULTI_PART = Pattern.compile("^\\d+(?:[/-]\\d+){3,}$");

    private static final Map<FormatTag, Pattern> FULL_MATCH_PATTERNS = new LinkedHashMap<>();

    private static final Map<FormatTag, Pattern> PREFIX_PATTERNS = new LinkedHashMap<>();

    static {
        FULL_MATCH_PATTERNS.put(FormatTag.SLASH_NUMERIC,
                Pattern.compile("^\\d{1,2}/\\d{1,2}/(?:\\d{1,2}|\\d{4})$"));
        FULL_MATCH_PATTERNS.put(FormatTag.DASH_NUMERIC,
                Pattern.compile("^\\d{1,2}-\\d{1,2}-(?:\\d{1,2}|\\d{4})$"));
        FULL_MATCH_PATTERNS.put(FormatTag.DOT_NUMERIC,
                Pattern.compile("^\\d{1,2}\\.\\d{1,2}\\.(?:\\d{1,2}|\\d{4})$"));

        PREFIX_PATTERNS.put(FormatTag.TEXTUAL_LONG,
                Pattern.compile("^[A-Za-z]{3}\\s+[A-Za-z]{3}\\s+\\d{1,2}\\s+\\d{4}"));
        PREFIX_PATTERNS.put(FormatTag.DAY_MONTH_TEXT_YEAR,
                Pattern.compile("^\\d{1,2}\\s+[A-Za-z]{3,9}\\s+\\d{4}"));
        PREFIX_PATTERNS.put(FormatTag.MONTH_TEXT_DAY_YEAR,
                Pattern.compile("^[A-Za-z]{3,9}\\s+\\d{1,2},?\\s+\\d{4}"));
    }

    public FormatTag classify(String raw) {
        if (raw == null) {
            return FormatTag.UNKNOWN;
        }
        String value = RawTable.stripCell(raw);
        if (value.isEmpty()) {
            return FormatTag.UNKNOWN;
        }

        for (Map.Entry<FormatTag, Pattern> entry : FULL_MATCH_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(value).matches()) {
                return entry.getKey();
            }
        }

        if (ISO_PREFIX.matcher(value).lookingAt()) {
            return validateIsoDate(value);
        }

        for (Map.Entry<FormatTag, Pattern> entry : PREFIX_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(value).lookingAt()) {
                return entry.getKey();
            }
        }

        if (INCOMPLETE.matcher(value).matches()) {
            return FormatTag.INCOMPLETE;
        }
        if (MULTI_PART.matcher(value).matches()) {
            return FormatTag.MALFORMED_MULTI_PART;
        }
        return FormatTag.UNKNOWN;
    }

    public DateSample sample(String raw) {
        return new DateSample(raw, classify(raw));
    }

    /**
     * Checks the year/month/day groups of a value already known to start with {@code YYYY-MM-DD}.
     * Anything after a 'T' or whitespace is treated as time of day and ignored; any other trailing
     * characters make the day group unparseable.
     */
    private FormatTag validateIsoDate(String value) {
        Matcher time = TIME_SEPARATOR.matcher(value);
        String datePart = time.find() ? value.substring(0, time.start()) : value;
        String[] parts = datePart.split("-");
        if (parts.length != 3) {
            return FormatTag.ISO_DATE_MALFORMED;
        }
        int month;
        int day;
        try {
            Integer.parseInt(parts[0]);
            month = Integer.parseInt(parts[1]);
            day = Integer.parseInt(parts[2]);
        } catch (NumberFormatException e) {
            return FormatTag.ISO_DATE_MALFORMED;
        }
        if (month < 1 || month > 12 || day < 1 || day > 31) {
            return FormatTag.ISO_DATE_INVALID_RANGE;
        }
        return FormatTag.ISO_DATE;
    }
}
