package com.orderintake.core.extract;

import com.joestelmach.natty.DateGroup;
import com.joestelmach.natty.Parser;
import com.orderintake.logging.AppLogger;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Natural-language date parsing backed by Natty, biased toward future dates.
 * <p>
 * Relative phrases resolve against the injected clock. A resolved date in the past is moved
 * forward unless the phrase names a year or reads as past ("ago", "last", "yesterday",
 * "previous"): month/day phrases by whole years, weekday phrases by whole weeks. Hits where
 * Natty only found a time of day, or read a slice of a longer number such as a phone number,
 * are ignored.
 */
public class DeliveryDateResolver {
    private static final Logger LOGGER = AppLogger.get();

    private static final Pattern EXPLICIT_YEAR = Pattern.compile("\\b\\d{4}\\b");
    private static final Pattern PAST_MARKER = Pattern.compile("\\b(ago|last|yesterday|previous)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CALENDAR_DATE = Pattern.compile(
        "\\b(jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\b|\\d{1,2}\\s*[/.-]\\s*\\d{1,2}",
        Pattern.CASE_INSENSITIVE);
    private static final String NUMBER_JOINERS = "-/.";
    private static final Pattern LETTER = Pattern.compile("\\p{L}");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final Clock clock;

    public DeliveryDateResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public DeliveryDateResolver() {
        this(Clock.systemDefaultZone());
    }

    /**
     * First date found in a short phrase such as the remainder of a "Deadline:" line.
     */
    public Optional<LocalDate> parse(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return Optional.empty();
        }
        List<DateGroup> groups;
        try {
            Parser parser = new Parser(TimeZone.getTimeZone(clock.getZone()));
            groups = parser.parse(phrase, Date.from(clock.instant()));
        } catch (RuntimeException ex) {
            LOGGER.fine("Date parser rejected '%s': %s".formatted(phrase, ex.getMessage()));
            return Optional.empty();
        }
        for (DateGroup group : groups) {
            if (group.isDateInferred() || group.getDates().isEmpty()) {
                continue;
            }
            if (isPartOfLongerNumber(phrase, group.getText()) || !isPlausibleNumericDate(group.getText())) {
                LOGGER.fine("Ignoring date '%s' taken from a longer number in '%s'".formatted(group.getText(), phrase));
                continue;
            }
            LocalDate date = group.getDates().get(0).toInstant().atZone(clock.getZone()).toLocalDate();
            return Optional.of(preferFuture(date, group.getText()));
        }
        return Optional.empty();
    }

    /**
     * First date phrase anywhere in a longer text, scanning line by line.
     */
    public Optional<LocalDate> search(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (String line : LINE_BREAK.split(text)) {
            Optional<LocalDate> date = parse(line);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    /**
     * True when every occurrence of the matched text touches further digits in the source, as
     * with the "5-12" Natty finds inside the phone number "555-1234".
     */
    static boolean isPartOfLongerNumber(String source, String matched) {
        if (source == null || matched == null || matched.isBlank()) {
            return false;
        }
        String text = source.toLowerCase(Locale.ROOT);
        String needle = matched.trim().toLowerCase(Locale.ROOT);
        int from = text.indexOf(needle);
        if (from < 0) {
            return false;
        }
        while (from >= 0) {
            int end = from + needle.length();
            if (!continuesNumber(text, from - 1, -1) && !continuesNumber(text, end, 1)) {
                return false;
            }
            from = text.indexOf(needle, from + 1);
        }
        return true;
    }

    /**
     * Text without letters must read as day, month and optional year: digit runs of one, two
     * or four characters.
     */
    static boolean isPlausibleNumericDate(String matched) {
        if (matched == null || LETTER.matcher(matched).find()) {
            return true;
        }
        Matcher runs = DIGIT_RUN.matcher(matched);
        while (runs.find()) {
            int length = runs.group().length();
            if (length == 3 || length > 4) {
                return false;
            }
        }
        return true;
    }

    private static boolean continuesNumber(String text, int index, int step) {
        if (index < 0 || index >= text.length()) {
            return false;
        }
        char c = text.charAt(index);
        if (Character.isDigit(c)) {
            return true;
        }
        int next = index + step;
        return NUMBER_JOINERS.indexOf(c) >= 0
            && next >= 0 && next < text.length()
            && Character.isDigit(text.charAt(next));
    }

    LocalDate preferFuture(LocalDate date, String phrase) {
        LocalDate today = LocalDate.now(clock);
        if (!date.isBefore(today)) {
            return date;
        }
        String text = phrase == null ? "" : phrase;
        if (EXPLICIT_YEAR.matcher(text).find() || PAST_MARKER.matcher(text).find()) {
            return date;
        }
        if (CALENDAR_DATE.matcher(text).find()) {
            LocalDate shifted = date.plusYears(ChronoUnit.YEARS.between(date, today));
            return shifted.isBefore(today) ? shifted.plusYears(1) : shifted;
        }
        long days = ChronoUnit.DAYS.between(date, today);
        return date.plusWeeks((days + 6) / 7);
    }
}
