package com.orderintake.core.extract;

import com.orderintake.core.model.DeliveryDetails;
import com.orderintake.logging.AppLogger;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Extracts the shipping address, required delivery date and delivery instructions from an email.
 * <p>
 * Keyword lists are evaluated in declaration order and the first line that yields a value wins.
 */
public class DeliveryDetailsExtractor {
    private static final Logger LOGGER = AppLogger.get();

    public static final List<String> ADDRESS_KEYWORDS = List.of(
        "ship to",
        "send to",
        "delivery address",
        "please deliver to",
        "deliver to",
        "recipient",
        "address is",
        "ship them to"
    );

    public static final List<String> DATE_KEYWORDS = List.of(
        "before",
        "by",
        "deadline",
        "requested delivery date",
        "deliver on",
        "deliver before",
        "delivery date",
        "needed on",
        "arrive by",
        "no later than",
        "expected on",
        "required delivery date"
    );

    public static final List<String> INSTRUCTION_KEYWORDS = List.of(
        "delivery instructions",
        "shipping instructions",
        "instructions"
    );

    /** Street-type words must stand alone, so "st" inside "best" or "first" does not count. */
    private static final Pattern ADDRESS_TOKEN = Pattern.compile(
        "\\b(street|st|avenue|ave|road|rd|lane|ln|blvd|drive|dr|way|court|ct|plaza|circle|parkway|square"
            + "|block|bldg|suite|apt|unit|room|po box|city)\\b|,",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern PRODUCT_LINE = Pattern.compile("pcs|qty|x\\s*\\d+|need \\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final DeliveryDateResolver dateResolver;

    public DeliveryDetailsExtractor(DeliveryDateResolver dateResolver) {
        this.dateResolver = Objects.requireNonNull(dateResolver, "dateResolver");
    }

    public DeliveryDetailsExtractor() {
        this(new DeliveryDateResolver());
    }

    public DeliveryDetails extract(String text) {
        if (text == null || text.isBlank()) {
            return DeliveryDetails.empty();
        }
        List<String> lines = nonBlankLines(text);

        String address = extractAddress(lines);
        LOGGER.fine("Extracted address: " + address);

        String date = extractDate(lines, text)
            .map(DateTimeFormatter.ISO_LOCAL_DATE::format)
            .orElse(null);
        LOGGER.fine("Extracted date: " + date);

        String instructions = extractInstructions(lines);
        return new DeliveryDetails(address, date, instructions);
    }

    String extractAddress(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String keyword = firstKeyword(line, ADDRESS_KEYWORDS);
            if (keyword == null) {
                continue;
            }
            String afterColon = afterFirstColon(line);
            if (!afterColon.isEmpty() && !afterColon.equalsIgnoreCase(keyword)) {
                return afterColon;
            }
            if (i + 1 < lines.size()) {
                String next = lines.get(i + 1);
                if (i + 2 < lines.size() && looksLikeAddress(lines.get(i + 2))) {
                    return next + ", " + lines.get(i + 2);
                }
                return next;
            }
        }

        for (String line : lines) {
            if (PRODUCT_LINE.matcher(line).find()) {
                continue;
            }
            if (looksLikeAddress(line)) {
                return line;
            }
        }
        return null;
    }

    Optional<LocalDate> extractDate(List<String> lines, String text) {
        for (String line : lines) {
            if (firstKeyword(line, DATE_KEYWORDS) == null) {
                continue;
            }
            String candidate = line.indexOf(':') >= 0 ? line.substring(line.indexOf(':') + 1) : line;
            Optional<LocalDate> date = dateResolver.parse(candidate);
            if (date.isPresent()) {
                return date;
            }
        }
        return dateResolver.search(text);
    }

    String extractInstructions(List<String> lines) {
        for (String line : lines) {
            String keyword = firstKeyword(line, INSTRUCTION_KEYWORDS);
            if (keyword == null || line.indexOf(':') < 0) {
                continue;
            }
            String value = afterFirstColon(line);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    static boolean looksLikeAddress(String line) {
        return ADDRESS_TOKEN.matcher(line).find();
    }

    private static String firstKeyword(String line, List<String> keywords) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    private static String afterFirstColon(String line) {
        int colon = line.indexOf(':');
        return (colon >= 0 ? line.substring(colon + 1) : line).trim();
    }

    private static List<String> nonBlankLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String raw : LINE_BREAK.split(text)) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }
}
