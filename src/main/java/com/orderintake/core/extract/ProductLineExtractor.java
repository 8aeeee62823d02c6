package com.orderintake.core.extract;

import com.orderintake.config.ExtractionSettings;
import com.orderintake.core.catalog.CatalogIndex;
import com.orderintake.core.catalog.CatalogIndex.CodeMention;
import com.orderintake.core.model.Product;
import com.orderintake.logging.AppLogger;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls one product mention and quantity out of each line of an email.
 * <p>
 * Per line:
 * <ul>
 *     <li>Lines without digits carry no quantity and are skipped.</li>
 *     <li>Catalog codes written verbatim (e.g. {@code ABC-123}) resolve the product directly and are
 *     masked so their digits are not read as the quantity.</li>
 *     <li>The quantity is the first remaining digit run.</li>
 *     <li>Otherwise the line minus its digits is fuzzy-matched against catalog names. A match scores
 *     {@value #MATCHED_CONFIDENCE}, a miss keeps the phrase verbatim at {@value #UNMATCHED_CONFIDENCE}.</li>
 *     <li>Results whose phrase contains one of {@link #NON_PRODUCT_PHRASES} are dropped.</li>
 * </ul>
 */
public class ProductLineExtractor {
    private static final Logger LOGGER = AppLogger.get();

    public static final List<String> NON_PRODUCT_PHRASES = List.of(
        "deliver to",
        "let me know",
        "pricing",
        "availability",
        "before",
        "address",
        "do deliver",
        "meguro",
        "japan"
    );

    public static final double MATCHED_CONFIDENCE = 1.0;
    public static final double UNMATCHED_CONFIDENCE = 0.5;

    static final String SEPARATORS = " -:x*.,\t";

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final CatalogIndex catalog;
    private final ExtractionSettings settings;

    public ProductLineExtractor(CatalogIndex catalog, ExtractionSettings settings) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public ProductLineExtractor(CatalogIndex catalog) {
        this(catalog, ExtractionSettings.defaults());
    }

    public List<ExtractedLine> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<ExtractedLine> results = new ArrayList<>();
        String[] lines = LINE_BREAK.split(text);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (!DIGIT_RUN.matcher(line).find()) {
                continue;
            }
            ExtractedLine extracted = extractLine(line, i + 1);
            if (extracted == null) {
                continue;
            }
            if (isNoise(extracted.rawPhrase())) {
                LOGGER.fine("Skipping line %d (non-product phrase): %s".formatted(i + 1, extracted.rawPhrase()));
                continue;
            }
            results.add(extracted);
        }
        return List.copyOf(results);
    }

    private ExtractedLine extractLine(String line, int lineNumber) {
        List<CodeMention> mentions = catalog.findCodeMentions(line);
        String remainder = mask(line, mentions);

        Matcher digits = DIGIT_RUN.matcher(remainder);
        if (!digits.find()) {
            LOGGER.fine("Skipping line %d (no quantity outside product codes)".formatted(lineNumber));
            return null;
        }
        int quantity;
        try {
            quantity = Integer.parseInt(digits.group());
        } catch (NumberFormatException ex) {
            LOGGER.fine("Skipping line %d (quantity out of range): %s".formatted(lineNumber, digits.group()));
            return null;
        }

        if (!mentions.isEmpty()) {
            Product product = mentions.get(0).product();
            if (mentions.size() > 1) {
                LOGGER.warning("Line %d mentions %d product codes; only %s is ordered: %s"
                    .formatted(lineNumber, mentions.size(), product.code(), line.trim()));
            }
            return new ExtractedLine(product, quantity, MATCHED_CONFIDENCE, product.name());
        }

        String candidate = candidatePhrase(remainder);
        Optional<String> bestName = catalog.matchName(candidate, settings.candidateThreshold());
        if (bestName.isPresent()) {
            Product product = catalog.findProduct(bestName.get()).orElse(null);
            return new ExtractedLine(product, quantity, MATCHED_CONFIDENCE, bestName.get());
        }
        return new ExtractedLine(null, quantity, UNMATCHED_CONFIDENCE, candidate);
    }

    static String candidatePhrase(String line) {
        String withoutDigits = DIGIT_RUN.matcher(line).replaceAll("");
        return StringUtils.strip(withoutDigits, SEPARATORS);
    }

    static boolean isNoise(String phrase) {
        if (phrase == null) {
            return false;
        }
        String lower = phrase.toLowerCase(Locale.ROOT);
        for (String noise : NON_PRODUCT_PHRASES) {
            if (lower.contains(noise)) {
                return true;
            }
        }
        return false;
    }

    private static String mask(String line, List<CodeMention> mentions) {
        if (mentions.isEmpty()) {
            return line;
        }
        StringBuilder masked = new StringBuilder(line);
        for (CodeMention mention : mentions) {
            for (int i = mention.start(); i < mention.end(); i++) {
                masked.setCharAt(i, ' ');
            }
        }
        return masked.toString();
    }
}
