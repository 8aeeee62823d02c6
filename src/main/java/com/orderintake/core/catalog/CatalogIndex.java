package com.orderintake.core.catalog;

import com.orderintake.config.ExtractionSettings;
import com.orderintake.core.match.FuzzyMatcher;
import com.orderintake.core.model.Product;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read-only lookup structure over the loaded catalog.
 * <p>
 * Instances never change after construction and can be shared between threads.
 */
public final class CatalogIndex {

    private final List<Product> products;
    private final Map<String, Product> byName;
    private final Map<String, Product> byCode;
    private final List<String> productNames;
    private final List<String> lookupKeys;
    private final List<Product> lookupOwners;
    private final Pattern codeMentionPattern;
    private final ExtractionSettings settings;
    private final FuzzyMatcher matcher;

    public CatalogIndex(List<Product> products, ExtractionSettings settings, FuzzyMatcher matcher) {
        this.products = List.copyOf(products);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.matcher = Objects.requireNonNull(matcher, "matcher");

        Map<String, Product> names = new LinkedHashMap<>();
        Map<String, Product> codes = new LinkedHashMap<>();
        List<String> nameList = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        List<Product> owners = new ArrayList<>();
        for (Product product : this.products) {
            names.putIfAbsent(product.name().toLowerCase(Locale.ROOT), product);
            codes.putIfAbsent(product.code().toLowerCase(Locale.ROOT), product);
            nameList.add(product.name());
        }
        // names first, then codes: fuzzy ties resolve to the earlier entry
        for (Product product : this.products) {
            keys.add(product.name());
            owners.add(product);
        }
        for (Product product : this.products) {
            keys.add(product.code());
            owners.add(product);
        }
        this.byName = Map.copyOf(names);
        this.byCode = Map.copyOf(codes);
        this.productNames = List.copyOf(nameList);
        this.lookupKeys = List.copyOf(keys);
        this.lookupOwners = List.copyOf(owners);
        this.codeMentionPattern = buildCodePattern(this.products);
    }

    public CatalogIndex(List<Product> products) {
        this(products, ExtractionSettings.defaults(), FuzzyMatcher.lcsRatio());
    }

    public List<Product> products() {
        return products;
    }

    public List<String> productNames() {
        return productNames;
    }

    public int size() {
        return products.size();
    }

    public boolean isEmpty() {
        return products.isEmpty();
    }

    public Optional<Product> findByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byCode.get(code.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolve a phrase to a catalog product: exact name, then exact code (both
     * case-insensitive), then the single best fuzzy match over all names and codes that
     * reaches the configured match threshold.
     */
    public Optional<Product> findProduct(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return Optional.empty();
        }
        String key = phrase.trim().toLowerCase(Locale.ROOT);
        Product exact = byName.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        exact = byCode.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        return matcher.bestMatch(phrase.trim(), lookupKeys, settings.matchThreshold())
            .map(match -> lookupOwners.get(lookupKeys.indexOf(match)));
    }

    /**
     * Best catalog name for a phrase at the given cutoff, without code lookup.
     */
    public Optional<String> matchName(String phrase, double cutoff) {
        return matcher.bestMatch(phrase, productNames, cutoff);
    }

    /**
     * Names and codes resembling the phrase, best first. Used for replacement suggestions.
     */
    public List<String> fuzzyCandidates(String phrase, int limit, double cutoff) {
        return matcher.closeMatches(phrase, lookupKeys, limit, cutoff);
    }

    /**
     * Catalog codes written verbatim in the line, in order of appearance. A code only counts
     * when it is not glued to further letters or digits.
     */
    public List<CodeMention> findCodeMentions(String line) {
        if (codeMentionPattern == null || line == null || line.isEmpty()) {
            return List.of();
        }
        List<CodeMention> mentions = new ArrayList<>();
        Matcher m = codeMentionPattern.matcher(line);
        while (m.find()) {
            Product product = byCode.get(m.group(1).toLowerCase(Locale.ROOT));
            if (product != null) {
                mentions.add(new CodeMention(product, m.start(1), m.end(1)));
            }
        }
        return List.copyOf(mentions);
    }

    private static Pattern buildCodePattern(List<Product> products) {
        if (products.isEmpty()) {
            return null;
        }
        String alternation = products.stream()
            .map(Product::code)
            .distinct()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![A-Za-z0-9])(" + alternation + ")(?![A-Za-z0-9])", Pattern.CASE_INSENSITIVE);
    }

    /**
     * A catalog code found inside a line of text.
     *
     * @param start index of the first character of the code
     * @param end   index after the last character of the code
     */
    public record CodeMention(Product product, int start, int end) {
    }
}
