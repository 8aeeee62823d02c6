package com.orderintake.core.catalog;

import com.orderintake.config.ExtractionSettings;
import com.orderintake.core.match.FuzzyMatcher;
import com.orderintake.core.model.Product;
import com.orderintake.logging.AppLogger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads a delimited product catalog (comma or tab separated, header row first) into a
 * {@link CatalogIndex}.
 * <p>
 * Header names are matched case-insensitively and accept a few common aliases, so both
 * {@code Product_Name} and {@code name} resolve to the product name column.
 */
public class CatalogLoader {
    private static final Logger LOGGER = AppLogger.get();

    static final String COLUMN_NAME = "product_name";
    static final String COLUMN_CODE = "product_code";
    static final String COLUMN_MOQ = "min_order_quantity";
    static final String COLUMN_STOCK = "available_in_stock";
    static final String COLUMN_PRICE = "price";
    static final String COLUMN_CATEGORY = "category";

    private static final List<String> REQUIRED_COLUMNS = List.of(
        COLUMN_NAME,
        COLUMN_CODE,
        COLUMN_MOQ,
        COLUMN_STOCK,
        COLUMN_PRICE
    );

    private static final Map<String, String> HEADER_ALIASES = Map.ofEntries(
        Map.entry("name", COLUMN_NAME),
        Map.entry("product", COLUMN_NAME),
        Map.entry("description", COLUMN_NAME),
        Map.entry("code", COLUMN_CODE),
        Map.entry("sku", COLUMN_CODE),
        Map.entry("moq", COLUMN_MOQ),
        Map.entry("min_order_qty", COLUMN_MOQ),
        Map.entry("minimum_order_quantity", COLUMN_MOQ),
        Map.entry("stock", COLUMN_STOCK),
        Map.entry("available_stock", COLUMN_STOCK),
        Map.entry("unit_price", COLUMN_PRICE)
    );

    private final ExtractionSettings settings;
    private final FuzzyMatcher matcher;

    public CatalogLoader() {
        this(ExtractionSettings.defaults(), FuzzyMatcher.lcsRatio());
    }

    public CatalogLoader(ExtractionSettings settings, FuzzyMatcher matcher) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    /**
     * Load the catalog stored at the given path (UTF-8).
     *
     * @throws CatalogLoadException if the file is missing, unreadable or lacks a required column
     */
    public CatalogIndex load(Path file) throws CatalogLoadException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            CatalogIndex index = load(reader);
            LOGGER.info("Loaded %d catalog products from %s".formatted(index.size(), file));
            return index;
        } catch (NoSuchFileException ex) {
            throw new CatalogLoadException("Catalog not found: " + file, ex);
        } catch (CatalogLoadException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new CatalogLoadException("Failed to read catalog " + file + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Load the catalog from a reader. The reader is consumed and closed.
     */
    public CatalogIndex load(Reader reader) throws CatalogLoadException {
        try (BufferedReader buffered = new BufferedReader(reader)) {
            String headerLine = buffered.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                throw new CatalogLoadException("Catalog is empty; missing columns " + REQUIRED_COLUMNS);
            }
            headerLine = stripBom(headerLine);
            char delimiter = headerLine.indexOf('\t') >= 0 ? '\t' : ',';

            Map<String, Integer> headerIndex = mapHeaderIndexes(splitLine(headerLine, delimiter));
            validateRequiredHeaders(headerIndex.keySet());

            Map<String, Product> productsByCode = new LinkedHashMap<>();
            String line;
            int rowIndex = 1;
            while ((line = buffered.readLine()) != null) {
                rowIndex++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    Product product = toProduct(splitLine(line, delimiter), headerIndex);
                    String key = product.code().toLowerCase(Locale.ROOT);
                    if (productsByCode.containsKey(key)) {
                        LOGGER.warning("Skipping catalog row %d: duplicate product code %s".formatted(rowIndex, product.code()));
                        continue;
                    }
                    productsByCode.put(key, product);
                } catch (IllegalArgumentException ex) {
                    LOGGER.warning("Skipping catalog row %d: %s".formatted(rowIndex, ex.getMessage()));
                }
            }
            return new CatalogIndex(new ArrayList<>(productsByCode.values()), settings, matcher);
        } catch (CatalogLoadException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new CatalogLoadException("Failed to read catalog: " + ex.getMessage(), ex);
        }
    }

    private static Product toProduct(List<String> columns, Map<String, Integer> headerIndex) {
        String name = getValue(columns, headerIndex, COLUMN_NAME);
        String code = getValue(columns, headerIndex, COLUMN_CODE);
        int moq = parseCount(getValue(columns, headerIndex, COLUMN_MOQ), COLUMN_MOQ);
        int stock = parseCount(getValue(columns, headerIndex, COLUMN_STOCK), COLUMN_STOCK);
        double price = parsePrice(getValue(columns, headerIndex, COLUMN_PRICE));
        String category = getOptionalValue(columns, headerIndex, COLUMN_CATEGORY);
        return new Product(code, name, moq, price, stock, category);
    }

    static List<String> splitLine(String line, char delimiter) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == delimiter) {
                values.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        values.add(current.toString().trim());
        return values;
    }

    static String normalizeHeader(String header) {
        String normalized = header.trim()
            .toLowerCase(Locale.ROOT)
            .replaceAll("[\\s\\-]+", "_");
        return HEADER_ALIASES.getOrDefault(normalized, normalized);
    }

    private static Map<String, Integer> mapHeaderIndexes(List<String> headers) {
        Map<String, Integer> indexMap = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header == null || header.isBlank()) continue;
            indexMap.putIfAbsent(normalizeHeader(header), i);
        }
        return indexMap;
    }

    private static void validateRequiredHeaders(Set<String> headers) throws CatalogLoadException {
        Set<String> missing = new LinkedHashSet<>();
        for (String required : REQUIRED_COLUMNS) {
            if (!headers.contains(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new CatalogLoadException("Catalog is missing required columns: " + missing);
        }
    }

    private static String getValue(List<String> columns, Map<String, Integer> headerIndex, String key) {
        Integer index = headerIndex.get(key);
        if (index == null || index >= columns.size()) {
            throw new IllegalArgumentException("Missing value for column '%s'".formatted(key));
        }
        String value = columns.get(index);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Empty value for column '%s'".formatted(key));
        }
        return value.trim();
    }

    private static String getOptionalValue(List<String> columns, Map<String, Integer> headerIndex, String key) {
        Integer index = headerIndex.get(key);
        if (index == null || index >= columns.size()) {
            return null;
        }
        String value = columns.get(index);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseCount(String raw, String column) {
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid integer '%s' for column '%s'".formatted(raw, column), ex);
        }
        if (value != Math.rint(value) || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("Invalid integer '%s' for column '%s'".formatted(raw, column));
        }
        return (int) value;
    }

    private static double parsePrice(String raw) {
        String cleaned = raw.replace(",", "").replaceFirst("^[$€£¥]", "").trim();
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid price '%s' for column '%s'".formatted(raw, COLUMN_PRICE));
        }
    }

    private static String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }
}
