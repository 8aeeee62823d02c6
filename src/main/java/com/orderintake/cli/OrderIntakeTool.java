package com.orderintake.cli;

import com.orderintake.config.ConfigService;
import com.orderintake.config.ExtractionSettings;
import com.orderintake.core.catalog.CatalogIndex;
import com.orderintake.core.catalog.CatalogLoader;
import com.orderintake.core.email.EmailTextReader;
import com.orderintake.core.json.OrderJsonWriter;
import com.orderintake.core.match.FuzzyMatcher;
import com.orderintake.core.model.EmailContent;
import com.orderintake.core.model.Order;
import com.orderintake.core.order.OrderAssembler;
import com.orderintake.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * CLI workflow that turns saved order emails into JSON orders.
 * <p>
 * The catalog is loaded once; every input email produces {@code <name>.json} in an
 * {@value #OUTPUT_FOLDER_NAME} folder next to the first input.
 */
public final class OrderIntakeTool {
    private static final Logger LOGGER = AppLogger.get();

    static final String OUTPUT_FOLDER_NAME = "extracted-orders";
    static final String INPUTS_PROPERTY = "orderintake.inputs";

    private OrderIntakeTool() {}

    public static void main(String[] args) throws Exception {
        List<Path> inputs = resolveInputs(args);
        ConfigService config = ConfigService.getInstance();
        List<Path> written = run(inputs, config.getCatalogPath(), config.getExtractionSettings(), Clock.systemDefaultZone());
        LOGGER.info("Wrote %d order file(s)".formatted(written.size()));
    }

    /**
     * @return JSON files written, one per readable input
     * @throws IOException if the catalog cannot be loaded or the output folder cannot be created
     */
    static List<Path> run(List<Path> inputs, Path catalogPath, ExtractionSettings settings, Clock clock) throws IOException {
        if (inputs.isEmpty()) throw new IOException("No input file");

        CatalogIndex catalog = new CatalogLoader(settings, FuzzyMatcher.lcsRatio()).load(catalogPath);
        OrderAssembler assembler = OrderAssembler.create(catalog, settings, clock);
        EmailTextReader reader = new EmailTextReader();
        OrderJsonWriter writer = new OrderJsonWriter();

        Path outDir = outputDirectory(inputs.get(0));
        Files.createDirectories(outDir);

        List<Path> written = new ArrayList<>();
        for (Path input : inputs) {
            EmailContent email;
            try {
                email = reader.read(input);
            } catch (IOException ex) {
                LOGGER.warning("Skipping %s: %s".formatted(input, ex.getMessage()));
                continue;
            }
            Order order = assembler.assemble(email);
            if (order.isEmpty()) {
                LOGGER.warning("No catalog products recognised in %s; order %s needs review".formatted(input, order.orderId()));
            }
            Path target = outDir.resolve(baseName(input) + ".json");
            writer.write(order, target);
            written.add(target);
        }
        return written;
    }

    static List<Path> resolveInputs(String[] args) throws IOException {
        List<Path> inputs = new ArrayList<>();

        // 1) CLI arguments
        if (args != null) {
            for (String p : args) {
                if (p == null || p.isBlank()) continue;
                addIfExists(inputs, Path.of(p.trim()));
            }
        }

        // 2) System property (comma-separated): -Dorderintake.inputs=/path/a.txt,/path/b.eml
        if (inputs.isEmpty()) {
            String csv = System.getProperty(INPUTS_PROPERTY);
            if (csv != null && !csv.isBlank()) {
                for (String p : csv.split(",")) {
                    String s = p.trim();
                    if (s.isEmpty()) continue;
                    addIfExists(inputs, Path.of(s));
                }
            }
        }

        if (inputs.isEmpty()) throw new IOException("No input file");
        return inputs;
    }

    private static void addIfExists(List<Path> inputs, Path path) throws IOException {
        if (Files.isDirectory(path)) {
            try (var stream = Files.list(path)) {
                stream.filter(Files::isRegularFile)
                    .filter(OrderIntakeTool::isEmailFile)
                    .sorted()
                    .forEach(inputs::add);
            }
        } else if (Files.exists(path)) {
            inputs.add(path);
        } else {
            LOGGER.warning("Input not found: " + path);
        }
    }

    private static boolean isEmailFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".txt") || name.endsWith(".eml");
    }

    private static Path outputDirectory(Path firstInput) {
        Path parent = firstInput.toAbsolutePath().getParent();
        return parent.resolve(OUTPUT_FOLDER_NAME);
    }

    private static String baseName(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
