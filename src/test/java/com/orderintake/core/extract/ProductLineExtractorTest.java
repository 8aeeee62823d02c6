package com.orderintake.core.extract;

import com.orderintake.core.catalog.CatalogIndex;
import com.orderintake.core.model.Product;
import com.orderintake.logging.AppLogger;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProductLineExtractorTest {

    private final CatalogIndex catalog = new CatalogIndex(List.of(
        new Product("ABC-123", "Widget Basic", 1, 9.99, 100),
        new Product("SW-100", "SuperWidget", 20, 4.5, 5000),
        new Product("XYZ-789", "Gadget Pro", 10, 1299.0, 50)
    ));

    private final ProductLineExtractor extractor = new ProductLineExtractor(catalog);

    @Test
    void codeMentionResolvesProductAndQuantityComesFromTheRest() {
        List<ExtractedLine> lines = extractor.extract("Please order ABC-123, 5 pieces");

        assertEquals(1, lines.size());
        ExtractedLine line = lines.get(0);
        assertEquals("ABC-123", line.product().code());
        assertEquals(5, line.quantity());
        assertEquals(1.0, line.confidence(), 1e-9);
        assertEquals("Widget Basic", line.rawPhrase());
    }

    @Test
    void productNameInsideSentenceMatchesFuzzily() {
        List<ExtractedLine> lines = extractor.extract("Need 10 pcs of SuperWidget");

        assertEquals(1, lines.size());
        assertEquals("SW-100", lines.get(0).product().code());
        assertEquals(10, lines.get(0).quantity());
        assertEquals(1.0, lines.get(0).confidence(), 1e-9);
    }

    @Test
    void extractsOneResultPerProductLine() {
        String text = String.join("\n",
            "Hi team,",
            "Please order ABC-123, 5 pieces",
            "Need 10 pcs of SuperWidget",
            "Gadget Pro x 12",
            "Thanks"
        );

        List<ExtractedLine> lines = extractor.extract(text);

        assertEquals(3, lines.size());
        assertEquals("XYZ-789", lines.get(2).product().code());
        assertEquals(12, lines.get(2).quantity());
    }

    @Test
    void unknownPhraseIsKeptAtLowConfidence() {
        List<ExtractedLine> lines = extractor.extract("Order 7 units of Flux Capacitor");

        assertEquals(1, lines.size());
        ExtractedLine line = lines.get(0);
        assertFalse(line.isMatched());
        assertNull(line.product());
        assertEquals(7, line.quantity());
        assertEquals(ProductLineExtractor.UNMATCHED_CONFIDENCE, line.confidence(), 1e-9);
        assertEquals("Order  units of Flux Capacitor", line.rawPhrase());
    }

    @Test
    void linesWithoutDigitsAreIgnored() {
        assertTrue(extractor.extract("Please send some SuperWidget soon").isEmpty());
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }

    @Test
    void lineWhoseOnlyDigitsBelongToACodeIsSkipped() {
        assertTrue(extractor.extract("Do you still carry ABC-123?").isEmpty());
    }

    @Test
    void nonProductPhrasesAreDropped() {
        assertTrue(extractor.extract("Please deliver before 15 March").isEmpty());
        assertTrue(extractor.extract("Our address is 4-2-1 Meguro").isEmpty());
    }

    @Test
    void candidatePhraseStripsDigitsAndSeparators() {
        assertEquals("Widget Basic", ProductLineExtractor.candidatePhrase("- 5 x Widget Basic."));
        assertEquals("Gadget Pro", ProductLineExtractor.candidatePhrase("Gadget Pro: 12"));
    }

    @Test
    void noiseCheckIgnoresCase() {
        assertTrue(ProductLineExtractor.isNoise("Let Me Know about PRICING"));
        assertFalse(ProductLineExtractor.isNoise("Widget Basic"));
    }

    @Test
    void extraCodesOnOneLineAreReportedAsWarning() {
        List<LogRecord> records = new ArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = AppLogger.get();
        logger.addHandler(capture);
        try {
            List<ExtractedLine> lines = extractor.extract("Need ABC-123 (10 pcs) and XYZ-789 (3 units)");

            assertEquals(1, lines.size());
            assertEquals("ABC-123", lines.get(0).product().code());
            assertEquals(10, lines.get(0).quantity());
            assertTrue(records.stream().anyMatch(record -> record.getLevel() == Level.WARNING
                && record.getMessage().contains("only ABC-123 is ordered")), "Expected a warning for the dropped code");
        } finally {
            logger.removeHandler(capture);
        }
    }
}
