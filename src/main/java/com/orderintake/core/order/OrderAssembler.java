package com.orderintake.core.order;

import com.orderintake.config.ExtractionSettings;
import com.orderintake.core.catalog.CatalogIndex;
import com.orderintake.core.extract.DeliveryDateResolver;
import com.orderintake.core.extract.DeliveryDetailsExtractor;
import com.orderintake.core.extract.ExtractedLine;
import com.orderintake.core.extract.NotesExtractor;
import com.orderintake.core.extract.ProductLineExtractor;
import com.orderintake.core.model.DeliveryDetails;
import com.orderintake.core.model.EmailContent;
import com.orderintake.core.model.Order;
import com.orderintake.core.model.OrderItem;
import com.orderintake.core.model.OrderStatus;
import com.orderintake.core.model.Product;
import com.orderintake.core.validation.ValidationEngine;
import com.orderintake.core.validation.ValidationResult;
import com.orderintake.logging.AppLogger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns one email into an {@link Order}.
 * <p>
 * Missing products, addresses, dates or notes never raise; they surface as absent values or as
 * an order without items and a confidence of {@code 0.0}, which callers should route to review.
 * <p>
 * Lines that did not match the catalog score {@link ProductLineExtractor#UNMATCHED_CONFIDENCE},
 * which is below the default keep threshold, so they never reach the order.
 */
public class OrderAssembler {
    private static final Logger LOGGER = AppLogger.get();

    public static final String ORDER_ID_PREFIX = "ORD-";
    public static final String PLACEHOLDER_ORDER_ID = ORDER_ID_PREFIX + "TEMP";
    public static final String UNKNOWN_CUSTOMER = "unknown@email.com";

    private static final DateTimeFormatter ORDER_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final ProductLineExtractor productLineExtractor;
    private final ValidationEngine validationEngine;
    private final DeliveryDetailsExtractor deliveryDetailsExtractor;
    private final NotesExtractor notesExtractor;
    private final ExtractionSettings settings;
    private final Clock clock;

    public OrderAssembler(ProductLineExtractor productLineExtractor,
                          ValidationEngine validationEngine,
                          DeliveryDetailsExtractor deliveryDetailsExtractor,
                          NotesExtractor notesExtractor,
                          ExtractionSettings settings,
                          Clock clock) {
        this.productLineExtractor = Objects.requireNonNull(productLineExtractor, "productLineExtractor");
        this.validationEngine = Objects.requireNonNull(validationEngine, "validationEngine");
        this.deliveryDetailsExtractor = Objects.requireNonNull(deliveryDetailsExtractor, "deliveryDetailsExtractor");
        this.notesExtractor = Objects.requireNonNull(notesExtractor, "notesExtractor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Wires the default pipeline around a loaded catalog.
     */
    public static OrderAssembler create(CatalogIndex catalog, ExtractionSettings settings, Clock clock) {
        return new OrderAssembler(
            new ProductLineExtractor(catalog, settings),
            new ValidationEngine(catalog, settings),
            new DeliveryDetailsExtractor(new DeliveryDateResolver(clock)),
            new NotesExtractor(),
            settings,
            clock
        );
    }

    public static OrderAssembler create(CatalogIndex catalog) {
        return create(catalog, ExtractionSettings.defaults(), Clock.systemDefaultZone());
    }

    public Order assemble(EmailContent email) {
        Objects.requireNonNull(email, "email");
        return assemble(email.rawContent(), email.sender(), email.receivedAt());
    }

    /**
     * @param rawText    email body
     * @param sender     sender address, may be {@code null}
     * @param receivedAt receipt time, may be {@code null}
     */
    public Order assemble(String rawText, String sender, LocalDateTime receivedAt) {
        String text = rawText == null ? "" : rawText;

        List<OrderItem> items = new ArrayList<>();
        for (ExtractedLine line : productLineExtractor.extract(text)) {
            if (line.confidence() < settings.keepConfidence()) {
                LOGGER.fine("Dropping low-confidence line '%s' (%.2f)".formatted(line.rawPhrase(), line.confidence()));
                continue;
            }
            items.add(toItem(line));
        }

        DeliveryDetails deliveryDetails = deliveryDetailsExtractor.extract(text);
        String notes = notesExtractor.extract(text).orElse(null);

        Order order = new Order(
            orderId(receivedAt),
            sender == null || sender.isBlank() ? UNKNOWN_CUSTOMER : sender.trim(),
            items,
            deliveryDetails,
            notes,
            OrderStatus.PENDING,
            clock.instant()
        );
        LOGGER.info("Assembled order %s with %d item(s), confidence %.2f, %d issue(s)".formatted(
            order.orderId(), order.items().size(), order.totalConfidenceScore(), order.validationIssues().size()));
        return order;
    }

    private OrderItem toItem(ExtractedLine line) {
        Product product = line.product();
        ValidationResult result = validationEngine.validate(product, line.quantity(), line.rawPhrase());
        return new OrderItem(
            product != null ? product.code() : line.rawPhrase(),
            line.quantity(),
            line.confidence(),
            product != null ? product.price() : 0.0,
            result.valid() ? List.of() : result.issues(),
            result.valid() ? List.of() : result.suggestions()
        );
    }

    static String orderId(LocalDateTime receivedAt) {
        return receivedAt == null ? PLACEHOLDER_ORDER_ID : ORDER_ID_PREFIX + ORDER_ID_FORMAT.format(receivedAt);
    }
}
