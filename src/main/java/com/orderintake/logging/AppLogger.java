package com.orderintake.logging;

import java.io.IOException;
import java.util.Locale;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the shared logger for the order intake pipeline.
 * <p>
 * {@code -Dorderintake.log.level} lowers or raises the level (e.g. {@code FINE} shows the
 * extracted address, date and skipped lines); {@code -Dorderintake.log.file} adds a file sink.
 */
public final class AppLogger {
    static final String LOGGER_NAME = "com.orderintake.OrderIntake";
    static final String LOG_FILE_PROPERTY = "orderintake.log.file";
    static final String LOG_LEVEL_PROPERTY = "orderintake.log.level";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    /**
     * Level named by {@code -Dorderintake.log.level} (e.g. {@code FINE}), {@code INFO} when unset.
     *
     * @throws IllegalArgumentException if the name is not a {@link Level}
     */
    static Level resolveLevel(String name) {
        if (name == null || name.isBlank()) {
            return Level.INFO;
        }
        return Level.parse(name.trim().toUpperCase(Locale.ROOT));
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String message = formatMessage(record);
                if (record.getThrown() != null) {
                    message = message + " (" + record.getThrown() + ")";
                }
                return "%s %s%n".formatted(record.getLevel().getName(), message);
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (IOException ex) {
            logger.fine("Console logging uses the platform encoding: " + ex.getMessage());
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);
        String levelName = System.getProperty(LOG_LEVEL_PROPERTY);
        try {
            logger.setLevel(resolveLevel(levelName));
        } catch (IllegalArgumentException ex) {
            logger.warning("Unknown log level '%s'; staying at INFO".formatted(levelName));
        }

        String logFile = System.getProperty(LOG_FILE_PROPERTY);
        if (logFile != null && !logFile.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(logFile.trim(), true);
                fileHandler.setFormatter(formatter);
                fileHandler.setEncoding(UTF_8.name());
                fileHandler.setLevel(Level.ALL);
                logger.addHandler(fileHandler);
            } catch (IOException ex) {
                logger.warning("Failed to initialize file logging at " + logFile + ": " + ex.getMessage());
            }
        }
        return logger;
    }
}
