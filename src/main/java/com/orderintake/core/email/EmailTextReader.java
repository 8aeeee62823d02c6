package com.orderintake.core.email;

import com.orderintake.core.model.EmailContent;
import com.orderintake.logging.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a saved email into {@link EmailContent}.
 * <p>
 * A leading block of {@code Name: value} headers terminated by a blank line is recognised when it
 * contains at least one of {@code From}, {@code Subject}, {@code Date} or {@code Thread-Id}; the
 * remainder becomes the body. Files without such a block are taken as body only.
 */
public class EmailTextReader {
    private static final Logger LOGGER = AppLogger.get();

    private static final String HEADER_FROM = "from";
    private static final String HEADER_SUBJECT = "subject";
    private static final String HEADER_DATE = "date";
    private static final String HEADER_THREAD_ID = "thread-id";
    private static final List<String> KNOWN_HEADERS = List.of(HEADER_FROM, HEADER_SUBJECT, HEADER_DATE, HEADER_THREAD_ID);

    private static final Pattern HEADER_LINE = Pattern.compile("^([A-Za-z][A-Za-z0-9-]*):\\s*(.*)$");
    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^>]+)>");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    public EmailContent read(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        EmailContent email = parse(content);
        if (email.receivedAt() != null) {
            return email;
        }
        LocalDateTime modified = LocalDateTime.ofInstant(Files.getLastModifiedTime(file).toInstant(), ZoneId.systemDefault());
        return new EmailContent(email.rawContent(), email.subject(), email.sender(), modified, email.threadId());
    }

    public EmailContent parse(String content) {
        if (content == null) {
            return EmailContent.of("");
        }
        String[] lines = LINE_BREAK.split(content, -1);
        Map<String, String> headers = new LinkedHashMap<>();
        int bodyStart = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                bodyStart = i + 1;
                break;
            }
            Matcher m = HEADER_LINE.matcher(line);
            if (!m.matches()) {
                headers.clear();
                break;
            }
            headers.putIfAbsent(m.group(1).toLowerCase(Locale.ROOT), m.group(2).trim());
        }

        boolean hasHeaderBlock = bodyStart > 0 && headers.keySet().stream().anyMatch(KNOWN_HEADERS::contains);
        if (!hasHeaderBlock) {
            return EmailContent.of(content);
        }

        String body = String.join("\n", Arrays.asList(lines).subList(bodyStart, lines.length));
        return new EmailContent(
            body,
            headers.get(HEADER_SUBJECT),
            extractAddress(headers.get(HEADER_FROM)),
            parseDate(headers.get(HEADER_DATE)),
            headers.get(HEADER_THREAD_ID)
        );
    }

    static String extractAddress(String from) {
        if (from == null || from.isBlank()) {
            return null;
        }
        Matcher m = ANGLE_ADDRESS.matcher(from);
        return m.find() ? m.group(1).trim() : from.trim();
    }

    static LocalDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException rfcFailure) {
            try {
                return LocalDateTime.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            } catch (DateTimeParseException isoFailure) {
                LOGGER.fine("Ignoring unparseable Date header: " + value);
                return null;
            }
        }
    }
}
