package com.orderintake.core.model;

import java.time.LocalDateTime;

/**
 * Email as handed over by the ingestion boundary. Only {@code rawContent} is required.
 */
public record EmailContent(String rawContent,
                           String subject,
                           String sender,
                           LocalDateTime receivedAt,
                           String threadId) {

    public EmailContent {
        if (rawContent == null) {
            throw new IllegalArgumentException("rawContent must not be null");
        }
        subject = blankToNull(subject);
        sender = blankToNull(sender);
        threadId = blankToNull(threadId);
    }

    public static EmailContent of(String rawContent) {
        return new EmailContent(rawContent, null, null, null, null);
    }

    public static EmailContent of(String rawContent, String sender, LocalDateTime receivedAt) {
        return new EmailContent(rawContent, null, sender, receivedAt, null);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
