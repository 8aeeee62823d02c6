package com.orderintake.core.email;

import com.orderintake.core.model.EmailContent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmailTextReaderTest {

    @TempDir
    Path tempDir;

    private final EmailTextReader reader = new EmailTextReader();

    @Test
    void splitsHeaderBlockFromBody() {
        String content = String.join("\n",
            "From: Jane Buyer <jane@example.com>",
            "Subject: PO for October",
            "Date: Fri, 16 Oct 2026 10:15:00 +0900",
            "Thread-Id: t-42",
            "",
            "Please order ABC-123, 5 pieces",
            "Thanks"
        );

        EmailContent email = reader.parse(content);

        assertEquals("jane@example.com", email.sender());
        assertEquals("PO for October", email.subject());
        assertEquals("t-42", email.threadId());
        assertEquals(LocalDateTime.of(2026, 10, 16, 10, 15, 0), email.receivedAt());
        assertEquals("Please order ABC-123, 5 pieces\nThanks", email.rawContent());
    }

    @Test
    void textWithoutHeadersIsBodyOnly() {
        String content = "Ship to: 123 Main Street, Springfield\n\nNeed 10 pcs of SuperWidget";

        EmailContent email = reader.parse(content);

        assertEquals(content, email.rawContent());
        assertNull(email.sender());
        assertNull(email.receivedAt());
    }

    @Test
    void acceptsIsoDateAndBareAddress() {
        assertEquals(LocalDateTime.of(2026, 10, 16, 8, 0), EmailTextReader.parseDate("2026-10-16T08:00:00"));
        assertNull(EmailTextReader.parseDate("sometime last week"));
        assertEquals("jane@example.com", EmailTextReader.extractAddress(" jane@example.com "));
    }

    @Test
    void readFallsBackToFileTimestamp() throws IOException {
        Path file = tempDir.resolve("order.txt");
        Files.writeString(file, "Need 10 pcs of SuperWidget");
        LocalDateTime modified = LocalDateTime.of(2026, 10, 15, 12, 0, 0);
        Files.setLastModifiedTime(file, FileTime.from(modified.atZone(ZoneId.systemDefault()).toInstant()));

        EmailContent email = reader.read(file);

        assertEquals(modified, email.receivedAt());
        assertTrue(email.rawContent().contains("SuperWidget"));
    }
}
