package org.stianloader.shyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.shyresolve.logging.AuditLog;
import org.stianloader.shyresolve.logging.LoggingAdapter;

public class LoggingAdapterTest {

    @TempDir
    Path logDir;

    @Test
    public void testAuditLogAppends() throws IOException {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        Path file = this.logDir.resolve("nested").resolve("audit.log");
        AuditLog log = new AuditLog(file, clock);
        log.record(LoggingAdapterTest.class, "{}: cache miss", "requests");
        clock.set(Instant.parse("2024-03-01T12:00:01Z"));
        log.record(LoggingAdapterTest.class, "{}: cache hit", "requests");

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(List.of("2024-03-01T12:00:00Z requests: cache miss", "2024-03-01T12:00:01Z requests: cache hit"), lines);
    }

    @Test
    public void testAuditLogWithoutFile() {
        new AuditLog(null, new MutableClock(Instant.EPOCH)).record(LoggingAdapterTest.class, "nothing to write");
    }

    @Test
    public void testFormatMessage() {
        assertEquals("a 1 b 2", LoggingAdapter.formatMessage("a {} b {}", 1, 2));
        assertEquals("a 1 b {}", LoggingAdapter.formatMessage("a {} b {}", 1));
        assertEquals("a 1 2", LoggingAdapter.formatMessage("a {}", 1, 2));
        assertEquals("no placeholders", LoggingAdapter.formatMessage("no placeholders"));

        String withThrowable = LoggingAdapter.formatMessage("failed {}", "requests", new IllegalStateException("boom"));
        assertTrue(withThrowable.startsWith("failed requests\njava.lang.IllegalStateException: boom"), withThrowable);
        assertFalse(withThrowable.contains("{}"));
    }
}
