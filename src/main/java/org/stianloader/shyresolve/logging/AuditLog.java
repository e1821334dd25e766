package org.stianloader.shyresolve.logging;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Collections;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Append-only trail of arbitration outcomes. Each record is mirrored to the
 * {@link LoggingAdapter} at info level and, if a log file is configured,
 * appended to it as a single timestamped line.
 *
 * <p>Failing to write the log file never aborts an arbitration, the failure is
 * reported through the {@link LoggingAdapter} instead.
 */
public class AuditLog {
    @NotNull
    private final Clock clock;
    @Nullable
    private final Path logFile;

    public AuditLog(@Nullable Path logFile, @NotNull Clock clock) {
        this.logFile = logFile;
        this.clock = Objects.requireNonNull(clock, "clock may not be null");
    }

    @Nullable
    public Path getLogFile() {
        return this.logFile;
    }

    public void record(@NotNull Class<?> source, @NotNull String message, Object @NotNull... args) {
        LoggingAdapter.getDefaultLogger().info(source, message, args);
        Path file = this.logFile;
        if (file == null) {
            return;
        }
        String line = this.clock.instant() + " " + LoggingAdapter.formatMessage(message, args);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null && Files.notExists(parent)) {
                Files.createDirectories(parent);
            }
            Files.write(file, Collections.singletonList(line), StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            LoggingAdapter.getDefaultLogger().warn(AuditLog.class, "Unable to append to audit log {}", file, e);
        }
    }
}
