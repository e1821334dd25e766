package org.stianloader.shyresolve.popularity.cache;

import java.io.IOException;
import java.io.Reader;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.shyresolve.logging.LoggingAdapter;
import org.stianloader.shyresolve.popularity.PopularityStats;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * {@link PopularityCache} storing one JSON record per package below {@code <cacheDirectory>/popularity/}.
 *
 * <p>Records are written to a temporary file next to the final location and are then moved in place,
 * so concurrent readers (including other processes) only ever see complete records. The modification
 * time of the temporary file is set from the {@link Clock} of this cache before the move, which makes
 * the modification time of the record the reference point for staleness checks.
 *
 * <p>A cache directory that exists as a regular file does not prevent construction. Reads then miss
 * and writes fail with an {@link IOException}, so the cache never stands in the way of a decision.
 */
public class FilePopularityCache implements PopularityCache {

    private static class CacheRecord {
        @SerializedName("fetched_at")
        private String fetchedAt;
        @SerializedName("last_day")
        private Long lastDay;
        @SerializedName("last_month")
        private Long lastMonth;
        @SerializedName("last_week")
        private Long lastWeek;
        @SerializedName("package")
        private String packageName;

        @Nullable
        private PopularityStats toStats(@NotNull String expectedPackage) {
            if (!expectedPackage.equals(this.packageName) || this.fetchedAt == null) {
                return null;
            }
            if (this.lastDay == null || this.lastWeek == null || this.lastMonth == null) {
                return null;
            }
            if (this.lastDay < 0 || this.lastWeek < 0 || this.lastMonth < 0) {
                return null;
            }
            try {
                return new PopularityStats(this.packageName, this.lastDay, this.lastWeek, this.lastMonth, Instant.parse(this.fetchedAt));
            } catch (DateTimeParseException e) {
                return null;
            }
        }
    }

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    @NotNull
    private final Path cacheDirectory;
    @NotNull
    private final Clock clock;

    public FilePopularityCache(@NotNull Path cacheDirectory, @NotNull Clock clock) {
        this.cacheDirectory = Objects.requireNonNull(cacheDirectory, "cacheDirectory may not be null");
        this.clock = Objects.requireNonNull(clock, "clock may not be null");
    }

    @Override
    @NotNull
    public Optional<CacheEntry> get(@NotNull String packageName) {
        if (this.isMisplaced()) {
            LoggingAdapter.getDefaultLogger().warn(FilePopularityCache.class, "The cache directory {} is not a directory; ignoring cached statistics of {}",
                    this.cacheDirectory.toAbsolutePath(), packageName);
            return Optional.empty();
        }
        Path file = this.getRecordPath(packageName);
        if (Files.notExists(file)) {
            LoggingAdapter.getDefaultLogger().debug(FilePopularityCache.class, "No cache record for {} at {}", packageName, file);
            return Optional.empty();
        }
        try {
            FileTime lastModified = Files.getLastModifiedTime(file);
            CacheRecord record;
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                record = GSON.fromJson(reader, CacheRecord.class);
            }
            PopularityStats stats = record == null ? null : record.toStats(packageName);
            if (stats == null) {
                LoggingAdapter.getDefaultLogger().debug(FilePopularityCache.class, "Ignoring incomplete cache record {}", file);
                return Optional.empty();
            }
            return Optional.of(new CacheEntry(stats, lastModified.toInstant()));
        } catch (IOException | JsonParseException e) {
            LoggingAdapter.getDefaultLogger().debug(FilePopularityCache.class, "Ignoring unreadable cache record {}: {}", file, e.toString());
            return Optional.empty();
        }
    }

    @NotNull
    @Contract(pure = true)
    public Path getCacheDirectory() {
        return this.cacheDirectory;
    }

    /**
     * Obtains the location of the record of a package. Package names are URL-encoded so that
     * names containing separators (such as maven coordinates) map to a single file name.
     *
     * @param packageName The name of the package
     * @return The path of the record, which may not exist
     */
    @NotNull
    @Contract(pure = true)
    public Path getRecordPath(@NotNull String packageName) {
        String fileName = URLEncoder.encode(packageName, StandardCharsets.UTF_8).replace("*", "%2A");
        return this.cacheDirectory.resolve("popularity").resolve(fileName + ".json");
    }

    /**
     * Whether the configured cache directory exists as something other than a directory.
     * Such a cache behaves as if it was always empty and refuses writes.
     *
     * @return True if the cache directory cannot be used
     */
    @Contract(pure = true)
    public boolean isMisplaced() {
        return Files.exists(this.cacheDirectory) && !Files.isDirectory(this.cacheDirectory);
    }

    @Override
    public void put(@NotNull String packageName, @NotNull PopularityStats stats) throws IOException {
        if (this.isMisplaced()) {
            throw new NotDirectoryException("The cache directory must point to a directory. It currently points to " + this.cacheDirectory.toAbsolutePath());
        }
        CacheRecord record = new CacheRecord();
        record.packageName = packageName;
        record.lastDay = stats.lastDay();
        record.lastWeek = stats.lastWeek();
        record.lastMonth = stats.lastMonth();
        record.fetchedAt = stats.fetchedAt().toString();

        Path target = this.getRecordPath(packageName);
        Path directory = target.getParent();
        Files.createDirectories(directory);
        Path part = Files.createTempFile(directory, target.getFileName().toString(), ".part");
        try {
            Files.write(part, GSON.toJson(record).getBytes(StandardCharsets.UTF_8));
            Files.setLastModifiedTime(part, FileTime.from(this.clock.instant()));
            try {
                Files.move(part, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(part);
        }
    }
}
