package org.stianloader.shyresolve;

import java.io.PrintStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.shyresolve.popularity.PopularityThreshold;
import org.stianloader.shyresolve.version.VersionScheme;

/**
 * The effective configuration of shyresolve. It is constructed once, validated eagerly and then handed to
 * every component, so no component reads process-wide state on its own.
 *
 * <p>Each setting is looked up by its (environment variable) name. Unset or blank settings use their default.
 * Malformed settings cause a {@link ConfigurationException} to be thrown by {@link #fromEnvironment(Function)}.
 */
public final class ShyConfiguration {

    public static final String ENV_UNTRUSTED = "SHYRESOLVE_UNTRUSTED";
    public static final String ENV_POPULARITY = "SHYRESOLVE_POPULARITY";
    public static final String ENV_CACHE = "SHYRESOLVE_CACHE";
    public static final String ENV_STATS_API_URL = "SHYRESOLVE_STATS_API_URL";
    public static final String ENV_MAX_CACHE_AGE = "SHYRESOLVE_MAX_CACHE_AGE";
    public static final String ENV_STATS_TIMEOUT = "SHYRESOLVE_STATS_TIMEOUT";
    public static final String ENV_DUMP_CONFIG = "SHYRESOLVE_DUMP_CONFIG";
    public static final String ENV_PROMPT = "SHYRESOLVE_PROMPT";
    public static final String ENV_LOG_FILE = "SHYRESOLVE_LOG_FILE";
    public static final String ENV_STATS_DOMAINS = "SHYRESOLVE_STATS_DOMAINS";
    public static final String ENV_VERSION_SCHEME = "SHYRESOLVE_VERSION_SCHEME";

    public static final String DEFAULT_UNTRUSTED = "pypi.org,files.pythonhosted.org";
    public static final String DEFAULT_STATS_API_URL = "https://pypistats.org/api";
    public static final long DEFAULT_MAX_CACHE_AGE_MINUTES = 1440;
    public static final int DEFAULT_STATS_TIMEOUT_MILLIS = 10_000;
    public static final String DEFAULT_STATS_DOMAINS = "pypi.org";
    public static final VersionScheme DEFAULT_VERSION_SCHEME = VersionScheme.PEP440;

    private static final DateTimeFormatter CACHE_DIRECTORY_DATE = DateTimeFormatter.ofPattern("yyyyMMdd", Locale.ROOT);

    /**
     * Obtains the cache directory used when none is configured: {@code ~/.cache/shyresolve} if that directory
     * already exists (and the system is not windows), otherwise a directory named after the current date
     * within the temporary directory of the system.
     *
     * @param today The current date
     * @param tryHome Whether the home directory should be considered
     * @return The default cache directory
     */
    @NotNull
    public static Path defaultCacheDirectory(@NotNull LocalDate today, boolean tryHome) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
        if (tryHome && !windows) {
            String home = System.getProperty("user.home");
            if (home != null) {
                Path homeCache = Paths.get(home, ".cache", "shyresolve");
                if (Files.isDirectory(homeCache)) {
                    return homeCache;
                }
            }
        }
        return Paths.get(System.getProperty("java.io.tmpdir"), "shyresolve-cache-" + CACHE_DIRECTORY_DATE.format(today));
    }

    @NotNull
    public static ShyConfiguration defaults() {
        return ShyConfiguration.fromEnvironment((name) -> null);
    }

    /**
     * Builds the configuration from a lookup function, such as {@link System#getenv(String)} or {@link Map#get(Object)}.
     *
     * @param lookup Function mapping setting names to their raw values, returning null for unset settings
     * @return The validated configuration
     * @throws ConfigurationException If any setting is malformed
     */
    @NotNull
    public static ShyConfiguration fromEnvironment(@NotNull Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup may not be null");

        Set<String> untrusted = ShyConfiguration.parseDomains(ShyConfiguration.lookup(lookup, ENV_UNTRUSTED, DEFAULT_UNTRUSTED));

        PopularityThreshold threshold = PopularityThreshold.parse(ShyConfiguration.lookup(lookup, ENV_POPULARITY, ""));

        Path cacheDirectory;
        String cacheSetting = ShyConfiguration.lookup(lookup, ENV_CACHE, "");
        if (cacheSetting.isEmpty()) {
            cacheDirectory = ShyConfiguration.defaultCacheDirectory(LocalDate.now(), true);
        } else {
            cacheDirectory = ShyConfiguration.parsePath(ENV_CACHE, cacheSetting);
        }

        String urlSetting = ShyConfiguration.lookup(lookup, ENV_STATS_API_URL, DEFAULT_STATS_API_URL);
        URI statsApiURL;
        try {
            statsApiURL = new URI(urlSetting);
        } catch (Exception e) {
            throw new ConfigurationException(ENV_STATS_API_URL + " is not a valid URL: " + urlSetting, e);
        }
        String scheme = statsApiURL.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || statsApiURL.getHost() == null) {
            throw new ConfigurationException(ENV_STATS_API_URL + " must be an absolute http(s) URL, but it is " + urlSetting);
        }

        long maxAgeMinutes = ShyConfiguration.parseNonNegative(ENV_MAX_CACHE_AGE, ShyConfiguration.lookup(lookup, ENV_MAX_CACHE_AGE, Long.toString(DEFAULT_MAX_CACHE_AGE_MINUTES)));
        long timeoutMillis = ShyConfiguration.parseNonNegative(ENV_STATS_TIMEOUT, ShyConfiguration.lookup(lookup, ENV_STATS_TIMEOUT, Integer.toString(DEFAULT_STATS_TIMEOUT_MILLIS)));
        if (timeoutMillis == 0 || timeoutMillis > Integer.MAX_VALUE) {
            throw new ConfigurationException(ENV_STATS_TIMEOUT + " must be a positive number of milliseconds, but it is " + timeoutMillis);
        }

        String dumpConfig = ShyConfiguration.lookup(lookup, ENV_DUMP_CONFIG, "");

        String cannedAnswer = ShyConfiguration.lookup(lookup, ENV_PROMPT, "");
        if (cannedAnswer.isEmpty()) {
            cannedAnswer = null;
        } else {
            String normalized = cannedAnswer.toLowerCase(Locale.ROOT);
            if (!normalized.equals("yes") && !normalized.equals("no")) {
                throw new ConfigurationException(ENV_PROMPT + " must be either \"yes\" or \"no\", but it is \"" + cannedAnswer + "\"");
            }
        }

        String logSetting = ShyConfiguration.lookup(lookup, ENV_LOG_FILE, "");
        Path logFile = logSetting.isEmpty() ? null : ShyConfiguration.parsePath(ENV_LOG_FILE, logSetting);

        Set<String> statsDomains = ShyConfiguration.parseDomains(ShyConfiguration.lookup(lookup, ENV_STATS_DOMAINS, DEFAULT_STATS_DOMAINS));

        String schemeSetting = ShyConfiguration.lookup(lookup, ENV_VERSION_SCHEME, DEFAULT_VERSION_SCHEME.getName());
        VersionScheme versionScheme = VersionScheme.byName(schemeSetting).orElseThrow(() -> {
            return new ConfigurationException(ENV_VERSION_SCHEME + " must be one of " + Arrays.toString(VersionScheme.values()) + ", but it is \"" + schemeSetting + "\"");
        });

        return new ShyConfiguration(untrusted, threshold, cacheDirectory, statsApiURL, Duration.ofMinutes(maxAgeMinutes),
                (int) timeoutMillis, ShyConfiguration.isTruthy(dumpConfig), cannedAnswer, logFile, statsDomains, versionScheme);
    }

    @Contract(pure = true)
    public static boolean isTruthy(@Nullable String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("1") || normalized.equals("yes") || normalized.equals("true");
    }

    @NotNull
    private static String lookup(@NotNull Function<String, String> lookup, @NotNull String name, @NotNull String defaultValue) {
        String value = lookup.apply(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    @NotNull
    private static Set<String> parseDomains(@NotNull String value) {
        Set<String> domains = new LinkedHashSet<>();
        for (String domain : value.split(",")) {
            String trimmed = domain.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                domains.add(trimmed);
            }
        }
        return domains;
    }

    private static long parseNonNegative(@NotNull String name, @NotNull String value) {
        long parsed;
        try {
            parsed = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, but it is \"" + value + "\"", e);
        }
        if (parsed < 0) {
            throw new ConfigurationException(name + " may not be negative, but it is " + parsed);
        }
        return parsed;
    }

    @NotNull
    private static Path parsePath(@NotNull String name, @NotNull String value) {
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            throw new ConfigurationException(name + " is not a valid path: " + value, e);
        }
    }

    @NotNull
    private final Path cacheDirectory;
    @Nullable
    private final String cannedAnswer;
    private final boolean dumpConfig;
    @Nullable
    private final Path logFile;
    @NotNull
    private final Duration maxCacheAge;
    @NotNull
    private final URI statsApiURL;
    @NotNull
    private final Set<String> statsDomains;
    private final int statsTimeoutMillis;
    @NotNull
    private final PopularityThreshold threshold;
    @NotNull
    private final Set<String> untrustedDomains;
    @NotNull
    private final VersionScheme versionScheme;

    private ShyConfiguration(@NotNull Set<String> untrustedDomains, @NotNull PopularityThreshold threshold, @NotNull Path cacheDirectory,
            @NotNull URI statsApiURL, @NotNull Duration maxCacheAge, int statsTimeoutMillis, boolean dumpConfig,
            @Nullable String cannedAnswer, @Nullable Path logFile, @NotNull Set<String> statsDomains, @NotNull VersionScheme versionScheme) {
        this.untrustedDomains = Collections.unmodifiableSet(new LinkedHashSet<>(untrustedDomains));
        this.threshold = threshold;
        this.cacheDirectory = cacheDirectory;
        this.statsApiURL = statsApiURL;
        this.maxCacheAge = maxCacheAge;
        this.statsTimeoutMillis = statsTimeoutMillis;
        this.dumpConfig = dumpConfig;
        this.cannedAnswer = cannedAnswer;
        this.logFile = logFile;
        this.statsDomains = Collections.unmodifiableSet(new LinkedHashSet<>(statsDomains));
        this.versionScheme = versionScheme;
    }

    /**
     * Obtains the effective settings as name-value pairs, in the order they are documented.
     *
     * @return The effective settings
     */
    @NotNull
    public Map<String, String> asMap() {
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put(ENV_UNTRUSTED, String.join(",", this.untrustedDomains));
        settings.put(ENV_POPULARITY, this.threshold.toSpecification());
        settings.put(ENV_CACHE, this.cacheDirectory.toString());
        settings.put(ENV_STATS_API_URL, this.statsApiURL.toString());
        settings.put(ENV_MAX_CACHE_AGE, Long.toString(this.maxCacheAge.toMinutes()));
        settings.put(ENV_STATS_TIMEOUT, Integer.toString(this.statsTimeoutMillis));
        settings.put(ENV_DUMP_CONFIG, this.dumpConfig ? "1" : "");
        settings.put(ENV_PROMPT, this.cannedAnswer == null ? "" : this.cannedAnswer);
        settings.put(ENV_LOG_FILE, this.logFile == null ? "" : this.logFile.toString());
        settings.put(ENV_STATS_DOMAINS, String.join(",", this.statsDomains));
        settings.put(ENV_VERSION_SCHEME, this.versionScheme.getName());
        return settings;
    }

    @NotNull
    public Path getCacheDirectory() {
        return this.cacheDirectory;
    }

    @Nullable
    public String getCannedAnswer() {
        return this.cannedAnswer;
    }

    @Nullable
    public Path getLogFile() {
        return this.logFile;
    }

    @NotNull
    public Duration getMaxCacheAge() {
        return this.maxCacheAge;
    }

    @NotNull
    public URI getStatsApiURL() {
        return this.statsApiURL;
    }

    /**
     * Obtains the index domains whose packages are tracked by the statistics service. Statistics of
     * candidates from other domains are never requested.
     *
     * @return The tracked index domains, lowercase
     */
    @NotNull
    public Set<String> getStatsDomains() {
        return this.statsDomains;
    }

    public int getStatsTimeoutMillis() {
        return this.statsTimeoutMillis;
    }

    @NotNull
    public PopularityThreshold getThreshold() {
        return this.threshold;
    }

    @NotNull
    public Set<String> getUntrustedDomains() {
        return this.untrustedDomains;
    }

    @NotNull
    public VersionScheme getVersionScheme() {
        return this.versionScheme;
    }

    public boolean isDumpConfig() {
        return this.dumpConfig;
    }

    public void print(@NotNull PrintStream out) {
        this.asMap().forEach((name, value) -> out.println(name + "=" + value));
    }

    @Override
    public String toString() {
        return "ShyConfiguration" + Arrays.toString(this.asMap().entrySet().toArray());
    }
}
