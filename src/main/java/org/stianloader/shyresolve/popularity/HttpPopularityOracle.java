package org.stianloader.shyresolve.popularity;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLConnection;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.shyresolve.logging.LoggingAdapter;
import org.stianloader.shyresolve.popularity.cache.PopularityCache;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * {@link PopularityOracle} querying a pypistats-compatible HTTP API.
 *
 * <p>The statistics of a package are requested from {@code <base>/packages/<name>/recent}, which is expected to answer
 * with a 2xx status and a body such as
 * <pre>{"data": {"last_day": 1128, "last_month": 28830, "last_week": 7099}, "package": "sampleproject", "type": "recent_downloads"}</pre>
 * Anything else (other statuses, other shapes, negative or fractional counts) is reported as a failure.
 */
public class HttpPopularityOracle implements PopularityOracle {

    /**
     * The index tracked by pypistats.
     */
    public static final String PYPI_DOMAIN = "pypi.org";

    @NotNull
    private final URI base;
    @NotNull
    private final PopularityCache cache;
    @NotNull
    private final Clock clock;
    private final int timeoutMillis;
    @NotNull
    private final Set<String> trackedDomains;

    public HttpPopularityOracle(@NotNull URI base, int timeoutMillis, @NotNull PopularityCache cache, @NotNull Clock clock) {
        this(base, timeoutMillis, cache, clock, Collections.singleton(PYPI_DOMAIN));
    }

    public HttpPopularityOracle(@NotNull URI base, int timeoutMillis, @NotNull PopularityCache cache, @NotNull Clock clock,
            @NotNull Collection<@NotNull String> trackedDomains) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("The timeout must be positive, but it was " + timeoutMillis);
        }
        if (base.getPath() == null || base.getPath().isEmpty()) {
            base = base.resolve("/");
        } else if (!base.getPath().endsWith("/")) {
            base = base.resolve(base.getPath() + "/");
        }
        this.base = base;
        this.timeoutMillis = timeoutMillis;
        this.cache = Objects.requireNonNull(cache, "cache may not be null");
        this.clock = Objects.requireNonNull(clock, "clock may not be null");
        Set<String> domains = new LinkedHashSet<>();
        for (String domain : trackedDomains) {
            domains.add(domain.trim().toLowerCase(Locale.ROOT));
        }
        this.trackedDomains = Collections.unmodifiableSet(domains);
    }

    @Nullable
    private static Long readCount(@NotNull JsonObject data, @NotNull PopularityWindow window) {
        JsonElement element = data.get(window.getKey());
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        BigDecimal value = element.getAsBigDecimal();
        if (value.signum() < 0 || value.stripTrailingZeros().scale() > 0) {
            return null;
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    @Override
    @NotNull
    public FetchOutcome fetch(@NotNull String packageName) {
        URI resolved = this.getRequestURI(packageName);
        LoggingAdapter.getDefaultLogger().debug(HttpPopularityOracle.class, "Fetching download statistics of {} from {}", packageName, resolved);

        URLConnection connection = null;
        try {
            connection = resolved.toURL().openConnection();
            connection.setConnectTimeout(this.timeoutMillis);
            connection.setReadTimeout(this.timeoutMillis);
            connection.setRequestProperty("Accept", "application/json");
            if (connection instanceof HttpURLConnection) {
                HttpURLConnection httpUrlConn = (HttpURLConnection) connection;
                if ((httpUrlConn.getResponseCode() / 100) != 2) {
                    return FetchOutcome.failure(FetchFailure.BAD_STATUS, "Query for " + resolved + " returned with a response code of " + httpUrlConn.getResponseCode() + " (" + httpUrlConn.getResponseMessage() + ")");
                }
            }

            String body;
            try (InputStream is = connection.getInputStream()) {
                body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }

            PopularityStats stats = this.parseResponse(packageName, body);
            if (stats == null) {
                return FetchOutcome.failure(FetchFailure.MALFORMED_RESPONSE, "Query for " + resolved + " returned an unexpected response body");
            }

            try {
                this.cache.put(packageName, stats);
            } catch (IOException e) {
                LoggingAdapter.getDefaultLogger().warn(HttpPopularityOracle.class, "Unable to cache the download statistics of {}", packageName, e);
            }
            return FetchOutcome.success(stats);
        } catch (SocketTimeoutException e) {
            return FetchOutcome.failure(FetchFailure.TIMEOUT, "Query for " + resolved + " timed out after " + this.timeoutMillis + " ms");
        } catch (IOException | RuntimeException e) {
            return FetchOutcome.failure(FetchFailure.UNREACHABLE, "Query for " + resolved + " failed: " + e);
        } finally {
            if (connection instanceof HttpURLConnection) {
                ((HttpURLConnection) connection).disconnect();
            }
        }
    }

    @NotNull
    @Contract(pure = true)
    public URI getBase() {
        return this.base;
    }

    @NotNull
    @Contract(pure = true)
    public URI getRequestURI(@NotNull String packageName) {
        String segment = URLEncoder.encode(packageName, StandardCharsets.UTF_8).replace("+", "%20");
        return this.base.resolve("packages/" + segment + "/recent");
    }

    @NotNull
    @Contract(pure = true)
    public Set<String> getTrackedDomains() {
        return this.trackedDomains;
    }

    @Override
    public boolean isTracked(@NotNull String originDomain) {
        return this.trackedDomains.contains(originDomain.toLowerCase(Locale.ROOT));
    }

    @Nullable
    private PopularityStats parseResponse(@NotNull String packageName, @NotNull String body) {
        try {
            JsonElement root = JsonParser.parseString(body);
            if (!root.isJsonObject()) {
                return null;
            }
            JsonElement data = root.getAsJsonObject().get("data");
            if (data == null || !data.isJsonObject()) {
                return null;
            }
            JsonObject dataObject = data.getAsJsonObject();
            Long lastDay = HttpPopularityOracle.readCount(dataObject, PopularityWindow.LAST_DAY);
            Long lastWeek = HttpPopularityOracle.readCount(dataObject, PopularityWindow.LAST_WEEK);
            Long lastMonth = HttpPopularityOracle.readCount(dataObject, PopularityWindow.LAST_MONTH);
            if (lastDay == null || lastWeek == null || lastMonth == null) {
                return null;
            }
            return new PopularityStats(packageName, lastDay, lastWeek, lastMonth, this.clock.instant());
        } catch (JsonParseException | NumberFormatException e) {
            LoggingAdapter.getDefaultLogger().debug(HttpPopularityOracle.class, "Unparseable statistics response for {}: {}", packageName, e.toString());
            return null;
        }
    }
}
