package no.boreas.config;

import no.boreas.errors.ValidationException;
import no.boreas.partition.PartitionKind;

import java.io.InputStream;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * Built once at startup and passed to every component. Any value that cannot be
 * parsed fails here with a {@link ValidationException}, never at first use.
 * </p>
 */
public record AppConfig(
        // Warehouse
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,

        // Incremental loading
        LocalDateTime ingestStartDate,
        int chunkDays,
        int parallelism,
        Duration httpTimeout,

        // Open-Meteo
        List<String> hourlyParams,
        String weatherTimezone,
        String archiveBaseUrl,
        String forecastBaseUrl,
        PartitionKind weatherPartitionKind,

        // NVE avalanche warnings
        String avalancheBaseUrl,
        String avalancheLanguageKey,
        int avalancheLookaheadDays,

        // Time
        ZoneId clockZoneId) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() throws ValidationException {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            throw new ValidationException("Unable to read application.properties", e);
        }
        return from(System.getenv(), System.getProperties(), p);
    }

    /**
     * Resolves every key from the three sources and validates the result.
     */
    public static AppConfig from(Map<String, String> env, Properties sys, Properties file)
            throws ValidationException {
        Sources s = new Sources(env, sys, file);

        String dbUrl = requireNonBlank("db.jdbcUrl",
                s.get("WAREHOUSE_JDBC_URL", "db.jdbcUrl", "jdbc:duckdb:boreas.duckdb"));
        String dbUser = s.get("DB_USERNAME", "db.username", "");
        String dbPass = s.get("DB_PASSWORD", "db.password", ""); // ok empty for embedded warehouse
        int poolMax = positiveInt("db.poolMax", s.get("DB_POOL_MAX", "db.poolMax", "1"));

        LocalDateTime startDate = parseStart(s.get("INGEST_START_DATE", "ingest.startDate", "2026-01-10T00:00"));
        int chunkDays = positiveInt("ingest.chunkDays", s.get("INGEST_CHUNK_DAYS", "ingest.chunkDays", "30"));
        int parallelism = positiveInt("ingest.parallelism",
                s.get("INGEST_PARALLELISM", "ingest.parallelism", "1"));
        Duration timeout = parseDuration("http.timeout", s.get("HTTP_TIMEOUT", "http.timeout", "PT30S"));

        List<String> params = parseList(s.get("WEATHER_HOURLY_PARAMS", "weather.hourlyParams",
                "temperature_2m,relative_humidity_2m,precipitation,windspeed_10m"));
        if (params.isEmpty())
            throw new ValidationException("weather.hourlyParams must name at least one metric");
        ZoneId zoneId = parseZone("clock.zone", s.get("CLOCK_ZONE", "clock.zone", "Europe/Oslo"));
        // upstream local times are compared against the clock when capping watermarks
        String weatherTz = s.get("WEATHER_TIMEZONE", "weather.timezone", zoneId.getId());
        if (!parseZone("weather.timezone", weatherTz).equals(zoneId))
            throw new ValidationException("weather.timezone (" + weatherTz + ") must match clock.zone ("
                    + zoneId.getId() + ")");
        String archiveUrl = requireNonBlank("weather.archiveBaseUrl", s.get("WEATHER_ARCHIVE_BASE_URL",
                "weather.archiveBaseUrl", "https://archive-api.open-meteo.com/v1"));
        String forecastUrl = requireNonBlank("weather.forecastBaseUrl", s.get("WEATHER_FORECAST_BASE_URL",
                "weather.forecastBaseUrl", "https://api.open-meteo.com/v1"));
        PartitionKind kind;
        try {
            kind = PartitionKind.fromConfig(s.get("WEATHER_PARTITION_KIND", "weather.partitionKind", "regions"));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("weather.partitionKind: " + e.getMessage(), e);
        }

        String avalancheUrl = requireNonBlank("avalanche.apiBaseUrl", s.get("AVALANCHE_API_BASE_URL",
                "avalanche.apiBaseUrl", "https://api01.nve.no/hydrology/forecast/avalanche/v6.3.0/api"));
        String languageKey = requireNonBlank("avalanche.languageKey",
                s.get("AVALANCHE_LANGUAGE_KEY", "avalanche.languageKey", "1"));
        int lookahead = nonNegativeInt("avalanche.lookaheadDays",
                s.get("AVALANCHE_LOOKAHEAD_DAYS", "avalanche.lookaheadDays", "7"));

        // constructor args must match record field order exactly
        return new AppConfig(
                dbUrl,
                dbUser,
                dbPass,
                poolMax,

                startDate,
                chunkDays,
                parallelism,
                timeout,

                params,
                weatherTz,
                trimSlash(archiveUrl),
                trimSlash(forecastUrl),
                kind,

                trimSlash(avalancheUrl),
                languageKey,
                lookahead,

                zoneId);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private record Sources(Map<String, String> env, Properties sys, Properties file) {
        String get(String envKey, String propKey, String def) {
            String v = env.get(envKey);
            if (v != null && !v.isBlank())
                return v.trim();
            String prop = sys.getProperty(propKey);
            if (prop != null && !prop.isBlank())
                return prop.trim();
            return file.getProperty(propKey, def).trim();
        }
    }

    private static String requireNonBlank(String key, String v) throws ValidationException {
        if (v == null || v.isBlank()) {
            throw new ValidationException("Missing required config value " + key
                    + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    /**
     * Accepts {@code yyyy-MM-ddTHH:mm[:ss]} or a plain date (midnight).
     */
    private static LocalDateTime parseStart(String v) throws ValidationException {
        try {
            if (v.length() == 10)
                return LocalDate.parse(v).atStartOfDay();
            return LocalDateTime.parse(v);
        } catch (DateTimeParseException e) {
            throw new ValidationException("ingest.startDate is not an ISO date or date-time: " + v, e);
        }
    }

    private static int positiveInt(String key, String v) throws ValidationException {
        int n = parseInt(key, v);
        if (n < 1)
            throw new ValidationException(key + " must be >= 1, got " + n);
        return n;
    }

    private static int nonNegativeInt(String key, String v) throws ValidationException {
        int n = parseInt(key, v);
        if (n < 0)
            throw new ValidationException(key + " must be >= 0, got " + n);
        return n;
    }

    private static int parseInt(String key, String v) throws ValidationException {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " is not an integer: " + v, e);
        }
    }

    private static Duration parseDuration(String key, String v) throws ValidationException {
        try {
            Duration d = Duration.parse(v);
            if (d.isNegative() || d.isZero())
                throw new ValidationException(key + " must be positive, got " + v);
            return d;
        } catch (DateTimeParseException e) {
            throw new ValidationException(key + " is not an ISO-8601 duration: " + v, e);
        }
    }

    private static ZoneId parseZone(String key, String v) throws ValidationException {
        try {
            return ZoneId.of(v);
        } catch (DateTimeException e) {
            throw new ValidationException(key + " is not a valid time zone: " + v, e);
        }
    }

    /**
     * Parses a comma separated list, dropping blanks.
     */
    private static List<String> parseList(String s) {
        List<String> out = new ArrayList<>();
        for (String part : s.split(",")) {
            if (!part.isBlank())
                out.add(part.trim());
        }
        return List.copyOf(out);
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
