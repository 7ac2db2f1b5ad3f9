package no.boreas.openmeteo;

import com.fasterxml.jackson.databind.JsonNode;
import no.boreas.config.AppConfig;
import no.boreas.errors.ApiFormatException;
import no.boreas.errors.NetworkException;
import no.boreas.http.FetchClient;
import no.boreas.ingest.FetchWindow;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Open-Meteo archive and forecast endpoints.
 *
 * <p>
 * Both return a keyed-array hourly series under {@code hourly}; a response
 * without it is rejected as an API format error.
 * </p>
 */
public final class OpenMeteoClient {
    public static final String SERVICE = "OPEN_METEO";
    static final String HOURLY = "hourly";

    private final AppConfig cfg;
    private final FetchClient http;

    public OpenMeteoClient(AppConfig cfg, FetchClient http) {
        this.cfg = cfg;
        this.http = http;
    }

    /**
     * Historical hourly series for a point over an inclusive date window.
     */
    public JsonNode archive(double lat, double lon, FetchWindow window) throws NetworkException, ApiFormatException {
        Map<String, String> params = pointParams(lat, lon);
        params.put("start_date", window.start().toString());
        params.put("end_date", window.end().toString());
        params.put(HOURLY, String.join(",", cfg.hourlyParams()));
        params.put("timezone", cfg.weatherTimezone());
        return http.fetchObject(archiveUrl(), params, cfg.httpTimeout(), HOURLY).get(HOURLY);
    }

    /**
     * Forecast hourly series for a point (the endpoint decides the horizon).
     */
    public JsonNode forecast(double lat, double lon) throws NetworkException, ApiFormatException {
        Map<String, String> params = pointParams(lat, lon);
        params.put(HOURLY, String.join(",", cfg.hourlyParams()));
        params.put("timezone", cfg.weatherTimezone());
        return http.fetchObject(forecastUrl(), params, cfg.httpTimeout(), HOURLY).get(HOURLY);
    }

    public String archiveUrl() {
        return cfg.archiveBaseUrl() + "/archive";
    }

    public String forecastUrl() {
        return cfg.forecastBaseUrl() + "/forecast";
    }

    private static Map<String, String> pointParams(double lat, double lon) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("latitude", String.format(java.util.Locale.ROOT, "%.4f", lat));
        params.put("longitude", String.format(java.util.Locale.ROOT, "%.4f", lon));
        return params;
    }
}
