package no.boreas.nve;

import com.fasterxml.jackson.databind.JsonNode;
import no.boreas.config.AppConfig;
import no.boreas.errors.ApiFormatException;
import no.boreas.errors.NetworkException;
import no.boreas.http.FetchClient;
import no.boreas.ingest.FetchWindow;

import java.util.Map;

/**
 * NVE avalanche warning API (simple warnings by region).
 */
public final class NveAvalancheClient {
    public static final String SERVICE = "NVE";

    private final AppConfig cfg;
    private final FetchClient http;

    public NveAvalancheClient(AppConfig cfg, FetchClient http) {
        this.cfg = cfg;
        this.http = http;
    }

    /**
     * Warnings for one region whose validity starts inside the window. The payload
     * is a JSON array of warning objects.
     */
    public JsonNode warnings(String regionId, FetchWindow window) throws NetworkException, ApiFormatException {
        return http.fetchArray(warningsUrl(regionId, window), Map.of(), cfg.httpTimeout());
    }

    public String warningsUrl(String regionId, FetchWindow window) {
        return cfg.avalancheBaseUrl()
                + "/AvalancheWarningByRegion/Simple/"
                + regionId + "/"
                + cfg.avalancheLanguageKey() + "/"
                + window.start() + "/"
                + window.end();
    }
}
