package no.boreas.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import no.boreas.errors.ApiFormatException;
import no.boreas.partition.GeoPartition;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Reshapes upstream payloads into one record per time step (weather) or per
 * published warning (avalanche), tagged with partition identity and ingestion time.
 */
public final class RecordNormalizer {
    static final String TIME = "time";

    // NVE fields mapped onto named record components; everything else goes to extras
    private static final Set<String> WARNING_FIELDS = Set.of(
            "RegId", "RegionId", "RegionName", "ValidFrom", "ValidTo", "DangerLevel", "MainText", "PublishTime");

    private RecordNormalizer() {
    }

    /**
     * Turns a columnar hourly block ({@code {field: [v0, v1, ...]}}) into one record
     * per index. Output keeps input order; ordering is not checked.
     */
    public static List<WeatherRecord> normalizeHourly(JsonNode hourly, GeoPartition partition, Instant ingestedAt)
            throws ApiFormatException {
        if (hourly == null || !hourly.isObject())
            throw new ApiFormatException("hourly block is missing or not an object for " + partition.id());
        JsonNode times = hourly.get(TIME);
        if (times == null || !times.isArray())
            throw new ApiFormatException("hourly block has no 'time' array for " + partition.id());

        int n = times.size();
        List<String> fields = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = hourly.fields(); it.hasNext();) {
            var e = it.next();
            if (!e.getValue().isArray())
                throw new ApiFormatException("hourly field '" + e.getKey() + "' is not an array for "
                        + partition.id());
            if (e.getValue().size() != n)
                throw new ApiFormatException("hourly field '" + e.getKey() + "' has " + e.getValue().size()
                        + " values but 'time' has " + n + " for " + partition.id());
            if (!TIME.equals(e.getKey()))
                fields.add(e.getKey());
        }

        List<WeatherRecord> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            LocalDateTime t = parseTime(times.get(i), TIME, i);
            Map<String, Double> metrics = new LinkedHashMap<>();
            for (String f : fields) {
                JsonNode v = hourly.get(f).get(i);
                if (v == null || v.isNull()) {
                    metrics.put(f, null);
                } else if (v.isNumber()) {
                    metrics.put(f, v.doubleValue());
                } else {
                    throw new ApiFormatException("hourly field '" + f + "' has non-numeric value at index " + i
                            + " for " + partition.id());
                }
            }
            out.add(new WeatherRecord(partition.id(), partition.name(), t, metrics, ingestedAt));
        }
        return out;
    }

    /**
     * Turns the NVE warning array for one region into records.
     */
    public static List<AvalancheWarningRecord> normalizeWarnings(JsonNode warnings, GeoPartition region,
            Instant ingestedAt) throws ApiFormatException {
        if (warnings == null || !warnings.isArray())
            throw new ApiFormatException("warnings payload is not an array for region " + region.id());

        List<AvalancheWarningRecord> out = new ArrayList<>(warnings.size());
        int i = 0;
        for (JsonNode w : warnings) {
            if (!w.isObject())
                throw new ApiFormatException("warning at index " + i + " is not an object for region "
                        + region.id());
            JsonNode regIdNode = w.get("RegId");
            if (regIdNode == null || !regIdNode.canConvertToLong())
                throw new ApiFormatException("warning at index " + i + " has no numeric RegId");
            LocalDateTime validFrom = parseTime(w.get("ValidFrom"), "ValidFrom", i);
            LocalDateTime validTo = parseTime(w.get("ValidTo"), "ValidTo", i);
            JsonNode publish = w.get("PublishTime");
            LocalDateTime publishTime = (publish == null || publish.isNull()) ? null
                    : parseTime(publish, "PublishTime", i);

            String regionId = textOr(w.get("RegionId"), region.id());
            String regionName = textOr(w.get("RegionName"), region.name());

            out.add(new AvalancheWarningRecord(
                    regIdNode.asLong(),
                    regionId,
                    regionName,
                    validFrom,
                    validTo,
                    dangerLevel(w.get("DangerLevel"), i),
                    textOr(w.get("MainText"), null),
                    publishTime,
                    ingestedAt,
                    extras(w)));
            i++;
        }
        return out;
    }

    /**
     * Danger level arrives as a number or a numeric string. 0 means "not assessed".
     */
    static int dangerLevel(JsonNode n, int index) throws ApiFormatException {
        if (n == null || n.isNull())
            throw new ApiFormatException("warning at index " + index + " has no DangerLevel");
        int level;
        if (n.isIntegralNumber()) {
            level = n.asInt();
        } else {
            try {
                level = Integer.parseInt(n.asText().trim());
            } catch (NumberFormatException e) {
                throw new ApiFormatException("warning at index " + index + " has non-numeric DangerLevel '"
                        + n.asText() + "'", e);
            }
        }
        if (level < 0 || level > 5)
            throw new ApiFormatException("warning at index " + index + " has DangerLevel " + level
                    + " outside 0..5");
        return level;
    }

    private static LocalDateTime parseTime(JsonNode n, String field, int index) throws ApiFormatException {
        if (n == null || !n.isTextual())
            throw new ApiFormatException("'" + field + "' at index " + index + " is missing or not a string");
        String s = n.asText();
        try {
            return LocalDateTime.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(s).toLocalDateTime();
            } catch (DateTimeParseException e2) {
                throw new ApiFormatException("'" + field + "' at index " + index + " is not a timestamp: " + s, e2);
            }
        }
    }

    private static String textOr(JsonNode n, String def) {
        if (n == null || n.isNull())
            return def;
        return n.asText();
    }

    private static Map<String, Object> extras(JsonNode w) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = w.fields(); it.hasNext();) {
            var e = it.next();
            if (WARNING_FIELDS.contains(e.getKey()))
                continue;
            JsonNode v = e.getValue();
            Object value;
            if (v.isNull()) {
                value = null;
            } else if (v.isTextual()) {
                value = v.asText();
            } else if (v.isIntegralNumber()) {
                value = v.asLong();
            } else if (v.isNumber()) {
                value = v.asDouble();
            } else if (v.isBoolean()) {
                value = v.asBoolean();
            } else {
                value = v.toString(); // nested objects/arrays kept as JSON text
            }
            out.put(snakeCase(e.getKey()), value);
        }
        return out;
    }

    /**
     * {@code NextWarningTime} -> {@code next_warning_time}.
     */
    static String snakeCase(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean prevLowerOrDigit = i > 0
                        && (Character.isLowerCase(name.charAt(i - 1)) || Character.isDigit(name.charAt(i - 1)));
                boolean acronymEnd = i > 0 && Character.isUpperCase(name.charAt(i - 1))
                        && i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                if (prevLowerOrDigit || acronymEnd)
                    sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else {
                sb.append('_');
            }
        }
        return sb.toString();
    }
}
