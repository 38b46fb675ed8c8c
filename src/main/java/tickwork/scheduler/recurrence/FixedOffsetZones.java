package tickwork.scheduler.recurrence;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Simplified timezone model: each supported zone name maps to one fixed UTC
 * offset. Daylight saving is deliberately not modelled.
 */
public final class FixedOffsetZones {

    public static final String UTC = "UTC";

    private static final Map<String, ZoneOffset> ZONES;

    static {
        Map<String, ZoneOffset> zones = new LinkedHashMap<>();
        zones.put(UTC, ZoneOffset.UTC);
        zones.put("America/New_York", ZoneOffset.ofHours(-5));
        zones.put("America/Los_Angeles", ZoneOffset.ofHours(-8));
        zones.put("America/Chicago", ZoneOffset.ofHours(-6));
        zones.put("America/Denver", ZoneOffset.ofHours(-7));
        zones.put("Europe/London", ZoneOffset.UTC);
        zones.put("Europe/Paris", ZoneOffset.ofHours(1));
        zones.put("Europe/Berlin", ZoneOffset.ofHours(1));
        zones.put("Asia/Tokyo", ZoneOffset.ofHours(9));
        zones.put("Asia/Shanghai", ZoneOffset.ofHours(8));
        zones.put("Asia/Kolkata", ZoneOffset.ofHoursMinutes(5, 30));
        zones.put("Asia/Dubai", ZoneOffset.ofHours(4));
        zones.put("Australia/Sydney", ZoneOffset.ofHours(11));
        zones.put("Pacific/Auckland", ZoneOffset.ofHours(13));
        ZONES = Collections.unmodifiableMap(zones);
    }

    private FixedOffsetZones() {
    }

    public static boolean isValid(String name) {
        return name != null && ZONES.containsKey(name);
    }

    public static Optional<ZoneOffset> find(String name) {
        return Optional.ofNullable(name != null ? ZONES.get(name) : null);
    }

    /**
     * Offset of a zone; unknown or missing names fall back to UTC.
     */
    public static ZoneOffset offsetOf(String name) {
        return find(name).orElse(ZoneOffset.UTC);
    }

    /** Convert a wall-clock time in the given zone to an instant */
    public static Instant toInstant(LocalDateTime local, String zone) {
        return local.toInstant(offsetOf(zone));
    }

    /** Convert an instant to wall-clock time in the given zone */
    public static LocalDateTime toLocal(Instant instant, String zone) {
        return LocalDateTime.ofInstant(instant, offsetOf(zone));
    }

    public static Map<String, ZoneOffset> all() {
        return ZONES;
    }
}
