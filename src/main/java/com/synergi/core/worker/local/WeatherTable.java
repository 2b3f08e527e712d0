package com.synergi.core.worker.local;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed weather readings for the built-in weather worker.
 */
final class WeatherTable {

    record Reading(int temp, String condition, int humidity, String wind) {}

    private static final Map<String, Reading> READINGS = Map.of(
            "new york", new Reading(22, "Partly Cloudy", 65, "12 km/h NW"),
            "london", new Reading(15, "Rainy", 80, "18 km/h SW"),
            "tokyo", new Reading(28, "Sunny", 55, "8 km/h E"),
            "mumbai", new Reading(33, "Humid", 90, "6 km/h SE"),
            "sydney", new Reading(25, "Clear", 50, "14 km/h NE"),
            "berlin", new Reading(12, "Overcast", 72, "20 km/h W"),
            "dubai", new Reading(40, "Hot", 30, "10 km/h S"),
            "paris", new Reading(18, "Cloudy", 68, "15 km/h NW")
    );

    private static final String[] CONDITIONS = {"Sunny", "Cloudy", "Rainy", "Windy"};

    private WeatherTable() {}

    /**
     * Reading for {@code city}; cities outside the table get a stable reading derived from the name.
     */
    static Reading lookup(String city) {
        String key = city.toLowerCase(Locale.ROOT).trim();
        Reading known = READINGS.get(key);
        if (known != null) {
            return known;
        }
        int h = Math.abs(key.hashCode());
        return new Reading(5 + h % 35, CONDITIONS[(h / 35) % CONDITIONS.length], 30 + (h / 7) % 60,
                (5 + (h / 11) % 25) + " km/h");
    }

    static String displayName(String city) {
        String trimmed = city.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        return Character.toUpperCase(trimmed.charAt(0)) + trimmed.substring(1).toLowerCase(Locale.ROOT);
    }
}
