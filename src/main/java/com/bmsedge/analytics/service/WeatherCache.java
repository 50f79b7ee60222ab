package com.bmsedge.analytics.service;

import com.bmsedge.analytics.exception.InvalidParameterException;
import com.bmsedge.analytics.model.WeatherObservation;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thread-safe LRU cache of weather ranges keyed by region and date range. Once maxEntries
 * ranges are held, the least recently used one is evicted.
 * Whoever creates the cache decides how long it lives.
 */
public class WeatherCache {

    public static final int DEFAULT_MAX_ENTRIES = 256;

    private final int maxEntries;
    private final Map<Key, List<WeatherObservation>> entries;

    public WeatherCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public WeatherCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new InvalidParameterException("maxEntries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, List<WeatherObservation>> eldest) {
                return size() > WeatherCache.this.maxEntries;
            }
        };
    }

    public synchronized List<WeatherObservation> get(String regionCode, LocalDate start, LocalDate end) {
        return entries.get(new Key(regionCode, start, end));
    }

    public synchronized List<WeatherObservation> getOrLoad(String regionCode, LocalDate start, LocalDate end,
                                                           Supplier<List<WeatherObservation>> loader) {
        return entries.computeIfAbsent(new Key(regionCode, start, end), k -> List.copyOf(loader.get()));
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public synchronized void clear() {
        entries.clear();
    }

    private static final class Key {
        private final String regionCode;
        private final LocalDate start;
        private final LocalDate end;

        private Key(String regionCode, LocalDate start, LocalDate end) {
            this.regionCode = regionCode;
            this.start = start;
            this.end = end;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return Objects.equals(regionCode, other.regionCode)
                    && Objects.equals(start, other.start)
                    && Objects.equals(end, other.end);
        }

        @Override
        public int hashCode() {
            return Objects.hash(regionCode, start, end);
        }

        @Override
        public String toString() {
            return regionCode + ":" + start + ":" + end;
        }
    }
}
