package com.tradesim.engine;

import java.util.HashMap;
import java.util.Map;

/**
 * Mutable per-run scratch space for a {@link SignalStrategy}.
 */
public class SignalContext {

    private final Map<String, Object> attributes = new HashMap<>();

    public void put(String key, Object value) {
        attributes.put(key, value);
    }

    public <T> T get(String key, Class<T> type) {
        Object value = attributes.get(key);
        return value != null ? type.cast(value) : null;
    }

    public <T> T getOrDefault(String key, Class<T> type, T defaultValue) {
        T value = get(key, type);
        return value != null ? value : defaultValue;
    }

    public boolean contains(String key) {
        return attributes.containsKey(key);
    }

    public void remove(String key) {
        attributes.remove(key);
    }

    public void clear() {
        attributes.clear();
    }
}
