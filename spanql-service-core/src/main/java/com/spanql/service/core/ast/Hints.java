package com.spanql.service.core.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/** Query hints from {@code with(name=value, ...)}. Unknown names are kept and ignored. */
public record Hints(Map<String, Static> values) {
    public static final String MOST_RECENT = "most_recent";
    public static final String ANCHOR_REGEX = "anchor_regex";

    private static final Hints NONE = new Hints(Map.of());

    public Hints {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Hints none() {
        return NONE;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Static value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value.type() == StaticType.BOOLEAN) {
            return value.isTrue();
        }
        if (value.type() == StaticType.STRING) {
            String s = value.asString();
            if ("true".equalsIgnoreCase(s)) return true;
            if ("false".equalsIgnoreCase(s)) return false;
        }
        return defaultValue;
    }

    /** Returns hints where {@code defaults} fill in names this instance does not set. */
    public Hints withDefaults(Map<String, ?> defaults) {
        if (defaults == null || defaults.isEmpty()) {
            return this;
        }
        Map<String, Static> merged = new LinkedHashMap<>();
        defaults.forEach((name, value) -> merged.put(name, Static.of(value)));
        merged.putAll(values);
        return new Hints(merged);
    }

    @Override
    public String toString() {
        return "with("
                + values.entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", "))
                + ")";
    }
}
