package com.spanql.telemetry.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered attribute bag shared by spans, resources, events, links and instrumentation scopes.
 *
 * <p>Values are plain Java types as produced by the decoder: {@link String}, {@link Long}/{@link Integer},
 * {@link Double}/{@link Float}, {@link Boolean}, {@link java.util.List} and nested {@link Map}.
 */
@JsonInclude(Include.NON_NULL)
public final class AttributeMap {
    private static final AttributeMap EMPTY = new AttributeMap(Collections.emptyMap());

    private final Map<String, Object> attributes;

    public AttributeMap() {
        this.attributes = new LinkedHashMap<>();
    }

    @JsonCreator
    public AttributeMap(Map<String, Object> attributes) {
        if (attributes != null) {
            this.attributes = new LinkedHashMap<>(attributes);
        } else {
            this.attributes = new LinkedHashMap<>();
        }
    }

    public static AttributeMap empty() {
        return EMPTY;
    }

    /** Builds a map from alternating key/value arguments. */
    public static AttributeMap of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("attribute key/value arguments must come in pairs");
        }
        AttributeMap map = new AttributeMap();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    /** expose as plain JSON object: {"k":"v"} */
    @JsonAnyGetter
    public Map<String, Object> map() {
        return Collections.unmodifiableMap(attributes);
    }

    /** accept arbitrary keys on input */
    @JsonAnySetter
    public void put(String key, Object value) {
        if (this == EMPTY) throw new UnsupportedOperationException("the shared empty attribute map is read-only");
        if (key != null && value != null) attributes.put(key, value);
    }

    public Object get(String key) {
        return key == null ? null : attributes.get(key);
    }

    public boolean containsKey(String key) {
        return key != null && attributes.containsKey(key);
    }

    public int size() {
        return attributes.size();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    /**
     * Resolves a dotted name. An exact key wins; otherwise the name is split at each dot and the prefix is
     * looked up as a nested map holding the remainder.
     */
    public Object lookup(String name) {
        if (name == null) return null;
        return lookup(attributes, name);
    }

    @SuppressWarnings("unchecked")
    private static Object lookup(Map<String, Object> map, String name) {
        Object direct = map.get(name);
        if (direct != null) return direct;
        int dot = name.indexOf('.');
        while (dot > 0 && dot < name.length() - 1) {
            Object prefix = map.get(name.substring(0, dot));
            if (prefix instanceof Map<?, ?> nested) {
                Object found = lookup((Map<String, Object>) nested, name.substring(dot + 1));
                if (found != null) return found;
            }
            dot = name.indexOf('.', dot + 1);
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof AttributeMap other && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }
}
