package com.spanql.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Objects;
import lombok.Getter;

/**
 * Resource attributes shared by every span emitted from the same process. Spans of one trace hold references
 * to the same instance when their resources are equal.
 */
@JsonInclude(Include.NON_NULL)
@Getter
public final class Resource {
    public static final String SERVICE_NAME = "service.name";

    private static final Resource EMPTY = new Resource(AttributeMap.empty());

    private final AttributeMap attributes;

    public Resource(AttributeMap attributes) {
        this.attributes = attributes != null ? attributes : AttributeMap.empty();
    }

    public static Resource empty() {
        return EMPTY;
    }

    public static Resource ofService(String serviceName) {
        return new Resource(AttributeMap.of(SERVICE_NAME, serviceName));
    }

    /** Value of {@code service.name}, or null when absent or not a string. */
    public String getServiceName() {
        return attributes.get(SERVICE_NAME) instanceof String s ? s : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Resource other && Objects.equals(attributes, other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }
}
