package com.spanql.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Objects;
import lombok.Getter;

@JsonInclude(Include.NON_NULL)
@Getter
public final class InstrumentationScope {
    private final String name;
    private final String version;
    private final AttributeMap attributes;

    public InstrumentationScope(String name, String version, AttributeMap attributes) {
        this.name = name;
        this.version = version;
        this.attributes = (attributes == null ? AttributeMap.empty() : attributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof InstrumentationScope other
                && Objects.equals(name, other.name)
                && Objects.equals(version, other.version)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, attributes);
    }
}
