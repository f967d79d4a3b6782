package com.spanql.service.core.ast;

/** Value tags for {@link Static}. {@link #ATTRIBUTE} marks an expression whose type is only known per span. */
public enum StaticType {
    NIL,
    INT,
    FLOAT,
    STRING,
    BOOLEAN,
    DURATION,
    STATUS,
    KIND,
    ARRAY,
    MAP,
    ATTRIBUTE;

    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == DURATION;
    }

    /** True when the type is fixed at parse time, i.e. not a per-span attribute value. */
    public boolean isKnown() {
        return this != ATTRIBUTE;
    }
}
