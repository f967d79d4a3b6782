package com.spanql.service.core.ast;

import java.util.Optional;

public enum AggregateOp {
    COUNT("count"),
    AVG("avg"),
    MIN("min"),
    MAX("max"),
    SUM("sum");

    private final String functionName;

    AggregateOp(String functionName) {
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }

    public static Optional<AggregateOp> fromFunctionName(String name) {
        for (AggregateOp op : values()) {
            if (op.functionName.equals(name)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
