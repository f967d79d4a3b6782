package com.spanql.service.core.tags;

/** A distinct value with its type name, e.g. {@code string} or {@code duration}. */
public record TagValue(String type, Object value) {}
