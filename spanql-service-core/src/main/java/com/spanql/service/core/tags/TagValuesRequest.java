package com.spanql.service.core.tags;

/**
 * Distinct values of {@code tag} (an attribute or intrinsic, written as in a query) over spans matching
 * {@code query}. A blank query matches every span; a zero limit takes the configured default.
 */
public record TagValuesRequest(String tag, String query, long startNanos, long endNanos, int limit) {}
