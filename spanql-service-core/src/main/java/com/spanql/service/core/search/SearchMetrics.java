package com.spanql.service.core.search;

public record SearchMetrics(
        long inspectedTraces, long prunedTraces, int totalShards, int completedShards, int skippedShards) {}
