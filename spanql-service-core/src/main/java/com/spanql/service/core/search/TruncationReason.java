package com.spanql.service.core.search;

/** Why a search returned before scanning everything in range. */
public enum TruncationReason {
    NONE,
    /** The most-recent shard budget was spent. */
    SCAN_BUDGET,
    /** The query deadline passed. */
    DEADLINE
}
