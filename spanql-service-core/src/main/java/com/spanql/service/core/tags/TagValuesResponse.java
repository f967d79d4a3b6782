package com.spanql.service.core.tags;

import java.util.List;

public record TagValuesResponse(List<TagValue> values, boolean truncated) {}
