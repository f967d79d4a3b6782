package com.spanql.service.core.eval;

import com.spanql.service.core.ast.Static;

/** A named value attached to a whole spanset, e.g. {@code count()} = 3 or {@code by(.region)} = "eu". */
public record SpansetAttribute(String name, Static value) {}
