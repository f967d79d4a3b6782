package com.spanql.service.core.tags;

import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.ast.Static;
import com.spanql.service.core.config.SearchProperties;
import com.spanql.service.core.conditions.FetchSpansRequest;
import com.spanql.service.core.engine.CompiledQuery;
import com.spanql.service.core.engine.TraceQLEngine;
import com.spanql.service.core.eval.FieldEvaluator;
import com.spanql.service.core.eval.Spanset;
import com.spanql.service.core.parser.Parser;
import com.spanql.service.core.spi.CandidateIndex;
import com.spanql.service.core.spi.TraceShard;
import com.spanql.service.core.spi.TraceSource;
import com.spanql.telemetry.model.Trace;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Autocomplete support: the distinct values one attribute takes on spans matching a query. */
@Service
@Slf4j
public class TagValuesService {
    private static final String MATCH_ALL = "{ }";

    private final TraceQLEngine engine;
    private final TraceSource traceSource;
    private final Optional<CandidateIndex> candidateIndex;
    private final SearchProperties properties;

    public TagValuesService(
            TraceQLEngine engine,
            TraceSource traceSource,
            Optional<CandidateIndex> candidateIndex,
            SearchProperties properties) {
        this.engine = engine;
        this.traceSource = traceSource;
        this.candidateIndex = candidateIndex;
        this.properties = properties;
    }

    public TagValuesResponse tagValues(TagValuesRequest request) {
        Attribute tag = Parser.parseAttribute(request.tag());
        String queryText = request.query() == null || request.query().isBlank() ? MATCH_ALL : request.query();
        int limit = request.limit() > 0 ? Math.min(request.limit(), properties.getMaxLimit()) : properties.getDefaultLimit();

        CompiledQuery query = engine.compile(queryText, request.startNanos(), request.endNanos());
        FetchSpansRequest fetch = query.fetchRequest();
        Set<String> candidates = candidateIndex.flatMap(index -> index.candidates(fetch)).orElse(null);

        Set<Static> seen = new LinkedHashSet<>();
        for (TraceShard shard : traceSource.shards(fetch)) {
            try (Stream<Trace> stream = shard.open()) {
                Iterator<Trace> traces = stream.iterator();
                while (traces.hasNext()) {
                    Trace trace = traces.next();
                    if (candidates != null && !candidates.contains(trace.getTraceId())) {
                        continue;
                    }
                    for (Spanset spanset : query.evaluate(trace)) {
                        for (int index : spanset.indexes()) {
                            for (Static value : FieldEvaluator.resolveAll(tag, spanset.tree(), index)) {
                                seen.add(value);
                                if (seen.size() >= limit) {
                                    log.debug("Tag values for {} truncated at {}", tag, limit);
                                    return response(seen, true);
                                }
                            }
                        }
                    }
                }
            }
        }
        return response(seen, false);
    }

    private static TagValuesResponse response(Set<Static> values, boolean truncated) {
        List<TagValue> out = new ArrayList<>(values.size());
        for (Static value : values) {
            out.add(new TagValue(value.type().name().toLowerCase(Locale.ROOT), value.toJavaValue()));
        }
        return new TagValuesResponse(out, truncated);
    }
}
