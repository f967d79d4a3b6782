package com.spanql.service.core.engine;

import com.spanql.service.core.ast.RootExpr;
import com.spanql.service.core.conditions.ConditionCompiler;
import com.spanql.service.core.conditions.FetchSpansRequest;
import com.spanql.service.core.eval.Evaluator;
import com.spanql.service.core.parser.Parser;
import com.spanql.service.core.parser.QueryException;
import com.spanql.service.core.parser.SemanticException;
import com.spanql.service.core.telemetry.SearchTelemetry;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Parses and compiles queries. Rejected queries surface as {@link QueryException}s before any scanning. */
@Component
@Slf4j
@RequiredArgsConstructor
public class TraceQLEngine {
    private final SearchTelemetry telemetry;

    public RootExpr parse(String query) {
        try {
            return Parser.parse(query);
        } catch (QueryException e) {
            telemetry.recordQueryRejected(e instanceof SemanticException ? "semantic" : "syntax");
            throw e;
        }
    }

    public CompiledQuery compile(String query, long startNanos, long endNanos) {
        return compile(query, startNanos, endNanos, Map.of());
    }

    /**
     * @param hintDefaults hints applied when the query's own {@code with(...)} does not set them
     */
    public CompiledQuery compile(String query, long startNanos, long endNanos, Map<String, ?> hintDefaults) {
        RootExpr parsed = parse(query);
        RootExpr root = new RootExpr(parsed.pipeline(), parsed.hints().withDefaults(hintDefaults));
        FetchSpansRequest request = ConditionCompiler.compile(root, startNanos, endNanos);
        if (log.isDebugEnabled()) {
            log.debug(
                    "Compiled query [{}] -> conditions={} all={} unconstrained={}",
                    root,
                    request.conditions(),
                    request.allConditions(),
                    request.unconstrained());
        }
        return new CompiledQuery(root, request, new Evaluator(root, telemetry));
    }
}
