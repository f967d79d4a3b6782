package com.spanql.service.core.engine;

import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.ast.RootExpr;
import com.spanql.service.core.conditions.FetchSpansRequest;
import com.spanql.service.core.eval.Evaluator;
import com.spanql.service.core.eval.Spanset;
import com.spanql.telemetry.model.Trace;
import java.util.List;

/**
 * A parsed query ready to run: the AST with request hints applied, the fetch request for storage and the
 * evaluator. Immutable and safe to share between threads.
 */
public final class CompiledQuery {
    private final RootExpr root;
    private final FetchSpansRequest fetchRequest;
    private final Evaluator evaluator;

    CompiledQuery(RootExpr root, FetchSpansRequest fetchRequest, Evaluator evaluator) {
        this.root = root;
        this.fetchRequest = fetchRequest;
        this.evaluator = evaluator;
    }

    public RootExpr root() {
        return root;
    }

    public FetchSpansRequest fetchRequest() {
        return fetchRequest;
    }

    /** Attributes materialised on every returned span. */
    public List<Attribute> outputAttributes() {
        return fetchRequest.secondPassAttributes();
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    public List<Spanset> evaluate(Trace trace) {
        return evaluator.evaluate(trace);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
