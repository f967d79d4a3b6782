package com.spanql.service.core.eval;

import static com.spanql.service.core.support.TestTraces.chain;
import static com.spanql.service.core.support.TestTraces.load;
import static com.spanql.service.core.support.TestTraces.span;
import static com.spanql.service.core.support.TestTraces.trace;
import static com.spanql.service.core.support.TestTraces.traceId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.spanql.service.core.ast.Static;
import com.spanql.service.core.parser.Parser;
import com.spanql.service.core.telemetry.SearchTelemetry;
import com.spanql.telemetry.model.Span;
import com.spanql.telemetry.model.SpanKind;
import com.spanql.telemetry.model.Trace;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class EvaluatorTest {
    private final SearchTelemetry telemetry = mock(SearchTelemetry.class);
    private final Trace checkout = load("/traces/checkout.json");

    private List<Spanset> run(String query, Trace trace) {
        return new Evaluator(Parser.parse(query), telemetry).evaluate(trace);
    }

    private List<String> names(String query, Trace trace) {
        List<Spanset> result = run(query, trace);
        assertThat(result).hasSizeLessThanOrEqualTo(1);
        return result.isEmpty()
                ? List.of()
                : result.get(0).spans().stream().map(Span::getName).collect(Collectors.toList());
    }

    @Test
    void emptyFilterSelectsEverySpan() {
        assertThat(names("{ }", chain(1))).containsExactly("A", "B", "C");
    }

    @Test
    void childAndDescendantOperators() {
        assertThat(names("{ name = \"A\" } > { name = \"B\" }", chain(1))).containsExactly("B");
        assertThat(names("{ name = \"A\" } > { name = \"C\" }", chain(1))).isEmpty();
        assertThat(names("{ name = \"A\" } >> { name = \"C\" }", chain(1))).containsExactly("C");
    }

    @Test
    void parentAndAncestorOperators() {
        assertThat(names("{ name = \"B\" } < { name = \"A\" }", chain(1))).containsExactly("A");
        assertThat(names("{ name = \"C\" } << { name = \"A\" }", chain(1))).containsExactly("A");
        assertThat(names("{ name = \"A\" } << { name = \"C\" }", chain(1))).isEmpty();
    }

    @Test
    void siblingOperatorNeedsAnotherSpanUnderTheSameParent() {
        Trace trace = trace(2, span(1, 0, "root"), span(2, 1, "x"), span(3, 1, "y"));

        assertThat(names("{ name = \"x\" } ~ { name = \"y\" }", trace)).containsExactly("y");
        assertThat(names("{ name = \"x\" } ~ { name = \"x\" }", trace)).isEmpty();
        assertThat(names("{ name = \"root\" } ~ { }", trace)).isEmpty();
    }

    @Test
    void unionOperatorsKeepBothSides() {
        assertThat(names("{ name = \"A\" } &>> { name = \"C\" }", chain(1))).containsExactly("A", "C");
        assertThat(names("{ name = \"C\" } &> { name = \"A\" }", chain(1))).isEmpty();
    }

    @Test
    void negatedOperatorsSelectUnrelatedRightHandSpans() {
        assertThat(names("{ name = \"A\" } !> { name = \"C\" }", chain(1))).containsExactly("C");
        assertThat(names("{ name = \"A\" } !> { name = \"B\" }", chain(1))).isEmpty();
        assertThat(names("{ name = \"Z\" } !> { name = \"C\" }", chain(1))).isEmpty();
    }

    @Test
    void spansetAndOrCombineWholeSpansets() {
        assertThat(names("{ name = \"A\" } && { name = \"C\" }", chain(1))).containsExactly("A", "C");
        assertThat(names("{ name = \"A\" } && { name = \"Z\" }", chain(1))).isEmpty();
        assertThat(names("{ name = \"A\" } || { name = \"Z\" }", chain(1))).containsExactly("A");
    }

    @Test
    void regexesAreAnchoredUnlessTheHintSaysOtherwise() {
        Trace trace = trace(3, span(1, 0, "root").putAttribute("foo", "embedded-bar-text"));

        assertThat(names("{ span.foo =~ \"bar\" }", trace)).isEmpty();
        assertThat(names("{ span.foo =~ \".*bar.*\" }", trace)).containsExactly("root");
        assertThat(names("{ span.foo !~ \"bar\" }", trace)).containsExactly("root");
        assertThat(names("{ span.foo =~ \"bar\" } with(anchor_regex=false)", trace)).containsExactly("root");
    }

    @Test
    void countCountsSpansInTheSpanset() {
        Trace trace = trace(
                4,
                span(1, 0, "a").putAttribute("http.status_code", 200L),
                span(2, 1, "b").putAttribute("http.status_code", 200L),
                span(3, 1, "c").putAttribute("http.status_code", 200L),
                span(4, 1, "d").putAttribute("http.status_code", 500L));

        List<Spanset> result = run("{ span.http.status_code = 200 } | count() > 2", trace);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).size()).isEqualTo(3);
        assertThat(result.get(0).scalar()).isEqualTo(Static.ofInt(3));
        assertThat(result.get(0).attributes()).containsExactly(new SpansetAttribute("count()", Static.ofInt(3)));
        assertThat(run("{ span.http.status_code = 200 } | count() > 3", trace)).isEmpty();
    }

    @Test
    void nilComparisonsTestPresence() {
        Trace trace = trace(5, span(1, 0, "with").putAttribute("x", "y"), span(2, 1, "without"));

        assertThat(names("{ span.x != nil }", trace)).containsExactly("with");
        assertThat(names("{ .x = nil }", trace)).containsExactly("without");
        assertThat(names("{ .x != \"y\" }", trace)).isEmpty();
    }

    @Test
    void aggregatesOverNumericValues() {
        Trace trace = trace(
                6,
                span(1, 0, "a").putAttribute("n", 1L),
                span(2, 1, "b").putAttribute("n", 2L),
                span(3, 1, "c").putAttribute("n", 3L),
                span(4, 1, "d").putAttribute("n", "not a number"));

        assertThat(run("{ } | sum(span.n) = 6", trace)).hasSize(1);
        assertThat(run("{ } | max(span.n) = 3", trace)).hasSize(1);
        assertThat(run("{ } | min(span.n) = 1", trace)).hasSize(1);
        assertThat(run("{ } | avg(span.n) = 2", trace).get(0).scalar()).isEqualTo(Static.ofFloat(2.0));
        assertThat(run("{ } | avg(duration) = 500ns", trace).get(0).scalar()).isEqualTo(Static.ofDuration(500L));
        assertThat(run("{ } | min(span.missing) > 0", trace)).isEmpty();
    }

    @Test
    void arithmeticInsideFilters() {
        Trace trace = trace(7, span(1, 0, "a").putAttribute("n", 2L), span(2, 1, "b").putAttribute("n", 3L));

        assertThat(names("{ span.n * 2 = 4 }", trace)).containsExactly("a");
        assertThat(names("{ span.n + 0.5 > 3 }", trace)).containsExactly("b");
    }

    @Test
    void byPartitionsAndCoalesceMerges() {
        Trace trace = trace(
                8,
                span(1, 0, "a").putAttribute("region", "eu"),
                span(2, 1, "b").putAttribute("region", "us"),
                span(3, 1, "c").putAttribute("region", "eu"),
                span(4, 1, "d"));

        List<Spanset> groups = run("{ } | by(.region)", trace);
        assertThat(groups).hasSize(3);
        assertThat(groups.get(0).spans()).extracting(Span::getName).containsExactly("a", "c");
        assertThat(groups.get(0).attributes())
                .containsExactly(new SpansetAttribute("by(.region)", Static.ofString("eu")));
        assertThat(groups.get(2).attributes()).containsExactly(new SpansetAttribute("by(.region)", Static.NIL));

        assertThat(run("{ } | by(.region) | count() > 1", trace)).hasSize(1);

        List<Spanset> merged = run("{ } | by(.region) | coalesce()", trace);
        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).size()).isEqualTo(4);
        assertThat(merged.get(0).attributes()).isEmpty();
    }

    @Test
    void eventAndLinkConditionsBindTheSameEventOrLink() {
        assertThat(names("{ event:name = \"exception\" && event.exception.type = \"DeclinedException\" }", checkout))
                .containsExactly("charge");
        assertThat(names("{ event:name = \"exception\" && event.exception.type = \"Other\" }", checkout))
                .isEmpty();
        assertThat(names("{ event:timeSinceStart > 200ms }", checkout)).containsExactly("charge");
        assertThat(names("{ link.link.kind = \"retry\" }", checkout)).containsExactly("charge");
        assertThat(names("{ link:spanID = \"b7ad6b7169203331\" }", checkout)).containsExactly("charge");
    }

    @Test
    void unscopedAttributesFallBackToResource() {
        assertThat(names("{ .service.name = \"payments\" }", checkout)).containsExactly("authorize");
        assertThat(names("{ .peer.service = \"payments\" }", checkout)).containsExactly("charge");
        assertThat(names("{ .retries = 2 }", checkout)).containsExactly("charge");
        assertThat(names("{ .amount > 10 }", checkout)).containsExactly("authorize");
        assertThat(names("{ span.service.name = \"payments\" }", checkout)).isEmpty();
    }

    @Test
    void parentScopeReadsTheParentSpan() {
        assertThat(names(
                        "{ parent.resource.service.name = \"frontend\" && resource.service.name = \"payments\" }",
                        checkout))
                .containsExactly("authorize");
        assertThat(names("{ parent.span.http.method = \"GET\" }", checkout)).containsExactly("charge");
    }

    @Test
    void intrinsics() {
        assertThat(names("{ trace:rootService = \"frontend\" }", checkout)).hasSize(3);
        assertThat(names("{ trace:rootName = \"GET /checkout\" && trace:duration = 1s }", checkout)).hasSize(3);
        assertThat(names("{ status = error }", checkout)).containsExactly("charge");
        assertThat(names("{ statusMessage = \"card declined\" }", checkout)).containsExactly("charge");
        assertThat(names("{ kind = client }", checkout)).containsExactly("charge");
        assertThat(names("{ kind = server }", checkout)).containsExactly("GET /checkout", "authorize");
        assertThat(names("{ childCount = 1 }", checkout)).containsExactly("GET /checkout", "charge");
        assertThat(names("{ span:parentID = \"00f067aa0ba902b7\" }", checkout)).containsExactly("charge");
        assertThat(names("{ span:id = \"2222222222222222\" }", checkout)).containsExactly("authorize");
        assertThat(names("{ instrumentation:name = \"io.opentelemetry.servlet\" }", checkout))
                .containsExactly("GET /checkout");
        assertThat(names("{ duration > 500ms }", checkout)).containsExactly("GET /checkout", "authorize");
    }

    @Test
    void corruptTracesAreSkippedAndCounted() {
        Trace duplicate = trace(9, span(1, 0, "a"), span(1, 0, "b"));

        assertThat(run("{ }", duplicate)).isEmpty();
        verify(telemetry).recordCorruptTrace(eq(traceId(9)), contains("duplicate"));
    }

    @Test
    void sharedClientServerSpanIdStillMatches() {
        Trace shared = trace(
                11,
                span(1, 0, "a"),
                span(2, 1, "b-client").kind(SpanKind.CLIENT),
                span(2, 2, "b-server").kind(SpanKind.SERVER),
                span(3, 2, "c"));

        assertThat(names("{ }", shared)).containsExactly("a", "b-client", "b-server", "c");
        assertThat(names("{ kind = client } > { kind = server }", shared)).containsExactly("b-server");
        assertThat(names("{ kind = server } > { name = \"c\" }", shared)).containsExactly("c");
        verify(telemetry, never()).recordCorruptTrace(anyString(), anyString());
    }

    @Test
    void danglingParentsAreCountedAndStillEvaluated() {
        Trace dangling = trace(10, span(1, 0, "root"), span(2, 42, "orphan"));

        assertThat(names("{ }", dangling)).containsExactly("root", "orphan");
        verify(telemetry).recordDanglingParents(traceId(10), 1);
        verify(telemetry, never()).recordCorruptTrace(anyString(), anyString());
    }

    @Test
    void wellFormedTracesRecordNothing() {
        run("{ }", chain(11));

        verify(telemetry, never()).recordDanglingParents(anyString(), anyInt());
        verify(telemetry, never()).recordCorruptTrace(anyString(), anyString());
    }
}
