package com.spanql.service.core.conditions;

import static org.assertj.core.api.Assertions.assertThat;

import com.spanql.service.core.ast.Attribute;
import com.spanql.service.core.ast.Intrinsic;
import com.spanql.service.core.ast.Operator;
import com.spanql.service.core.ast.Scope;
import com.spanql.service.core.ast.Static;
import com.spanql.service.core.parser.Parser;
import org.junit.jupiter.api.Test;

class ConditionCompilerTest {

    private static FetchSpansRequest compile(String query) {
        return ConditionCompiler.compile(Parser.parse(query), 0, 0);
    }

    private static Attribute span(String name) {
        return Attribute.custom(Scope.SPAN, name);
    }

    @Test
    void matchAllIsUnconstrained() {
        FetchSpansRequest request = compile("{ }");

        assertThat(request.unconstrained()).isTrue();
        assertThat(request.conditions()).isEmpty();
        assertThat(request.allConditions()).isFalse();
    }

    @Test
    void andWithinAFilterMustHoldOnOneSpan() {
        FetchSpansRequest request = compile("{ span.a = 1 && name = \"x\" }");

        assertThat(request.unconstrained()).isFalse();
        assertThat(request.allConditions()).isTrue();
        assertThat(request.conditions())
                .containsExactly(
                        new Condition(span("a"), Operator.EQ, Static.ofInt(1)),
                        new Condition(Attribute.legacyIntrinsic(Intrinsic.NAME), Operator.EQ, Static.ofString("x")));
    }

    @Test
    void orWithinAFilterNeedsAnyCondition() {
        FetchSpansRequest request = compile("{ span.a = 1 || span.b > 2 }");

        assertThat(request.allConditions()).isFalse();
        assertThat(request.conditions()).hasSize(2);
    }

    @Test
    void orWithAnUnusableSideIsUnconstrained() {
        assertThat(compile("{ span.a = 1 || span.b = span.c }").unconstrained()).isTrue();
    }

    @Test
    void andKeepsTheUsableSide() {
        FetchSpansRequest request = compile("{ span.a = 1 && span.b * 2 = 4 }");

        assertThat(request.allConditions()).isTrue();
        assertThat(request.conditions()).containsExactly(new Condition(span("a"), Operator.EQ, Static.ofInt(1)));
    }

    @Test
    void staticOnTheLeftIsFlipped() {
        assertThat(compile("{ 1 < span.a }").conditions())
                .containsExactly(new Condition(span("a"), Operator.GT, Static.ofInt(1)));
    }

    @Test
    void presenceTests() {
        assertThat(compile("{ span.a != nil }").conditions()).containsExactly(Condition.exists(span("a")));
        assertThat(compile("{ span.a = nil }").unconstrained()).isTrue();
        assertThat(Condition.exists(span("a")).toString()).isEqualTo("span.a != nil");
    }

    @Test
    void separateSpansetsCombineAsAnyCondition() {
        FetchSpansRequest and = compile("{ span.a = 1 } && { span.b = 2 }");
        FetchSpansRequest child = compile("{ span.a = 1 } > { span.b = 2 }");

        assertThat(and.allConditions()).isFalse();
        assertThat(and.conditions()).hasSize(2);
        assertThat(child.allConditions()).isFalse();
        assertThat(child.conditions()).hasSize(2);
    }

    @Test
    void spansetOrWithAMatchAllSideIsUnconstrained() {
        assertThat(compile("{ span.a = 1 } || { }").unconstrained()).isTrue();
    }

    @Test
    void pipelineStagesDoNotLoosenEarlierFilters() {
        FetchSpansRequest request = compile("{ span.a = 1 } | count() > 2");

        assertThat(request.allConditions()).isTrue();
        assertThat(request.conditions()).containsExactly(new Condition(span("a"), Operator.EQ, Static.ofInt(1)));
    }

    @Test
    void carriesRangeAndReadAttributes() {
        FetchSpansRequest request =
                ConditionCompiler.compile(Parser.parse("{ span.a = 1 } | by(resource.region)"), 10, 20);

        assertThat(request.startNanos()).isEqualTo(10);
        assertThat(request.endNanos()).isEqualTo(20);
        assertThat(request.secondPassAttributes())
                .containsExactly(span("a"), Attribute.custom(Scope.RESOURCE, "region"));
        assertThat(request.overlaps(10)).isTrue();
        assertThat(request.overlaps(21)).isFalse();
        assertThat(request.overlaps(0, 9)).isFalse();
        assertThat(request.overlaps(0, 15)).isTrue();
    }
}
