package com.spanql.service.core.ast;

import static org.assertj.core.api.Assertions.assertThat;

import com.spanql.telemetry.model.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class StaticTest {

    @Test
    void numericTypesCompareAcrossTags() {
        assertThat(Static.ofInt(3).compare(Operator.LT, Static.ofFloat(3.5))).isTrue();
        assertThat(Static.ofDuration(2_000_000L).compare(Operator.GT, Static.ofInt(1_000_000L))).isTrue();
        assertThat(Static.ofFloat(2.0).compare(Operator.EQ, Static.ofInt(2))).isTrue();
        assertThat(Static.ofFloat(Double.NaN).compare(Operator.NEQ, Static.ofInt(2))).isFalse();
    }

    @Test
    void nilNeverCompares() {
        assertThat(Static.NIL.compare(Operator.EQ, Static.NIL)).isFalse();
        assertThat(Static.NIL.compare(Operator.NEQ, Static.ofInt(1))).isFalse();
        assertThat(Static.ofString("x").compare(Operator.NEQ, Static.NIL)).isFalse();
    }

    @Test
    void stringAgainstNumberOnlyForOrdering() {
        assertThat(Static.ofString("200").compare(Operator.EQ, Static.ofInt(200))).isFalse();
        assertThat(Static.ofString("300").compare(Operator.GT, Static.ofInt(200))).isTrue();
        assertThat(Static.ofString("abc").compare(Operator.LT, Static.ofString("abd"))).isTrue();
    }

    @Test
    void mismatchedTagsAreFalse() {
        assertThat(Static.ofStatus(StatusCode.ERROR).compare(Operator.EQ, Static.ofString("error"))).isFalse();
        assertThat(Static.ofKind(SpanKind.SERVER).compare(Operator.EQ, Static.ofKind(SpanKind.SERVER))).isTrue();
        assertThat(Static.TRUE.compare(Operator.NEQ, Static.ofInt(1))).isFalse();
    }

    @Test
    void arraysMatchWhenAnyElementDoes() {
        Static array = Static.of(List.of(1, 2, 3));

        assertThat(array.type()).isEqualTo(StaticType.ARRAY);
        assertThat(array.compare(Operator.EQ, Static.ofInt(2))).isTrue();
        assertThat(array.compare(Operator.GT, Static.ofInt(5))).isFalse();
        assertThat(Static.of(List.of("a-b", "c")).matches(Pattern.compile("^c$"))).isTrue();
    }

    @Test
    void mapsNeverCompare() {
        Static map = Static.of(Map.of("k", "v"));

        assertThat(map.type()).isEqualTo(StaticType.MAP);
        assertThat(map.compare(Operator.EQ, map)).isFalse();
        assertThat(map.isNil()).isFalse();
    }

    @Test
    void arithmeticKeepsIntsAndDurations() {
        assertThat(Static.ofInt(7).arithmetic(Operator.ADD, Static.ofInt(3))).isEqualTo(Static.ofInt(10));
        assertThat(Static.ofInt(7).arithmetic(Operator.DIV, Static.ofInt(2))).isEqualTo(Static.ofFloat(3.5));
        assertThat(Static.ofInt(7).arithmetic(Operator.MOD, Static.ofInt(0))).isEqualTo(Static.NIL);
        assertThat(Static.ofDuration(1_000L).arithmetic(Operator.ADD, Static.ofDuration(500L)))
                .isEqualTo(Static.ofDuration(1_500L));
        assertThat(Static.ofDuration(1_000L).arithmetic(Operator.MUL, Static.ofInt(3)))
                .isEqualTo(Static.ofDuration(3_000L));
        assertThat(Static.ofDuration(1_000L).arithmetic(Operator.DIV, Static.ofInt(4)))
                .isEqualTo(Static.ofFloat(250.0));
        assertThat(Static.ofString("a").arithmetic(Operator.ADD, Static.ofInt(1))).isEqualTo(Static.NIL);
        assertThat(Static.NIL.arithmetic(Operator.ADD, Static.ofInt(1))).isEqualTo(Static.NIL);
    }

    @Test
    void rendersLiteralsInQuerySyntax() {
        assertThat(Static.ofFloat(2.0)).hasToString("2.0");
        assertThat(Static.ofFloat(0.1)).hasToString("0.1");
        assertThat(Static.ofDuration(90_000_000_000L)).hasToString("90s");
        assertThat(Static.ofDuration(3_600_000_000_000L)).hasToString("1h");
        assertThat(Static.ofDuration(1_500L)).hasToString("1500ns");
        assertThat(Static.ofString("a\"b")).hasToString("\"a\\\"b\"");
        assertThat(Static.ofStatus(StatusCode.OK)).hasToString("ok");
        assertThat(Static.ofKind(SpanKind.CONSUMER)).hasToString("consumer");
    }

    @Test
    void javaValuesForResults() {
        assertThat(Static.ofStatus(StatusCode.ERROR).toJavaValue()).isEqualTo("error");
        assertThat(Static.of(List.of(1L, "x")).toJavaValue()).isEqualTo(List.of(1L, "x"));
        assertThat(Static.NIL.toJavaValue()).isNull();
    }
}
