package io.firelite.core.value;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ValueEqualityTest {

    @Test
    void nanEqualsNan() {
        assertThat(ValueEquality.equal(Value.of(Double.NaN), Value.of(Double.NaN))).isTrue();
        assertThat(ValueEquality.contains(List.of(Value.of(1L), Value.of(Double.NaN)), Value.of(Double.NaN))).isTrue();
    }

    @Test
    void integersAndDoublesAreDistinctKinds() {
        assertThat(ValueEquality.equal(Value.of(1L), Value.of(1.0))).isFalse();
    }

    @Test
    void timestampsCompareAtMillisecondPrecision() {
        Instant base = Instant.parse("2024-01-01T00:00:00.123Z");
        assertThat(ValueEquality.equal(Value.of(base), Value.of(base.plusNanos(456_000)))).isTrue();
        assertThat(ValueEquality.equal(Value.of(base), Value.of(base.plusMillis(1)))).isFalse();
    }

    @Test
    void extremeTimestampsCompareWithoutOverflow() {
        assertThat(ValueEquality.equal(Value.of(Instant.MAX), Value.of(Instant.MAX))).isTrue();
        assertThat(ValueEquality.equal(Value.of(Instant.MAX), Value.of(Instant.MIN))).isFalse();
    }

    @Test
    void comparesContainersDeeply() {
        Value a = Value.map(Map.of("list", Value.array(Value.of("x"), Value.map(Map.of("n", Value.of(1L))))));
        Value b = Value.map(Map.of("list", Value.array(Value.of("x"), Value.map(Map.of("n", Value.of(1L))))));
        Value c = Value.map(Map.of("list", Value.array(Value.map(Map.of("n", Value.of(1L))), Value.of("x"))));
        assertThat(ValueEquality.equal(a, b)).isTrue();
        assertThat(ValueEquality.equal(a, c)).isFalse();
        assertThat(ValueEquality.equal(Value.map(Map.of("a", Value.nullValue())), Value.map(Map.of()))).isFalse();
    }

    @Test
    void comparesBytesAndGeoPointsByContent() {
        assertThat(ValueEquality.equal(new Value.BytesValue(new byte[] {1, 2}), new Value.BytesValue(new byte[] {1, 2})))
                .isTrue();
        assertThat(ValueEquality.equal(new Value.GeoPointValue(1, 2), new Value.GeoPointValue(1, 2))).isTrue();
        assertThat(ValueEquality.equal(new Value.GeoPointValue(1, 2), new Value.GeoPointValue(2, 1))).isFalse();
    }
}
