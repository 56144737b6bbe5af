package com.ksexpr.types;

import com.ksexpr.exception.InvalidFloatException;
import com.ksexpr.test.TestBase;
import com.ksexpr.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for PositiveFiniteDouble construction, equality and ordering.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PositiveFiniteDouble Tests")
public class PositiveFiniteDoubleTest extends TestBase {

    /** Largest subnormal double, bits 0x000FFFFFFFFFFFFF. */
    private static final double MAX_SUBNORMAL = Double.longBitsToDouble(0x000F_FFFF_FFFF_FFFFL);

    /** Smallest positive subnormal double, bits 0x0000000000000001. */
    private static final double MIN_SUBNORMAL = Double.MIN_VALUE;

    private static void assertAccepted(double value) {
        PositiveFiniteDouble wrapped = PositiveFiniteDouble.of(value);
        assertThat(Double.doubleToRawLongBits(wrapped.value()))
            .isEqualTo(Double.doubleToRawLongBits(value));
        assertThat(PositiveFiniteDouble.check(value)).isEmpty();
    }

    private static void assertRejected(double value, InvalidFloatError expected) {
        InvalidFloatException e = catchThrowableOfType(
            () -> PositiveFiniteDouble.of(value), InvalidFloatException.class);
        assertThat(e).isNotNull();
        assertThat(e.getError()).isEqualTo(expected);
        assertThat(PositiveFiniteDouble.check(value)).contains(expected);
    }

    @Nested
    @DisplayName("Non-finite values")
    class NonFinite {

        @Test
        @DisplayName("Positive NaN is NON_FINITE")
        void testPositiveNaN() {
            double value = Double.NaN;
            assertThat(Double.doubleToRawLongBits(value)).isPositive();
            assertRejected(value, InvalidFloatError.NON_FINITE);
        }

        @Test
        @DisplayName("Negative NaN is NON_FINITE, not NEGATIVE")
        void testNegativeNaN() {
            double value = Double.longBitsToDouble(0xFFF8_0000_0000_0000L);
            assertThat(Double.isNaN(value)).isTrue();
            assertThat(Double.doubleToRawLongBits(value)).isNegative();
            assertRejected(value, InvalidFloatError.NON_FINITE);
        }

        @Test
        @DisplayName("Positive infinity is NON_FINITE")
        void testPositiveInfinity() {
            assertRejected(Double.POSITIVE_INFINITY, InvalidFloatError.NON_FINITE);
        }

        @Test
        @DisplayName("Negative infinity is NON_FINITE")
        void testNegativeInfinity() {
            assertRejected(Double.NEGATIVE_INFINITY, InvalidFloatError.NON_FINITE);
        }
    }

    @Nested
    @DisplayName("Zero")
    class Zero {

        @Test
        @DisplayName("Positive zero is accepted")
        void testPositiveZero() {
            assertAccepted(0.0);
        }

        @Test
        @DisplayName("Negative zero is NEGATIVE")
        void testNegativeZero() {
            assertThat(-0.0 == 0.0).isTrue();
            assertRejected(-0.0, InvalidFloatError.NEGATIVE);
        }
    }

    @Nested
    @DisplayName("Subnormal values")
    class Subnormal {

        @Test
        @DisplayName("Largest positive subnormal is accepted")
        void testPositiveMaxSubnormal() {
            assertThat(MAX_SUBNORMAL).isLessThan(Double.MIN_NORMAL);
            assertAccepted(MAX_SUBNORMAL);
        }

        @Test
        @DisplayName("Smallest positive subnormal is accepted")
        void testPositiveMinSubnormal() {
            assertThat(MIN_SUBNORMAL * 0.5).isEqualTo(0.0);
            assertAccepted(MIN_SUBNORMAL);
        }

        @Test
        @DisplayName("Negative subnormals are NEGATIVE")
        void testNegativeSubnormals() {
            assertRejected(-MIN_SUBNORMAL, InvalidFloatError.NEGATIVE);
            assertRejected(-MAX_SUBNORMAL, InvalidFloatError.NEGATIVE);
        }
    }

    @Nested
    @DisplayName("Normal values")
    class Normal {

        @ParameterizedTest
        @ValueSource(doubles = {Double.MAX_VALUE, Double.MIN_NORMAL, Math.PI, 1.0, 13.0, 1e16, 0.0001})
        @DisplayName("Positive normal values are accepted verbatim")
        void testPositiveNormal(double value) {
            assertAccepted(value);
        }

        @ParameterizedTest
        @ValueSource(doubles = {-Double.MIN_NORMAL, -Double.MAX_VALUE, -Math.PI, -1.0})
        @DisplayName("Negative normal values are NEGATIVE")
        void testNegativeNormal(double value) {
            assertRejected(value, InvalidFloatError.NEGATIVE);
        }
    }

    @Nested
    @DisplayName("Equality and ordering")
    class EqualityAndOrdering {

        @Test
        @DisplayName("Equal values are equal and hash alike")
        void testEquality() {
            PositiveFiniteDouble a = PositiveFiniteDouble.of(2.5);
            PositiveFiniteDouble b = PositiveFiniteDouble.of(2.5);

            assertThat(a).isEqualTo(b);
            assertThat(a.hashCode()).isEqualTo(b.hashCode());
            assertThat(a.compareTo(b)).isZero();
            assertThat(a).isNotEqualTo(PositiveFiniteDouble.of(2.25));
        }

        @Test
        @DisplayName("Zero works as a map and set key")
        void testZeroAsKey() {
            Map<PositiveFiniteDouble, String> map = new HashMap<>();
            map.put(PositiveFiniteDouble.of(0.0), "zero");

            assertThat(map.get(PositiveFiniteDouble.of(0.0))).isEqualTo("zero");

            Set<PositiveFiniteDouble> set = new HashSet<>();
            set.add(PositiveFiniteDouble.of(0.0));
            set.add(PositiveFiniteDouble.of(0.0));
            assertThat(set).hasSize(1);
        }

        @Test
        @DisplayName("Values sort in numeric order")
        void testSorting() {
            List<PositiveFiniteDouble> values = new ArrayList<>(Arrays.asList(
                PositiveFiniteDouble.of(1e16),
                PositiveFiniteDouble.of(0.0),
                PositiveFiniteDouble.of(Double.MIN_VALUE),
                PositiveFiniteDouble.of(3.0)
            ));
            values.sort(null);

            assertThat(values).extracting(PositiveFiniteDouble::value)
                .containsExactly(0.0, Double.MIN_VALUE, 3.0, 1e16);
        }
    }

    @Test
    @DisplayName("Exception reports the rejected value")
    void testExceptionDetails() {
        InvalidFloatException e = catchThrowableOfType(
            () -> PositiveFiniteDouble.of(-2.5), InvalidFloatException.class);

        assertThat(e.getRejectedValue()).isEqualTo(-2.5);
        assertThat(e.getError()).isEqualTo(InvalidFloatError.NEGATIVE);
        assertThat(e).isInstanceOf(IllegalArgumentException.class);
        assertThat(e.getMessage()).contains("-2.5").contains("must not be negative");
    }
}
