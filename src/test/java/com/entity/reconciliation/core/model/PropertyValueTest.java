package com.entity.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PropertyValue Tests")
class PropertyValueTest {

    @Nested
    @DisplayName("Coercion")
    class CoercionTests {

        @ParameterizedTest
        @ValueSource(strings = {"yes", "TRUE", "t", "On", "1"})
        @DisplayName("Truthy strings should coerce to true")
        void truthyStrings(String s) {
            assertTrue(PropertyValue.of(s).asBoolean());
        }

        @ParameterizedTest
        @ValueSource(strings = {"no", "false", "0", "", "maybe"})
        @DisplayName("Other strings should coerce to false")
        void falsyStrings(String s) {
            assertFalse(PropertyValue.of(s).asBoolean());
        }

        @Test
        @DisplayName("Numbers should be true when non-zero")
        void numbersAsBoolean() {
            assertTrue(PropertyValue.of(3L).asBoolean());
            assertFalse(PropertyValue.of(0L).asBoolean());
            assertTrue(PropertyValue.of(0.5).asBoolean());
            assertFalse(PropertyValue.of(0.0).asBoolean());
        }

        @Test
        @DisplayName("asLong should truncate doubles and parse strings")
        void asLong() {
            assertEquals(3L, PropertyValue.of(3.9).asLong());
            assertEquals(1979L, PropertyValue.of(" 1979 ").asLong());
            assertEquals(1L, PropertyValue.of(true).asLong());
            assertEquals(0L, PropertyValue.of("not a number").asLong());
        }

        @Test
        @DisplayName("asDouble should parse strings and widen longs")
        void asDouble() {
            assertEquals(2.5, PropertyValue.of("2.5").asDouble());
            assertEquals(42.0, PropertyValue.of(42L).asDouble());
            assertEquals(0.0, PropertyValue.of("n/a").asDouble());
        }

        @Test
        @DisplayName("References should render as their id")
        void referenceAsString() {
            PropertyValue ref = PropertyValue.ofReference("place:cambridge", "Cambridge");

            assertTrue(ref.isReference());
            assertEquals("place:cambridge", ref.asString());
            assertEquals("Cambridge", ref.asReference().orElseThrow().name());
            assertFalse(ref.asBoolean());
        }
    }

    @Nested
    @DisplayName("fromJson")
    class FromJsonTests {

        @Test
        @DisplayName("Integral numbers should become longs")
        void integralNumbers() {
            assertEquals(PropertyValue.of(1979L), PropertyValue.fromJson(1979));
            assertEquals(PropertyValue.of(7L), PropertyValue.fromJson(new BigDecimal("7")));
        }

        @Test
        @DisplayName("Fractional numbers should become doubles")
        void fractionalNumbers() {
            assertEquals(PropertyValue.of(1.5), PropertyValue.fromJson(1.5));
            assertEquals(PropertyValue.of(0.25), PropertyValue.fromJson(new BigDecimal("0.25")));
        }

        @Test
        @DisplayName("Objects with an id should become references")
        void objectsWithId() {
            PropertyValue value = PropertyValue.fromJson(Map.of("id", "place:cambridge", "name", "Cambridge"));

            assertTrue(value.isReference());
            assertEquals(new PropertyValue.Reference("place:cambridge", "Cambridge"), value.rawValue());
        }

        @Test
        @DisplayName("Anything else should be kept as text")
        void fallbackToText() {
            assertEquals(PropertyValue.of("[a, b]"), PropertyValue.fromJson(List.of("a", "b")));
            assertEquals(PropertyValue.of(true), PropertyValue.fromJson(Boolean.TRUE));
        }
    }
}
