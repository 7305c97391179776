package com.wireframe.compiler.ir.model;

import static org.assertj.core.api.Assertions.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PropertyBagTest {

    @Test
    void testKeepsInsertionOrderAndDropsNulls() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("zeta", "z");
        values.put("alpha", 1);
        values.put("gone", null);

        PropertyBag bag = PropertyBag.of(values);

        assertThat(bag.keys()).containsExactly("zeta", "alpha");
        assertThat(bag.has("gone")).isFalse();
    }

    @Test
    void testIsImmutable() {
        PropertyBag bag = PropertyBag.of(Map.of("text", "Hi"));

        assertThatThrownBy(() -> bag.asMap().put("text", "Bye"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testNumbersAreNormalized() {
        Map<String, Object> values = new HashMap<>();
        values.put("long", 5L);
        values.put("float", 1.5f);

        PropertyBag bag = PropertyBag.of(values);

        assertThat(bag.get("long")).isEqualTo(5);
        assertThat(bag.get("float")).isEqualTo(1.5);
    }

    @ParameterizedTest
    @CsvSource({
            "12, 12",
            "' 7 ', 7",
            "3.5, ",
            "abc, "
    })
    void testGetIntFromStrings(String raw, Integer expected) {
        assertThat(PropertyBag.of(Map.of("span", raw)).getInt("span")).isEqualTo(expected);
    }

    @Test
    void testGetBooleanAcceptsLiteralStrings() {
        PropertyBag bag = PropertyBag.of(Map.of("a", "true", "b", false, "c", "yes"));

        assertThat(bag.getBoolean("a")).isTrue();
        assertThat(bag.getBoolean("b")).isFalse();
        assertThat(bag.getBoolean("c")).isNull();
    }
}
