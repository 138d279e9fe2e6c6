package com.example.threadcache.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

class KeyedOptionTest {

    private static final List<String> KEYS = List.of("a", "b", "c");

    @Test
    void sharedAppliesToEveryKey() {
        Function<String, String> resolved = KeyedOption.shared("v").bind(KEYS, "fallback");

        assertThat(resolved.apply("a")).isEqualTo("v");
        assertThat(resolved.apply("unknown")).isEqualTo("v");
    }

    @Test
    void sharedNullIsAValue() {
        Function<String, String> resolved = KeyedOption.<String>shared(null).bind(KEYS, "fallback");

        assertThat(resolved.apply("a")).isNull();
    }

    @Test
    void orderedFollowsKeyPositions() {
        Function<String, String> resolved = KeyedOption.ordered(Arrays.asList("1", null)).bind(KEYS, "fallback");

        assertThat(resolved.apply("a")).isEqualTo("1");
        assertThat(resolved.apply("b")).isNull();
        assertThat(resolved.apply("c")).isEqualTo("fallback");
    }

    @Test
    void orderedIgnoresExtraValues() {
        Function<String, String> resolved = KeyedOption.ordered(List.of("1", "2", "3", "4")).bind(List.of("a"), "fallback");

        assertThat(resolved.apply("a")).isEqualTo("1");
        assertThat(resolved.apply("b")).isEqualTo("fallback");
    }

    @Test
    void orderedRepeatedKeyTakesLastPosition() {
        Function<String, String> resolved = KeyedOption.ordered(List.of("1", "2")).bind(List.of("a", "a"), "fallback");

        assertThat(resolved.apply("a")).isEqualTo("2");
    }

    @Test
    void byKeyUsesPresentKeysOnly() {
        Map<String, String> values = new HashMap<>();
        values.put("a", "1");
        values.put("b", null);

        Function<String, String> resolved = KeyedOption.byKey(values).bind(KEYS, "fallback");

        assertThat(resolved.apply("a")).isEqualTo("1");
        assertThat(resolved.apply("b")).isNull();
        assertThat(resolved.apply("c")).isEqualTo("fallback");
    }

    @Test
    void byKeyIsDetachedFromSource() {
        Map<String, String> values = new HashMap<>();
        values.put("a", "1");
        KeyedOption<String> option = KeyedOption.byKey(values);

        values.put("a", "changed");

        assertThat(option.bind(KEYS, null).apply("a")).isEqualTo("1");
    }
}
