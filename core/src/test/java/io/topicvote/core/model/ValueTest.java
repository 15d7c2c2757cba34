package io.topicvote.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.topicvote.core.error.ValueTypeException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link Value} coercions, host conversion and literal rendering. */
@DisplayName("Value")
class ValueTest {

    @Nested
    @DisplayName("coercions")
    class Coercions {

        @Test
        @DisplayName("Int and Float are numbers")
        void intAndFloatAreNumbers() {
            assertThat(Value.of(3L).asNumber()).isEqualTo(3.0);
            assertThat(Value.of(2.5).asNumber()).isEqualTo(2.5);
            assertThat(Value.of(3L).isNumber()).isTrue();
        }

        @Test
        @DisplayName("asNumber on a String names both types")
        void asNumberOnString() {
            assertThatThrownBy(() -> Value.of("x").asNumber())
                    .isInstanceOf(ValueTypeException.class)
                    .hasMessageContaining("number")
                    .hasMessageContaining("String");
        }

        @Test
        @DisplayName("asInt rejects Float")
        void asIntRejectsFloat() {
            assertThatThrownBy(() -> Value.of(1.0).asInt())
                    .isInstanceOf(ValueTypeException.class)
                    .satisfies(e -> assertThat(((ValueTypeException) e).actual()).isEqualTo("Float"));
        }

        @Test
        @DisplayName("asTuple exposes the elements")
        void asTuple() {
            Value tuple = Value.tuple(Value.of(1L), Value.of("a"));

            assertThat(tuple.asTuple()).containsExactly(Value.of(1L), Value.of("a"));
            assertThatThrownBy(() -> Value.EMPTY.asTuple()).isInstanceOf(ValueTypeException.class);
        }
    }

    @Nested
    @DisplayName("from(Object)")
    class FromObject {

        @Test
        void convertsScalars() {
            assertThat(Value.from(null)).isEqualTo(Value.EMPTY);
            assertThat(Value.from(7)).isEqualTo(Value.of(7L));
            assertThat(Value.from(7L)).isEqualTo(Value.of(7L));
            assertThat(Value.from(0.5f)).isEqualTo(Value.of(0.5));
            assertThat(Value.from(true)).isEqualTo(Value.of(true));
            assertThat(Value.from(new StringBuilder("s"))).isEqualTo(Value.of("s"));
        }

        @Test
        void convertsCollectionsToTuples() {
            assertThat(Value.from(List.of(1, "b", Arrays.asList(2.0, null))))
                    .isEqualTo(Value.tuple(
                            Value.of(1L), Value.of("b"), Value.tuple(Value.of(2.0), Value.EMPTY)));
        }

        @Test
        void convertsArraysToTuples() {
            assertThat(Value.from(new int[] {1, 2})).isEqualTo(Value.tuple(Value.of(1L), Value.of(2L)));
            assertThat(Value.from(new double[] {0.5})).isEqualTo(Value.tuple(Value.of(0.5)));
            assertThat(Value.from(new boolean[] {true})).isEqualTo(Value.tuple(Value.of(true)));
            assertThat(Value.from(new Object[] {1L, null})).isEqualTo(Value.tuple(Value.of(1L), Value.EMPTY));
        }

        @Test
        void rejectsUnknownObjects() {
            assertThatThrownBy(() -> Value.from(new Object()))
                    .isInstanceOf(ValueTypeException.class)
                    .hasMessageContaining("java.lang.Object");
        }
    }

    @Test
    @DisplayName("toString renders literals")
    void rendersLiterals() {
        assertThat(Value.of("a\"b").toString()).isEqualTo("\"a\\\"b\"");
        assertThat(Value.of(3L).toString()).isEqualTo("3");
        assertThat(Value.of(3.0).toString()).isEqualTo("3.0");
        assertThat(Value.tuple(Value.of(1L), Value.of(true)).toString()).isEqualTo("[1, true]");
        assertThat(Value.tuple(Value.of(1L)).toString()).isEqualTo("[1]");
        assertThat(Value.EMPTY.toString()).isEqualTo("null");
    }

    @Test
    @DisplayName("toJava round-trips plain objects")
    void toJava() {
        assertThat(Value.tuple(Value.of(1L), Value.EMPTY).toJava()).isEqualTo(Arrays.asList(1L, null));
        assertThat(Value.of(1.5).toJava()).isEqualTo(1.5);
    }
}
