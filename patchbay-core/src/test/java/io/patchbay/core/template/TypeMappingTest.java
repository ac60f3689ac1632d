package io.patchbay.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TypeMappingTest {

    @Test
    void shouldMapSpecTypesToJava() {
        assertThat(TypeMapping.javaType("string", false)).contains("String");
        assertThat(TypeMapping.javaType("Integer", false)).contains("int");
        assertThat(TypeMapping.javaType("int", true)).contains("Integer");
        assertThat(TypeMapping.javaType("number", false)).contains("double");
        assertThat(TypeMapping.javaType("bool", true)).contains("Boolean");
        assertThat(TypeMapping.javaType("decimal", false)).isEmpty();
        assertThat(TypeMapping.isKnown("LONG")).isTrue();
    }

    @Test
    void shouldRenderLiterals() {
        assertThat(TypeMapping.literal("a \"b\"", "String")).isEqualTo("\"a \\\"b\\\"\"");
        assertThat(TypeMapping.literal(4, "int")).isEqualTo("4");
        assertThat(TypeMapping.literal(4, "long")).isEqualTo("4L");
        assertThat(TypeMapping.literal(120, "double")).isEqualTo("120.0");
        assertThat(TypeMapping.literal(true, "boolean")).isEqualTo("true");
        assertThat(TypeMapping.literal(null, "String")).isEqualTo("null");
    }

    @Test
    void shouldParseLiteralsBack() {
        assertThat(TypeMapping.parseLiteral("\"audio\"", "String")).isEqualTo("audio");
        assertThat(TypeMapping.parseLiteral("\"a\\nb\"", "String")).isEqualTo("a\nb");
        assertThat(TypeMapping.parseLiteral("4L", "long")).isEqualTo(4L);
        assertThat(TypeMapping.parseLiteral("120.0", "Double")).isEqualTo(120.0);
        assertThat(TypeMapping.parseLiteral("null", "Integer")).isNull();
        assertThatThrownBy(() -> TypeMapping.parseLiteral("audio", "String"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeMapping.parseLiteral("four", "int"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Literal four does not fit type int");
    }

    @Test
    void shouldCoerceArguments() {
        assertThat(TypeMapping.coerce(132, "double")).isEqualTo(132.0);
        assertThat(TypeMapping.coerce(4.0, "int")).isEqualTo(4);
        assertThat(TypeMapping.coerce(null, "String")).isNull();
        assertThatThrownBy(() -> TypeMapping.coerce(null, "int"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeMapping.coerce("fast", "double"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot pass String as double");
    }

    @Test
    void shouldRejectIntegralArgumentsThatWouldTruncateOrWrap() {
        // Given
        long pastIntRange = 4294967297L;

        // When / Then
        assertThatThrownBy(() -> TypeMapping.coerce(pastIntRange, "int"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot pass 4294967297 as int");
        assertThatThrownBy(() -> TypeMapping.coerce(2.5, "Integer"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot pass 2.5 as Integer");
        assertThatThrownBy(() -> TypeMapping.coerce(Double.NaN, "long"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeMapping.coerce(9.3e18, "long"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeMapping.coerce(200, "byte"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeMapping.coerce(1e300, "float"))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(TypeMapping.coerce(pastIntRange, "long")).isEqualTo(4294967297L);
        assertThat(TypeMapping.coerce(Integer.MAX_VALUE, "int")).isEqualTo(Integer.MAX_VALUE);
        assertThat(TypeMapping.coerce(-128L, "byte")).isEqualTo((byte) -128);
    }

    @Test
    void shouldRejectDefaultsOutsideIntegralRange() {
        assertThat(TypeMapping.accepts("int", 4294967297L)).isFalse();
        assertThat(TypeMapping.accepts("long", 4294967297L)).isTrue();
        assertThat(TypeMapping.accepts("Integer", Double.NaN)).isFalse();
    }

    @Test
    void shouldAcceptOnlyFittingDefaults() {
        assertThat(TypeMapping.accepts("int", 4.0)).isTrue();
        assertThat(TypeMapping.accepts("int", 4.5)).isFalse();
        assertThat(TypeMapping.accepts("double", 4)).isTrue();
        assertThat(TypeMapping.accepts("String", null)).isTrue();
        assertThat(TypeMapping.accepts("boolean", null)).isFalse();
    }
}
