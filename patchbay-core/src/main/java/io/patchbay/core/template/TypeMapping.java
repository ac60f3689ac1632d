package io.patchbay.core.template;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/// Maps abstract spec types to Java types, literals and runtime values.
///
/// | spec type                    | Java     | nullable optional |
/// |------------------------------|----------|-------------------|
/// | `string`, `str`              | String   | String            |
/// | `integer`, `int`             | int      | Integer           |
/// | `long`                       | long     | Long              |
/// | `number`, `float`, `double`  | double   | Double            |
/// | `boolean`, `bool`            | boolean  | Boolean           |
public final class TypeMapping {

    private static final Map<String, String> PRIMITIVES =
            Map.of(
                    "string", "String",
                    "str", "String",
                    "integer", "int",
                    "int", "int",
                    "long", "long",
                    "number", "double",
                    "float", "double",
                    "double", "double",
                    "boolean", "boolean",
                    "bool", "boolean");

    private static final Map<String, String> BOXED =
            Map.of(
                    "int", "Integer",
                    "long", "Long",
                    "double", "Double",
                    "boolean", "Boolean",
                    "String", "String");

    private TypeMapping() {}

    /// Returns whether the abstract type is known.
    public static boolean isKnown(String specType) {
        return specType != null && PRIMITIVES.containsKey(specType.strip().toLowerCase(Locale.ROOT));
    }

    /// Resolves the Java type of a parameter.
    ///
    /// @param specType abstract type, not null
    /// @param nullable whether `null` must be representable
    /// @return Java type name, or empty for an unknown type
    public static Optional<String> javaType(String specType, boolean nullable) {
        String primitive = PRIMITIVES.get(specType.strip().toLowerCase(Locale.ROOT));
        if (primitive == null) {
            return Optional.empty();
        }
        return Optional.of(nullable ? BOXED.get(primitive) : primitive);
    }

    /// Returns whether a default value fits a Java type.
    public static boolean accepts(String javaType, Object value) {
        if (value == null) {
            return !isPrimitive(javaType);
        }
        return switch (javaType) {
            case "String" -> value instanceof String;
            case "int", "Integer" -> value instanceof Number n && fits(n, Integer.MIN_VALUE, Integer.MAX_VALUE);
            case "long", "Long" -> value instanceof Number n && fits(n, Long.MIN_VALUE, Long.MAX_VALUE);
            case "double", "Double" -> value instanceof Number;
            case "boolean", "Boolean" -> value instanceof Boolean;
            default -> false;
        };
    }

    /// Renders a value as a Java literal of the given type.
    ///
    /// @param value the value, may be null
    /// @param javaType target Java type, not null
    /// @return literal source, e.g. `"audio"`, `4`, `120.0`, `4L`, `null`
    public static String literal(Object value, String javaType) {
        if (value == null) {
            return "null";
        }
        return switch (javaType) {
            case "String" -> quote(value.toString());
            case "int", "Integer" -> Integer.toString(((Number) value).intValue());
            case "long", "Long" -> ((Number) value).longValue() + "L";
            case "double", "Double" -> Double.toString(((Number) value).doubleValue());
            default -> value.toString();
        };
    }

    /// Parses a Java literal of the given type back into a runtime value.
    ///
    /// @param literal literal source as written in `@Param(defaultValue = ...)`, not null
    /// @param javaType declared Java type, not null
    /// @return the value, null for the `null` literal
    /// @throws IllegalArgumentException if the literal does not fit the type
    public static Object parseLiteral(String literal, String javaType) {
        String text = literal.strip();
        if (text.equals("null")) {
            return null;
        }
        try {
            return switch (javaType) {
                case "String", "CharSequence" -> unquote(text);
                case "int", "Integer" -> Integer.parseInt(text);
                case "long", "Long" -> Long.parseLong(stripSuffix(text, 'L'));
                case "short", "Short" -> Short.parseShort(text);
                case "byte", "Byte" -> Byte.parseByte(text);
                case "double", "Double" -> Double.parseDouble(stripSuffix(text, 'D'));
                case "float", "Float" -> Float.parseFloat(stripSuffix(text, 'F'));
                case "boolean", "Boolean" -> parseBoolean(text);
                default -> throw new IllegalArgumentException(
                        "Unsupported parameter type: " + javaType);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Literal " + literal + " does not fit type " + javaType, e);
        }
    }

    /// Converts a runtime argument to the representation a Java parameter of `javaType` takes.
    ///
    /// Integral targets take only whole values inside the target's range; nothing is truncated
    /// or wrapped.
    ///
    /// @param value argument value, may be null
    /// @param javaType declared Java type, not null
    /// @return converted value
    /// @throws IllegalArgumentException if the value cannot be passed as that type
    public static Object coerce(Object value, String javaType) {
        if (value == null) {
            if (isPrimitive(javaType)) {
                throw new IllegalArgumentException("null passed for primitive " + javaType);
            }
            return null;
        }
        return switch (javaType) {
            case "int", "Integer" -> (int) integral(value, javaType, Integer.MIN_VALUE, Integer.MAX_VALUE);
            case "long", "Long" -> integral(value, javaType, Long.MIN_VALUE, Long.MAX_VALUE);
            case "short", "Short" -> (short) integral(value, javaType, Short.MIN_VALUE, Short.MAX_VALUE);
            case "byte", "Byte" -> (byte) integral(value, javaType, Byte.MIN_VALUE, Byte.MAX_VALUE);
            case "double", "Double" -> number(value, javaType).doubleValue();
            case "float", "Float" -> {
                double d = number(value, javaType).doubleValue();
                float f = (float) d;
                if (Float.isInfinite(f) && !Double.isInfinite(d)) {
                    throw outOfRange(value, javaType);
                }
                yield f;
            }
            case "boolean", "Boolean" -> {
                if (value instanceof Boolean b) {
                    yield b;
                }
                throw mismatch(value, javaType);
            }
            case "String", "CharSequence" -> {
                if (value instanceof CharSequence s) {
                    yield s.toString();
                }
                throw mismatch(value, javaType);
            }
            default -> value;
        };
    }

    public static boolean isPrimitive(String javaType) {
        return switch (javaType) {
            case "int", "long", "short", "byte", "double", "float", "boolean", "char" -> true;
            default -> false;
        };
    }

    private static Number number(Object value, String javaType) {
        if (value instanceof Number n) {
            return n;
        }
        throw mismatch(value, javaType);
    }

    private static long integral(Object value, String javaType, long min, long max) {
        Number n = number(value, javaType);
        if (!fits(n, min, max)) {
            throw outOfRange(value, javaType);
        }
        return n instanceof BigInteger || n instanceof BigDecimal || isIntegralBox(n)
                ? n.longValue()
                : (long) n.doubleValue();
    }

    /// Returns whether a number is whole and inside `[min, max]`.
    private static boolean fits(Number n, long min, long max) {
        if (isIntegralBox(n)) {
            long v = n.longValue();
            return v >= min && v <= max;
        }
        if (n instanceof BigInteger b) {
            return b.compareTo(BigInteger.valueOf(min)) >= 0 && b.compareTo(BigInteger.valueOf(max)) <= 0;
        }
        if (n instanceof BigDecimal b) {
            return b.stripTrailingZeros().scale() <= 0
                    && b.compareTo(BigDecimal.valueOf(min)) >= 0
                    && b.compareTo(BigDecimal.valueOf(max)) <= 0;
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
            return false;
        }
        // Exact comparison in decimal: (double) Long.MAX_VALUE rounds up past the range.
        BigDecimal exact = new BigDecimal(d);
        return exact.compareTo(BigDecimal.valueOf(min)) >= 0 && exact.compareTo(BigDecimal.valueOf(max)) <= 0;
    }

    private static boolean isIntegralBox(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static IllegalArgumentException outOfRange(Object value, String javaType) {
        return new IllegalArgumentException("Cannot pass " + value + " as " + javaType);
    }

    private static IllegalArgumentException mismatch(Object value, String javaType) {
        return new IllegalArgumentException(
                "Cannot pass " + value.getClass().getSimpleName() + " as " + javaType);
    }

    private static Boolean parseBoolean(String text) {
        if (text.equals("true") || text.equals("false")) {
            return Boolean.valueOf(text);
        }
        throw new IllegalArgumentException("Not a boolean literal: " + text);
    }

    private static String stripSuffix(String text, char suffix) {
        if (!text.isEmpty() && Character.toUpperCase(text.charAt(text.length() - 1)) == suffix) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }

    /// Quotes and escapes a string as a Java string literal.
    public static String quote(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    private static String unquote(String text) {
        if (text.length() < 2 || !text.startsWith("\"") || !text.endsWith("\"")) {
            throw new IllegalArgumentException("Not a string literal: " + text);
        }
        String body = text.substring(1, text.length() - 1);
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> out.append('\n');
                    case 'r' -> out.append('\r');
                    case 't' -> out.append('\t');
                    default -> out.append(next);
                }
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
