package io.patchbay.core.convention;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// A restricted parameter domain: a numeric range or an enumerated choice set.
///
/// One domain drives three things that must never drift apart: the guard the generator
/// emits, the guard the validator demands, and the invalid value the harness sends.
///
/// @see ParameterDomains#parse(String) for recognition from prose
public sealed interface ParameterDomain permits ParameterDomain.NumericRange, ParameterDomain.Choice {

    /// Returns whether a runtime value lies inside the domain.
    boolean accepts(Object value);

    /// Returns whether a runtime value violates the domain, mirroring
    /// {@link #violationCondition(String, String, boolean)}.
    ///
    /// @param value runtime value, may be null
    /// @param nullAllowed whether `null` is a legal value
    /// @return true if a guard would reject the value
    default boolean rejects(Object value, boolean nullAllowed) {
        if (value == null) {
            return !nullAllowed;
        }
        return !accepts(value);
    }

    /// Returns an in-domain sample converted to `javaType`.
    Object sampleValue(String javaType);

    /// Returns an out-of-domain value converted to `javaType`.
    ///
    /// @throws IllegalStateException if every value of `javaType` lies inside the domain
    /// @see #hasInvalidValue(String)
    Object invalidValue(String javaType);

    /// Returns whether some value of `javaType` lies outside the domain.
    default boolean hasInvalidValue(String javaType) {
        return true;
    }

    /// Returns the Java expression that is true when `javaName` lies outside the domain.
    ///
    /// The expression never dereferences a null reference: a null value is accepted when
    /// `nullAllowed` (an optional parameter defaulting to `null`) and rejected otherwise.
    ///
    /// @param javaName parameter identifier in generated code, not null
    /// @param javaType declared Java type, not null
    /// @param nullAllowed whether `null` is a legal value
    /// @return boolean expression source, never null
    String violationCondition(String javaName, String javaType, boolean nullAllowed);

    /// Returns the canonical error-prefixed message for a violation.
    ///
    /// @param parameterName parameter name as exposed to callers, not null
    /// @return message starting with {@link ToolConventions#ERROR_PREFIX}, never null
    String violationMessage(String parameterName);

    /// Returns whether the domain can restrict a parameter of the given Java type.
    boolean appliesTo(String javaType);

    /// Inclusive numeric range.
    ///
    /// The rendered guard is `!(x >= min && x <= max)`, which also rejects `NaN`.
    ///
    /// @param min lower bound, inclusive
    /// @param max upper bound, inclusive, not less than `min`
    record NumericRange(double min, double max) implements ParameterDomain {

        private static final Set<String> NUMERIC_TYPES =
                Set.of(
                        "int", "long", "short", "byte", "double", "float", "Integer", "Long",
                        "Short", "Byte", "Double", "Float", "Number", "BigDecimal");

        public NumericRange {
            if (min > max) {
                throw new IllegalArgumentException("min must be less than or equal to max");
            }
        }

        @Override
        public boolean accepts(Object value) {
            double number;
            if (value instanceof Number n) {
                number = n.doubleValue();
            } else if (value instanceof String s) {
                try {
                    number = Double.parseDouble(s.strip());
                } catch (NumberFormatException e) {
                    return false;
                }
            } else {
                return false;
            }
            return min <= number && number <= max;
        }

        @Override
        public Object sampleValue(String javaType) {
            return convert(Math.ceil(min) <= max ? Math.ceil(min) : min, javaType);
        }

        /// Prefers the first whole number above the range, then the last one below it.
        @Override
        public Object invalidValue(String javaType) {
            double above = Math.floor(max) + 1;
            if (above > max && representable(above, javaType)) {
                return convert(above, javaType);
            }
            double below = Math.ceil(min) - 1;
            if (below < min && representable(below, javaType)) {
                return convert(below, javaType);
            }
            throw new IllegalStateException(
                    "every " + javaType + " value lies between " + format(min) + " and " + format(max));
        }

        @Override
        public boolean hasInvalidValue(String javaType) {
            double above = Math.floor(max) + 1;
            double below = Math.ceil(min) - 1;
            return (above > max && representable(above, javaType))
                    || (below < min && representable(below, javaType));
        }

        /// Returns whether both bounds are values of `javaType`.
        public boolean fitsType(String javaType) {
            return representable(min, javaType) && representable(max, javaType);
        }

        @Override
        public String violationCondition(String javaName, String javaType, boolean nullAllowed) {
            String outside =
                    "!(" + javaName + " >= " + format(min) + " && " + javaName + " <= " + format(max) + ")";
            if (!isBoxed(javaType)) {
                return outside;
            }
            return nullAllowed
                    ? javaName + " != null && " + outside
                    : javaName + " == null || " + outside;
        }

        @Override
        public String violationMessage(String parameterName) {
            return ToolConventions.ERROR_PREFIX
                    + parameterName
                    + " must be between "
                    + format(min)
                    + " and "
                    + format(max);
        }

        @Override
        public boolean appliesTo(String javaType) {
            return NUMERIC_TYPES.contains(javaType);
        }

        /// Formats a bound without a trailing `.0` for whole numbers.
        public static String format(double value) {
            if (value == Math.rint(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }

        private static boolean isBoxed(String javaType) {
            return !javaType.isEmpty() && Character.isUpperCase(javaType.charAt(0));
        }

        private static boolean representable(double value, String javaType) {
            return switch (javaType) {
                case "int", "Integer" -> value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
                case "long", "Long" -> value >= -0x1p63 && value < 0x1p63;
                case "short", "Short" -> value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
                case "byte", "Byte" -> value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE;
                case "float", "Float" -> Math.abs(value) <= Float.MAX_VALUE;
                default -> !Double.isInfinite(value);
            };
        }

        private static Object convert(double value, String javaType) {
            switch (javaType) {
                case "int", "Integer" -> {
                    return (int) value;
                }
                case "long", "Long" -> {
                    return (long) value;
                }
                case "short", "Short" -> {
                    return (short) value;
                }
                case "byte", "Byte" -> {
                    return (byte) value;
                }
                case "float", "Float" -> {
                    return (float) value;
                }
                default -> {
                    return value;
                }
            }
        }
    }

    /// Enumerated choice set, compared by exact string match.
    ///
    /// @param values allowed values in documentation order, at least two
    record Choice(List<String> values) implements ParameterDomain {

        private static final Set<String> TEXT_TYPES = Set.of("String", "CharSequence");

        public Choice {
            Objects.requireNonNull(values, "values must not be null");
            values = List.copyOf(values);
            if (values.size() < 2) {
                throw new IllegalArgumentException("a choice needs at least two values");
            }
        }

        @Override
        public boolean accepts(Object value) {
            return value instanceof String s && values.contains(s);
        }

        @Override
        public Object sampleValue(String javaType) {
            return values.get(0);
        }

        @Override
        public Object invalidValue(String javaType) {
            String candidate = "invalid_choice";
            while (values.contains(candidate)) {
                candidate = candidate + "_x";
            }
            return candidate;
        }

        @Override
        public String violationCondition(String javaName, String javaType, boolean nullAllowed) {
            String list =
                    values.stream().map(v -> "\"" + v + "\"").collect(Collectors.joining(", "));
            String membership = "!List.of(" + list + ").contains(" + javaName + ")";
            return nullAllowed
                    ? javaName + " != null && " + membership
                    : javaName + " == null || " + membership;
        }

        @Override
        public String violationMessage(String parameterName) {
            return ToolConventions.ERROR_PREFIX
                    + parameterName
                    + " must be one of: "
                    + String.join(", ", values);
        }

        @Override
        public boolean appliesTo(String javaType) {
            return TEXT_TYPES.contains(javaType);
        }
    }
}
