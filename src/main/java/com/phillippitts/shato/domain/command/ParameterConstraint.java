package com.phillippitts.shato.domain.command;

import com.phillippitts.shato.util.NumberFormats;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Constraint applied to a parameter value after its kind has been checked.
 *
 * <p>Implementations return a human-readable violation message, or empty when the value
 * satisfies the constraint.
 */
public sealed interface ParameterConstraint {

    /**
     * Checks a normalized parameter value.
     *
     * @param field parameter name
     * @param value normalized value (raw value for enum membership)
     * @return violation message, or empty if satisfied
     */
    Optional<String> check(String field, Object value);

    /**
     * Value must be one of a fixed set of strings.
     *
     * @param allowed allowed values in declaration order
     */
    record OneOf(List<String> allowed) implements ParameterConstraint {

        public OneOf {
            allowed = List.copyOf(allowed);
        }

        @Override
        public Optional<String> check(String field, Object value) {
            if (value instanceof String s && allowed.contains(s)) {
                return Optional.empty();
            }
            return Optional.of("Invalid value for '" + field + "'. Expected one of: " + String.join(", ", allowed));
        }
    }

    /**
     * Numeric range; either bound may be open-ended ({@code null}).
     *
     * @param min          lower bound (nullable)
     * @param minInclusive whether the lower bound itself is allowed
     * @param max          upper bound (nullable)
     * @param maxInclusive whether the upper bound itself is allowed
     */
    record Range(Double min, boolean minInclusive, Double max, boolean maxInclusive) implements ParameterConstraint {

        public static Range atLeast(double min) {
            return new Range(min, true, null, false);
        }

        @Override
        public Optional<String> check(String field, Object value) {
            double v = ((Number) value).doubleValue();
            if (min != null && (minInclusive ? v < min : v <= min)) {
                return Optional.of("Invalid value for '" + field + "'. Input should be greater than "
                        + (minInclusive ? "or equal to " : "") + NumberFormats.plain(min));
            }
            if (max != null && (maxInclusive ? v > max : v >= max)) {
                return Optional.of("Invalid value for '" + field + "'. Input should be less than "
                        + (maxInclusive ? "or equal to " : "") + NumberFormats.plain(max));
            }
            return Optional.empty();
        }
    }

    /**
     * Value must not equal a forbidden literal.
     *
     * @param forbidden forbidden numeric value
     * @param message   message reported on violation
     */
    record NotEqual(double forbidden, String message) implements ParameterConstraint {

        public NotEqual {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public Optional<String> check(String field, Object value) {
            return ((Number) value).doubleValue() == forbidden ? Optional.of(message) : Optional.empty();
        }
    }
}
