package com.phillippitts.shato.domain.command;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Primitive kind of a command parameter.
 *
 * <p>Coercion follows lenient JSON semantics: any JSON number is a valid {@link #NUMBER},
 * integral numbers (including {@code 5.0}) are valid {@link #INTEGER}s, and only strings are
 * accepted for {@link #ENUM} and {@link #STRING}.
 */
public enum ParameterKind {

    NUMBER("Input should be a valid number"),
    INTEGER("Input should be a valid integer"),
    ENUM("Input should be one of the allowed values"),
    STRING("Input should be a valid string");

    private final String expectation;

    ParameterKind(String expectation) {
        this.expectation = expectation;
    }

    /**
     * @return human-readable description of the expected type
     */
    public String expectation() {
        return expectation;
    }

    /**
     * Converts a raw JSON value into the normalized Java representation of this kind.
     *
     * @param raw raw value (nullable)
     * @return {@code Double} for numbers, {@code Long} for integers, {@code String} otherwise;
     *         empty if the value does not match this kind
     */
    public Optional<Object> coerce(Object raw) {
        switch (this) {
            case NUMBER:
                if (raw instanceof Number n && Double.isFinite(n.doubleValue())) {
                    return Optional.of(n.doubleValue());
                }
                return Optional.empty();
            case INTEGER:
                return toLong(raw).map(Long::valueOf);
            case ENUM:
            case STRING:
                return raw instanceof String s ? Optional.of(s) : Optional.empty();
            default:
                throw new IllegalStateException("Unhandled parameter kind: " + this);
        }
    }

    private static Optional<Long> toLong(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return Optional.of(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? Optional.of(big.longValue()) : Optional.empty();
        }
        if (raw instanceof Number n) {
            try {
                BigDecimal decimal = new BigDecimal(n.toString());
                return Optional.of(decimal.longValueExact());
            } catch (ArithmeticException | NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
