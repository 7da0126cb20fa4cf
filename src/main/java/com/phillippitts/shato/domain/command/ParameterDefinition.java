package com.phillippitts.shato.domain.command;

import java.util.List;
import java.util.Objects;

/**
 * Declaration of one command parameter.
 *
 * @param name         parameter key as it appears in the parameter mapping
 * @param kind         expected primitive kind
 * @param required     whether the key must be present
 * @param defaultValue normalized value used when an optional key is absent (nullable)
 * @param constraints  constraints checked in order after the kind check
 */
public record ParameterDefinition(String name,
                                  ParameterKind kind,
                                  boolean required,
                                  Object defaultValue,
                                  List<ParameterConstraint> constraints) {

    public ParameterDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        constraints = List.copyOf(constraints);
        if (!required && defaultValue == null) {
            throw new IllegalArgumentException("Optional parameter '" + name + "' needs a default value");
        }
    }

    public static ParameterDefinition required(String name, ParameterKind kind, ParameterConstraint... constraints) {
        return new ParameterDefinition(name, kind, true, null, List.of(constraints));
    }

    public static ParameterDefinition optional(String name, ParameterKind kind, Object defaultValue,
                                               ParameterConstraint... constraints) {
        return new ParameterDefinition(name, kind, false, defaultValue, List.of(constraints));
    }

    public static ParameterConstraint oneOf(String... values) {
        return new ParameterConstraint.OneOf(List.of(values));
    }
}
