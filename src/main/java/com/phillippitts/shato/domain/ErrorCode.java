package com.phillippitts.shato.domain;

/**
 * Error taxonomy shared by the validator, the router and the HTTP boundary.
 */
public enum ErrorCode {

    /** Command name outside the closed command set. */
    UNKNOWN_COMMAND("UnknownCommand"),

    /** Missing key, wrong type, invalid enum value or violated constraint. */
    SCHEMA_VIOLATION("SchemaViolation"),

    /** Generation or validation transport failed or timed out. */
    UPSTREAM_UNAVAILABLE("UpstreamUnavailable"),

    /** Model output could not be parsed; absorbed by the generation client, log only. */
    GENERATION_PARSE_ERROR("GenerationParseError"),

    /** A validated command could not be simulated (validator/registry inconsistency). */
    INTERNAL_ERROR("InternalError");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * @return wire representation of this code
     */
    public String code() {
        return code;
    }

    /**
     * Resolves a wire code, falling back to {@link #SCHEMA_VIOLATION} for unknown or missing values.
     *
     * @param code wire representation (nullable)
     * @return matching error code
     */
    public static ErrorCode fromCode(String code) {
        if (code != null) {
            for (ErrorCode candidate : values()) {
                if (candidate.code.equalsIgnoreCase(code) || candidate.name().equalsIgnoreCase(code)) {
                    return candidate;
                }
            }
        }
        return SCHEMA_VIOLATION;
    }
}
