package com.bmsedge.analytics.exception;

public enum ErrorKind {
    // Input shape errors (INP_XXX)
    DEGENERATE_INPUT("INP_001", "Series is empty or has zero variance"),
    INVALID_PARAMETER("INP_002", "Parameter is outside its allowed range"),

    // Sample size errors (SMP_XXX)
    INSUFFICIENT_DATA("SMP_001", "Not enough data points for the computation"),
    INSUFFICIENT_SAMPLES("SMP_002", "Not enough samples for the requested lag order"),
    INSUFFICIENT_HISTORY("SMP_003", "Not enough history for the requested window"),

    // Numeric errors (NUM_XXX)
    SINGULAR_MATRIX("NUM_001", "Linear system is singular"),

    // Collaborator errors (SRC_XXX)
    DATA_SOURCE("SRC_001", "External data could not be loaded");

    private final String code;
    private final String description;

    ErrorKind(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static ErrorKind fromCode(String code) {
        for (ErrorKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown error code: " + code);
    }
}
