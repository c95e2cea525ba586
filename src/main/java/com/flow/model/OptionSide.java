package com.flow.model;

import java.util.Optional;

/**
 * Option side of an instrument key.
 */
public enum OptionSide {

    CALL("C"),
    PUT("P");

    private final String code;

    OptionSide(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public OptionSide opposite() {
        return this == CALL ? PUT : CALL;
    }

    /**
     * Look up a side by its one-letter code ("C" / "P") or its name, case-insensitive.
     */
    public static Optional<OptionSide> fromCode(String value) {
        if (value == null) return Optional.empty();
        for (OptionSide side : values()) {
            if (side.code.equalsIgnoreCase(value) || side.name().equalsIgnoreCase(value)) {
                return Optional.of(side);
            }
        }
        return Optional.empty();
    }
}
