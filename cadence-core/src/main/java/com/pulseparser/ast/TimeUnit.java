package com.pulseparser.ast;

/**
 * Units a duration literal may carry. {@code DT} is the backend-dependent sample time.
 */
public enum TimeUnit {
    NS("ns"),
    US("us"),
    MS("ms"),
    S("s"),
    DT("dt");

    private final String suffix;

    TimeUnit(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Resolves a unit suffix as written in source. The micro sign form {@code µs} is
     * accepted as an alias of {@code us}.
     */
    public static TimeUnit fromSuffix(String suffix) {
        if (suffix.equals("µs")) {
            return US;
        }
        for (TimeUnit unit : values()) {
            if (unit.suffix.equals(suffix)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown time unit: " + suffix);
    }
}
