package io.jobflow4j.core;

/**
 * Job priority levels. Higher {@link #value()} is dispatched first.
 */
public enum Priority {

    LOW(1),
    NORMAL(2),
    HIGH(3),
    URGENT(4);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static Priority fromValue(int value) {
        for (Priority p : values()) {
            if (p.value == value) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority value: " + value);
    }
}
