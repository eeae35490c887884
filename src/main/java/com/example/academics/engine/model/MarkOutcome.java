package com.example.academics.engine.model;

import java.util.Objects;

/**
 * A normalized percentage in [0, 100], or the explicit absence of one.
 * <p>
 * Missing is a normal outcome (a mark not uploaded yet), not zero. Callers must check
 * {@link #isMissing()} before reading {@link #percentage()}; reports render missing
 * outcomes as "N/A".
 */
public final class MarkOutcome {

    private static final MarkOutcome MISSING = new MarkOutcome(null);

    private final Double value;

    private MarkOutcome(Double value) {
        this.value = value;
    }

    public static MarkOutcome of(double percentage) {
        return new MarkOutcome(percentage);
    }

    public static MarkOutcome missing() {
        return MISSING;
    }

    public boolean isMissing() {
        return value == null;
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * @throws IllegalStateException when the outcome is missing
     */
    public double percentage() {
        if (value == null) {
            throw new IllegalStateException("No mark recorded");
        }
        return value;
    }

    /** Nullable view for serialization; null means missing. */
    public Double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkOutcome)) return false;
        return Objects.equals(value, ((MarkOutcome) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "MISSING" : value.toString();
    }
}
