package com.incoresoft.blePresence.domain.ingest.dto;

import com.incoresoft.blePresence.domain.shared.SignalLevels;

/**
 * Signal strength as a receiver sent it. Receivers report either one reading or a
 * structured value with an average and the current reading; {@link #resolve()}
 * turns both into the single dBm value stored in the registry.
 */
public final class SignalStrength {
    private final Double scalar;
    private final Double average;
    private final Double current;

    private SignalStrength(Double scalar, Double average, Double current) {
        this.scalar = scalar;
        this.average = average;
        this.current = current;
    }

    public static SignalStrength of(Number value) {
        return new SignalStrength(value == null ? null : value.doubleValue(), null, null);
    }

    public static SignalStrength structured(Number average, Number current) {
        return new SignalStrength(null,
                average == null ? null : average.doubleValue(),
                current == null ? null : current.doubleValue());
    }

    public static SignalStrength absent() {
        return new SignalStrength(null, null, null);
    }

    /**
     * Average, then current, then the bare reading. {@link SignalLevels#FLOOR} when none is
     * there or the value does not fit an int dBm reading.
     */
    public int resolve() {
        Double value = average != null ? average : current != null ? current : scalar;
        if (value == null || value.isNaN()) return SignalLevels.FLOOR;
        long rounded = Math.round(value);
        if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) return SignalLevels.FLOOR;
        return (int) rounded;
    }

    public static int resolve(SignalStrength strength) {
        return strength == null ? SignalLevels.FLOOR : strength.resolve();
    }

    public boolean isStructured() {
        return scalar == null && (average != null || current != null);
    }

    @Override
    public String toString() {
        return isStructured()
                ? "SignalStrength{average=" + average + ", current=" + current + "}"
                : "SignalStrength{" + scalar + "}";
    }
}
