package com.incoresoft.blePresence.domain.query.dto;

import java.util.Collection;

public record RssiStats(double average, int max, int min, int samples) {

    /** Null for an empty sample. */
    public static RssiStats of(Collection<Integer> values) {
        if (values == null || values.isEmpty()) return null;
        int max = Integer.MIN_VALUE;
        int min = Integer.MAX_VALUE;
        long sum = 0;
        for (int v : values) {
            sum += v;
            max = Math.max(max, v);
            min = Math.min(min, v);
        }
        return new RssiStats((double) sum / values.size(), max, min, values.size());
    }
}
