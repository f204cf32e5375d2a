package com.consensushub.graph;

import java.util.List;
import java.util.Map;

/**
 * Shallow similarity of two decision payloads:
 * {@code 0.4 * keyOverlap + 0.6 * equalValueRatio}.
 *
 * keyOverlap is |common keys| / |larger key set|; equalValueRatio is the
 * fraction of common keys whose values are equal. Numbers compare by value,
 * nested maps and lists never count as equal.
 */
public final class PayloadSimilarity {

    static final double UNKNOWN = 0.5;

    private PayloadSimilarity() {
    }

    public static double of(Map<String, Object> payload1, Map<String, Object> payload2) {
        if (payload1 == null || payload2 == null) {
            return UNKNOWN;
        }
        int largest = Math.max(payload1.size(), payload2.size());
        if (largest == 0) {
            return UNKNOWN;
        }

        int common = 0;
        int equal = 0;
        for (Map.Entry<String, Object> entry : payload1.entrySet()) {
            if (!payload2.containsKey(entry.getKey())) {
                continue;
            }
            common++;
            if (valuesEqual(entry.getValue(), payload2.get(entry.getKey()))) {
                equal++;
            }
        }

        double keySimilarity = (double) common / largest;
        double valueSimilarity = common > 0 ? (double) equal / common : 0.0;
        return (keySimilarity * 0.4) + (valueSimilarity * 0.6);
    }

    static boolean valuesEqual(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Map<?, ?> || a instanceof List<?> || b instanceof Map<?, ?> || b instanceof List<?>) {
            return false;
        }
        if (a instanceof Number n1 && b instanceof Number n2) {
            return Double.compare(n1.doubleValue(), n2.doubleValue()) == 0;
        }
        return a.equals(b);
    }
}
