package com.influxgate.core.engine;

import com.influxgate.core.result.SeriesPoint;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Folds per-window aggregates into one statistic over the whole range. */
final class WindowFolding {

    private WindowFolding() {}

    static long total(List<SeriesPoint> counts) {
        long total = 0;
        for (SeriesPoint p : counts) {
            if (p.value() instanceof Number n) {
                total += n.longValue();
            }
        }
        return total;
    }

    /** Count-weighted mean of window means; windows without a count weigh one. */
    static Double mean(List<SeriesPoint> means, List<SeriesPoint> counts) {
        Map<String, Long> weights = new HashMap<>();
        for (SeriesPoint c : counts) {
            if (c.value() instanceof Number n) {
                weights.put(c.time(), n.longValue());
            }
        }
        double sum = 0;
        long weight = 0;
        for (SeriesPoint m : means) {
            if (m.value() instanceof Number n) {
                long w = weights.getOrDefault(m.time(), 1L);
                sum += n.doubleValue() * w;
                weight += w;
            }
        }
        return weight == 0 ? null : sum / weight;
    }

    /** Smallest (or largest) numeric value; non-numeric windows are compared as text. */
    static Object extreme(List<SeriesPoint> values, boolean smallest) {
        Object best = null;
        for (SeriesPoint p : values) {
            Object v = p.value();
            if (v == null) {
                continue;
            }
            if (best == null || compare(v, best) * (smallest ? 1 : -1) < 0) {
                best = v;
            }
        }
        return best;
    }

    private static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        return a.toString().compareTo(b.toString());
    }
}
