package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellError;

/**
 * Aggregates over a rectangular range: SUM, AVG, MIN, MAX, STDEV.
 */
public enum RangeFunctionType {
    SUM,
    AVG,
    MIN,
    MAX,
    STDEV;

    /**
     * Aggregates error-free values; {@code values} is never empty because a range
     * covers at least one cell.
     */
    public EvaluationResult aggregate(int[] values) {
        if (values.length == 0) {
            return EvaluationResult.error(CellError.DIVIDE_BY_ZERO);
        }
        switch (this) {
            case SUM:
                return EvaluationResult.ofLong(sum(values));
            case AVG:
                return EvaluationResult.ofLong(sum(values) / values.length);
            case MIN: {
                int min = Integer.MAX_VALUE;
                for (int v : values) {
                    min = Math.min(min, v);
                }
                return EvaluationResult.of(min);
            }
            case MAX: {
                int max = Integer.MIN_VALUE;
                for (int v : values) {
                    max = Math.max(max, v);
                }
                return EvaluationResult.of(max);
            }
            case STDEV:
                return stdev(values);
            default:
                throw new IllegalStateException("Unknown range function " + this);
        }
    }

    private static long sum(int[] values) {
        long sum = 0;
        for (int v : values) {
            sum += v;
        }
        return sum;
    }

    // Population deviation around the truncated integer mean, rounded to the nearest integer
    private static EvaluationResult stdev(int[] values) {
        long mean = sum(values) / values.length;
        double varianceSum = 0.0;
        for (int v : values) {
            double diff = v - mean;
            varianceSum += diff * diff;
        }
        double variance = varianceSum / values.length;
        return EvaluationResult.ofLong(Math.round(Math.sqrt(variance)));
    }
}
