package com.spreadsheet.calc.engine;

/**
 * Series detected in an autofill source column.
 *
 * Detection order: constant run, arithmetic step, geometric integer ratio
 * (three or more values), and otherwise repeat the nearest source value.
 * Positions are indexes into the source: 0..n-1 are the source itself, n and up
 * continue below it, -1 and down continue above it.
 */
public final class AutofillPattern {

    public enum Kind { CONSTANT, ARITHMETIC, GEOMETRIC, REPEAT }

    private final Kind kind;
    private final int first;
    private final int last;
    private final int count;
    private final long step;

    private AutofillPattern(Kind kind, int first, int last, int count, long step) {
        this.kind = kind;
        this.first = first;
        this.last = last;
        this.count = count;
        this.step = step;
    }

    public static AutofillPattern detect(int[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Autofill source is empty");
        }
        int n = values.length;
        int first = values[0];
        int last = values[n - 1];
        if (n < 2) {
            return new AutofillPattern(Kind.REPEAT, first, last, n, 0);
        }

        boolean constant = true;
        for (int v : values) {
            if (v != first) {
                constant = false;
                break;
            }
        }
        if (constant) {
            return new AutofillPattern(Kind.CONSTANT, first, last, n, 0);
        }

        long diff = (long) values[1] - values[0];
        boolean arithmetic = true;
        for (int i = 1; i < n; i++) {
            if ((long) values[i] - values[i - 1] != diff) {
                arithmetic = false;
                break;
            }
        }
        if (arithmetic) {
            return new AutofillPattern(Kind.ARITHMETIC, first, last, n, diff);
        }

        if (n >= 3 && values[0] != 0 && values[1] % values[0] == 0) {
            long ratio = (long) values[1] / values[0];
            boolean geometric = ratio != 0 && ratio != 1;
            for (int i = 1; i < n && geometric; i++) {
                geometric = values[i - 1] != 0 && (long) values[i - 1] * ratio == values[i];
            }
            if (geometric) {
                return new AutofillPattern(Kind.GEOMETRIC, first, last, n, ratio);
            }
        }

        return new AutofillPattern(Kind.REPEAT, first, last, n, 0);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Value of the series at {@code position}, or null if it does not fit in an int.
     * Upward geometric values use truncating integer division.
     */
    public Integer valueAt(int position) {
        switch (kind) {
            case CONSTANT:
            case REPEAT:
                return position < 0 ? first : last;
            case ARITHMETIC: {
                long value = first + step * position;
                return fits(value) ? (int) value : null;
            }
            case GEOMETRIC: {
                if (position < 0) {
                    long value = first;
                    for (int i = 0; i < -position; i++) {
                        value /= step;
                    }
                    return (int) value;
                }
                long value = last;
                for (int i = count - 1; i < position; i++) {
                    value *= step;
                    if (!fits(value)) {
                        return null;
                    }
                }
                return (int) value;
            }
            default:
                throw new IllegalStateException("Unknown pattern " + kind);
        }
    }

    private static boolean fits(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }
}
