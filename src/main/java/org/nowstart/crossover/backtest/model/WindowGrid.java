package org.nowstart.crossover.backtest.model;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.crossover.data.exception.InvalidParameterException;

public record WindowGrid(
        List<Integer> shortWindows,
        List<Integer> longWindows
) {

    public static final int MAX_RANGE_VALUES = 1_000;

    public WindowGrid {
        shortWindows = List.copyOf(shortWindows);
        longWindows = List.copyOf(longWindows);
    }

    public static WindowGrid parse(String shortSpec, String longSpec) {
        return new WindowGrid(
                parseWindowRange(shortSpec, "short-windows"),
                parseWindowRange(longSpec, "long-windows")
        );
    }

    /**
     * Pairs with {@code short < long} whose long window fits into {@code seriesLength}.
     */
    public List<int[]> pairs(int seriesLength) {
        List<int[]> out = new ArrayList<>();
        for (int shortWindow : shortWindows) {
            for (int longWindow : longWindows) {
                if (shortWindow < longWindow && longWindow <= seriesLength) {
                    out.add(new int[]{shortWindow, longWindow});
                }
            }
        }
        return out;
    }

    static List<Integer> parseWindowRange(String spec, String fieldName) {
        if (spec == null || spec.isBlank()) {
            throw new InvalidParameterException(fieldName + " must be start:end:step");
        }
        String[] parts = spec.split(":");
        if (parts.length != 3) {
            throw new InvalidParameterException(fieldName + " must be start:end:step, got: " + spec);
        }

        int start;
        int end;
        int step;
        try {
            start = Integer.parseInt(parts[0].trim());
            end = Integer.parseInt(parts[1].trim());
            step = Integer.parseInt(parts[2].trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(fieldName + " must contain integers, got: " + spec);
        }
        if (step <= 0) {
            throw new InvalidParameterException(fieldName + " step must be > 0, got: " + spec);
        }
        if (end < start) {
            throw new InvalidParameterException(fieldName + " end must be >= start, got: " + spec);
        }
        if (start < 1) {
            throw new InvalidParameterException(fieldName + " values must be >= 1, got: " + spec);
        }

        long count = ((long) end - start) / step + 1;
        if (count > MAX_RANGE_VALUES) {
            throw new InvalidParameterException(
                    fieldName + " expands to " + count + " values, limit is " + MAX_RANGE_VALUES + ", got: " + spec);
        }

        List<Integer> out = new ArrayList<>((int) count);
        for (int i = 0; i < count; i++) {
            out.add(start + i * step);
        }
        return List.copyOf(out);
    }
}
