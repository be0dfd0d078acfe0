package org.nowstart.crossover.backtest.model;

import java.time.Instant;
import java.util.List;

public final class PriceSeries {

    private final List<PricePoint> points;
    private final double[] prices;

    private PriceSeries(List<PricePoint> points) {
        this.points = points;
        this.prices = new double[points.size()];
        for (int i = 0; i < prices.length; i++) {
            prices[i] = points.get(i).price();
        }
    }

    public static PriceSeries of(List<PricePoint> points) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("price series requires at least 1 row");
        }
        Instant previous = null;
        for (int i = 0; i < points.size(); i++) {
            PricePoint point = points.get(i);
            if (point == null || point.timestamp() == null) {
                throw new IllegalArgumentException("price row " + i + " has no timestamp");
            }
            if (!Double.isFinite(point.price())) {
                throw new IllegalArgumentException("price row " + i + " is not finite: " + point.price());
            }
            if (previous != null && !point.timestamp().isAfter(previous)) {
                throw new IllegalArgumentException(
                        "timestamps must be strictly increasing, got " + point.timestamp() + " after " + previous);
            }
            previous = point.timestamp();
        }
        return new PriceSeries(List.copyOf(points));
    }

    public int size() {
        return points.size();
    }

    public PricePoint get(int index) {
        return points.get(index);
    }

    public double price(int index) {
        return prices[index];
    }

    public Instant timestamp(int index) {
        return points.get(index).timestamp();
    }

    public double[] prices() {
        return prices.clone();
    }

    public List<PricePoint> points() {
        return points;
    }

    @Override
    public String toString() {
        return "PriceSeries[size=" + size() + ", range=" + timestamp(0) + " -> " + timestamp(size() - 1) + "]";
    }
}
