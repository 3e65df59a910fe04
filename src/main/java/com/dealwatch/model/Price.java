package com.dealwatch.model;

import java.util.List;

/**
 * Upstream price, either a single amount or a tiered list of amounts.
 */
public sealed interface Price permits Price.Scalar, Price.Tiered {

    /**
     * Single amount used for display and savings math. Tiered prices resolve to their minimum.
     */
    double representative();

    static Price scalar(double amount) {
        return new Scalar(amount);
    }

    static Price tiered(List<Double> amounts) {
        return new Tiered(amounts);
    }

    record Scalar(double amount) implements Price {
        public Scalar {
            if (!Double.isFinite(amount)) {
                throw new IllegalArgumentException("price amount must be finite: " + amount);
            }
        }

        @Override
        public double representative() {
            return amount;
        }
    }

    record Tiered(List<Double> amounts) implements Price {
        public Tiered {
            if (amounts == null || amounts.isEmpty()) {
                throw new IllegalArgumentException("tiered price needs at least one amount");
            }
            for (Double amount : amounts) {
                if (amount == null || !Double.isFinite(amount)) {
                    throw new IllegalArgumentException("tiered price amount must be finite: " + amount);
                }
            }
            amounts = List.copyOf(amounts);
        }

        @Override
        public double representative() {
            double min = Double.POSITIVE_INFINITY;
            for (double amount : amounts) {
                min = Math.min(min, amount);
            }
            return min;
        }
    }
}
