package com.grid.analytics.model;

/**
 * Standardization parameters of one continuous feature: {@code (x - mean) / std}.
 */
public record ScalingParameter(double mean, double std) {

    public double apply(double value) {
        return (value - mean) / std;
    }

    public double invert(double scaled) {
        return scaled * std + mean;
    }
}
