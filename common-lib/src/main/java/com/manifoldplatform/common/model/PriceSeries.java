package com.manifoldplatform.common.model;

import com.manifoldplatform.common.exception.InsufficientDataException;
import com.manifoldplatform.common.exception.MalformedSeriesException;

import java.util.Arrays;

/**
 * Ordered price samples with optional parallel volume and timestamp arrays.
 *
 * <p>All arrays are copied on the way in and on the way out, so the caller's
 * buffers are never shared with or mutated by the engine. When timestamps are
 * omitted the sequential index {@code 0..N-1} is substituted.
 *
 * @param prices     at least two finite prices
 * @param volume     {@code null}, or one non-negative volume per price
 * @param timestamps one non-decreasing timestamp per price
 */
public record PriceSeries(double[] prices, double[] volume, double[] timestamps) {

    public static final int MIN_SAMPLES = 2;

    public PriceSeries {
        if (prices == null || prices.length < MIN_SAMPLES) {
            throw new InsufficientDataException("PriceSeries", MIN_SAMPLES, prices == null ? 0 : prices.length);
        }
        for (int i = 0; i < prices.length; i++) {
            if (!Double.isFinite(prices[i])) {
                throw new MalformedSeriesException("PriceSeries", "price at index " + i + " is not finite");
            }
        }
        prices = prices.clone();

        if (volume != null) {
            if (volume.length != prices.length) {
                throw new MalformedSeriesException("PriceSeries",
                    "volume length " + volume.length + " does not match price length " + prices.length);
            }
            for (int i = 0; i < volume.length; i++) {
                if (!(volume[i] >= 0.0) || Double.isInfinite(volume[i])) {
                    throw new MalformedSeriesException("PriceSeries", "volume at index " + i + " must be finite and >= 0");
                }
            }
            volume = volume.clone();
        }

        if (timestamps == null) {
            timestamps = sequentialIndex(prices.length);
        } else {
            if (timestamps.length != prices.length) {
                throw new MalformedSeriesException("PriceSeries",
                    "timestamp length " + timestamps.length + " does not match price length " + prices.length);
            }
            for (int i = 1; i < timestamps.length; i++) {
                if (timestamps[i] < timestamps[i - 1]) {
                    throw new MalformedSeriesException("PriceSeries", "timestamps decrease at index " + i);
                }
            }
            timestamps = timestamps.clone();
        }
    }

    public static PriceSeries of(double[] prices) {
        return new PriceSeries(prices, null, null);
    }

    public static PriceSeries of(double[] prices, double[] volume) {
        return new PriceSeries(prices, volume, null);
    }

    public static PriceSeries of(double[] prices, double[] volume, double[] timestamps) {
        return new PriceSeries(prices, volume, timestamps);
    }

    @Override
    public double[] prices() {
        return prices.clone();
    }

    @Override
    public double[] volume() {
        return volume == null ? null : volume.clone();
    }

    @Override
    public double[] timestamps() {
        return timestamps.clone();
    }

    public boolean hasVolume() {
        return volume != null;
    }

    public int size() {
        return prices.length;
    }

    public double lastPrice() {
        return prices[prices.length - 1];
    }

    /**
     * Keeps every {@code stride}-th sample starting at index 0. Volume and
     * timestamps are decimated alongside the prices.
     *
     * @throws InsufficientDataException when fewer than two samples survive
     */
    public PriceSeries decimate(int stride) {
        if (stride <= 1) {
            return this;
        }
        int kept = (prices.length + stride - 1) / stride;
        double[] p = new double[kept];
        double[] t = new double[kept];
        double[] v = volume == null ? null : new double[kept];
        for (int i = 0, j = 0; i < prices.length; i += stride, j++) {
            p[j] = prices[i];
            t[j] = timestamps[i];
            if (v != null) v[j] = volume[i];
        }
        if (kept < MIN_SAMPLES) {
            throw new InsufficientDataException("PriceSeries.decimate(" + stride + ")", MIN_SAMPLES, kept);
        }
        return new PriceSeries(p, v, t);
    }

    private static double[] sequentialIndex(int n) {
        double[] index = new double[n];
        for (int i = 0; i < n; i++) index[i] = i;
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriceSeries other)) return false;
        return Arrays.equals(prices, other.prices)
            && Arrays.equals(volume, other.volume)
            && Arrays.equals(timestamps, other.timestamps);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(prices);
        result = 31 * result + Arrays.hashCode(volume);
        result = 31 * result + Arrays.hashCode(timestamps);
        return result;
    }

    @Override
    public String toString() {
        return "PriceSeries[size=" + prices.length + ", volume=" + (volume != null) + "]";
    }
}
