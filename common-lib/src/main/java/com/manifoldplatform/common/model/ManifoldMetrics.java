package com.manifoldplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable output of one {@code ManifoldEngine.analyze} call.
 *
 * <p>Every array has the length of the analysed price series. Arrays are
 * copied on construction and on access. Wire names match the JSON the
 * presentation layer consumes ({@code local_entropy}, {@code ricci_flow}).
 */
public record ManifoldMetrics(
    @JsonProperty("timestamp") double[] timestamp,
    @JsonProperty("prices") double[] prices,
    @JsonProperty("curvature") double[] curvature,
    @JsonProperty("entropy") double entropy,
    @JsonProperty("local_entropy") double[] localEntropy,
    @JsonProperty("singularities") List<Integer> singularities,
    @JsonProperty("attractors") List<Attractor> attractors,
    @JsonProperty("ricci_flow") double[] ricciFlow,
    @JsonProperty("tension") double[] tension,
    @JsonProperty("timescale") TimeScale timescale
) {
    public ManifoldMetrics {
        timestamp = copy(timestamp);
        prices = copy(prices);
        curvature = copy(curvature);
        localEntropy = copy(localEntropy);
        ricciFlow = copy(ricciFlow);
        tension = copy(tension);
        singularities = singularities == null ? List.of() : List.copyOf(singularities);
        attractors = attractors == null ? List.of() : List.copyOf(attractors);
    }

    @Override
    public double[] timestamp() {
        return timestamp.clone();
    }

    @Override
    public double[] prices() {
        return prices.clone();
    }

    @Override
    public double[] curvature() {
        return curvature.clone();
    }

    @Override
    public double[] localEntropy() {
        return localEntropy.clone();
    }

    @Override
    public double[] ricciFlow() {
        return ricciFlow.clone();
    }

    @Override
    public double[] tension() {
        return tension.clone();
    }

    public int size() {
        return prices.length;
    }

    public double latestPrice() {
        return last(prices);
    }

    public double latestCurvature() {
        return last(curvature);
    }

    public double latestTension() {
        return last(tension);
    }

    public double latestLocalEntropy() {
        return last(localEntropy);
    }

    public double latestRicciFlow() {
        return last(ricciFlow);
    }

    private static double last(double[] values) {
        return values.length == 0 ? 0.0 : values[values.length - 1];
    }

    private static double[] copy(double[] values) {
        return values == null ? new double[0] : values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ManifoldMetrics other)) return false;
        return Double.compare(entropy, other.entropy) == 0
            && Arrays.equals(timestamp, other.timestamp)
            && Arrays.equals(prices, other.prices)
            && Arrays.equals(curvature, other.curvature)
            && Arrays.equals(localEntropy, other.localEntropy)
            && singularities.equals(other.singularities)
            && attractors.equals(other.attractors)
            && Arrays.equals(ricciFlow, other.ricciFlow)
            && Arrays.equals(tension, other.tension)
            && timescale == other.timescale;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(entropy, singularities, attractors, timescale);
        result = 31 * result + Arrays.hashCode(prices);
        result = 31 * result + Arrays.hashCode(curvature);
        result = 31 * result + Arrays.hashCode(tension);
        return result;
    }

    @Override
    public String toString() {
        return "ManifoldMetrics[timescale=" + timescale + ", size=" + prices.length
            + ", entropy=" + entropy + ", singularities=" + singularities.size()
            + ", attractors=" + attractors.size() + "]";
    }
}
