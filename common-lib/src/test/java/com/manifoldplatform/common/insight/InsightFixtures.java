package com.manifoldplatform.common.insight;

import com.manifoldplatform.common.model.Attractor;
import com.manifoldplatform.common.model.ManifoldMetrics;
import com.manifoldplatform.common.model.TimeScale;

import java.util.Arrays;
import java.util.List;

/** Hand-built snapshots with flat per-sample arrays. */
final class InsightFixtures {

    private InsightFixtures() {}

    static ManifoldMetrics flat(int n, double price, double tension, double localEntropy, double globalEntropy,
                                List<Integer> singularities, List<Attractor> attractors) {
        return new ManifoldMetrics(index(n), filled(n, price), filled(n, 0.0), globalEntropy,
            filled(n, localEntropy), singularities, attractors, filled(n, 0.0), filled(n, tension),
            TimeScale.DAILY);
    }

    static double[] filled(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    private static double[] index(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) values[i] = i;
        return values;
    }
}
