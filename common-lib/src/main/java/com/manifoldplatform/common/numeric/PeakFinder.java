package com.manifoldplatform.common.numeric;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Local-maximum detection with height, separation and prominence filters.
 *
 * <p>Filters are applied in a fixed order:
 * <ol>
 *   <li>candidates - samples strictly greater than their left neighbour and
 *       greater than the first differing sample to their right; a flat top
 *       resolves to its (left-biased) midpoint; the two end samples never qualify</li>
 *   <li>height - candidate value ≥ {@code minHeight}</li>
 *   <li>distance - walking candidates from highest to lowest, every lower
 *       candidate closer than {@code minDistance} samples to a kept one is dropped</li>
 *   <li>prominence - value minus the higher of the two lowest points reached
 *       before meeting a higher sample (or the array end) on either side</li>
 * </ol>
 *
 * <p>Stateless; returned indices are ascending.
 */
public final class PeakFinder {

    private final Double minHeight;
    private final Double minProminence;
    private final int minDistance;

    private PeakFinder(Double minHeight, Double minProminence, int minDistance) {
        this.minHeight = minHeight;
        this.minProminence = minProminence;
        this.minDistance = minDistance;
    }

    public static PeakFinder withHeight(double minHeight, int minDistance) {
        return new PeakFinder(minHeight, null, minDistance);
    }

    public static PeakFinder withProminence(double minProminence, int minDistance) {
        return new PeakFinder(null, minProminence, minDistance);
    }

    public int[] find(double[] x) {
        List<Integer> peaks = localMaxima(x);

        if (minHeight != null) {
            peaks.removeIf(p -> !(x[p] >= minHeight));
        }
        if (minDistance > 1 && peaks.size() > 1) {
            peaks = selectByDistance(x, peaks, minDistance);
        }
        if (minProminence != null) {
            peaks.removeIf(p -> !(prominence(x, p) >= minProminence));
        }
        return peaks.stream().mapToInt(Integer::intValue).toArray();
    }

    static List<Integer> localMaxima(double[] x) {
        List<Integer> peaks = new ArrayList<>();
        int i = 1;
        int last = x.length - 1;
        while (i < last) {
            if (x[i - 1] < x[i]) {
                int ahead = i + 1;
                while (ahead < last && x[ahead] == x[i]) ahead++;
                if (x[ahead] < x[i]) {
                    int leftEdge = i;
                    int rightEdge = ahead - 1;
                    peaks.add((leftEdge + rightEdge) / 2);
                    i = ahead;
                }
            }
            i++;
        }
        return peaks;
    }

    static double prominence(double[] x, int peak) {
        double leftMin = x[peak];
        for (int i = peak; i >= 0 && x[i] <= x[peak]; i--) {
            leftMin = Math.min(leftMin, x[i]);
        }
        double rightMin = x[peak];
        for (int i = peak; i < x.length && x[i] <= x[peak]; i++) {
            rightMin = Math.min(rightMin, x[i]);
        }
        return x[peak] - Math.max(leftMin, rightMin);
    }

    private static List<Integer> selectByDistance(double[] x, List<Integer> peaks, int distance) {
        int count = peaks.size();
        boolean[] keep = new boolean[count];
        Arrays.fill(keep, true);

        // ascending by height, ties by position; visited from the end
        Integer[] order = new Integer[count];
        for (int k = 0; k < count; k++) order[k] = k;
        Arrays.sort(order, Comparator.comparingDouble(k -> x[peaks.get(k)]));

        for (int o = count - 1; o >= 0; o--) {
            int j = order[o];
            if (!keep[j]) continue;
            for (int k = j - 1; k >= 0 && peaks.get(j) - peaks.get(k) < distance; k--) {
                keep[k] = false;
            }
            for (int k = j + 1; k < count && peaks.get(k) - peaks.get(j) < distance; k++) {
                keep[k] = false;
            }
        }

        List<Integer> selected = new ArrayList<>();
        for (int k = 0; k < count; k++) {
            if (keep[k]) selected.add(peaks.get(k));
        }
        return selected;
    }
}
