package com.bastion.correlation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * DBSCAN over feature vectors.
 *
 * Columns are standardised to zero mean and unit variance first (a constant
 * column becomes all zeros) so that hashed and geographic features do not
 * dominate the Euclidean distance. A point is a core point when at least
 * {@code minSamples} points, itself included, lie within {@code eps}.
 */
public class DensityClusterer {

    /**
     * Label of points that belong to no cluster
     */
    public static final int NOISE = -1;

    private static final int UNVISITED = -2;

    private final double eps;
    private final int minSamples;

    public DensityClusterer(double eps, int minSamples) {
        if (eps <= 0) {
            throw new IllegalArgumentException("eps must be positive: " + eps);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1: " + minSamples);
        }
        this.eps = eps;
        this.minSamples = minSamples;
    }

    /**
     * @return one label per input row: a cluster number starting at 0, or {@link #NOISE}
     */
    public int[] cluster(double[][] features) {
        int n = features.length;
        int[] labels = new int[n];
        Arrays.fill(labels, UNVISITED);
        if (n == 0) {
            return labels;
        }

        double[][] points = standardize(features);
        int cluster = 0;

        for (int i = 0; i < n; i++) {
            if (labels[i] != UNVISITED) {
                continue;
            }
            List<Integer> neighbours = regionQuery(points, i);
            if (neighbours.size() < minSamples) {
                labels[i] = NOISE;
                continue;
            }

            labels[i] = cluster;
            Deque<Integer> seeds = new ArrayDeque<>(neighbours);
            while (!seeds.isEmpty()) {
                int j = seeds.poll();
                if (labels[j] == NOISE) {
                    // border point
                    labels[j] = cluster;
                }
                if (labels[j] != UNVISITED) {
                    continue;
                }
                labels[j] = cluster;
                List<Integer> expansion = regionQuery(points, j);
                if (expansion.size() >= minSamples) {
                    seeds.addAll(expansion);
                }
            }
            cluster++;
        }
        return labels;
    }

    private List<Integer> regionQuery(double[][] points, int index) {
        List<Integer> result = new ArrayList<>();
        double epsSquared = eps * eps;
        for (int k = 0; k < points.length; k++) {
            if (squaredDistance(points[index], points[k]) <= epsSquared) {
                result.add(k);
            }
        }
        return result;
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int d = 0; d < a.length; d++) {
            double diff = a[d] - b[d];
            sum += diff * diff;
        }
        return sum;
    }

    static double[][] standardize(double[][] features) {
        int n = features.length;
        int dims = features[0].length;
        double[][] result = new double[n][dims];

        for (int d = 0; d < dims; d++) {
            double mean = 0.0;
            for (double[] row : features) {
                if (row.length != dims) {
                    throw new IllegalArgumentException("Feature rows have different lengths");
                }
                mean += row[d];
            }
            mean /= n;

            double variance = 0.0;
            for (double[] row : features) {
                variance += (row[d] - mean) * (row[d] - mean);
            }
            double std = Math.sqrt(variance / n);

            for (int i = 0; i < n; i++) {
                double value = features[i][d];
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    throw new IllegalArgumentException("Non-finite feature value in column " + d);
                }
                result[i][d] = std > 0 ? (value - mean) / std : 0.0;
            }
        }
        return result;
    }

    public double getEps() {
        return eps;
    }

    public int getMinSamples() {
        return minSamples;
    }
}
