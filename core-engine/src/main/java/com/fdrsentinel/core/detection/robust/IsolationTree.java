package com.fdrsentinel.core.detection.robust;

import java.util.Random;

/**
 * One randomly grown isolation tree. Immutable once built.
 *
 * @since 1.0.0
 */
final class IsolationTree {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    /**
     * Grow a tree on the given sample rows.
     *
     * @param data        all rows
     * @param sample      indices of the rows this tree sees
     * @param heightLimit maximum depth
     * @param random      source of split choices
     */
    static IsolationTree grow(double[][] data, int[] sample, int heightLimit, Random random) {
        return new IsolationTree(build(data, sample, 0, heightLimit, random));
    }

    /**
     * @return depth of the leaf reached by {@code row} plus the expected
     *         remaining depth for the rows that leaf holds
     */
    double pathLength(double[] row) {
        Node node = root;
        int depth = 0;
        while (node.left != null) {
            node = row[node.feature] < node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful binary-search-tree lookup among
     * {@code n} items.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static Node build(double[][] data, int[] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int features = data[0].length;
        double[] min = new double[features];
        double[] max = new double[features];
        int candidates = 0;
        for (int f = 0; f < features; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
            for (int r : rows) {
                min[f] = Math.min(min[f], data[r][f]);
                max[f] = Math.max(max[f], data[r][f]);
            }
            if (max[f] > min[f]) {
                candidates++;
            }
        }
        if (candidates == 0) {
            return Node.leaf(rows.length);
        }

        int pick = random.nextInt(candidates);
        int feature = -1;
        for (int f = 0; f < features; f++) {
            if (max[f] > min[f] && pick-- == 0) {
                feature = f;
                break;
            }
        }
        double split;
        do {
            split = min[feature] + random.nextDouble() * (max[feature] - min[feature]);
        } while (split <= min[feature]);

        int leftCount = 0;
        for (int r : rows) {
            if (data[r][feature] < split) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int l = 0;
        int rr = 0;
        for (int r : rows) {
            if (data[r][feature] < split) {
                left[l++] = r;
            } else {
                right[rr++] = r;
            }
        }
        return Node.split(feature, split,
                build(data, left, depth + 1, heightLimit, random),
                build(data, right, depth + 1, heightLimit, random));
    }

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node split(int feature, double split, Node left, Node right) {
            return new Node(feature, split, left, right, left.size + right.size);
        }
    }
}
