package com.fdrsentinel.core.detection.robust;

import com.fdrsentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Isolation forest outlier ensemble.
 *
 * <h3>Fitting</h3>
 * <p>
 * Each tree is grown on {@code min(sampleSize, rows)} rows drawn without
 * replacement, with height limit {@code ceil(log2(psi))}. Trees are grown in
 * parallel, each from its own seed drawn up front from the forest seed, so
 * the result does not depend on scheduling.
 * </p>
 *
 * <h3>Scoring</h3>
 * <p>
 * {@code score(x) = 2^(-E[h(x)] / c(psi))}, in (0, 1]; higher is more
 * anomalous. A row is an outlier when its score is strictly above the
 * {@code (1 - contamination)} percentile of the training scores.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForest {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForest.class);

    private final int trees;
    private final int sampleSize;
    private final double contamination;
    private final long seed;

    private List<IsolationTree> forest;
    private double normalizer;
    private double offset;

    public IsolationForest(int trees, int sampleSize, double contamination, long seed) {
        if (trees <= 0 || sampleSize <= 0) {
            throw new IllegalArgumentException("trees and sampleSize must be positive");
        }
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
        }
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.contamination = contamination;
        this.seed = seed;
    }

    public void fit(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
        }
        int psi = Math.min(sampleSize, rows.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));

        Random seeds = new Random(seed);
        long[] treeSeeds = new long[trees];
        for (int t = 0; t < trees; t++) {
            treeSeeds[t] = seeds.nextLong();
        }

        forest = IntStream.range(0, trees)
                .parallel()
                .mapToObj(t -> {
                    Random random = new Random(treeSeeds[t]);
                    return IsolationTree.grow(rows, sample(rows.length, psi, random), heightLimit, random);
                })
                .toList();
        normalizer = IsolationTree.averagePathLength(psi);

        double[] training = scores(rows);
        offset = Stats.percentile(training, 100.0 * (1.0 - contamination));
        LOG.info("Grew {} isolation tree(s) on samples of {} row(s); outlier offset {}", trees, psi, offset);
    }

    /**
     * @return anomaly score per row
     */
    public double[] scores(double[][] rows) {
        if (forest == null) {
            throw new IllegalStateException("Isolation forest has not been fitted");
        }
        double[] scores = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            double total = 0.0;
            for (IsolationTree tree : forest) {
                total += tree.pathLength(rows[r]);
            }
            double mean = total / forest.size();
            scores[r] = normalizer == 0.0 ? 1.0 : Math.pow(2.0, -mean / normalizer);
        }
        return scores;
    }

    public boolean isOutlier(double score) {
        return score > offset;
    }

    public double getOffset() {
        return offset;
    }

    private static int[] sample(int rows, int size, Random random) {
        int[] pool = new int[rows];
        for (int i = 0; i < rows; i++) {
            pool[i] = i;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(rows - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(pool, 0, sample, 0, size);
        return sample;
    }
}
