package org.ctanalytics.anomaly.engine.detector.scorer;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.ctanalytics.anomaly.engine.datamodel.FeatureSchema;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;
import org.ctanalytics.anomaly.engine.detector.DetectorConfig;

/**
 * Isolation forest. Points that are isolated by few random splits score close to 1. The decision
 * threshold is the (1 - contamination) quantile of the in-sample training scores.
 */
public class IsolationScorer implements AnomalyScorer {
  private static final double EULER_GAMMA = 0.5772156649;

  private final FeatureSchema schema;
  private final int trees;
  private final int sampleSize;
  private final double contamination;
  private final long seed;

  public IsolationScorer(DetectorConfig config, FeatureSchema schema) {
    Preconditions.checkArgument(config.getIsolationTrees() > 0, "isolation.trees must be > 0");
    Preconditions.checkArgument(
        config.getIsolationContamination() > 0 && config.getIsolationContamination() < 1,
        "isolation.contamination must be in (0, 1)");
    this.schema = schema;
    this.trees = config.getIsolationTrees();
    this.sampleSize = config.getIsolationSampleSize();
    this.contamination = config.getIsolationContamination();
    this.seed = config.getSeed();
  }

  @Override
  public ScorerType type() {
    return ScorerType.ISOLATION;
  }

  @Override
  public TrainedScorer train(List<FeatureVector> history) {
    Preconditions.checkArgument(!history.isEmpty(), "cannot train on empty history");
    List<String> features = schema.getFeatureNames();
    double[][] points = new double[history.size()][];
    for (int i = 0; i < points.length; i++) {
      points[i] = history.get(i).toArray(features);
    }

    RandomGenerator random = new MersenneTwister(seed);
    int psi = Math.min(sampleSize, points.length);
    int maxDepth = (int) Math.ceil(Math.log(psi) / Math.log(2));
    List<Node> forest = new ArrayList<>(trees);
    for (int t = 0; t < trees; t++) {
      forest.add(build(sample(points, psi, random), 0, maxDepth, random));
    }
    double normalizer = averagePathLength(psi);
    Forest model = new Forest(ImmutableList.copyOf(forest), normalizer <= 0 ? 1.0 : normalizer);

    double[] trainingScores = new double[points.length];
    for (int i = 0; i < points.length; i++) {
      trainingScores[i] = model.score(points[i]);
    }
    double threshold = new Percentile().evaluate(trainingScores, 100 * (1 - contamination));
    return new TrainedIsolationScorer(features, model, threshold);
  }

  private static List<double[]> sample(double[][] points, int size, RandomGenerator random) {
    // partial Fisher-Yates over indices, sampling without replacement
    int[] indices = new int[points.length];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = i;
    }
    List<double[]> sample = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      int j = i + random.nextInt(indices.length - i);
      int swap = indices[i];
      indices[i] = indices[j];
      indices[j] = swap;
      sample.add(points[indices[i]]);
    }
    return sample;
  }

  private static Node build(
      List<double[]> points, int depth, int maxDepth, RandomGenerator random) {
    int dims = points.get(0).length;
    double[] min = new double[dims];
    double[] max = new double[dims];
    for (int d = 0; d < dims; d++) {
      min[d] = Double.POSITIVE_INFINITY;
      max[d] = Double.NEGATIVE_INFINITY;
    }
    for (double[] point : points) {
      for (int d = 0; d < dims; d++) {
        min[d] = Math.min(min[d], point[d]);
        max[d] = Math.max(max[d], point[d]);
      }
    }
    if (depth >= maxDepth || points.size() <= 1) {
      return Node.leaf(min, max, points.size());
    }
    List<Integer> splittable = new ArrayList<>();
    for (int d = 0; d < dims; d++) {
      if (max[d] > min[d]) {
        splittable.add(d);
      }
    }
    if (splittable.isEmpty()) {
      return Node.leaf(min, max, points.size());
    }
    int dimension = splittable.get(random.nextInt(splittable.size()));
    double splitValue = min[dimension] + random.nextDouble() * (max[dimension] - min[dimension]);
    List<double[]> left = new ArrayList<>();
    List<double[]> right = new ArrayList<>();
    for (double[] point : points) {
      if (point[dimension] < splitValue) {
        left.add(point);
      } else {
        right.add(point);
      }
    }
    if (left.isEmpty() || right.isEmpty()) {
      return Node.leaf(min, max, points.size());
    }
    return Node.internal(
        min,
        max,
        dimension,
        splitValue,
        build(left, depth + 1, maxDepth, random),
        build(right, depth + 1, maxDepth, random));
  }

  /** Average path length of an unsuccessful search in a binary search tree of n points. */
  static double averagePathLength(int n) {
    if (n <= 1) {
      return 0.0;
    }
    if (n == 2) {
      return 1.0;
    }
    return 2.0 * (Math.log(n - 1) + EULER_GAMMA) - 2.0 * (n - 1) / n;
  }

  private static final class Node {
    private final double[] min;
    private final double[] max;
    private final int size;
    private final int dimension;
    private final double splitValue;
    private final Node left;
    private final Node right;

    private Node(
        double[] min,
        double[] max,
        int size,
        int dimension,
        double splitValue,
        Node left,
        Node right) {
      this.min = min;
      this.max = max;
      this.size = size;
      this.dimension = dimension;
      this.splitValue = splitValue;
      this.left = left;
      this.right = right;
    }

    static Node leaf(double[] min, double[] max, int size) {
      return new Node(min, max, size, -1, 0.0, null, null);
    }

    static Node internal(
        double[] min, double[] max, int dimension, double splitValue, Node left, Node right) {
      return new Node(min, max, left.size + right.size, dimension, splitValue, left, right);
    }

    boolean contains(double[] point) {
      for (int d = 0; d < point.length; d++) {
        if (point[d] < min[d] || point[d] > max[d]) {
          return false;
        }
      }
      return true;
    }

    double pathLength(double[] point, int depth) {
      if (!contains(point)) {
        return depth;
      }
      if (left == null) {
        return depth + averagePathLength(size);
      }
      return point[dimension] < splitValue
          ? left.pathLength(point, depth + 1)
          : right.pathLength(point, depth + 1);
    }
  }

  private static final class Forest {
    private final List<Node> trees;
    private final double normalizer;

    Forest(List<Node> trees, double normalizer) {
      this.trees = trees;
      this.normalizer = normalizer;
    }

    double score(double[] point) {
      double total = 0.0;
      for (Node tree : trees) {
        total += tree.pathLength(point, 0);
      }
      return Math.pow(2.0, -(total / trees.size()) / normalizer);
    }
  }

  private static final class TrainedIsolationScorer implements TrainedScorer {
    private final List<String> features;
    private final Forest forest;
    private final double threshold;

    TrainedIsolationScorer(List<String> features, Forest forest, double threshold) {
      this.features = features;
      this.forest = forest;
      this.threshold = threshold;
    }

    @Override
    public ScorerType type() {
      return ScorerType.ISOLATION;
    }

    @Override
    public double threshold() {
      return threshold;
    }

    @Override
    public double score(FeatureVector current, List<FeatureVector> recentHistory) {
      return forest.score(current.toArray(features));
    }
  }
}
