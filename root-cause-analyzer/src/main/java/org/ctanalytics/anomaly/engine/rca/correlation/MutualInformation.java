package org.ctanalytics.anomaly.engine.rca.correlation;

/**
 * Normalized mutual information over an equal-width histogram with ceil(sqrt(n)) bins per axis,
 * divided by the smaller marginal entropy. A constant series carries no information and yields 0.
 */
final class MutualInformation {

  private MutualInformation() {}

  static double normalized(double[] x, double[] y) {
    int n = x.length;
    if (n < 2) {
      return 0.0;
    }
    int bins = (int) Math.ceil(Math.sqrt(n));
    int[] bx = discretize(x, bins);
    int[] by = discretize(y, bins);

    double[] px = new double[bins];
    double[] py = new double[bins];
    double[][] joint = new double[bins][bins];
    for (int i = 0; i < n; i++) {
      px[bx[i]] += 1.0 / n;
      py[by[i]] += 1.0 / n;
      joint[bx[i]][by[i]] += 1.0 / n;
    }
    double hx = entropy(px);
    double hy = entropy(py);
    double denominator = Math.min(hx, hy);
    if (denominator <= 0) {
      return 0.0;
    }
    double mi = 0.0;
    for (int a = 0; a < bins; a++) {
      for (int b = 0; b < bins; b++) {
        if (joint[a][b] > 0) {
          mi += joint[a][b] * Math.log(joint[a][b] / (px[a] * py[b]));
        }
      }
    }
    return Math.max(0.0, Math.min(1.0, mi / denominator));
  }

  private static int[] discretize(double[] values, int bins) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double value : values) {
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    int[] binned = new int[values.length];
    double width = (max - min) / bins;
    if (width <= 0) {
      return binned;
    }
    for (int i = 0; i < values.length; i++) {
      binned[i] = Math.min(bins - 1, (int) ((values[i] - min) / width));
    }
    return binned;
  }

  private static double entropy(double[] distribution) {
    double h = 0.0;
    for (double p : distribution) {
      if (p > 0) {
        h -= p * Math.log(p);
      }
    }
    return h;
  }
}
