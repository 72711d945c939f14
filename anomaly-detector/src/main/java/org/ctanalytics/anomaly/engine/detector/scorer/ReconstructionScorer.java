package org.ctanalytics.anomaly.engine.detector.scorer;

import com.google.common.base.Preconditions;
import java.util.List;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.ctanalytics.anomaly.engine.datamodel.FeatureSchema;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;
import org.ctanalytics.anomaly.engine.datamodel.exception.InsufficientHistoryException;
import org.ctanalytics.anomaly.engine.detector.DetectorConfig;

/**
 * Linear encode/decode model over sliding windows of standardized vectors. The encoder projects a
 * flattened window onto the leading principal subspace of the training windows and the decoder
 * maps it back. The score is the reconstruction error relative to the error seen on held-out
 * validation windows.
 */
public class ReconstructionScorer implements AnomalyScorer {
  private static final double MIN_SCALE = 1e-9;
  private static final double MIN_ERROR_BOUND = 1e-6;
  private static final double SINGULAR_VALUE_TOLERANCE = 1e-9;

  private final FeatureSchema schema;
  private final int windowLength;
  private final double latentRatio;
  private final double validationFraction;
  private final double threshold;

  public ReconstructionScorer(DetectorConfig config, FeatureSchema schema) {
    Preconditions.checkArgument(
        config.getReconstructionWindowLength() > 0, "reconstruction.window.length must be > 0");
    this.schema = schema;
    this.windowLength = config.getReconstructionWindowLength();
    this.latentRatio = config.getReconstructionLatentRatio();
    this.validationFraction = config.getReconstructionValidationFraction();
    this.threshold = config.getReconstructionThreshold();
  }

  @Override
  public ScorerType type() {
    return ScorerType.RECONSTRUCTION;
  }

  @Override
  public TrainedScorer train(List<FeatureVector> history) {
    int windows = history.size() - windowLength + 1;
    if (windows < 2) {
      throw new InsufficientHistoryException(
          String.format(
              "Reconstruction scorer needs at least %d vectors, got %d",
              windowLength + 1, history.size()));
    }
    List<String> features = schema.getFeatureNames();
    int dims = features.size();

    double[] means = new double[dims];
    double[] scales = new double[dims];
    for (int d = 0; d < dims; d++) {
      DescriptiveStatistics stats = new DescriptiveStatistics();
      for (FeatureVector vector : history) {
        stats.addValue(vector.get(features.get(d)));
      }
      means[d] = stats.getMean();
      double std = stats.getStandardDeviation();
      scales[d] = std < MIN_SCALE ? 1.0 : std;
    }
    Standardizer standardizer = new Standardizer(features, means, scales);

    double[][] flattened = new double[windows][];
    for (int w = 0; w < windows; w++) {
      flattened[w] = standardizer.flatten(history.subList(w, w + windowLength));
    }
    int validationCount = Math.max(1, (int) Math.floor(windows * validationFraction));
    int trainingCount = windows - validationCount;

    Subspace subspace = fit(flattened, trainingCount);
    DescriptiveStatistics validationErrors = new DescriptiveStatistics();
    for (int w = trainingCount; w < windows; w++) {
      validationErrors.addValue(subspace.reconstructionError(flattened[w]));
    }
    double errorBound =
        Math.max(
            validationErrors.getMean() + 3 * validationErrors.getStandardDeviation(),
            MIN_ERROR_BOUND);
    return new TrainedReconstructionScorer(
        standardizer, subspace, errorBound, windowLength, threshold);
  }

  private Subspace fit(double[][] flattened, int trainingCount) {
    int width = flattened[0].length;
    double[] center = new double[width];
    for (int w = 0; w < trainingCount; w++) {
      for (int c = 0; c < width; c++) {
        center[c] += flattened[w][c] / trainingCount;
      }
    }
    double[][] centered = new double[trainingCount][width];
    boolean degenerate = true;
    for (int w = 0; w < trainingCount; w++) {
      for (int c = 0; c < width; c++) {
        centered[w][c] = flattened[w][c] - center[c];
        degenerate &= centered[w][c] == 0.0;
      }
    }
    if (degenerate) {
      return new Subspace(center, new double[width][0]);
    }

    SingularValueDecomposition svd =
        new SingularValueDecomposition(new Array2DRowRealMatrix(centered, false));
    double[] singularValues = svd.getSingularValues();
    double tolerance = SINGULAR_VALUE_TOLERANCE * Math.max(1.0, singularValues[0]);
    int nonDegenerate = 0;
    for (double value : singularValues) {
      if (value > tolerance) {
        nonDegenerate++;
      }
    }
    int latent = Math.min((int) Math.ceil(latentRatio * width), nonDegenerate);
    RealMatrix v = svd.getV();
    double[][] basis = new double[width][latent];
    for (int r = 0; r < width; r++) {
      for (int k = 0; k < latent; k++) {
        basis[r][k] = v.getEntry(r, k);
      }
    }
    return new Subspace(center, basis);
  }

  private static final class Standardizer {
    private final List<String> features;
    private final double[] means;
    private final double[] scales;

    Standardizer(List<String> features, double[] means, double[] scales) {
      this.features = features;
      this.means = means;
      this.scales = scales;
    }

    double[] flatten(List<FeatureVector> window) {
      int dims = features.size();
      double[] flat = new double[window.size() * dims];
      for (int i = 0; i < window.size(); i++) {
        for (int d = 0; d < dims; d++) {
          flat[i * dims + d] = (window.get(i).get(features.get(d)) - means[d]) / scales[d];
        }
      }
      return flat;
    }
  }

  private static final class Subspace {
    private final double[] center;
    // width x latent, orthonormal columns
    private final double[][] basis;

    Subspace(double[] center, double[][] basis) {
      this.center = center;
      this.basis = basis;
    }

    double reconstructionError(double[] window) {
      int width = center.length;
      int latent = basis.length == 0 ? 0 : basis[0].length;
      double[] centered = new double[width];
      for (int c = 0; c < width; c++) {
        centered[c] = window[c] - center[c];
      }
      double[] code = new double[latent];
      for (int k = 0; k < latent; k++) {
        for (int c = 0; c < width; c++) {
          code[k] += basis[c][k] * centered[c];
        }
      }
      double squaredError = 0.0;
      for (int c = 0; c < width; c++) {
        double decoded = 0.0;
        for (int k = 0; k < latent; k++) {
          decoded += basis[c][k] * code[k];
        }
        double residual = centered[c] - decoded;
        squaredError += residual * residual;
      }
      return squaredError / width;
    }
  }

  private static final class TrainedReconstructionScorer implements TrainedScorer {
    private final Standardizer standardizer;
    private final Subspace subspace;
    private final double errorBound;
    private final int windowLength;
    private final double threshold;

    TrainedReconstructionScorer(
        Standardizer standardizer,
        Subspace subspace,
        double errorBound,
        int windowLength,
        double threshold) {
      this.standardizer = standardizer;
      this.subspace = subspace;
      this.errorBound = errorBound;
      this.windowLength = windowLength;
      this.threshold = threshold;
    }

    @Override
    public ScorerType type() {
      return ScorerType.RECONSTRUCTION;
    }

    @Override
    public double threshold() {
      return threshold;
    }

    @Override
    public double score(FeatureVector current, List<FeatureVector> recentHistory) {
      return subspace.reconstructionError(standardizer.flatten(window(current, recentHistory)))
          / errorBound;
    }

    // last windowLength - 1 history vectors then current, left-padded with the oldest available
    private List<FeatureVector> window(FeatureVector current, List<FeatureVector> recentHistory) {
      FeatureVector[] window = new FeatureVector[windowLength];
      window[windowLength - 1] = current;
      int available = Math.min(windowLength - 1, recentHistory.size());
      for (int i = 0; i < available; i++) {
        window[windowLength - 2 - i] = recentHistory.get(recentHistory.size() - 1 - i);
      }
      for (int i = windowLength - 2 - available; i >= 0; i--) {
        window[i] = window[i + 1];
      }
      return List.of(window);
    }
  }
}
