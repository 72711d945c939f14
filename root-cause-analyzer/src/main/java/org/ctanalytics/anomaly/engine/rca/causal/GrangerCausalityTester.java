package org.ctanalytics.anomaly.engine.rca.causal;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.ctanalytics.anomaly.engine.datamodel.CausalDirection;
import org.ctanalytics.anomaly.engine.datamodel.CausalEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second RCA stage: lagged-regression F-test in both directions of every surviving pair.
 *
 * <p>For cause x and effect y at lag L the restricted model regresses y on its own L lags and the
 * unrestricted model adds the L lags of x. The lag with the lowest p-value is kept. A regression
 * that cannot be fitted counts as p = 1.
 */
public class GrangerCausalityTester {
  private static final Logger LOGGER = LoggerFactory.getLogger(GrangerCausalityTester.class);

  static final double NOT_SIGNIFICANT = 1.0;
  private static final double SINGULARITY_THRESHOLD = 1e-10;
  private static final double MIN_RESIDUAL = 1e-12;
  private static final int MIN_DEGREES_OF_FREEDOM = 2;

  private final int maxLag;
  private final double significance;

  public GrangerCausalityTester(int maxLag, double significance) {
    this.maxLag = maxLag;
    this.significance = significance;
  }

  public CausalAnalysis analyze(Map<String, double[]> series, List<Pair<String, String>> pairs) {
    List<CausalEdge> ranking = new ArrayList<>();
    List<CausalEdge> ambiguous = new ArrayList<>();
    for (Pair<String, String> pair : pairs) {
      String a = pair.getLeft();
      String b = pair.getRight();
      LaggedTestResult aCausesB = test(series.get(a), series.get(b));
      LaggedTestResult bCausesA = test(series.get(b), series.get(a));
      boolean forward = aCausesB.getPValue() < significance;
      boolean backward = bCausesA.getPValue() < significance;
      if (forward && backward) {
        LaggedTestResult stronger =
            aCausesB.getPValue() <= bCausesA.getPValue() ? aCausesB : bCausesA;
        LOGGER.debug("Ambiguous causality between {} and {}", a, b);
        ambiguous.add(edge(a, b, stronger, CausalDirection.BIDIRECTIONAL));
      } else if (forward) {
        ranking.add(edge(a, b, aCausesB, CausalDirection.UNIDIRECTIONAL));
      } else if (backward) {
        ranking.add(edge(b, a, bCausesA, CausalDirection.UNIDIRECTIONAL));
      }
    }
    ranking.sort(Comparator.comparingDouble(CausalEdge::getPValue));
    return CausalAnalysis.builder()
        .ranking(ImmutableList.copyOf(ranking))
        .ambiguous(ImmutableList.copyOf(ambiguous))
        .build();
  }

  private static CausalEdge edge(
      String cause, String effect, LaggedTestResult result, CausalDirection direction) {
    return CausalEdge.builder()
        .causeFeature(cause)
        .effectFeature(effect)
        .lag(result.getLag())
        .pValue(result.getPValue())
        .direction(direction)
        .build();
  }

  /** Tests whether {@code cause} helps predict {@code effect}, over every feasible lag. */
  public LaggedTestResult test(double[] cause, double[] effect) {
    int n = effect.length;
    // rows (n - L) must exceed the 2L + 1 unrestricted parameters by the minimum dof
    int feasible = (n - 1 - MIN_DEGREES_OF_FREEDOM) / 3;
    int lags = Math.min(maxLag, feasible);
    LaggedTestResult best = new LaggedTestResult(1, NOT_SIGNIFICANT);
    for (int lag = 1; lag <= lags; lag++) {
      double p = pValue(cause, effect, lag);
      if (p < best.getPValue()) {
        best = new LaggedTestResult(lag, p);
      }
    }
    return best;
  }

  private static double pValue(double[] cause, double[] effect, int lag) {
    int rows = effect.length - lag;
    double[] y = new double[rows];
    double[][] restricted = new double[rows][lag];
    double[][] unrestricted = new double[rows][2 * lag];
    for (int r = 0; r < rows; r++) {
      int t = r + lag;
      y[r] = effect[t];
      for (int l = 1; l <= lag; l++) {
        restricted[r][l - 1] = effect[t - l];
        unrestricted[r][l - 1] = effect[t - l];
        unrestricted[r][lag + l - 1] = cause[t - l];
      }
    }
    double rssRestricted;
    double rssUnrestricted;
    try {
      rssRestricted = residualSumOfSquares(y, restricted);
      rssUnrestricted = residualSumOfSquares(y, unrestricted);
    } catch (MathIllegalArgumentException e) {
      // singular design, typically a constant series
      return NOT_SIGNIFICANT;
    }
    if (rssUnrestricted <= MIN_RESIDUAL * Math.max(1.0, rssRestricted)) {
      return NOT_SIGNIFICANT;
    }
    int df1 = lag;
    int df2 = rows - (2 * lag + 1);
    double f = ((rssRestricted - rssUnrestricted) / df1) / (rssUnrestricted / df2);
    if (!(f > 0)) {
      return NOT_SIGNIFICANT;
    }
    return 1.0 - new FDistribution(df1, df2).cumulativeProbability(f);
  }

  private static double residualSumOfSquares(double[] y, double[][] x) {
    OLSMultipleLinearRegression regression =
        new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
    regression.newSampleData(y, x);
    return regression.calculateResidualSumOfSquares();
  }
}
