package org.ctanalytics.anomaly.engine.rca.causal;

/** Best lag of one directional test and its p-value. */
public class LaggedTestResult {
  private final int lag;
  private final double pValue;

  LaggedTestResult(int lag, double pValue) {
    this.lag = lag;
    this.pValue = pValue;
  }

  public int getLag() {
    return lag;
  }

  public double getPValue() {
    return pValue;
  }
}
