package com.vitals.analytics.engine;

/**
 * Z-score classification of a single sample against window statistics.
 *
 * <p>A zero standard deviation never yields an anomaly: the z-score is not computed and reported as 0.
 */
public final class AnomalyClassifier {

  public static final double DEFAULT_THRESHOLD = 2.0;

  private AnomalyClassifier() { }

  public static Classification classify(double value, double mean, double stdDev, double threshold) {
    if (stdDev == 0.0) {
      return Classification.NORMAL_ZERO_VARIANCE;
    }
    double z = (value - mean) / stdDev;
    return new Classification(Math.abs(z) > threshold, z);
  }

  public static Classification classify(double value, double mean, double stdDev) {
    return classify(value, mean, stdDev, DEFAULT_THRESHOLD);
  }

  public record Classification(boolean anomaly, double zScore) {
    static final Classification NORMAL_ZERO_VARIANCE = new Classification(false, 0.0);
  }
}
