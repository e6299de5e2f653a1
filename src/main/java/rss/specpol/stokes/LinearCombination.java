package rss.specpol.stokes;

/**
 * Combination of the LINEAR pattern: two waveplate pairs, the first measuring Q and the second
 * measuring U directly. Both pairs are required. A wavelength is valid where calibration is
 * available and both pairs have at least one valid cycle; Q and U are independent, so the QU
 * covariance is zero.
 */
public class LinearCombination extends PatternCombination {

  @Override
  boolean isUsable(boolean[] present) {
    for (boolean pair : present) {
      if (!pair) {
        return false;
      }
    }
    return true;
  }

  @Override
  CombinedStokes backend(NormalizedPairs pairs) {
    int wavs = pairs.wavs;
    boolean[] ok = pairs.okCal.clone();
    for (int p = 0; p < pairs.pairCount; ++p) {
      boolean[] have = pairs.hasData(p);
      for (int w = 0; w < wavs; ++w) {
        ok[w] &= have[w];
      }
    }

    double[][] stokes = new double[3][];
    double[][] variance = new double[4][];
    stokes[0] = pairs.intensity.clone();
    variance[0] = pairs.intensityVariance.clone();
    for (int p = 0; p < 2; ++p) {
      stokes[p + 1] = new double[wavs];
      variance[p + 1] = new double[wavs];
      for (int w = 0; w < wavs; ++w) {
        if (!ok[w]) {
          continue;
        }
        double scale = pairs.intensity[w] / pairs.stokes[p][0][w];
        stokes[p + 1][w] = pairs.stokes[p][1][w] * scale;
        variance[p + 1][w] = pairs.variance[p][1][w] * scale * scale;
      }
    }
    variance[3] = new double[wavs];

    return new CombinedStokes(stokes, variance, ok);
  }
}
