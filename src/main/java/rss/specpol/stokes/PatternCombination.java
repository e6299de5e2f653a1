package rss.specpol.stokes;

import org.apache.log4j.Logger;

/**
 * Template for merging the cycle-combined waveplate pairs of one observation into final
 * I, Q, U spectra. Concrete extensions define which subsets of pairs are usable and the
 * backend that turns the pairs into Q and U; the pair intensity normalization and the total
 * intensity are common to all patterns.
 *
 * Pairs are passed indexed by their position in the pattern, with null for pairs the
 * observation does not have. Each combination instance is only used for one observation.
 */
public abstract class PatternCombination {

  private static final Logger logger = Logger.getLogger(PatternCombination.class);

  /**
   * Merge the pairs of an observation
   *
   * @param pairs cycle-combined pairs indexed by pattern position (null where missing)
   * @param okCal wavelengths where every enabled calibration is available
   * @return combined stokes with validity mask and diagnostics
   * @throws ObservationSkippedException if the available pairs cannot produce Q and U
   */
  public CombinedStokes combine(WaveplatePair[] pairs, boolean[] okCal)
      throws ObservationSkippedException {
    boolean[] present = new boolean[pairs.length];
    int count = 0;
    for (int p = 0; p < pairs.length; ++p) {
      present[p] = pairs[p] != null;
      if (present[p]) {
        ++count;
      }
    }
    if (count < 2) {
      throw new ObservationSkippedException("Only " + count + " pair, skipping observation");
    }
    if (count < pairs.length && !isUsable(present)) {
      throw new ObservationSkippedException("Pattern not usable, skipping observation");
    }
    return backend(new NormalizedPairs(pairs, okCal));
  }

  /**
   * Whether an incomplete set of pairs still determines both Q and U
   *
   * @param present which pattern pairs the observation has
   * @return true if the observation can be combined
   */
  abstract boolean isUsable(boolean[] present);

  /**
   * Compute Q and U from the normalized pairs
   *
   * @param pairs normalized pairs and total intensity
   * @return combined stokes
   */
  abstract CombinedStokes backend(NormalizedPairs pairs);

  /**
   * The pairs of an observation with their intensities rescaled to a common level, and the
   * total intensity. The scale of each pair is its summed intensity over the wavelengths where
   * every present pair has all of its cycles and calibration is available, relative to the mean
   * of those sums; this removes throughput drift between pairs without changing polarization.
   */
  static class NormalizedPairs {

    final int pairCount;
    final int wavs;
    final boolean[] present;
    final WaveplatePair[] pairs;
    // indexed by pair, then sum/difference row, then wavelength; null for missing pairs
    final double[][][] stokes;
    final double[][][] variance;
    final int[][] cycleCount;
    final boolean[] okCal;
    final boolean[] okAll;
    final double[] intensity;
    final double[] intensityVariance;

    NormalizedPairs(WaveplatePair[] pairs, boolean[] okCal) {
      this.pairs = pairs.clone();
      this.okCal = okCal.clone();
      pairCount = pairs.length;
      wavs = okCal.length;
      present = new boolean[pairCount];
      stokes = new double[pairCount][][];
      variance = new double[pairCount][][];
      cycleCount = new int[pairCount][wavs];

      okAll = okCal.clone();
      int presentCount = 0;
      for (int p = 0; p < pairCount; ++p) {
        if (pairs[p] == null) {
          continue;
        }
        present[p] = true;
        ++presentCount;
        stokes[p] = pairs[p].getStokes();
        variance[p] = pairs[p].getVariance();
        cycleCount[p] = pairs[p].getCycleCount();
        boolean[] complete = pairs[p].getAllCyclesValid();
        for (int w = 0; w < wavs; ++w) {
          okAll[w] &= complete[w];
        }
      }

      double[] sums = new double[pairCount];
      double meanSum = 0.;
      boolean anyNormal = false;
      for (int p = 0; p < pairCount; ++p) {
        if (!present[p]) {
          continue;
        }
        for (int w = 0; w < wavs; ++w) {
          if (okAll[w]) {
            sums[p] += stokes[p][0][w];
            anyNormal = true;
          }
        }
        meanSum += sums[p] / presentCount;
      }

      if (!anyNormal || meanSum == 0.) {
        logger.warn("No wavelengths with complete data in every pair, intensities not "
            + "normalized");
      } else {
        for (int p = 0; p < pairCount; ++p) {
          if (!present[p]) {
            continue;
          }
          double factor = sums[p] / meanSum;
          for (int s = 0; s < 2; ++s) {
            for (int w = 0; w < wavs; ++w) {
              stokes[p][s][w] /= factor;
              variance[p][s][w] /= factor * factor;
            }
          }
        }
      }

      intensity = new double[wavs];
      intensityVariance = new double[wavs];
      for (int p = 0; p < pairCount; ++p) {
        if (!present[p]) {
          continue;
        }
        for (int w = 0; w < wavs; ++w) {
          intensity[w] += stokes[p][0][w] / presentCount;
          intensityVariance[w] +=
              variance[p][0][w] / ((double) presentCount * presentCount);
        }
      }
    }

    /**
     * Wavelengths where a pair has at least one valid cycle
     *
     * @param p pattern pair index
     * @return validity of the pair, all false for a missing pair
     */
    boolean[] hasData(int p) {
      boolean[] have = new boolean[wavs];
      for (int w = 0; w < wavs; ++w) {
        have[w] = cycleCount[p][w] > 0;
      }
      return have;
    }
  }
}
