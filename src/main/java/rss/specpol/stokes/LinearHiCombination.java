package rss.specpol.stokes;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import rss.specpol.utils.NumericUtils;

/**
 * Combination of the redundant LINEAR-HI pattern: four waveplate pairs (04, 15, 26, 37) at
 * 22.5 degree steps of polarization angle. Pair 0 measures Q and pair 2 measures U directly
 * (the primary path); each pair can also be reconstructed from the others (the secondary path).
 *
 * Each pair is derived in normalized (fractional) stokes. Where a pair has a primary and a
 * secondary value the two are averaged with equal weight and their chi-square is recorded.
 * A wavelength is invalidated if any pair's chi-square exceeds an upper outer fence
 * proportional to the third quartile of that pair's chi-square distribution. The fence is never
 * below {@link CycleCombiner#CHI2_LIMIT}, so consistent data with a near-zero chi-square
 * distribution keeps every wavelength.
 */
public class LinearHiCombination extends PatternCombination {

  static final double QQ = 1. / FastMath.sqrt(2.);

  /**
   * Pattern pairs used by the secondary path of each pair
   */
  static final int[][] SECONDARIES = {{1, 3}, {0, 2}, {1, 3}, {0, 2}};

  /**
   * Upper outer fence in units of the third quartile of a chi-square distribution, indexed by
   * degrees of freedom of the redundancy
   */
  static final double[] FENCE_MULTIPLIERS = {6.43, 4.08, 3.31, 2.91, 2.65, 2.49, 2.35, 2.25};

  static final double FENCE_SCALE = 2.2;

  static final int REDUNDANCY_DOF = 2;

  /**
   * Secondary-path coefficients when both secondary pairs of the target are available.
   * Rows are target pairs, columns are the source pairs
   */
  static final RealMatrix BOTH_SECONDARIES = MatrixUtils.createRealMatrix(new double[][]{
      {0., 1., 0., -1.},
      {1., 0., 1., 0.},
      {0., 1., 0., 1.},
      {-1., 0., 1., 0.}}).scalarMultiply(QQ);

  /**
   * Secondary-path coefficients when only the first secondary pair of the target is available
   */
  static final RealMatrix FIRST_SECONDARY_ONLY = MatrixUtils.createRealMatrix(new double[][]{
      {QQ, 1., -QQ, 0.},
      {1., QQ, 0., QQ},
      {-QQ, 1., QQ, 0.},
      {-1., QQ, 0., QQ}}).scalarMultiply(QQ);

  /**
   * Secondary-path coefficients when only the second secondary pair of the target is available
   */
  static final RealMatrix SECOND_SECONDARY_ONLY = MatrixUtils.createRealMatrix(new double[][]{
      {QQ, 0., QQ, -1.},
      {0., QQ, 1., -QQ},
      {QQ, 0., QQ, 1.},
      {0., -QQ, 1., QQ}}).scalarMultiply(QQ);

  private static final int PAIRS = 4;

  /**
   * Which secondary reconstruction of a pair is available
   */
  enum SecondaryPath {
    NONE(null),
    BOTH(BOTH_SECONDARIES),
    FIRST_ONLY(FIRST_SECONDARY_ONLY),
    SECOND_ONLY(SECOND_SECONDARY_ONLY);

    private final RealMatrix coefficients;

    SecondaryPath(RealMatrix coefficients) {
      this.coefficients = coefficients;
    }

    /**
     * Coefficients of the source pairs in the reconstruction of a target pair
     *
     * @param target pattern pair index
     * @return coefficient per source pair, all zero if there is no secondary path
     */
    double[] getCoefficients(int target) {
      if (coefficients == null) {
        return new double[PAIRS];
      }
      return coefficients.getRow(target);
    }
  }

  /**
   * Select the secondary path of a pair from the pairs available at a wavelength. With one of
   * its two secondary pairs missing, a pair can still be reconstructed if the remaining
   * secondary pair and both secondaries of the missing one are available.
   *
   * @param target pattern pair index
   * @param have availability of each pattern pair
   * @return secondary path that can be used
   */
  static SecondaryPath selectSecondary(int target, boolean[] have) {
    int first = SECONDARIES[target][0];
    int second = SECONDARIES[target][1];
    if (haveBothSecondaries(target, have)) {
      return SecondaryPath.BOTH;
    }
    if (have[first] && haveBothSecondaries(second, have)) {
      return SecondaryPath.FIRST_ONLY;
    }
    if (have[second] && haveBothSecondaries(first, have)) {
      return SecondaryPath.SECOND_ONLY;
    }
    return SecondaryPath.NONE;
  }

  private static boolean haveBothSecondaries(int target, boolean[] have) {
    return have[SECONDARIES[target][0]] && have[SECONDARIES[target][1]];
  }

  /**
   * Usable if Q (pair 0) and U (pair 2) each have a primary or secondary path
   */
  @Override
  boolean isUsable(boolean[] present) {
    for (int target : new int[]{0, 2}) {
      if (!present[target] && selectSecondary(target, present) == SecondaryPath.NONE) {
        return false;
      }
    }
    return true;
  }

  @Override
  CombinedStokes backend(NormalizedPairs pairs) {
    int wavs = pairs.wavs;

    boolean[][] have = new boolean[PAIRS][];
    double[][] primary = new double[PAIRS][];
    double[][] primaryVariance = new double[PAIRS][];
    for (int p = 0; p < PAIRS; ++p) {
      have[p] = pairs.hasData(p);
      if (pairs.present[p]) {
        primary[p] = pairs.pairs[p].getNormStokes();
        primaryVariance[p] = pairs.pairs[p].getNormVariance();
      } else {
        primary[p] = new double[wavs];
        primaryVariance[p] = new double[wavs];
      }
    }

    boolean[] ok = new boolean[wavs];
    for (int w = 0; w < wavs; ++w) {
      boolean[] okPair = new boolean[PAIRS];
      for (int p = 0; p < PAIRS; ++p) {
        okPair[p] = pairs.okCal[w] && have[p][w];
      }
      ok[w] = (okPair[0] && okPair[2]) || (okPair[1] && okPair[3]);
    }

    double[][] combined = new double[PAIRS][wavs];
    double[][] combinedVariance = new double[PAIRS][wavs];
    double[] covarianceQU = new double[wavs];
    double[][] chi2 = new double[PAIRS][wavs];
    boolean[][] bothPaths = new boolean[PAIRS][wavs];

    for (int w = 0; w < wavs; ++w) {
      boolean[] haveHere = new boolean[PAIRS];
      double[] pri = new double[PAIRS];
      double[] priVar = new double[PAIRS];
      for (int p = 0; p < PAIRS; ++p) {
        haveHere[p] = have[p][w];
        pri[p] = primary[p][w];
        priVar[p] = primaryVariance[p][w];
      }

      double[][] cof = new double[PAIRS][];
      for (int t = 0; t < PAIRS; ++t) {
        SecondaryPath path = selectSecondary(t, haveHere);
        double[] secCof = path.getCoefficients(t);
        double sec = 0.;
        double secVar = 0.;
        for (int s = 0; s < PAIRS; ++s) {
          sec += secCof[s] * pri[s];
          secVar += secCof[s] * secCof[s] * priVar[s];
        }
        boolean haveSecondary = path != SecondaryPath.NONE;
        cof[t] = new double[PAIRS];
        if (haveHere[t] && haveSecondary) {
          bothPaths[t][w] = true;
          for (int s = 0; s < PAIRS; ++s) {
            cof[t][s] = 0.5 * secCof[s];
          }
          cof[t][t] += 0.5;
          double covPriSec = secCof[t] * priVar[t];
          double denominator = priVar[t] + secVar - 2. * covPriSec;
          if (denominator > 0.) {
            chi2[t][w] = (pri[t] - sec) * (pri[t] - sec) / denominator;
          }
        } else if (haveHere[t]) {
          cof[t][t] = 1.;
        } else if (haveSecondary) {
          cof[t] = secCof;
        }

        for (int s = 0; s < PAIRS; ++s) {
          combined[t][w] += cof[t][s] * pri[s];
          combinedVariance[t][w] += cof[t][s] * cof[t][s] * priVar[s];
        }
      }
      for (int s = 0; s < PAIRS; ++s) {
        covarianceQU[w] += cof[0][s] * cof[2][s] * priVar[s];
      }
    }

    // cull wavelengths where primary and secondary disagree
    double[] fence = new double[PAIRS];
    for (int p = 0; p < PAIRS; ++p) {
      double q3 = NumericUtils.maskedPercentile(chi2[p], pairs.okAll, 75.);
      fence[p] = FastMath.max(FENCE_SCALE * FENCE_MULTIPLIERS[REDUNDANCY_DOF] * q3,
          CycleCombiner.CHI2_LIMIT);
    }
    int culls = 0;
    for (int w = 0; w < wavs; ++w) {
      if (!ok[w]) {
        continue;
      }
      for (int p = 0; p < PAIRS; ++p) {
        if (chi2[p][w] > fence[p]) {
          ok[w] = false;
          ++culls;
          break;
        }
      }
    }

    boolean haveRedundancyChi = false;
    double[] pairChi2 = new double[PAIRS];
    for (int p = 0; p < PAIRS; ++p) {
      double sum = 0.;
      int count = 0;
      boolean any = false;
      for (int w = 0; w < wavs; ++w) {
        any |= bothPaths[p][w];
        if (ok[w]) {
          sum += chi2[p][w];
          if (bothPaths[p][w]) {
            ++count;
          }
        }
      }
      haveRedundancyChi |= any;
      if (any && count > 0) {
        pairChi2[p] = sum / count;
      }
    }

    double[][] stokes = new double[3][];
    double[][] variance = new double[4][];
    stokes[0] = pairs.intensity.clone();
    variance[0] = pairs.intensityVariance.clone();
    stokes[1] = new double[wavs];
    stokes[2] = new double[wavs];
    variance[1] = new double[wavs];
    variance[2] = new double[wavs];
    variance[3] = new double[wavs];
    for (int w = 0; w < wavs; ++w) {
      if (!ok[w]) {
        continue;
      }
      double i = pairs.intensity[w];
      stokes[1][w] = combined[0][w] * i;
      stokes[2][w] = combined[2][w] * i;
      variance[1][w] = combinedVariance[0][w] * i * i;
      variance[2][w] = combinedVariance[2][w] * i * i;
      variance[3][w] = covarianceQU[w] * i * i;
    }

    return new CombinedStokes(stokes, variance, ok, pairChi2, haveRedundancyChi, culls);
  }
}
