package rss.specpol.stokes;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import org.apache.commons.math3.util.FastMath;
import org.junit.Test;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.stokes.LinearHiCombination.SecondaryPath;
import rss.specpol.test.TestUtils;

public class LinearHiCombinationTest {

  private static final double Q = 0.01;
  private static final double U = 0.02;
  private static final double ROOT_HALF = FastMath.sqrt(0.5);
  private static final String[] WAVEPLATES = {"h04", "h15", "h26", "h37"};

  /**
   * Fractional polarization measured by each pattern pair for the source (Q, U)
   */
  private static double[] measured() {
    return new double[]{Q, (Q + U) * ROOT_HALF, U, (U - Q) * ROOT_HALF};
  }

  private static WaveplatePair pair(int p, double norm, double normAtFive) {
    double[] norms = new double[TestUtils.WAVS];
    Arrays.fill(norms, norm);
    norms[5] = normAtFive;
    return pair(p, norms);
  }

  private static WaveplatePair pair(int p, double[] norms) {
    RawStokesExposure raw = TestUtils.exposure("vega", "c0", WAVEPLATES[p], "01",
        TestUtils.header("LINEAR-HI"), TestUtils.INTENSITY, norms);
    return CycleCombiner.combine(Arrays.asList(raw));
  }

  private static WaveplatePair[] pairs(boolean... present) {
    double[] norms = measured();
    WaveplatePair[] pairs = new WaveplatePair[4];
    for (int p = 0; p < 4; ++p) {
      if (present[p]) {
        pairs[p] = pair(p, norms[p], norms[p]);
      }
    }
    return pairs;
  }

  private static boolean[] allTrue() {
    boolean[] ok = new boolean[TestUtils.WAVS];
    Arrays.fill(ok, true);
    return ok;
  }

  private static void assertQU(CombinedStokes combined, double q, double u) {
    double[][] stokes = combined.getStokes();
    boolean[] ok = combined.getValid();
    for (int w = 0; w < TestUtils.WAVS; ++w) {
      assertTrue(ok[w]);
      assertEquals(TestUtils.INTENSITY, stokes[0][w], 1E-9);
      assertEquals(q * TestUtils.INTENSITY, stokes[1][w], 1E-9);
      assertEquals(u * TestUtils.INTENSITY, stokes[2][w], 1E-9);
    }
  }

  @Test
  public void consistentPairsAverageToSource() throws ObservationSkippedException {
    CombinedStokes combined =
        new LinearHiCombination().combine(pairs(true, true, true, true), allTrue());
    assertQU(combined, Q, U);
    assertTrue(combined.hasRedundancyChi());
    assertEquals(0, combined.getRedundancyCulls());
    for (double chi2 : combined.getPairChi2()) {
      assertEquals(0., chi2, 1E-12);
    }
    // each of Q and U averages a primary and a secondary of equal weight
    double nvar = TestUtils.DIFFERENCE_VARIANCE / (TestUtils.INTENSITY * TestUtils.INTENSITY);
    double expected = 0.5 * nvar * TestUtils.INTENSITY * TestUtils.INTENSITY;
    double[][] variance = combined.getVariance();
    for (int w = 0; w < TestUtils.WAVS; ++w) {
      assertEquals(expected, variance[1][w], 1E-9);
      assertEquals(expected, variance[2][w], 1E-9);
      assertEquals(0., variance[3][w], 1E-9);
    }
  }

  @Test
  public void primaryAndSecondaryAreAveraged() throws ObservationSkippedException {
    double delta = 0.001;
    double[] norms = measured();
    WaveplatePair[] pairs = new WaveplatePair[4];
    for (int p = 0; p < 4; ++p) {
      double norm = p == 1 ? norms[p] + delta : norms[p];
      pairs[p] = pair(p, norm, norm);
    }
    CombinedStokes combined = new LinearHiCombination().combine(pairs, allTrue());

    // pair 15 enters the secondary of Q and U with weight 1/sqrt(2)
    assertQU(combined, Q + 0.5 * ROOT_HALF * delta, U + 0.5 * ROOT_HALF * delta);
    assertEquals(0, combined.getRedundancyCulls());
    double[] pairChi2 = combined.getPairChi2();
    // (delta / sqrt(2))^2 / 2e-4 and delta^2 / 2e-4
    assertEquals(2.5E-3, pairChi2[0], 1E-9);
    assertEquals(5E-3, pairChi2[1], 1E-9);
    assertEquals(2.5E-3, pairChi2[2], 1E-9);
    assertEquals(0., pairChi2[3], 1E-9);
  }

  @Test
  public void inconsistentWavelengthIsCulled() throws ObservationSkippedException {
    double[] norms = measured();
    WaveplatePair[] pairs = new WaveplatePair[4];
    for (int p = 0; p < 4; ++p) {
      pairs[p] = pair(p, norms[p], norms[p]);
    }
    // scatter of up to 0.002 on pair 15 gives a chi-square background up to 0.02,
    // the outlier of 0.1 at wavelength 5 gives 50
    double[] scattered = new double[TestUtils.WAVS];
    for (int w = 0; w < TestUtils.WAVS; ++w) {
      scattered[w] = norms[1] + 0.001 * ((w % 3) - 1) * (w % 2 == 0 ? 1 : 2);
    }
    scattered[5] = norms[1] + 0.1;
    pairs[1] = pair(1, scattered);
    CombinedStokes combined = new LinearHiCombination().combine(pairs, allTrue());

    boolean[] ok = combined.getValid();
    assertFalse(ok[5]);
    assertTrue(ok[4]);
    assertTrue(ok[6]);
    assertEquals(1, combined.getRedundancyCulls());
    assertEquals(0., combined.getStokes()[1][5], 0.);
    assertTrue(combined.getBadPixel()[2][5]);
  }

  @Test
  public void consistentVaryingPolarizationKeepsEveryWavelength()
      throws ObservationSkippedException {
    double[][] norms = new double[4][TestUtils.WAVS];
    double[] q = new double[TestUtils.WAVS];
    double[] u = new double[TestUtils.WAVS];
    for (int w = 0; w < TestUtils.WAVS; ++w) {
      q[w] = 0.01 + 0.0007 * w;
      u[w] = 0.02 - 0.0003 * w;
      norms[0][w] = q[w];
      norms[1][w] = (q[w] + u[w]) * ROOT_HALF;
      norms[2][w] = u[w];
      norms[3][w] = (u[w] - q[w]) * ROOT_HALF;
    }
    WaveplatePair[] pairs = new WaveplatePair[4];
    for (int p = 0; p < 4; ++p) {
      pairs[p] = pair(p, norms[p]);
    }
    CombinedStokes combined = new LinearHiCombination().combine(pairs, allTrue());

    assertEquals(0, combined.getRedundancyCulls());
    double[][] stokes = combined.getStokes();
    for (int w = 0; w < TestUtils.WAVS; ++w) {
      assertTrue(combined.getValid()[w]);
      assertEquals(q[w] * TestUtils.INTENSITY, stokes[1][w], 1E-9);
      assertEquals(u[w] * TestUtils.INTENSITY, stokes[2][w], 1E-9);
    }
  }

  @Test
  public void insignificantDisagreementIsKept() throws ObservationSkippedException {
    double[] norms = measured();
    WaveplatePair[] pairs = new WaveplatePair[4];
    for (int p = 0; p < 4; ++p) {
      // 1e-5 is a thousandth of the normalized sigma
      pairs[p] = p == 1 ? pair(p, norms[p], norms[p] + 1E-5) : pair(p, norms[p], norms[p]);
    }
    CombinedStokes combined = new LinearHiCombination().combine(pairs, allTrue());
    assertEquals(0, combined.getRedundancyCulls());
    assertTrue(combined.getValid()[5]);
  }

  @Test
  public void directPairsOnly() throws ObservationSkippedException {
    CombinedStokes combined =
        new LinearHiCombination().combine(pairs(true, false, true, false), allTrue());
    assertQU(combined, Q, U);
    assertFalse(combined.hasRedundancyChi());
  }

  @Test
  public void diagonalPairsOnly() throws ObservationSkippedException {
    CombinedStokes combined =
        new LinearHiCombination().combine(pairs(false, true, false, true), allTrue());
    assertQU(combined, Q, U);
  }

  @Test
  public void threePairsReconstructTheFourth() throws ObservationSkippedException {
    CombinedStokes combined =
        new LinearHiCombination().combine(pairs(true, true, true, false), allTrue());
    assertQU(combined, Q, U);
    assertTrue(combined.hasRedundancyChi());
  }

  @Test
  public void unusableSubsetIsSkipped() {
    try {
      new LinearHiCombination().combine(pairs(true, false, false, true), allTrue());
      fail();
    } catch (ObservationSkippedException e) {
      assertEquals("Pattern not usable, skipping observation", e.getMessage());
    }
  }

  @Test
  public void selectSecondary() {
    boolean[] all = {true, true, true, true};
    for (int t = 0; t < 4; ++t) {
      assertEquals(SecondaryPath.BOTH, LinearHiCombination.selectSecondary(t, all));
    }
    boolean[] noLast = {true, true, true, false};
    assertEquals(SecondaryPath.FIRST_ONLY, LinearHiCombination.selectSecondary(0, noLast));
    assertEquals(SecondaryPath.BOTH, LinearHiCombination.selectSecondary(3, noLast));
    boolean[] noSecond = {true, false, true, true};
    assertEquals(SecondaryPath.SECOND_ONLY, LinearHiCombination.selectSecondary(0, noSecond));
    boolean[] direct = {true, false, true, false};
    assertEquals(SecondaryPath.NONE, LinearHiCombination.selectSecondary(0, direct));
    assertEquals(SecondaryPath.BOTH, LinearHiCombination.selectSecondary(1, direct));
  }

  @Test
  public void usableSubsets() {
    LinearHiCombination combination = new LinearHiCombination();
    assertTrue(combination.isUsable(new boolean[]{true, false, true, false}));
    assertTrue(combination.isUsable(new boolean[]{false, true, false, true}));
    assertTrue(combination.isUsable(new boolean[]{false, true, true, true}));
    assertFalse(combination.isUsable(new boolean[]{true, true, false, false}));
    assertFalse(combination.isUsable(new boolean[]{true, false, false, true}));
  }
}
