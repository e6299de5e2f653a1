package rss.specpol.stokes;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import org.junit.Test;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.test.TestUtils;

public class LinearCombinationTest {

  private static WaveplatePair pair(String waveplate, double intensity, double norm) {
    double[] norms = new double[TestUtils.WAVS];
    Arrays.fill(norms, norm);
    RawStokesExposure raw = TestUtils.exposure("vega", "c0", waveplate, "01",
        TestUtils.header("LINEAR"), intensity, norms);
    return CycleCombiner.combine(Arrays.asList(raw));
  }

  private static boolean[] allTrue() {
    boolean[] ok = new boolean[TestUtils.WAVS];
    Arrays.fill(ok, true);
    return ok;
  }

  @Test
  public void qAndUComeFromTheirPairs() throws ObservationSkippedException {
    WaveplatePair[] pairs = {pair("h04", 1000., 0.01), pair("h26", 1000., 0.02)};
    CombinedStokes combined = new LinearCombination().combine(pairs, allTrue());

    double[][] stokes = combined.getStokes();
    double[][] variance = combined.getVariance();
    for (int w = 0; w < TestUtils.WAVS; ++w) {
      assertEquals(1000., stokes[0][w], 1E-9);
      assertEquals(10., stokes[1][w], 1E-9);
      assertEquals(20., stokes[2][w], 1E-9);
      assertEquals(TestUtils.SUM_VARIANCE / 2., variance[0][w], 1E-9);
      assertEquals(TestUtils.DIFFERENCE_VARIANCE, variance[1][w], 1E-9);
      assertEquals(TestUtils.DIFFERENCE_VARIANCE, variance[2][w], 1E-9);
      assertEquals(0., variance[3][w], 0.);
    }
    assertFalse(combined.hasRedundancyChi());
    assertNull(combined.getPairChi2());
    for (boolean ok : combined.getValid()) {
      assertTrue(ok);
    }
  }

  @Test
  public void throughputDriftIsNormalizedOut() throws ObservationSkippedException {
    WaveplatePair[] pairs = {pair("h04", 1000., 0.01), pair("h26", 1100., 0.01)};
    CombinedStokes combined = new LinearCombination().combine(pairs, allTrue());

    double[][] stokes = combined.getStokes();
    for (int w = 0; w < TestUtils.WAVS; ++w) {
      assertEquals(1050., stokes[0][w], 1E-9);
      assertEquals(10.5, stokes[1][w], 1E-9);
      assertEquals(10.5, stokes[2][w], 1E-9);
    }
  }

  @Test
  public void uncalibratableWavelengthsAreInvalid() throws ObservationSkippedException {
    WaveplatePair[] pairs = {pair("h04", 1000., 0.01), pair("h26", 1000., 0.02)};
    boolean[] okCal = allTrue();
    okCal[0] = false;
    okCal[TestUtils.WAVS - 1] = false;
    CombinedStokes combined = new LinearCombination().combine(pairs, okCal);

    boolean[] ok = combined.getValid();
    assertFalse(ok[0]);
    assertTrue(ok[1]);
    assertFalse(ok[TestUtils.WAVS - 1]);
    assertEquals(0., combined.getStokes()[1][0], 0.);
    boolean[][] bpm = combined.getBadPixel();
    assertArrayEquals(bpm[0], bpm[2]);
    assertTrue(bpm[1][0]);
  }

  @Test
  public void singlePairIsSkipped() {
    WaveplatePair[] pairs = {pair("h04", 1000., 0.01), null};
    try {
      new LinearCombination().combine(pairs, allTrue());
      fail();
    } catch (ObservationSkippedException e) {
      assertEquals("Only 1 pair, skipping observation", e.getMessage());
    }
  }
}
