package rss.specpol.stokes;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;
import rss.specpol.input.CalibrationCurve;
import rss.specpol.input.CalibrationSet;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.input.RawStokesExposure.Header;
import rss.specpol.output.FrameType;
import rss.specpol.test.TestUtils;

public class CalibrationApplierTest {

  private static final double[] TABLE_WAVS = {3000., 4000., 5000., 6000.};

  private static CalibrationCurve hwCalibration(double efficiency, double plateAngle) {
    double[] eff = new double[TABLE_WAVS.length];
    double[] pa = new double[TABLE_WAVS.length];
    Arrays.fill(eff, efficiency);
    Arrays.fill(pa, plateAngle);
    return new CalibrationCurve("RSSpol_HW_Calibration_v2.txt", TABLE_WAVS, eff, pa);
  }

  private static CalibrationCurve telZeropoint(double qPercent) {
    double[] q = new double[TABLE_WAVS.length];
    Arrays.fill(q, qPercent);
    return new CalibrationCurve("RSSpol_Linear_TelZeropoint_v3.txt", TABLE_WAVS, q,
        new double[TABLE_WAVS.length]);
  }

  private static RawStokesExposure reference(String lamp, double telpa) {
    double[] norms = new double[TestUtils.WAVS];
    return TestUtils.exposure("vega", "c0", "h04", "01",
        new Header("PG0900", "LINEAR", lamp, telpa, 0.), TestUtils.INTENSITY, norms);
  }

  /**
   * Combined stokes with Q = 9, U = 0 of I = 1000 at every wavelength
   */
  private static CombinedStokes combined() {
    int wavs = TestUtils.WAVS;
    double[][] stokes = new double[3][wavs];
    double[][] variance = new double[4][wavs];
    boolean[] ok = new boolean[wavs];
    for (int w = 0; w < wavs; ++w) {
      stokes[0][w] = 1000.;
      stokes[1][w] = 9.;
      variance[0][w] = 50.;
      variance[1][w] = 1.;
      variance[2][w] = 1.;
      ok[w] = true;
    }
    return new CombinedStokes(stokes, variance, ok);
  }

  @Test
  public void wavelengthsOutsideTableAreNotCalibratable() {
    CalibrationCurve hw = new CalibrationCurve("HW.txt", new double[]{3000., 4000., 4100.},
        new double[]{0.9, 0.9, 0.9}, new double[]{0., 0., 0.});
    CalibrationSet set = new CalibrationSet(hw, null, null, 0., null);
    CalibrationApplier applier = new CalibrationApplier(set, TestUtils.grid());

    boolean[] okCal = applier.getCalibratable();
    assertTrue(okCal[10]);
    assertFalse(okCal[11]);
    assertEquals(0.9, applier.getEfficiency()[10], 1E-12);
    assertEquals(1., applier.getEfficiency()[11], 0.);
  }

  @Test
  public void uncalibratedLeavesStokesAlone() {
    CalibrationApplier applier =
        new CalibrationApplier(CalibrationSet.uncalibrated(), TestUtils.grid());
    RawStokesExposure raw = reference(RawStokesExposure.NO_LAMP, 30.);
    CombinedStokes combined = combined();
    assertSame(raw, applier.applyZeropoint(raw));
    assertSame(combined, applier.calibrate(combined, raw));
    assertEquals(FrameType.INSTRUMENTAL, applier.getFrame(raw));
    for (boolean ok : applier.getCalibratable()) {
      assertTrue(ok);
    }
  }

  @Test
  public void zeropointIsRotatedIntoEachWaveplateFrame() {
    CalibrationSet set = new CalibrationSet(hwCalibration(0.9, 0.), telZeropoint(1.), null,
        0., null);
    CalibrationApplier applier = new CalibrationApplier(set, TestUtils.grid());
    assertEquals(0.01, applier.getTelZeropoint()[0][0], 1E-12);

    RawStokesExposure q = TestUtils.exposure("vega", "c0", "h04", "01", "LINEAR", 0.01);
    RawStokesExposure u = TestUtils.exposure("vega", "c0", "h26", "01", "LINEAR", 0.01);
    // 10 - 1000 * 0.01 * 0.9
    assertEquals(1., applier.applyZeropoint(q).getStokes()[1][3], 1E-9);
    // zero-point q is all u in the frame of station 2
    assertEquals(10., applier.applyZeropoint(u).getStokes()[1][3], 1E-9);
    assertEquals(1000., applier.applyZeropoint(u).getStokes()[0][3], 0.);
  }

  @Test
  public void efficiencyAndTelescopeAngleAreApplied() {
    CalibrationSet set = new CalibrationSet(hwCalibration(0.9, 0.), null, null, 0., null);
    CalibrationApplier applier = new CalibrationApplier(set, TestUtils.grid());

    RawStokesExposure sky = reference(RawStokesExposure.NO_LAMP, 0.);
    assertEquals(FrameType.EQUATORIAL, applier.getFrame(sky));
    CombinedStokes calibrated = applier.calibrate(combined(), sky);
    assertEquals(10., calibrated.getStokes()[1][0], 1E-9);
    assertEquals(0., calibrated.getStokes()[2][0], 1E-9);
    assertEquals(1. / 0.81, calibrated.getVariance()[1][0], 1E-9);
    assertEquals(1000., calibrated.getStokes()[0][0], 0.);

    // telescope PA of 225 is 45 modulo 180, rotating Q into U
    RawStokesExposure rotated = reference(RawStokesExposure.NO_LAMP, 225.);
    calibrated = applier.calibrate(combined(), rotated);
    assertEquals(0., calibrated.getStokes()[1][0], 1E-9);
    assertEquals(10., calibrated.getStokes()[2][0], 1E-9);
  }

  @Test
  public void lampStaysInstrumental() {
    CalibrationSet set = new CalibrationSet(hwCalibration(0.9, -22.5), null, null, 0., null);
    CalibrationApplier applier = new CalibrationApplier(set, TestUtils.grid());
    assertEquals(22.5, applier.getHWPositionAngle()[0], 1E-9);

    RawStokesExposure lamp = reference("ARC", 45.);
    assertEquals(FrameType.INSTRUMENTAL, applier.getFrame(lamp));
    CombinedStokes calibrated = applier.calibrate(combined(), lamp);
    double component = 10. * Math.sqrt(0.5);
    assertEquals(component, calibrated.getStokes()[1][0], 1E-9);
    assertEquals(component, calibrated.getStokes()[2][0], 1E-9);
  }
}
