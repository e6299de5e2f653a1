package rss.specpol.stokes;

import org.apache.commons.math3.util.Pair;
import rss.specpol.input.CalibrationSet;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.input.WavelengthGrid;
import rss.specpol.output.FrameType;
import rss.specpol.utils.StokesUtils;

/**
 * Applies the polarimetric calibrations of one configuration, with the calibration curves
 * sampled once on its wavelength grid. Calibration happens in three stages:
 * <ol>
 * <li>the telescope zero-point, rotated into the raw frame of each waveplate position and
 * scaled by the half-wave plate efficiency, is removed from each raw exposure before cycles
 * are combined;</li>
 * <li>after the pattern combination, Q and U are divided by the half-wave plate
 * efficiency;</li>
 * <li>Q and U are rotated from the instrumental frame to the equatorial frame using the
 * half-wave plate PA and the telescope PA. Lamp exposures are only corrected for the half-wave
 * plate PA and stay in the instrumental frame.</li>
 * </ol>
 * Wavelengths where an enabled calibration curve has no value are not calibratable.
 */
public class CalibrationApplier {

  private final CalibrationSet calibrations;
  private final WavelengthGrid grid;
  private final boolean[] okCal;
  private final double[] efficiency;
  private final double[] hwPA;
  private final double[][] telZeropoint;

  /**
   * Sample the enabled calibration curves on a configuration's wavelength grid
   *
   * @param calibrations calibration curves and enabled stages
   * @param grid wavelength grid of the configuration
   */
  public CalibrationApplier(CalibrationSet calibrations, WavelengthGrid grid) {
    this.calibrations = calibrations;
    this.grid = grid;
    int wavs = grid.getLength();
    double[] wavelengths = grid.getWavelengths();

    okCal = new boolean[wavs];
    efficiency = new double[wavs];
    hwPA = new double[wavs];
    telZeropoint = new double[2][wavs];
    for (int w = 0; w < wavs; ++w) {
      okCal[w] = true;
      efficiency[w] = 1.;
    }

    if (calibrations.isHWCalEnabled()) {
      double[] eff = calibrations.getHWCalibration().sample(0, wavelengths);
      double[] pa = calibrations.getHWCalibration().sample(1, wavelengths);
      for (int w = 0; w < wavs; ++w) {
        okCal[w] &= Double.isFinite(eff[w]);
        if (okCal[w]) {
          efficiency[w] = eff[w];
          // table PA is of the plate, the frame correction has the opposite sign
          hwPA[w] = Double.isFinite(pa[w]) ? -pa[w] : 0.;
        }
      }
    }

    if (calibrations.isPolZeropointEnabled()) {
      double[] q = calibrations.getTelZeropoint().sample(0, wavelengths);
      double[] u = calibrations.getTelZeropoint().sample(1, wavelengths);
      for (int w = 0; w < wavs; ++w) {
        okCal[w] &= Double.isFinite(q[w]);
        if (okCal[w]) {
          // table is in percent
          telZeropoint[0][w] = q[w] / 100.;
          telZeropoint[1][w] = Double.isFinite(u[w]) ? u[w] / 100. : 0.;
        }
      }
    }
  }

  public WavelengthGrid getGrid() {
    return grid;
  }

  /**
   * Wavelengths where every enabled calibration is available
   *
   * @return calibratable wavelengths
   */
  public boolean[] getCalibratable() {
    return okCal.clone();
  }

  /**
   * Half-wave plate efficiency, 1 where not calibrated
   *
   * @return efficiency per wavelength
   */
  public double[] getEfficiency() {
    return efficiency.clone();
  }

  /**
   * PA correction for the half-wave plate, degrees; 0 where not calibrated
   *
   * @return PA correction per wavelength
   */
  public double[] getHWPositionAngle() {
    return hwPA.clone();
  }

  /**
   * Telescope zero-point q and u (fractional), 0 where not calibrated
   *
   * @return zero-point rows
   */
  public double[][] getTelZeropoint() {
    return StokesUtils.copyRows(telZeropoint);
  }

  /**
   * Remove the telescope zero-point polarization from a raw exposure. The zero-point is rotated
   * into the raw frame by the waveplate station angle, the half-wave plate PA and the tracker
   * rotation, scaled by the efficiency, and its q component times the intensity is subtracted
   * from the difference row.
   *
   * @param raw raw stokes exposure on this configuration's grid
   * @return corrected exposure, or the same exposure if the zero-point is disabled
   */
  public RawStokesExposure applyZeropoint(RawStokesExposure raw) {
    if (!calibrations.isPolZeropointEnabled()) {
      return raw;
    }
    int wavs = grid.getLength();
    double station = 22.5 * raw.getName().getFirstStation();
    double[] rawPA = new double[wavs];
    for (int w = 0; w < wavs; ++w) {
      rawPA[w] = -(station + hwPA[w] + raw.getTrackRho());
    }
    double[][] rawZeropoint = StokesUtils.rotateNormalized(telZeropoint, rawPA);

    double[][] stokes = raw.getStokes();
    for (int w = 0; w < wavs; ++w) {
      if (okCal[w]) {
        stokes[1][w] -= stokes[0][w] * rawZeropoint[0][w] * efficiency[w];
      }
    }
    return raw.withStokes(stokes);
  }

  /**
   * Frame of the calibrated output of an observation
   *
   * @param reference first exposure of the observation
   * @return equatorial if the half-wave plate calibration is applied to a sky exposure
   */
  public FrameType getFrame(RawStokesExposure reference) {
    if (!calibrations.isHWCalEnabled() || reference.isLampExposure()) {
      return FrameType.INSTRUMENTAL;
    }
    return FrameType.EQUATORIAL;
  }

  /**
   * Apply the efficiency and frame rotation to combined stokes
   *
   * @param combined combined stokes of an observation
   * @param reference first exposure of the observation, for the telescope PA and lamp
   * @return calibrated stokes, or the same stokes if the half-wave plate calibration is off
   */
  public CombinedStokes calibrate(CombinedStokes combined, RawStokesExposure reference) {
    if (!calibrations.isHWCalEnabled()) {
      return combined;
    }
    int wavs = grid.getLength();
    double[][] stokes = combined.getStokes();
    double[][] variance = combined.getVariance();
    boolean[] ok = combined.getValid();
    for (int w = 0; w < wavs; ++w) {
      if (!ok[w]) {
        continue;
      }
      double eff = efficiency[w];
      for (int f = 1; f < 3; ++f) {
        stokes[f][w] /= eff;
      }
      for (int f = 1; f < 4; ++f) {
        variance[f][w] /= eff * eff;
      }
    }

    double telPA = 0.;
    if (getFrame(reference) == FrameType.EQUATORIAL) {
      telPA = ((reference.getTelescopePA() % 180.) + 180.) % 180.;
    }
    double[] pa = new double[wavs];
    for (int w = 0; w < wavs; ++w) {
      pa[w] = hwPA[w] + telPA;
    }
    Pair<double[][], double[][]> rotated = StokesUtils.rotate(stokes, variance, pa, false);
    return combined.withStokes(rotated.getFirst(), rotated.getSecond());
  }
}
