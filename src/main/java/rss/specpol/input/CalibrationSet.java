package rss.specpol.input;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * The already-resolved polarimetric calibrations for a reduction run, and which of them are in
 * use. Calibration stages depend on each other in order: disabling the half-wave plate
 * calibration disables the polarization zero-point, and disabling the polarization zero-point
 * disables the PA zero-point.
 *
 * The half-wave plate table has columns wavelength, efficiency, PA offset (degrees). The
 * telescope zero-point table has columns wavelength, q (%), u (%), error.
 */
public class CalibrationSet {

  public static final String POLCAL_MODEL = "PolCal Model: 20170429";

  public static final String PA_ZEROPOINT_TABLE = "RSSpol_Linear_PAZeropoint.txt";

  private static final Logger logger = Logger.getLogger(CalibrationSet.class);

  private final CalibrationCurve hwCalibration;
  private final CalibrationCurve telZeropoint;
  private final String paZeropointVersion;
  private final double paZeropoint;
  private final String specZeropoint;

  private boolean hwCalEnabled;
  private boolean polZeropointEnabled;
  private boolean paZeropointEnabled;

  /**
   * Create a set of calibrations with every stage enabled where its table is present
   *
   * @param hwCalibration half-wave plate efficiency and PA table (null if unavailable)
   * @param telZeropoint telescope q, u zero-point table (null if unavailable)
   * @param paZeropointVersion version label of the PA zero-point entry (null if unavailable)
   * @param paZeropoint PA zero-point value, degrees
   * @param specZeropoint name of the spectrograph zero-point table (null or empty if none)
   */
  public CalibrationSet(CalibrationCurve hwCalibration, CalibrationCurve telZeropoint,
      String paZeropointVersion, double paZeropoint, String specZeropoint) {
    this.hwCalibration = hwCalibration;
    this.telZeropoint = telZeropoint;
    this.paZeropointVersion = paZeropointVersion;
    this.paZeropoint = paZeropoint;
    this.specZeropoint = specZeropoint;
    setOverrides(false, false, false);
  }

  /**
   * Calibration set with every stage disabled, giving instrumental-frame output
   *
   * @return uncalibrated set
   */
  public static CalibrationSet uncalibrated() {
    return new CalibrationSet(null, null, null, 0., null);
  }

  /**
   * Load the calibration tables named in the configuration
   *
   * @param config Configuration giving the table paths
   * @return calibration set with all available stages enabled
   * @throws IOException if a configured table cannot be read
   */
  public static CalibrationSet fromConfiguration(Configuration config) throws IOException {
    CalibrationCurve hw = null;
    CalibrationCurve tel = null;
    String hwPath = config.getHWCalibrationPath();
    if (hwPath != null && !hwPath.isEmpty()) {
      hw = CalibrationCurve.load(new File(hwPath));
    }
    String telPath = config.getTelZeropointPath();
    if (telPath != null && !telPath.isEmpty()) {
      tel = CalibrationCurve.load(new File(telPath));
    }
    CalibrationSet set = new CalibrationSet(hw, tel, config.getPAZeropointVersion(),
        config.getPAZeropoint(), config.getSpecZeropointPath());
    set.setOverrides(config.isHWCalOverride(), config.isPolZeropointOverride(),
        config.isPAZeropointOverride());
    return set;
  }

  /**
   * Disable calibration stages. Disabling a stage also disables every later stage, and a stage
   * whose table is missing is always disabled.
   *
   * @param hwCalOverride true to skip the half-wave plate calibration (and all others)
   * @param polZeropointOverride true to skip the telescope polarization zero-point
   * @param paZeropointOverride true to skip the PA zero-point
   */
  public void setOverrides(boolean hwCalOverride, boolean polZeropointOverride,
      boolean paZeropointOverride) {
    if (!hwCalOverride && hwCalibration == null) {
      logger.warn("No half-wave plate calibration available, output will be uncalibrated");
    }
    hwCalEnabled = !hwCalOverride && hwCalibration != null;
    polZeropointEnabled = hwCalEnabled && !polZeropointOverride && telZeropoint != null;
    paZeropointEnabled = polZeropointEnabled && !paZeropointOverride
        && paZeropointVersion != null;
  }

  public boolean isHWCalEnabled() {
    return hwCalEnabled;
  }

  public boolean isPolZeropointEnabled() {
    return polZeropointEnabled;
  }

  public boolean isPAZeropointEnabled() {
    return paZeropointEnabled;
  }

  public CalibrationCurve getHWCalibration() {
    return hwCalibration;
  }

  public CalibrationCurve getTelZeropoint() {
    return telZeropoint;
  }

  public double getPAZeropoint() {
    return paZeropoint;
  }

  /**
   * Calibration history for output headers. Every stage is listed; stages not applied are
   * listed as "Uncalibrated" (half-wave plate) or "Null" (zero-points).
   *
   * @return list of human-readable provenance lines
   */
  public List<String> getProvenance() {
    List<String> history = new ArrayList<>();
    history.add(POLCAL_MODEL);
    if (!hwCalEnabled) {
      history.add("HWCal: Uncalibrated");
    } else {
      history.add("HWCal: " + hwCalibration.getName());
    }
    if (!polZeropointEnabled) {
      history.add("PolZeropoint: Null");
    } else {
      history.add("PolZeropoint: " + telZeropoint.getName());
    }
    if (!paZeropointEnabled) {
      history.add("PAZeropoint: Null");
    } else {
      history.add("PAZeropoint: " + PA_ZEROPOINT_TABLE + " " + paZeropointVersion + " "
          + paZeropoint);
    }
    if (specZeropoint != null && !specZeropoint.isEmpty()) {
      history.add("SpecZeropoint: " + new File(specZeropoint).getName());
    }
    return history;
  }
}
